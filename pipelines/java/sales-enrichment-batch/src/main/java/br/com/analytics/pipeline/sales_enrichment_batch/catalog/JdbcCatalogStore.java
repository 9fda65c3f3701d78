package br.com.analytics.pipeline.sales_enrichment_batch.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Relational catalog of tables, columns and partitions, kept up to date from
 * the registrar's events. Every write replaces the previous entry, so
 * registering the same table or partition again is harmless.
 */
@Component
public class JdbcCatalogStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCatalogStore.class);

    private static final String SQL_DELETE_COLUMNS =
            "DELETE FROM catalog_column WHERE database_name = ? AND table_name = ?";

    private static final String SQL_DELETE_TABLE =
            "DELETE FROM catalog_table WHERE database_name = ? AND table_name = ?";

    private static final String SQL_INSERT_TABLE =
            "INSERT INTO catalog_table (database_name, table_name, location, storage_format, compression, " +
                    "location_template, ddl, declared_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SQL_INSERT_COLUMN =
            "INSERT INTO catalog_column (database_name, table_name, column_position, column_name, column_type, " +
                    "partition_key, projection_range) VALUES (?, ?, ?, ?, ?, ?, ?)";

    private static final String SQL_DELETE_PARTITION =
            "DELETE FROM catalog_partition WHERE database_name = ? AND table_name = ? AND partition_name = ?";

    private static final String SQL_INSERT_PARTITION =
            "INSERT INTO catalog_partition (database_name, table_name, partition_name, location, record_count, " +
                    "registered_at) VALUES (?, ?, ?, ?, ?, ?)";

    private static final String SQL_SELECT_TABLE =
            "SELECT location, storage_format, compression FROM catalog_table " +
                    "WHERE database_name = ? AND table_name = ?";

    private static final String SQL_SELECT_COLUMNS =
            "SELECT column_name, column_type, partition_key, projection_range FROM catalog_column " +
                    "WHERE database_name = ? AND table_name = ? ORDER BY column_position";

    private static final String SQL_SELECT_PARTITIONS =
            "SELECT partition_name, location, record_count, registered_at FROM catalog_partition " +
                    "WHERE database_name = ? AND table_name = ? ORDER BY partition_name";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcCatalogStore(@Qualifier("catalogDataSource") DataSource dataSource,
                            @Qualifier("transactionManager") PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @EventListener
    public void onTableDeclared(TableDeclaredEvent event) {
        TableDefinition table = event.table();
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update(SQL_DELETE_COLUMNS, table.database(), table.name());
            jdbcTemplate.update(SQL_DELETE_TABLE, table.database(), table.name());
            jdbcTemplate.update(SQL_INSERT_TABLE,
                    table.database(),
                    table.name(),
                    table.location(),
                    table.storageFormat(),
                    table.compression(),
                    table.isPartitioned() ? table.locationTemplate() : null,
                    event.ddl(),
                    Timestamp.from(Instant.now()));

            List<Object[]> columns = new ArrayList<>();
            int position = 0;
            for (ColumnDefinition column : table.columns()) {
                columns.add(new Object[]{table.database(), table.name(), position++,
                        column.name(), column.type(), false, null});
            }
            for (PartitionKeyDefinition key : table.partitionKeys()) {
                columns.add(new Object[]{table.database(), table.name(), position++,
                        key.name(), key.type(), true, key.range()});
            }
            jdbcTemplate.batchUpdate(SQL_INSERT_COLUMN, columns);
        });
        log.info("Catalog table {}.{} stored with {} columns and {} partition keys",
                table.database(), table.name(), table.columns().size(), table.partitionKeys().size());
    }

    @EventListener
    public void onPartitionRegistered(PartitionRegisteredEvent event) {
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update(SQL_DELETE_PARTITION, event.database(), event.table(), event.partitionName());
            jdbcTemplate.update(SQL_INSERT_PARTITION,
                    event.database(),
                    event.table(),
                    event.partitionName(),
                    event.location(),
                    event.recordCount(),
                    Timestamp.from(Instant.now()));
        });
        log.debug("Catalog partition {}.{} {} stored", event.database(), event.table(), event.partitionName());
    }

    public Optional<TableDefinition> findTable(String database, String table) {
        List<String[]> rows = jdbcTemplate.query(SQL_SELECT_TABLE,
                (rs, rowNum) -> new String[]{rs.getString("location"), rs.getString("storage_format"),
                        rs.getString("compression")},
                database, table);
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        List<ColumnDefinition> columns = new ArrayList<>();
        List<PartitionKeyDefinition> partitionKeys = new ArrayList<>();
        jdbcTemplate.query(SQL_SELECT_COLUMNS, rs -> {
            String name = rs.getString("column_name");
            String type = rs.getString("column_type");
            if (rs.getBoolean("partition_key")) {
                partitionKeys.add(PartitionKeyDefinition.parse(name, type, rs.getString("projection_range")));
            } else {
                columns.add(new ColumnDefinition(name, type));
            }
        }, database, table);

        String[] row = rows.get(0);
        return Optional.of(new TableDefinition(database, table, row[0], row[1], row[2], columns, partitionKeys));
    }

    public List<CatalogPartition> partitions(String database, String table) {
        return jdbcTemplate.query(SQL_SELECT_PARTITIONS,
                (rs, rowNum) -> new CatalogPartition(
                        database,
                        table,
                        rs.getString("partition_name"),
                        rs.getString("location"),
                        rs.getLong("record_count"),
                        rs.getTimestamp("registered_at").toInstant()),
                database, table);
    }
}
