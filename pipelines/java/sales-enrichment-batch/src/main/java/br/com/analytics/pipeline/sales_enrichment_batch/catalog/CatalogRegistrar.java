package br.com.analytics.pipeline.sales_enrichment_batch.catalog;

import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionWriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Announces tables and written partitions to whoever keeps the catalog. The
 * pipeline only emits; it does not wait for or depend on the catalog's answer.
 */
public class CatalogRegistrar {

    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final ApplicationEventPublisher publisher;

    public CatalogRegistrar(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void declareTable(TableDefinition table) {
        publisher.publishEvent(new TableDeclaredEvent(table, TableDdlRenderer.render(table)));
        log.info("Declared table {}.{} at {}", table.database(), table.name(), table.location());
    }

    /**
     * @return false when the partition was not written and so was not announced
     */
    public boolean registerPartition(TableDefinition table, PartitionWriteResult result) {
        if (!result.isWritten()) {
            log.warn("Not registering partition {} of {}: write failed ({})", result.key(), table.name(), result.error());
            return false;
        }
        publisher.publishEvent(new PartitionRegisteredEvent(
                table.database(),
                table.name(),
                result.key().path(),
                result.location().toAbsolutePath().normalize().toString(),
                result.recordCount()));
        log.debug("Registered partition {} of {}", result.key(), table.name());
        return true;
    }
}
