package br.com.analytics.pipeline.sales_enrichment_batch.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

@Configuration
public class DataSourceConfig {

    @Autowired
    private Environment env;

    @Bean(name = "catalogDataSource")
    public DataSource catalogDataSource() {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("catalog");
        dataSource.setDriverClassName(env.getProperty("catalog.datasource.driver-class-name", "org.h2.Driver"));
        dataSource.setJdbcUrl(env.getProperty("catalog.datasource.url", "jdbc:h2:file:./data/catalog/catalog"));
        dataSource.setUsername(env.getProperty("catalog.datasource.username", "sa"));
        dataSource.setPassword(env.getProperty("catalog.datasource.password", ""));
        return dataSource;
    }

    @Bean(name = "batchDataSource")
    public DataSource batchDataSource() {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("batch");
        dataSource.setDriverClassName(env.getProperty("batch.datasource.driver-class-name", "org.h2.Driver"));
        dataSource.setJdbcUrl(env.getProperty("batch.datasource.url", "jdbc:h2:mem:batch;DB_CLOSE_DELAY=-1"));
        dataSource.setUsername(env.getProperty("batch.datasource.username", "sa"));
        dataSource.setPassword(env.getProperty("batch.datasource.password", ""));
        return dataSource;
    }

    @Bean(name = "transactionManager")
    public DataSourceTransactionManager transactionManager(@Qualifier("catalogDataSource") DataSource catalogDataSource) {
        return new DataSourceTransactionManager(catalogDataSource);
    }

    @Bean(name = "batchTransactionManager")
    public DataSourceTransactionManager batchTransactionManager(@Qualifier("batchDataSource") DataSource batchDataSource) {
        return new DataSourceTransactionManager(batchDataSource);
    }

    @Bean
    public DataSourceInitializer catalogSchemaInitializer(@Qualifier("catalogDataSource") DataSource catalogDataSource) {
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(catalogDataSource);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource("catalog-schema.sql")));
        return initializer;
    }

    /**
     * Job repository tables. A file-based repository already has them after the
     * first start, so existing tables are not an error.
     */
    @Bean
    public DataSourceInitializer batchSchemaInitializer(@Qualifier("batchDataSource") DataSource batchDataSource) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(
                new ClassPathResource(env.getProperty("batch.datasource.schema", "org/springframework/batch/core/schema-h2.sql")));
        populator.setContinueOnError(true);
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(batchDataSource);
        initializer.setDatabasePopulator(populator);
        return initializer;
    }

}
