package br.com.analytics.pipeline.sales_enrichment_batch.config;

import br.com.analytics.pipeline.sales_enrichment_batch.catalog.CatalogRegistrar;
import br.com.analytics.pipeline.sales_enrichment_batch.listener.PipelineRunListener;
import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.TransactionRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.processor.EnrichmentProcessor;
import br.com.analytics.pipeline.sales_enrichment_batch.reader.SourceReaders;
import br.com.analytics.pipeline.sales_enrichment_batch.run.PipelineRunContext;
import br.com.analytics.pipeline.sales_enrichment_batch.tasklet.CatalogRegistrationTasklet;
import br.com.analytics.pipeline.sales_enrichment_batch.tasklet.LoadCustomersTasklet;
import br.com.analytics.pipeline.sales_enrichment_batch.tasklet.PartitionFlushTasklet;
import br.com.analytics.pipeline.sales_enrichment_batch.tasklet.SummaryWriteTasklet;
import br.com.analytics.pipeline.sales_enrichment_batch.writer.EnrichedRecordItemWriter;
import br.com.analytics.pipeline.sales_enrichment_batch.writer.ParquetPartitionWriter;
import br.com.analytics.pipeline.sales_enrichment_batch.writer.SummaryParquetWriter;
import com.google.gson.Gson;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.configuration.annotation.EnableJdbcJobRepository;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.ItemProcessor;
import org.springframework.batch.infrastructure.item.ItemStreamReader;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * The sales enrichment job: load customers, enrich and partition transactions,
 * write partitions, write the summary, register in the catalog.
 */
@Configuration
@EnableBatchProcessing
@EnableJdbcJobRepository(dataSourceRef = "batchDataSource", transactionManagerRef = "batchTransactionManager")
@EnableConfigurationProperties(PipelineProperties.class)
public class SalesEnrichmentBatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final PipelineProperties properties;
    private final PipelineRunContext runContext;
    private final ApplicationEventPublisher eventPublisher;

    public SalesEnrichmentBatchConfig(JobRepository jobRepository,
                                      @Qualifier("transactionManager") PlatformTransactionManager transactionManager,
                                      PipelineProperties properties,
                                      PipelineRunContext runContext,
                                      ApplicationEventPublisher eventPublisher) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
        this.runContext = runContext;
        this.eventPublisher = eventPublisher;
    }

    @Bean
    public Gson ndjsonGson() {
        return SourceReaders.ndjsonGson();
    }

    @Bean
    public ItemStreamReader<TransactionRecord> transactionReader() {
        return SourceReaders.transactions(properties.input().transactionsPath(), runContext.errors());
    }

    @Bean
    public ItemProcessor<TransactionRecord, EnrichedRecord> enrichmentProcessor() {
        return new EnrichmentProcessor(runContext);
    }

    @Bean
    public ItemWriter<EnrichedRecord> enrichedRecordWriter() {
        return new EnrichedRecordItemWriter(runContext);
    }

    @Bean
    public ParquetPartitionWriter parquetPartitionWriter() {
        return new ParquetPartitionWriter(properties.output().enrichedPath(), properties.output().writeMode());
    }

    @Bean
    public SummaryParquetWriter summaryParquetWriter() {
        return new SummaryParquetWriter(properties.output().summaryPath());
    }

    @Bean
    public CatalogRegistrar catalogRegistrar() {
        return new CatalogRegistrar(eventPublisher);
    }

    @Bean
    public Step loadCustomersStep() {
        return new StepBuilder("loadCustomersStep", jobRepository)
                .tasklet(new LoadCustomersTasklet(properties.input().customersPath(), ndjsonGson(), runContext),
                        transactionManager)
                .build();
    }

    @Bean
    public Step enrichTransactionsStep() {
        return new StepBuilder("enrichTransactionsStep", jobRepository)
                .<TransactionRecord, EnrichedRecord>chunk(properties.chunkSize())
                .reader(transactionReader())
                .processor(enrichmentProcessor())
                .writer(enrichedRecordWriter())
                .build();
    }

    @Bean
    public Step writePartitionsStep() {
        return new StepBuilder("writePartitionsStep", jobRepository)
                .tasklet(new PartitionFlushTasklet(parquetPartitionWriter(), runContext, properties.writer().threads()),
                        transactionManager)
                .build();
    }

    @Bean
    public Step writeSummaryStep() {
        return new StepBuilder("writeSummaryStep", jobRepository)
                .tasklet(new SummaryWriteTasklet(summaryParquetWriter(), runContext), transactionManager)
                .build();
    }

    @Bean
    public Step registerCatalogStep() {
        return new StepBuilder("registerCatalogStep", jobRepository)
                .tasklet(new CatalogRegistrationTasklet(catalogRegistrar(), runContext, properties,
                        parquetPartitionWriter()), transactionManager)
                .build();
    }

    @Bean
    public Job salesEnrichmentJob() {
        return new JobBuilder("salesEnrichmentJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .listener(new PipelineRunListener(runContext))
                .start(loadCustomersStep())
                .next(enrichTransactionsStep())
                .next(writePartitionsStep())
                .next(writeSummaryStep())
                .next(registerCatalogStep())
                .build();
    }

}
