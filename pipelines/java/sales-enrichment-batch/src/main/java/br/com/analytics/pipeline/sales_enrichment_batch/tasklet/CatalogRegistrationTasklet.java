package br.com.analytics.pipeline.sales_enrichment_batch.tasklet;

import br.com.analytics.pipeline.sales_enrichment_batch.catalog.CatalogRegistrar;
import br.com.analytics.pipeline.sales_enrichment_batch.catalog.SalesTables;
import br.com.analytics.pipeline.sales_enrichment_batch.catalog.TableDefinition;
import br.com.analytics.pipeline.sales_enrichment_batch.config.PipelineProperties;
import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionKey;
import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionWriteResult;
import br.com.analytics.pipeline.sales_enrichment_batch.run.PipelineRunContext;
import br.com.analytics.pipeline.sales_enrichment_batch.writer.ParquetPartitionWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Runs after every write: declares the tables and announces the partitions
 * that were written. Failed partitions are never announced. The year
 * projection of the enriched table covers every partition on storage, including
 * those of earlier runs.
 */
public class CatalogRegistrationTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrationTasklet.class);

    private final CatalogRegistrar registrar;
    private final PipelineRunContext runContext;
    private final PipelineProperties properties;
    private final ParquetPartitionWriter partitionWriter;

    public CatalogRegistrationTasklet(CatalogRegistrar registrar, PipelineRunContext runContext,
                                      PipelineProperties properties, ParquetPartitionWriter partitionWriter) {
        this.registrar = registrar;
        this.runContext = runContext;
        this.properties = properties;
        this.partitionWriter = partitionWriter;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        List<PartitionWriteResult> results = runContext.partitionResults();
        SortedSet<PartitionKey> projected = new TreeSet<>(partitionWriter.existingPartitions());
        results.stream()
                .filter(PartitionWriteResult::isWritten)
                .map(PartitionWriteResult::key)
                .forEach(projected::add);

        PipelineProperties.Catalog catalog = properties.catalog();
        TableDefinition enriched = SalesTables.enriched(
                catalog.database(), catalog.enrichedTable(), properties.output().enrichedPath(), projected);
        registrar.declareTable(enriched);

        int registered = 0;
        for (PartitionWriteResult result : results) {
            if (registrar.registerPartition(enriched, result)) {
                registered++;
            }
        }

        if (runContext.summaryWritten()) {
            registrar.declareTable(SalesTables.summary(
                    catalog.database(), catalog.summaryTable(), properties.output().summaryPath()));
        }

        log.info("Registered {} of {} partitions in catalog {}", registered, results.size(), catalog.database());
        return RepeatStatus.FINISHED;
    }
}
