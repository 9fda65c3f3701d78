package br.com.analytics.pipeline.sales_enrichment_batch.tasklet;

import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
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
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Flushes every partition buffer to Parquet, one task per partition on a
 * bounded pool. Each partition has a single writer; a failed partition is
 * recorded and the others carry on.
 */
public class PartitionFlushTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(PartitionFlushTasklet.class);

    private final ParquetPartitionWriter writer;
    private final PipelineRunContext runContext;
    private final int threads;

    public PartitionFlushTasklet(ParquetPartitionWriter writer, PipelineRunContext runContext, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Partition writer threads must be at least 1, got " + threads);
        }
        this.writer = writer;
        this.runContext = runContext;
        this.threads = threads;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        SortedMap<PartitionKey, List<EnrichedRecord>> partitions = runContext.arena().snapshot();
        String runId = runContext.runId();

        ExecutorService pool = Executors.newFixedThreadPool(
                Math.max(1, Math.min(threads, partitions.size())),
                new CustomizableThreadFactory("partition-writer-"));
        List<PartitionWriteResult> results = new ArrayList<>(partitions.size());
        try {
            Map<PartitionKey, Future<PartitionWriteResult>> pending = new LinkedHashMap<>();
            partitions.forEach((key, records) ->
                    pending.put(key, pool.submit(() -> writer.write(key, records, runId))));

            for (Map.Entry<PartitionKey, Future<PartitionWriteResult>> entry : pending.entrySet()) {
                results.add(await(entry.getKey(), entry.getValue(), partitions.get(entry.getKey()).size()));
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while writing partitions, cancelling {} writer(s)", partitions.size() - results.size());
            pool.shutdownNow();
            throw e;
        } finally {
            pool.shutdown();
        }

        runContext.partitionResults(results);
        long failed = results.stream().filter(result -> !result.isWritten()).count();
        log.info("Partitions written: {}, failed: {}", results.size() - failed, failed);
        return RepeatStatus.FINISHED;
    }

    private PartitionWriteResult await(PartitionKey key, Future<PartitionWriteResult> future, int recordCount)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.warn("Partition {} writer died: {}", key, e.getCause().toString(), e.getCause());
            return PartitionWriteResult.failed(key, writer.locationOf(key), recordCount, e.getCause().toString());
        }
    }
}
