package br.com.analytics.pipeline.sales_enrichment_batch.tasklet;

import br.com.analytics.pipeline.sales_enrichment_batch.model.SummaryRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.run.PipelineRunContext;
import br.com.analytics.pipeline.sales_enrichment_batch.writer.SummaryParquetWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.io.IOException;
import java.util.List;

/**
 * Writes the summary table. A failed write is recorded and leaves the step
 * completed, so the partitions already written are still registered.
 */
public class SummaryWriteTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(SummaryWriteTasklet.class);

    private final SummaryParquetWriter writer;
    private final PipelineRunContext runContext;

    public SummaryWriteTasklet(SummaryParquetWriter writer, PipelineRunContext runContext) {
        this.writer = writer;
        this.runContext = runContext;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        List<SummaryRecord> summaries = runContext.aggregator().summaries();
        try {
            writer.write(summaries);
            runContext.summaryWritten(true);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write summary ({} rows): {}", summaries.size(), e.toString(), e);
            runContext.summaryWritten(false);
        }
        return RepeatStatus.FINISHED;
    }
}
