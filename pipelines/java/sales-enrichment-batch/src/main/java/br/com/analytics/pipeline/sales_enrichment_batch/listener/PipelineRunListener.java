package br.com.analytics.pipeline.sales_enrichment_batch.listener;

import br.com.analytics.pipeline.sales_enrichment_batch.model.RunReport;
import br.com.analytics.pipeline.sales_enrichment_batch.run.PipelineRunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.annotation.AfterJob;
import org.springframework.batch.core.annotation.BeforeJob;
import org.springframework.batch.core.job.JobExecution;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Resets run state before each execution and logs the run report after it.
 * A run that completed but lost partitions ends with
 * {@value #COMPLETED_WITH_FAILED_PARTITIONS}; one that only lost the summary
 * ends with {@value #COMPLETED_WITH_FAILED_SUMMARY}.
 */
public class PipelineRunListener {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunListener.class);

    public static final String COMPLETED_WITH_FAILED_PARTITIONS = "COMPLETED_WITH_FAILED_PARTITIONS";
    public static final String COMPLETED_WITH_FAILED_SUMMARY = "COMPLETED_WITH_FAILED_SUMMARY";

    private static final DateTimeFormatter RUN_ID = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS");

    private final PipelineRunContext runContext;

    public PipelineRunListener(PipelineRunContext runContext) {
        this.runContext = runContext;
    }

    @BeforeJob
    public void beforeJob(JobExecution jobExecution) {
        String runId = "run-" + LocalDateTime.now().format(RUN_ID);
        runContext.reset(runId);
        log.info("Starting {} as {}", jobExecution.getJobInstance().getJobName(), runId);
    }

    @AfterJob
    public void afterJob(JobExecution jobExecution) {
        RunReport report = runContext.report();
        log.info("Run {} finished with status {}: {}", runContext.runId(), jobExecution.getStatus(), report);

        if (jobExecution.getStatus() != BatchStatus.COMPLETED || !report.isPartial()) {
            return;
        }
        if (report.hasFailedPartitions()) {
            jobExecution.setExitStatus(new ExitStatus(COMPLETED_WITH_FAILED_PARTITIONS,
                    report.partitionsFailed() + " partition(s) failed to write"));
            log.warn("{} partition(s) failed to write and were not registered", report.partitionsFailed());
        } else {
            jobExecution.setExitStatus(new ExitStatus(COMPLETED_WITH_FAILED_SUMMARY, "summary failed to write"));
            log.warn("Summary failed to write and was not registered");
        }
    }
}
