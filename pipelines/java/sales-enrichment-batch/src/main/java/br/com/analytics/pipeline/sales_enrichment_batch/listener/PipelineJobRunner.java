package br.com.analytics.pipeline.sales_enrichment_batch.listener;

import br.com.analytics.pipeline.sales_enrichment_batch.config.PipelineProperties;
import br.com.analytics.pipeline.sales_enrichment_batch.model.RecordError;
import br.com.analytics.pipeline.sales_enrichment_batch.model.RunReport;
import br.com.analytics.pipeline.sales_enrichment_batch.run.PipelineRunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Launches the next instance of the job when the application starts, unless
 * {@code pipeline.run-on-startup} is false. The job's run id incrementer picks
 * the parameters. Exit code 1 means the run failed, 2 means it completed but
 * some partitions or the summary could not be written.
 */
@Component
public class PipelineJobRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PipelineJobRunner.class);

    private final JobOperator jobOperator;
    private final Job salesEnrichmentJob;
    private final PipelineProperties properties;
    private final PipelineRunContext runContext;

    private int exitCode;

    public PipelineJobRunner(JobOperator jobOperator, Job salesEnrichmentJob, PipelineProperties properties,
                             PipelineRunContext runContext) {
        this.jobOperator = jobOperator;
        this.salesEnrichmentJob = salesEnrichmentJob;
        this.properties = properties;
        this.runContext = runContext;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!properties.runOnStartup()) {
            log.info("pipeline.run-on-startup is false, not launching {}", salesEnrichmentJob.getName());
            return;
        }
        JobExecution execution = jobOperator.start(salesEnrichmentJob, new JobParameters());
        exitCode = exitCodeOf(execution);

        RunReport report = runContext.lastReport();
        if (report != null && !report.errorSamples().isEmpty()) {
            RecordError first = report.errorSamples().get(0);
            log.info("{} record error(s), first: {} {} at line {}: {}", report.recordErrors(),
                    first.kind(), first.source(), first.lineNumber(), first.message());
        }
        log.info("{} exiting with code {}", salesEnrichmentJob.getName(), exitCode);
    }

    static int exitCodeOf(JobExecution execution) {
        if (execution.getStatus() != BatchStatus.COMPLETED) {
            return 1;
        }
        String exit = execution.getExitStatus().getExitCode();
        if (PipelineRunListener.COMPLETED_WITH_FAILED_PARTITIONS.equals(exit)
                || PipelineRunListener.COMPLETED_WITH_FAILED_SUMMARY.equals(exit)) {
            return 2;
        }
        return 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
