package br.com.analytics.pipeline.sales_enrichment_batch;

import br.com.analytics.pipeline.sales_enrichment_batch.catalog.CatalogPartition;
import br.com.analytics.pipeline.sales_enrichment_batch.catalog.JdbcCatalogStore;
import br.com.analytics.pipeline.sales_enrichment_batch.catalog.TableDefinition;
import br.com.analytics.pipeline.sales_enrichment_batch.listener.PipelineRunListener;
import br.com.analytics.pipeline.sales_enrichment_batch.model.RecordError;
import br.com.analytics.pipeline.sales_enrichment_batch.model.RunReport;
import br.com.analytics.pipeline.sales_enrichment_batch.run.PipelineRunContext;
import br.com.analytics.pipeline.sales_enrichment_batch.writer.ParquetPartitionWriter;
import br.com.analytics.pipeline.sales_enrichment_batch.writer.ParquetRows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.batch.core.step.StepExecution;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.util.FileSystemUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "pipeline.run-on-startup=false",
        "pipeline.chunk-size=2",
        "pipeline.catalog.database=sales_it",
        "catalog.datasource.url=jdbc:h2:mem:sales-it-catalog;DB_CLOSE_DELAY=-1"
})
class SalesEnrichmentJobIntegrationTest {

    @TempDir
    static Path workDir;

    @Autowired
    private JobOperator jobOperator;

    @Autowired
    private Job salesEnrichmentJob;

    @Autowired
    private PipelineRunContext runContext;

    @Autowired
    private JdbcCatalogStore catalogStore;

    @Autowired
    @Qualifier("catalogDataSource")
    private DataSource catalogDataSource;

    @DynamicPropertySource
    static void pipelinePaths(DynamicPropertyRegistry registry) {
        registry.add("pipeline.input.transactions", () -> workDir.resolve("raw/sales_data.csv").toString());
        registry.add("pipeline.input.customers", () -> workDir.resolve("raw/customer_demographics.json").toString());
        registry.add("pipeline.output.base-path", () -> workDir.resolve("processed").toString());
    }

    @BeforeEach
    void writeInputs() throws Exception {
        FileSystemUtils.deleteRecursively(workDir.resolve("processed"));
        JdbcTemplate catalog = new JdbcTemplate(catalogDataSource);
        catalog.update("DELETE FROM catalog_partition");
        catalog.update("DELETE FROM catalog_column");
        catalog.update("DELETE FROM catalog_table");
        Files.createDirectories(workDir.resolve("raw"));
        Files.write(workDir.resolve("raw/sales_data.csv"), List.of(
                "transaction_id,date,customer_id,product,quantity,unit_price,region,total_amount",
                "T1,2025-01-05 09:15:00,C1,Laptop,1,100,North,100",
                "T2,2025-01-20 18:00:00,C2,Laptop,1,50,North,50",
                "T5,broken",
                "T3,2025-02-01 00:00:01,C1,Laptop,1,75,North,75",
                "T4,2025-02-30 10:00:00,C1,Laptop,1,20,North,20"
        ), StandardCharsets.UTF_8);
        Files.write(workDir.resolve("raw/customer_demographics.json"), List.of(
                "{\"customer_id\":\"C1\",\"age_group\":\"26-35\",\"membership_tier\":\"Gold\",\"signup_date\":\"2024-06-01\"}",
                "{\"customer_id\":\"C3\",\"age_group\":\"46-55\",\"membership_tier\":\"Bronze\",\"signup_date\":\"2023-02-11\"}"
        ), StandardCharsets.UTF_8);
    }

    @Test
    void enrichesPartitionsSummarisesAndRegisters() throws Exception {
        JobExecution execution = run();

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getExitStatus().getExitCode()).isEqualTo("COMPLETED");

        RunReport report = runContext.lastReport();
        assertThat(report).isNotNull();
        assertThat(report.transactionsRead()).isEqualTo(4);
        assertThat(report.malformedTransactions()).isEqualTo(1);
        assertThat(report.customersLoaded()).isEqualTo(2);
        assertThat(report.enrichedRecords()).isEqualTo(4);
        assertThat(report.unmatchedTransactions()).isEqualTo(1);
        assertThat(report.badTimestamps()).isEqualTo(1);
        assertThat(report.outputRecords()).isEqualTo(3);
        assertThat(report.summaryGroups()).isEqualTo(2);
        assertThat(report.partitionsWritten()).isEqualTo(2);
        assertThat(report.summaryWritten()).isTrue();
        assertThat(report.errorSamples()).extracting(RecordError::kind)
                .containsExactly(RecordError.Kind.MALFORMED, RecordError.Kind.BAD_TIMESTAMP);
        assertThat(report.errorSamples().get(0).lineNumber()).isEqualTo(4L);

        Path enriched = workDir.resolve("processed/enriched");
        assertThat(ParquetRows.column(january(enriched), "transaction_id")).containsExactly("T1", "T2");
        assertThat(ParquetRows.column(january(enriched), "membership_tier")).containsExactly("Gold", null);
        assertThat(ParquetRows.column(february(enriched), "transaction_id")).containsExactly("T3");

        Path summary = workDir.resolve("processed/summary").resolve(ParquetPartitionWriter.PART_FILE);
        assertThat(ParquetRows.column(summary, "total_revenue")).containsExactly("150.0", "75.0");
        assertThat(ParquetRows.column(summary, "transaction_count")).containsExactly("2", "1");

        List<CatalogPartition> partitions = catalogStore.partitions("sales_it", "enriched_sales");
        assertThat(partitions).extracting(CatalogPartition::partitionName)
                .containsExactly("year=2025/month=1", "year=2025/month=2");
        assertThat(partitions).extracting(CatalogPartition::recordCount).containsExactly(2L, 1L);
        assertThat(catalogStore.findTable("sales_it", "enriched_sales"))
                .hasValueSatisfying(table -> assertThat(table.partitionKeys().get(0).range()).isEqualTo("2025,2025"));
        assertThat(catalogStore.findTable("sales_it", "sales_summary")).map(TableDefinition::isPartitioned)
                .contains(false);
    }

    @Test
    void rerunProducesSameOutput() throws Exception {
        run();
        List<String> firstJanuary = ParquetRows.column(january(workDir.resolve("processed/enriched")), "transaction_id");

        JobExecution second = run();

        assertThat(second.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(ParquetRows.column(january(workDir.resolve("processed/enriched")), "transaction_id"))
                .isEqualTo(firstJanuary);
        assertThat(runContext.lastReport().outputRecords()).isEqualTo(3);
        assertThat(catalogStore.partitions("sales_it", "enriched_sales")).hasSize(2);
    }

    @Test
    void unwritablePartitionsEndTheRunAsPartial() throws Exception {
        Files.createDirectories(workDir.resolve("processed/enriched"));
        Files.writeString(workDir.resolve("processed/enriched/year=2025"), "blocked");

        JobExecution execution = run();

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getExitStatus().getExitCode())
                .isEqualTo(PipelineRunListener.COMPLETED_WITH_FAILED_PARTITIONS);
        assertThat(runContext.lastReport().partitionsFailed()).isEqualTo(2);
        assertThat(runContext.lastReport().summaryWritten()).isTrue();
    }

    @Test
    void yearProjectionSpansPartitionsOfEarlierRuns() throws Exception {
        writeTransactions("T0,2024-06-10 12:00:00,C1,Laptop,1,30,North,30");
        run();
        writeTransactions("T1,2025-01-05 09:15:00,C1,Laptop,1,100,North,100");

        JobExecution second = run();

        assertThat(second.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(catalogStore.findTable("sales_it", "enriched_sales"))
                .hasValueSatisfying(table -> assertThat(table.partitionKeys().get(0).range()).isEqualTo("2024,2025"));
        assertThat(catalogStore.partitions("sales_it", "enriched_sales")).extracting(CatalogPartition::partitionName)
                .containsExactly("year=2024/month=6", "year=2025/month=1");
    }

    @Test
    void unwritableSummaryEndsTheRunAsPartialAndStillRegisters() throws Exception {
        Files.createDirectories(workDir.resolve("processed"));
        Files.writeString(workDir.resolve("processed/summary"), "blocked");

        JobExecution execution = run();

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getExitStatus().getExitCode())
                .isEqualTo(PipelineRunListener.COMPLETED_WITH_FAILED_SUMMARY);
        assertThat(execution.getStepExecutions()).extracting(StepExecution::getStepName)
                .contains("registerCatalogStep");
        assertThat(runContext.lastReport().summaryWritten()).isFalse();
        assertThat(runContext.lastReport().partitionsWritten()).isEqualTo(2);
        assertThat(catalogStore.partitions("sales_it", "enriched_sales")).hasSize(2);
        assertThat(catalogStore.findTable("sales_it", "sales_summary")).isEmpty();
    }

    @Test
    void missingCustomerFileFailsTheRun() throws Exception {
        Files.delete(workDir.resolve("raw/customer_demographics.json"));

        JobExecution execution = run();

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(Files.exists(workDir.resolve("processed/summary"))).isFalse();
    }

    private JobExecution run() throws Exception {
        return jobOperator.start(salesEnrichmentJob, new JobParameters());
    }

    private static void writeTransactions(String... rows) throws Exception {
        List<String> lines = new ArrayList<>();
        lines.add("transaction_id,date,customer_id,product,quantity,unit_price,region,total_amount");
        lines.addAll(List.of(rows));
        Files.write(workDir.resolve("raw/sales_data.csv"), lines, StandardCharsets.UTF_8);
    }

    private static Path january(Path enriched) {
        return enriched.resolve("year=2025/month=1").resolve(ParquetPartitionWriter.PART_FILE);
    }

    private static Path february(Path enriched) {
        return enriched.resolve("year=2025/month=2").resolve(ParquetPartitionWriter.PART_FILE);
    }
}
