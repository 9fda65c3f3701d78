package br.com.analytics.pipeline.sales_enrichment_batch.writer;

import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionKey;
import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionWriteResult;
import org.apache.avro.generic.GenericRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static br.com.analytics.pipeline.sales_enrichment_batch.TestRecords.enriched;
import static org.assertj.core.api.Assertions.assertThat;

class ParquetPartitionWriterTest {

    private static final PartitionKey JANUARY = new PartitionKey(2025, 1);

    @TempDir
    Path root;

    private final List<EnrichedRecord> january = List.of(
            enriched("T1", "C1", "100", "2025-01-05 09:15:00"),
            enriched("T2", "C2", "50", "2025-01-20"));

    @Test
    void writesPartitionUnderHiveStyleDirectory() throws Exception {
        ParquetPartitionWriter writer = new ParquetPartitionWriter(root, WriteMode.OVERWRITE);

        PartitionWriteResult result = writer.write(JANUARY, january, "run-1");

        assertThat(result.isWritten()).isTrue();
        assertThat(result.recordCount()).isEqualTo(2);
        assertThat(result.location()).isEqualTo(root.resolve("year=2025").resolve("month=1"));
        Path part = result.location().resolve(ParquetPartitionWriter.PART_FILE);
        assertThat(ParquetFiles.rowCount(part)).isEqualTo(2);

        List<GenericRecord> rows = ParquetRows.read(part);
        assertThat(rows).extracting(row -> row.get("transaction_id").toString()).containsExactly("T1", "T2");
        assertThat(rows.get(0).get("age_group").toString()).isEqualTo("26-35");
        assertThat(rows.get(1).get("age_group")).isNull();
        assertThat(rows.get(0).get("day")).isEqualTo(5);
        assertThat(rows.get(0).get("total_amount")).isEqualTo(100.0);
        assertThat(rows.get(0).getSchema().getField("year")).isNull();
    }

    @Test
    void rewritingPartitionReplacesItsContent() throws Exception {
        ParquetPartitionWriter writer = new ParquetPartitionWriter(root, WriteMode.OVERWRITE);
        writer.write(JANUARY, january, "run-1");
        Path stale = writer.locationOf(JANUARY).resolve("part-old" + ParquetFiles.EXTENSION);
        Files.copy(writer.locationOf(JANUARY).resolve(ParquetPartitionWriter.PART_FILE), stale);

        PartitionWriteResult result = writer.write(JANUARY, january.subList(0, 1), "run-2");

        assertThat(result.isWritten()).isTrue();
        assertThat(listFiles(result.location())).containsExactly(ParquetPartitionWriter.PART_FILE);
        assertThat(ParquetRows.column(result.location().resolve(ParquetPartitionWriter.PART_FILE), "transaction_id"))
                .containsExactly("T1");
    }

    @Test
    void appendModeAddsOneFilePerRun() throws Exception {
        ParquetPartitionWriter writer = new ParquetPartitionWriter(root, WriteMode.APPEND);

        writer.write(JANUARY, january, "run-20250105T091500000");
        writer.write(JANUARY, january.subList(1, 2), "run:2");

        assertThat(listFiles(writer.locationOf(JANUARY)))
                .containsExactlyInAnyOrder(
                        "part-run-20250105T091500000" + ParquetFiles.EXTENSION,
                        "part-run_2" + ParquetFiles.EXTENSION);
    }

    @Test
    void failureIsReportedInsteadOfThrown() throws Exception {
        Files.writeString(root.resolve("year=2025"), "not a directory");
        ParquetPartitionWriter writer = new ParquetPartitionWriter(root, WriteMode.OVERWRITE);

        PartitionWriteResult result = writer.write(JANUARY, january, "run-1");

        assertThat(result.isWritten()).isFalse();
        assertThat(result.status()).isEqualTo(PartitionWriteResult.Status.FAILED);
        assertThat(result.error()).isNotBlank();
        assertThat(result.recordCount()).isEqualTo(2);
    }

    @Test
    void leavesNoTemporaryFilesBehind() throws Exception {
        ParquetPartitionWriter writer = new ParquetPartitionWriter(root, WriteMode.OVERWRITE);

        writer.write(JANUARY, january, "run-1");

        assertThat(listFiles(writer.locationOf(JANUARY))).noneMatch(name -> name.startsWith("."));
    }

    @Test
    void existingPartitionsAreReadBackFromStorage() throws Exception {
        ParquetPartitionWriter writer = new ParquetPartitionWriter(root, WriteMode.OVERWRITE);
        writer.write(new PartitionKey(2024, 6), january, "run-1");
        writer.write(JANUARY, january, "run-2");
        Files.createDirectories(root.resolve("year=2023").resolve("month=3"));
        Files.createDirectories(root.resolve("year=twenty").resolve("month=1"));
        Files.writeString(root.resolve("year=2022"), "not a directory");

        assertThat(writer.existingPartitions())
                .containsExactly(new PartitionKey(2024, 6), JANUARY);
    }

    @Test
    void missingRootHasNoExistingPartitions() throws Exception {
        ParquetPartitionWriter writer = new ParquetPartitionWriter(root.resolve("absent"), WriteMode.OVERWRITE);

        assertThat(writer.existingPartitions()).isEmpty();
    }

    private static List<String> listFiles(Path directory) throws Exception {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(file -> file.getFileName().toString()).sorted().toList();
        }
    }
}
