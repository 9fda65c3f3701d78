package br.com.analytics.pipeline.sales_enrichment_batch.writer;

import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionKey;
import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionWriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Writes one partition of enriched records to
 * {@code <root>/year=<Y>/month=<M>/}. A failure is reported in the returned
 * result and never thrown, so partitions written in parallel stay independent.
 */
public class ParquetPartitionWriter {

    private static final Logger log = LoggerFactory.getLogger(ParquetPartitionWriter.class);

    public static final String PART_FILE = "part-00000" + ParquetFiles.EXTENSION;

    private final Path enrichedRoot;
    private final WriteMode writeMode;

    public ParquetPartitionWriter(Path enrichedRoot, WriteMode writeMode) {
        this.enrichedRoot = enrichedRoot;
        this.writeMode = writeMode;
    }

    public Path locationOf(PartitionKey key) {
        return enrichedRoot.resolve("year=" + key.year()).resolve("month=" + key.month());
    }

    public PartitionWriteResult write(PartitionKey key, List<EnrichedRecord> records, String runId) {
        Path location = locationOf(key);
        try {
            Path target = location.resolve(fileName(runId));
            ParquetFiles.writeAtomically(
                    target,
                    ParquetSchemas.ENRICHED,
                    () -> records.stream().map(ParquetSchemas::toRecord).iterator(),
                    records.size());
            if (writeMode == WriteMode.OVERWRITE) {
                removeOtherParts(location, target);
            }
            log.debug("Wrote {} records to partition {}", records.size(), key);
            return PartitionWriteResult.written(key, location, records.size());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write partition {} ({} records): {}", key, records.size(), e.toString(), e);
            return PartitionWriteResult.failed(key, location, records.size(), e.toString());
        }
    }

    /**
     * Partitions present under the root from this or any earlier run: every
     * {@code year=<Y>/month=<M>} directory holding at least one part file.
     */
    public SortedSet<PartitionKey> existingPartitions() throws IOException {
        SortedSet<PartitionKey> keys = new TreeSet<>();
        if (!Files.isDirectory(enrichedRoot)) {
            return keys;
        }
        try (DirectoryStream<Path> years = Files.newDirectoryStream(enrichedRoot, "year=*")) {
            for (Path year : years) {
                if (!Files.isDirectory(year)) {
                    continue;
                }
                try (DirectoryStream<Path> months = Files.newDirectoryStream(year, "month=*")) {
                    for (Path month : months) {
                        Optional<PartitionKey> key = keyOf(year, month);
                        if (key.isPresent() && hasPartFile(month)) {
                            keys.add(key.get());
                        }
                    }
                }
            }
        }
        return keys;
    }

    private String fileName(String runId) {
        if (writeMode == WriteMode.APPEND) {
            return "part-" + runId.replaceAll("[^A-Za-z0-9_-]", "_") + ParquetFiles.EXTENSION;
        }
        return PART_FILE;
    }

    private static Optional<PartitionKey> keyOf(Path year, Path month) {
        try {
            int y = Integer.parseInt(year.getFileName().toString().substring("year=".length()));
            int m = Integer.parseInt(month.getFileName().toString().substring("month=".length()));
            return Optional.of(new PartitionKey(y, m));
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unrecognised partition directory {}", month);
            return Optional.empty();
        }
    }

    private static boolean hasPartFile(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return false;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                if (ParquetFiles.isPartFile(file)) {
                    return true;
                }
            }
            return false;
        }
    }

    private static void removeOtherParts(Path location, Path keep) throws IOException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(location)) {
            for (Path file : files) {
                if (ParquetFiles.isPartFile(file) && !file.getFileName().equals(keep.getFileName())) {
                    Files.delete(file);
                    log.debug("Removed stale part file {}", file);
                }
            }
        }
    }
}
