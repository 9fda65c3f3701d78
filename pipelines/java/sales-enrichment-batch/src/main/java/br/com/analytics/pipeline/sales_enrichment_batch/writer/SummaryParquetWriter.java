package br.com.analytics.pipeline.sales_enrichment_batch.writer;

import br.com.analytics.pipeline.sales_enrichment_batch.model.SummaryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the unpartitioned summary table. The summary is recomputed on every
 * run, so the single part file is always replaced.
 */
public class SummaryParquetWriter {

    private static final Logger log = LoggerFactory.getLogger(SummaryParquetWriter.class);

    private final Path summaryRoot;

    public SummaryParquetWriter(Path summaryRoot) {
        this.summaryRoot = summaryRoot;
    }

    public Path write(List<SummaryRecord> summaries) throws IOException {
        Path target = summaryRoot.resolve(ParquetPartitionWriter.PART_FILE);
        ParquetFiles.writeAtomically(
                target,
                ParquetSchemas.SUMMARY,
                () -> summaries.stream().map(ParquetSchemas::toRecord).iterator(),
                summaries.size());
        log.info("Wrote {} summary rows to {}", summaries.size(), target);
        return target;
    }
}
