package br.com.analytics.pipeline.sales_enrichment_batch.writer;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Snappy-compressed Parquet files written whole or not at all: rows go to a
 * hidden temporary file next to the target, the footer row count is checked,
 * and the file is then moved over the target.
 */
public final class ParquetFiles {

    private static final Logger log = LoggerFactory.getLogger(ParquetFiles.class);

    public static final String EXTENSION = ".snappy.parquet";

    private ParquetFiles() {
    }

    public static void writeAtomically(Path target, Schema schema, Iterable<GenericRecord> records, long expectedRows)
            throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temporary = directory.resolve("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(new NioOutputFile(temporary))
                    .withSchema(schema)
                    .withDataModel(GenericData.get())
                    .withCompressionCodec(CompressionCodecName.SNAPPY)
                    .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                    .build()) {
                for (GenericRecord record : records) {
                    writer.write(record);
                }
            }

            long rows = rowCount(temporary);
            if (rows != expectedRows) {
                throw new IOException("Parquet footer of " + target + " reports " + rows
                        + " rows, expected " + expectedRows);
            }
            move(temporary, target);
        } finally {
            Files.deleteIfExists(temporary);
        }
    }

    public static long rowCount(Path file) throws IOException {
        try (ParquetFileReader reader = ParquetFileReader.open(new NioInputFile(file))) {
            return reader.getRecordCount();
        }
    }

    public static boolean isPartFile(Path file) {
        String name = file.getFileName().toString();
        return name.startsWith("part-") && name.endsWith(".parquet");
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
