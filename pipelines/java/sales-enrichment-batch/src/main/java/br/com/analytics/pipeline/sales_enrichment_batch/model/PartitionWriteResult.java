package br.com.analytics.pipeline.sales_enrichment_batch.model;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

public record PartitionWriteResult(
        PartitionKey key,
        Path location,
        long recordCount,
        Status status,
        @Nullable String error
) {

    public enum Status {
        WRITTEN,
        FAILED
    }

    public static PartitionWriteResult written(PartitionKey key, Path location, long recordCount) {
        return new PartitionWriteResult(key, location, recordCount, Status.WRITTEN, null);
    }

    public static PartitionWriteResult failed(PartitionKey key, Path location, long recordCount, String error) {
        return new PartitionWriteResult(key, location, recordCount, Status.FAILED, error);
    }

    public boolean isWritten() {
        return status == Status.WRITTEN;
    }
}
