package br.com.analytics.pipeline.sales_enrichment_batch.model;

/**
 * A record excluded from the output. {@code lineNumber} is 0 when the error is
 * found after the source line is no longer known.
 */
public record RecordError(
        String source,
        long lineNumber,
        Kind kind,
        String message
) {

    public enum Kind {
        MALFORMED,
        BAD_TIMESTAMP
    }
}
