package br.com.analytics.pipeline.sales_enrichment_batch.writer;

/**
 * What a run does to a partition that already holds data.
 */
public enum WriteMode {
    /** Replace the partition contents; re-runs never double count. */
    OVERWRITE,
    /** Add a new part file named after the run next to the existing ones. */
    APPEND
}
