package br.com.analytics.pipeline.sales_enrichment_batch.model;

import java.math.BigDecimal;

public record SummaryRecord(
        String region,
        String product,
        Integer year,
        Integer month,
        BigDecimal totalRevenue,
        Long transactionCount,
        BigDecimal avgTransactionValue
) {
}
