package br.com.analytics.pipeline.sales_enrichment_batch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

public record TransactionRecord(
        String transactionId,
        String timestamp,
        @Nullable String customerId,
        String product,
        Integer quantity,
        BigDecimal unitPrice,
        String region,
        BigDecimal totalAmount
) {
}
