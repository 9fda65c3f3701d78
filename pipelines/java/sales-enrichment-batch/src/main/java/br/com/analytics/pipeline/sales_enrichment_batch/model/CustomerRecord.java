package br.com.analytics.pipeline.sales_enrichment_batch.model;

import org.jspecify.annotations.Nullable;

public record CustomerRecord(
        String customerId,
        @Nullable String ageGroup,
        @Nullable String membershipTier,
        @Nullable String signupDate
) {
}
