package br.com.analytics.pipeline.sales_enrichment_batch.processor;

import br.com.analytics.pipeline.sales_enrichment_batch.model.AggregationKey;
import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.SummaryRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory revenue aggregation by (region, product, year, month). Sums are
 * exact decimals, so the result does not depend on the order records arrive in.
 */
public class SalesAggregator {

    static final int AVERAGE_SCALE = 6;

    private final Map<AggregationKey, Totals> aggregatedData = new TreeMap<>();

    public void accumulate(EnrichedRecord record) {
        if (!record.hasCalendarDate()) {
            throw new IllegalArgumentException(
                    "Transaction " + record.transactionId() + " has no calendar date to aggregate by");
        }
        AggregationKey key = new AggregationKey(record.region(), record.product(), record.year(), record.month());
        aggregatedData.computeIfAbsent(key, k -> new Totals()).add(record.totalAmount(), 1L);
    }

    public void merge(SalesAggregator other) {
        other.aggregatedData.forEach((key, totals) ->
                aggregatedData.computeIfAbsent(key, k -> new Totals()).add(totals.revenue, totals.count));
    }

    public List<SummaryRecord> summaries() {
        List<SummaryRecord> summaries = new ArrayList<>(aggregatedData.size());
        aggregatedData.forEach((key, totals) -> summaries.add(new SummaryRecord(
                key.region(),
                key.product(),
                key.year(),
                key.month(),
                totals.revenue,
                totals.count,
                average(totals.revenue, totals.count)
        )));
        return summaries;
    }

    public int groupCount() {
        return aggregatedData.size();
    }

    public void clear() {
        aggregatedData.clear();
    }

    static BigDecimal average(BigDecimal revenue, long count) {
        if (count == 0) {
            return BigDecimal.ZERO;
        }
        return revenue.divide(BigDecimal.valueOf(count), AVERAGE_SCALE, RoundingMode.HALF_EVEN);
    }

    private static final class Totals {

        private BigDecimal revenue = BigDecimal.ZERO;
        private long count;

        private void add(BigDecimal amount, long transactions) {
            revenue = revenue.add(amount);
            count += transactions;
        }
    }
}
