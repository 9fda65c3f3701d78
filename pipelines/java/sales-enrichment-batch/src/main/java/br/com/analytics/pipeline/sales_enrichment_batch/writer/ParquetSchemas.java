package br.com.analytics.pipeline.sales_enrichment_batch.writer;

import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.SummaryRecord;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

/**
 * Avro schemas of the Parquet outputs. Partition columns (year, month) of the
 * enriched data live in the directory path, not in the files. The timestamp is
 * kept as the original text.
 */
public final class ParquetSchemas {

    private static final String NAMESPACE = "br.com.analytics.pipeline.sales_enrichment_batch";

    public static final Schema ENRICHED = SchemaBuilder.record("EnrichedSale").namespace(NAMESPACE)
            .fields()
            .requiredString("transaction_id")
            .requiredString("timestamp")
            .optionalString("customer_id")
            .requiredString("product")
            .requiredInt("quantity")
            .requiredDouble("unit_price")
            .requiredString("region")
            .requiredDouble("total_amount")
            .optionalString("age_group")
            .optionalString("membership_tier")
            .optionalString("signup_date")
            .requiredInt("day")
            .endRecord();

    public static final Schema SUMMARY = SchemaBuilder.record("SalesSummary").namespace(NAMESPACE)
            .fields()
            .requiredString("region")
            .requiredString("product")
            .requiredInt("year")
            .requiredInt("month")
            .requiredDouble("total_revenue")
            .requiredLong("transaction_count")
            .requiredDouble("avg_transaction_value")
            .endRecord();

    private ParquetSchemas() {
    }

    public static GenericRecord toRecord(EnrichedRecord record) {
        if (record.day() == null) {
            throw new IllegalArgumentException("Transaction " + record.transactionId() + " has no calendar day");
        }
        GenericRecord avro = new GenericData.Record(ENRICHED);
        avro.put("transaction_id", record.transactionId());
        avro.put("timestamp", record.timestamp());
        avro.put("customer_id", record.customerId());
        avro.put("product", record.product());
        avro.put("quantity", record.quantity());
        avro.put("unit_price", record.unitPrice().doubleValue());
        avro.put("region", record.region());
        avro.put("total_amount", record.totalAmount().doubleValue());
        avro.put("age_group", record.ageGroup());
        avro.put("membership_tier", record.membershipTier());
        avro.put("signup_date", record.signupDate());
        avro.put("day", record.day());
        return avro;
    }

    public static GenericRecord toRecord(SummaryRecord summary) {
        GenericRecord avro = new GenericData.Record(SUMMARY);
        avro.put("region", summary.region());
        avro.put("product", summary.product());
        avro.put("year", summary.year());
        avro.put("month", summary.month());
        avro.put("total_revenue", summary.totalRevenue().doubleValue());
        avro.put("transaction_count", summary.transactionCount());
        avro.put("avg_transaction_value", summary.avgTransactionValue().doubleValue());
        return avro;
    }
}
