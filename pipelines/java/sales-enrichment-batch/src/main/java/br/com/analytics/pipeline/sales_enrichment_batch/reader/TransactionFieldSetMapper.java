package br.com.analytics.pipeline.sales_enrichment_batch.reader;

import br.com.analytics.pipeline.sales_enrichment_batch.model.TransactionRecord;
import org.springframework.batch.infrastructure.item.file.mapping.FieldSetMapper;
import org.springframework.batch.infrastructure.item.file.transform.FieldSet;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * Binds a sales CSV row by header name. The timestamp column may be called
 * {@code timestamp} or, as in the raw sales extract, {@code date}.
 */
public class TransactionFieldSetMapper implements FieldSetMapper<TransactionRecord> {

    static final String TIMESTAMP = "timestamp";
    static final String DATE = "date";

    @Override
    public TransactionRecord mapFieldSet(FieldSet fieldSet) {
        List<String> names = Arrays.asList(fieldSet.getNames());
        String timestampColumn = names.contains(TIMESTAMP) ? TIMESTAMP : DATE;

        String customerId = fieldSet.readString("customer_id");
        return new TransactionRecord(
                required(fieldSet, "transaction_id"),
                required(fieldSet, timestampColumn),
                customerId == null || customerId.isBlank() ? null : customerId,
                required(fieldSet, "product"),
                Integer.valueOf(required(fieldSet, "quantity")),
                new BigDecimal(required(fieldSet, "unit_price")),
                required(fieldSet, "region"),
                new BigDecimal(required(fieldSet, "total_amount"))
        );
    }

    private static String required(FieldSet fieldSet, String name) {
        String value = fieldSet.readString(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing value for column '" + name + "'");
        }
        return value;
    }
}
