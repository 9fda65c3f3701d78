package br.com.analytics.pipeline.sales_enrichment_batch.reader;

import br.com.analytics.pipeline.sales_enrichment_batch.model.CustomerRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.TransactionRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.run.PipelineRunContext;
import br.com.analytics.pipeline.sales_enrichment_batch.run.RecordErrorLog;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import org.springframework.batch.infrastructure.item.file.FlatFileItemReader;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.infrastructure.item.file.transform.DelimitedLineTokenizer;
import org.springframework.core.io.FileSystemResource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public final class SourceReaders {

    private SourceReaders() {
    }

    public static RecordErrorIsolatingReader<TransactionRecord> transactions(Path csv, RecordErrorLog errors) {
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();
        tokenizer.setStrict(true);

        FlatFileItemReader<TransactionRecord> reader = new FlatFileItemReaderBuilder<TransactionRecord>()
                .name("transactionReader")
                .resource(new FileSystemResource(csv))
                .encoding(StandardCharsets.UTF_8.name())
                .strict(true)
                .linesToSkip(1)
                .skippedLinesCallback(new HeaderNamesCallback(tokenizer))
                .lineTokenizer(tokenizer)
                .fieldSetMapper(new TransactionFieldSetMapper())
                .build();
        return new RecordErrorIsolatingReader<>(reader, PipelineRunContext.TRANSACTIONS_SOURCE, errors);
    }

    public static RecordErrorIsolatingReader<CustomerRecord> customers(Path ndjson, Gson gson, RecordErrorLog errors) {
        FlatFileItemReader<CustomerRecord> reader = new FlatFileItemReaderBuilder<CustomerRecord>()
                .name("customerReader")
                .resource(new FileSystemResource(ndjson))
                .encoding(StandardCharsets.UTF_8.name())
                .strict(true)
                .lineMapper(new NdjsonLineMapper<>(gson, CustomerRecord.class, SourceReaders::requireCustomerId))
                .build();
        return new RecordErrorIsolatingReader<>(reader, PipelineRunContext.CUSTOMERS_SOURCE, errors);
    }

    /**
     * Strict Gson for snake_case NDJSON: unquoted names, single quotes and other
     * lenient syntax make a line malformed.
     */
    public static Gson ndjsonGson() {
        return new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .setStrictness(Strictness.STRICT)
                .create();
    }

    private static CustomerRecord requireCustomerId(CustomerRecord customer) {
        if (customer.customerId() == null || customer.customerId().isBlank()) {
            throw new JsonParseException("Missing customer_id");
        }
        return customer;
    }
}
