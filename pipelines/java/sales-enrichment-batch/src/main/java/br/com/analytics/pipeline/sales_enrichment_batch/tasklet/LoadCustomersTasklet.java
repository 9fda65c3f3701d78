package br.com.analytics.pipeline.sales_enrichment_batch.tasklet;

import br.com.analytics.pipeline.sales_enrichment_batch.lookup.InMemoryKeyedLookup;
import br.com.analytics.pipeline.sales_enrichment_batch.model.CustomerRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.reader.RecordErrorIsolatingReader;
import br.com.analytics.pipeline.sales_enrichment_batch.reader.SourceReaders;
import br.com.analytics.pipeline.sales_enrichment_batch.run.PipelineRunContext;
import com.google.gson.Gson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.nio.file.Path;

/**
 * Builds the customer lookup eagerly, before any transaction is joined. An
 * unreadable customer file fails the step; malformed lines are skipped.
 */
public class LoadCustomersTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(LoadCustomersTasklet.class);

    private final Path customersFile;
    private final Gson gson;
    private final PipelineRunContext runContext;

    public LoadCustomersTasklet(Path customersFile, Gson gson, PipelineRunContext runContext) {
        this.customersFile = customersFile;
        this.gson = gson;
        this.runContext = runContext;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        InMemoryKeyedLookup.Builder<String, CustomerRecord> customers =
                InMemoryKeyedLookup.builder(CustomerRecord::customerId);

        RecordErrorIsolatingReader<CustomerRecord> reader =
                SourceReaders.customers(customersFile, gson, runContext.errors());
        reader.open(new ExecutionContext());
        try {
            CustomerRecord customer;
            while ((customer = reader.read()) != null) {
                if (!customers.add(customer)) {
                    log.warn("Ignoring duplicate customer {} in {}", customer.customerId(), customersFile);
                }
            }
        } finally {
            reader.close();
        }

        InMemoryKeyedLookup<String, CustomerRecord> lookup = customers.build();
        runContext.customersLoaded(lookup, customers.duplicates());
        log.info("Loaded {} customers from {} ({} duplicates ignored)",
                lookup.size(), customersFile, customers.duplicates());
        return RepeatStatus.FINISHED;
    }
}
