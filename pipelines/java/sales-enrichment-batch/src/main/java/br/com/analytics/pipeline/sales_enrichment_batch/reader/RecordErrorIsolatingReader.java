package br.com.analytics.pipeline.sales_enrichment_batch.reader;

import br.com.analytics.pipeline.sales_enrichment_batch.model.RecordError;
import br.com.analytics.pipeline.sales_enrichment_batch.run.RecordErrorLog;
import org.jspecify.annotations.Nullable;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.ItemStreamException;
import org.springframework.batch.infrastructure.item.ItemStreamReader;
import org.springframework.batch.infrastructure.item.file.FlatFileParseException;

/**
 * Wraps a flat file reader so that a line which fails to parse is recorded and
 * skipped instead of failing the step. Blank lines are skipped without being
 * counted. Failures to open or read the source itself still propagate.
 */
public class RecordErrorIsolatingReader<T> implements ItemStreamReader<T> {

    private final ItemStreamReader<T> delegate;
    private final String source;
    private final RecordErrorLog errors;

    public RecordErrorIsolatingReader(ItemStreamReader<T> delegate, String source, RecordErrorLog errors) {
        this.delegate = delegate;
        this.source = source;
        this.errors = errors;
    }

    @Override
    public @Nullable T read() throws Exception {
        while (true) {
            try {
                return delegate.read();
            } catch (FlatFileParseException e) {
                String input = e.getInput();
                if (input == null || input.isBlank()) {
                    continue;
                }
                errors.record(new RecordError(source, e.getLineNumber(), RecordError.Kind.MALFORMED, reason(e)));
            }
        }
    }

    @Override
    public void open(ExecutionContext executionContext) throws ItemStreamException {
        delegate.open(executionContext);
    }

    @Override
    public void update(ExecutionContext executionContext) throws ItemStreamException {
        delegate.update(executionContext);
    }

    @Override
    public void close() throws ItemStreamException {
        delegate.close();
    }

    private static String reason(FlatFileParseException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
