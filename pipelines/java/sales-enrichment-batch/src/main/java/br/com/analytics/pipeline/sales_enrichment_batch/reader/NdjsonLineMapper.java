package br.com.analytics.pipeline.sales_enrichment_batch.reader;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.springframework.batch.infrastructure.item.file.LineMapper;

import java.util.function.UnaryOperator;

/**
 * Maps one line of newline-delimited JSON to one object. Each line must hold a
 * single JSON object; a line holding an array is rejected like any other
 * malformed record.
 */
public class NdjsonLineMapper<T> implements LineMapper<T> {

    private final Gson gson;
    private final Class<T> type;
    private final UnaryOperator<T> validator;

    public NdjsonLineMapper(Gson gson, Class<T> type, UnaryOperator<T> validator) {
        this.gson = gson;
        this.type = type;
        this.validator = validator;
    }

    @Override
    public T mapLine(String line, int lineNumber) throws Exception {
        T value = gson.fromJson(line, type);
        if (value == null) {
            throw new JsonParseException("Empty record at line " + lineNumber);
        }
        return validator.apply(value);
    }
}
