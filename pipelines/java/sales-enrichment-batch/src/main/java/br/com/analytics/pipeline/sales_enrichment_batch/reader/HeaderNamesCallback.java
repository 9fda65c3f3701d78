package br.com.analytics.pipeline.sales_enrichment_batch.reader;

import org.springframework.batch.infrastructure.item.file.LineCallbackHandler;
import org.springframework.batch.infrastructure.item.file.transform.DelimitedLineTokenizer;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Takes field names from the header row and hands them to the tokenizer that
 * reads the data rows, so columns are bound by name rather than position.
 */
public class HeaderNamesCallback implements LineCallbackHandler {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final DelimitedLineTokenizer dataTokenizer;
    private final DelimitedLineTokenizer headerTokenizer = new DelimitedLineTokenizer();

    public HeaderNamesCallback(DelimitedLineTokenizer dataTokenizer) {
        this.dataTokenizer = dataTokenizer;
    }

    @Override
    public void handleLine(String line) {
        String header = !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK ? line.substring(1) : line;
        String[] names = headerTokenizer.tokenize(header).getValues();

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < names.length; i++) {
            names[i] = names[i].strip().toLowerCase(Locale.ROOT);
            if (names[i].isEmpty() || !seen.add(names[i])) {
                throw new IllegalStateException("Invalid header row: " + line);
            }
        }
        dataTokenizer.setNames(names);
    }
}
