package br.com.analytics.pipeline.sales_enrichment_batch.run;

import br.com.analytics.pipeline.sales_enrichment_batch.model.RecordError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-record errors of a run. Every error is counted; only the first
 * {@value #MAX_SAMPLES} are kept for the run report.
 */
public class RecordErrorLog {

    private static final Logger log = LoggerFactory.getLogger(RecordErrorLog.class);

    static final int MAX_SAMPLES = 100;

    private final Map<String, Map<RecordError.Kind, Long>> counts = new HashMap<>();
    private final List<RecordError> samples = new ArrayList<>();

    public synchronized void record(RecordError error) {
        counts.computeIfAbsent(error.source(), s -> new EnumMap<>(RecordError.Kind.class))
                .merge(error.kind(), 1L, Long::sum);
        if (samples.size() < MAX_SAMPLES) {
            samples.add(error);
        }
        log.warn("Skipping {} record from {} at line {}: {}",
                error.kind(), error.source(), error.lineNumber(), error.message());
    }

    public synchronized long count(String source, RecordError.Kind kind) {
        return counts.getOrDefault(source, Map.of()).getOrDefault(kind, 0L);
    }

    public synchronized List<RecordError> samples() {
        return List.copyOf(samples);
    }

    public synchronized void clear() {
        counts.clear();
        samples.clear();
    }
}
