package br.com.analytics.pipeline.sales_enrichment_batch.lookup;

import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Immutable hash map lookup. Built eagerly through {@link Builder}; the first
 * value seen for a key wins so the join side never holds duplicates.
 */
public final class InMemoryKeyedLookup<K, V> implements KeyedLookup<K, V> {

    private final Map<K, V> entries;

    private InMemoryKeyedLookup(Map<K, V> entries) {
        this.entries = Map.copyOf(entries);
    }

    public static <K, V> InMemoryKeyedLookup<K, V> empty() {
        return new InMemoryKeyedLookup<>(Map.of());
    }

    public static <K, V> Builder<K, V> builder(Function<V, K> keyExtractor) {
        return new Builder<>(keyExtractor);
    }

    @Override
    public @Nullable V find(@Nullable K key) {
        if (key == null) {
            return null;
        }
        return entries.get(key);
    }

    @Override
    public int size() {
        return entries.size();
    }

    public static final class Builder<K, V> {

        private final Function<V, K> keyExtractor;
        private final Map<K, V> entries = new HashMap<>();
        private long duplicates;

        private Builder(Function<V, K> keyExtractor) {
            this.keyExtractor = keyExtractor;
        }

        /**
         * @return false when the key was already present and the value was ignored
         */
        public boolean add(V value) {
            K key = keyExtractor.apply(value);
            if (key == null) {
                throw new IllegalArgumentException("lookup key must not be null");
            }
            if (entries.putIfAbsent(key, value) != null) {
                duplicates++;
                return false;
            }
            return true;
        }

        public long duplicates() {
            return duplicates;
        }

        public InMemoryKeyedLookup<K, V> build() {
            return new InMemoryKeyedLookup<>(entries);
        }
    }
}
