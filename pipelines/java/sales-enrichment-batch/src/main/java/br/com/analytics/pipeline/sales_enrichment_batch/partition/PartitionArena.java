package br.com.analytics.pipeline.sales_enrichment_batch.partition;

import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Ordered map of partition key to an append-only buffer of records. Filled by a
 * single writer during enrichment, then read by the partition flush once the
 * enrichment step is over.
 */
public class PartitionArena {

    private final SortedMap<PartitionKey, List<EnrichedRecord>> buffers = new TreeMap<>();
    private long size;

    public void append(PartitionKey key, EnrichedRecord record) {
        buffers.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        size++;
    }

    public SortedMap<PartitionKey, List<EnrichedRecord>> snapshot() {
        SortedMap<PartitionKey, List<EnrichedRecord>> copy = new TreeMap<>();
        for (Map.Entry<PartitionKey, List<EnrichedRecord>> entry : buffers.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
        }
        return Collections.unmodifiableSortedMap(copy);
    }

    public int partitionCount() {
        return buffers.size();
    }

    public long size() {
        return size;
    }

    public void clear() {
        buffers.clear();
        size = 0;
    }
}
