package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.Side;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Blocking key → record ids for one side, with the reverse mapping so a removed record
 * can be purged without re-deriving its keys.
 * Not thread-safe; mutated only by the single batch writer.
 */
public class BlockingIndex {

    private final Side side;
    private final Map<String, NavigableSet<RecordId>> recordsByKey = new HashMap<>();
    private final Map<RecordId, Set<String>> keysByRecord = new HashMap<>();

    public BlockingIndex(Side side) {
        this.side = side;
    }

    public Side getSide() {
        return side;
    }

    /**
     * Files a record under the given keys, replacing any keys it was filed under before.
     */
    public void add(RecordId id, Set<String> keys) {
        remove(id);
        if (keys.isEmpty()) {
            return;
        }
        keysByRecord.put(id, Set.copyOf(keys));
        for (String key : keys) {
            recordsByKey.computeIfAbsent(key, k -> new TreeSet<>()).add(id);
        }
    }

    /**
     * Purges a record from every key it is filed under.
     *
     * @return the keys the record was filed under (empty if it was not indexed)
     */
    public Set<String> remove(RecordId id) {
        Set<String> keys = keysByRecord.remove(id);
        if (keys == null) {
            return Set.of();
        }
        for (String key : keys) {
            NavigableSet<RecordId> ids = recordsByKey.get(key);
            if (ids != null) {
                ids.remove(id);
                if (ids.isEmpty()) {
                    recordsByKey.remove(key);
                }
            }
        }
        return keys;
    }

    /**
     * Records filed under a key, in id order.
     */
    public Set<RecordId> lookup(String key) {
        NavigableSet<RecordId> ids = recordsByKey.get(key);
        return ids != null ? Collections.unmodifiableSet(ids) : Set.of();
    }

    public Set<String> keysOf(RecordId id) {
        return keysByRecord.getOrDefault(id, Set.of());
    }

    public boolean contains(RecordId id) {
        return keysByRecord.containsKey(id);
    }

    public Set<RecordId> indexedIds() {
        return Collections.unmodifiableSet(keysByRecord.keySet());
    }

    public int recordCount() {
        return keysByRecord.size();
    }

    public int keyCount() {
        return recordsByKey.size();
    }

    /**
     * Size of the most populated key; a skew indicator for fan-out tuning.
     */
    public int largestBlock() {
        return recordsByKey.values().stream().mapToInt(Set::size).max().orElse(0);
    }
}
