package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.core.model.FieldBag;
import com.fuzzy.reconciliation.core.model.Side;

import java.util.Set;

/**
 * Derives blocking keys from a record's fields.
 * Records on opposite sides become candidates when one side's probe keys meet the
 * other side's index keys.
 *
 * <p>Keys are namespaced by extractor ({@code amt:894}) so different extractors never collide.
 * Approximate extractors index a record under one bucket and probe the neighbouring buckets
 * too, so values just either side of a bucket boundary still meet.</p>
 */
public interface BlockingKeyExtractor {

    /**
     * Keys under which the record is filed in its side's index.
     *
     * @return set of keys (never null, may be empty)
     */
    Set<String> indexKeys(Side side, FieldBag fields);

    /**
     * Keys looked up in the opposite side's index. Defaults to the index keys.
     */
    default Set<String> probeKeys(Side side, FieldBag fields) {
        return indexKeys(side, fields);
    }

    /**
     * Namespace prefix of the keys produced by this extractor.
     */
    String getName();
}
