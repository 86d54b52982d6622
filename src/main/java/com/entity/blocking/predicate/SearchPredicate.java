package com.entity.blocking.predicate;

import com.entity.blocking.index.TfidfIndex;
import com.entity.blocking.index.TfidfIndexType;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Nearest-neighbour predicate over a TF-IDF index.
 *
 * <p>A target record is looked up as a member of the indexed corpus and yields its own
 * document id. A non-target record queries the index and yields the ids of every corpus
 * document at or above the threshold. A pair of records therefore shares a key exactly when
 * the target's document is among the other record's neighbours.</p>
 */
public class SearchPredicate extends IndexedPredicate {

    public SearchPredicate(TfidfIndexType indexType, String field, double threshold) {
        super(indexType, field, threshold);
    }

    @Override
    protected Set<String> query(TfidfIndex index, List<String> doc, boolean target) {
        if (target) {
            OptionalInt id = index.documentId(doc);
            return id.isPresent() ? Set.of(String.valueOf(id.getAsInt())) : Set.of();
        }
        Set<String> keys = new LinkedHashSet<>();
        for (Integer center : index.search(doc, threshold)) {
            keys.add(String.valueOf(center));
        }
        return keys;
    }
}
