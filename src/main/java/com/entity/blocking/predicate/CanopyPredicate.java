package com.entity.blocking.predicate;

import com.entity.blocking.index.TfidfIndex;
import com.entity.blocking.index.TfidfIndexType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Canopy-clustering predicate over a TF-IDF index.
 *
 * <p>The first time a corpus document is seen it either inherits the canopy it was already
 * assigned to, or becomes the center of a new canopy that absorbs every not-yet-assigned
 * neighbour at or above the threshold. A document with no neighbours belongs to no canopy.
 * Values absent from the corpus yield no key. Assignments depend on the order in which
 * records are presented and are kept until {@link #clearCache()}.</p>
 */
public class CanopyPredicate extends IndexedPredicate {

    private static final int NO_CANOPY = -1;

    private final Cache<Integer, Integer> canopy = Caffeine.newBuilder().build();

    public CanopyPredicate(TfidfIndexType indexType, String field, double threshold) {
        super(indexType, field, threshold);
    }

    @Override
    protected Set<String> query(TfidfIndex index, List<String> doc, boolean target) {
        OptionalInt docId = index.documentId(doc);
        if (docId.isEmpty()) {
            return Set.of();
        }
        int id = docId.getAsInt();
        Integer assigned = canopy.getIfPresent(id);
        if (assigned == null) {
            List<Integer> members = index.search(doc, threshold);
            for (Integer member : members) {
                if (canopy.getIfPresent(member) == null) {
                    canopy.put(member, id);
                }
            }
            assigned = members.isEmpty() ? NO_CANOPY : id;
            canopy.put(id, assigned);
        }
        return assigned == NO_CANOPY ? Set.of() : Set.of(String.valueOf(assigned));
    }

    @Override
    protected boolean isTargetSensitive() {
        return false;
    }

    @Override
    public void clearCache() {
        super.clearCache();
        canopy.invalidateAll();
    }

    @Override
    public long cachedEntries() {
        canopy.cleanUp();
        return super.cachedEntries() + canopy.estimatedSize();
    }
}
