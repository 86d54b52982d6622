package com.entity.blocking.predicate;

import com.entity.blocking.core.model.Instance;
import com.entity.blocking.exception.IndexStateException;
import com.entity.blocking.index.Index;
import com.entity.blocking.index.IndexKey;
import com.entity.blocking.index.IndexLookup;
import com.entity.blocking.index.TfidfIndex;
import com.entity.blocking.index.TfidfIndexType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base class for predicates backed by a shared TF-IDF index over one field.
 *
 * <p>The predicate never owns its index. It carries an {@link IndexKey} and resolves the
 * index through the {@link IndexLookup} it was bound to when registered with an
 * {@link com.entity.blocking.index.IndexManager}. Results are memoised per
 * (document, target) until {@link #clearCache()}.</p>
 */
public abstract class IndexedPredicate implements BlockingPredicate {

    protected final String field;
    protected final TfidfIndexType indexType;
    protected final double threshold;
    private final IndexKey indexKey;
    private final Cache<ResultKey, Set<String>> results;
    private volatile IndexLookup lookup = IndexLookup.NONE;

    protected IndexedPredicate(TfidfIndexType indexType, String field, double threshold) {
        this.field = Objects.requireNonNull(field, "field is required");
        this.indexType = Objects.requireNonNull(indexType, "indexType is required");
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        this.threshold = threshold;
        this.indexKey = new IndexKey(field, indexType.getTag());
        this.results = Caffeine.newBuilder().build();
    }

    @Override
    public final Set<String> apply(Instance instance, boolean target) {
        TfidfIndex index = requireIndex();
        Object value = instance.get(field);
        if (Instance.isEmptyValue(value)) {
            return Set.of();
        }
        List<String> doc = preprocess(value);
        if (doc.isEmpty()) {
            return Set.of();
        }
        ResultKey cacheKey = new ResultKey(doc, target && isTargetSensitive());
        return results.get(cacheKey, k -> Set.copyOf(query(index, doc, k.target())));
    }

    /**
     * Computes keys for a preprocessed, non-empty document against a search-ready index.
     */
    protected abstract Set<String> query(TfidfIndex index, List<String> doc, boolean target);

    /**
     * Whether {@code target} changes the result. Target-insensitive predicates share cache entries.
     */
    protected boolean isTargetSensitive() {
        return true;
    }

    @Override
    public final boolean requiresIndex() {
        return true;
    }

    public List<String> preprocess(Object value) {
        return indexType.tokenize(value);
    }

    /**
     * Creates a fresh, empty index of the type this predicate needs.
     */
    public Index initIndex() {
        return new TfidfIndex();
    }

    /**
     * Binds this predicate to the lookup that owns its index.
     */
    public void bind(IndexLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup is required");
    }

    /**
     * The currently built index for this predicate's field and type, if any.
     */
    public Optional<Index> index() {
        return lookup.find(indexKey);
    }

    /**
     * Drops all memoised, index-derived state.
     */
    public void clearCache() {
        results.invalidateAll();
    }

    /**
     * Number of memoised entries held by this predicate.
     */
    public long cachedEntries() {
        results.cleanUp();
        return results.estimatedSize();
    }

    public IndexKey getIndexKey() {
        return indexKey;
    }

    public String getField() {
        return field;
    }

    public TfidfIndexType getIndexType() {
        return indexType;
    }

    public double getThreshold() {
        return threshold;
    }

    private TfidfIndex requireIndex() {
        Index index = lookup.find(indexKey).orElseThrow(() -> new IndexStateException(
                describe() + " invoked before its index " + indexKey + " was built"));
        if (!index.isSearchReady()) {
            throw new IndexStateException(describe() + " invoked while index " + indexKey + " is not finalized");
        }
        if (!(index instanceof TfidfIndex tfidf)) {
            throw new IndexStateException("Index " + indexKey + " is not a TF-IDF index: " + index.getClass().getName());
        }
        return tfidf;
    }

    @Override
    public String describe() {
        return getClass().getSimpleName() + "(" + threshold + ", " + field + ")";
    }

    @Override
    public String toString() {
        return describe();
    }

    private record ResultKey(List<String> doc, boolean target) {}
}
