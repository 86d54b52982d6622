package com.entity.blocking.blocking;

import com.entity.blocking.core.model.BlockedRecord;
import com.entity.blocking.core.model.DataRecord;
import com.entity.blocking.core.model.Instance;
import com.entity.blocking.index.IndexManager;
import com.entity.blocking.metrics.BlockingMetrics;
import com.entity.blocking.metrics.NoOpBlockingMetrics;
import com.entity.blocking.predicate.BlockingPredicate;
import com.entity.blocking.predicate.CompoundPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Turns records into tagged block keys.
 *
 * <p>A blocker is built once from an ordered list of predicates. Each predicate is tagged with
 * its position in that list, so keys from different predicates never land in the same block.
 * Indexed predicates are registered with the blocker's {@link IndexManager}, which must build
 * their indices before {@link #emit} is called.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * Blocker blocker = Blocker.builder()
 *     .predicate(new WholeFieldPredicate("name"))
 *     .predicate(new CanopyPredicate(TfidfIndexType.TEXT, "name", 0.6))
 *     .build();
 *
 * blocker.buildAllIndices(dataset);
 * try (Stream&lt;BlockedRecord&gt; keys = blocker.emit(records, false)) {
 *     keys.forEach(pair -&gt; ...);
 * }
 * blocker.resetIndices();
 * </pre>
 */
public class Blocker {
    private static final Logger log = LoggerFactory.getLogger(Blocker.class);

    private final List<CompoundPredicate> predicates;
    private final IndexManager indexManager;
    private final BlockingOptions options;
    private final BlockingMetrics metrics;

    private Blocker(Builder builder) {
        this.predicates = List.copyOf(builder.predicates);
        this.options = builder.options;
        this.metrics = builder.metrics;
        this.indexManager = new IndexManager(options.getIndexBuildParallelism(), metrics);
        this.indexManager.group(predicates);
        log.info("blocker.created predicates={} indexedFields={}",
                predicates.size(), indexManager.getIndexedFields());
    }

    /**
     * Streams the tagged block keys for the given records.
     *
     * @param records records to block; consumed lazily, exactly once
     * @param target  true when the records are the second dataset of a record-linkage run
     * @return single-pass stream of (key, record id) pairs
     */
    public Stream<BlockedRecord> emit(Iterator<DataRecord> records, boolean target) {
        return emit(records, target, ProgressCallback.NOOP, CancellationToken.none());
    }

    public Stream<BlockedRecord> emit(Iterator<DataRecord> records, boolean target,
                                      ProgressCallback progress, CancellationToken cancellation) {
        BlockKeyIterator iterator = new BlockKeyIterator(records, predicates, target,
                options.getProgressInterval(),
                progress != null ? progress : ProgressCallback.NOOP,
                cancellation != null ? cancellation : CancellationToken.none(),
                metrics);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    public Stream<BlockedRecord> emit(Iterable<DataRecord> records, boolean target) {
        return emit(records.iterator(), target);
    }

    public Stream<BlockedRecord> emit(Stream<DataRecord> records, boolean target) {
        return emit(records.iterator(), target).onClose(records::close);
    }

    /**
     * Streams the tagged block keys for a dataset keyed by record id.
     */
    public Stream<BlockedRecord> emit(Map<String, Instance> dataset, boolean target) {
        return emit(dataset.entrySet().stream().map(e -> new DataRecord(e.getKey(), e.getValue())), target);
    }

    /**
     * @see IndexManager#buildIndex(Collection, String)
     */
    public void buildIndex(Collection<?> fieldValues, String field) {
        indexManager.buildIndex(fieldValues, field);
    }

    /**
     * @see IndexManager#unbuildIndex(Collection, String)
     */
    public void unbuildIndex(Collection<?> fieldValues, String field) {
        indexManager.unbuildIndex(fieldValues, field);
    }

    /**
     * @see IndexManager#buildAllIndices(Map)
     */
    public void buildAllIndices(Map<String, Instance> datasetById) {
        indexManager.buildAllIndices(datasetById);
    }

    /**
     * @see IndexManager#resetIndices()
     */
    public void resetIndices() {
        indexManager.resetIndices();
    }

    public List<CompoundPredicate> getPredicates() {
        return predicates;
    }

    /**
     * Description of the predicate at a tag ordinal.
     */
    public String describe(int ordinal) {
        return predicates.get(ordinal).describe();
    }

    public IndexManager getIndexManager() {
        return indexManager;
    }

    public BlockingOptions getOptions() {
        return options;
    }

    public BlockingMetrics getMetrics() {
        return metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<CompoundPredicate> predicates = new ArrayList<>();
        private BlockingOptions options = BlockingOptions.defaults();
        private BlockingMetrics metrics = NoOpBlockingMetrics.INSTANCE;

        /**
         * Appends a predicate. Non-compound predicates are wrapped as single-member compounds.
         */
        public Builder predicate(BlockingPredicate predicate) {
            if (predicate instanceof CompoundPredicate compound) {
                predicates.add(compound);
            } else {
                predicates.add(CompoundPredicate.of(predicate));
            }
            return this;
        }

        public Builder predicates(List<? extends BlockingPredicate> predicates) {
            predicates.forEach(this::predicate);
            return this;
        }

        public Builder options(BlockingOptions options) {
            this.options = options;
            return this;
        }

        public Builder metrics(BlockingMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Blocker build() {
            if (predicates.isEmpty()) {
                throw new IllegalArgumentException("At least one predicate is required");
            }
            if (options == null) {
                options = BlockingOptions.defaults();
            }
            if (metrics == null) {
                metrics = NoOpBlockingMetrics.INSTANCE;
            }
            return new Blocker(this);
        }
    }
}
