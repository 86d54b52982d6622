package com.entity.blocking.index;

import com.entity.blocking.core.model.Instance;
import com.entity.blocking.exception.BlockingConfigurationException;
import com.entity.blocking.exception.IndexStateException;
import com.entity.blocking.logging.LogContext;
import com.entity.blocking.metrics.BlockingMetrics;
import com.entity.blocking.metrics.NoOpBlockingMetrics;
import com.entity.blocking.predicate.BlockingPredicate;
import com.entity.blocking.predicate.CompoundPredicate;
import com.entity.blocking.predicate.IndexedPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Owns the shared indices used by indexed predicates.
 *
 * <p>Predicates are grouped by field and index type; every predicate in a group resolves
 * the same {@link Index} instance through this manager. Indices are built per field,
 * possibly in parallel across fields, and released together by {@link #resetIndices()}.</p>
 *
 * <p>Not internally locked against concurrent phases: callers must not reset while
 * emitting or building on the same predicates.</p>
 */
public class IndexManager implements IndexLookup {
    private static final Logger log = LoggerFactory.getLogger(IndexManager.class);

    // field -> index type tag -> predicates, in registration order
    private final Map<String, Map<String, List<IndexedPredicate>>> indexFields = new LinkedHashMap<>();
    private final Map<IndexKey, Index> indices = new ConcurrentHashMap<>();
    private final int parallelism;
    private final BlockingMetrics metrics;

    public IndexManager() {
        this(1, NoOpBlockingMetrics.INSTANCE);
    }

    public IndexManager(int parallelism, BlockingMetrics metrics) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        this.parallelism = parallelism;
        this.metrics = metrics != null ? metrics : NoOpBlockingMetrics.INSTANCE;
    }

    /**
     * Registers every member predicate that requires an index under its field and index type,
     * and binds it to this manager. Simple predicates are ignored.
     */
    public void group(List<CompoundPredicate> predicates) {
        for (CompoundPredicate compound : predicates) {
            for (BlockingPredicate member : compound.getMembers()) {
                if (!member.requiresIndex()) {
                    continue;
                }
                if (!(member instanceof IndexedPredicate indexed)) {
                    throw new BlockingConfigurationException("Predicate " + member.describe()
                            + " requires an index but does not extend IndexedPredicate");
                }
                List<IndexedPredicate> group = indexFields
                        .computeIfAbsent(indexed.getField(), f -> new LinkedHashMap<>())
                        .computeIfAbsent(indexed.getIndexKey().indexType(), t -> new ArrayList<>());
                if (!group.contains(indexed)) {
                    group.add(indexed);
                }
                indexed.bind(this);
            }
        }
        log.debug("predicates.grouped fields={}", indexFields.keySet());
    }

    /**
     * Builds (or extends) every index needed on {@code field} from the given raw values.
     * Empty values are skipped. A field without indexed predicates is a no-op.
     */
    public void buildIndex(Collection<?> fieldValues, String field) {
        Map<String, List<IndexedPredicate>> byType = indexFields.get(field);
        if (byType == null) {
            log.debug("index.skipped field={} reason=no-indexed-predicates", field);
            return;
        }
        for (Map.Entry<String, List<IndexedPredicate>> entry : byType.entrySet()) {
            List<IndexedPredicate> group = entry.getValue();
            IndexedPredicate owner = group.get(0);
            IndexKey key = owner.getIndexKey();

            long start = System.nanoTime();
            Index index = owner.index().orElseGet(owner::initIndex);
            for (List<String> doc : documents(owner, fieldValues)) {
                index.index(doc);
            }
            index.initSearch();
            indices.put(key, index);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            for (IndexedPredicate predicate : group) {
                predicate.clearCache();
                log.debug("index.assigned predicate={} index={}", predicate.describe(), key);
            }
            metrics.recordIndexBuild(key, index.size(), elapsed);
            log.info("index.built index={} documents={} predicates={} elapsedMs={}",
                    key, index.size(), group.size(), elapsed.toMillis());
        }
    }

    /**
     * Removes the given raw values from every index on {@code field} and re-finalizes them.
     *
     * @throws IndexStateException if an index on the field was never built
     */
    public void unbuildIndex(Collection<?> fieldValues, String field) {
        Map<String, List<IndexedPredicate>> byType = indexFields.get(field);
        if (byType == null) {
            log.debug("index.unbuild.skipped field={} reason=no-indexed-predicates", field);
            return;
        }
        for (List<IndexedPredicate> group : byType.values()) {
            IndexedPredicate owner = group.get(0);
            IndexKey key = owner.getIndexKey();
            Index index = indices.get(key);
            if (index == null) {
                throw new IndexStateException("Cannot unindex values from " + key + ": index was never built");
            }
            for (List<String> doc : documents(owner, fieldValues)) {
                index.unindex(doc);
            }
            index.initSearch();
            // cached keys may point at documents that are gone
            group.forEach(IndexedPredicate::clearCache);
            log.info("index.unbuilt index={} documents={}", key, index.size());
        }
    }

    /**
     * Builds the indices of every registered field from the unique non-empty values
     * that field takes across the dataset.
     */
    public void buildAllIndices(Map<String, Instance> datasetById) {
        String runId = LogContext.generateRunId();
        List<String> fields = new ArrayList<>(indexFields.keySet());
        if (fields.isEmpty()) {
            return;
        }
        if (parallelism == 1 || fields.size() == 1) {
            for (String field : fields) {
                buildField(runId, field, datasetById);
            }
            return;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, fields.size()));
        try {
            List<CompletableFuture<Void>> futures = fields.stream()
                    .map(field -> CompletableFuture.runAsync(() -> buildField(runId, field, datasetById), executor))
                    .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    // values that tokenize to nothing, such as [""], are not documents
    private static List<List<String>> documents(IndexedPredicate owner, Collection<?> fieldValues) {
        List<List<String>> documents = new ArrayList<>();
        for (Object value : fieldValues) {
            if (Instance.isEmptyValue(value)) {
                continue;
            }
            List<String> doc = owner.preprocess(value);
            if (!doc.isEmpty()) {
                documents.add(doc);
            }
        }
        return documents;
    }

    private void buildField(String runId, String field, Map<String, Instance> datasetById) {
        try (LogContext ctx = LogContext.forIndexBuild(runId, field)) {
            Set<Object> unique = new LinkedHashSet<>();
            for (Instance instance : datasetById.values()) {
                Object value = instance.get(field);
                if (!Instance.isEmptyValue(value)) {
                    unique.add(value);
                }
            }
            buildIndex(unique, field);
        }
    }

    /**
     * Releases every index and clears all index-derived predicate caches.
     * Indexed predicates fail until their field is built again.
     */
    public void resetIndices() {
        int released = indices.size();
        indices.clear();
        int predicates = 0;
        for (Map<String, List<IndexedPredicate>> byType : indexFields.values()) {
            for (List<IndexedPredicate> group : byType.values()) {
                for (IndexedPredicate predicate : group) {
                    predicate.clearCache();
                    predicates++;
                }
            }
        }
        log.info("indices.reset released={} predicates={}", released, predicates);
    }

    @Override
    public Optional<Index> find(IndexKey key) {
        return Optional.ofNullable(indices.get(key));
    }

    /**
     * Fields that have at least one indexed predicate, in registration order.
     */
    public Set<String> getIndexedFields() {
        return Collections.unmodifiableSet(indexFields.keySet());
    }

    /**
     * Predicates registered for a field and index type tag.
     */
    public List<IndexedPredicate> getPredicates(String field, String indexType) {
        return List.copyOf(indexFields.getOrDefault(field, Map.of()).getOrDefault(indexType, List.of()));
    }

    public int getBuiltIndexCount() {
        return indices.size();
    }
}
