package com.entity.blocking.blocking;

import com.entity.blocking.core.model.BlockKey;
import com.entity.blocking.core.model.BlockedRecord;
import com.entity.blocking.core.model.DataRecord;
import com.entity.blocking.core.model.Instance;
import com.entity.blocking.exception.IndexStateException;
import com.entity.blocking.index.TfidfIndexType;
import com.entity.blocking.metrics.MicrometerBlockingMetrics;
import com.entity.blocking.predicate.CommonSetElementPredicate;
import com.entity.blocking.predicate.CompoundPredicate;
import com.entity.blocking.predicate.FirstTokenPredicate;
import com.entity.blocking.predicate.SearchPredicate;
import com.entity.blocking.predicate.WholeFieldPredicate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BlockerTest {

    private static DataRecord record(String id, Map<String, ?> fields) {
        return DataRecord.of(id, fields);
    }

    private static List<DataRecord> records(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> record("r" + i, Map.of("name", "name " + i)))
                .toList();
    }

    @Nested
    @DisplayName("Emission")
    class Emission {

        private final Blocker blocker = Blocker.builder()
                .predicate(new WholeFieldPredicate("name"))
                .predicate(new FirstTokenPredicate("name"))
                .predicate(new CommonSetElementPredicate("tags"))
                .build();

        @Test
        @DisplayName("A record yields one pair per key per predicate")
        void emitsOnePairPerKey() {
            DataRecord acme = record("1", Map.of("name", "Acme Corp", "tags", List.of("a", "b")));

            List<BlockedRecord> pairs = blocker.emit(List.of(acme), false).toList();

            assertEquals(4, pairs.size());
            assertTrue(pairs.contains(new BlockedRecord(new BlockKey("acme corp", 0), "1")));
            assertTrue(pairs.contains(new BlockedRecord(new BlockKey("acme", 1), "1")));
            assertTrue(pairs.contains(new BlockedRecord(new BlockKey("a", 2), "1")));
            assertTrue(pairs.contains(new BlockedRecord(new BlockKey("b", 2), "1")));
        }

        @Test
        @DisplayName("A record outside every predicate's domain is blocked out")
        void recordWithoutFieldsYieldsNothing() {
            DataRecord empty = record("1", Map.of("city", "Paris"));

            assertEquals(0, blocker.emit(List.of(empty), false).count());
        }

        @Test
        @DisplayName("Identical raw keys from different predicates land in different blocks")
        void keysTaggedByOrdinal() {
            Blocker twoFields = Blocker.builder()
                    .predicate(new WholeFieldPredicate("first"))
                    .predicate(new WholeFieldPredicate("last"))
                    .build();
            DataRecord record = record("1", Map.of("first", "lee", "last", "lee"));

            Set<BlockKey> keys = twoFields.emit(List.of(record), false)
                    .map(BlockedRecord::key)
                    .collect(Collectors.toSet());

            assertEquals(Set.of(new BlockKey("lee", 0), new BlockKey("lee", 1)), keys);
        }

        @Test
        void compoundPredicateTaggedOnce() {
            Blocker compound = Blocker.builder()
                    .predicate(CompoundPredicate.of(new FirstTokenPredicate("name"), new WholeFieldPredicate("city")))
                    .build();

            List<BlockedRecord> pairs = compound.emit(
                    List.of(record("1", Map.of("name", "acme corp", "city", "paris"))), false).toList();

            assertEquals(List.of(new BlockedRecord(new BlockKey("acme:paris", 0), "1")), pairs);
        }

        @Test
        void emissionIsDeterministic() {
            Map<String, Instance> dataset = new LinkedHashMap<>();
            dataset.put("1", Instance.of(Map.of("name", "acme corp", "tags", List.of("x"))));
            dataset.put("2", Instance.of(Map.of("name", "zenith", "tags", List.of("x", "y"))));

            assertEquals(blocker.emit(dataset, false).collect(Collectors.toSet()),
                    blocker.emit(dataset, false).collect(Collectors.toSet()));
        }

        @Test
        @DisplayName("Records are pulled lazily")
        void emissionIsLazy() {
            AtomicInteger pulled = new AtomicInteger();
            Iterator<DataRecord> source = records(100).iterator();
            Iterator<DataRecord> counting = new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return source.hasNext();
                }

                @Override
                public DataRecord next() {
                    pulled.incrementAndGet();
                    return source.next();
                }
            };

            var stream = blocker.emit(counting, false);
            assertEquals(0, pulled.get());

            stream.findFirst();
            assertEquals(1, pulled.get());
        }

        @Test
        void emptyPredicateListRejected() {
            assertThrows(IllegalArgumentException.class, () -> Blocker.builder().build());
        }
    }

    @Nested
    @DisplayName("Indexed predicates")
    class Indexed {

        @Test
        void emittingBeforeIndexBuildFails() {
            Blocker blocker = Blocker.builder()
                    .predicate(new SearchPredicate(TfidfIndexType.TEXT, "name", 0.5))
                    .build();

            assertThrows(IndexStateException.class,
                    () -> blocker.emit(List.of(record("1", Map.of("name", "acme"))), false).toList());
        }

        @Test
        @DisplayName("Record linkage: both sides meet on the corpus document id")
        void linkageAcrossTargetSides() {
            Blocker blocker = Blocker.builder()
                    .predicate(new SearchPredicate(TfidfIndexType.TEXT, "name", 0.3))
                    .build();
            Map<String, Instance> corpus = new LinkedHashMap<>();
            corpus.put("b1", Instance.of(Map.of("name", "acme corporation")));
            corpus.put("b2", Instance.of(Map.of("name", "zenith labs")));
            blocker.buildAllIndices(corpus);

            Set<BlockKey> left = blocker.emit(List.of(record("a1", Map.of("name", "acme corp"))), false)
                    .map(BlockedRecord::key)
                    .collect(Collectors.toSet());
            Set<BlockKey> right = blocker.emit(corpus, true)
                    .filter(pair -> pair.recordId().equals("b1"))
                    .map(BlockedRecord::key)
                    .collect(Collectors.toSet());

            assertFalse(right.isEmpty());
            assertTrue(left.containsAll(right));
        }

        @Test
        void resetThenEmitFails() {
            Blocker blocker = Blocker.builder()
                    .predicate(new SearchPredicate(TfidfIndexType.TEXT, "name", 0.5))
                    .build();
            blocker.buildIndex(List.of("acme"), "name");
            assertEquals(1, blocker.emit(List.of(record("1", Map.of("name", "acme"))), false).count());

            blocker.resetIndices();

            assertThrows(IndexStateException.class,
                    () -> blocker.emit(List.of(record("1", Map.of("name", "acme"))), false).toList());
        }
    }

    @Nested
    @DisplayName("Progress and cancellation")
    class Progress {

        private final Blocker blocker = Blocker.builder()
                .predicate(new WholeFieldPredicate("name"))
                .options(BlockingOptions.builder().progressInterval(2).build())
                .build();

        @Test
        void progressReportedAtFixedCadence() {
            List<Long> checkpoints = new ArrayList<>();
            ProgressCallback callback = (processed, elapsed) -> {
                assertFalse(elapsed.isNegative());
                checkpoints.add(processed);
            };

            blocker.emit(records(5).iterator(), false, callback, CancellationToken.none()).toList();

            assertEquals(List.of(2L, 4L), checkpoints);
        }

        @Test
        void cancellationCheckedAtCheckpoint() {
            CancellationToken token = new CancellationToken();
            List<Long> checkpoints = new ArrayList<>();
            ProgressCallback callback = (processed, elapsed) -> {
                checkpoints.add(processed);
                token.cancel();
            };

            assertThrows(CancellationException.class,
                    () -> blocker.emit(records(10).iterator(), false, callback, token).toList());
            assertEquals(List.of(2L), checkpoints);
        }

        @Test
        void nullCallbackAndTokenTolerated() {
            assertEquals(5, blocker.emit(records(5).iterator(), false, null, null).count());
        }

        @Test
        void defaultCadenceIsTenThousand() {
            assertEquals(10_000, BlockingOptions.defaults().getProgressInterval());
        }
    }

    @Test
    @DisplayName("Records and keys are counted in metrics")
    void metricsRecorded() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        Blocker blocker = Blocker.builder()
                .predicate(new WholeFieldPredicate("name"))
                .predicate(new FirstTokenPredicate("name"))
                .metrics(new MicrometerBlockingMetrics(registry))
                .build();

        blocker.emit(records(3), false).toList();

        assertEquals(3.0, registry.find("blocking.records").counter().count());
        assertEquals(6.0, registry.find("blocking.keys").counter().count());
    }
}
