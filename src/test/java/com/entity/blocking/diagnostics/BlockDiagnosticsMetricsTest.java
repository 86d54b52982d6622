package com.entity.blocking.diagnostics;

import com.entity.blocking.blocking.Blocker;
import com.entity.blocking.core.model.Instance;
import com.entity.blocking.core.model.InstancePair;
import com.entity.blocking.core.model.TrainingPairs;
import com.entity.blocking.metrics.BlockingMetrics;
import com.entity.blocking.predicate.WholeFieldPredicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BlockDiagnosticsMetricsTest {

    @Mock
    private BlockingMetrics metrics;

    private BlockDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        Blocker blocker = Blocker.builder()
                .predicate(new WholeFieldPredicate("name"))
                .metrics(metrics)
                .build();
        diagnostics = new BlockDiagnostics(blocker);
    }

    @Test
    void blockSizesAreRecorded() {
        diagnostics.blockSizes(Map.of(
                "1", Instance.of(Map.of("name", "acme")),
                "2", Instance.of(Map.of("name", "acme")),
                "3", Instance.of(Map.of("name", "zenith"))), false);

        verify(metrics).recordBlockSize(2L);
        verify(metrics).recordBlockSize(1L);
        verify(metrics, times(3)).incrementRecordsBlocked();
    }

    @Test
    void recallIsRecorded() {
        TrainingPairs pairs = new TrainingPairs(List.of(new InstancePair(
                Instance.of(Map.of("name", "acme")),
                Instance.of(Map.of("name", "acme")))), List.of());

        diagnostics.recallEstimate(pairs);

        verify(metrics).recordRecall(1.0);
    }

    @Test
    void recallWithoutMatchesIsNotRecorded() {
        diagnostics.recallEstimate(TrainingPairs.empty());

        verify(metrics, never()).recordRecall(anyDouble());
    }
}
