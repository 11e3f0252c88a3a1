package com.ryuqq.statecheck.adapter.runner;

import com.ryuqq.statecheck.adapter.inmemory.frontier.InMemoryFrontier;
import com.ryuqq.statecheck.adapter.inmemory.store.InMemoryStateStore;
import com.ryuqq.statecheck.application.exploration.ExplorationOutcome;
import com.ryuqq.statecheck.application.exploration.Explorer;
import com.ryuqq.statecheck.core.config.CheckerConfig;
import com.ryuqq.statecheck.core.graph.ExplorationGraph;
import com.ryuqq.statecheck.core.result.ExplorationResult;
import com.ryuqq.statecheck.core.result.ExplorationStatus;
import com.ryuqq.statecheck.core.spec.Model;
import com.ryuqq.statecheck.core.spi.Frontier;
import com.ryuqq.statecheck.core.spi.StateStore;
import com.ryuqq.statecheck.testkit.model.SampleModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DefaultModelChecker unit tests.
 *
 * <p>The explorer is mocked, so these tests cover only result assembly:</p>
 * <ul>
 *   <li>Run-level failures keep partial counters and carry no trace</li>
 *   <li>A fresh store and frontier per run, sized by maxStates</li>
 *   <li>Argument validation</li>
 * </ul>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultModelCheckerTest {

    @Mock
    private Explorer explorer;

    private Model model;

    @BeforeEach
    void setUp() {
        model = SampleModels.idleReady(false);
    }

    @Test
    void run_ExplorerFailure_ReportedWithPartialCounters() {
        // given
        ExplorationOutcome failed = ExplorationOutcome.failed(ExplorationStatus.EVALUATOR_TIMEOUT,
            "Action Prepare exceeded its evaluation budget of 10ms", 7, 12, null, new ExplorationGraph(3));
        when(explorer.explore(eq(model), any(CheckerConfig.class), any(StateStore.class), any(Frontier.class)))
            .thenReturn(failed);

        // when
        ExplorationResult result = new DefaultModelChecker(model, explorer).run(new CheckerConfig());

        // then: liveness is never checked on a partial graph
        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.EVALUATOR_TIMEOUT);
        assertThat(result.getStatesExplored()).isEqualTo(7);
        assertThat(result.getStatesGenerated()).isEqualTo(12);
        assertThat(result.getTrace()).isEmpty();
        assertThat(result.getErrorMessage()).hasValueSatisfying(m -> assertThat(m).contains("Prepare"));
    }

    @Test
    void run_CreatesFreshStorePerRunWithConfiguredCapacity() {
        // given
        AtomicInteger stores = new AtomicInteger();
        AtomicInteger lastCapacity = new AtomicInteger();
        DefaultModelChecker checker = new DefaultModelChecker(model, explorer, capacity -> {
            stores.incrementAndGet();
            lastCapacity.set(capacity);
            return new InMemoryStateStore(capacity);
        }, InMemoryFrontier::new);
        when(explorer.explore(eq(model), any(CheckerConfig.class), any(StateStore.class), any(Frontier.class)))
            .thenReturn(ExplorationOutcome.failed(ExplorationStatus.CANCELLED, "cancelled", 0, 0, null,
                new ExplorationGraph(3)));

        // when
        checker.run(new CheckerConfig().withMaxStates(42));
        checker.run(new CheckerConfig().withMaxStates(42));

        // then
        assertThat(stores.get()).isEqualTo(2);
        assertThat(lastCapacity.get()).isEqualTo(42);
        verify(explorer, times(2)).explore(eq(model), any(CheckerConfig.class), any(StateStore.class),
            any(Frontier.class));
    }

    @Test
    void run_PassesConfigThroughToExplorer() {
        // given
        CheckerConfig config = new CheckerConfig().withStopOnFirstViolation(false);
        when(explorer.explore(eq(model), same(config), any(StateStore.class), any(Frontier.class)))
            .thenReturn(ExplorationOutcome.failed(ExplorationStatus.CANCELLED, "cancelled", 0, 0, null,
                new ExplorationGraph(3)));

        // when
        ExplorationResult result = new DefaultModelChecker(model, explorer).run(config);

        // then
        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.CANCELLED);
    }

    @Test
    void run_NullConfig_ThrowsException() {
        DefaultModelChecker checker = new DefaultModelChecker(model, explorer);

        assertThatThrownBy(() -> checker.run(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
        verify(explorer, never()).explore(any(), any(), any(), any());
    }

    @Test
    void constructor_NullModel_ThrowsException() {
        assertThatThrownBy(() -> new DefaultModelChecker(null, explorer))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("model");
    }

    @Test
    void constructor_NullExplorer_ThrowsException() {
        assertThatThrownBy(() -> new DefaultModelChecker(model, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("explorer");
    }
}
