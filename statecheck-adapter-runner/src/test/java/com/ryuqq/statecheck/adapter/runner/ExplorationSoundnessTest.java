package com.ryuqq.statecheck.adapter.runner;

import com.ryuqq.statecheck.adapter.inmemory.frontier.InMemoryFrontier;
import com.ryuqq.statecheck.adapter.inmemory.store.InMemoryStateStore;
import com.ryuqq.statecheck.application.exploration.ExplorationOutcome;
import com.ryuqq.statecheck.application.exploration.Explorer;
import com.ryuqq.statecheck.core.config.CheckerConfig;
import com.ryuqq.statecheck.core.graph.ExplorationGraph;
import com.ryuqq.statecheck.core.graph.ReachableGraph;
import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.model.Transition;
import com.ryuqq.statecheck.core.spec.Action;
import com.ryuqq.statecheck.core.spec.Model;
import com.ryuqq.statecheck.core.spec.Successor;
import com.ryuqq.statecheck.testkit.model.SampleModels;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Every recorded edge must be reproducible by re-running its action.
 *
 * <p>For an edge {@code (s, action, label, t)}, calling the action on state {@code s}
 * must return a successor with that label whose state is {@code t}. The same holds for
 * the discovery transition of every non-initial state.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
class ExplorationSoundnessTest {

    private static final CheckerConfig FULL_EXPLORATION = new CheckerConfig()
        .withCheckDeadlock(false)
        .withStopOnFirstViolation(false);

    @Test
    void sequential_RecordedEdgesMatchActionOutputs() {
        assertSound(new SequentialExplorer(), SampleModels.mutex(true));
        assertSound(new SequentialExplorer(), SampleModels.transfer(SampleModels.sumIs(100)));
        assertSound(new SequentialExplorer(), SampleModels.idleReady(false));
    }

    @Test
    void workerPool_RecordedEdgesMatchActionOutputs() {
        Explorer pool = new WorkerPoolExplorer(new WorkerPoolConfig(4));

        assertSound(pool, SampleModels.mutex(true));
        assertSound(pool, SampleModels.transfer(SampleModels.sumIs(100)));
        assertSound(pool, SampleModels.countdown(5, true));
    }

    private static void assertSound(Explorer explorer, Model model) {
        // given
        InMemoryStateStore store = new InMemoryStateStore(10_000);

        // when
        ExplorationOutcome outcome = explorer.explore(model, FULL_EXPLORATION, store, new InMemoryFrontier());

        // then
        ExplorationGraph recorded = outcome.getGraph();
        ReachableGraph graph = recorded.freeze(store.size());
        int edges = 0;
        for (int s = 0; s < graph.stateCount(); s++) {
            State source = store.get(s);
            for (int k = 0; k < graph.outDegree(s); k++) {
                Action action = model.getActions().get(graph.action(s, k));
                assertThat(action.successors(source))
                    .as("edge %s -[%s]-> %s", source, graph.label(s, k), store.get(graph.target(s, k)))
                    .contains(Successor.of(graph.label(s, k), store.get(graph.target(s, k))));
                edges++;
            }

            Optional<Transition> discovery = recorded.discoveryOf(s);
            if (discovery.isEmpty()) {
                assertThat(recorded.isInitial(s)).as("state %s has no discovery edge", store.get(s)).isTrue();
                continue;
            }
            Transition transition = discovery.get();
            assertThat(transition.targetId()).isEqualTo(s);
            Action action = model.getActions().get(model.indexOfAction(transition.actionName()));
            List<Successor> produced = action.successors(store.get(transition.sourceId()));
            assertThat(produced)
                .as("discovery %s", transition)
                .contains(Successor.of(transition.label(), source));
        }
        assertThat(edges).isPositive();
    }
}
