package com.ryuqq.statecheck.core.graph;

import com.ryuqq.statecheck.core.model.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExplorationGraphTest {

    private ExplorationGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ExplorationGraph(2);
        graph.recordInitial(0);
    }

    @Test
    void recordDiscovery_AssignsParentAndDepth() {
        // When
        graph.recordDiscovery(new Transition(0, "Inc", "Inc", 1));
        graph.recordDiscovery(new Transition(1, "Inc", "Inc", 2));

        // Then
        assertThat(graph.isInitial(0)).isTrue();
        assertThat(graph.isInitial(2)).isFalse();
        assertThat(graph.depthOf(2)).isEqualTo(2);
        assertThat(graph.discoveryOf(2)).map(Transition::sourceId).contains(1);
        assertThat(graph.discoveryOf(0)).isEmpty();
    }

    @Test
    void recordDiscovery_SecondParent_ThrowsException() {
        graph.recordDiscovery(new Transition(0, "Inc", "Inc", 1));

        assertThatThrownBy(() -> graph.recordDiscovery(new Transition(0, "Dec", "Dec", 1)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void recordDiscovery_UnknownSource_ThrowsException() {
        assertThatThrownBy(() -> graph.recordDiscovery(new Transition(5, "Inc", "Inc", 6)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void recordExpansion_Twice_ThrowsException() {
        graph.recordExpansion(0, List.of(), new BitSet());

        assertThatThrownBy(() -> graph.recordExpansion(0, List.of(), new BitSet()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void freeze_SortsAndDeduplicatesEdges() {
        // Given
        graph.recordDiscovery(new Transition(0, "B", "B", 1));
        graph.recordDiscovery(new Transition(0, "A", "A", 2));
        BitSet enabled = new BitSet();
        enabled.set(0);
        enabled.set(1);
        graph.recordExpansion(0, List.of(
            new Edge(0, 2, 0, "A"),
            new Edge(0, 1, 1, "B"),
            new Edge(0, 2, 0, "A"),
            new Edge(0, 0, 1, "B")), enabled);

        // When
        ReachableGraph frozen = graph.freeze(3);

        // Then
        assertThat(frozen.stateCount()).isEqualTo(3);
        assertThat(frozen.outDegree(0)).isEqualTo(3);
        assertThat(frozen.target(0, 0)).isEqualTo(0);
        assertThat(frozen.target(0, 1)).isEqualTo(1);
        assertThat(frozen.target(0, 2)).isEqualTo(2);
        assertThat(frozen.hasSelfLoop(0)).isTrue();
        assertThat(frozen.isEnabled(0, 1)).isTrue();
        assertThat(frozen.outDegree(2)).isZero();
        assertThat(frozen.predecessorCount(2)).isEqualTo(1);
        assertThat(frozen.depth(2)).isEqualTo(1);
        assertThat(frozen.initialIds()).containsExactly(0);
        assertThat(frozen.isEnabled(2, 0)).isFalse();
    }
}
