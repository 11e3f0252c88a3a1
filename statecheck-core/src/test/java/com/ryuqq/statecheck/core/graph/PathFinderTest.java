package com.ryuqq.statecheck.core.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.ryuqq.statecheck.core.graph.Graphs.set;
import static org.assertj.core.api.Assertions.assertThat;

class PathFinderTest {

    // 0 -> 1 -> 3, 0 -> 2 -> 3, 3 -> 0, 2 -> 4
    private final ReachableGraph graph = Graphs.of(5, 1,
        new int[] {0, 2, 0}, new int[] {0, 1, 0}, new int[] {1, 3, 0},
        new int[] {2, 3, 0}, new int[] {3, 0, 0}, new int[] {2, 4, 0});

    @Test
    void shortestPath_PrefersLowestIds() {
        Optional<List<Edge>> path = PathFinder.shortestPath(graph, 0, set(3), graph.allStates());

        assertThat(path).isPresent();
        assertThat(path.get()).extracting(Edge::targetId).containsExactly(1, 3);
    }

    @Test
    void shortestPath_RespectsAllowedSet() {
        Optional<List<Edge>> path = PathFinder.shortestPath(graph, 0, set(3), set(0, 2, 3));

        assertThat(path).isPresent();
        assertThat(path.get()).extracting(Edge::targetId).containsExactly(2, 3);
    }

    @Test
    void shortestPath_StartIsTarget_ReturnsEmptyPath() {
        assertThat(PathFinder.shortestPath(graph, 3, set(3), graph.allStates())).contains(List.of());
    }

    @Test
    void shortestPath_Unreachable_ReturnsEmpty() {
        assertThat(PathFinder.shortestPath(graph, 4, set(0), graph.allStates())).isEmpty();
    }

    @Test
    void canReach_CollectsBackwardReachableStates() {
        assertThat(PathFinder.canReach(graph, set(4), graph.allStates())).isEqualTo(set(0, 1, 2, 3, 4));
        assertThat(PathFinder.canReach(graph, set(4), set(1, 2, 3, 4))).isEqualTo(set(2, 4));
    }
}
