package com.ryuqq.statecheck.core.graph;

import com.ryuqq.statecheck.core.model.Transition;

import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe recorder of everything learned while exploring.
 *
 * <p>During a run, explorers write into this graph from one or many threads:</p>
 * <ul>
 *   <li><strong>Initial states:</strong> seeded in declaration order, depth 0</li>
 *   <li><strong>Discovery transitions:</strong> one per non-initial state, written once by its discoverer</li>
 *   <li><strong>Expansions:</strong> every outgoing edge plus the set of enabled actions of an expanded state</li>
 * </ul>
 *
 * <p>Once exploration is over, {@link #freeze(int)} converts the maps into the flat
 * arena arrays of a {@link ReachableGraph}, which liveness analysis works on.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>discoveries:</strong> ConcurrentHashMap&lt;Integer, Transition&gt; - parent pointer per state</li>
 *   <li><strong>depths:</strong> ConcurrentHashMap&lt;Integer, Integer&gt; - BFS level per state</li>
 *   <li><strong>expansions:</strong> ConcurrentHashMap&lt;Integer, Expansion&gt; - edges and enabled actions</li>
 * </ul>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class ExplorationGraph {

    private final int actionCount;
    private final List<Integer> initialIds;
    private final ConcurrentHashMap<Integer, Transition> discoveries;
    private final ConcurrentHashMap<Integer, Integer> depths;
    private final ConcurrentHashMap<Integer, Expansion> expansions;

    /**
     * @param actionCount number of declared actions
     * @throws IllegalArgumentException if actionCount is not positive
     */
    public ExplorationGraph(int actionCount) {
        if (actionCount <= 0) {
            throw new IllegalArgumentException("actionCount must be positive (current: " + actionCount + ")");
        }
        this.actionCount = actionCount;
        this.initialIds = new CopyOnWriteArrayList<>();
        this.discoveries = new ConcurrentHashMap<>();
        this.depths = new ConcurrentHashMap<>();
        this.expansions = new ConcurrentHashMap<>();
    }

    /**
     * Records an initial state (depth 0).
     *
     * @param stateId id of a newly interned initial state
     * @throws IllegalStateException if the state is already known
     */
    public void recordInitial(int stateId) {
        if (depths.putIfAbsent(stateId, 0) != null) {
            throw new IllegalStateException("State " + stateId + " is already recorded");
        }
        initialIds.add(stateId);
    }

    /**
     * Records the discovery transition of a state.
     *
     * <p>Must be called only by the caller that observed {@code isNew=true} when interning
     * the target, so each state gets exactly one parent.</p>
     *
     * @param transition discovery edge
     * @throws IllegalStateException if the target already has a parent or is unknown as source
     */
    public void recordDiscovery(Transition transition) {
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        Integer sourceDepth = depths.get(transition.sourceId());
        if (sourceDepth == null) {
            throw new IllegalStateException("Source state " + transition.sourceId() + " was never recorded");
        }
        if (discoveries.putIfAbsent(transition.targetId(), transition) != null
            || depths.putIfAbsent(transition.targetId(), sourceDepth + 1) != null) {
            throw new IllegalStateException("State " + transition.targetId() + " already has a discovery transition");
        }
    }

    /**
     * Records the full expansion of a state.
     *
     * @param sourceId expanded state
     * @param edges every successor edge, in evaluation order
     * @param enabledActions indexes of actions that produced at least one successor
     * @throws IllegalStateException if the state was expanded before
     */
    public void recordExpansion(int sourceId, List<Edge> edges, BitSet enabledActions) {
        if (edges == null || enabledActions == null) {
            throw new IllegalArgumentException("edges and enabledActions cannot be null");
        }
        for (Edge edge : edges) {
            if (edge.sourceId() != sourceId) {
                throw new IllegalArgumentException("Edge " + edge + " does not start at state " + sourceId);
            }
            if (edge.actionIndex() >= actionCount) {
                throw new IllegalArgumentException("Edge " + edge + " refers to an undeclared action");
            }
        }
        Expansion expansion = new Expansion(List.copyOf(edges), (BitSet) enabledActions.clone());
        if (expansions.putIfAbsent(sourceId, expansion) != null) {
            throw new IllegalStateException("State " + sourceId + " was already expanded");
        }
    }

    public boolean isInitial(int stateId) {
        return depths.containsKey(stateId) && !discoveries.containsKey(stateId);
    }

    /**
     * Discovery transition of a state.
     *
     * @param stateId state id
     * @return parent transition, empty for initial states
     */
    public Optional<Transition> discoveryOf(int stateId) {
        return Optional.ofNullable(discoveries.get(stateId));
    }

    /**
     * @param stateId recorded state
     * @return number of transitions from an initial state along discovery edges
     * @throws IllegalArgumentException if the state is unknown
     */
    public int depthOf(int stateId) {
        Integer depth = depths.get(stateId);
        if (depth == null) {
            throw new IllegalArgumentException("Unknown state: " + stateId);
        }
        return depth;
    }

    /**
     * Converts the recorded data into an immutable arena-indexed graph.
     *
     * <p>Edges are sorted by (target, action, label) and deduplicated, so every later
     * traversal that walks adjacency lists in order prefers the lowest target id.</p>
     *
     * @param stateCount number of interned states (ids 0..stateCount-1)
     * @return frozen graph
     */
    public ReachableGraph freeze(int stateCount) {
        if (stateCount < 0) {
            throw new IllegalArgumentException("stateCount cannot be negative (current: " + stateCount + ")");
        }
        int[] depth = new int[stateCount];
        for (int id = 0; id < stateCount; id++) {
            depth[id] = depths.getOrDefault(id, Integer.MAX_VALUE);
        }
        Edge[][] adjacency = new Edge[stateCount][];
        BitSet[] enabled = new BitSet[stateCount];
        for (int id = 0; id < stateCount; id++) {
            Expansion expansion = expansions.get(id);
            if (expansion == null) {
                adjacency[id] = new Edge[0];
                enabled[id] = new BitSet(actionCount);
            } else {
                adjacency[id] = expansion.edges().toArray(new Edge[0]);
                enabled[id] = expansion.enabledActions();
            }
        }
        int[] initial = initialIds.stream().mapToInt(Integer::intValue).toArray();
        return new ReachableGraph(adjacency, enabled, depth, initial);
    }

    private record Expansion(List<Edge> edges, BitSet enabledActions) {
    }
}
