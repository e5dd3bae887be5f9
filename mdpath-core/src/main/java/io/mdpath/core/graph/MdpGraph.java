package io.mdpath.core.graph;

import io.mdpath.core.state.StateId;
import io.mdpath.core.stratification.StratificationKey;
import io.mdpath.core.transition.EdgeKey;
import io.mdpath.core.transition.RawTransition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/// MDP graph of one stratification key.
///
/// Holds node statistics per state and the transitions whose source graph is this graph,
/// both within-graph edges and outgoing cross-graph edges. Cross-graph transitions arriving
/// from other graphs are recorded as incoming annotations: references to edges owned by
/// their source graph, never edges of this graph.
///
/// Nodes, edges and annotations iterate in canonical order, so two graphs built from the
/// same observations are equal and serialize identically.
///
/// @implNote **Not thread-safe**. During aggregation each graph has a single writer;
/// afterwards it is read-only.
///
/// @see GraphRegistry for the full set of graphs
/// @see GraphAggregator for the fold
public final class MdpGraph {

    private static final Comparator<Transition> BY_SOURCE =
            Comparator.comparing(Transition::getFromGraph).thenComparing(Transition::getKey);

    private final StratificationKey key;
    private final TreeMap<StateId, NodeStats> nodes = new TreeMap<>();
    private final TreeMap<EdgeKey, Transition> transitions = new TreeMap<>();
    private final List<Transition> incoming = new ArrayList<>();

    MdpGraph(StratificationKey key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    void recordNode(StateId state, String patientId) {
        nodes.computeIfAbsent(state, s -> new NodeStats()).observe(patientId);
    }

    void recordTransition(RawTransition raw) {
        if (!raw.fromGraph().equals(key)) {
            throw new IllegalArgumentException(
                    "Transition from " + raw.fromGraph() + " folded into graph " + key);
        }
        transitions.computeIfAbsent(raw.edgeKey(), k -> new Transition(key, k)).add(raw);
    }

    void linkIncoming(Transition transition) {
        if (!transition.getToGraph().equals(key) || transition.getFromGraph().equals(key)) {
            throw new IllegalArgumentException(
                    "Not an incoming cross-graph transition of " + key + ": " + transition);
        }
        int position = Collections.binarySearch(incoming, transition, BY_SOURCE);
        if (position < 0) {
            incoming.add(-position - 1, transition);
        }
    }

    void clearIncoming() {
        incoming.clear();
    }

    void mergeFrom(MdpGraph other) {
        if (!other.key.equals(key)) {
            throw new IllegalArgumentException("Cannot merge graph " + other.key + " into " + key);
        }
        other.nodes.forEach(
                (state, stats) -> nodes.computeIfAbsent(state, s -> new NodeStats()).mergeFrom(stats));
        other.transitions.forEach(
                (edgeKey, edge) ->
                        transitions.computeIfAbsent(edgeKey, k -> new Transition(key, k)).mergeFrom(edge));
    }

    public StratificationKey getKey() {
        return key;
    }

    /// Returns observation statistics per state.
    ///
    /// @return unmodifiable map in canonical state order, never null
    public Map<StateId, NodeStats> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    /// Returns all transitions owned by this graph.
    ///
    /// @return within-graph and outgoing cross-graph edges in canonical order, never null
    public List<Transition> getTransitions() {
        return List.copyOf(transitions.values());
    }

    /// Returns the edges that stay within this graph.
    ///
    /// @return edges in canonical order, never null
    public List<Transition> getEdges() {
        return transitions.values().stream().filter(t -> !t.isCrossGraph()).toList();
    }

    /// Returns the owned edges that lead to another graph.
    ///
    /// @return cross-graph edges in canonical order, never null
    public List<Transition> getOutgoingCrossGraph() {
        return transitions.values().stream().filter(Transition::isCrossGraph).toList();
    }

    /// Returns read-only references to cross-graph edges that arrive in this graph.
    ///
    /// @return edges owned by other graphs, ordered by source graph then edge, never null
    public List<Transition> getIncomingCrossGraph() {
        return List.copyOf(incoming);
    }

    /// Looks up an owned edge.
    ///
    /// @param edgeKey the edge identity, not null
    /// @return the edge, empty if never observed
    public Optional<Transition> findTransition(EdgeKey edgeKey) {
        return Optional.ofNullable(transitions.get(edgeKey));
    }

    /// Returns the total number of visit observations across all nodes.
    ///
    /// @return observation count
    public int getObservationCount() {
        return nodes.values().stream().mapToInt(NodeStats::getObservationCount).sum();
    }

    /// Returns whether nothing was observed in this graph.
    ///
    /// @return `true` if there are no nodes, edges or incoming annotations
    public boolean isEmpty() {
        return nodes.isEmpty() && transitions.isEmpty() && incoming.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MdpGraph that)) return false;
        return key.equals(that.key)
                && nodes.equals(that.nodes)
                && transitions.equals(that.transitions)
                && incoming.equals(that.incoming);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, nodes.size(), transitions.size());
    }

    @Override
    public String toString() {
        return "MdpGraph{key="
                + key
                + ", nodes="
                + nodes.size()
                + ", transitions="
                + transitions.size()
                + ", incoming="
                + incoming.size()
                + "}";
    }
}
