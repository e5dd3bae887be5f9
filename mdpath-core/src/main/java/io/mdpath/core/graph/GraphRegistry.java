package io.mdpath.core.graph;

import io.mdpath.core.stratification.StratificationKey;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Stream;

/// The full set of MDP graphs, one per stratification key.
///
/// All graphs are created up front from the Cartesian product of the four stratification
/// enumerations, including graphs that never receive an observation. The registry is an
/// explicit object created once per pipeline run and handed to the aggregator.
///
/// @implNote **Not thread-safe**. Writes go through {@link GraphAggregator}, which
/// guarantees a single writer per graph.
public final class GraphRegistry {

    private final TreeMap<StratificationKey, MdpGraph> graphs = new TreeMap<>();

    /// Creates a registry holding one empty graph per stratification key.
    public GraphRegistry() {
        for (StratificationKey key : StratificationKey.all()) {
            graphs.put(key, new MdpGraph(key));
        }
    }

    /// Returns the graph of a key.
    ///
    /// @param key stratification key, not null
    /// @return the graph, never null
    public MdpGraph get(StratificationKey key) {
        MdpGraph graph = graphs.get(Objects.requireNonNull(key, "key"));
        if (graph == null) {
            throw new IllegalStateException("No graph declared for key " + key);
        }
        return graph;
    }

    /// Returns all graphs in canonical key order.
    ///
    /// @return unmodifiable collection of 90 graphs, never null
    public Collection<MdpGraph> getGraphs() {
        return Collections.unmodifiableCollection(graphs.values());
    }

    /// Returns the graphs keyed by stratification key.
    ///
    /// @return unmodifiable sorted map, never null
    public Map<StratificationKey, MdpGraph> asMap() {
        return Collections.unmodifiableMap(graphs);
    }

    /// Returns graphs with at least one observation.
    ///
    /// @return stream in canonical key order, never null
    public Stream<MdpGraph> nonEmpty() {
        return graphs.values().stream().filter(g -> !g.isEmpty());
    }

    public int size() {
        return graphs.size();
    }

    /// Merges another partial aggregate into this registry.
    ///
    /// Node statistics and edges are combined; incoming annotations are rebuilt afterwards.
    ///
    /// @apiNote **Side effects**: Modifies every graph of this registry
    ///
    /// @param other registry to merge, not modified, not null
    /// @return this registry for chaining, never null
    public GraphRegistry mergeFrom(GraphRegistry other) {
        for (MdpGraph graph : other.graphs.values()) {
            graphs.get(graph.getKey()).mergeFrom(graph);
        }
        linkCrossGraph();
        return this;
    }

    /// Rebuilds the incoming cross-graph annotations from the owned outgoing edges.
    ///
    /// Idempotent.
    void linkCrossGraph() {
        graphs.values().forEach(MdpGraph::clearIncoming);
        for (MdpGraph graph : graphs.values()) {
            for (Transition transition : graph.getOutgoingCrossGraph()) {
                get(transition.getToGraph()).linkIncoming(transition);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphRegistry that)) return false;
        return graphs.equals(that.graphs);
    }

    @Override
    public int hashCode() {
        return graphs.hashCode();
    }
}
