package io.mdpath.core.graph;

import io.mdpath.core.assembly.StateActionAssembler;
import io.mdpath.core.state.StateId;
import io.mdpath.core.stratification.StratificationKey;
import io.mdpath.core.transition.PatientTimeline;
import io.mdpath.core.transition.RawTransition;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Folds patient timelines into the graph registry.
///
/// Each raw transition goes to the graph of its source key, where it is merged into the
/// edge with the same (from state, action, to graph, to state), or inserted with count 1.
/// Each visit is counted as one node observation in the graph of the key in force at that
/// visit. Once all graphs are folded, every outgoing cross-graph edge is linked as an
/// incoming annotation on its destination graph.
///
/// The fold is commutative and associative over the multiset of raw transitions, so the
/// result does not depend on patient or transition order.
///
/// ### Modes
/// - **Sequential** (no executor): single-threaded reduction on the calling thread
/// - **Parallel**: observations are partitioned by graph key and each partition is folded
///   by one task, so every graph has exactly one writer; annotations are linked afterwards
///   on the calling thread
///
/// @implNote Stateless; the executor is borrowed, not owned.
public final class GraphAggregator {

    private static final Logger logger = Logger.getLogger(GraphAggregator.class.getName());

    private final StateActionAssembler assembler = new StateActionAssembler();
    private final ExecutorService executor;

    /// Creates a sequential aggregator.
    public GraphAggregator() {
        this(null);
    }

    /// Creates an aggregator.
    ///
    /// @param executor executor for the partitioned fold, null for sequential folding
    public GraphAggregator(ExecutorService executor) {
        this.executor = executor;
    }

    /// Folds node observations and transitions of all timelines into the registry.
    ///
    /// @apiNote **Side effects**: Modifies the graphs of `registry`
    ///
    /// @param registry target registry, not null
    /// @param timelines processed patient timelines, not null
    /// @throws IllegalStateException if a parallel fold task fails or is interrupted
    public void aggregate(GraphRegistry registry, Collection<PatientTimeline> timelines) {
        Objects.requireNonNull(registry, "registry");
        Map<StratificationKey, Partition> partitions = partition(timelines);

        if (executor == null) {
            partitions.forEach((key, partition) -> partition.foldInto(registry.get(key)));
        } else {
            foldInParallel(registry, partitions);
        }
        registry.linkCrossGraph();

        logger.info(
                "Aggregated "
                        + timelines.size()
                        + " timelines into "
                        + partitions.size()
                        + " of "
                        + registry.size()
                        + " graphs");
    }

    /// Folds raw transitions only, without node observations.
    ///
    /// @apiNote **Side effects**: Modifies the graphs of `registry`
    ///
    /// @param registry target registry, not null
    /// @param transitions raw transitions in any order, not null
    public void foldTransitions(GraphRegistry registry, Collection<RawTransition> transitions) {
        for (RawTransition transition : transitions) {
            registry.get(transition.fromGraph()).recordTransition(transition);
        }
        registry.linkCrossGraph();
    }

    private void foldInParallel(
            GraphRegistry registry, Map<StratificationKey, Partition> partitions) {
        List<Callable<Void>> tasks = new ArrayList<>(partitions.size());
        partitions.forEach(
                (key, partition) ->
                        tasks.add(
                                () -> {
                                    partition.foldInto(registry.get(key));
                                    return null;
                                }));
        try {
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while aggregating graphs", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Graph aggregation failed: " + e.getCause(), e.getCause());
        }
    }

    private Map<StratificationKey, Partition> partition(
            Collection<PatientTimeline> timelines) {
        Map<StratificationKey, Partition> partitions = new TreeMap<>();
        for (PatientTimeline timeline : timelines) {
            for (int i = 0; i < timeline.visits().size(); i++) {
                StratificationKey key = timeline.keys().get(i);
                partitions
                        .computeIfAbsent(key, k -> new Partition())
                        .nodes
                        .add(
                                new NodeObservation(
                                        timeline.patientId(),
                                        assembler.stateOf(timeline.visits().get(i))));
            }
            for (RawTransition transition : timeline.transitions()) {
                partitions
                        .computeIfAbsent(transition.fromGraph(), k -> new Partition())
                        .transitions
                        .add(transition);
            }
        }
        return partitions;
    }

    private record NodeObservation(String patientId, StateId state) {}

    private static final class Partition {
        private final List<NodeObservation> nodes = new ArrayList<>();
        private final List<RawTransition> transitions = new ArrayList<>();

        void foldInto(MdpGraph graph) {
            for (NodeObservation observation : nodes) {
                graph.recordNode(observation.state(), observation.patientId());
            }
            for (RawTransition transition : transitions) {
                graph.recordTransition(transition);
            }
        }
    }
}
