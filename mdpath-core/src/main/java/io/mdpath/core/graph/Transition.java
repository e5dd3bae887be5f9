package io.mdpath.core.graph;

import io.mdpath.core.action.Action;
import io.mdpath.core.state.StateId;
import io.mdpath.core.stratification.StratificationKey;
import io.mdpath.core.transition.EdgeKey;
import io.mdpath.core.transition.RawTransition;
import io.mdpath.core.transition.TransitionOutcome;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// Deduplicated, count-aggregated edge of an MDP graph.
///
/// Identity is the 5-tuple (from graph, from state, action, to graph, to state). Every raw
/// observation with the same identity is merged in: the count grows, the patient set is
/// unioned, the elapsed-time sample and the outcome are added. Nothing is ever overwritten.
///
/// All accumulated collections are independent of merge order: patient ids are a sorted set,
/// elapsed samples a sorted list, outcomes an enum-keyed count map.
///
/// @implNote **Not thread-safe**. Mutated only by the owning graph during aggregation;
/// read-only for every other caller.
public final class Transition {

    private final StratificationKey fromGraph;
    private final EdgeKey key;
    private final List<String> changedFactors;
    private int count;
    private int assumedGradeCount;
    private final TreeSet<String> patientIds = new TreeSet<>();
    private final List<Double> elapsedSamples = new ArrayList<>();
    private final EnumMap<TransitionOutcome, Integer> outcomeCounts =
            new EnumMap<>(TransitionOutcome.class);

    Transition(StratificationKey fromGraph, EdgeKey key) {
        this.fromGraph = Objects.requireNonNull(fromGraph, "fromGraph");
        this.key = Objects.requireNonNull(key, "key");
        this.changedFactors = fromGraph.changedFactors(key.toGraph());
    }

    void add(RawTransition raw) {
        if (!raw.fromGraph().equals(fromGraph) || !raw.edgeKey().equals(key)) {
            throw new IllegalArgumentException("Raw transition does not match edge " + this);
        }
        count++;
        if (raw.fromGradeAssumed()) {
            assumedGradeCount++;
        }
        patientIds.add(raw.patientId());
        insertSample(raw.elapsedMonths());
        outcomeCounts.merge(raw.outcome(), 1, Integer::sum);
    }

    void mergeFrom(Transition other) {
        if (!other.fromGraph.equals(fromGraph) || !other.key.equals(key)) {
            throw new IllegalArgumentException("Cannot merge " + other + " into " + this);
        }
        count += other.count;
        assumedGradeCount += other.assumedGradeCount;
        patientIds.addAll(other.patientIds);
        for (double sample : other.elapsedSamples) {
            insertSample(sample);
        }
        other.outcomeCounts.forEach((outcome, n) -> outcomeCounts.merge(outcome, n, Integer::sum));
    }

    private void insertSample(double sample) {
        int position = Collections.binarySearch(elapsedSamples, sample);
        elapsedSamples.add(position < 0 ? -position - 1 : position, sample);
    }

    public StratificationKey getFromGraph() {
        return fromGraph;
    }

    public StateId getFromState() {
        return key.fromState();
    }

    public Action getAction() {
        return key.action();
    }

    public StratificationKey getToGraph() {
        return key.toGraph();
    }

    public StateId getToState() {
        return key.toState();
    }

    public EdgeKey getKey() {
        return key;
    }

    /// Returns whether this edge leaves its source graph.
    ///
    /// @return `true` iff from graph and to graph differ
    public boolean isCrossGraph() {
        return !fromGraph.equals(key.toGraph());
    }

    /// Returns the stratification factors that differ between the two graphs.
    ///
    /// @return unmodifiable list, empty for within-graph edges
    public List<String> getChangedFactors() {
        return changedFactors;
    }

    public int getCount() {
        return count;
    }

    /// Returns how many observations left a visit whose grade was the pre-pathology default.
    ///
    /// @return count of assumed-grade observations
    public int getAssumedGradeCount() {
        return assumedGradeCount;
    }

    /// Returns the patients that contributed to this edge.
    ///
    /// @return unmodifiable sorted set, never null
    public Set<String> getPatientIds() {
        return Collections.unmodifiableSet(patientIds);
    }

    /// Returns all elapsed-time samples in ascending order.
    ///
    /// @return unmodifiable list in months, never null
    public List<Double> getElapsedSamples() {
        return Collections.unmodifiableList(elapsedSamples);
    }

    /// Returns the count of each size-bucket outcome.
    ///
    /// @return unmodifiable map with only observed outcomes, never null
    public Map<TransitionOutcome, Integer> getOutcomeCounts() {
        return Collections.unmodifiableMap(outcomeCounts);
    }

    /// Returns the mean elapsed time.
    ///
    /// @return mean in months, `0.0` if there are no samples
    public double getMeanElapsedMonths() {
        if (elapsedSamples.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double sample : elapsedSamples) {
            sum += sample;
        }
        return sum / elapsedSamples.size();
    }

    /// Returns the population standard deviation of the elapsed time.
    ///
    /// @return standard deviation in months, `0.0` for fewer than two samples
    public double getStdElapsedMonths() {
        if (elapsedSamples.size() < 2) {
            return 0.0;
        }
        double mean = getMeanElapsedMonths();
        double squares = 0.0;
        for (double sample : elapsedSamples) {
            squares += (sample - mean) * (sample - mean);
        }
        return Math.sqrt(squares / elapsedSamples.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transition that)) return false;
        return count == that.count
                && assumedGradeCount == that.assumedGradeCount
                && fromGraph.equals(that.fromGraph)
                && key.equals(that.key)
                && patientIds.equals(that.patientIds)
                && elapsedSamples.equals(that.elapsedSamples)
                && outcomeCounts.equals(that.outcomeCounts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromGraph, key, count);
    }

    @Override
    public String toString() {
        return fromGraph
                + ":"
                + key.fromState()
                + " --"
                + key.action().label()
                + "--> "
                + key.toGraph()
                + ":"
                + key.toState()
                + " (n="
                + count
                + ")";
    }
}
