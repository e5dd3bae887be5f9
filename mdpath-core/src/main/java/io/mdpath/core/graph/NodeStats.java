package io.mdpath.core.graph;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// Observation statistics of one state within one graph.
///
/// @implNote **Not thread-safe**. Mutated only by the owning graph during aggregation.
public final class NodeStats {

    private int observationCount;
    private final TreeSet<String> patientIds = new TreeSet<>();

    NodeStats() {}

    void observe(String patientId) {
        observationCount++;
        patientIds.add(patientId);
    }

    void mergeFrom(NodeStats other) {
        observationCount += other.observationCount;
        patientIds.addAll(other.patientIds);
    }

    /// Returns how many visits were observed in this state.
    ///
    /// @return observation count, at least 1 for a stored node
    public int getObservationCount() {
        return observationCount;
    }

    /// Returns the patients with at least one visit in this state.
    ///
    /// @return unmodifiable sorted set, never null
    public Set<String> getPatientIds() {
        return Collections.unmodifiableSet(patientIds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeStats that)) return false;
        return observationCount == that.observationCount && patientIds.equals(that.patientIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(observationCount, patientIds);
    }

    @Override
    public String toString() {
        return "NodeStats{count=" + observationCount + ", patients=" + patientIds.size() + "}";
    }
}
