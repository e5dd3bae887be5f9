package io.mdpath.core.transition;

import io.mdpath.core.action.Action;
import io.mdpath.core.state.StateId;
import io.mdpath.core.stratification.StratificationKey;
import java.util.List;
import java.util.Objects;

/// One observed (state, action, state) step of one patient, before deduplication.
///
/// @param patientId contributing patient, not null
/// @param fromGraph stratification key as of the earlier visit, not null
/// @param fromState state at the earlier visit, not null
/// @param action action taken during the step, not null
/// @param toGraph stratification key as of the later visit, not null
/// @param toState state at the later visit, not null
/// @param elapsedMonths time between the two visits
/// @param changedFactors stratification factors that differ between the keys, never null
/// @param outcome size-bucket outcome of the step, not null
/// @param fromGradeAssumed `true` if the earlier visit's grade was the default
/// @param fromVisitIndex index of the earlier visit
public record RawTransition(
        String patientId,
        StratificationKey fromGraph,
        StateId fromState,
        Action action,
        StratificationKey toGraph,
        StateId toState,
        double elapsedMonths,
        List<String> changedFactors,
        TransitionOutcome outcome,
        boolean fromGradeAssumed,
        int fromVisitIndex) {

    public RawTransition {
        Objects.requireNonNull(patientId, "patientId");
        Objects.requireNonNull(fromGraph, "fromGraph");
        Objects.requireNonNull(fromState, "fromState");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(toGraph, "toGraph");
        Objects.requireNonNull(toState, "toState");
        Objects.requireNonNull(outcome, "outcome");
        changedFactors = List.copyOf(changedFactors);
    }

    /// Returns whether the step moves the patient to another graph.
    ///
    /// @return `true` iff the source and destination keys differ
    public boolean isCrossGraph() {
        return !fromGraph.equals(toGraph);
    }

    /// Returns the deduplication key of this step within its source graph.
    ///
    /// @return edge key, never null
    public EdgeKey edgeKey() {
        return new EdgeKey(fromState, action, toGraph, toState);
    }

    public int toVisitIndex() {
        return fromVisitIndex + 1;
    }
}
