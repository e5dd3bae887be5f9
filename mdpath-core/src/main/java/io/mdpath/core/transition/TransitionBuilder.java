package io.mdpath.core.transition;

import io.mdpath.core.action.Action;
import io.mdpath.core.assembly.StateActionAssembler;
import io.mdpath.core.state.StateId;
import io.mdpath.core.stratification.StratificationKey;
import io.mdpath.core.visit.Visit;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Pairs consecutive visits of one patient into raw transitions.
///
/// For each pair (i, i+1) the from-state comes from visit i, the action from the
/// assembler, the to-state from visit i+1. The source graph is the key in force at visit i.
/// When visit i+1 has a different grade, the destination graph is the same key with the new
/// grade, the transition is cross-graph with `changedFactors = ["tumor_grade"]`, and the new
/// key applies to all later pairs.
///
/// @implNote Stateless and thread-safe; the key is threaded through a {@link TimelineFold}.
public final class TransitionBuilder {

    private static final Logger logger = Logger.getLogger(TransitionBuilder.class.getName());

    private final StateActionAssembler assembler;

    public TransitionBuilder(StateActionAssembler assembler) {
        this.assembler = Objects.requireNonNull(assembler, "assembler");
    }

    /// Builds the timeline of one patient.
    ///
    /// @param patientId patient identifier, not null
    /// @param initialKey key in force at the first visit, not null
    /// @param visits visits in chronological order, not null
    /// @return timeline with one key per visit and one transition per pair, never null
    public PatientTimeline build(String patientId, StratificationKey initialKey, List<Visit> visits) {
        Objects.requireNonNull(patientId, "patientId");
        Objects.requireNonNull(initialKey, "initialKey");
        if (visits.isEmpty()) {
            return new PatientTimeline(patientId, List.of(), List.of(), List.of());
        }

        TimelineFold fold = TimelineFold.start(initialKey.withGrade(visits.get(0).grade()));
        for (int i = 0; i + 1 < visits.size(); i++) {
            fold = fold.step(buildTransition(patientId, fold.currentKey(), visits.get(i), visits.get(i + 1)));
        }
        return new PatientTimeline(patientId, visits, fold.keys(), fold.transitions());
    }

    /// Builds the transition between two consecutive visits.
    ///
    /// @param patientId patient identifier, not null
    /// @param fromGraph key in force at `from`, not null
    /// @param from earlier visit, not null
    /// @param to later visit, not null
    /// @return raw transition, never null
    public RawTransition buildTransition(
            String patientId, StratificationKey fromGraph, Visit from, Visit to) {
        StateId fromState = assembler.stateOf(from);
        StateId toState = assembler.stateOf(to);
        Action action = assembler.actionBetween(from, to);
        StratificationKey toGraph = fromGraph.withGrade(to.grade());
        List<String> changed = fromGraph.changedFactors(toGraph);

        if (!changed.isEmpty()) {
            logger.fine(
                    "Patient "
                            + patientId
                            + " moves from "
                            + fromGraph
                            + " to "
                            + toGraph
                            + " at visit "
                            + to.index());
        }

        return new RawTransition(
                patientId,
                fromGraph,
                fromState,
                action,
                toGraph,
                toState,
                to.months() - from.months(),
                changed,
                TransitionOutcome.of(from.size(), to.size()),
                from.gradeAssumed(),
                from.index());
    }
}
