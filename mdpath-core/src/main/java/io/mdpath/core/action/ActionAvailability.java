package io.mdpath.core.action;

import io.mdpath.core.state.TreatmentPhase;
import java.util.EnumSet;
import java.util.Set;

/// Lookup table of the actions available in each treatment phase.
///
/// Availability depends on the phase only, never on the rest of the state.
///
/// ```
/// Phase           Available
/// ————————————————+——————————————————————————————————————————————
/// naive           │ all
/// early_postop    │ observe_*, radiation_*, supportive_care
/// late_postop     │ all
/// early_postrad   │ observe_*, surgery_*, supportive_care
/// late_postrad    │ all
/// recurrent       │ all
/// ```
public final class ActionAvailability {

    private static final Set<Action> ALL = EnumSet.allOf(Action.class);

    private static final Set<Action> EARLY_POSTOP = allExcept(Action.Kind.SURGERY);

    private static final Set<Action> EARLY_POSTRAD = allExcept(Action.Kind.RADIATION);

    private ActionAvailability() {}

    /// Returns the actions available in a phase.
    ///
    /// @param phase the treatment phase, not null
    /// @return unmodifiable set of actions, never null or empty
    public static Set<Action> availableIn(TreatmentPhase phase) {
        Set<Action> actions =
                switch (phase) {
                    case NAIVE, LATE_POSTOP, LATE_POSTRAD, RECURRENT -> ALL;
                    case EARLY_POSTOP -> EARLY_POSTOP;
                    case EARLY_POSTRAD -> EARLY_POSTRAD;
                };
        return Set.copyOf(actions);
    }

    /// Checks whether an action is available in a phase.
    ///
    /// @param phase the treatment phase, not null
    /// @param action the action to check, not null
    /// @return `true` if the table allows the action
    public static boolean isAvailable(TreatmentPhase phase, Action action) {
        return switch (phase) {
            case NAIVE, LATE_POSTOP, LATE_POSTRAD, RECURRENT -> true;
            case EARLY_POSTOP -> EARLY_POSTOP.contains(action);
            case EARLY_POSTRAD -> EARLY_POSTRAD.contains(action);
        };
    }

    private static Set<Action> allExcept(Action.Kind excluded) {
        Set<Action> actions = EnumSet.noneOf(Action.class);
        for (Action action : Action.values()) {
            if (action.kind() != excluded) {
                actions.add(action);
            }
        }
        return actions;
    }
}
