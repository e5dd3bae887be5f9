package io.mdpath.core.transition;

import io.mdpath.core.action.Action;
import io.mdpath.core.state.StateId;
import io.mdpath.core.stratification.StratificationKey;
import java.util.Comparator;
import java.util.Objects;

/// Identity of an aggregated edge within its source graph.
///
/// Together with the owning graph's key this is the 5-tuple
/// (from graph, from state, action, to graph, to state) edges are deduplicated by.
///
/// @param fromState source state, not null
/// @param action action taken, not null
/// @param toGraph destination graph, not null
/// @param toState destination state, not null
public record EdgeKey(StateId fromState, Action action, StratificationKey toGraph, StateId toState)
        implements Comparable<EdgeKey> {

    private static final Comparator<EdgeKey> ORDER =
            Comparator.comparing(EdgeKey::fromState)
                    .thenComparing(EdgeKey::action)
                    .thenComparing(EdgeKey::toGraph)
                    .thenComparing(EdgeKey::toState);

    public EdgeKey {
        Objects.requireNonNull(fromState, "fromState");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(toGraph, "toGraph");
        Objects.requireNonNull(toState, "toState");
    }

    @Override
    public int compareTo(EdgeKey o) {
        return ORDER.compare(this, o);
    }
}
