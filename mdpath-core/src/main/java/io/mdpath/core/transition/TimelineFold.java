package io.mdpath.core.transition;

import io.mdpath.core.stratification.StratificationKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Immutable accumulator threaded through one patient's visit pairs.
///
/// Each step returns a new fold holding the key for subsequent pairs, so a grade change
/// only affects transitions built after it.
///
/// @param currentKey key in force for the next pair, not null
/// @param keys key per visit seen so far, never null
/// @param transitions transitions built so far, never null
public record TimelineFold(
        StratificationKey currentKey, List<StratificationKey> keys, List<RawTransition> transitions) {

    public TimelineFold {
        Objects.requireNonNull(currentKey, "currentKey");
        keys = List.copyOf(keys);
        transitions = List.copyOf(transitions);
    }

    /// Starts a fold at the first visit.
    ///
    /// @param initialKey key of the first visit, not null
    /// @return fold with one key and no transitions, never null
    public static TimelineFold start(StratificationKey initialKey) {
        return new TimelineFold(initialKey, List.of(initialKey), List.of());
    }

    /// Appends one transition and moves the current key to its destination graph.
    ///
    /// @param transition the transition built from the current key, not null
    /// @return the next fold, never null
    public TimelineFold step(RawTransition transition) {
        if (!transition.fromGraph().equals(currentKey)) {
            throw new IllegalStateException(
                    "Transition built from " + transition.fromGraph() + " but current key is " + currentKey);
        }
        List<StratificationKey> nextKeys = new ArrayList<>(keys);
        nextKeys.add(transition.toGraph());
        List<RawTransition> nextTransitions = new ArrayList<>(transitions);
        nextTransitions.add(transition);
        return new TimelineFold(transition.toGraph(), nextKeys, nextTransitions);
    }
}
