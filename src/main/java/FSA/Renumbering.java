package FSA;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import FSA.Model.Automaton;

/**
 * Canonical relabeling: states are numbered in breadth-first order from the initial state, following epsilon first
 * and then the alphabet in sorted order. Unreachable states keep their sorted order after the reachable ones.
 */
public final class Renumbering {

    private Renumbering() {}

    public static Map<String, String> canonicalLabels(Automaton<?> automaton, String prefix) {
        Objects.requireNonNull(prefix, "prefix");

        final Map<String, String> mapping = new LinkedHashMap<>();
        for (String state : Reachability.reachableStates(automaton)) {
            mapping.put(state, prefix + mapping.size());
        }
        for (String state : automaton.getStates()) {
            if (!mapping.containsKey(state)) {
                mapping.put(state, prefix + mapping.size());
            }
        }
        return mapping;
    }
}
