package FSA;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;

import FSA.Model.Automaton;
import FSA.Model.NFA;

/**
 * Reachability over epsilon transitions.
 */
public final class EpsilonClosure {

    private EpsilonClosure() {}

    /**
     * Smallest superset of {@code states} closed under epsilon transitions.
     * The visited set makes this terminate on cyclic epsilon graphs.
     */
    public static Set<String> closure(NFA nfa, Collection<String> states) {
        final Set<String> result = new TreeSet<>(states);
        final Deque<String> worklist = new ArrayDeque<>(states);

        while (!worklist.isEmpty()) {
            String state = worklist.pop();
            for (String succ : nfa.step(state, Automaton.EPSILON)) {
                if (result.add(succ)) {
                    worklist.push(succ);
                }
            }
        }
        return result;
    }

    public static Set<String> closure(NFA nfa, String state) {
        return closure(nfa, Collections.singleton(state));
    }
}
