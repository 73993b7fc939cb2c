package FSA;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSA.Model.Automaton;
import FSA.Model.DFA;
import FSA.Model.Transition;

/**
 * Forward reachability from the initial state, written against {@link Automaton#step(String, String)} so it serves
 * both automaton kinds.
 */
public final class Reachability {

    private Reachability() {}

    /**
     * @return states reachable from the initial state, in breadth-first discovery order
     */
    public static Set<String> reachableStates(Automaton<?> automaton) {
        Validator.validate(automaton);

        final Set<String> visited = new LinkedHashSet<>();
        final Deque<String> queue = new ArrayDeque<>();
        final List<String> symbols = symbols(automaton);

        visited.add(automaton.getInitialState());
        queue.add(automaton.getInitialState());

        while (!queue.isEmpty()) {
            String state = queue.poll();
            for (String symbol : symbols) {
                for (String succ : automaton.step(state, symbol)) {
                    if (visited.add(succ)) {
                        queue.add(succ);
                    }
                }
            }
        }
        return visited;
    }

    /**
     * @return {@code true} if no accepting state is reachable, i.e. the automaton accepts no word
     */
    public static boolean isEmpty(Automaton<?> automaton) {
        for (String state : reachableStates(automaton)) {
            if (automaton.isFinal(state)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Copy of {@code dfa} without the states that cannot be reached from its initial state.
     */
    public static DFA restrictToReachable(DFA dfa) {
        final Set<String> reachable = reachableStates(dfa);
        if (reachable.size() == dfa.size()) {
            return dfa;
        }

        final Map<String, Map<String, String>> delta = new HashMap<>();
        for (Transition t : dfa.getTransitions()) {
            if (reachable.contains(t.source())) {
                delta.computeIfAbsent(t.source(), k -> new HashMap<>()).put(t.symbol(), t.target());
            }
        }
        final Set<String> finals = new HashSet<>(dfa.getFinalStates());
        finals.retainAll(reachable);
        return new DFA(reachable, dfa.getAlphabet(), delta, dfa.getInitialState(), finals);
    }

    /**
     * Symbols to follow from every state: epsilon first for NFAs, then the alphabet in order.
     */
    static List<String> symbols(Automaton<?> automaton) {
        final List<String> symbols = new ArrayList<>(automaton.getAlphabet().size() + 1);
        if (!automaton.isDeterministic()) {
            symbols.add(Automaton.EPSILON);
        }
        symbols.addAll(automaton.getAlphabet());
        return symbols;
    }
}
