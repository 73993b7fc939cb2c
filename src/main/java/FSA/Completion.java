package FSA;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import FSA.Model.DFA;
import FSA.Model.NFA;
import FSA.Model.Transition;
import FSA.Registry.Labels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes transition functions total by routing every undefined (state, symbol) pair to a fresh, non-accepting trap
 * state that loops on every symbol.
 */
public final class Completion {
    private static final Logger LOG = LoggerFactory.getLogger(Completion.class);

    private Completion() {}

    public static boolean isComplete(DFA dfa) {
        for (String state : dfa.getStates()) {
            for (String symbol : dfa.getAlphabet()) {
                if (dfa.getTransition(state, symbol) == null) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return {@code dfa} itself if it is already complete, otherwise a completed copy
     */
    public static DFA complete(DFA dfa) {
        Validator.validate(dfa);
        if (isComplete(dfa)) {
            return dfa;
        }

        final String trap = Labels.fresh(Labels.TRAP, dfa.getStates());
        final Set<String> states = new HashSet<>(dfa.getStates());
        states.add(trap);

        final Map<String, Map<String, String>> delta = new HashMap<>();
        for (Transition t : dfa.getTransitions()) {
            delta.computeIfAbsent(t.source(), k -> new HashMap<>()).put(t.symbol(), t.target());
        }
        for (String state : states) {
            Map<String, String> row = delta.computeIfAbsent(state, k -> new HashMap<>());
            for (String symbol : dfa.getAlphabet()) {
                row.putIfAbsent(symbol, trap);
            }
        }

        LOG.debug("Completed DFA with trap state {}", trap);
        return new DFA(states, dfa.getAlphabet(), delta, dfa.getInitialState(), dfa.getFinalStates());
    }

    public static boolean isComplete(NFA nfa) {
        for (String state : nfa.getStates()) {
            for (String symbol : nfa.getAlphabet()) {
                if (nfa.step(state, symbol).isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Completes an epsilon-free NFA: every (state, symbol) pair without successors moves to the trap state.
     *
     * @throws IllegalArgumentException if {@code nfa} has epsilon transitions
     */
    public static NFA complete(NFA nfa) {
        Validator.validate(nfa);
        if (EpsilonRemoval.hasEpsilonTransitions(nfa)) {
            throw new IllegalArgumentException("Completion requires an epsilon-free NFA");
        }
        if (isComplete(nfa)) {
            return nfa;
        }

        final String trap = Labels.fresh(Labels.TRAP, nfa.getStates());
        final Set<String> states = new HashSet<>(nfa.getStates());
        states.add(trap);

        final Map<String, Map<String, Set<String>>> delta = new HashMap<>();
        for (String state : states) {
            Map<String, Set<String>> row = new HashMap<>();
            for (String symbol : nfa.getAlphabet()) {
                Set<String> targets = nfa.step(state, symbol);
                row.put(symbol, targets.isEmpty() ? Set.of(trap) : targets);
            }
            delta.put(state, row);
        }

        LOG.debug("Completed NFA with trap state {}", trap);
        return new NFA(states, nfa.getAlphabet(), delta, nfa.getInitialState(), nfa.getFinalStates());
    }
}
