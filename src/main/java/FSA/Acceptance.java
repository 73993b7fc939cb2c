package FSA;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import FSA.Errors.InputException;
import FSA.Model.Automaton;
import FSA.Model.DFA;
import FSA.Model.NFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs automata over input words.
 * <p>
 * The whole word is checked against the alphabet before the run starts, so an undeclared symbol is reported even
 * if the run would have rejected earlier.
 */
public final class Acceptance {
    private static final Logger LOG = LoggerFactory.getLogger(Acceptance.class);

    private Acceptance() {}

    public static boolean accepts(DFA dfa, List<String> word) {
        Validator.validate(dfa);
        checkWord(dfa, word);

        String current = dfa.getInitialState();
        for (String symbol : word) {
            current = dfa.getTransition(current, symbol);
            if (current == null) {
                // undefined transition: plain rejection
                return false;
            }
        }
        return dfa.isFinal(current);
    }

    /**
     * Simulates the NFA on the set of active states. An explicit epsilon token in {@code word} consumes nothing.
     */
    public static boolean accepts(NFA nfa, List<String> word) {
        Validator.validate(nfa);
        checkWord(nfa, word);

        Set<String> active = EpsilonClosure.closure(nfa, nfa.getInitialState());
        for (String symbol : word) {
            if (Automaton.EPSILON.equals(symbol)) {
                continue; // active is already epsilon-closed
            }
            Set<String> moved = new HashSet<>();
            for (String state : active) {
                moved.addAll(nfa.step(state, symbol));
            }
            active = EpsilonClosure.closure(nfa, moved);
            LOG.trace("{} -> {}", symbol, active);
            if (active.isEmpty()) {
                return false;
            }
        }
        for (String state : active) {
            if (nfa.isFinal(state)) {
                return true;
            }
        }
        return false;
    }

    private static void checkWord(Automaton<?> automaton, List<String> word) {
        for (int i = 0; i < word.size(); i++) {
            String symbol = word.get(i);
            if (symbol == null || !isInputSymbol(automaton, symbol)) {
                throw new InputException(String.valueOf(symbol), i);
            }
        }
    }

    private static boolean isInputSymbol(Automaton<?> automaton, String symbol) {
        return Validator.isTransitionSymbol(automaton, symbol);
    }
}
