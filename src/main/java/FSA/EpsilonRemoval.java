package FSA;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import FSA.Model.Automaton;
import FSA.Model.NFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an equivalent epsilon-free NFA over the same states.
 */
public final class EpsilonRemoval {
    private static final Logger LOG = LoggerFactory.getLogger(EpsilonRemoval.class);

    private EpsilonRemoval() {}

    public static boolean hasEpsilonTransitions(NFA nfa) {
        for (String source : nfa.getTransitionSources()) {
            if (nfa.getSymbolsFrom(source).contains(Automaton.EPSILON)) {
                return true;
            }
        }
        return false;
    }

    /**
     * delta'(s, a) is the union of delta(s', a) over s' in closure(s). A state becomes accepting if its closure
     * contains an accepting state.
     */
    public static NFA removeEpsilonTransitions(NFA nfa) {
        Validator.validate(nfa);

        final Map<String, Map<String, Set<String>>> delta = new HashMap<>();
        final Set<String> finals = new HashSet<>(nfa.getFinalStates());

        for (String state : nfa.getStates()) {
            Set<String> closure = EpsilonClosure.closure(nfa, state);

            for (String c : closure) {
                if (nfa.isFinal(c)) {
                    finals.add(state);
                    break;
                }
            }

            for (String symbol : nfa.getAlphabet()) {
                Set<String> targets = new TreeSet<>();
                for (String c : closure) {
                    targets.addAll(nfa.step(c, symbol));
                }
                if (!targets.isEmpty()) {
                    delta.computeIfAbsent(state, k -> new HashMap<>()).put(symbol, targets);
                }
            }
        }

        LOG.debug("Removed epsilon transitions: {} -> {} final states", nfa.getFinalStates().size(), finals.size());
        return new NFA(nfa.getStates(), nfa.getAlphabet(), delta, nfa.getInitialState(), finals);
    }
}
