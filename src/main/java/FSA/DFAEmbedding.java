package FSA;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import FSA.Model.DFA;
import FSA.Model.NFA;
import FSA.Model.Transition;

/**
 * Views a DFA as an NFA: every defined transition becomes a singleton target set. Adds no epsilon transitions.
 */
public final class DFAEmbedding {

    private DFAEmbedding() {}

    public static NFA toNFA(DFA dfa) {
        Validator.validate(dfa);

        final Map<String, Map<String, Set<String>>> delta = new HashMap<>();
        for (Transition t : dfa.getTransitions()) {
            delta.computeIfAbsent(t.source(), k -> new HashMap<>()).put(t.symbol(), Set.of(t.target()));
        }
        return new NFA(dfa.getStates(), dfa.getAlphabet(), delta, dfa.getInitialState(), dfa.getFinalStates());
    }
}
