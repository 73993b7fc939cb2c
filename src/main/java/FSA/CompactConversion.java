package FSA;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSA.Model.Automaton;
import FSA.Model.DFA;
import FSA.Model.NFA;
import FSA.Model.Transition;
import FSA.Registry.Labels;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversion between the string-labelled automata and AutomataLib's compact, integer-indexed automata.
 */
public final class CompactConversion {
    /**
     * Symbol used for epsilon edges in converted NFAs, primed if the alphabet already uses it.
     */
    public static final String EPSILON_SYMBOL = "ε";

    private CompactConversion() {}

    /**
     * A compact automaton together with the original label of each of its integer states.
     */
    public record CompactView<A>(A automaton, Alphabet<String> alphabet, List<String> labels) {
        public String label(int state) {
            return labels.get(state);
        }
    }

    public static CompactView<CompactDFA<String>> toCompactDFA(DFA dfa) {
        Validator.validate(dfa);

        final Alphabet<String> alphabet = Alphabets.fromCollection(dfa.getAlphabet());
        final CompactDFA<String> out = new CompactDFA<>(alphabet, dfa.size());
        final List<String> labels = new ArrayList<>(dfa.getStates());
        final Object2IntMap<String> index = indexOf(labels);

        for (String state : labels) {
            out.addState(dfa.isFinal(state));
        }
        out.setInitialState(index.getInt(dfa.getInitialState()));
        for (Transition t : dfa.getTransitions()) {
            out.setTransition(index.getInt(t.source()), t.symbol(), (Integer) index.getInt(t.target()));
        }
        return new CompactView<>(out, alphabet, labels);
    }

    /**
     * Epsilon transitions, if any, become edges on {@link #EPSILON_SYMBOL}, which is then part of the compact
     * alphabet. Remove epsilon transitions first when the result is used for anything but display.
     */
    public static CompactView<CompactNFA<String>> toCompactNFA(NFA nfa) {
        Validator.validate(nfa);

        final boolean epsilon = EpsilonRemoval.hasEpsilonTransitions(nfa);
        final String epsilonSymbol = Labels.fresh(EPSILON_SYMBOL, nfa.getAlphabet());
        final List<String> symbols = new ArrayList<>(nfa.getAlphabet());
        if (epsilon) {
            symbols.add(epsilonSymbol);
        }

        final Alphabet<String> alphabet = Alphabets.fromCollection(symbols);
        final CompactNFA<String> out = new CompactNFA<>(alphabet, nfa.size());
        final List<String> labels = new ArrayList<>(nfa.getStates());
        final Object2IntMap<String> index = indexOf(labels);

        for (String state : labels) {
            out.addState(nfa.isFinal(state));
        }
        out.setInitial(index.getInt(nfa.getInitialState()), true);
        for (Transition t : nfa.getTransitions()) {
            String symbol = t.isEpsilon() ? epsilonSymbol : t.symbol();
            out.addTransition(index.getInt(t.source()), symbol, index.getInt(t.target()));
        }
        return new CompactView<>(out, alphabet, labels);
    }

    /**
     * States of the result are named {@code q<id>} after the compact state ids.
     *
     * @throws IllegalArgumentException if {@code dfa} has no initial state
     */
    public static DFA fromCompactDFA(CompactDFA<String> dfa) {
        final Integer init = dfa.getInitialState();
        if (init == null) {
            throw new IllegalArgumentException("Compact DFA has no initial state");
        }

        final Set<String> states = new HashSet<>();
        final Set<String> finals = new HashSet<>();
        final Map<String, Map<String, String>> delta = new HashMap<>();

        for (Integer state : dfa.getStates()) {
            String label = Automaton.DEFAULT_PREFIX + state;
            states.add(label);
            if (dfa.isAccepting(state)) {
                finals.add(label);
            }
            for (String symbol : dfa.getInputAlphabet()) {
                Integer succ = dfa.getTransition(state, symbol);
                if (succ != null) {
                    delta.computeIfAbsent(label, k -> new HashMap<>()).put(symbol, Automaton.DEFAULT_PREFIX + succ);
                }
            }
        }
        return new DFA(states, new HashSet<>(dfa.getInputAlphabet()), delta, Automaton.DEFAULT_PREFIX + init, finals);
    }

    private static Object2IntMap<String> indexOf(List<String> labels) {
        final Object2IntMap<String> index = new Object2IntOpenHashMap<>(labels.size());
        for (int i = 0; i < labels.size(); i++) {
            index.put(labels.get(i), i);
        }
        return index;
    }
}
