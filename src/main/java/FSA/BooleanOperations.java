package FSA;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import FSA.Model.DFA;
import FSA.Model.NFA;
import FSA.Model.ProductAcceptance;
import FSA.Model.Transition;

/**
 * Boolean algebra of regular languages. Binary operations are reachable products that differ only in their
 * {@link ProductAcceptance}; {@code product} is the full cross product with the intersection predicate.
 */
public final class BooleanOperations {

    private BooleanOperations() {}

    /**
     * Completes {@code dfa} and swaps accepting and rejecting states.
     */
    public static DFA complement(DFA dfa) {
        final DFA complete = Completion.complete(dfa);

        final Set<String> finals = new TreeSet<>(complete.getStates());
        finals.removeAll(complete.getFinalStates());

        final Map<String, Map<String, String>> delta = new HashMap<>();
        for (Transition t : complete.getTransitions()) {
            delta.computeIfAbsent(t.source(), k -> new HashMap<>()).put(t.symbol(), t.target());
        }
        return new DFA(complete.getStates(), complete.getAlphabet(), delta, complete.getInitialState(), finals);
    }

    /**
     * Complement through the subset construction, lifted back to an NFA.
     */
    public static NFA complement(NFA nfa) {
        return DFAEmbedding.toNFA(complement(PowersetDeterminizer.determinize(nfa)));
    }

    public static DFA union(DFA left, DFA right) {
        return ProductConstruction.product(left, right, ProductAcceptance.union());
    }

    public static DFA intersection(DFA left, DFA right) {
        return ProductConstruction.product(left, right, ProductAcceptance.intersection());
    }

    public static DFA difference(DFA left, DFA right) {
        return ProductConstruction.product(left, right, ProductAcceptance.difference());
    }

    public static DFA symmetricDifference(DFA left, DFA right) {
        return ProductConstruction.product(left, right, ProductAcceptance.symmetricDifference());
    }

    public static DFA product(DFA left, DFA right) {
        return ProductConstruction.fullProduct(left, right, ProductAcceptance.intersection());
    }

    public static NFA union(NFA left, NFA right) {
        return ProductConstruction.product(left, right, ProductAcceptance.union());
    }

    public static NFA intersection(NFA left, NFA right) {
        return ProductConstruction.product(left, right, ProductAcceptance.intersection());
    }

    public static NFA product(NFA left, NFA right) {
        return ProductConstruction.fullProduct(left, right, ProductAcceptance.intersection());
    }
}
