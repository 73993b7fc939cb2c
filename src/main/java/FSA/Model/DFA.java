package FSA.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import FSA.Acceptance;
import FSA.BooleanOperations;
import FSA.Completion;
import FSA.DFAEmbedding;
import FSA.Minimizer;

/**
 * Deterministic finite automaton with a partial transition function.
 * A missing (state, symbol) entry rejects the input; it is not an error.
 */
public class DFA extends Automaton<DFA> {
    private SortedMap<String, SortedMap<String, String>> transitions;

    public DFA(Set<String> states,
               Set<String> alphabet,
               Map<String, ? extends Map<String, String>> transitions,
               String initialState,
               Set<String> finalStates) {
        super(states, alphabet, initialState, finalStates);
        this.transitions = copyOf(Objects.requireNonNull(transitions, "transitions"));
    }

    private static SortedMap<String, SortedMap<String, String>> copyOf(Map<String, ? extends Map<String, String>> table) {
        SortedMap<String, SortedMap<String, String>> copy = new TreeMap<>();
        table.forEach((source, row) -> {
            SortedMap<String, String> rowCopy = new TreeMap<>();
            Objects.requireNonNull(row, "transitions of " + source).forEach((symbol, target) ->
                rowCopy.put(Objects.requireNonNull(symbol), Objects.requireNonNull(target, "target of " + source)));
            copy.put(Objects.requireNonNull(source), rowCopy);
        });
        return copy;
    }

    @Override
    public boolean isDeterministic() {
        return true;
    }

    /**
     * @return the successor of {@code state} on {@code symbol}, or {@code null} if undefined
     */
    public String getTransition(String state, String symbol) {
        SortedMap<String, String> row = transitions.get(state);
        return row == null ? null : row.get(symbol);
    }

    @Override
    public Set<String> step(String state, String symbol) {
        String target = getTransition(state, symbol);
        return target == null ? Collections.emptySet() : Collections.singleton(target);
    }

    @Override
    public Set<String> getTransitionSources() {
        return Collections.unmodifiableSet(transitions.keySet());
    }

    @Override
    public Set<String> getSymbolsFrom(String state) {
        SortedMap<String, String> row = transitions.get(state);
        return row == null ? Collections.emptySet() : Collections.unmodifiableSet(row.keySet());
    }

    @Override
    public List<Transition> getTransitions() {
        List<Transition> result = new ArrayList<>();
        transitions.forEach((source, row) ->
            row.forEach((symbol, target) -> result.add(new Transition(source, symbol, target))));
        return result;
    }

    /**
     * @return {@code true} if every state has a transition on every alphabet symbol
     */
    public boolean isComplete() {
        return Completion.isComplete(this);
    }

    @Override
    public boolean accept(List<String> word) {
        return Acceptance.accepts(this, word);
    }

    public DFA complete() {
        return Completion.complete(this);
    }

    public NFA toNFA() {
        return DFAEmbedding.toNFA(this);
    }

    @Override
    public DFA complement() {
        return BooleanOperations.complement(this);
    }

    @Override
    public DFA minimize() {
        return Minimizer.minimize(this);
    }

    @Override
    public DFA union(DFA other) {
        return BooleanOperations.union(this, other);
    }

    @Override
    public DFA intersection(DFA other) {
        return BooleanOperations.intersection(this, other);
    }

    public DFA difference(DFA other) {
        return BooleanOperations.difference(this, other);
    }

    public DFA symmetricDifference(DFA other) {
        return BooleanOperations.symmetricDifference(this, other);
    }

    @Override
    public DFA product(DFA other) {
        return BooleanOperations.product(this, other);
    }

    @Override
    public DFA relabeled(Map<String, String> mapping) {
        checkInjective(mapping);
        SortedMap<String, SortedMap<String, String>> renamed = new TreeMap<>();
        transitions.forEach((source, row) -> {
            SortedMap<String, String> renamedRow = new TreeMap<>();
            row.forEach((symbol, target) -> renamedRow.put(symbol, rename(mapping, target)));
            renamed.put(rename(mapping, source), renamedRow);
        });
        return new DFA(rename(mapping, states), alphabet, renamed, rename(mapping, initialState),
            rename(mapping, finalStates));
    }

    @Override
    protected void adopt(DFA other) {
        adoptCommon(other);
        this.transitions = copyOf(other.transitions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DFA)) {
            return false;
        }
        DFA other = (DFA) o;
        return states.equals(other.states) && alphabet.equals(other.alphabet)
            && transitions.equals(other.transitions) && initialState.equals(other.initialState)
            && finalStates.equals(other.finalStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, transitions, initialState, finalStates);
    }
}
