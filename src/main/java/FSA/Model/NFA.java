package FSA.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import FSA.Acceptance;
import FSA.BooleanOperations;
import FSA.EpsilonClosure;
import FSA.EpsilonRemoval;
import FSA.Minimizer;
import FSA.PowersetDeterminizer;
import FSA.Validator;

/**
 * Non-deterministic finite automaton. Transitions map (state, symbol) to a set of states; the symbol
 * {@link #EPSILON} denotes an epsilon transition.
 */
public class NFA extends Automaton<NFA> {
    private SortedMap<String, SortedMap<String, SortedSet<String>>> transitions;

    public NFA(Set<String> states,
               Set<String> alphabet,
               Map<String, ? extends Map<String, ? extends Set<String>>> transitions,
               String initialState,
               Set<String> finalStates) {
        super(states, alphabet, initialState, finalStates);
        this.transitions = copyOf(Objects.requireNonNull(transitions, "transitions"));
    }

    private static SortedMap<String, SortedMap<String, SortedSet<String>>> copyOf(
            Map<String, ? extends Map<String, ? extends Set<String>>> table) {
        SortedMap<String, SortedMap<String, SortedSet<String>>> copy = new TreeMap<>();
        table.forEach((source, row) -> {
            SortedMap<String, SortedSet<String>> rowCopy = new TreeMap<>();
            Objects.requireNonNull(row, "transitions of " + source).forEach((symbol, targets) ->
                rowCopy.put(Objects.requireNonNull(symbol),
                    new TreeSet<>(Objects.requireNonNull(targets, "targets of " + source))));
            copy.put(Objects.requireNonNull(source), rowCopy);
        });
        return copy;
    }

    @Override
    public boolean isDeterministic() {
        return false;
    }

    @Override
    public Set<String> step(String state, String symbol) {
        SortedMap<String, SortedSet<String>> row = transitions.get(state);
        if (row == null) {
            return Collections.emptySet();
        }
        SortedSet<String> targets = row.get(symbol);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
    }

    @Override
    public Set<String> getTransitionSources() {
        return Collections.unmodifiableSet(transitions.keySet());
    }

    @Override
    public Set<String> getSymbolsFrom(String state) {
        SortedMap<String, SortedSet<String>> row = transitions.get(state);
        return row == null ? Collections.emptySet() : Collections.unmodifiableSet(row.keySet());
    }

    @Override
    public List<Transition> getTransitions() {
        List<Transition> result = new ArrayList<>();
        transitions.forEach((source, row) -> row.forEach((symbol, targets) -> {
            for (String target : targets) {
                result.add(new Transition(source, symbol, target));
            }
        }));
        return result;
    }

    public boolean hasEpsilonTransitions() {
        return EpsilonRemoval.hasEpsilonTransitions(this);
    }

    /**
     * @return all states reachable from {@code states} through zero or more epsilon transitions
     * @throws FSA.Errors.StructuralException if one of {@code states} is undeclared
     */
    public Set<String> epsilonClosure(Set<String> states) {
        Validator.validate(this);
        Validator.validateStates(this, states);
        return EpsilonClosure.closure(this, states);
    }

    @Override
    public boolean accept(List<String> word) {
        return Acceptance.accepts(this, word);
    }

    public NFA removeEpsilonTransitions() {
        return EpsilonRemoval.removeEpsilonTransitions(this);
    }

    public DFA toDFA() {
        return PowersetDeterminizer.determinize(this);
    }

    @Override
    public NFA complement() {
        return BooleanOperations.complement(this);
    }

    /**
     * Determinizes, minimizes and lifts the result back; states are renumbered.
     */
    @Override
    public NFA minimize() {
        return Minimizer.minimize(this);
    }

    @Override
    public NFA union(NFA other) {
        return BooleanOperations.union(this, other);
    }

    @Override
    public NFA intersection(NFA other) {
        return BooleanOperations.intersection(this, other);
    }

    @Override
    public NFA product(NFA other) {
        return BooleanOperations.product(this, other);
    }

    @Override
    public NFA relabeled(Map<String, String> mapping) {
        checkInjective(mapping);
        SortedMap<String, SortedMap<String, SortedSet<String>>> renamed = new TreeMap<>();
        transitions.forEach((source, row) -> {
            SortedMap<String, SortedSet<String>> renamedRow = new TreeMap<>();
            row.forEach((symbol, targets) -> renamedRow.put(symbol, rename(mapping, targets)));
            renamed.put(rename(mapping, source), renamedRow);
        });
        return new NFA(rename(mapping, states), alphabet, renamed, rename(mapping, initialState),
            rename(mapping, finalStates));
    }

    @Override
    protected void adopt(NFA other) {
        adoptCommon(other);
        this.transitions = copyOf(other.transitions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NFA)) {
            return false;
        }
        NFA other = (NFA) o;
        return states.equals(other.states) && alphabet.equals(other.alphabet)
            && transitions.equals(other.transitions) && initialState.equals(other.initialState)
            && finalStates.equals(other.finalStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, transitions, initialState, finalStates);
    }
}
