package FSA.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import FSA.Renumbering;
import FSA.Validator;

/**
 * Common shape of deterministic and non-deterministic finite automata over string-labelled states.
 * <p>
 * Both kinds expose the same stepping capability, {@link #step(String, String)}, which is what the shape-agnostic
 * algorithms (reachability, product construction) are written against. Apart from {@link #renumber()}, every
 * operation leaves the receiver untouched and returns a new automaton.
 *
 * @param <A> the concrete automaton kind
 */
public abstract class Automaton<A extends Automaton<A>> {
    /**
     * Reserved symbol for epsilon transitions. Never a member of a declared alphabet.
     */
    public static final String EPSILON = "";

    public static final String DEFAULT_PREFIX = "q";

    protected SortedSet<String> states;
    protected final SortedSet<String> alphabet;
    protected String initialState;
    protected SortedSet<String> finalStates;

    protected Automaton(Set<String> states, Set<String> alphabet, String initialState, Set<String> finalStates) {
        this.states = new TreeSet<>(Objects.requireNonNull(states, "states"));
        this.alphabet = new TreeSet<>(Objects.requireNonNull(alphabet, "alphabet"));
        this.initialState = Objects.requireNonNull(initialState, "initialState");
        this.finalStates = new TreeSet<>(Objects.requireNonNull(finalStates, "finalStates"));
    }

    public SortedSet<String> getStates() {
        return Collections.unmodifiableSortedSet(states);
    }

    public SortedSet<String> getAlphabet() {
        return Collections.unmodifiableSortedSet(alphabet);
    }

    public String getInitialState() {
        return initialState;
    }

    public SortedSet<String> getFinalStates() {
        return Collections.unmodifiableSortedSet(finalStates);
    }

    public boolean isFinal(String state) {
        return finalStates.contains(state);
    }

    public int size() {
        return states.size();
    }

    public abstract boolean isDeterministic();

    /**
     * Successors of {@code state} on {@code symbol}, without any epsilon closure.
     * A deterministic automaton yields at most one state. Missing entries yield the empty set.
     */
    public abstract Set<String> step(String state, String symbol);

    /**
     * @return states that have an entry in the transition function
     */
    public abstract Set<String> getTransitionSources();

    /**
     * @return symbols (possibly {@link #EPSILON}) that have an entry for {@code state}
     */
    public abstract Set<String> getSymbolsFrom(String state);

    /**
     * Flat view of the transition function, one element per (source, symbol, target) edge.
     */
    public abstract List<Transition> getTransitions();

    /**
     * @return {@code true} if all structural invariants hold
     * @throws FSA.Errors.StructuralException if a state referenced by the automaton is undeclared
     * @throws FSA.Errors.AlphabetException if a transition symbol is undeclared
     */
    public boolean isValid() {
        Validator.validate(this);
        return true;
    }

    /**
     * Runs the automaton over {@code input}, reading one symbol per code point.
     *
     * @throws FSA.Errors.InputException if {@code input} contains a symbol outside the alphabet
     */
    public boolean accept(String input) {
        return accept(symbolsOf(input));
    }

    /**
     * Runs the automaton over a word of symbol tokens, for alphabets whose symbols span several characters.
     *
     * @throws FSA.Errors.InputException if {@code word} contains a symbol outside the alphabet
     */
    public abstract boolean accept(List<String> word);

    public abstract A complement();

    public abstract A minimize();

    public abstract A union(A other);

    public abstract A intersection(A other);

    public abstract A product(A other);

    /**
     * Copy of this automaton with every state renamed through {@code mapping}.
     *
     * @param mapping injective renaming, defined for every state
     */
    public abstract A relabeled(Map<String, String> mapping);

    /**
     * Replaces this automaton's structure with that of {@code other}. Used by the in-place renumbering only.
     */
    protected abstract void adopt(A other);

    public A renumbered() {
        return renumbered(DEFAULT_PREFIX);
    }

    public A renumbered(String prefix) {
        return relabeled(Renumbering.canonicalLabels(this, prefix));
    }

    /**
     * Renames the states of this automaton in place, in breadth-first order from the initial state.
     * This is the only mutating operation; callers need exclusive access to the receiver while it runs.
     * Equality and hash code change with the labels, so do not renumber an automaton held in a hashed collection.
     */
    public void renumber() {
        renumber(DEFAULT_PREFIX);
    }

    public void renumber(String prefix) {
        adopt(renumbered(prefix));
    }

    protected void adoptCommon(Automaton<?> other) {
        this.states = new TreeSet<>(other.states);
        this.initialState = other.initialState;
        this.finalStates = new TreeSet<>(other.finalStates);
    }

    protected static String rename(Map<String, String> mapping, String state) {
        String renamed = mapping.get(state);
        if (renamed == null) {
            throw new IllegalArgumentException("No new label for state " + state);
        }
        return renamed;
    }

    protected static SortedSet<String> rename(Map<String, String> mapping, Set<String> states) {
        SortedSet<String> renamed = new TreeSet<>();
        for (String state : states) {
            renamed.add(rename(mapping, state));
        }
        return renamed;
    }

    protected void checkInjective(Map<String, String> mapping) {
        if (new HashSet<>(mapping.values()).size() != mapping.size()) {
            throw new IllegalArgumentException("Relabeling must be injective: " + mapping);
        }
    }

    /**
     * Splits {@code input} into single code point symbols.
     */
    public static List<String> symbolsOf(String input) {
        Objects.requireNonNull(input, "input");
        List<String> symbols = new ArrayList<>(input.length());
        input.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return symbols;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{states=" + states + ", alphabet=" + alphabet
            + ", initial=" + initialState + ", final=" + finalStates + ", transitions=" + getTransitions() + "}";
    }
}
