package FSA;

import java.util.Collection;
import java.util.Set;

import FSA.Errors.AlphabetException;
import FSA.Errors.StructuralException;
import FSA.Errors.StructuralException.Invariant;
import FSA.Model.Automaton;

/**
 * Checks the structural invariants of an automaton. Every algorithm runs this before trusting its input.
 */
public final class Validator {

    private Validator() {}

    /**
     * @param automaton automaton to check
     * @throws AlphabetException if the alphabet declares the epsilon symbol, or a transition uses an undeclared symbol
     * @throws StructuralException if the initial state, a final state or a transition endpoint is undeclared
     */
    public static void validate(Automaton<?> automaton) {
        final Set<String> states = automaton.getStates();

        for (String symbol : automaton.getAlphabet()) {
            if (Automaton.EPSILON.equals(symbol)) {
                throw new AlphabetException(symbol, "The empty symbol is reserved for epsilon transitions");
            }
        }

        if (!states.contains(automaton.getInitialState())) {
            throw new StructuralException(Invariant.INITIAL_STATE, automaton.getInitialState());
        }

        for (String f : automaton.getFinalStates()) {
            if (!states.contains(f)) {
                throw new StructuralException(Invariant.FINAL_STATE, f);
            }
        }

        for (String source : automaton.getTransitionSources()) {
            if (!states.contains(source)) {
                throw new StructuralException(Invariant.TRANSITION_SOURCE, source);
            }
            for (String symbol : automaton.getSymbolsFrom(source)) {
                if (!isTransitionSymbol(automaton, symbol)) {
                    throw new AlphabetException(symbol, "Transition symbol of " + source + " is not declared in the alphabet");
                }
                for (String target : automaton.step(source, symbol)) {
                    if (!states.contains(target)) {
                        throw new StructuralException(Invariant.TRANSITION_TARGET, target);
                    }
                }
            }
        }
    }

    /**
     * @throws StructuralException if one of {@code arguments} is not a state of {@code automaton}
     */
    public static void validateStates(Automaton<?> automaton, Collection<String> arguments) {
        for (String state : arguments) {
            if (!automaton.getStates().contains(state)) {
                throw new StructuralException(Invariant.ARGUMENT_STATE, state);
            }
        }
    }

    static boolean isTransitionSymbol(Automaton<?> automaton, String symbol) {
        return automaton.getAlphabet().contains(symbol)
            || (!automaton.isDeterministic() && Automaton.EPSILON.equals(symbol));
    }
}
