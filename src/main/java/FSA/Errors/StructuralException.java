package FSA.Errors;

/**
 * An automaton references a state that is not declared in its state set.
 */
public class StructuralException extends AutomatonException {

    public enum Invariant {
        INITIAL_STATE("Initial state is not declared in the state set"),
        FINAL_STATE("Final state is not declared in the state set"),
        TRANSITION_SOURCE("Transition source is not declared in the state set"),
        TRANSITION_TARGET("Transition target is not declared in the state set"),
        ARGUMENT_STATE("State argument is not declared in the state set");

        private final String description;

        Invariant(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Invariant invariant;

    public StructuralException(Invariant invariant, String state) {
        super(state, invariant.getDescription());
        this.invariant = invariant;
    }

    public Invariant getInvariant() {
        return invariant;
    }
}
