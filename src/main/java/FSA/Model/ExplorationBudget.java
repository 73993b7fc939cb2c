package FSA.Model;

import FSA.Errors.StateLimitException;

/**
 * Upper bound on the number of states a materializing construction may create.
 * Subset and product constructions are exponential in the worst case; the budget turns a runaway
 * construction into a {@link StateLimitException} instead of an {@link OutOfMemoryError}.
 */
public class ExplorationBudget {
    public static final String MAX_STATES_PROPERTY = "fsa.maxStates";

    private final int stateThreshold;

    public ExplorationBudget() {
        this(Integer.MAX_VALUE);
    }

    public ExplorationBudget(int stateThreshold) {
        if (stateThreshold <= 0) {
            throw new IllegalArgumentException("State threshold must be positive: " + stateThreshold);
        }
        this.stateThreshold = stateThreshold;
    }

    public static ExplorationBudget unlimited() {
        return new ExplorationBudget();
    }

    public static ExplorationBudget of(int maxStates) {
        return new ExplorationBudget(maxStates);
    }

    /**
     * Reads the threshold from the {@value #MAX_STATES_PROPERTY} system property; unlimited if unset.
     */
    public static ExplorationBudget fromSystemProperties() {
        String value = System.getProperty(MAX_STATES_PROPERTY);
        if (value == null || value.isBlank()) {
            return unlimited();
        }
        try {
            return new ExplorationBudget(Integer.parseInt(value.trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid value for " + MAX_STATES_PROPERTY + ": " + value, ex);
        }
    }

    public int getStateThreshold() {
        return stateThreshold;
    }

    public boolean isAboveThreshold(int states) {
        return states > stateThreshold;
    }

    /**
     * @param construction name of the running construction, reported in the exception
     * @param states number of states materialized so far
     * @throws StateLimitException if {@code states} exceeds the threshold
     */
    public void check(String construction, int states) {
        if (isAboveThreshold(states)) {
            throw new StateLimitException(construction, stateThreshold);
        }
    }

    @Override
    public String toString() {
        return stateThreshold == Integer.MAX_VALUE ? "unlimited" : String.valueOf(stateThreshold);
    }
}
