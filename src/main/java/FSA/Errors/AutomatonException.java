package FSA.Errors;

/**
 * Base class of every error raised by the automaton algorithms.
 * Carries the offending element (state, symbol, input) alongside the message.
 */
public class AutomatonException extends RuntimeException {
    private final String expression;

    public AutomatonException(String expression, String message) {
        super(message + ": " + expression);
        this.expression = expression;
    }

    /**
     * @return the state, symbol or input that caused the error
     */
    public String getExpression() {
        return expression;
    }
}
