package FSA.Errors;

/**
 * An input word contains a symbol outside the alphabet.
 * Rejection of an in-alphabet word is a normal outcome and never raises this.
 */
public class InputException extends AutomatonException {
    private final int position;

    public InputException(String symbol, int position) {
        super(symbol, "Input symbol at position " + position + " is not declared in the alphabet");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
