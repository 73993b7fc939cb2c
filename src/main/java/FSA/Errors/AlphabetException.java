package FSA.Errors;

/**
 * A transition uses a symbol outside the declared alphabet, or the alphabet itself is malformed.
 */
public class AlphabetException extends AutomatonException {

    public AlphabetException(String symbol, String message) {
        super(symbol, message);
    }
}
