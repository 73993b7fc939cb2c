package FSA.Errors;

import java.util.Set;

/**
 * A binary operation was invoked on automata over different alphabets.
 */
public class AlphabetMismatchException extends AutomatonException {
    private final Set<String> left;
    private final Set<String> right;

    public AlphabetMismatchException(Set<String> left, Set<String> right) {
        super(left + " vs " + right, "Both automata must share the same alphabet");
        this.left = Set.copyOf(left);
        this.right = Set.copyOf(right);
    }

    public Set<String> getLeft() {
        return left;
    }

    public Set<String> getRight() {
        return right;
    }
}
