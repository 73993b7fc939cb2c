package FSA.Model;

/**
 * A single edge of an automaton. Non-deterministic fan-out is represented by one transition per target.
 */
public record Transition(String source, String symbol, String target) {

    public boolean isEpsilon() {
        return Automaton.EPSILON.equals(symbol);
    }

    @Override
    public String toString() {
        return source + " -" + (isEpsilon() ? "ε" : symbol) + "-> " + target;
    }
}
