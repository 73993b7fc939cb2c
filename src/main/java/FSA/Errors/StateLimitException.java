package FSA.Errors;

/**
 * A construction materialized more states than its exploration budget allows.
 */
public class StateLimitException extends AutomatonException {
    private final int limit;

    public StateLimitException(String construction, int limit) {
        super(construction, "State limit of " + limit + " exceeded by");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
