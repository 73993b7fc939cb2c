package FSA.Registry;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Readable base names for states built out of other states.
 */
public final class Labels {
    public static final String TRAP = "trap";
    public static final String PRIME = "'";

    private Labels() {}

    public static String pair(String left, String right) {
        return "(" + left + "," + right + ")";
    }

    public static String subset(Collection<String> states) {
        return "{" + String.join(",", new TreeSet<>(states)) + "}";
    }

    /**
     * @return {@code base}, primed as often as needed to avoid every label in {@code taken}
     */
    public static String fresh(String base, Set<String> taken) {
        String candidate = base;
        while (taken.contains(candidate)) {
            candidate += PRIME;
        }
        return candidate;
    }
}
