package FSA.Model;

import java.util.function.BiPredicate;

/**
 * Decides whether a product pair is accepting, given whether each component is accepting.
 * This is the only part of a product construction that differs between the boolean operations.
 */
public interface ProductAcceptance extends BiPredicate<Boolean, Boolean> {

    String getName();

    /**
     * intersection(): F x F'
     */
    static ProductAcceptance intersection() {
        return of("intersection", (left, right) -> left && right);
    }

    /**
     * union(): (F x Q') u (Q x F')
     */
    static ProductAcceptance union() {
        return of("union", (left, right) -> left || right);
    }

    /**
     * difference(): F x (Q' \ F')
     */
    static ProductAcceptance difference() {
        return of("difference", (left, right) -> left && !right);
    }

    /**
     * symmetricDifference(): (F x (Q' \ F')) u ((Q \ F) x F')
     */
    static ProductAcceptance symmetricDifference() {
        return of("symmetricDifference", (left, right) -> left ^ right);
    }

    static ProductAcceptance of(String name, BiPredicate<Boolean, Boolean> predicate) {
        return new ProductAcceptance() {
            @Override
            public boolean test(Boolean left, Boolean right) {
                return predicate.test(left, right);
            }

            @Override
            public String getName() {
                return name;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
