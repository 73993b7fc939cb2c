package FSA;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import FSA.Errors.AlphabetMismatchException;
import FSA.Model.Automaton;
import FSA.Model.DFA;
import FSA.Model.ExplorationBudget;
import FSA.Model.NFA;
import FSA.Model.ProductAcceptance;
import FSA.Registry.AddressRegistry;
import FSA.Registry.Labels;
import FSA.Registry.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cross product of two automata over a shared alphabet. Both operands are completed first; the pair
 * {@code (p, p')} moves on {@code a} to every pair of successors. Which pairs accept is decided by a
 * {@link ProductAcceptance}.
 */
public final class ProductConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(ProductConstruction.class);
    private static final String CONSTRUCTION = "product construction";

    private ProductConstruction() {}

    /**
     * Product over the pairs reachable from the pair of initial states.
     */
    public static DFA product(DFA left, DFA right, ProductAcceptance acceptance) {
        return product(left, right, acceptance, ExplorationBudget.fromSystemProperties());
    }

    public static DFA product(DFA left, DFA right, ProductAcceptance acceptance, ExplorationBudget budget) {
        return toDFA(explore(prepare(left, right), prepare(right, left), acceptance, true, budget));
    }

    /**
     * Product over all pairs of states, reachable or not.
     */
    public static DFA fullProduct(DFA left, DFA right, ProductAcceptance acceptance) {
        return fullProduct(left, right, acceptance, ExplorationBudget.fromSystemProperties());
    }

    public static DFA fullProduct(DFA left, DFA right, ProductAcceptance acceptance, ExplorationBudget budget) {
        return toDFA(explore(prepare(left, right), prepare(right, left), acceptance, false, budget));
    }

    /**
     * Reachable product of two NFAs. Epsilon transitions are removed and both operands completed first, so every
     * run of one operand pairs with some run of the other. This is only sound for predicates that hold when one
     * run pair satisfies them (intersection, union), not for difference.
     */
    public static NFA product(NFA left, NFA right, ProductAcceptance acceptance) {
        return product(left, right, acceptance, ExplorationBudget.fromSystemProperties());
    }

    public static NFA product(NFA left, NFA right, ProductAcceptance acceptance, ExplorationBudget budget) {
        return toNFA(explore(prepare(left, right), prepare(right, left), acceptance, true, budget));
    }

    public static NFA fullProduct(NFA left, NFA right, ProductAcceptance acceptance) {
        return fullProduct(left, right, acceptance, ExplorationBudget.fromSystemProperties());
    }

    public static NFA fullProduct(NFA left, NFA right, ProductAcceptance acceptance, ExplorationBudget budget) {
        return toNFA(explore(prepare(left, right), prepare(right, left), acceptance, false, budget));
    }

    private static DFA prepare(DFA operand, DFA other) {
        Validator.validate(operand);
        Validator.validate(other);
        checkAlphabets(operand, other);
        return Completion.complete(operand);
    }

    private static NFA prepare(NFA operand, NFA other) {
        Validator.validate(operand);
        Validator.validate(other);
        checkAlphabets(operand, other);
        return Completion.complete(EpsilonRemoval.removeEpsilonTransitions(operand));
    }

    static void checkAlphabets(Automaton<?> left, Automaton<?> right) {
        if (!left.getAlphabet().equals(right.getAlphabet())) {
            throw new AlphabetMismatchException(left.getAlphabet(), right.getAlphabet());
        }
    }

    private static Product explore(Automaton<?> left,
                                   Automaton<?> right,
                                   ProductAcceptance acceptance,
                                   boolean reachableOnly,
                                   ExplorationBudget budget) {
        final Registry<StatePair> registry = new AddressRegistry<>(p -> Labels.pair(p.left(), p.right()));
        final Deque<StatePair> queue = new ArrayDeque<>();

        final StatePair init = new StatePair(left.getInitialState(), right.getInitialState());
        register(registry, queue, init, budget);

        if (!reachableOnly) {
            for (String l : left.getStates()) {
                for (String r : right.getStates()) {
                    StatePair pair = new StatePair(l, r);
                    if (!registry.contains(pair)) {
                        register(registry, queue, pair, budget);
                    }
                }
            }
        }

        final Map<String, Map<String, Set<String>>> delta = new HashMap<>();
        final Set<String> finals = new HashSet<>();

        while (!queue.isEmpty()) {
            StatePair curr = queue.poll();
            String label = registry.labelOf(curr);

            if (acceptance.test(left.isFinal(curr.left()), right.isFinal(curr.right()))) {
                finals.add(label);
            }

            for (String sym : left.getAlphabet()) {
                Set<String> targets = new TreeSet<>();
                for (String l : left.step(curr.left(), sym)) {
                    for (String r : right.step(curr.right(), sym)) {
                        StatePair succ = new StatePair(l, r);
                        if (!registry.contains(succ)) {
                            register(registry, queue, succ, budget);
                        }
                        targets.add(registry.labelOf(succ));
                    }
                }
                if (!targets.isEmpty()) {
                    delta.computeIfAbsent(label, k -> new HashMap<>()).put(sym, targets);
                }
            }
        }

        LOG.debug("{} {} of {} x {} states: {} pairs", reachableOnly ? "Reachable" : "Full", acceptance,
            left.size(), right.size(), registry.size());
        return new Product(new HashSet<>(registry.labels()), left.getAlphabet(), delta,
            registry.label(0), finals);
    }

    private static void register(Registry<StatePair> registry, Deque<StatePair> queue, StatePair pair,
                                 ExplorationBudget budget) {
        registry.put(pair);
        budget.check(CONSTRUCTION, registry.size());
        queue.add(pair);
    }

    private static DFA toDFA(Product product) {
        final Map<String, Map<String, String>> delta = new HashMap<>();
        product.delta().forEach((source, row) -> {
            Map<String, String> dRow = new HashMap<>();
            row.forEach((symbol, targets) -> {
                // completed deterministic operands yield exactly one successor pair
                dRow.put(symbol, targets.iterator().next());
            });
            delta.put(source, dRow);
        });
        return new DFA(product.states(), product.alphabet(), delta, product.initial(), product.finals());
    }

    private static NFA toNFA(Product product) {
        return new NFA(product.states(), product.alphabet(), product.delta(), product.initial(), product.finals());
    }

    private record StatePair(String left, String right) { }

    private record Product(Set<String> states,
                           Set<String> alphabet,
                           Map<String, Map<String, Set<String>>> delta,
                           String initial,
                           Set<String> finals) { }
}
