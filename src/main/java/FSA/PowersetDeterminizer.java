package FSA;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import FSA.Model.DFA;
import FSA.Model.ExplorationBudget;
import FSA.Model.NFA;
import FSA.Registry.AddressRegistry;
import FSA.Registry.Labels;
import FSA.Registry.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction. Only subsets reachable from the epsilon closure of the initial state are materialized;
 * the worst case is still exponential in the number of NFA states.
 */
public class PowersetDeterminizer {
    private static final Logger LOG = LoggerFactory.getLogger(PowersetDeterminizer.class);
    private static final String CONSTRUCTION = "subset construction";

    private final ExplorationBudget budget;

    public PowersetDeterminizer(ExplorationBudget budget) {
        this.budget = budget;
    }

    public DFA run(NFA nfa) {
        return doDeterminize(nfa, this.budget);
    }

    public static DFA determinize(NFA nfa) {
        return determinize(nfa, ExplorationBudget.fromSystemProperties());
    }

    public static DFA determinize(NFA nfa, ExplorationBudget budget) {
        return doDeterminize(nfa, budget);
    }

    /**
     * DFA states are subsets of NFA states, labelled {@code {s1,s2,...}}. A subset is accepting iff it contains an
     * accepting NFA state. The empty subset, if reached, stays as an explicit dead state, so the result is complete.
     */
    private static DFA doDeterminize(NFA nfa, ExplorationBudget budget) {
        Validator.validate(nfa);

        final Registry<Set<String>> registry = new AddressRegistry<>(Labels::subset);
        final Deque<DeterminizeRecord> stack = new ArrayDeque<>();
        final Map<String, Map<String, String>> delta = new HashMap<>();
        final Set<String> finals = new HashSet<>();

        Set<String> init = Set.copyOf(EpsilonClosure.closure(nfa, nfa.getInitialState()));
        int initOut = registry.put(init);

        stack.push(new DeterminizeRecord(init, initOut));

        while (!stack.isEmpty()) {
            DeterminizeRecord curr = stack.pop();

            Set<String> inState = curr.inputState();
            String outState = registry.label(curr.outputAddress());

            if (isAccepting(nfa, inState)) {
                finals.add(outState);
            }

            Map<String, String> row = new TreeMap<>();
            for (String sym : nfa.getAlphabet()) {
                Set<String> moved = new LinkedHashSet<>();
                for (String s : inState) {
                    moved.addAll(nfa.step(s, sym));
                }
                Set<String> succ = Set.copyOf(EpsilonClosure.closure(nfa, moved));

                int outSucc = registry.get(succ);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    // add new state to DFA and to stack
                    outSucc = registry.put(succ);
                    budget.check(CONSTRUCTION, registry.size());
                    stack.push(new DeterminizeRecord(succ, outSucc));
                }
                row.put(sym, registry.label(outSucc));
            }
            delta.put(outState, row);
        }

        LOG.debug("Subset construction: {} NFA states -> {} DFA states", nfa.size(), registry.size());
        return new DFA(new HashSet<>(registry.labels()), nfa.getAlphabet(), delta, registry.label(initOut), finals);
    }

    private static boolean isAccepting(NFA nfa, Set<String> subset) {
        for (String s : subset) {
            if (nfa.isFinal(s)) {
                return true;
            }
        }
        return false;
    }

    private record DeterminizeRecord(Set<String> inputState, int outputAddress) { }
}
