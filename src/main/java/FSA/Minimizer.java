package FSA;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSA.CompactConversion.CompactView;
import FSA.Model.DFA;
import FSA.Model.NFA;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Myhill-Nerode minimization.
 * <p>
 * The DFA is completed, restricted to its reachable states and minimized by AutomataLib's Hopcroft partition
 * refinement. Each state of the result corresponds to one block of language-equivalent states; the block of every
 * original state is recovered by running the input and the minimized automaton in lockstep.
 */
public final class Minimizer {
    private static final Logger LOG = LoggerFactory.getLogger(Minimizer.class);
    private static final int MISSING_BLOCK = -1;

    private Minimizer() {}

    /**
     * Each state of the result is named after the smallest original state of its block. If completion had to add a
     * trap state, the block absorbing it is dropped again (unless it holds the initial state), so the result is
     * never larger than the input.
     */
    public static DFA minimize(DFA dfa) {
        Validator.validate(dfa);

        final DFA complete = Completion.complete(dfa);
        final String trap = complete == dfa ? null : addedState(dfa, complete);
        final DFA reachable = Reachability.restrictToReachable(complete);

        final CompactView<CompactDFA<String>> view = CompactConversion.toCompactDFA(reachable);
        final Alphabet<String> alphabet = view.alphabet();
        final CompactDFA<String> min = HopcroftMinimizer.minimizeDFA(view.automaton(), alphabet);

        final int[] blockOf = blocksOf(view.automaton(), min, alphabet.size());
        final DFA result = build(reachable, view.labels(), alphabet, min, blockOf, trap);
        LOG.debug("Minimized DFA: {} -> {} states", dfa.size(), result.size());
        return result;
    }

    /**
     * Determinizes, minimizes and lifts the result back to an NFA with renumbered states.
     */
    public static NFA minimize(NFA nfa) {
        final NFA result = DFAEmbedding.toNFA(minimize(PowersetDeterminizer.determinize(nfa)));
        result.renumber();
        return result;
    }

    private static String addedState(DFA original, DFA complete) {
        for (String state : complete.getStates()) {
            if (!original.getStates().contains(state)) {
                return state;
            }
        }
        throw new IllegalStateException("Completion added no state");
    }

    /**
     * Maps every state of the complete, reachable {@code in} to the state of {@code min} reached by the same words.
     */
    private static int[] blocksOf(CompactDFA<String> in, CompactDFA<String> min, int numInputs) {
        final int[] blockOf = new int[in.size()];
        Arrays.fill(blockOf, MISSING_BLOCK);

        final IntArrayList queue = new IntArrayList();
        final int init = in.getIntInitialState();
        blockOf[init] = min.getIntInitialState();
        queue.add(init);

        for (int ptr = 0; ptr < queue.size(); ptr++) {
            int state = queue.getInt(ptr);
            for (int i = 0; i < numInputs; i++) {
                int succ = in.getSuccessor(state, i);
                if (blockOf[succ] == MISSING_BLOCK) {
                    blockOf[succ] = min.getSuccessor(blockOf[state], i);
                    queue.add(succ);
                }
            }
        }
        LOG.trace("Blocks: {}", Arrays.toString(blockOf));
        return blockOf;
    }

    private static DFA build(DFA dfa,
                             List<String> labels,
                             Alphabet<String> alphabet,
                             CompactDFA<String> min,
                             int[] blockOf,
                             String trap) {
        // representative: smallest original state of the block; the trap only represents a block of its own
        final String[] representative = new String[min.size()];
        for (int state = 0; state < labels.size(); state++) {
            int block = blockOf[state];
            if (representative[block] == null || trap != null && trap.equals(representative[block])) {
                representative[block] = labels.get(state);
            }
        }

        final int initialBlock = min.getIntInitialState();
        int droppedBlock = MISSING_BLOCK;
        final int trapIndex = trap == null ? -1 : labels.indexOf(trap);
        if (trapIndex >= 0 && blockOf[trapIndex] != initialBlock) {
            droppedBlock = blockOf[trapIndex];
        }

        final Set<String> newStates = new HashSet<>();
        final Set<String> finals = new HashSet<>();
        final Map<String, Map<String, String>> delta = new HashMap<>();

        for (int block = 0; block < representative.length; block++) {
            if (block == droppedBlock) {
                continue;
            }
            String rep = representative[block];
            newStates.add(rep);
            if (dfa.isFinal(rep)) {
                finals.add(rep);
            }
            Map<String, String> row = new HashMap<>();
            for (int i = 0; i < alphabet.size(); i++) {
                int target = min.getSuccessor(block, i);
                if (target != droppedBlock) {
                    row.put(alphabet.getSymbol(i), representative[target]);
                }
            }
            delta.put(rep, row);
        }

        return new DFA(newStates, dfa.getAlphabet(), delta, representative[initialBlock], finals);
    }
}
