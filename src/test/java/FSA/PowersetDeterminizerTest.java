package FSA;

import FSA.CompactConversion.CompactView;
import FSA.Errors.StateLimitException;
import FSA.Model.DFA;
import FSA.Model.ExplorationBudget;
import FSA.Model.NFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

public class PowersetDeterminizerTest {
  private static NFA singleEdge() {
    return new NFA(Set.of("a", "b"), Set.of("x", "y"), Map.of("a", Map.of("x", Set.of("b"))), "a", Set.of("b"));
  }

  @Test
  void testEmptySubsetIsKept() {
    DFA dfa = PowersetDeterminizer.determinize(singleEdge());
    Assertions.assertEquals(Set.of("{a}", "{b}", "{}"), dfa.getStates());
    Assertions.assertEquals("{a}", dfa.getInitialState());
    Assertions.assertEquals(Set.of("{b}"), dfa.getFinalStates());
    Assertions.assertEquals("{}", dfa.getTransition("{a}", "y"));
    Assertions.assertEquals("{}", dfa.getTransition("{}", "x"));
    Assertions.assertTrue(dfa.isComplete());
  }

  @Test
  void testSubsetLabels() {
    DFA dfa = PowersetDeterminizer.determinize(Fixtures.contains11or101());
    Assertions.assertEquals("{q1}", dfa.getInitialState());
    // q2 always drags q3 along through its epsilon edge
    Assertions.assertEquals("{q1,q2,q3}", dfa.getTransition("{q1}", "1"));
    for (String state : dfa.getFinalStates()) {
      Assertions.assertTrue(state.contains("q4"));
    }
  }

  @Test
  void testBudget() {
    NFA nfa = singleEdge();
    Assertions.assertEquals(3, new PowersetDeterminizer(ExplorationBudget.of(3)).run(nfa).size());
    StateLimitException ex = Assertions.assertThrows(StateLimitException.class,
        () -> PowersetDeterminizer.determinize(nfa, ExplorationBudget.of(2)));
    Assertions.assertEquals(2, ex.getLimit());

    String old = System.getProperty(ExplorationBudget.MAX_STATES_PROPERTY);
    try {
      System.setProperty(ExplorationBudget.MAX_STATES_PROPERTY, "2");
      Assertions.assertThrows(StateLimitException.class, nfa::toDFA);
    } finally {
      if (old == null) {
        System.clearProperty(ExplorationBudget.MAX_STATES_PROPERTY);
      } else {
        System.setProperty(ExplorationBudget.MAX_STATES_PROPERTY, old);
      }
    }
  }

  @Test
  void testAgainstAutomataLib() {
    for (int seed = 0; seed < 30; seed++) {
      for (int size = 1; size <= 8; size++) {
        NFA nfa = RandomAutomata.getRandomNFA(seed, size, true);
        DFA dfa = PowersetDeterminizer.determinize(nfa);

        CompactView<CompactNFA<String>> in = CompactConversion.toCompactNFA(nfa.removeEpsilonTransitions());
        CompactDFA<String> expected = NFAs.determinize(in.automaton(), in.alphabet());
        CompactView<CompactDFA<String>> out = CompactConversion.toCompactDFA(dfa);

        Assertions.assertTrue(Automata.testEquivalence(expected, out.automaton(), in.alphabet()),
            "seed " + seed + ", size " + size);
      }
    }
  }
}
