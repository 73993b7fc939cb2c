package FSA;

import FSA.Model.NFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class EpsilonRemovalTest {
  @Test
  void testFinalStatesAugmented() {
    NFA nfa = new NFA(Set.of("x", "y"), Set.of("a"), Map.of("x", Map.of("", Set.of("y"))), "x", Set.of("y"));
    Assertions.assertTrue(nfa.accept(""));

    NFA free = EpsilonRemoval.removeEpsilonTransitions(nfa);
    Assertions.assertEquals(Set.of("x", "y"), free.getFinalStates());
    Assertions.assertTrue(free.getTransitions().isEmpty());
    Assertions.assertTrue(free.accept(""));
    Assertions.assertFalse(free.accept("a"));
  }

  @Test
  void testMultiCharSymbols() {
    NFA nfa = Fixtures.multiCharSymbols();
    NFA free = EpsilonRemoval.removeEpsilonTransitions(nfa);
    Assertions.assertFalse(EpsilonRemoval.hasEpsilonTransitions(free));
    Assertions.assertEquals(Set.of("2"), free.step("3", "BB"));
    Assertions.assertEquals(Set.of("4"), free.step("3", "DD"));
    Assertions.assertEquals(nfa.getStates(), free.getStates());
    Assertions.assertTrue(free.accept(List.of("AA", "BB", "CC", "BB", "CC", "DD")));
    Assertions.assertFalse(free.accept(List.of("AA", "BB", "CC", "BB", "DD")));
  }

  @Test
  void testEpsilonFreeUnchanged() {
    NFA nfa = Fixtures.mod3().toNFA();
    Assertions.assertFalse(EpsilonRemoval.hasEpsilonTransitions(nfa));
    Assertions.assertEquals(nfa, EpsilonRemoval.removeEpsilonTransitions(nfa));
  }
}
