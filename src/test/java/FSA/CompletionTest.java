package FSA;

import FSA.Model.DFA;
import FSA.Model.NFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

public class CompletionTest {
  @Test
  void testCompleteDFA() {
    DFA partial = new DFA(Set.of("s0", "s1"), Set.of("a", "b"), Map.of("s0", Map.of("a", "s1")), "s0", Set.of("s1"));
    DFA complete = Completion.complete(partial);
    Assertions.assertTrue(Completion.isComplete(complete));
    Assertions.assertEquals(Set.of("s0", "s1", "trap"), complete.getStates());
    Assertions.assertEquals("trap", complete.getTransition("s0", "b"));
    Assertions.assertEquals("trap", complete.getTransition("trap", "a"));
    Assertions.assertFalse(complete.isFinal("trap"));
    Assertions.assertEquals(Set.of("s1"), complete.getFinalStates());
    // the input is left alone
    Assertions.assertEquals(2, partial.size());
  }

  @Test
  void testAlreadyComplete() {
    DFA dfa = Fixtures.mod3();
    Assertions.assertTrue(dfa.isComplete());
    Assertions.assertSame(dfa, Completion.complete(dfa));
  }

  @Test
  void testFreshTrapName() {
    DFA partial = new DFA(Set.of("trap", "trap'"), Set.of("a"), Map.of("trap", Map.of("a", "trap'")), "trap", Set.of());
    DFA complete = partial.complete();
    Assertions.assertEquals(Set.of("trap", "trap'", "trap''"), complete.getStates());
    Assertions.assertEquals("trap''", complete.getTransition("trap'", "a"));
  }

  @Test
  void testCompleteNFA() {
    NFA nfa = Fixtures.contains11or101().removeEpsilonTransitions();
    Assertions.assertFalse(Completion.isComplete(nfa));
    NFA complete = Completion.complete(nfa);
    Assertions.assertTrue(Completion.isComplete(complete));
    Assertions.assertTrue(complete.getStates().contains("trap"));
    Assertions.assertTrue(complete.accept("0000011"));
    Assertions.assertFalse(complete.accept("000001"));

    Assertions.assertThrows(IllegalArgumentException.class, () -> Completion.complete(Fixtures.contains11or101()));
  }
}
