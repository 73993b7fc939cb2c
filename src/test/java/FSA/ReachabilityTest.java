package FSA;

import FSA.Model.DFA;
import FSA.Model.NFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class ReachabilityTest {
  @Test
  void testBreadthFirstOrder() {
    NFA nfa = Fixtures.contains11or101();
    Assertions.assertEquals(List.of("q1", "q2", "q3", "q4"), List.copyOf(Reachability.reachableStates(nfa)));

    DFA dfa = new DFA(Set.of("a", "b", "c"), Set.of("x"), Map.of("a", Map.of("x", "b")), "a", Set.of("c"));
    Assertions.assertEquals(Set.of("a", "b"), Reachability.reachableStates(dfa));
    Assertions.assertTrue(Reachability.isEmpty(dfa));
    Assertions.assertFalse(Reachability.isEmpty(Fixtures.mod3()));
  }

  @Test
  void testRestrictToReachable() {
    DFA dfa = new DFA(Set.of("a", "b", "c"), Set.of("x"),
        Map.of("a", Map.of("x", "b"), "c", Map.of("x", "a")), "a", Set.of("b", "c"));
    DFA restricted = Reachability.restrictToReachable(dfa);
    Assertions.assertEquals(Set.of("a", "b"), restricted.getStates());
    Assertions.assertEquals(Set.of("b"), restricted.getFinalStates());
    Assertions.assertSame(restricted, Reachability.restrictToReachable(restricted));
  }
}
