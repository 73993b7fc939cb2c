package FSA.Model;

import FSA.Errors.StateLimitException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class ModelTest {
  @Test
  void testProductAcceptance() {
    ProductAcceptance p = ProductAcceptance.intersection();
    Assertions.assertEquals("intersection", p.getName());
    Assertions.assertTrue(p.test(true, true));
    Assertions.assertFalse(p.test(true, false));

    p = ProductAcceptance.union();
    Assertions.assertEquals("union", p.toString());
    Assertions.assertTrue(p.test(false, true));
    Assertions.assertFalse(p.test(false, false));

    p = ProductAcceptance.difference();
    Assertions.assertTrue(p.test(true, false));
    Assertions.assertFalse(p.test(true, true));
    Assertions.assertFalse(p.test(false, false));

    p = ProductAcceptance.symmetricDifference();
    Assertions.assertTrue(p.test(false, true));
    Assertions.assertFalse(p.test(true, true));

    p = ProductAcceptance.of("left", (l, r) -> l);
    Assertions.assertEquals("left", p.getName());
    Assertions.assertTrue(p.test(true, false));
  }

  @Test
  void testExplorationBudget() {
    ExplorationBudget b = ExplorationBudget.of(2);
    Assertions.assertEquals(2, b.getStateThreshold());
    Assertions.assertEquals("2", b.toString());
    Assertions.assertFalse(b.isAboveThreshold(2));
    Assertions.assertTrue(b.isAboveThreshold(3));
    b.check("test", 2); // at the threshold is fine
    StateLimitException ex = Assertions.assertThrows(StateLimitException.class, () -> ExplorationBudget.of(2).check("test", 3));
    Assertions.assertEquals(2, ex.getLimit());

    Assertions.assertEquals("unlimited", ExplorationBudget.unlimited().toString());
    Assertions.assertFalse(ExplorationBudget.unlimited().isAboveThreshold(Integer.MAX_VALUE));
    Assertions.assertThrows(IllegalArgumentException.class, () -> ExplorationBudget.of(0));
  }

  @Test
  void testBudgetFromSystemProperties() {
    String old = System.getProperty(ExplorationBudget.MAX_STATES_PROPERTY);
    try {
      System.clearProperty(ExplorationBudget.MAX_STATES_PROPERTY);
      Assertions.assertEquals("unlimited", ExplorationBudget.fromSystemProperties().toString());

      System.setProperty(ExplorationBudget.MAX_STATES_PROPERTY, " 17 ");
      Assertions.assertEquals(17, ExplorationBudget.fromSystemProperties().getStateThreshold());

      System.setProperty(ExplorationBudget.MAX_STATES_PROPERTY, "many");
      Assertions.assertThrows(IllegalArgumentException.class, ExplorationBudget::fromSystemProperties);
    } finally {
      if (old == null) {
        System.clearProperty(ExplorationBudget.MAX_STATES_PROPERTY);
      } else {
        System.setProperty(ExplorationBudget.MAX_STATES_PROPERTY, old);
      }
    }
  }

  @Test
  void testTransition() {
    Transition t = new Transition("p", "a", "q");
    Assertions.assertFalse(t.isEpsilon());
    Assertions.assertEquals("p -a-> q", t.toString());
    Assertions.assertEquals("p -ε-> q", new Transition("p", Automaton.EPSILON, "q").toString());
  }

  @Test
  void testSymbolsOf() {
    Assertions.assertEquals(List.of("0", "1"), Automaton.symbolsOf("01"));
    Assertions.assertEquals(List.of(), Automaton.symbolsOf(""));
    Assertions.assertEquals(List.of("😀", "a"), Automaton.symbolsOf("😀a"));
  }
}
