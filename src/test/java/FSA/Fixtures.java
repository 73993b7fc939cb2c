package FSA;

import java.util.Map;
import java.util.Set;

import FSA.Model.DFA;
import FSA.Model.NFA;

/**
 * Small automata shared by the tests.
 */
public class Fixtures {
  /** Binary numbers divisible by three. */
  public static DFA mod3() {
    return new DFA(
        Set.of("q0", "q1", "q2"),
        Set.of("0", "1"),
        Map.of(
            "q0", Map.of("0", "q0", "1", "q1"),
            "q1", Map.of("0", "q2", "1", "q0"),
            "q2", Map.of("0", "q1", "1", "q2")),
        "q0",
        Set.of("q0"));
  }

  /** Odd number of 1s. */
  public static DFA oddOnes() {
    return new DFA(
        Set.of("A", "B"),
        Set.of("0", "1"),
        Map.of("A", Map.of("0", "A", "1", "B"), "B", Map.of("0", "B", "1", "A")),
        "A",
        Set.of("B"));
  }

  /** Contains 000. */
  public static DFA threeZeros() {
    return new DFA(
        Set.of("R", "S", "T", "U"),
        Set.of("0", "1"),
        Map.of(
            "R", Map.of("0", "S", "1", "R"),
            "S", Map.of("0", "T", "1", "R"),
            "T", Map.of("0", "U", "1", "R"),
            "U", Map.of("0", "U", "1", "U")),
        "R",
        Set.of("U"));
  }

  /** Contains 11 or 101; the epsilon edge q2 -> q3 skips the 0 of 101. */
  public static NFA contains11or101() {
    return new NFA(
        Set.of("q1", "q2", "q3", "q4"),
        Set.of("0", "1"),
        Map.of(
            "q1", Map.of("0", Set.of("q1"), "1", Set.of("q1", "q2")),
            "q2", Map.of("0", Set.of("q3"), "", Set.of("q3")),
            "q3", Map.of("1", Set.of("q4")),
            "q4", Map.of("0", Set.of("q4"), "1", Set.of("q4"))),
        "q1",
        Set.of("q4"));
  }

  /** AA BB CC (BB CC)* DD over multi-character symbols, with an epsilon loop back from 3 to 1. */
  public static NFA multiCharSymbols() {
    return new NFA(
        Set.of("0", "1", "2", "3", "4"),
        Set.of("AA", "BB", "CC", "DD"),
        Map.of(
            "0", Map.of("AA", Set.of("1")),
            "1", Map.of("BB", Set.of("2")),
            "2", Map.of("CC", Set.of("3")),
            "3", Map.of("", Set.of("1"), "DD", Set.of("4"))),
        "0",
        Set.of("4"));
  }
}
