package FSA.Render;

import FSA.Fixtures;
import FSA.Model.DFA;
import FSA.Model.NFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class DOTRendererTest {
  @Test
  void testDFA() {
    DFA dfa = Fixtures.mod3();
    String dot = DOTRenderer.toDOT(dfa);
    Assertions.assertTrue(dot.contains("digraph"));
    Assertions.assertTrue(dot.contains("q0"));
    Assertions.assertTrue(dot.contains("q2"));
    Assertions.assertEquals(Fixtures.mod3(), dfa);
  }

  @Test
  void testNFAWithEpsilon() {
    NFA nfa = Fixtures.contains11or101();
    String dot = DOTRenderer.toDOT(nfa);
    Assertions.assertTrue(dot.contains("q4"));
    Assertions.assertTrue(dot.contains("ε"));
  }

  @Test
  void testOptions() {
    RenderOptions options = RenderOptions.defaults()
        .withNodeAttribute("color", "blue")
        .withEdgeAttribute("fontcolor", "red");
    Assertions.assertEquals("blue", options.nodeAttributes().get("color"));
    Assertions.assertTrue(RenderOptions.defaults().nodeAttributes().isEmpty());

    String dot = DOTRenderer.toDOT(Fixtures.oddOnes(), options);
    Assertions.assertTrue(dot.contains("blue"));
    Assertions.assertTrue(dot.contains("red"));
  }

  @Test
  void testWrite(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("mod3.dot");
    DOTRenderer.write(Fixtures.mod3(), file, RenderOptions.defaults());
    String content = Files.readString(file, StandardCharsets.UTF_8);
    Assertions.assertEquals(DOTRenderer.toDOT(Fixtures.mod3()), content);
  }
}
