package FSA.Render;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import FSA.CompactConversion;
import FSA.CompactConversion.CompactView;
import FSA.Model.Automaton;
import FSA.Model.DFA;
import FSA.Model.NFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.serialization.dot.GraphDOT;
import net.automatalib.visualization.VisualizationHelper;

/**
 * Writes automata in the GraphViz DOT format. Only reads the automaton; a failing writer never affects it.
 */
public final class DOTRenderer {

    private DOTRenderer() {}

    public static String toDOT(Automaton<?> automaton) {
        return toDOT(automaton, RenderOptions.defaults());
    }

    public static String toDOT(Automaton<?> automaton, RenderOptions options) {
        StringBuilder sb = new StringBuilder();
        try {
            render(automaton, sb, options);
        } catch (IOException ex) {
            // StringBuilder does not throw
            throw new IllegalStateException(ex);
        }
        return sb.toString();
    }

    public static void write(Automaton<?> automaton, Path path, RenderOptions options) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            render(automaton, writer, options);
        }
    }

    public static void render(Automaton<?> automaton, Appendable out, RenderOptions options) throws IOException {
        if (automaton instanceof DFA) {
            CompactView<CompactDFA<String>> view = CompactConversion.toCompactDFA((DFA) automaton);
            GraphDOT.write(view.automaton(), view.alphabet(), out, new LabelHelper(view.labels(), options));
        } else if (automaton instanceof NFA) {
            CompactView<CompactNFA<String>> view = CompactConversion.toCompactNFA((NFA) automaton);
            GraphDOT.write(view.automaton(), view.alphabet(), out, new LabelHelper(view.labels(), options));
        } else {
            throw new IllegalArgumentException("Unsupported automaton: " + automaton.getClass().getName());
        }
    }

    /**
     * Shows original state labels instead of compact ids and applies the caller's styling.
     */
    private static final class LabelHelper implements VisualizationHelper<Integer, Object> {
        private final List<String> labels;
        private final RenderOptions options;

        LabelHelper(List<String> labels, RenderOptions options) {
            this.labels = labels;
            this.options = options;
        }

        @Override
        public boolean getNodeProperties(Integer node, Map<String, String> properties) {
            properties.put(NodeAttrs.LABEL, labels.get(node));
            properties.putAll(options.nodeAttributes());
            return true;
        }

        @Override
        public boolean getEdgeProperties(Integer src, Object edge, Integer tgt, Map<String, String> properties) {
            properties.putAll(options.edgeAttributes());
            return true;
        }
    }
}
