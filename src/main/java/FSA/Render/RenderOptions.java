package FSA.Render;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied GraphViz attributes applied to every node and edge of a rendered automaton.
 */
public record RenderOptions(Map<String, String> nodeAttributes, Map<String, String> edgeAttributes) {

    public RenderOptions {
        nodeAttributes = Map.copyOf(nodeAttributes);
        edgeAttributes = Map.copyOf(edgeAttributes);
    }

    public static RenderOptions defaults() {
        return new RenderOptions(Map.of(), Map.of());
    }

    public RenderOptions withNodeAttribute(String key, String value) {
        Map<String, String> attributes = new LinkedHashMap<>(nodeAttributes);
        attributes.put(key, value);
        return new RenderOptions(attributes, edgeAttributes);
    }

    public RenderOptions withEdgeAttribute(String key, String value) {
        Map<String, String> attributes = new LinkedHashMap<>(edgeAttributes);
        attributes.put(key, value);
        return new RenderOptions(nodeAttributes, attributes);
    }
}
