package com.workflow.pga.layout;

import com.workflow.pga.api.UnknownNodeException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Positions of every node of one graph, produced fresh by each
 * {@link LayeredLayoutEngine#layout} call.
 */
public final class LayoutResult {
    // Ordered by layer, then by order within the layer.
    private final Map<String, NodePosition> positions;
    private final List<List<String>> layers;
    private final List<String> isolated;
    private final List<LayoutWarning> warnings;

    LayoutResult(Map<String, NodePosition> positions, List<List<String>> layers, List<String> isolated,
            List<LayoutWarning> warnings) {
        this.positions = Collections.unmodifiableMap(positions);
        List<List<String>> frozen = new ArrayList<>(layers.size());
        for (List<String> l : layers)
            frozen.add(List.copyOf(l));
        this.layers = Collections.unmodifiableList(frozen);
        this.isolated = List.copyOf(isolated);
        this.warnings = List.copyOf(warnings);
    }

    public NodePosition position(String id) {
        NodePosition p = positions.get(id);
        if (p == null)
            throw new UnknownNodeException(id);
        return p;
    }

    public Collection<NodePosition> positions() {
        return positions.values();
    }

    public int layerOf(String id) {
        return position(id).layer();
    }

    public int layerCount() {
        return layers.size();
    }

    /** Node ids of layer {@code n}, left to right. */
    public List<String> layer(int n) {
        return layers.get(n);
    }

    /** Nodes no layering root reaches; they sit in layer 0. */
    public List<String> isolated() {
        return isolated;
    }

    public List<LayoutWarning> warnings() {
        return warnings;
    }

    public boolean isDegenerate() {
        return warnings.stream().anyMatch(w -> w.type() == LayoutWarning.Type.DEGENERATE_GRAPH);
    }

    /** Right-most x coordinate, 0 for an empty layout. */
    public double width() {
        double max = 0;
        for (NodePosition p : positions.values())
            max = Math.max(max, p.x());
        return max;
    }

    /** Bottom-most y coordinate, 0 for an empty layout. */
    public double height() {
        double max = 0;
        for (NodePosition p : positions.values())
            max = Math.max(max, p.y());
        return max;
    }

    public int size() {
        return positions.size();
    }
}
