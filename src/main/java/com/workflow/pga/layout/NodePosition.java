package com.workflow.pga.layout;

/**
 * Placement of one node.
 *
 * @param id       Node id.
 * @param x        Horizontal coordinate (position within the layer).
 * @param y        Vertical coordinate (layer).
 * @param layer    Breadth-first distance class, 0 for roots and isolated nodes.
 * @param order    Zero-based position within the layer.
 * @param isolated true if no layering root reaches the node.
 */
public record NodePosition(String id, double x, double y, int layer, int order, boolean isolated) {
}
