package com.workflow.pga.layout;

/**
 * Spacing constants for the layered layout.
 *
 * @param nodeSpacingX  Horizontal distance between neighbours in a layer.
 * @param layerSpacingY Vertical distance between consecutive layers.
 * @param marginX       X coordinate of the first node of every layer.
 * @param marginY       Y coordinate of layer 0.
 */
public record LayoutConfig(double nodeSpacingX, double layerSpacingY, double marginX, double marginY) {

    // 120x60 glyphs plus a 60px gutter horizontally and 100px vertically.
    public static final double DEFAULT_NODE_SPACING_X = 180.0;
    public static final double DEFAULT_LAYER_SPACING_Y = 160.0;
    public static final double DEFAULT_MARGIN_X = 40.0;
    public static final double DEFAULT_MARGIN_Y = 50.0;

    public static final LayoutConfig DEFAULT = new LayoutConfig(DEFAULT_NODE_SPACING_X, DEFAULT_LAYER_SPACING_Y,
            DEFAULT_MARGIN_X, DEFAULT_MARGIN_Y);

    public LayoutConfig {
        if (!(nodeSpacingX > 0) || !(layerSpacingY > 0))
            throw new IllegalArgumentException(
                    "Spacing must be positive: nodeSpacingX=" + nodeSpacingX + ", layerSpacingY=" + layerSpacingY);
        if (marginX < 0 || marginY < 0)
            throw new IllegalArgumentException("Margins must not be negative: " + marginX + ", " + marginY);
    }
}
