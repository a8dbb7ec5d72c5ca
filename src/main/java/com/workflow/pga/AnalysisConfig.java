package com.workflow.pga;

import com.workflow.pga.layout.LayoutConfig;
import com.workflow.pga.model.WeightMetric;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Engine settings.
 *
 * @param layout        Layout spacing.
 * @param maxPathLength Maximum nodes per enumerated path; 0 means twice the
 *                      node count of the graph.
 * @param maxPaths      Maximum paths per start/end pair; 0 means unbounded.
 * @param weightMetric  Metric used when a critical path is requested without
 *                      one.
 */
public record AnalysisConfig(LayoutConfig layout, int maxPathLength, int maxPaths, WeightMetric weightMetric) {

    public static final String DEFAULT_RESOURCE = "process-analysis.properties";

    public static final AnalysisConfig DEFAULT = new AnalysisConfig(LayoutConfig.DEFAULT, 0, 0, WeightMetric.DURATION);

    public AnalysisConfig {
        if (layout == null)
            layout = LayoutConfig.DEFAULT;
        if (weightMetric == null)
            weightMetric = WeightMetric.DURATION;
        if (maxPathLength < 0)
            throw new IllegalArgumentException("maxPathLength must not be negative: " + maxPathLength);
        if (maxPaths < 0)
            throw new IllegalArgumentException("maxPaths must not be negative: " + maxPaths);
    }

    /**
     * Reads settings from a key/value map. Missing keys keep their defaults.
     * <p>
     * Keys: {@code layout.nodeSpacingX}, {@code layout.layerSpacingY},
     * {@code layout.marginX}, {@code layout.marginY},
     * {@code paths.maxPathLength}, {@code paths.maxPaths},
     * {@code criticalPath.metric}.
     */
    public static AnalysisConfig fromProperties(Map<String, ?> props) {
        LayoutConfig layout = new LayoutConfig(
                getDouble(props, "layout.nodeSpacingX", LayoutConfig.DEFAULT_NODE_SPACING_X),
                getDouble(props, "layout.layerSpacingY", LayoutConfig.DEFAULT_LAYER_SPACING_Y),
                getDouble(props, "layout.marginX", LayoutConfig.DEFAULT_MARGIN_X),
                getDouble(props, "layout.marginY", LayoutConfig.DEFAULT_MARGIN_Y));
        Object metric = props.get("criticalPath.metric");
        return new AnalysisConfig(layout,
                getInt(props, "paths.maxPathLength", 0),
                getInt(props, "paths.maxPaths", 0),
                metric != null ? WeightMetric.fromString(metric.toString().trim()) : WeightMetric.DURATION);
    }

    /** Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if absent. */
    public static AnalysisConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /** Loads a classpath properties resource; defaults if the resource does not exist. */
    public static AnalysisConfig load(String resource) {
        try (InputStream in = AnalysisConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                return DEFAULT;
            Properties p = new Properties();
            p.load(in);
            Map<String, Object> map = new HashMap<>();
            for (String key : p.stringPropertyNames())
                map.put(key, p.getProperty(key));
            return fromProperties(map);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration " + resource, e);
        }
    }

    static double getDouble(Map<String, ?> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString().trim());
    }

    static int getInt(Map<String, ?> props, String key, int def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE)
                throw new IllegalArgumentException(key + " must be an integer: " + v);
            return (int) d;
        }
        return Integer.parseInt(v.toString().trim());
    }
}
