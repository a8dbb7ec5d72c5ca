package com.workflow.pga.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of the interchange document: a process graph plus any
 * subset of its analysis results. Absent sections are omitted from JSON.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "process", "nodes", "edges", "layout", "paths", "bottlenecks", "criticalPath" })
public final class ProcessDocument {
    private ProcessInfo process;
    private List<NodeDef> nodes;
    private List<EdgeDef> edges;
    private List<LayoutDef> layout;
    private List<List<String>> paths;
    private List<BottleneckDef> bottlenecks;
    private CriticalPathDef criticalPath;

    /** Identity of the process. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ProcessInfo {
        private String id, name;
    }

    /** One workflow step. {@code kind} is one of Start, End, Task, Gateway, Event. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "id", "label", "kind", "duration", "cost", "role" })
    public static final class NodeDef {
        private String id, label, kind;
        private Double duration, cost;
        private String role;
    }

    /** One sequence flow. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EdgeDef {
        private String from, to;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({ "id", "x", "y", "layer" })
    public static final class LayoutDef {
        private String id;
        private double x, y;
        private int layer;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BottleneckDef {
        private String id;
        private int distinctPredecessorCount;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CriticalPathDef {
        private List<String> nodes;
        private double weight;
    }
}
