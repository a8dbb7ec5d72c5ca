package com.workflow.pga;

import com.workflow.pga.analysis.BottleneckAnalyzer;
import com.workflow.pga.analysis.BottleneckRecord;
import com.workflow.pga.analysis.BranchAnalyzer;
import com.workflow.pga.analysis.BranchPoint;
import com.workflow.pga.analysis.CriticalPathCalculator;
import com.workflow.pga.analysis.CriticalPathResult;
import com.workflow.pga.analysis.PathEnumerator;
import com.workflow.pga.analysis.PathSet;
import com.workflow.pga.api.GraphProvider;
import com.workflow.pga.api.NoPathException;
import com.workflow.pga.layout.LayeredLayoutEngine;
import com.workflow.pga.layout.LayoutResult;
import com.workflow.pga.model.NodeKind;
import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.WeightMetric;
import com.workflow.pga.report.CostKpi;
import com.workflow.pga.report.GatewayRecord;
import com.workflow.pga.report.PortfolioReport;
import com.workflow.pga.report.ResourceRequirement;
import com.workflow.pga.report.TaskMatch;
import com.workflow.pga.report.TimeKpi;
import com.workflow.pga.util.ProcessStatistics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Entry point of the analysis engine.
 * <p>
 * Wires the layout engine and the analyzers from one {@link AnalysisConfig}.
 * Every call reads the graph only and returns fresh results; nothing is cached
 * between calls. Holds no mutable state, so one instance can serve many
 * threads as long as each graph is left unmodified, which {@link ProcessGraph}
 * guarantees.
 */
public class ProcessAnalysisEngine {
    private static final Logger log = LogManager.getLogger(ProcessAnalysisEngine.class);

    private final AnalysisConfig config;
    private final LayeredLayoutEngine layoutEngine;
    private final PathEnumerator pathEnumerator;
    private final BottleneckAnalyzer bottleneckAnalyzer = new BottleneckAnalyzer();
    private final BranchAnalyzer branchAnalyzer = new BranchAnalyzer();
    private final CriticalPathCalculator criticalPathCalculator;

    public ProcessAnalysisEngine() {
        this(AnalysisConfig.DEFAULT);
    }

    public ProcessAnalysisEngine(AnalysisConfig config) {
        this.config = config;
        this.layoutEngine = new LayeredLayoutEngine(config.layout());
        this.pathEnumerator = new PathEnumerator(config.maxPathLength(), config.maxPaths());
        this.criticalPathCalculator = new CriticalPathCalculator(pathEnumerator);
    }

    public AnalysisConfig config() {
        return config;
    }

    public LayoutResult layout(ProcessGraph graph) {
        return layoutEngine.layout(graph);
    }

    public PathSet paths(ProcessGraph graph) {
        return pathEnumerator.enumerate(graph);
    }

    public PathSet paths(ProcessGraph graph, NodeKind startKind, NodeKind endKind) {
        return pathEnumerator.enumerate(graph, startKind, endKind);
    }

    public PathSet paths(ProcessGraph graph, String startId, String endId) {
        return pathEnumerator.enumerate(graph, startId, endId);
    }

    public List<BottleneckRecord> bottlenecks(ProcessGraph graph) {
        return bottleneckAnalyzer.analyze(graph);
    }

    public List<BranchPoint> branches(ProcessGraph graph) {
        return branchAnalyzer.analyze(graph);
    }

    /** Critical path by the configured default metric. */
    public CriticalPathResult criticalPath(ProcessGraph graph) {
        return criticalPath(graph, config.weightMetric());
    }

    public CriticalPathResult criticalPath(ProcessGraph graph, WeightMetric metric) {
        return criticalPathCalculator.calculate(graph, metric);
    }

    public ProcessStatistics statistics(ProcessGraph graph) {
        return ProcessStatistics.of(graph);
    }

    // Reports across every process of a provider

    public List<TimeKpi> timeKpi(GraphProvider provider) {
        return new PortfolioReport(provider).timeKpi();
    }

    public List<CostKpi> costKpi(GraphProvider provider) {
        return new PortfolioReport(provider).costKpi();
    }

    public List<ResourceRequirement> resourceRequirements(GraphProvider provider) {
        return new PortfolioReport(provider).resourceRequirements();
    }

    public List<TaskMatch> findTask(GraphProvider provider, String name) {
        return new PortfolioReport(provider).findTask(name);
    }

    public List<GatewayRecord> gateways(GraphProvider provider) {
        return new PortfolioReport(provider).gateways();
    }

    /**
     * Fetches a graph from {@code provider} and analyzes it.
     * A {@link com.workflow.pga.api.ProcessNotFoundException} from the provider
     * reaches the caller unchanged.
     */
    public ProcessAnalysis analyze(GraphProvider provider, String processId) {
        return analyze(provider.fetchGraph(processId));
    }

    /**
     * Runs every analysis. A missing start-to-end path leaves the critical path
     * empty; the other results are unaffected.
     */
    public ProcessAnalysis analyze(ProcessGraph graph) {
        long t0 = System.nanoTime();
        LayoutResult layout = layout(graph);
        PathSet paths = paths(graph);
        List<BottleneckRecord> bottlenecks = bottlenecks(graph);
        List<BranchPoint> branches = branches(graph);

        CriticalPathResult critical = null;
        try {
            critical = criticalPathCalculator.select(graph, paths, config.weightMetric());
        } catch (NoPathException e) {
            log.warn("Process {}: no critical path ({})", graph.processId(), e.getMessage());
        }

        ProcessAnalysis result = new ProcessAnalysis(graph, layout, paths, bottlenecks, branches, critical,
                statistics(graph));
        log.info("Analyzed process {} in {} us: {} nodes, {} layers, {} paths{}, {} bottlenecks",
                graph.processId(), (System.nanoTime() - t0) / 1_000, graph.nodeCount(), layout.layerCount(),
                paths.size(), paths.isTruncated() ? " (truncated)" : "", bottlenecks.size());
        return result;
    }
}
