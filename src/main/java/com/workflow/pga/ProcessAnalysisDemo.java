package com.workflow.pga;

import com.workflow.pga.analysis.BottleneckRecord;
import com.workflow.pga.io.ProcessDocumentCodec;
import com.workflow.pga.model.NodeKind;
import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.ProcessNode;
import com.workflow.pga.store.InMemoryGraphProvider;
import com.workflow.pga.util.ProcessExplain;
import com.workflow.pga.web.ProcessAnalysisServer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Analyzes a loan approval process with a document rework loop.
 * <p>
 * Run with {@code --serve [port]} to expose the results over HTTP instead of
 * exiting.
 */
public class ProcessAnalysisDemo {
    private static final Logger log = LogManager.getLogger(ProcessAnalysisDemo.class);

    public static void main(String[] args) throws Exception {
        ProcessGraph graph = loanApproval();
        ProcessAnalysisEngine engine = new ProcessAnalysisEngine(AnalysisConfig.load());
        ProcessAnalysis analysis = engine.analyze(graph);

        log.info("\n{}", new ProcessExplain(graph).dumpTopology());
        log.info("Layout: {} layers, {} x {} px", analysis.layout().layerCount(), analysis.layout().width(),
                analysis.layout().height());
        for (var path : analysis.paths().paths())
            log.info("Path: {}", String.join(" -> ", path));
        for (BottleneckRecord b : analysis.bottlenecks())
            log.info("Bottleneck: {} ({} incoming branches)", b.nodeId(), b.distinctPredecessorCount());
        analysis.findCriticalPath().ifPresent(cp -> log.info("Critical path ({} = {}): {}",
                cp.metric(), cp.weight(), String.join(" -> ", cp.nodes())));
        log.info("Statistics: {}", analysis.statistics());

        log.info("Mermaid:\n{}", new ProcessExplain(graph).toMermaid(analysis.criticalPath()));

        ProcessDocumentCodec codec = new ProcessDocumentCodec();
        log.info("Export:\n{}", codec.toJson(codec.export(graph, analysis)));

        if (args.length > 0 && "--serve".equals(args[0])) {
            int port = args.length > 1 ? Integer.parseInt(args[1]) : 7070;
            ProcessAnalysisServer server = new ProcessAnalysisServer(engine,
                    new InMemoryGraphProvider().register(graph)).start(port);
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
        }
    }

    static ProcessGraph loanApproval() {
        return ProcessGraph.builder("loan-approval", "Loan Approval")
                .addNode(ProcessNode.start("start").withLabel("Application received"))
                .addNode(ProcessNode.task("check_docs").withLabel("Check documents")
                        .withDuration(30.0).withCost(20.0).withRole("Clerk"))
                .addNode(ProcessNode.task("request_docs").withLabel("Request missing documents")
                        .withDuration(15.0).withCost(5.0).withRole("Clerk"))
                .addNode(new ProcessNode("complete", "Documents complete?", NodeKind.GATEWAY, null, null, null))
                .addNode(ProcessNode.task("credit_check").withLabel("Credit check")
                        .withDuration(60.0).withCost(45.0).withRole("Analyst"))
                .addNode(ProcessNode.task("risk_review").withLabel("Risk review")
                        .withDuration(120.0).withCost(90.0).withRole("Risk Officer"))
                .addNode(new ProcessNode("decide", "Decision", NodeKind.GATEWAY, 10.0, 15.0, "Manager"))
                .addNode(new ProcessNode("notify", "Notify applicant", NodeKind.EVENT, 5.0, 1.0, null))
                .addNode(ProcessNode.end("end").withLabel("Closed"))
                .addEdge("start", "check_docs")
                .addEdge("check_docs", "complete")
                .addEdge("complete", "request_docs")
                .addEdge("request_docs", "check_docs")
                .addEdge("complete", "credit_check")
                .addEdge("complete", "risk_review")
                .addEdge("credit_check", "decide")
                .addEdge("risk_review", "decide")
                .addEdge("decide", "notify")
                .addEdge("notify", "end")
                .build();
    }
}
