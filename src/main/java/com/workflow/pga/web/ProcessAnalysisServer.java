package com.workflow.pga.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.pga.ProcessAnalysisEngine;
import com.workflow.pga.analysis.PathSet;
import com.workflow.pga.api.GraphProvider;
import com.workflow.pga.api.GraphValidationException;
import com.workflow.pga.api.NoPathException;
import com.workflow.pga.api.ProcessNotFoundException;
import com.workflow.pga.api.UnknownNodeException;
import com.workflow.pga.io.ProcessDocumentCodec;
import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.WeightMetric;

import io.javalin.Javalin;
import io.javalin.http.Context;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only HTTP adapter that hands analysis results to a presentation layer
 * as plain JSON. Every request fetches a fresh graph snapshot from the
 * provider and recomputes; the server keeps no per-process state.
 *
 * <pre>
 * GET /api/processes                          ids known to the provider
 * GET /api/processes/{id}                     full export document
 * GET /api/processes/{id}/layout
 * GET /api/processes/{id}/paths
 * GET /api/processes/{id}/bottlenecks
 * GET /api/processes/{id}/critical-path?metric=duration|cost
 * GET /api/kpi/time                           total duration per process
 * GET /api/kpi/cost                           total cost per process
 * GET /api/kpi/resources                      roles per process
 * GET /api/tasks?name=...                     task search across processes
 * GET /api/gateways                           branching steps across processes
 * </pre>
 */
public class ProcessAnalysisServer {
    private static final Logger log = LogManager.getLogger(ProcessAnalysisServer.class);
    private static final String JSON = "application/json";

    private final ProcessAnalysisEngine engine;
    private final GraphProvider provider;
    private final ProcessDocumentCodec codec;
    private final ObjectMapper mapper = new ObjectMapper();
    private Javalin app;

    public ProcessAnalysisServer(ProcessAnalysisEngine engine, GraphProvider provider) {
        this.engine = engine;
        this.provider = provider;
        this.codec = new ProcessDocumentCodec(mapper);
    }

    /**
     * Starts the server.
     *
     * @param port Port to listen on; 0 picks a free one.
     */
    public ProcessAnalysisServer start(int port) {
        app = Javalin.create(config -> config.showJavalinBanner = false);

        app.get("/api/processes", ctx -> respond(ctx, provider.processIds()));
        app.get("/api/processes/{id}", ctx -> {
            ProcessGraph graph = fetch(ctx);
            ctx.contentType(JSON).result(codec.toJson(codec.export(graph, engine.analyze(graph))));
        });
        app.get("/api/processes/{id}/layout", ctx -> {
            ProcessGraph graph = fetch(ctx);
            respond(ctx, codec.export(graph, engine.layout(graph), null, null, null).getLayout());
        });
        app.get("/api/processes/{id}/paths", ctx -> {
            PathSet paths = engine.paths(fetch(ctx));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("paths", paths.paths());
            body.put("truncated", paths.isTruncated());
            body.put("limitSignals", paths.limitSignals());
            respond(ctx, body);
        });
        app.get("/api/processes/{id}/bottlenecks", ctx -> {
            ProcessGraph graph = fetch(ctx);
            respond(ctx, codec.export(graph, null, null, engine.bottlenecks(graph), null).getBottlenecks());
        });
        app.get("/api/processes/{id}/critical-path", ctx -> {
            String metric = ctx.queryParam("metric");
            WeightMetric m = metric != null ? WeightMetric.fromString(metric) : engine.config().weightMetric();
            respond(ctx, engine.criticalPath(fetch(ctx), m));
        });

        app.get("/api/kpi/time", ctx -> respond(ctx, engine.timeKpi(provider)));
        app.get("/api/kpi/cost", ctx -> respond(ctx, engine.costKpi(provider)));
        app.get("/api/kpi/resources", ctx -> respond(ctx, engine.resourceRequirements(provider)));
        app.get("/api/tasks", ctx -> respond(ctx, engine.findTask(provider, ctx.queryParam("name"))));
        app.get("/api/gateways", ctx -> respond(ctx, engine.gateways(provider)));

        app.exception(ProcessNotFoundException.class, (e, ctx) -> error(ctx, 404, e.getMessage()));
        app.exception(UnknownNodeException.class, (e, ctx) -> error(ctx, 404, e.getMessage()));
        app.exception(GraphValidationException.class, (e, ctx) -> error(ctx, 400, e.getMessage()));
        app.exception(IllegalArgumentException.class, (e, ctx) -> error(ctx, 400, e.getMessage()));
        app.exception(NoPathException.class, (e, ctx) -> error(ctx, 422, e.getMessage()));
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Request {} failed", ctx.path(), e);
            error(ctx, 500, "Internal error");
        });

        app.start(port);
        log.info("Process analysis server listening on port {}", app.port());
        return this;
    }

    public int port() {
        return app.port();
    }

    public void stop() {
        if (app != null) {
            app.stop();
            log.info("Process analysis server stopped");
        }
    }

    private ProcessGraph fetch(Context ctx) {
        return provider.fetchGraph(ctx.pathParam("id"));
    }

    private void respond(Context ctx, Object body) throws JsonProcessingException {
        ctx.contentType(JSON).result(mapper.writeValueAsString(body));
    }

    private void error(Context ctx, int status, String message) {
        Map<String, String> body = Map.of("error", message != null ? message : "");
        try {
            ctx.status(status).contentType(JSON).result(mapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            ctx.status(status).result(message);
        }
    }
}
