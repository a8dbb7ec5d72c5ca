package com.workflow.pga.report;

import com.workflow.pga.api.GraphProvider;
import com.workflow.pga.api.ProcessNotFoundException;
import com.workflow.pga.model.NodeKind;
import com.workflow.pga.model.ProcessGraph;
import com.workflow.pga.model.ProcessNode;
import com.workflow.pga.model.WeightMetric;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Reports spanning every process a {@link GraphProvider} serves: time and cost
 * rankings, role requirements, task search and the branching steps of each
 * process.
 *
 * Processes are visited in id order. A process that disappears between
 * {@link GraphProvider#processIds()} and its fetch is skipped with a warning.
 */
@Log4j2
public final class PortfolioReport {
    /** Role values that mark automated or structural steps rather than people. */
    public static final Set<String> EXCLUDED_ROLES = Set.of("System", "Start", "End");

    private final GraphProvider provider;

    public PortfolioReport(GraphProvider provider) {
        this.provider = provider;
    }

    /** Total duration per process, longest first; ties by process id. */
    public List<TimeKpi> timeKpi() {
        List<TimeKpi> out = new ArrayList<>();
        for (ProcessGraph g : graphs()) {
            double minutes = total(g, WeightMetric.DURATION);
            out.add(new TimeKpi(g.processId(), g.name(), minutes, Math.round(minutes / 60.0 * 100.0) / 100.0));
        }
        out.sort(Comparator.comparingDouble(TimeKpi::totalMinutes).reversed()
                .thenComparing(TimeKpi::processId));
        return out;
    }

    /** Total cost per process, most expensive first; ties by process id. */
    public List<CostKpi> costKpi() {
        List<CostKpi> out = new ArrayList<>();
        for (ProcessGraph g : graphs())
            out.add(new CostKpi(g.processId(), g.name(), total(g, WeightMetric.COST)));
        out.sort(Comparator.comparingDouble(CostKpi::totalCost).reversed()
                .thenComparing(CostKpi::processId));
        return out;
    }

    /**
     * Distinct roles per process, ignoring {@link #EXCLUDED_ROLES}. Processes
     * without any remaining role are left out.
     */
    public List<ResourceRequirement> resourceRequirements() {
        List<ResourceRequirement> out = new ArrayList<>();
        for (ProcessGraph g : graphs()) {
            TreeSet<String> roles = new TreeSet<>();
            for (ProcessNode n : g.nodes()) {
                if (n.role() == null)
                    continue;
                String role = n.role().trim();
                if (!role.isEmpty() && !EXCLUDED_ROLES.contains(role))
                    roles.add(role);
            }
            if (!roles.isEmpty())
                out.add(ResourceRequirement.of(g.processId(), g.name(), new ArrayList<>(roles)));
        }
        return out;
    }

    /**
     * Task steps whose label contains {@code name}, case-insensitive, by process
     * id and then step order.
     */
    public List<TaskMatch> findTask(String name) {
        if (name == null)
            throw new IllegalArgumentException("Task name is required");
        String needle = name.toLowerCase(Locale.ROOT);
        List<TaskMatch> out = new ArrayList<>();
        for (ProcessGraph g : graphs())
            for (ProcessNode n : g.nodes())
                if (n.kind() == NodeKind.TASK && n.label().toLowerCase(Locale.ROOT).contains(needle))
                    out.add(new TaskMatch(g.processId(), g.name(), n.id(), n.label()));
        return out;
    }

    /**
     * Gateway and Event steps with at least one distinct successor, by process
     * id, then label, then step id.
     */
    public List<GatewayRecord> gateways() {
        List<GatewayRecord> out = new ArrayList<>();
        for (ProcessGraph g : graphs()) {
            List<GatewayRecord> perProcess = new ArrayList<>();
            for (ProcessNode n : g.nodes()) {
                if (n.kind() != NodeKind.GATEWAY && n.kind() != NodeKind.EVENT)
                    continue;
                int branches = g.distinctSuccessors(n.id()).size();
                if (branches > 0)
                    perProcess.add(new GatewayRecord(g.processId(), g.name(), n.id(), n.label(), n.kind(),
                            branches));
            }
            perProcess.sort(Comparator.comparing(GatewayRecord::gatewayLabel)
                    .thenComparing(GatewayRecord::gatewayId));
            out.addAll(perProcess);
        }
        return out;
    }

    private List<ProcessGraph> graphs() {
        List<String> ids = new ArrayList<>(provider.processIds());
        Collections.sort(ids);
        List<ProcessGraph> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            try {
                out.add(provider.fetchGraph(id));
            } catch (ProcessNotFoundException e) {
                log.warn("Process {} vanished while building report, skipped", id);
            }
        }
        return out;
    }

    private static double total(ProcessGraph g, WeightMetric metric) {
        double sum = 0;
        for (ProcessNode n : g.nodes())
            sum += n.weight(metric);
        return sum;
    }
}
