package com.workflow.pga.report;

/** Total step cost of one process, absent costs counting as 0. */
public record CostKpi(String processId, String processName, double totalCost) {
}
