package com.workflow.pga.report;

/** A Task step whose label matched a search. */
public record TaskMatch(String processId, String processName, String taskId, String taskLabel) {
}
