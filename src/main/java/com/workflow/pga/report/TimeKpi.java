package com.workflow.pga.report;

/**
 * Total step duration of one process.
 *
 * @param totalMinutes Sum of step durations, absent durations counting as 0.
 * @param totalHours   {@code totalMinutes / 60}, rounded to two decimals.
 */
public record TimeKpi(String processId, String processName, double totalMinutes, double totalHours) {
}
