package com.workflow.pga.report;

import java.util.List;

/**
 * Roles a process needs people for.
 *
 * @param requiredRoles Distinct roles, sorted; placeholder roles excluded.
 * @param roleCount     Size of {@code requiredRoles}.
 */
public record ResourceRequirement(String processId, String processName, List<String> requiredRoles, int roleCount) {

    public ResourceRequirement {
        requiredRoles = List.copyOf(requiredRoles);
    }

    static ResourceRequirement of(String processId, String processName, List<String> roles) {
        return new ResourceRequirement(processId, processName, roles, roles.size());
    }
}
