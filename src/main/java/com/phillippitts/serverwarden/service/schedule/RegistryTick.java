package com.phillippitts.serverwarden.service.schedule;

import java.util.List;

/**
 * What the action registry wants done on this tick.
 *
 * @param warnings   warnings to announce
 * @param executions actions to execute, already removed from the registry
 */
public record RegistryTick(List<DueWarning> warnings, List<ScheduledAction> executions) {

    public RegistryTick {
        warnings = List.copyOf(warnings);
        executions = List.copyOf(executions);
    }

    public boolean isEmpty() {
        return warnings.isEmpty() && executions.isEmpty();
    }
}
