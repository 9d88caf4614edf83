package com.phillippitts.serverwarden.service.schedule;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * What the periodic restart schedule wants done on this tick.
 *
 * @param warnings   minute thresholds to announce for the upcoming restart
 * @param outcome    whether an occurrence was consumed
 * @param occurrence the consumed occurrence (null for {@link Outcome#NONE})
 * @param next       the following occurrence after this tick
 */
public record PeriodicTick(List<Integer> warnings, Outcome outcome, ZonedDateTime occurrence, ZonedDateTime next) {

    public enum Outcome {
        NONE,
        /** Back up, then restart. */
        EXECUTE,
        /** Occurrence consumed without restarting. */
        SKIPPED
    }

    public PeriodicTick {
        warnings = List.copyOf(warnings);
    }

    static PeriodicTick idle(List<Integer> warnings, ZonedDateTime next) {
        return new PeriodicTick(warnings, Outcome.NONE, null, next);
    }
}
