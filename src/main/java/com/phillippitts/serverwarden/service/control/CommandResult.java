package com.phillippitts.serverwarden.service.control;

/**
 * Outcome of an external command that ran to completion.
 *
 * @param exitCode   process exit code
 * @param stdout     captured standard output (capped)
 * @param stderr     captured standard error (capped)
 * @param durationMs wall time in milliseconds
 */
public record CommandResult(int exitCode, String stdout, String stderr, long durationMs) {

    public boolean succeeded() {
        return exitCode == 0;
    }

    /** Standard output followed by standard error, for marker searches. */
    public String combinedOutput() {
        if (stderr.isEmpty()) {
            return stdout;
        }
        return stdout.isEmpty() ? stderr : stdout + "\n" + stderr;
    }
}
