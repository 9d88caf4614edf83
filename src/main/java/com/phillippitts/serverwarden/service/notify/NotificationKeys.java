package com.phillippitts.serverwarden.service.notify;

/**
 * Event keys used in notifications.
 */
public final class NotificationKeys {

    public static final String STATUS_CHANGED = "status-changed";

    public static final String ACTION_SCHEDULED = "action-scheduled";
    public static final String ACTION_CANCELLED = "action-cancelled";
    public static final String ACTION_WARNING = "action-warning";
    public static final String ACTION_COMPLETED = "action-completed";
    public static final String ACTION_FAILED = "action-failed";

    public static final String PERIODIC_RESTART_WARNING = "periodic-restart-warning";
    public static final String PERIODIC_RESTART_SKIP_REQUESTED = "periodic-restart-skip-requested";
    public static final String PERIODIC_RESTART_SKIPPED = "periodic-restart-skipped";
    public static final String PERIODIC_RESTART_COMPLETED = "periodic-restart-completed";
    public static final String PERIODIC_RESTART_FAILED = "periodic-restart-failed";

    public static final String SERVER_STARTED = "server-started";
    public static final String SERVER_START_FAILED = "server-start-failed";

    public static final String RECOVERY_RESTARTED = "recovery-restarted";
    public static final String RECOVERY_FAILED = "recovery-failed";
    public static final String RECOVERY_EXHAUSTED = "recovery-exhausted";
    public static final String RECOVERY_INTENTIONAL_STOP = "recovery-intentional-stop";
    public static final String STARTUP_TIMEOUT = "startup-timeout";

    public static final String BACKUP_COMPLETED = "backup-completed";
    public static final String BACKUP_FAILED = "backup-failed";

    public static final String UPDATE_CHECK_FAILED = "update-check-failed";

    private NotificationKeys() {}
}
