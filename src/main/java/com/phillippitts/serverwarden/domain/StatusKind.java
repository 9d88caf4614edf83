package com.phillippitts.serverwarden.domain;

/**
 * Lifecycle states of the managed server, shared by parsed log events and the canonical status.
 *
 * <p>States carry a total order {@code UNKNOWN < OFFLINE < STARTING < LOADING < ONLINE}.
 * {@link #SHUTTING_DOWN} sits outside that order: it is a hard override that is always accepted,
 * like {@link #OFFLINE}, regardless of how far the server had progressed.
 */
public enum StatusKind {
    UNKNOWN(0, "Unknown"),
    OFFLINE(1, "Offline"),
    STARTING(2, "Starting"),
    LOADING(3, "Loading"),
    ONLINE(4, "Online"),
    SHUTTING_DOWN(-1, "Shutting down");

    private final int priority;
    private final String label;

    StatusKind(int priority, String label) {
        this.priority = priority;
        this.label = label;
    }

    /**
     * Position in the lifecycle order; {@code -1} for {@link #SHUTTING_DOWN}, which is unordered.
     */
    public int priority() {
        return priority;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true for states that must be accepted even when they regress below the
     * highest state reached.
     */
    public boolean isRegressionOverride() {
        return this == SHUTTING_DOWN || this == OFFLINE;
    }

    /**
     * Returns true when this state is at least as advanced as {@code other} in the lifecycle order.
     */
    public boolean isAtLeast(StatusKind other) {
        return priority >= other.priority;
    }
}
