package com.phillippitts.serverwarden.domain;

import java.util.Locale;

/**
 * Kinds of delayed actions an administrator (or the update checker) can schedule.
 */
public enum ActionKind {
    RESTART("restart"),
    STOP("stop"),
    UPDATE("update");

    private final String key;

    ActionKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a kind from its lower-case key or enum name.
     *
     * @throws IllegalArgumentException for unknown kinds
     */
    public static ActionKind fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Action kind must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ActionKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown action kind: '" + value
                + "'. Allowed: restart, stop, update");
    }
}
