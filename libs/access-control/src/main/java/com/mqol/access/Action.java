package com.mqol.access;

import java.util.Locale;
import java.util.Optional;

/**
 * Operations that can be performed on a {@link Resource}. Each resource declares which of these
 * apply to it.
 */
public enum Action {
    CREATE("create"),
    READ("read"),
    UPDATE("update"),
    DELETE("delete"),
    LEAVE("leave");

    private final String value;

    Action(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<Action> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Action action : values()) {
            if (action.value.equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
