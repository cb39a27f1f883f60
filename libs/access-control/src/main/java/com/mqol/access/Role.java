package com.mqol.access;

import java.util.Locale;
import java.util.Optional;

/**
 * Team roles, held once per membership.
 * <p>
 * The roles are totally ordered {@code OWNER > ADMIN > MEMBER}. The ordering is for ergonomic
 * checks only ("may this actor grant OWNER?"); whether a role may perform an action is always
 * looked up in the {@link PermissionMatrix}, never derived from rank, so a new action is never
 * granted to higher roles by accident.
 */
public enum Role {

    OWNER("owner", 3),
    ADMIN("admin", 2),
    MEMBER("member", 1);

    private final String value;
    private final int rank;

    Role(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    /** The canonical lower-case name used on the wire and in storage (e.g., "owner"). */
    public String value() {
        return value;
    }

    /**
     * True if this role ranks at or above {@code threshold}.
     */
    public boolean atLeast(Role threshold) {
        return rank >= threshold.rank;
    }

    /** Static form of {@link #atLeast(Role)}. */
    public static boolean atLeast(Role role, Role threshold) {
        return role.atLeast(threshold);
    }

    /**
     * Looks up a Role by its canonical name, case-insensitively.
     *
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
