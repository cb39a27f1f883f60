package com.mqol.access;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a {@link PermissionMatrix} is built without an explicit entry for every
 * role × resource × applicable action.
 * <p>
 * WHY a RuntimeException: an incomplete matrix is a deployment error. It surfaces while the
 * application context starts, never at request time.
 */
public class ConfigurationGapException extends RuntimeException {

    /** One unset cell of the matrix. */
    public record Cell(Role role, Resource resource, Action action) {

        @Override
        public String toString() {
            return role.value() + ":" + resource.key() + ":" + action.value();
        }
    }

    private final List<Cell> missing;

    public ConfigurationGapException(List<Cell> missing) {
        super("Permission matrix has %d unset cell(s): %s".formatted(
                missing.size(),
                missing.stream().map(Cell::toString).collect(Collectors.joining(", "))));
        this.missing = List.copyOf(missing);
    }

    public List<Cell> missing() {
        return missing;
    }
}
