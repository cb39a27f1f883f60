package com.mqol.access;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table answering "may role R perform action A on resource X?".
 * <p>
 * Built once through {@link Builder} and shared by reference. Lookups are two {@link EnumMap}
 * hops and a set check. Anything not granted, including actions a resource does not support,
 * is denied.
 * <p>
 * WHY no rank fallback: grants are listed per role. OWNER is a superset of ADMIN only because
 * the table says so, so adding an action never silently widens a higher role.
 */
public final class PermissionMatrix {

    private final Map<Role, Map<Resource, Set<Action>>> grants;

    private PermissionMatrix(Map<Role, Map<Resource, Set<Action>>> grants) {
        this.grants = grants;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns true only when the cell for (role, resource, action) was explicitly allowed.
     */
    public boolean allows(Role role, Resource resource, Action action) {
        if (role == null || resource == null || action == null) {
            return false;
        }
        return grants.get(role).get(resource).contains(action);
    }

    /**
     * The role's granted actions per resource. Resources with no granted action are omitted.
     */
    public Map<Resource, Set<Action>> permissionsFor(Role role) {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        Map<Resource, Set<Action>> result = new EnumMap<>(Resource.class);
        grants.get(role).forEach((resource, actions) -> {
            if (!actions.isEmpty()) {
                result.put(resource, actions);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    /**
     * Collects one decision per cell. {@link #build()} refuses to produce a matrix while any
     * role × resource × applicable action is left unset.
     */
    public static final class Builder {

        private final Map<Role, Map<Resource, Map<Action, Boolean>>> cells = new EnumMap<>(Role.class);

        private Builder() {
        }

        public Builder allow(Role role, Resource resource, Action... actions) {
            return set(role, resource, true, actions);
        }

        public Builder deny(Role role, Resource resource, Action... actions) {
            return set(role, resource, false, actions);
        }

        /** Allows every action the resource supports. */
        public Builder allowAll(Role role, Resource resource) {
            return allow(role, resource, resource.actions().toArray(Action[]::new));
        }

        /** Denies every action the resource supports. */
        public Builder denyAll(Role role, Resource resource) {
            return deny(role, resource, resource.actions().toArray(Action[]::new));
        }

        /**
         * Allows only the listed actions and denies the rest of the resource's actions.
         */
        public Builder only(Role role, Resource resource, Action... actions) {
            Set<Action> allowed = actions.length == 0
                    ? EnumSet.noneOf(Action.class)
                    : EnumSet.of(actions[0], actions);
            for (Action action : resource.actions()) {
                set(role, resource, allowed.contains(action), action);
            }
            return this;
        }

        /**
         * @throws ConfigurationGapException if any applicable cell has no entry
         */
        public PermissionMatrix build() {
            List<ConfigurationGapException.Cell> missing = new ArrayList<>();
            Map<Role, Map<Resource, Set<Action>>> grants = new EnumMap<>(Role.class);

            for (Role role : Role.values()) {
                Map<Resource, Map<Action, Boolean>> byResource =
                        cells.getOrDefault(role, Map.of());
                Map<Resource, Set<Action>> roleGrants = new EnumMap<>(Resource.class);
                for (Resource resource : Resource.values()) {
                    Map<Action, Boolean> byAction = byResource.getOrDefault(resource, Map.of());
                    Set<Action> allowed = EnumSet.noneOf(Action.class);
                    for (Action action : resource.actions()) {
                        Boolean value = byAction.get(action);
                        if (value == null) {
                            missing.add(new ConfigurationGapException.Cell(role, resource, action));
                        } else if (value) {
                            allowed.add(action);
                        }
                    }
                    roleGrants.put(resource, Collections.unmodifiableSet(allowed));
                }
                grants.put(role, Collections.unmodifiableMap(roleGrants));
            }

            if (!missing.isEmpty()) {
                throw new ConfigurationGapException(missing);
            }
            return new PermissionMatrix(Collections.unmodifiableMap(grants));
        }

        private Builder set(Role role, Resource resource, boolean value, Action... actions) {
            if (role == null || resource == null) {
                throw new IllegalArgumentException("role and resource must not be null");
            }
            Map<Action, Boolean> byAction = cells
                    .computeIfAbsent(role, r -> new EnumMap<>(Resource.class))
                    .computeIfAbsent(resource, r -> new EnumMap<>(Action.class));
            for (Action action : actions) {
                if (!resource.supports(action)) {
                    throw new IllegalArgumentException(
                            "Action '%s' does not apply to resource '%s'"
                                    .formatted(action.value(), resource.key()));
                }
                Boolean previous = byAction.putIfAbsent(action, value);
                if (previous != null && previous != value) {
                    throw new IllegalArgumentException(
                            "Conflicting entries for %s:%s:%s"
                                    .formatted(role.value(), resource.key(), action.value()));
                }
            }
            return this;
        }
    }
}
