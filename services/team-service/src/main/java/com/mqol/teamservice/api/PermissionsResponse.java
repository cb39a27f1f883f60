package com.mqol.teamservice.api;

import com.mqol.access.Action;
import com.mqol.access.Resource;
import com.mqol.access.Role;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The caller's role and allowed actions keyed by resource, e.g.
 * {@code {"role":"member","permissions":{"team":["read","leave"]}}}.
 */
public record PermissionsResponse(String role, Map<String, List<String>> permissions) {

    static PermissionsResponse from(Role role, Map<Resource, Set<Action>> permissions) {
        Map<String, List<String>> byKey = new LinkedHashMap<>();
        permissions.forEach((resource, actions) ->
                byKey.put(resource.key(), actions.stream().map(Action::value).toList()));
        return new PermissionsResponse(role.value(), byKey);
    }
}
