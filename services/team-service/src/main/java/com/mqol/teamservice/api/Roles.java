package com.mqol.teamservice.api;

import com.mqol.access.Role;

final class Roles {

    private Roles() {
    }

    static Role parse(String value) {
        return Role.fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role '%s'".formatted(value)));
    }
}
