package com.mqol.teamservice.domain;

/**
 * The authenticated caller, identified by the id the upstream authentication layer issued.
 */
public record Actor(String id) {

    public Actor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("actor id must not be blank");
        }
    }
}
