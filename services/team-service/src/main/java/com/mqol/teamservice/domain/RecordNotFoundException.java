package com.mqol.teamservice.domain;

/**
 * Thrown when a record does not exist inside the caller's team. Records of other teams are
 * reported the same way, never as forbidden.
 */
public class RecordNotFoundException extends RuntimeException {

    private final String thing;

    public RecordNotFoundException(String thing) {
        super(thing + " not found");
        this.thing = thing;
    }

    public String thing() {
        return thing;
    }
}
