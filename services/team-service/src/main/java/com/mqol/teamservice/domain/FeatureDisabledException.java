package com.mqol.teamservice.domain;

/**
 * Thrown when an operation belongs to a feature switched off for the deployment or the team.
 */
public class FeatureDisabledException extends RuntimeException {

    private final String feature;

    public FeatureDisabledException(String feature) {
        super("Feature disabled: " + feature);
        this.feature = feature;
    }

    public String feature() {
        return feature;
    }
}
