package com.mqol.teamservice.domain;

/** Thrown when a request reaches the service without an authenticated actor. */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
