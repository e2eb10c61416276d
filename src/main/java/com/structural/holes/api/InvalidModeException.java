package com.structural.holes.api;

/** Thrown when a mode selector is missing or not one of both, out, in. */
public class InvalidModeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidModeException(String message) {
        super(message);
    }
}
