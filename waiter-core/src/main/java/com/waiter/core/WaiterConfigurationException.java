package com.waiter.core;

/** Raised when a waiter is built from settings it can never run with. */
public class WaiterConfigurationException extends IllegalArgumentException {
    public WaiterConfigurationException(String message) {
        super(message);
    }
}
