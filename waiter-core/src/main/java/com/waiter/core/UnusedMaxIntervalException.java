package com.waiter.core;

/** A maxInterval was set on a waiter without exponential backoff. */
public final class UnusedMaxIntervalException extends WaiterConfigurationException {
    public UnusedMaxIntervalException() {
        super("maxInterval is only used with exponential backoff");
    }
}
