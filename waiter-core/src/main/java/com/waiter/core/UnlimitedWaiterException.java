package com.waiter.core;

/** Neither a timeout nor an attempt limit was set, so the poll loop could never stop. */
public final class UnlimitedWaiterException extends WaiterConfigurationException {
    public UnlimitedWaiterException() {
        super("Waiter needs a timeout or maxAttempts limit; both are 0");
    }
}
