package com.acme.perf.governor.api;

/**
 * Handle returned by push-style collaborators. Closing it unsubscribes.
 *
 * <p>Implementations must tolerate {@link #close()} being called more than once.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
    Subscription NOOP = () -> { };

    @Override
    void close();
}
