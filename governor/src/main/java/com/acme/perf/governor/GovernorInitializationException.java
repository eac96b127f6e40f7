package com.acme.perf.governor;

/**
 * Thrown by {@link AdaptiveGovernor#initialize(GovernorConfig)} when the governor cannot start.
 * The governor is left uninitialized.
 */
public final class GovernorInitializationException extends Exception {
    public GovernorInitializationException(String message) {
        super(message);
    }

    public GovernorInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
