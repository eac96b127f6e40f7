package com.acme.perf.governor.api;

/**
 * Host application lifecycle signals. The governor listens for the "backgrounded"
 * notification and answers it with a forced memory optimization.
 */
public interface HostLifecycle {
    HostLifecycle NONE = onBackgrounded -> Subscription.NOOP;

    Subscription subscribeBackgrounded(Runnable onBackgrounded);
}
