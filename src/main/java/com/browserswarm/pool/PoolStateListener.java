package com.browserswarm.pool;

/**
 * Receives a fresh pool snapshot after every worker state transition.
 * Implementations must not block; they are called on dispatch threads.
 */
@FunctionalInterface
public interface PoolStateListener {

    PoolStateListener NONE = status -> { };

    void onPoolStateChanged(PoolStatus status);
}
