package com.realtimeanalytics.core.engine;

/**
 * Lifecycle of an {@link AnalyticsEngine}. Transitions only move forward.
 *
 * @since 1.0.0
 */
public enum EngineState {

    /** Constructed; writes are dropped until {@link AnalyticsEngine#start()}. */
    NEW,

    /** Loading baselines. */
    STARTING,

    /** Accepting writes. */
    RUNNING,

    /** Shutdown in progress; writes are dropped. */
    CLOSING,

    /** Fully drained and storage closed. */
    CLOSED
}
