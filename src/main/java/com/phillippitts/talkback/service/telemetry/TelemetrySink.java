package com.phillippitts.talkback.service.telemetry;

import java.time.Duration;

/**
 * Receives latency samples and milestone events from the orchestrator.
 *
 * <p>Implementations must be thread-safe and must not throw; the orchestrator calls them from
 * its session loop and from worker threads.
 *
 * @since 1.0
 */
public interface TelemetrySink {

    /**
     * Sink that discards everything. Default for builders and tests that do not assert telemetry.
     */
    TelemetrySink NOOP = new TelemetrySink() {
        @Override
        public void recordLatency(LatencyKind kind, Duration latency) {
            // no-op
        }

        @Override
        public void recordEvent(TelemetryEvent event) {
            // no-op
        }
    };

    void recordLatency(LatencyKind kind, Duration latency);

    void recordEvent(TelemetryEvent event);
}
