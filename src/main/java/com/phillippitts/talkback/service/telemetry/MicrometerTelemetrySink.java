package com.phillippitts.talkback.service.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Micrometer-backed telemetry for conversation sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>{@code talkback.conversation.latency} timer, tagged with {@code kind}</li>
 *   <li>{@code talkback.conversation.events} counter, tagged with {@code event}</li>
 * </ul>
 *
 * <p>Metrics are exposed through the actuator metrics endpoint.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class MicrometerTelemetrySink implements TelemetrySink {

    private static final Logger LOG = LogManager.getLogger(MicrometerTelemetrySink.class);

    static final String METRIC_PREFIX = "talkback.conversation";

    private final MeterRegistry registry;

    public MicrometerTelemetrySink(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public void recordLatency(LatencyKind kind, Duration latency) {
        if (kind == null || latency == null || latency.isNegative()) {
            return;
        }
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Latency of conversation pipeline stages")
                .tag("kind", kind.tagValue())
                .register(registry)
                .record(latency);
        LOG.debug("Latency {}: {} ms", kind, latency.toMillis());
    }

    @Override
    public void recordEvent(TelemetryEvent event) {
        if (event == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".events")
                .description("Number of conversation milestones by type")
                .tag("event", event.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
