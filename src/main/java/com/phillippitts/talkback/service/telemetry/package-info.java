/**
 * Latency and milestone telemetry.
 *
 * <p>{@link com.phillippitts.talkback.service.telemetry.TelemetrySink} is the orchestrator-facing
 * contract; {@link com.phillippitts.talkback.service.telemetry.MicrometerTelemetrySink} publishes
 * to the Spring Boot meter registry.
 *
 * @since 1.0
 */
package com.phillippitts.talkback.service.telemetry;
