package com.demo.instrument.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Call count and latency histogram per {type, name, method, peer}.
 *
 * Meters:
 * - {side}_handle_total: counter, additionally tagged with the normalized status code
 * - {side}_handle_seconds: timer with fixed SLO buckets for histogram_quantile() queries
 *
 * Backend failures are logged at DEBUG and never reach the call.
 */
public class CallMetrics {
    private static final Logger logger = LoggerFactory.getLogger(CallMetrics.class);

    private static final Duration[] LATENCY_BUCKETS = {
        Duration.ofMillis(5),
        Duration.ofMillis(10),
        Duration.ofMillis(25),
        Duration.ofMillis(50),
        Duration.ofMillis(100),
        Duration.ofMillis(250),
        Duration.ofMillis(500),
        Duration.ofMillis(1000),
        Duration.ofMillis(2500),
        Duration.ofMillis(5000)
    };

    private final MeterRegistry registry;

    public CallMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public static String counterName(CallKind kind) {
        return kind.side() + "_handle_total";
    }

    public static String timerName(CallKind kind) {
        return kind.side() + "_handle_seconds";
    }

    /**
     * Record one finished call.
     *
     * @param kind side and shape of the call
     * @param serviceName logical name of the local component
     * @param method full gRPC method name
     * @param peerOrTarget caller application on the server side, target on the client side
     * @param status normalized outcome
     * @param elapsed wall time of the call
     */
    public void record(CallKind kind, String serviceName, String method, String peerOrTarget,
                       NormalizedStatus status, Duration elapsed) {
        try {
            Counter.builder(counterName(kind))
                .description("Total " + kind.side() + " gRPC calls")
                .tag("type", kind.type())
                .tag("name", nullToEmpty(serviceName))
                .tag("method", nullToEmpty(method))
                .tag("peer", nullToEmpty(peerOrTarget))
                .tag("code", status.reason())
                .register(registry)
                .increment();

            Timer.builder(timerName(kind))
                .description(kind.side() + " gRPC call latency")
                .tag("type", kind.type())
                .tag("name", nullToEmpty(serviceName))
                .tag("method", nullToEmpty(method))
                .tag("peer", nullToEmpty(peerOrTarget))
                .serviceLevelObjectives(LATENCY_BUCKETS)
                .register(registry)
                .record(elapsed);
        } catch (RuntimeException e) {
            logger.debug("Dropping {} metrics for {}: {}", kind.side(), method, e.toString());
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
