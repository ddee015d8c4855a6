package com.demo.instrument.observability;

import com.demo.instrument.config.InterceptorConfig;
import com.demo.instrument.context.CallContext;
import com.demo.instrument.context.PropagatedHeaders;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Assembles and emits the access log entry of a call.
 *
 * Severity, one entry per call:
 * - failed with a 5xx normalized status: ERROR "access"
 * - failed otherwise: WARN "access"
 * - succeeded but slower than the threshold: WARN "slow"
 * - succeeded and access logging enabled: INFO "access"
 * - anything else: nothing, and the caller should not build fields at all
 */
public class AccessLogger {
    private static final Logger logger = LoggerFactory.getLogger(AccessLogger.class);

    private final InterceptorConfig config;
    private final PayloadFormatter formatter;

    public AccessLogger(InterceptorConfig config, PayloadFormatter formatter) {
        this.config = config;
        this.formatter = formatter;
    }

    public InterceptorConfig config() {
        return config;
    }

    public PayloadFormatter formatter() {
        return formatter;
    }

    public boolean isSlow(Duration elapsed) {
        Duration threshold = config.slowLogThreshold();
        return !threshold.isNegative() && !threshold.isZero() && elapsed.compareTo(threshold) > 0;
    }

    /**
     * Whether {@code outcome} produces an entry. Checked before any field is assembled.
     */
    public boolean shouldEmit(CallOutcome outcome) {
        return !outcome.isSuccess() || config.isEnableAccessInterceptor() || isSlow(outcome.elapsed());
    }

    /**
     * Outcome part of the entry, common to both sides. A preset {@code event} (for instance
     * {@code recover}) is kept.
     */
    public FieldSet appendOutcome(FieldSet fields, CallKind kind, String method, CallOutcome outcome) {
        String event = fields.contains("event")
            ? String.valueOf(fields.get("event"))
            : outcome.isSuccess() ? "normal" : "error";
        fields.add("type", kind.type())
            .add("code", outcome.code())
            .add("originCode", outcome.originCode().value())
            .add("description", outcome.message())
            .put("event", event)
            .add("method", method)
            .add("cost", outcome.elapsed().toMillis());
        return fields;
    }

    public FieldSet appendPropagated(FieldSet fields, CallContext carrier) {
        for (String key : PropagatedHeaders.keys()) {
            String value = carrier.value(key);
            if (!value.isEmpty()) {
                fields.add(key, value);
            }
        }
        return fields;
    }

    public FieldSet appendTraceId(FieldSet fields, Span span) {
        if (!config.isEnableTraceInterceptor() || span == null) {
            return fields;
        }
        SpanContext spanContext = span.getSpanContext();
        if (spanContext.isValid()) {
            fields.add("tid", spanContext.getTraceId());
        }
        return fields;
    }

    public void emit(FieldSet fields, CallOutcome outcome) {
        boolean slow = isSlow(outcome.elapsed());
        try {
            if (!outcome.isSuccess()) {
                if (slow) {
                    fields.add("slow", true);
                }
                fields.add("error", outcome.originCode().name() + ": " + outcome.message());
                if (outcome.outcomeClass() == OutcomeClass.SERVER_FAULT) {
                    logger.error("access {}", fields);
                } else {
                    logger.warn("access {}", fields);
                }
                return;
            }
            if (slow) {
                logger.warn("slow {}", fields);
                return;
            }
            if (config.isEnableAccessInterceptor()) {
                logger.info("access {}", fields);
            }
        } catch (RuntimeException e) {
            logger.debug("Failed to write access log entry: {}", e.toString());
        }
    }
}
