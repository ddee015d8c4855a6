package com.demo.instrument.observability;

import io.grpc.Metadata;
import io.grpc.Status;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapSetter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Span of one call. {@link #end(Status)} tags failures and ends the span; only the first call has
 * an effect, whichever path (close, cancel, start failure) gets there first.
 */
public final class CallSpan {
    private static final Logger logger = LoggerFactory.getLogger(CallSpan.class);

    public static final AttributeKey<Long> GRPC_STATUS_CODE = AttributeKey.longKey("rpc.grpc.status_code");
    public static final AttributeKey<Long> CODE = AttributeKey.longKey("code");
    public static final AttributeKey<String> EVENT = AttributeKey.stringKey("event");
    public static final AttributeKey<String> MESSAGE = AttributeKey.stringKey("message");

    public static final TextMapSetter<Metadata> METADATA_SETTER = (carrier, key, value) -> {
        if (carrier != null) {
            carrier.put(Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER), value);
        }
    };

    public static final TextMapGetter<Metadata> METADATA_GETTER = new TextMapGetter<Metadata>() {
        @Override
        public Iterable<String> keys(Metadata carrier) {
            return carrier.keys();
        }

        @Override
        public String get(Metadata carrier, String key) {
            if (carrier == null || key.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                return null;
            }
            return carrier.get(Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER));
        }
    };

    private final Span span;
    private final AtomicBoolean ended = new AtomicBoolean();

    public CallSpan(Span span) {
        this.span = span;
    }

    public void end(Status status) {
        if (!ended.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!status.isOk()) {
                String message = StatusClassifier.messageOf(status);
                span.setAttribute(GRPC_STATUS_CODE, (long) status.getCode().value());
                span.setAttribute(CODE, (long) NormalizedStatus.fromGrpcStatus(status.getCode()).code());
                span.setStatus(StatusCode.ERROR, message);
                span.addEvent("error", Attributes.of(EVENT, "error", MESSAGE, message));
            }
        } catch (RuntimeException e) {
            logger.debug("Failed to tag span: {}", e.toString());
        } finally {
            span.end();
        }
    }
}
