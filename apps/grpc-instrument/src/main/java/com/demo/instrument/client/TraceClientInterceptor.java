package com.demo.instrument.client;

import com.demo.instrument.context.MetadataKeys;
import com.demo.instrument.observability.CallKind;
import com.demo.instrument.observability.CallSpan;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.ForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapPropagator;

import java.util.function.Supplier;

/**
 * Starts a CLIENT span per call and injects its context into the outgoing headers so the server
 * can continue the trace. The span is current while inner interceptors create and start the call.
 *
 * <p>The {@link OpenTelemetry} instance is looked up on every call, so a global SDK registered
 * after the chain was built is picked up.
 */
public class TraceClientInterceptor implements ClientInterceptor {
    static final String INSTRUMENTATION_NAME = "com.demo.instrument";

    private final Supplier<OpenTelemetry> openTelemetry;

    public TraceClientInterceptor(OpenTelemetry openTelemetry) {
        this(() -> openTelemetry);
    }

    public TraceClientInterceptor(Supplier<OpenTelemetry> openTelemetry) {
        this.openTelemetry = openTelemetry;
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
            MethodDescriptor<ReqT, RespT> method,
            CallOptions callOptions,
            Channel next) {

        OpenTelemetry telemetry = openTelemetry.get();
        Tracer tracer = telemetry.getTracer(INSTRUMENTATION_NAME);
        TextMapPropagator propagator = telemetry.getPropagators().getTextMapPropagator();
        Context parent = Context.current();
        Span span = tracer.spanBuilder(method.getFullMethodName())
                .setParent(parent)
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute("component", "grpc")
                .setAttribute("rpc.kind", "client." + CallKind.client(method.getType()).type())
                .startSpan();
        Context traced = parent.with(span);
        CallSpan callSpan = new CallSpan(span);

        ClientCall<ReqT, RespT> call;
        try (Scope ignored = traced.makeCurrent()) {
            call = next.newCall(method, callOptions);
        } catch (RuntimeException e) {
            callSpan.end(Status.fromThrowable(e));
            throw e;
        }

        return new ForwardingClientCall.SimpleForwardingClientCall<ReqT, RespT>(call) {
            @Override
            public void start(Listener<RespT> responseListener, Metadata headers) {
                Metadata outgoing = MetadataKeys.copyOf(headers);
                propagator.inject(traced, outgoing, CallSpan.METADATA_SETTER);

                try (Scope ignored = traced.makeCurrent()) {
                    super.start(new ForwardingClientCallListener.SimpleForwardingClientCallListener<RespT>(responseListener) {
                        @Override
                        public void onClose(Status status, Metadata trailers) {
                            callSpan.end(status);
                            super.onClose(status, trailers);
                        }
                    }, outgoing);
                } catch (RuntimeException e) {
                    callSpan.end(Status.fromThrowable(e));
                    throw e;
                }
            }
        };
    }
}
