package com.demo.instrument.server;

import com.demo.instrument.observability.CallKind;
import com.demo.instrument.observability.CallSpan;
import com.demo.instrument.observability.StatusClassifier;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapPropagator;

import java.util.function.Supplier;

/**
 * Starts a SERVER span per call, continuing the caller's trace when the headers carry one.
 * The span is current in every listener callback, so inner interceptors and the handler see it.
 *
 * <p>The {@link OpenTelemetry} instance is looked up on every call.
 */
public class TraceServerInterceptor implements ServerInterceptor {
    static final String INSTRUMENTATION_NAME = "com.demo.instrument";
    static final AttributeKey<Boolean> IS_SERVER_STREAM = AttributeKey.booleanKey("isServerStream");

    private final Supplier<OpenTelemetry> openTelemetry;

    public TraceServerInterceptor(OpenTelemetry openTelemetry) {
        this(() -> openTelemetry);
    }

    public TraceServerInterceptor(Supplier<OpenTelemetry> openTelemetry) {
        this.openTelemetry = openTelemetry;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call,
            Metadata headers,
            ServerCallHandler<ReqT, RespT> next) {

        OpenTelemetry telemetry = openTelemetry.get();
        Tracer tracer = telemetry.getTracer(INSTRUMENTATION_NAME);
        TextMapPropagator propagator = telemetry.getPropagators().getTextMapPropagator();
        MethodDescriptor<ReqT, RespT> method = call.getMethodDescriptor();
        Context parent = propagator.extract(Context.root(), headers, CallSpan.METADATA_GETTER);
        SpanBuilder builder = tracer.spanBuilder(method.getFullMethodName())
                .setParent(parent)
                .setSpanKind(SpanKind.SERVER)
                .setAttribute("component", "grpc")
                .setAttribute("rpc.kind", "server." + CallKind.server(method.getType()).type());
        if (method.getType() != MethodDescriptor.MethodType.UNARY) {
            builder.setAttribute(IS_SERVER_STREAM, !method.getType().serverSendsOneMessage());
        }
        Span span = builder.startSpan();
        Context traced = parent.with(span);
        CallSpan callSpan = new CallSpan(span);

        ServerCall<ReqT, RespT> tracedCall = new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
            @Override
            public void close(Status status, Metadata trailers) {
                callSpan.end(status);
                super.close(status, trailers);
            }
        };

        ServerCall.Listener<ReqT> listener;
        try (Scope ignored = traced.makeCurrent()) {
            listener = next.startCall(tracedCall, headers);
        } catch (RuntimeException e) {
            callSpan.end(Status.fromThrowable(e));
            throw e;
        }

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(listener) {
            @Override
            public void onMessage(ReqT message) {
                try (Scope ignored = traced.makeCurrent()) {
                    super.onMessage(message);
                }
            }

            @Override
            public void onHalfClose() {
                try (Scope ignored = traced.makeCurrent()) {
                    super.onHalfClose();
                }
            }

            @Override
            public void onCancel() {
                try (Scope ignored = traced.makeCurrent()) {
                    super.onCancel();
                } finally {
                    callSpan.end(StatusClassifier.cancelledStatus(io.grpc.Context.current()));
                }
            }

            @Override
            public void onComplete() {
                try (Scope ignored = traced.makeCurrent()) {
                    super.onComplete();
                }
            }

            @Override
            public void onReady() {
                try (Scope ignored = traced.makeCurrent()) {
                    super.onReady();
                }
            }
        };
    }
}
