package com.demo.instrument.server;

import com.demo.instrument.config.InterceptorConfig;
import com.demo.instrument.observability.CallKind;
import com.demo.instrument.observability.CallMetrics;
import com.demo.instrument.observability.NormalizedStatus;
import com.demo.instrument.observability.StatusClassifier;
import io.grpc.Context;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Records count and latency of every handled call, labelled with the caller's declared application.
 */
public class MetricServerInterceptor implements ServerInterceptor {
    private final InterceptorConfig config;
    private final CallMetrics metrics;

    public MetricServerInterceptor(InterceptorConfig config, CallMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call,
            Metadata headers,
            ServerCallHandler<ReqT, RespT> next) {

        long startNanos = System.nanoTime();
        CallKind kind = CallKind.server(call.getMethodDescriptor().getType());
        String method = call.getMethodDescriptor().getFullMethodName();
        String peer = PeerInfo.app(headers);
        AtomicBoolean recorded = new AtomicBoolean();

        ServerCall<ReqT, RespT> measured = new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
            @Override
            public void close(Status status, Metadata trailers) {
                if (recorded.compareAndSet(false, true)) {
                    metrics.record(kind, config.name(), method, peer,
                            NormalizedStatus.fromGrpcStatus(status.getCode()),
                            Duration.ofNanos(System.nanoTime() - startNanos));
                }
                super.close(status, trailers);
            }
        };

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(next.startCall(measured, headers)) {
            @Override
            public void onCancel() {
                try {
                    super.onCancel();
                } finally {
                    if (recorded.compareAndSet(false, true)) {
                        Status status = StatusClassifier.cancelledStatus(Context.current());
                        metrics.record(kind, config.name(), method, peer,
                                NormalizedStatus.fromGrpcStatus(status.getCode()),
                                Duration.ofNanos(System.nanoTime() - startNanos));
                    }
                }
            }
        };
    }
}
