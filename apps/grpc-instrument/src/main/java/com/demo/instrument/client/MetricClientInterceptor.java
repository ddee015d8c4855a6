package com.demo.instrument.client;

import com.demo.instrument.config.InterceptorConfig;
import com.demo.instrument.observability.CallKind;
import com.demo.instrument.observability.CallMetrics;
import com.demo.instrument.observability.NormalizedStatus;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.ForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;

import java.time.Duration;

/**
 * Records count and latency of every outgoing call, labelled with the configured target.
 */
public class MetricClientInterceptor implements ClientInterceptor {
    private final InterceptorConfig config;
    private final CallMetrics metrics;

    public MetricClientInterceptor(InterceptorConfig config, CallMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
            MethodDescriptor<ReqT, RespT> method,
            CallOptions callOptions,
            Channel next) {

        CallKind kind = CallKind.client(method.getType());
        String target = config.targetOr(next.authority());

        return new ForwardingClientCall.SimpleForwardingClientCall<ReqT, RespT>(next.newCall(method, callOptions)) {
            @Override
            public void start(Listener<RespT> responseListener, Metadata headers) {
                long startNanos = System.nanoTime();
                super.start(new ForwardingClientCallListener.SimpleForwardingClientCallListener<RespT>(responseListener) {
                    @Override
                    public void onClose(Status status, Metadata trailers) {
                        metrics.record(kind, config.name(), method.getFullMethodName(), target,
                                NormalizedStatus.fromGrpcStatus(status.getCode()),
                                Duration.ofNanos(System.nanoTime() - startNanos));
                        super.onClose(status, trailers);
                    }
                }, headers);
            }
        };
    }
}
