package com.demo.instrument.client;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.Context;
import io.grpc.MethodDescriptor;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Applies a default deadline to unary calls whose caller set none, neither on the call options
 * nor on the current context. Streaming calls are left alone; they are usually long-lived.
 *
 * <p>The deadline timer belongs to the call and is cancelled by the transport when the call
 * closes, on success, failure or cancellation alike.
 */
public class DeadlineClientInterceptor implements ClientInterceptor {
    private final Duration timeout;

    public DeadlineClientInterceptor(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
            MethodDescriptor<ReqT, RespT> method,
            CallOptions callOptions,
            Channel next) {

        CallOptions effective = callOptions;
        if (method.getType() == MethodDescriptor.MethodType.UNARY
                && callOptions.getDeadline() == null
                && Context.current().getDeadline() == null) {
            effective = callOptions.withDeadlineAfter(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        return next.newCall(method, effective);
    }
}
