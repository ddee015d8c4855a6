package com.demo.instrument.client;

import com.demo.instrument.config.InterceptorConfig;
import com.demo.instrument.context.CallContext;
import com.demo.instrument.observability.AccessLogger;
import com.demo.instrument.observability.CallKind;
import com.demo.instrument.observability.CallOutcome;
import com.demo.instrument.observability.FieldSet;
import com.demo.instrument.observability.StatusClassifier;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.ForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.opentelemetry.api.trace.Span;

import java.time.Duration;

/**
 * Writes one access log entry per outgoing call once it closes. Request and response payloads
 * are only kept for unary calls.
 */
public class AccessLogClientInterceptor implements ClientInterceptor {
    private final AccessLogger accessLogger;
    private final StatusClassifier classifier;

    public AccessLogClientInterceptor(AccessLogger accessLogger, StatusClassifier classifier) {
        this.accessLogger = accessLogger;
        this.classifier = classifier;
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
            MethodDescriptor<ReqT, RespT> method,
            CallOptions callOptions,
            Channel next) {

        InterceptorConfig config = accessLogger.config();
        CallKind kind = CallKind.client(method.getType());
        CallContext carrier = CallContext.current();
        Span span = Span.current();
        String target = config.targetOr(next.authority());
        boolean keepRequest = kind.isUnary() && config.isEnableAccessInterceptorReq();
        boolean keepResponse = kind.isUnary() && config.isEnableAccessInterceptorRes();

        return new ForwardingClientCall.SimpleForwardingClientCall<ReqT, RespT>(next.newCall(method, callOptions)) {
            private volatile ReqT request;

            @Override
            public void start(Listener<RespT> responseListener, Metadata headers) {
                long startNanos = System.nanoTime();
                super.start(new ForwardingClientCallListener.SimpleForwardingClientCallListener<RespT>(responseListener) {
                    private RespT response;

                    @Override
                    public void onMessage(RespT message) {
                        if (keepResponse) {
                            response = message;
                        }
                        super.onMessage(message);
                    }

                    @Override
                    public void onClose(Status status, Metadata trailers) {
                        try {
                            CallOutcome outcome = classifier.classify(status, Duration.ofNanos(System.nanoTime() - startNanos));
                            if (accessLogger.shouldEmit(outcome)) {
                                FieldSet fields = new FieldSet();
                                accessLogger.appendOutcome(fields, kind, method.getFullMethodName(), outcome);
                                fields.add("name", target);
                                accessLogger.appendPropagated(fields, carrier);
                                accessLogger.appendTraceId(fields, span);
                                if (keepRequest) {
                                    fields.add("req", accessLogger.formatter().format(request));
                                }
                                if (keepResponse) {
                                    fields.add("res", accessLogger.formatter().format(response));
                                }
                                accessLogger.emit(fields, outcome);
                            }
                        } finally {
                            super.onClose(status, trailers);
                        }
                    }
                }, headers);
            }

            @Override
            public void sendMessage(ReqT message) {
                if (keepRequest) {
                    request = message;
                }
                super.sendMessage(message);
            }
        };
    }
}
