package com.demo.instrument.server;

import com.demo.instrument.config.InterceptorConfig;
import com.demo.instrument.context.CallContext;
import com.demo.instrument.observability.AccessLogger;
import com.demo.instrument.observability.CallKind;
import com.demo.instrument.observability.CallOutcome;
import com.demo.instrument.observability.FieldSet;
import com.demo.instrument.observability.StatusClassifier;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.opentelemetry.api.trace.Span;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes one access log entry per handled call. The call's {@link FieldSet} is published in the
 * gRPC context so the recovery guard below can add the stack of a failed handler to it.
 */
public class AccessLogServerInterceptor implements ServerInterceptor {
    private final AccessLogger accessLogger;
    private final StatusClassifier classifier;

    public AccessLogServerInterceptor(AccessLogger accessLogger, StatusClassifier classifier) {
        this.accessLogger = accessLogger;
        this.classifier = classifier;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call,
            Metadata headers,
            ServerCallHandler<ReqT, RespT> next) {

        AccessLogCall<ReqT, RespT> logged = new AccessLogCall<>(call, headers);
        Context context = Context.current().withValue(FieldSet.KEY, logged.fields);
        ServerCall.Listener<ReqT> listener = Contexts.interceptCall(context, logged, headers, next);

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(listener) {
            @Override
            public void onMessage(ReqT message) {
                logged.keepRequest(message);
                super.onMessage(message);
            }

            @Override
            public void onCancel() {
                try {
                    super.onCancel();
                } finally {
                    logged.complete(StatusClassifier.cancelledStatus(Context.current()));
                }
            }
        };
    }

    private final class AccessLogCall<ReqT, RespT> extends ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT> {
        private final long startNanos = System.nanoTime();
        private final FieldSet fields = new FieldSet();
        private final AtomicBoolean completed = new AtomicBoolean();
        private final Metadata headers;
        private final CallKind kind;
        private final CallContext carrier;
        private final Span span;
        private final boolean keepRequest;
        private final boolean keepResponse;
        private volatile Object request;
        private volatile Object response;

        AccessLogCall(ServerCall<ReqT, RespT> delegate, Metadata headers) {
            super(delegate);
            InterceptorConfig config = accessLogger.config();
            this.headers = headers;
            this.kind = CallKind.server(delegate.getMethodDescriptor().getType());
            this.carrier = CallContext.current();
            this.span = Span.current();
            this.keepRequest = kind.isUnary() && config.isEnableAccessInterceptorReq();
            this.keepResponse = kind.isUnary() && config.isEnableAccessInterceptorRes();
        }

        void keepRequest(Object message) {
            if (keepRequest) {
                request = message;
            }
        }

        @Override
        public void sendMessage(RespT message) {
            if (keepResponse) {
                response = message;
            }
            super.sendMessage(message);
        }

        @Override
        public void close(Status status, Metadata trailers) {
            try {
                complete(status);
            } finally {
                super.close(status, trailers);
            }
        }

        void complete(Status status) {
            if (!completed.compareAndSet(false, true)) {
                return;
            }
            CallOutcome outcome = classifier.classify(status, Duration.ofNanos(System.nanoTime() - startNanos));
            if (!accessLogger.shouldEmit(outcome)) {
                return;
            }
            accessLogger.appendOutcome(fields, kind, getMethodDescriptor().getFullMethodName(), outcome);
            fields.add("peerName", PeerInfo.name(headers))
                .add("peerIp", PeerInfo.ip(this, headers));
            accessLogger.appendPropagated(fields, carrier);
            accessLogger.appendTraceId(fields, span);
            if (keepRequest) {
                fields.add("req", accessLogger.formatter().format(request, headers));
            }
            if (keepResponse) {
                fields.add("res", accessLogger.formatter().format(response));
            }
            accessLogger.emit(fields, outcome);
        }
    }
}
