package com.demo.instrument.server;

import com.demo.instrument.observability.FieldSet;
import com.demo.instrument.observability.StatusClassifier;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Innermost server interceptor. Anything the handler throws is turned into the status the call
 * closes with; the throwable never reaches the transport.
 *
 * The stack trace, cut to {@value #MAX_STACK_LENGTH} characters, goes to the call's access log
 * entry under {@code stack} with {@code event=recover}.
 */
public class RecoveryServerInterceptor implements ServerInterceptor {
    private static final Logger logger = LoggerFactory.getLogger(RecoveryServerInterceptor.class);

    static final int MAX_STACK_LENGTH = 4096;

    private final StatusClassifier classifier;

    public RecoveryServerInterceptor(StatusClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call,
            Metadata headers,
            ServerCallHandler<ReqT, RespT> next) {

        GuardedCall<ReqT, RespT> guarded = new GuardedCall<>(call, FieldSet.current());
        ServerCall.Listener<ReqT> listener;
        try {
            listener = next.startCall(guarded, headers);
        } catch (RuntimeException | Error t) {
            guarded.recover(t);
            return new ServerCall.Listener<ReqT>() {
            };
        }

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(listener) {
            @Override
            public void onMessage(ReqT message) {
                try {
                    super.onMessage(message);
                } catch (RuntimeException | Error t) {
                    guarded.recover(t);
                }
            }

            @Override
            public void onHalfClose() {
                try {
                    super.onHalfClose();
                } catch (RuntimeException | Error t) {
                    guarded.recover(t);
                }
            }

            @Override
            public void onCancel() {
                try {
                    super.onCancel();
                } catch (RuntimeException | Error t) {
                    guarded.recover(t);
                }
            }

            @Override
            public void onComplete() {
                try {
                    super.onComplete();
                } catch (RuntimeException | Error t) {
                    guarded.recover(t);
                }
            }

            @Override
            public void onReady() {
                try {
                    super.onReady();
                } catch (RuntimeException | Error t) {
                    guarded.recover(t);
                }
            }
        };
    }

    static String stackTrace(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        String stack = writer.toString();
        return stack.length() > MAX_STACK_LENGTH ? stack.substring(0, MAX_STACK_LENGTH) : stack;
    }

    private final class GuardedCall<ReqT, RespT> extends ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT> {
        private final FieldSet fields;
        private volatile boolean closed;

        GuardedCall(ServerCall<ReqT, RespT> delegate, FieldSet fields) {
            super(delegate);
            this.fields = fields;
        }

        @Override
        public void close(Status status, Metadata trailers) {
            closed = true;
            super.close(status, trailers);
        }

        void recover(Throwable t) {
            String method = getMethodDescriptor().getFullMethodName();
            if (closed) {
                logger.error("Handler of {} failed after the call was closed", method, t);
                return;
            }
            if (fields != null) {
                fields.put("event", "recover");
                fields.add("stack", stackTrace(t));
            } else {
                logger.error("Recovered from handler failure in {}", method, t);
            }
            close(classifier.statusOf(t), new Metadata());
        }
    }
}
