package com.demo.instrument.server;

import com.demo.instrument.context.CallContext;
import com.demo.instrument.context.MetadataKeys;
import com.demo.instrument.context.PropagatedHeaders;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.ForwardingServerCall;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies registered propagated headers of the incoming call into its {@link CallContext}, so the
 * handler and any call it makes downstream carry them, and answers CPU usage requests.
 */
public class HeaderServerInterceptor implements ServerInterceptor {
    private static final Logger logger = LoggerFactory.getLogger(HeaderServerInterceptor.class);

    private final CpuUsageSampler cpuUsageSampler;

    public HeaderServerInterceptor(CpuUsageSampler cpuUsageSampler) {
        this.cpuUsageSampler = cpuUsageSampler;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call,
            Metadata headers,
            ServerCallHandler<ReqT, RespT> next) {

        CallContext carrier = CallContext.current();
        for (String key : PropagatedHeaders.keys()) {
            Iterable<String> values = headers.getAll(MetadataKeys.ascii(key));
            if (values == null) {
                continue;
            }
            for (String value : values) {
                if (!value.isEmpty()) {
                    carrier = carrier.with(key, value);
                }
            }
        }

        ServerCall<ReqT, RespT> target = call;
        if ("true".equals(MetadataKeys.value(headers, MetadataKeys.ENABLE_CPU_USAGE.name()))) {
            target = new CpuUsageReportingCall<>(call);
        }

        Context context = Context.current().withValue(CallContext.KEY, carrier);
        return Contexts.interceptCall(context, target, headers, next);
    }

    /**
     * Adds {@code cpu-usage} to the response headers, or to the trailers of a trailers-only response.
     */
    private final class CpuUsageReportingCall<ReqT, RespT>
            extends ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT> {
        private boolean headersSent;

        CpuUsageReportingCall(ServerCall<ReqT, RespT> delegate) {
            super(delegate);
        }

        @Override
        public void sendHeaders(Metadata headers) {
            headersSent = true;
            attachUsage(headers);
            super.sendHeaders(headers);
        }

        @Override
        public void close(Status status, Metadata trailers) {
            if (!headersSent) {
                attachUsage(trailers);
            }
            super.close(status, trailers);
        }

        private void attachUsage(Metadata metadata) {
            try {
                long usage = cpuUsageSampler.sample();
                if (usage > 0) {
                    metadata.put(MetadataKeys.CPU_USAGE, Long.toString(usage));
                }
            } catch (RuntimeException e) {
                logger.error("Failed to attach cpu usage to {}", getMethodDescriptor().getFullMethodName(), e);
            }
        }
    }
}
