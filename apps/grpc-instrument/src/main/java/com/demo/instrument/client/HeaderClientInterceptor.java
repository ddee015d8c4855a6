package com.demo.instrument.client;

import com.demo.instrument.config.InterceptorConfig;
import com.demo.instrument.context.CallContext;
import com.demo.instrument.context.MetadataKeys;
import com.demo.instrument.context.PropagatedHeaders;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;

/**
 * Writes the caller identity and the propagated headers into a copy of the outgoing metadata:
 * - {@code app}: always, the local application name
 * - {@code enable-cpu-usage}: when CPU usage reporting is requested
 * - every registered propagated header present in the current {@link CallContext}
 */
public class HeaderClientInterceptor implements ClientInterceptor {
    private final InterceptorConfig config;

    public HeaderClientInterceptor(InterceptorConfig config) {
        this.config = config;
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
            MethodDescriptor<ReqT, RespT> method,
            CallOptions callOptions,
            Channel next) {

        CallContext carrier = CallContext.current();

        return new ForwardingClientCall.SimpleForwardingClientCall<ReqT, RespT>(next.newCall(method, callOptions)) {
            @Override
            public void start(Listener<RespT> responseListener, Metadata headers) {
                super.start(responseListener, outgoing(headers, carrier));
            }
        };
    }

    Metadata outgoing(Metadata headers, CallContext carrier) {
        Metadata outgoing = MetadataKeys.copyOf(headers);
        outgoing.removeAll(MetadataKeys.APP);
        outgoing.put(MetadataKeys.APP, config.appName());
        if (config.isEnableCpuUsage()) {
            outgoing.removeAll(MetadataKeys.ENABLE_CPU_USAGE);
            outgoing.put(MetadataKeys.ENABLE_CPU_USAGE, "true");
        }
        for (String key : PropagatedHeaders.keys()) {
            Metadata.Key<String> metadataKey = MetadataKeys.ascii(key);
            if (outgoing.containsKey(metadataKey)) {
                continue;
            }
            for (String value : carrier.values(key)) {
                outgoing.put(metadataKey, value);
            }
        }
        return outgoing;
    }
}
