package com.demo.instrument.server;

import com.demo.instrument.context.MetadataKeys;
import io.grpc.Grpc;
import io.grpc.Metadata;
import io.grpc.ServerCall;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * Who is calling: the application name the client declared and its address.
 */
final class PeerInfo {
    static final String UNKNOWN_APP = "unknown";

    private PeerInfo() {
    }

    /** Declared application name of the caller, {@code ""} when absent. */
    static String name(Metadata headers) {
        return MetadataKeys.value(headers, MetadataKeys.APP.name());
    }

    /** Declared application name, or {@code unknown} for metric labels. */
    static String app(Metadata headers) {
        String app = name(headers);
        return app.isEmpty() ? UNKNOWN_APP : app;
    }

    /**
     * Caller address: the {@code client-ip} header when a proxy set it, else the transport peer host.
     */
    static String ip(ServerCall<?, ?> call, Metadata headers) {
        String clientIp = MetadataKeys.value(headers, MetadataKeys.CLIENT_IP.name());
        if (!clientIp.isEmpty()) {
            return clientIp;
        }
        SocketAddress remote = call.getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR);
        if (remote instanceof InetSocketAddress inet) {
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return "";
    }
}
