package com.demo.instrument.context;

import io.grpc.Metadata;

/**
 * Metadata keys exchanged between instrumented clients and servers.
 */
public final class MetadataKeys {

    /** Application name of the caller. */
    public static final Metadata.Key<String> APP = ascii("app");

    /** Caller address set explicitly by a proxy, preferred over the transport peer address. */
    public static final Metadata.Key<String> CLIENT_IP = ascii("client-ip");

    /** Set by the client to ask the server for its CPU usage. */
    public static final Metadata.Key<String> ENABLE_CPU_USAGE = ascii("enable-cpu-usage");

    /** Server CPU usage in per-mille, sent back in the response headers. */
    public static final Metadata.Key<String> CPU_USAGE = ascii("cpu-usage");

    private MetadataKeys() {
    }

    public static Metadata.Key<String> ascii(String name) {
        return Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER);
    }

    /**
     * First value of an ASCII header, or {@code ""}.
     */
    public static String value(Metadata headers, String name) {
        if (headers == null) {
            return "";
        }
        String value = headers.get(ascii(name));
        return value == null ? "" : value;
    }

    /**
     * Fresh metadata holding every entry of {@code headers}; the source is left untouched.
     */
    public static Metadata copyOf(Metadata headers) {
        Metadata copy = new Metadata();
        if (headers != null) {
            copy.merge(headers);
        }
        return copy;
    }
}
