package com.demo.instrument.observability;

import io.grpc.MethodDescriptor;

/**
 * Side of the call crossed with its shape. Used as the {@code type} label and log field.
 */
public enum CallKind {
    CLIENT_UNARY("client", "unary"),
    CLIENT_STREAM("client", "stream"),
    SERVER_UNARY("server", "unary"),
    SERVER_STREAM("server", "stream");

    private final String side;
    private final String type;

    CallKind(String side, String type) {
        this.side = side;
        this.type = type;
    }

    public String side() {
        return side;
    }

    public String type() {
        return type;
    }

    public boolean isUnary() {
        return this == CLIENT_UNARY || this == SERVER_UNARY;
    }

    public static CallKind client(MethodDescriptor.MethodType methodType) {
        return methodType == MethodDescriptor.MethodType.UNARY ? CLIENT_UNARY : CLIENT_STREAM;
    }

    public static CallKind server(MethodDescriptor.MethodType methodType) {
        return methodType == MethodDescriptor.MethodType.UNARY ? SERVER_UNARY : SERVER_STREAM;
    }
}
