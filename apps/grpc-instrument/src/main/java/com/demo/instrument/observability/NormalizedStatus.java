package com.demo.instrument.observability;

import io.grpc.Status;

/**
 * HTTP-style status taxonomy used for logging severity and metric labels.
 * Maps gRPC status codes to the code a caller would see behind an HTTP gateway.
 */
public enum NormalizedStatus {
    /** Call completed successfully */
    OK(200, "OK"),

    BAD_REQUEST(400, "Bad Request"),

    UNAUTHORIZED(401, "Unauthorized"),

    FORBIDDEN(403, "Forbidden"),

    NOT_FOUND(404, "Not Found"),

    CONFLICT(409, "Conflict"),

    TOO_MANY_REQUESTS(429, "Too Many Requests"),

    /** Caller cancelled the call before it finished */
    CLIENT_CLOSED_REQUEST(499, "Client Closed Request"),

    INTERNAL_SERVER_ERROR(500, "Internal Server Error"),

    NOT_IMPLEMENTED(501, "Not Implemented"),

    SERVICE_UNAVAILABLE(503, "Service Unavailable"),

    /** Call exceeded its deadline */
    GATEWAY_TIMEOUT(504, "Gateway Timeout");

    private final int code;
    private final String reason;

    NormalizedStatus(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int code() {
        return code;
    }

    public String reason() {
        return reason;
    }

    public OutcomeClass outcomeClass() {
        return OutcomeClass.of(code);
    }

    /**
     * Maps gRPC status code to normalized status.
     * @param grpcStatusCode code of the finished call
     * @return corresponding NormalizedStatus
     */
    public static NormalizedStatus fromGrpcStatus(Status.Code grpcStatusCode) {
        switch (grpcStatusCode) {
            case OK:
                return OK;
            case CANCELLED:
                return CLIENT_CLOSED_REQUEST;
            case INVALID_ARGUMENT:
            case FAILED_PRECONDITION:
            case OUT_OF_RANGE:
                return BAD_REQUEST;
            case DEADLINE_EXCEEDED:
                return GATEWAY_TIMEOUT;
            case NOT_FOUND:
                return NOT_FOUND;
            case ALREADY_EXISTS:
            case ABORTED:
                return CONFLICT;
            case PERMISSION_DENIED:
                return FORBIDDEN;
            case UNAUTHENTICATED:
                return UNAUTHORIZED;
            case RESOURCE_EXHAUSTED:
                return TOO_MANY_REQUESTS;
            case UNIMPLEMENTED:
                return NOT_IMPLEMENTED;
            case UNAVAILABLE:
                return SERVICE_UNAVAILABLE;
            case UNKNOWN:
            case INTERNAL:
            case DATA_LOSS:
            default:
                return INTERNAL_SERVER_ERROR;
        }
    }
}
