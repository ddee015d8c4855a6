package com.demo.instrument.observability;

/**
 * Bucket a normalized status falls into. Drives access log severity.
 */
public enum OutcomeClass {
    SUCCESS,        // 1xx-3xx
    CLIENT_FAULT,   // 4xx, logged at WARN
    SERVER_FAULT;   // 5xx, logged at ERROR

    public static OutcomeClass of(int code) {
        if (code >= 500) {
            return SERVER_FAULT;
        }
        if (code >= 400) {
            return CLIENT_FAULT;
        }
        return SUCCESS;
    }
}
