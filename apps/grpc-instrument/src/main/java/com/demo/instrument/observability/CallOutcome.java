package com.demo.instrument.observability;

import io.grpc.Status;

import java.time.Duration;

/**
 * Classification result for a finished call.
 */
public record CallOutcome(
    NormalizedStatus status,
    Status.Code originCode,
    String message,
    Duration elapsed
) {
    public boolean isSuccess() {
        return originCode == Status.Code.OK;
    }

    public int code() {
        return status.code();
    }

    public OutcomeClass outcomeClass() {
        return isSuccess() ? OutcomeClass.SUCCESS : status.outcomeClass();
    }

    public String resultLabel() {
        return status.reason();
    }
}
