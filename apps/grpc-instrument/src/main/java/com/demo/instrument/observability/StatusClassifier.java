package com.demo.instrument.observability;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Deadline;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;

import java.time.Duration;
import java.util.Objects;

/**
 * Maps the final gRPC status of a call to a {@link CallOutcome}.
 *
 * Output: CallOutcome{status, originCode, message, elapsed}
 * - status: normalized HTTP-style status, decides metrics label and log severity
 * - originCode: the gRPC code as the transport reported it
 * - message: status description, or the code name when the status has none
 *
 * Used by: access log, metrics and trace interceptors on both sides, and by the server recovery
 * guard to turn a thrown exception into a status.
 */
public class StatusClassifier {

    public CallOutcome classify(Status status, Duration elapsed) {
        Objects.requireNonNull(status, "status");
        return new CallOutcome(
            NormalizedStatus.fromGrpcStatus(status.getCode()),
            status.getCode(),
            messageOf(status),
            elapsed == null ? Duration.ZERO : elapsed);
    }

    /**
     * Status a thrown exception stands for. Exceptions that already carry a gRPC status keep it;
     * anything else becomes UNKNOWN with the exception rendered as description.
     */
    public Status statusOf(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable");
        if (throwable instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        if (throwable instanceof StatusException se) {
            return se.getStatus();
        }
        return Status.UNKNOWN.withDescription(throwable.toString()).withCause(throwable);
    }

    /**
     * Status of a server call that was cancelled before it closed. The cancellation cause of the
     * call's context decides (a passed deadline is DEADLINE_EXCEEDED); a plain cancel is CANCELLED.
     */
    public static Status cancelledStatus(Context context) {
        Status status = context.isCancelled() ? Contexts.statusFromCancelled(context) : null;
        if (status != null && status.getCode() != Status.Code.CANCELLED) {
            return status;
        }
        Deadline deadline = context.getDeadline();
        if (deadline != null && deadline.isExpired()) {
            return Status.DEADLINE_EXCEEDED.withDescription("deadline exceeded");
        }
        return status != null ? status : Status.CANCELLED.withDescription("call cancelled");
    }

    public static String messageOf(Status status) {
        String description = status.getDescription();
        return description == null ? status.getCode().name() : description;
    }
}
