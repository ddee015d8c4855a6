package com.demo.instrument.observability;

import io.grpc.Context;
import io.grpc.Deadline;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class StatusClassifierTest {

    private final StatusClassifier classifier = new StatusClassifier();

    @Test
    void testSuccess() {
        CallOutcome outcome = classifier.classify(Status.OK, Duration.ofMillis(12));
        assertEquals(NormalizedStatus.OK, outcome.status());
        assertEquals(200, outcome.code());
        assertEquals(Status.Code.OK, outcome.originCode());
        assertEquals("OK", outcome.message());
        assertEquals(Duration.ofMillis(12), outcome.elapsed());
        assertTrue(outcome.isSuccess());
        assertEquals(OutcomeClass.SUCCESS, outcome.outcomeClass());
    }

    @Test
    void testUnavailable() {
        CallOutcome outcome = classifier.classify(Status.UNAVAILABLE.withDescription("connection reset"), Duration.ZERO);
        assertEquals(NormalizedStatus.SERVICE_UNAVAILABLE, outcome.status());
        assertEquals(503, outcome.code());
        assertEquals("connection reset", outcome.message());
        assertEquals(OutcomeClass.SERVER_FAULT, outcome.outcomeClass());
    }

    @Test
    void testDeadlineExceeded() {
        CallOutcome outcome = classifier.classify(Status.DEADLINE_EXCEEDED, Duration.ZERO);
        assertEquals(NormalizedStatus.GATEWAY_TIMEOUT, outcome.status());
        assertEquals(OutcomeClass.SERVER_FAULT, outcome.outcomeClass());
    }

    @Test
    void testResourceExhausted() {
        CallOutcome outcome = classifier.classify(Status.RESOURCE_EXHAUSTED, Duration.ZERO);
        assertEquals(429, outcome.code());
        assertEquals(OutcomeClass.CLIENT_FAULT, outcome.outcomeClass());
    }

    @Test
    void testInvalidArgument() {
        CallOutcome outcome = classifier.classify(Status.INVALID_ARGUMENT, Duration.ZERO);
        assertEquals(NormalizedStatus.BAD_REQUEST, outcome.status());
        assertEquals(OutcomeClass.CLIENT_FAULT, outcome.outcomeClass());
        assertFalse(outcome.isSuccess());
    }

    @Test
    void testCancelledIsClientFault() {
        CallOutcome outcome = classifier.classify(Status.CANCELLED, Duration.ZERO);
        assertEquals(499, outcome.code());
        assertEquals(OutcomeClass.CLIENT_FAULT, outcome.outcomeClass());
    }

    @Test
    void testInternal() {
        CallOutcome outcome = classifier.classify(Status.INTERNAL, Duration.ZERO);
        assertEquals(NormalizedStatus.INTERNAL_SERVER_ERROR, outcome.status());
        assertEquals(OutcomeClass.SERVER_FAULT, outcome.outcomeClass());
    }

    @Test
    void testUnknownGrpcStatus() {
        CallOutcome outcome = classifier.classify(Status.UNKNOWN, Duration.ZERO);
        assertEquals(500, outcome.code());
        assertEquals("UNKNOWN", outcome.message());
        assertEquals(OutcomeClass.SERVER_FAULT, outcome.outcomeClass());
    }

    @Test
    void testEveryCodeIsMapped() {
        for (Status.Code code : Status.Code.values()) {
            assertNotNull(NormalizedStatus.fromGrpcStatus(code), code.name());
        }
    }

    @Test
    void testStatusOfStatusRuntimeException() {
        Status status = classifier.statusOf(new StatusRuntimeException(Status.NOT_FOUND.withDescription("no user")));
        assertEquals(Status.Code.NOT_FOUND, status.getCode());
        assertEquals("no user", status.getDescription());
    }

    @Test
    void testStatusOfStatusException() {
        Status status = classifier.statusOf(new StatusException(Status.PERMISSION_DENIED));
        assertEquals(Status.Code.PERMISSION_DENIED, status.getCode());
    }

    @Test
    void testStatusOfNonGrpcException() {
        IllegalStateException ex = new IllegalStateException("test");
        Status status = classifier.statusOf(ex);
        assertEquals(Status.Code.UNKNOWN, status.getCode());
        assertEquals("java.lang.IllegalStateException: test", status.getDescription());
        assertSame(ex, status.getCause());
    }

    @Test
    void testResultLabel() {
        assertEquals("OK", classifier.classify(Status.OK, Duration.ZERO).resultLabel());
        assertEquals("Service Unavailable", classifier.classify(Status.UNAVAILABLE, Duration.ZERO).resultLabel());
    }

    @Test
    void testCancelledWithoutCauseIsClientCancel() {
        Context.CancellableContext context = Context.ROOT.withCancellation();
        context.cancel(null);

        assertEquals(Status.Code.CANCELLED, StatusClassifier.cancelledStatus(context).getCode());
        assertEquals(Status.Code.CANCELLED, StatusClassifier.cancelledStatus(Context.ROOT).getCode());
    }

    @Test
    void testCancelledByTimeoutIsDeadlineExceeded() {
        Context.CancellableContext context = Context.ROOT.withCancellation();
        context.cancel(new TimeoutException("context timed out"));

        assertEquals(Status.Code.DEADLINE_EXCEEDED, StatusClassifier.cancelledStatus(context).getCode());
    }

    @Test
    void testExpiredDeadlineWinsBeforeContextIsCancelled() {
        FakeTicker ticker = new FakeTicker();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        Context.CancellableContext context =
                Context.ROOT.withDeadline(Deadline.after(1, TimeUnit.MINUTES, ticker), scheduler);
        try {
            ticker.nanos = TimeUnit.MINUTES.toNanos(2);

            assertFalse(context.isCancelled());
            assertEquals(Status.Code.DEADLINE_EXCEEDED, StatusClassifier.cancelledStatus(context).getCode());
        } finally {
            context.cancel(null);
            scheduler.shutdownNow();
        }
    }

    private static final class FakeTicker extends Deadline.Ticker {
        volatile long nanos;

        @Override
        public long nanoTime() {
            return nanos;
        }
    }
}
