package com.demo.instrument.server;

import com.demo.instrument.EchoService;
import com.demo.instrument.context.CallContext;
import com.demo.instrument.context.MetadataKeys;
import com.demo.instrument.context.PropagatedHeaders;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientInterceptors;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.MetadataUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HeaderServerInterceptorTest {

    private final AtomicLong cpuUsage = new AtomicLong();
    private final AtomicReference<Metadata> responseHeaders = new AtomicReference<>();
    private final AtomicReference<Metadata> responseTrailers = new AtomicReference<>();
    private Server server;
    private ManagedChannel channel;

    @BeforeEach
    void start() throws Exception {
        PropagatedHeaders.set(List.of("x-tenant"));
        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name)
                .directExecutor()
                .addService(ServerInterceptors.interceptForward(EchoService.service((request, observer) -> {
                    if (request.equals("fail")) {
                        observer.onError(Status.FAILED_PRECONDITION.asRuntimeException());
                        return;
                    }
                    CallContext carrier = CallContext.current();
                    observer.onNext(carrier.value(request));
                    observer.onCompleted();
                }), new HeaderServerInterceptor(cpuUsage::get)))
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
    }

    @AfterEach
    void shutdown() throws InterruptedException {
        PropagatedHeaders.set(List.of());
        channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
        server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    }

    private String call(Metadata headers, String request) {
        Channel intercepted = ClientInterceptors.intercept(channel,
                MetadataUtils.newCaptureMetadataInterceptor(responseHeaders, responseTrailers),
                MetadataUtils.newAttachHeadersInterceptor(headers));
        return ClientCalls.blockingUnaryCall(intercepted, EchoService.SAY, CallOptions.DEFAULT, request);
    }

    private static Metadata headers(String... pairs) {
        Metadata metadata = new Metadata();
        for (int i = 0; i < pairs.length; i += 2) {
            metadata.put(MetadataKeys.ascii(pairs[i]), pairs[i + 1]);
        }
        return metadata;
    }

    @Test
    void testRegisteredHeaderIsVisibleToHandler() {
        assertEquals("t1", call(headers("x-tenant", "t1"), "x-tenant"));
    }

    @Test
    void testMixedCaseRegistrationMatchesWireHeader() {
        PropagatedHeaders.set(List.of("X-Tenant"));

        assertEquals("t2", call(headers("x-tenant", "t2"), "X-Tenant"));
    }

    @Test
    void testUnregisteredHeaderIsNotCarried() {
        assertEquals("", call(headers("x-other", "o1"), "x-other"));
    }

    @Test
    void testCpuUsageReportedWhenRequested() {
        cpuUsage.set(370);

        call(headers("enable-cpu-usage", "true"), "x-tenant");

        assertEquals("370", responseHeaders.get().get(MetadataKeys.CPU_USAGE));
    }

    @Test
    void testNoCpuUsageWithoutSample() {
        cpuUsage.set(0);

        call(headers("enable-cpu-usage", "true"), "x-tenant");

        assertNull(responseHeaders.get().get(MetadataKeys.CPU_USAGE));
        assertNull(responseTrailers.get().get(MetadataKeys.CPU_USAGE));
    }

    @Test
    void testNoCpuUsageWhenNotRequested() {
        cpuUsage.set(370);

        call(new Metadata(), "x-tenant");

        assertNull(responseHeaders.get().get(MetadataKeys.CPU_USAGE));
        assertNull(responseTrailers.get().get(MetadataKeys.CPU_USAGE));
    }

    @Test
    void testCpuUsageOnTrailersOnlyResponse() {
        cpuUsage.set(420);

        assertThrows(StatusRuntimeException.class, () -> call(headers("enable-cpu-usage", "true"), "fail"));

        Metadata headers = responseHeaders.get();
        String reported = headers != null && headers.containsKey(MetadataKeys.CPU_USAGE)
                ? headers.get(MetadataKeys.CPU_USAGE)
                : responseTrailers.get().get(MetadataKeys.CPU_USAGE);
        assertEquals("420", reported);
    }
}
