package com.demo.instrument.chain;

import com.demo.instrument.client.AccessLogClientInterceptor;
import com.demo.instrument.client.DeadlineClientInterceptor;
import com.demo.instrument.client.HeaderClientInterceptor;
import com.demo.instrument.client.MetricClientInterceptor;
import com.demo.instrument.client.TraceClientInterceptor;
import com.demo.instrument.config.InterceptorConfig;
import com.demo.instrument.observability.AccessLogger;
import com.demo.instrument.observability.CallMetrics;
import com.demo.instrument.observability.PayloadFormatter;
import com.demo.instrument.observability.StatusClassifier;
import com.demo.instrument.server.AccessLogServerInterceptor;
import com.demo.instrument.server.CpuUsageSampler;
import com.demo.instrument.server.HeaderServerInterceptor;
import com.demo.instrument.server.MetricServerInterceptor;
import com.demo.instrument.server.RecoveryServerInterceptor;
import com.demo.instrument.server.SystemCpuUsageSampler;
import com.demo.instrument.server.TraceServerInterceptor;
import io.grpc.BindableService;
import io.grpc.Channel;
import io.grpc.ClientInterceptor;
import io.grpc.ClientInterceptors;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Ordered client and server interceptors built from one {@link InterceptorConfig}.
 *
 * <p>Order, outermost first:
 * <pre>
 * client: trace -> metrics -> deadline -> headers -> access log -> call
 * server: trace -> metrics -> headers -> access log -> recovery -> handler
 * </pre>
 * Recovery is innermost: no interceptor above it observes a throwable from the handler.
 *
 * <p>Unary and streaming calls share the chain of their side; each interceptor decides per call
 * from the method type.
 */
public final class InterceptorChain {

    private final InterceptorConfig config;
    private final List<ClientInterceptor> clientInterceptors;
    private final List<ServerInterceptor> serverInterceptors;

    private InterceptorChain(Builder builder) {
        this.config = builder.config;

        StatusClassifier classifier = new StatusClassifier();
        CallMetrics metrics = new CallMetrics(builder.meterRegistry);
        AccessLogger accessLogger = new AccessLogger(config, builder.payloadFormatter);

        List<ClientInterceptor> client = new ArrayList<>();
        if (config.isEnableTraceInterceptor()) {
            client.add(new TraceClientInterceptor(builder.openTelemetry));
        }
        if (config.isEnableMetricInterceptor()) {
            client.add(new MetricClientInterceptor(config, metrics));
        }
        client.add(new DeadlineClientInterceptor(config.defaultTimeout()));
        client.add(new HeaderClientInterceptor(config));
        client.add(new AccessLogClientInterceptor(accessLogger, classifier));
        this.clientInterceptors = Collections.unmodifiableList(client);

        List<ServerInterceptor> server = new ArrayList<>();
        if (config.isEnableTraceInterceptor()) {
            server.add(new TraceServerInterceptor(builder.openTelemetry));
        }
        if (config.isEnableMetricInterceptor()) {
            server.add(new MetricServerInterceptor(config, metrics));
        }
        server.add(new HeaderServerInterceptor(builder.cpuUsageSampler));
        server.add(new AccessLogServerInterceptor(accessLogger, classifier));
        server.add(new RecoveryServerInterceptor(classifier));
        this.serverInterceptors = Collections.unmodifiableList(server);
    }

    public static Builder builder(InterceptorConfig config) {
        return new Builder(config);
    }

    public InterceptorConfig config() {
        return config;
    }

    /** Client interceptors, outermost first. */
    public List<ClientInterceptor> clientInterceptors() {
        return clientInterceptors;
    }

    /** Server interceptors, outermost first. */
    public List<ServerInterceptor> serverInterceptors() {
        return serverInterceptors;
    }

    public Channel intercept(Channel channel) {
        return ClientInterceptors.interceptForward(channel, clientInterceptors);
    }

    public ServerServiceDefinition intercept(ServerServiceDefinition service) {
        return ServerInterceptors.interceptForward(service, serverInterceptors);
    }

    public ServerServiceDefinition intercept(BindableService service) {
        return ServerInterceptors.interceptForward(service, serverInterceptors);
    }

    public static final class Builder {
        private final InterceptorConfig config;
        private MeterRegistry meterRegistry = Metrics.globalRegistry;
        private Supplier<OpenTelemetry> openTelemetry = GlobalOpenTelemetry::get;
        private CpuUsageSampler cpuUsageSampler;
        private PayloadFormatter payloadFormatter = new PayloadFormatter();

        private Builder(InterceptorConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
            return this;
        }

        /**
         * Fixed OpenTelemetry instance. Without one, {@link GlobalOpenTelemetry} is read on every
         * call, never while building.
         */
        public Builder openTelemetry(OpenTelemetry openTelemetry) {
            Objects.requireNonNull(openTelemetry, "openTelemetry");
            this.openTelemetry = () -> openTelemetry;
            return this;
        }

        public Builder cpuUsageSampler(CpuUsageSampler cpuUsageSampler) {
            this.cpuUsageSampler = Objects.requireNonNull(cpuUsageSampler, "cpuUsageSampler");
            return this;
        }

        public Builder payloadFormatter(PayloadFormatter payloadFormatter) {
            this.payloadFormatter = Objects.requireNonNull(payloadFormatter, "payloadFormatter");
            return this;
        }

        public InterceptorChain build() {
            if (cpuUsageSampler == null) {
                cpuUsageSampler = new SystemCpuUsageSampler();
            }
            return new InterceptorChain(this);
        }
    }
}
