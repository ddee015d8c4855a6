package com.demo.instrument.config;

import com.demo.instrument.chain.InterceptorChain;
import com.demo.instrument.context.PropagatedHeaders;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import javax.annotation.PostConstruct;
import java.util.Arrays;
import java.util.List;

/**
 * Spring wiring for the interceptor chain. Options come from {@code instrument.*} properties.
 *
 * Example:
 * <pre>
 * instrument.name=order-service
 * instrument.access.enabled=true
 * instrument.slow-log-threshold=200ms
 * instrument.propagated-headers=x-request-id,x-tenant
 * </pre>
 */
@Configuration
public class InstrumentationConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(InstrumentationConfiguration.class);

    @Value("${instrument.name:grpc}")
    private String name;

    @Value("${instrument.app-name:${spring.application.name:unknown}}")
    private String appName;

    @Value("${instrument.target:}")
    private String target;

    @Value("${instrument.access.enabled:false}")
    private boolean enableAccessInterceptor;

    @Value("${instrument.access.request:false}")
    private boolean enableAccessInterceptorReq;

    @Value("${instrument.access.response:false}")
    private boolean enableAccessInterceptorRes;

    @Value("${instrument.trace.enabled:true}")
    private boolean enableTraceInterceptor;

    @Value("${instrument.metric.enabled:true}")
    private boolean enableMetricInterceptor;

    @Value("${instrument.cpu-usage.enabled:false}")
    private boolean enableCpuUsage;

    @Value("${instrument.slow-log-threshold:500ms}")
    private String slowLogThreshold;

    @Value("${instrument.timeout:3s}")
    private String defaultTimeout;

    @Value("${instrument.propagated-headers:}")
    private String propagatedHeaders;

    @PostConstruct
    public void registerPropagatedHeaders() {
        List<String> names = Arrays.stream(StringUtils.commaDelimitedListToStringArray(propagatedHeaders))
                .map(String::trim)
                .filter(header -> !header.isEmpty())
                .toList();
        PropagatedHeaders.set(names);
        logger.info("Propagated headers registered: {}", PropagatedHeaders.keys());
    }

    @Bean
    public InterceptorConfig interceptorConfig() {
        InterceptorConfig config = InterceptorConfig.builder()
                .name(name)
                .appName(appName)
                .target(target)
                .enableAccessInterceptor(enableAccessInterceptor)
                .enableAccessInterceptorReq(enableAccessInterceptorReq)
                .enableAccessInterceptorRes(enableAccessInterceptorRes)
                .enableTraceInterceptor(enableTraceInterceptor)
                .enableMetricInterceptor(enableMetricInterceptor)
                .enableCpuUsage(enableCpuUsage)
                .slowLogThreshold(DurationStyle.detectAndParse(slowLogThreshold))
                .defaultTimeout(DurationStyle.detectAndParse(defaultTimeout))
                .build();
        logger.info("Interceptor chain configured: {}", config);
        return config;
    }

    @Bean
    public InterceptorChain interceptorChain(InterceptorConfig interceptorConfig,
                                             ObjectProvider<MeterRegistry> meterRegistry,
                                             ObjectProvider<OpenTelemetry> openTelemetry) {
        InterceptorChain.Builder builder = InterceptorChain.builder(interceptorConfig)
                .meterRegistry(meterRegistry.getIfAvailable(() -> Metrics.globalRegistry));
        openTelemetry.ifAvailable(builder::openTelemetry);
        return builder.build();
    }
}
