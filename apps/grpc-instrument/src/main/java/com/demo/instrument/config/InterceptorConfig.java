package com.demo.instrument.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Options resolved once when an interceptor chain is built. Immutable.
 */
public final class InterceptorConfig {

    public static final Duration DEFAULT_SLOW_LOG_THRESHOLD = Duration.ofMillis(500);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);

    private final String name;
    private final String appName;
    private final String target;
    private final boolean enableAccessInterceptor;
    private final boolean enableAccessInterceptorReq;
    private final boolean enableAccessInterceptorRes;
    private final boolean enableTraceInterceptor;
    private final boolean enableMetricInterceptor;
    private final boolean enableCpuUsage;
    private final Duration slowLogThreshold;
    private final Duration defaultTimeout;

    private InterceptorConfig(Builder builder) {
        this.name = builder.name;
        this.appName = builder.appName;
        this.target = builder.target;
        this.enableAccessInterceptor = builder.enableAccessInterceptor;
        this.enableAccessInterceptorReq = builder.enableAccessInterceptorReq;
        this.enableAccessInterceptorRes = builder.enableAccessInterceptorRes;
        this.enableTraceInterceptor = builder.enableTraceInterceptor;
        this.enableMetricInterceptor = builder.enableMetricInterceptor;
        this.enableCpuUsage = builder.enableCpuUsage;
        this.slowLogThreshold = builder.slowLogThreshold;
        this.defaultTimeout = builder.defaultTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static InterceptorConfig defaults() {
        return builder().build();
    }

    /** Logical name of the component, used as the {@code name} metrics tag. */
    public String name() {
        return name;
    }

    /** Local application name sent to servers in the {@code app} header. */
    public String appName() {
        return appName;
    }

    /** Client target used in logs and metrics, {@code null} to use the channel authority. */
    public String target() {
        return target;
    }

    /** Configured target, else {@code authority}. */
    public String targetOr(String authority) {
        return target != null ? target : authority;
    }

    public boolean isEnableAccessInterceptor() {
        return enableAccessInterceptor;
    }

    public boolean isEnableAccessInterceptorReq() {
        return enableAccessInterceptorReq;
    }

    public boolean isEnableAccessInterceptorRes() {
        return enableAccessInterceptorRes;
    }

    public boolean isEnableTraceInterceptor() {
        return enableTraceInterceptor;
    }

    public boolean isEnableMetricInterceptor() {
        return enableMetricInterceptor;
    }

    public boolean isEnableCpuUsage() {
        return enableCpuUsage;
    }

    /** Calls slower than this are logged at WARN; zero or negative disables slow logging. */
    public Duration slowLogThreshold() {
        return slowLogThreshold;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    @Override
    public String toString() {
        return "InterceptorConfig{name=" + name
            + ", appName=" + appName
            + ", target=" + target
            + ", access=" + enableAccessInterceptor
            + ", accessReq=" + enableAccessInterceptorReq
            + ", accessRes=" + enableAccessInterceptorRes
            + ", trace=" + enableTraceInterceptor
            + ", metric=" + enableMetricInterceptor
            + ", cpuUsage=" + enableCpuUsage
            + ", slowLogThreshold=" + slowLogThreshold
            + ", defaultTimeout=" + defaultTimeout + "}";
    }

    public static final class Builder {
        private String name = "grpc";
        private String appName = "unknown";
        private String target;
        private boolean enableAccessInterceptor;
        private boolean enableAccessInterceptorReq;
        private boolean enableAccessInterceptorRes;
        private boolean enableTraceInterceptor = true;
        private boolean enableMetricInterceptor = true;
        private boolean enableCpuUsage;
        private Duration slowLogThreshold = DEFAULT_SLOW_LOG_THRESHOLD;
        private Duration defaultTimeout = DEFAULT_TIMEOUT;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder appName(String appName) {
            this.appName = Objects.requireNonNull(appName, "appName");
            return this;
        }

        public Builder target(String target) {
            this.target = target == null || target.isBlank() ? null : target;
            return this;
        }

        public Builder enableAccessInterceptor(boolean enabled) {
            this.enableAccessInterceptor = enabled;
            return this;
        }

        public Builder enableAccessInterceptorReq(boolean enabled) {
            this.enableAccessInterceptorReq = enabled;
            return this;
        }

        public Builder enableAccessInterceptorRes(boolean enabled) {
            this.enableAccessInterceptorRes = enabled;
            return this;
        }

        public Builder enableTraceInterceptor(boolean enabled) {
            this.enableTraceInterceptor = enabled;
            return this;
        }

        public Builder enableMetricInterceptor(boolean enabled) {
            this.enableMetricInterceptor = enabled;
            return this;
        }

        public Builder enableCpuUsage(boolean enabled) {
            this.enableCpuUsage = enabled;
            return this;
        }

        public Builder slowLogThreshold(Duration threshold) {
            this.slowLogThreshold = Objects.requireNonNull(threshold, "slowLogThreshold");
            return this;
        }

        public Builder defaultTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "defaultTimeout");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("defaultTimeout must be positive: " + timeout);
            }
            this.defaultTimeout = timeout;
            return this;
        }

        public InterceptorConfig build() {
            return new InterceptorConfig(this);
        }
    }
}
