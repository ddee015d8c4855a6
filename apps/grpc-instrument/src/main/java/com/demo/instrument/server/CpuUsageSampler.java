package com.demo.instrument.server;

/**
 * Source of the CPU usage reported to callers that ask for it.
 */
@FunctionalInterface
public interface CpuUsageSampler {

    /**
     * Current CPU usage in per-mille (0..1000); zero or negative when no sample is available.
     */
    long sample();
}
