package com.demo.instrument.server;

import com.sun.management.OperatingSystemMXBean;

import java.lang.management.ManagementFactory;

/**
 * System-wide CPU load from the platform MXBean, the metric auto-scalers use.
 */
public class SystemCpuUsageSampler implements CpuUsageSampler {
    private final OperatingSystemMXBean osBean;

    public SystemCpuUsageSampler() {
        this.osBean = (OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();
    }

    /**
     * CPU load scaled to 0..1000; the MXBean reports a negative value while it has no sample yet.
     */
    @Override
    public long sample() {
        double load = osBean.getCpuLoad();
        if (load < 0 || Double.isNaN(load)) {
            return -1;
        }
        return Math.round(load * 1000.0);
    }
}
