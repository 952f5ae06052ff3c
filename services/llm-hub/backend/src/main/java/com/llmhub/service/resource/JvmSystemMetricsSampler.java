package com.llmhub.service.resource;

import com.llmhub.dto.ResourceSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.time.Clock;

/**
 * com.sun.management.OperatingSystemMXBean 기반 계측
 * - 자기 프로세스 메모리: heap + non-heap 사용량 / 물리 메모리
 * - 값을 얻을 수 없으면 0 으로 보고
 */
@Slf4j
public class JvmSystemMetricsSampler implements SystemMetricsSampler {

    private final Clock clock;
    private final File diskRoot;
    private final com.sun.management.OperatingSystemMXBean os;
    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();

    public JvmSystemMetricsSampler(Clock clock, File diskRoot) {
        this.clock = clock;
        this.diskRoot = diskRoot;

        java.lang.management.OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        if (bean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            this.os = sunBean;
        } else {
            log.warn("event=METRICS_UNAVAILABLE reason=no_com_sun_os_mxbean");
            this.os = null;
        }
    }

    @Override
    public ResourceSnapshot sample() {
        if (os == null) {
            return ResourceSnapshot.empty(clock.instant());
        }

        long totalMemory = os.getTotalMemorySize();
        double systemMemoryPercent = totalMemory > 0
                ? (totalMemory - os.getFreeMemorySize()) * 100.0 / totalMemory
                : 0.0;

        long processUsed = memory.getHeapMemoryUsage().getUsed()
                + memory.getNonHeapMemoryUsage().getUsed();
        double processMemoryPercent = totalMemory > 0 ? processUsed * 100.0 / totalMemory : 0.0;

        return new ResourceSnapshot(
                clock.instant(),
                toPercent(os.getCpuLoad()),
                systemMemoryPercent,
                toPercent(os.getProcessCpuLoad()),
                processMemoryPercent
        );
    }

    @Override
    public double diskUsedPercent() {
        long total = diskRoot.getTotalSpace();
        if (total <= 0) {
            return 0.0;
        }
        return (total - diskRoot.getFreeSpace()) * 100.0 / total;
    }

    // MXBean 은 0.0~1.0, 측정 불가 시 음수
    private static double toPercent(double load) {
        return load < 0 ? 0.0 : load * 100.0;
    }
}
