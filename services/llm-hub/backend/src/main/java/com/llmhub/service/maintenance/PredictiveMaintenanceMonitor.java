package com.llmhub.service.maintenance;

import com.llmhub.dto.PredictionStatus;
import com.llmhub.dto.ResourceSnapshot;
import com.llmhub.exception.ErrorPattern;
import com.llmhub.logging.LogEvent;
import com.llmhub.observability.HubMetrics;
import com.llmhub.scheduling.PollingLoop;
import com.llmhub.service.bridge.UpstreamClient;
import com.llmhub.service.resource.ProcessPriority;
import com.llmhub.service.resource.ProcessPriorityAdjuster;
import com.llmhub.service.resource.SystemMetricsSampler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * 추세 기반 예측 정비
 *
 * - 주기마다 메모리/CPU/디스크 사용률을 24h 보관 버퍼에 적재
 * - 추세/평균/오류 빈도가 임계치를 넘으면 쿨다운을 거쳐 선제 조치
 *   memory 1h 추세 > 5%/h       → GC + 캐시 정리 이벤트 (정리 쿨다운 1h)
 *   CPU 최근 5분 평균 > 80%      → 자기 프로세스 우선순위 하향 (쿨다운 1h)
 *   disk 24h 추세 > 10%/day     → 24h 지난 자기 임시 파일 삭제 (정리 쿨다운 1h, memory 와 공유)
 *   최근 1h 오류 > 3건           → 연결 풀 재생성 (쿨다운 2h)
 */
@Slf4j
public class PredictiveMaintenanceMonitor extends PollingLoop implements ErrorRecorder {

    static final Duration RETENTION = Duration.ofHours(24);
    static final Duration MEMORY_WINDOW = Duration.ofHours(1);
    static final Duration CPU_WINDOW = Duration.ofMinutes(5);
    static final Duration DISK_WINDOW = Duration.ofHours(24);
    static final Duration ERROR_WINDOW = Duration.ofHours(1);

    static final double MEMORY_GROWTH_PER_HOUR = 5.0;
    static final double CPU_SUSTAINED_PERCENT = 80.0;
    static final double DISK_GROWTH_PER_DAY = 10.0;
    static final int ERROR_FREQUENCY_THRESHOLD = 3;

    static final Duration CLEANUP_COOLDOWN = Duration.ofHours(1);
    static final Duration CPU_COOLDOWN = Duration.ofHours(1);
    static final Duration RESTART_COOLDOWN = Duration.ofHours(2);

    static final Duration TEMP_FILE_MAX_AGE = Duration.ofHours(24);

    private static final Duration PER_HOUR = Duration.ofHours(1);
    private static final Duration PER_DAY = Duration.ofDays(1);

    private final SystemMetricsSampler sampler;
    private final ProcessPriorityAdjuster priorityAdjuster;
    private final UpstreamClient upstreamClient;
    private final ApplicationEventPublisher eventPublisher;
    private final HubMetrics metrics;
    private final Clock clock;
    private final Duration interval;
    private final Path tempDir;

    private final TrendBuffer memory = new TrendBuffer();
    private final TrendBuffer cpu = new TrendBuffer();
    private final TrendBuffer disk = new TrendBuffer();
    private final ErrorLog errors = new ErrorLog();

    private volatile Instant lastCleanupAt;
    private volatile Instant lastCpuActionAt;
    private volatile Instant lastRestartAt;

    public PredictiveMaintenanceMonitor(
            SystemMetricsSampler sampler,
            ProcessPriorityAdjuster priorityAdjuster,
            UpstreamClient upstreamClient,
            ApplicationEventPublisher eventPublisher,
            HubMetrics metrics,
            Clock clock,
            Duration interval,
            Path tempDir
    ) {
        super("predictive-maintenance");
        this.sampler = sampler;
        this.priorityAdjuster = priorityAdjuster;
        this.upstreamClient = upstreamClient;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
        this.interval = interval;
        this.tempDir = tempDir;
    }

    @Override
    protected Duration runCycle() {
        collect();
        analyze();
        return interval;
    }

    @Override
    protected Duration fallbackDelay() {
        return interval;
    }

    @Override
    public void recordError(ErrorPattern pattern) {
        errors.record(clock.instant(), pattern);
    }

    void collect() {
        Instant now = clock.instant();
        ResourceSnapshot snapshot = sampler.sample();

        record(now, snapshot.systemMemoryPercent(), snapshot.systemCpuPercent(), sampler.diskUsedPercent());
    }

    void record(Instant timestamp, double memoryPercent, double cpuPercent, double diskPercent) {
        memory.add(timestamp, memoryPercent);
        cpu.add(timestamp, cpuPercent);
        disk.add(timestamp, diskPercent);

        Instant cutoff = timestamp.minus(RETENTION);
        memory.trimOlderThan(cutoff);
        cpu.trimOlderThan(cutoff);
        disk.trimOlderThan(cutoff);
        errors.trimOlderThan(cutoff);
    }

    /**
     * 규칙 평가 후 조치 (각 조치는 자체 쿨다운 확인)
     */
    void analyze() {
        Instant now = clock.instant();

        double memoryTrend = memory.trend(MEMORY_WINDOW, now, PER_HOUR);
        if (memoryTrend > MEMORY_GROWTH_PER_HOUR) {
            log.warn("event={} metric=memory trendPerHour={}", LogEvent.TREND_ALERT, round(memoryTrend));
            memoryCleanup(now);
        }

        double cpuMean = cpu.meanSince(now.minus(CPU_WINDOW));
        if (!Double.isNaN(cpuMean) && cpuMean > CPU_SUSTAINED_PERCENT) {
            log.warn("event={} metric=cpu meanPercent={}", LogEvent.TREND_ALERT, round(cpuMean));
            cpuOptimization(now);
        }

        double diskTrend = disk.trend(DISK_WINDOW, now, PER_DAY);
        if (diskTrend > DISK_GROWTH_PER_DAY) {
            log.warn("event={} metric=disk trendPerDay={}", LogEvent.TREND_ALERT, round(diskTrend));
            diskCleanup(now);
        }

        int recentErrors = errors.countSince(now.minus(ERROR_WINDOW));
        if (recentErrors > ERROR_FREQUENCY_THRESHOLD) {
            log.warn("event={} metric=errors lastHour={}", LogEvent.TREND_ALERT, recentErrors);
            errorMitigation(now);
        }
    }

    private void memoryCleanup(Instant now) {
        if (onCooldown(lastCleanupAt, CLEANUP_COOLDOWN, now)) {
            log.debug("event=MAINTENANCE_SKIPPED action=memory_cleanup reason=cooldown");
            return;
        }

        System.gc();
        eventPublisher.publishEvent(new CachePruneRequestedEvent(now));

        lastCleanupAt = now;
        actionTaken("memory_cleanup");
    }

    private void cpuOptimization(Instant now) {
        if (onCooldown(lastCpuActionAt, CPU_COOLDOWN, now)) {
            log.debug("event=MAINTENANCE_SKIPPED action=cpu_priority reason=cooldown");
            return;
        }

        priorityAdjuster.apply(ProcessPriority.BELOW_NORMAL);

        lastCpuActionAt = now;
        actionTaken("cpu_priority");
    }

    private void diskCleanup(Instant now) {
        if (onCooldown(lastCleanupAt, CLEANUP_COOLDOWN, now)) {
            log.debug("event=MAINTENANCE_SKIPPED action=disk_cleanup reason=cooldown");
            return;
        }

        int deleted = deleteStaleTempFiles(now.minus(TEMP_FILE_MAX_AGE));
        log.info("event=TEMP_FILES_DELETED dir={} count={}", tempDir, deleted);

        lastCleanupAt = now;
        actionTaken("disk_cleanup");
    }

    private void errorMitigation(Instant now) {
        if (onCooldown(lastRestartAt, RESTART_COOLDOWN, now)) {
            log.debug("event=MAINTENANCE_SKIPPED action=error_mitigation reason=cooldown");
            return;
        }

        boolean recovered = upstreamClient.attemptRecovery();
        log.info("event=CONNECTION_POOL_RESET recovered={}", recovered);

        lastRestartAt = now;
        actionTaken("error_mitigation");
    }

    int deleteStaleTempFiles(Instant cutoff) {
        if (!Files.isDirectory(tempDir)) {
            return 0;
        }

        FileTime threshold = FileTime.from(cutoff);
        int deleted = 0;

        try (Stream<Path> paths = Files.walk(tempDir)) {
            List<Path> files = paths.filter(Files::isRegularFile).toList();

            for (Path file : files) {
                try {
                    if (Files.getLastModifiedTime(file).compareTo(threshold) < 0) {
                        Files.deleteIfExists(file);
                        deleted++;
                    }
                } catch (IOException e) {
                    // 삭제 불가 파일은 건너뜀
                    log.debug("event=TEMP_FILE_SKIPPED file={} message={}", file, e.getMessage());
                }
            }

        } catch (IOException e) {
            log.warn("event=TEMP_CLEANUP_FAIL dir={} message={}", tempDir, e.getMessage());
        }

        return deleted;
    }

    private void actionTaken(String action) {
        metrics.maintenanceAction(action);
        log.info("event={} action={}", LogEvent.MAINTENANCE_ACTION, action);
    }

    public PredictionStatus getStatus() {
        Instant now = clock.instant();

        return new PredictionStatus(
                isRunning(),
                new PredictionStatus.Trends(
                        round(memory.trend(MEMORY_WINDOW, now, PER_HOUR)),
                        round(cpu.trend(MEMORY_WINDOW, now, PER_HOUR)),
                        round(disk.trend(DISK_WINDOW, now, PER_DAY))
                ),
                new PredictionStatus.ErrorFrequency(
                        errors.countSince(now.minus(ERROR_WINDOW)),
                        ERROR_FREQUENCY_THRESHOLD
                ),
                new PredictionStatus.LastActions(
                        lastCleanupAt,
                        lastCpuActionAt,
                        lastRestartAt,
                        remaining(lastCleanupAt, CLEANUP_COOLDOWN, now),
                        remaining(lastCpuActionAt, CPU_COOLDOWN, now),
                        remaining(lastRestartAt, RESTART_COOLDOWN, now)
                ),
                new PredictionStatus.DataPoints(memory.size(), cpu.size(), disk.size(), errors.size())
        );
    }

    private static boolean onCooldown(Instant last, Duration cooldown, Instant now) {
        return last != null && Duration.between(last, now).compareTo(cooldown) < 0;
    }

    private static long remaining(Instant last, Duration cooldown, Instant now) {
        if (last == null) {
            return 0;
        }
        long left = cooldown.minus(Duration.between(last, now)).toSeconds();
        return Math.max(0, left);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
