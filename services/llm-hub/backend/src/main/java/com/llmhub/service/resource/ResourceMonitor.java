package com.llmhub.service.resource;

import com.llmhub.dto.ResourceSnapshot;
import com.llmhub.dto.ResourceStatus;
import com.llmhub.dto.ThrottleState;
import com.llmhub.logging.LogEvent;
import com.llmhub.scheduling.PollingLoop;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * 리소스 압박 기반 스로틀 컨트롤러
 *
 * - 주기마다 시스템/자기 프로세스 CPU·메모리를 샘플링 (최근 1회만 유지)
 * - 독립 규칙들의 최대값으로 스로틀 레벨(0~5) 산출, 사용자 활동 중이면 +1
 * - 레벨이 바뀔 때만 OS 스케줄링 우선순위 조정
 */
@Slf4j
public class ResourceMonitor extends PollingLoop implements ThrottleAdvisor {

    static final double SYSTEM_CPU_LIMIT = 80.0;
    static final double SYSTEM_MEMORY_LIMIT = 85.0;
    static final double USER_ACTIVITY_CPU_GAP = 20.0;
    static final int MAX_LEVEL = 5;
    static final int THROTTLE_FROM_LEVEL = 2;

    private final SystemMetricsSampler sampler;
    private final ProcessPriorityAdjuster priorityAdjuster;
    private final Clock clock;
    private final Duration interval;
    private final double maxCpuPercent;
    private final double maxMemoryPercent;

    private volatile ResourceSnapshot snapshot;
    private volatile ThrottleState throttle = ThrottleState.NONE;
    private volatile boolean userActive;

    public ResourceMonitor(
            SystemMetricsSampler sampler,
            ProcessPriorityAdjuster priorityAdjuster,
            Clock clock,
            Duration interval,
            double maxCpuPercent,
            double maxMemoryPercent
    ) {
        super("resource-monitor");
        this.sampler = sampler;
        this.priorityAdjuster = priorityAdjuster;
        this.clock = clock;
        this.interval = interval;
        this.maxCpuPercent = maxCpuPercent;
        this.maxMemoryPercent = maxMemoryPercent;
        this.snapshot = ResourceSnapshot.empty(clock.instant());
    }

    @Override
    protected Duration runCycle() {
        sampleOnce();
        return interval;
    }

    @Override
    protected Duration fallbackDelay() {
        return interval;
    }

    /**
     * 샘플 1회 + 스로틀 재계산
     * - 루프 스레드(또는 정지 상태의 테스트)에서만 호출
     */
    ThrottleState sampleOnce() {
        ResourceSnapshot current;
        boolean active;
        try {
            current = sampler.sample();
            active = current.systemCpuPercent() - current.processCpuPercent() > USER_ACTIVITY_CPU_GAP;
        } catch (RuntimeException e) {
            // 계측 실패: 직전 샘플 유지, 사용자 활동 중으로 간주
            log.warn("event=RESOURCE_SAMPLE_FAIL message={}", e.getMessage());
            current = snapshot;
            active = true;
        }
        int level = computeThrottleLevel(current, active, maxCpuPercent, maxMemoryPercent);

        ThrottleState previous = throttle;
        ThrottleState next = new ThrottleState(level, recommendedDelay(level));

        snapshot = current;
        userActive = active;
        throttle = next;

        if (previous.level() != level) {
            ProcessPriority priority = ProcessPriority.forThrottleLevel(level);
            log.info("event={} from={} to={} priority={} systemCpu={} systemMemory={} userActive={}",
                    LogEvent.THROTTLE_CHANGED, previous.level(), level, priority,
                    Math.round(current.systemCpuPercent()), Math.round(current.systemMemoryPercent()), active);
            priorityAdjuster.apply(priority);
        }

        return next;
    }

    /**
     * 독립 규칙의 최대값, 사용자 활동 중이고 규칙이 하나라도 발동하면 +1 (최대 5)
     */
    public static int computeThrottleLevel(
            ResourceSnapshot snapshot,
            boolean userActive,
            double maxCpuPercent,
            double maxMemoryPercent
    ) {
        int level = 0;

        if (snapshot.systemCpuPercent() > SYSTEM_CPU_LIMIT) {
            level = Math.max(level, 3);
        }
        if (snapshot.systemMemoryPercent() > SYSTEM_MEMORY_LIMIT) {
            level = Math.max(level, 2);
        }
        if (snapshot.processCpuPercent() > maxCpuPercent) {
            level = Math.max(level, 2);
        }
        if (snapshot.processMemoryPercent() > maxMemoryPercent) {
            level = Math.max(level, 1);
        }

        if (userActive && level > 0) {
            level = Math.min(level + 1, MAX_LEVEL);
        }

        return level;
    }

    public static Duration recommendedDelay(int level) {
        return switch (level) {
            case 0 -> Duration.ZERO;
            case 1 -> Duration.ofMillis(100);
            case 2 -> Duration.ofMillis(250);
            case 3 -> Duration.ofMillis(500);
            case 4 -> Duration.ofSeconds(1);
            default -> level < 0 ? Duration.ZERO : Duration.ofSeconds(2);
        };
    }

    @Override
    public boolean shouldThrottle() {
        return throttle.level() >= THROTTLE_FROM_LEVEL;
    }

    @Override
    public Duration recommendedDelay() {
        return throttle.recommendedDelay();
    }

    public ThrottleState getThrottleState() {
        return throttle;
    }

    public ResourceStatus getResourceStatus() {
        return new ResourceStatus(
                isRunning(),
                snapshot,
                maxCpuPercent,
                maxMemoryPercent,
                throttle,
                userActive
        );
    }
}
