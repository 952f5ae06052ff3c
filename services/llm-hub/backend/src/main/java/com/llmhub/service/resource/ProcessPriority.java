package com.llmhub.service.resource;

/**
 * 프로세스 스케줄링 우선순위 4단계 (Unix nice 값)
 */
public enum ProcessPriority {

    NORMAL(0),
    BELOW_NORMAL(10),
    LOW(15),
    IDLE(19);

    private final int niceValue;

    ProcessPriority(int niceValue) {
        this.niceValue = niceValue;
    }

    public int getNiceValue() {
        return niceValue;
    }

    /**
     * 스로틀 레벨 → 우선순위 (0: normal, 1: below-normal, 2: low, 3+: idle)
     */
    public static ProcessPriority forThrottleLevel(int level) {
        if (level <= 0) {
            return NORMAL;
        }
        if (level == 1) {
            return BELOW_NORMAL;
        }
        if (level == 2) {
            return LOW;
        }
        return IDLE;
    }
}
