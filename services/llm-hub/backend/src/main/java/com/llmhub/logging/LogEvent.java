package com.llmhub.logging;

public final class LogEvent {

    private LogEvent() {
        // 인스턴스 생성 방지
    }

    /** 도구 호출 처리 시작 */
    public static final String TOOL_CALL_START = "TOOL_CALL_START";

    /** 도구 호출 정상 종료 */
    public static final String TOOL_CALL_END = "TOOL_CALL_END";

    /** 도구 호출 중 예외 발생 (비치명적) */
    public static final String TOOL_CALL_FAIL = "TOOL_CALL_FAIL";

    /** 치명적 오류로 인한 도구 호출 실패 */
    public static final String TOOL_CALL_ERROR = "TOOL_CALL_ERROR";

    /** 업스트림 요청 재시도 */
    public static final String UPSTREAM_RETRY = "UPSTREAM_RETRY";

    /** 업스트림 요청 최종 실패 */
    public static final String UPSTREAM_FAILED = "UPSTREAM_FAILED";

    /** CircuitBreaker 상태가 OPEN으로 전환됨 / OPEN 상태에서 차단됨 */
    public static final String CIRCUIT_OPEN = "CIRCUIT_OPEN";

    /** CircuitBreaker가 다시 CLOSED로 전환됨 */
    public static final String CIRCUIT_CLOSED = "CIRCUIT_CLOSED";

    /** 리소스 압박으로 인한 추가 지연 */
    public static final String THROTTLE_DELAY = "THROTTLE_DELAY";

    /** 스로틀 레벨 변경 */
    public static final String THROTTLE_CHANGED = "THROTTLE_CHANGED";

    /** 자동 복구 시도 */
    public static final String RECOVERY_ATTEMPT = "RECOVERY_ATTEMPT";

    /** 자동 복구 성공 */
    public static final String RECOVERY_SUCCESS = "RECOVERY_SUCCESS";

    /** 자동 복구 실패 */
    public static final String RECOVERY_FAIL = "RECOVERY_FAIL";

    /** 쿨다운 또는 최대 시도 횟수로 복구 생략 */
    public static final String RECOVERY_SKIPPED = "RECOVERY_SKIPPED";

    /** 모델 추가 감지 */
    public static final String MODEL_ADDED = "MODEL_ADDED";

    /** 모델 제거 감지 */
    public static final String MODEL_REMOVED = "MODEL_REMOVED";

    /** 모델 디스커버리 사이클 실패 */
    public static final String DISCOVERY_FAIL = "DISCOVERY_FAIL";

    /** 장애 중 폴링 주기 연장 */
    public static final String POLL_BACKOFF = "POLL_BACKOFF";

    /** 예측 정비 조치 실행 */
    public static final String MAINTENANCE_ACTION = "MAINTENANCE_ACTION";

    /** 추세 임계치 초과 감지 */
    public static final String TREND_ALERT = "TREND_ALERT";

    /** 게이트웨이 레지스트리 갱신 */
    public static final String SERVICE_REGISTERED = "SERVICE_REGISTERED";

    /** 게이트웨이 레지스트리에서 제거 */
    public static final String SERVICE_REMOVED = "SERVICE_REMOVED";

    /** 폴링 루프 내부 예외 */
    public static final String LOOP_ERROR = "LOOP_ERROR";

    /** 비즈니스 예외(ApiException) 발생 */
    public static final String BUSINESS_EXCEPTION = "BUSINESS_EXCEPTION";

    /** 예상하지 못한 시스템 예외 */
    public static final String UNHANDLED_EXCEPTION = "UNHANDLED_EXCEPTION";

    /** 인증 실패로 요청이 차단됨 */
    public static final String AUTH_REJECTED = "AUTH_REJECTED";

    /** Rate Limit에 의해 요청이 차단됨 */
    public static final String RATE_LIMIT_REJECTED = "RATE_LIMIT_REJECTED";

}
