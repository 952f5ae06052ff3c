package com.llmhub.logging;

import com.llmhub.dto.ToolCallResult;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.util.List;

@Aspect
@Component
@Slf4j
public class LogAspect {

    /**
     * 도구 호출 경로에만 적용
     * - 브리지: ToolTranslator.invoke
     * - 게이트웨이: ToolRouter.route, ResponseAggregator.aggregate
     */
    @Around(
            "execution(* com.llmhub.service.bridge.ToolTranslator.invoke(..)) || " +
                    "execution(* com.llmhub.service.gateway.ToolRouter.route(..)) || " +
                    "execution(* com.llmhub.service.gateway.ResponseAggregator.aggregate(..))"
    )
    public Object logToolCall(ProceedingJoinPoint joinPoint) throws Throwable {

        long start = System.currentTimeMillis();
        String component = joinPoint.getSignature().getDeclaringType().getSimpleName();
        String target = describeTarget(joinPoint.getArgs());

        log.info("event={} component={} target={}", LogEvent.TOOL_CALL_START, component, target);

        try {
            Object result = joinPoint.proceed();

            long duration = System.currentTimeMillis() - start;

            // 라우터/애그리게이터는 실패도 status 로 반환
            if (result instanceof ToolCallResult callResult) {
                log.info("event={} component={} target={} status={} durationMs={}",
                        LogEvent.TOOL_CALL_END, component, target, callResult.status().getCode(), duration);
            } else {
                log.info("event={} component={} target={} durationMs={}",
                        LogEvent.TOOL_CALL_END, component, target, duration);
            }

            return result;

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - start;

            Level level = LogLevelPolicy.decideByException(e);

            if (level == Level.WARN) {
                // 복구/재시도 대상 또는 호출자 오류
                log.warn(
                        "event={} component={} target={} durationMs={} message={}",
                        LogEvent.TOOL_CALL_FAIL,
                        component,
                        target,
                        duration,
                        e.getMessage()
                );

            } else {
                log.error(
                        "event={} component={} target={} durationMs={} message={}",
                        LogEvent.TOOL_CALL_ERROR,
                        component,
                        target,
                        duration,
                        e.getMessage(),
                        e
                );
            }
            throw e;
        }
        // trace_id clear 금지 (요청 종료 시 Filter에서 일괄 처리)
    }

    private static String describeTarget(Object[] args) {
        if (args.length > 0 && args[0] instanceof String toolName) {
            return toolName;
        }
        if (args.length > 0 && args[0] instanceof List<?> calls) {
            return "calls:" + calls.size();
        }
        return "-";
    }
}
