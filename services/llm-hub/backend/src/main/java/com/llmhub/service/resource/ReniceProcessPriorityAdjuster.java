package com.llmhub.service.resource;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * renice 로 자기 프로세스 우선순위 조정
 * - 비특권 프로세스는 nice 값을 낮출 수 없으므로 NORMAL 복귀는 실패할 수 있음 (WARN 로그)
 * - Windows 는 지원하지 않음
 */
@Slf4j
public class ReniceProcessPriorityAdjuster implements ProcessPriorityAdjuster {

    private static final long TIMEOUT_SECONDS = 5;

    private final boolean supported =
            !System.getProperty("os.name", "").toLowerCase().startsWith("windows");

    @Override
    public boolean apply(ProcessPriority priority) {
        if (!supported) {
            log.debug("event=PRIORITY_UNSUPPORTED priority={}", priority);
            return false;
        }

        long pid = ProcessHandle.current().pid();
        ProcessBuilder builder = new ProcessBuilder(
                "renice", "-n", String.valueOf(priority.getNiceValue()), "-p", String.valueOf(pid)
        ).redirectErrorStream(true);

        try {
            Process process = builder.start();
            process.getInputStream().transferTo(java.io.OutputStream.nullOutputStream());

            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("event=PRIORITY_FAIL priority={} reason=timeout", priority);
                return false;
            }

            if (process.exitValue() != 0) {
                log.warn("event=PRIORITY_FAIL priority={} exitCode={}", priority, process.exitValue());
                return false;
            }

            log.debug("event=PRIORITY_SET priority={} nice={}", priority, priority.getNiceValue());
            return true;

        } catch (IOException e) {
            log.warn("event=PRIORITY_FAIL priority={} message={}", priority, e.getMessage());
            return false;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
