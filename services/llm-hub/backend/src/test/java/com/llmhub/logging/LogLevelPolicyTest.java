package com.llmhub.logging;

import com.llmhub.exception.ApiException;
import com.llmhub.exception.CircuitOpenException;
import com.llmhub.exception.ErrorPattern;
import com.llmhub.exception.UpstreamClientErrorException;
import com.llmhub.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;

class LogLevelPolicyTest {

    @Test
    void transientUpstreamFailuresAreWarnings() {
        assertThat(LogLevelPolicy.decideByException(new CircuitOpenException("open"))).isEqualTo(Level.WARN);
        assertThat(LogLevelPolicy.decideByException(
                new UpstreamUnavailableException("t", ErrorPattern.TIMEOUT, null))).isEqualTo(Level.WARN);
        assertThat(LogLevelPolicy.decideByException(
                new UpstreamClientErrorException("bad", 400, null))).isEqualTo(Level.WARN);
    }

    @Test
    void unclassifiedFailuresAreErrors() {
        assertThat(LogLevelPolicy.decideByException(
                new UpstreamUnavailableException("g", ErrorPattern.GENERIC, null))).isEqualTo(Level.ERROR);
        assertThat(LogLevelPolicy.decideByException(new IllegalStateException())).isEqualTo(Level.ERROR);
    }

    @Test
    void apiExceptionLevelFollowsStatus() {
        assertThat(LogLevelPolicy.decideByException(
                new ApiException("INVALID_PARAMETERS", "x", HttpStatus.BAD_REQUEST))).isEqualTo(Level.WARN);
        assertThat(LogLevelPolicy.decideByException(
                new ApiException("BROKEN", "x", HttpStatus.INTERNAL_SERVER_ERROR))).isEqualTo(Level.ERROR);
    }
}
