package com.llmhub.filter;

import com.llmhub.logging.TraceContext;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TraceIdFilterTest {

    @Test
    void reusesIncomingTraceIdAndClearsMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.addHeader(TraceContext.TRACE_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        new TraceIdFilter().doFilter(request, response, (req, res) -> seen.set(TraceContext.current()));

        assertThat(seen.get()).isEqualTo("abc-123");
        assertThat(response.getHeader(TraceContext.TRACE_ID_HEADER)).isEqualTo("abc-123");
        assertThat(MDC.get(TraceContext.TRACE_ID_KEY)).isNull();
    }

    @Test
    void generatesTraceIdWhenMissing() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        new TraceIdFilter().doFilter(new MockHttpServletRequest("GET", "/health"), response, new MockFilterChain());

        assertThat(response.getHeader(TraceContext.TRACE_ID_HEADER)).isNotBlank();
    }
}
