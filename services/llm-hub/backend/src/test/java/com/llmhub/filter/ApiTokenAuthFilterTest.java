package com.llmhub.filter;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class ApiTokenAuthFilterTest {

    private final Counter rejected = new SimpleMeterRegistry().counter("auth_rejected");

    private ApiTokenAuthFilter filter(boolean enabled) {
        return new ApiTokenAuthFilter(new ClientKeyResolver(), rejected, enabled, "secret-key");
    }

    private static MockHttpServletRequest request(String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/gateway/tools/inference");
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return request;
    }

    @Test
    void validTokenPassesThrough() throws Exception {
        MockFilterChain chain = new MockFilterChain();
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter(true).doFilter(request("Bearer secret-key"), response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    void missingTokenIsRejected() throws Exception {
        MockFilterChain chain = new MockFilterChain();
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter(true).doFilter(request(null), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getHeader("WWW-Authenticate")).isEqualTo("Bearer");
        assertThat(response.getContentAsString()).contains("UNAUTHORIZED");
        assertThat(rejected.count()).isEqualTo(1.0);
    }

    @Test
    void wrongTokenIsRejected() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter(true).doFilter(request("Bearer nope"), response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(401);
    }

    @Test
    void disabledAuthLetsEverythingThrough() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter(false).doFilter(request(null), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }
}
