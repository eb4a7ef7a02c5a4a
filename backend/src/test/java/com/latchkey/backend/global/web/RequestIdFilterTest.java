package com.latchkey.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void echoesASafeClientRequestIdAndExposesItToLogging() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, " abc-123 ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seenInMdc.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
            }
        });

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
        assertThat(seenInMdc.get()).isEqualTo("abc-123");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    void replacesUnsafeOrOversizedIds() {
        MockHttpServletRequest injected = new MockHttpServletRequest();
        injected.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc\nforged log line");
        MockHttpServletRequest oversized = new MockHttpServletRequest();
        oversized.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "a".repeat(RequestIdFilter.MAX_LENGTH + 1));

        assertThat(RequestIdFilter.resolveRequestId(injected)).doesNotContain("forged").hasSize(36);
        assertThat(RequestIdFilter.resolveRequestId(oversized)).hasSize(36);
        assertThat(RequestIdFilter.resolveRequestId(new MockHttpServletRequest())).hasSize(36);
    }
}
