package com.phillippitts.ellie.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;
    private final Map<String, String> seen = new HashMap<>();

    @BeforeEach
    void setUp() throws ServletException, IOException {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/chat/text");
        doAnswer(inv -> {
            seen.putAll(ThreadContext.getImmutableContext());
            return null;
        }).when(chain).doFilter(any(), any());
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void propagatesHeadersIntoContextAndClearsAfterwards() throws Exception {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-1");
        when(request.getHeader(MdcFilter.SESSION_ID_HEADER)).thenReturn("sess-9");

        filter.doFilter(request, response, chain);

        assertThat(seen).containsEntry("requestId", "req-1")
                .containsEntry("sessionId", "sess-9")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/chat/text");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void generatesRequestIdWhenHeaderMissing() throws Exception {
        filter.doFilter(request, response, chain);

        assertThat(seen.get("requestId")).isNotBlank().hasSize(36);
        assertThat(seen).doesNotContainKey("sessionId");
    }
}
