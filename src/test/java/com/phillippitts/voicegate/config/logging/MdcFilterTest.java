package com.phillippitts.voicegate.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.matches;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

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
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/providers/health");
        doAnswer(invocation -> {
            seen.putAll(ThreadContext.getContext());
            return null;
        }).when(chain).doFilter(any(), any());
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void populatesOrchestratorKeysAndEchoesRequestId() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-xyz");
        when(request.getHeader(MdcFilter.TENANT_ID_HEADER)).thenReturn("acme");

        filter.doFilter(request, response, chain);

        assertThat(seen).containsEntry("requestId", "req-xyz")
                .containsEntry("tenantId", "acme")
                .containsEntry("operation", "GET /providers/health");
        verify(response).setHeader(MdcFilter.REQUEST_ID_HEADER, "req-xyz");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void generatesUuidWhenHeaderIsMissing() throws ServletException, IOException {
        filter.doFilter(request, response, chain);

        assertThat(seen.get("requestId")).matches(UUID_PATTERN);
        assertThat(seen).doesNotContainKey("tenantId");
        verify(response).setHeader(eq(MdcFilter.REQUEST_ID_HEADER), matches(UUID_PATTERN));
    }

    @Test
    void stripsUnsafeCharactersFromCallerIds() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("abc\r\nFAKE LOG LINE");
        when(request.getHeader(MdcFilter.TENANT_ID_HEADER)).thenReturn("\n\t ");

        filter.doFilter(request, response, chain);

        assertThat(seen).containsEntry("requestId", "abcFAKELOGLINE");
        assertThat(seen).doesNotContainKey("tenantId");
    }

    @Test
    void capsIdLength() {
        assertThat(MdcFilter.cleanId("x".repeat(200))).hasSize(MdcFilter.MAX_ID_LENGTH);
        assertThat(MdcFilter.cleanId("!!!")).isNull();
        assertThat(MdcFilter.cleanId(null)).isNull();
    }

    @Test
    void keepsUnrelatedContextAndRemovesOwnKeysWhenChainThrows() throws ServletException, IOException {
        ThreadContext.put("worker", "w-1");
        doThrow(new ServletException("boom")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("boom");

        assertThat(ThreadContext.getContext()).containsOnlyKeys("worker");
    }

    @Test
    void passesNonHttpRequestsThrough() throws ServletException, IOException {
        ServletRequest nonHttpRequest = mock(ServletRequest.class);

        filter.doFilter(nonHttpRequest, response, chain);

        verify(chain).doFilter(nonHttpRequest, response);
        assertThat(seen).isEmpty();
    }
}
