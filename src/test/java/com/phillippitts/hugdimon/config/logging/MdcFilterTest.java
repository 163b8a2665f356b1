package com.phillippitts.hugdimon.config.logging;

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
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
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

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void extractsRequestIdFromHeader() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("test-request-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/chat");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get(MdcFilter.REQUEST_ID)).isEqualTo("test-request-123");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
    }

    @Test
    void generatesUuidIfRequestIdHeaderIsMissingOrBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn(null, "   ");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/chat");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get(MdcFilter.REQUEST_ID)).matches(UUID_PATTERN);
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
        filter.doFilter(request, response, chain);
    }

    @Test
    void setsConversationIdOnlyWhenHeaderPresent() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-1");
        when(request.getHeader("X-Conversation-ID")).thenReturn("conv-9", "  ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/chat/conv-9/history");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get(MdcFilter.CONVERSATION_ID)).isEqualTo("conv-9");
            return null;
        }).doAnswer(invocation -> {
            assertThat(ThreadContext.get(MdcFilter.CONVERSATION_ID)).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
        filter.doFilter(request, response, chain);
    }

    @Test
    void setsAllValuesInSingleRequest() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-xyz");
        when(request.getHeader("X-Conversation-ID")).thenReturn("conv-abc");
        when(request.getMethod()).thenReturn("DELETE");
        when(request.getRequestURI()).thenReturn("/chat/conv-abc");

        doAnswer(invocation -> {
            Map<String, String> contextMap = ThreadContext.getContext();
            assertThat(contextMap).containsEntry("requestId", "req-xyz");
            assertThat(contextMap).containsEntry("conversationId", "conv-abc");
            assertThat(contextMap).containsEntry("method", "DELETE");
            assertThat(contextMap).containsEntry("uri", "/chat/conv-abc");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/chat");

        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void clearsValuesAddedDownstream() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/chat");

        doAnswer(invocation -> {
            ThreadContext.put("turnStage", "GENERATED");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        assertThat(ThreadContext.get("turnStage")).isNull();
    }

    @Test
    void handlesNonHttpServletRequest() throws ServletException, IOException {
        ServletRequest nonHttpRequest = mock(ServletRequest.class);

        filter.doFilter(nonHttpRequest, response, chain);

        verify(chain).doFilter(nonHttpRequest, response);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }
}
