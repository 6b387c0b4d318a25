package com.phillippitts.attendancekiosk.config.logging;

import com.phillippitts.attendancekiosk.config.properties.AttendanceProperties;
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
        AttendanceProperties attendance = new AttendanceProperties();
        attendance.setDeviceId("kiosk-gate-3");
        filter = new MdcFilter(attendance);
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
    void setsAllValuesInSingleRequest() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-xyz");
        when(request.getHeader("X-Operator-ID")).thenReturn("admin-7");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/events/failed");

        doAnswer(invocation -> {
            Map<String, String> contextMap = ThreadContext.getContext();
            assertThat(contextMap)
                    .containsEntry("requestId", "req-xyz")
                    .containsEntry("operatorId", "admin-7")
                    .containsEntry("deviceId", "kiosk-gate-3")
                    .containsEntry("method", "GET")
                    .containsEntry("uri", "/events/failed");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
    }

    @Test
    void generatesUuidIfNoRequestIdHeader() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn(null);
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/status");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).matches(UUID_PATTERN);
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void generatesUuidIfRequestIdHeaderIsBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("   ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/status");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).matches(UUID_PATTERN);
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void doesNotSetOperatorIdIfHeaderIsBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getHeader("X-Operator-ID")).thenReturn("  ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/status");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("operatorId")).isNull();
            assertThat(ThreadContext.get("deviceId")).isEqualTo("kiosk-gate-3");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-123");
        when(request.getHeader("X-Operator-ID")).thenReturn("admin-7");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/status");
        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void handlesNonHttpServletRequest() throws ServletException, IOException {
        ServletRequest nonHttpRequest = mock(ServletRequest.class);

        filter.doFilter(nonHttpRequest, response, chain);

        verify(chain).doFilter(nonHttpRequest, response);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void preventsMdcLeakageBetweenRequests() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-1");
        when(request.getHeader("X-Operator-ID")).thenReturn("admin-1");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/status");
        filter.doFilter(request, response, chain);

        when(request.getHeader("X-Request-ID")).thenReturn("req-2");
        when(request.getHeader("X-Operator-ID")).thenReturn(null);
        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("req-2");
            assertThat(ThreadContext.get("operatorId")).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }
}
