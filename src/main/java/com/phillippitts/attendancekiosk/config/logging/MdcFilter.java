package com.phillippitts.attendancekiosk.config.logging;

import com.phillippitts.attendancekiosk.config.properties.AttendanceProperties;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID</li>
 *   <li>operatorId: from X-Operator-ID header (if present), set by the admin console</li>
 *   <li>deviceId: id of this kiosk</li>
 *   <li>method and uri of the request</li>
 * </ul>
 *
 * <p>The context is always cleared after the request to avoid leakage across threads.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String OPERATOR_ID_HEADER = "X-Operator-ID";

    private final String deviceId;

    public MdcFilter(AttendanceProperties attendanceProperties) {
        this.deviceId = attendanceProperties.getDeviceId();
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                ThreadContext.put("requestId", headerOrGenerate(http, REQUEST_ID_HEADER));

                String operatorId = http.getHeader(OPERATOR_ID_HEADER);
                if (operatorId != null && !operatorId.isBlank()) {
                    ThreadContext.put("operatorId", operatorId);
                }

                ThreadContext.put("deviceId", deviceId);
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
