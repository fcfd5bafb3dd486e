package org.example.helpdesk.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Logs every request and exposes request id, method and path in the MDC while it is handled.
 */
@Slf4j
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    static final String REQUEST_ID = "request_id";
    static final String HTTP_METHOD = "http_method";
    static final String HTTP_PATH = "http_path";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        MDC.put(REQUEST_ID, resolveRequestId(request));
        MDC.put(HTTP_METHOD, request.getMethod());
        MDC.put(HTTP_PATH, request.getRequestURI());
        log.info("{} {}", request.getMethod(), request.getRequestURI());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
                                @Nullable Exception ex) {
        log.debug("{} {} -> {}", request.getMethod(), request.getRequestURI(), response.getStatus());
        MDC.remove(REQUEST_ID);
        MDC.remove(HTTP_METHOD);
        MDC.remove(HTTP_PATH);
    }

    private String resolveRequestId(HttpServletRequest request) {
        String requestId = request.getHeader("X-Request-Id");
        if (requestId != null && !requestId.isBlank()) {
            return requestId;
        }
        return UUID.randomUUID().toString();
    }
}
