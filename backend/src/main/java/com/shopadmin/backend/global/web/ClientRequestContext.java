package com.shopadmin.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.util.StringUtils;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Request metadata copied into audit entries. All fields are nullable and are cut to the widths of
 * the audit columns, since every one of them is caller-controlled.
 */
public record ClientRequestContext(String clientIp, String userAgent, String requestId) {

    public static final int MAX_CLIENT_IP_LENGTH = 64;
    public static final int MAX_USER_AGENT_LENGTH = 500;
    public static final int MAX_REQUEST_ID_LENGTH = 128;

    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final ClientRequestContext EMPTY = new ClientRequestContext(null, null, null);

    public ClientRequestContext {
        clientIp = truncate(clientIp, MAX_CLIENT_IP_LENGTH);
        userAgent = truncate(userAgent, MAX_USER_AGENT_LENGTH);
        requestId = truncate(requestId, MAX_REQUEST_ID_LENGTH);
    }

    public static ClientRequestContext empty() {
        return EMPTY;
    }

    public static ClientRequestContext from(HttpServletRequest request) {
        if (request == null) {
            return EMPTY;
        }
        Object requestId = request.getAttribute(RequestIdFilter.REQUEST_ID_ATTRIBUTE);
        return new ClientRequestContext(
                resolveClientIp(request),
                request.getHeader("User-Agent"),
                requestId != null ? requestId.toString() : null
        );
    }

    /**
     * Context of the request bound to the current thread, or {@link #empty()} outside a web request.
     */
    public static ClientRequestContext current() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes servletAttributes) {
            return from(servletAttributes.getRequest());
        }
        return EMPTY;
    }

    private static String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwarded)) {
            int comma = forwarded.indexOf(',');
            return (comma >= 0 ? forwarded.substring(0, comma) : forwarded).trim();
        }
        return request.getRemoteAddr();
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
