package com.example.streampanel.common.logging;

import com.example.streampanel.common.security.AccountPrincipal;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Assigns a request id, exposes request coordinates through the MDC and writes one
 * access line per request. Relay requests can last hours, so the line carries the
 * full cost of the stream and the account that held it.
 */
public class AccessLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessLogFilter.class);

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_CLIENT_IP = "clientIp";

    /** Caller-supplied ids end up in every log line of the request. */
    private static final Pattern ACCEPTED_REQUEST_ID = Pattern.compile("[A-Za-z0-9_-]{8,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();
        String requestId = resolveRequestId(request);
        String clientIp = resolveClientIp(request);

        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_CLIENT_IP, clientIp);
        try {
            filterChain.doFilter(request, response);
        } finally {
            long cost = System.currentTimeMillis() - start;
            int status = response.getStatus();
            Long accountId = currentAccountId();
            if (status >= 500) {
                log.warn("HTTP_ACCESS method={} uri={} status={} costMs={} ip={} accountId={}",
                        request.getMethod(), request.getRequestURI(), status, cost, clientIp, accountId);
            } else {
                log.info("HTTP_ACCESS method={} uri={} status={} costMs={} ip={} accountId={}",
                        request.getMethod(), request.getRequestURI(), status, cost, clientIp, accountId);
            }
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_CLIENT_IP);
        }
    }

    static String resolveRequestId(HttpServletRequest request) {
        String supplied = request.getHeader(HEADER_REQUEST_ID);
        if (supplied != null && ACCEPTED_REQUEST_ID.matcher(supplied.trim()).matches()) {
            return supplied.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String resolveClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.trim().isEmpty()) {
            int commaIndex = xForwardedFor.indexOf(',');
            return commaIndex > 0 ? xForwardedFor.substring(0, commaIndex).trim() : xForwardedFor.trim();
        }
        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.trim().isEmpty()) {
            return xRealIp.trim();
        }
        return request.getRemoteAddr();
    }

    private static Long currentAccountId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AccountPrincipal) {
            return ((AccountPrincipal) authentication.getPrincipal()).getAccountId();
        }
        return null;
    }
}
