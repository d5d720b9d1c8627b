package com.example.streampanel.infrastructure.security;

import com.example.streampanel.common.config.AppAuthProperties;
import javax.servlet.http.Cookie;
import javax.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Finds the session token on a request: Authorization header, then the token cookie,
 * then the token query parameter.
 */
@Component
public class RequestTokenResolver {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AppAuthProperties properties;

    public RequestTokenResolver(AppAuthProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the token, or null when none of the three places carries one
     */
    public String resolve(HttpServletRequest request) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String value = authHeader.substring(BEARER_PREFIX.length()).trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (properties.getTokenCookieName().equals(cookie.getName())
                        && cookie.getValue() != null && !cookie.getValue().trim().isEmpty()) {
                    return cookie.getValue().trim();
                }
            }
        }
        String queryToken = request.getParameter(properties.getTokenQueryParam());
        if (queryToken != null && !queryToken.trim().isEmpty()) {
            return queryToken.trim();
        }
        return null;
    }
}
