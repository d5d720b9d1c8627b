package com.example.streampanel.infrastructure.security;

import com.example.streampanel.api.response.ApiResponse;
import com.example.streampanel.application.service.AuthTokenService;
import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.common.exception.ErrorCode;
import com.example.streampanel.common.security.AccountPrincipal;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates every protected request from its session token. Media players that
 * cannot set headers pass the token as a cookie or query parameter instead.
 */
public class TokenAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthFilter.class);

    private final RequestTokenResolver tokenResolver;
    private final AuthTokenService authTokenService;
    private final ObjectMapper objectMapper;

    public TokenAuthFilter(RequestTokenResolver tokenResolver, AuthTokenService authTokenService) {
        this.tokenResolver = tokenResolver;
        this.authTokenService = authTokenService;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri.startsWith("/actuator/health")
                || uri.startsWith("/actuator/info")
                || uri.startsWith("/v3/api-docs")
                || uri.startsWith("/swagger-ui")
                || uri.startsWith("/favicon.ico")
                || uri.startsWith("/error")
                || uri.equals("/api/v1/auth/login")
                || uri.equals("/api/v1/auth/logout");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String token = tokenResolver.resolve(request);
        if (token == null) {
            unauthorized(response, ErrorCode.AUTH_MISSING_TOKEN, "Access denied. No token provided.", "Please log in");
            return;
        }

        AccountPrincipal principal;
        try {
            principal = authTokenService.authenticate(token);
        } catch (BusinessException e) {
            log.debug("AUTH_REJECTED code={} uri={}", e.getCode(), request.getRequestURI());
            unauthorized(response, e.getErrorCode(), e.getMessage(), e.getUserAction());
            return;
        }

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities());
        SecurityContextHolder.getContext().setAuthentication(authentication);
        filterChain.doFilter(request, response);
    }

    private void unauthorized(HttpServletResponse response,
                              ErrorCode code,
                              String message,
                              String userAction) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType("application/json;charset=UTF-8");
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, buildWwwAuthenticateValue(code));
        ApiResponse<Void> body = ApiResponse.fail(code, message, userAction);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private String buildWwwAuthenticateValue(ErrorCode code) {
        if (code == ErrorCode.AUTH_MISSING_TOKEN) {
            return "Bearer error=\"invalid_request\", error_description=\"missing bearer token\"";
        }
        return "Bearer error=\"invalid_token\", error_description=\"" + describe(code) + "\"";
    }

    private String describe(ErrorCode code) {
        switch (code) {
            case AUTH_TOKEN_EXPIRED:
                return "access token expired";
            case AUTH_SESSION_INVALID:
                return "session revoked or expired";
            case AUTH_ACCOUNT_SUSPENDED:
                return "account suspended";
            case AUTH_ACCOUNT_EXPIRED:
                return "account expired";
            default:
                return "access token invalid";
        }
    }
}
