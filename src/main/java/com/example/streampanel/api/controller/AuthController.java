package com.example.streampanel.api.controller;

import com.example.streampanel.api.request.AuthLoginRequest;
import com.example.streampanel.api.response.AccountProfileResponse;
import com.example.streampanel.api.response.ApiResponse;
import com.example.streampanel.api.response.AuthTokenResponse;
import com.example.streampanel.application.service.AuthTokenService;
import com.example.streampanel.common.logging.AccessLogFilter;
import com.example.streampanel.common.security.SecurityUtil;
import com.example.streampanel.domain.model.ClientMeta;
import com.example.streampanel.infrastructure.security.RequestTokenResolver;
import javax.servlet.http.HttpServletRequest;
import javax.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AuthTokenService authTokenService;
    private final RequestTokenResolver tokenResolver;

    public AuthController(AuthTokenService authTokenService, RequestTokenResolver tokenResolver) {
        this.authTokenService = authTokenService;
        this.tokenResolver = tokenResolver;
    }

    @PostMapping("/login")
    public ApiResponse<AuthTokenResponse> login(@Valid @RequestBody AuthLoginRequest request,
                                                HttpServletRequest servletRequest) {
        ClientMeta origin = new ClientMeta(AccessLogFilter.resolveClientIp(servletRequest),
                servletRequest.getHeader(HttpHeaders.USER_AGENT));
        return ApiResponse.success(authTokenService.login(request.getUsername(), request.getPassword(), origin));
    }

    @PostMapping("/logout")
    public ApiResponse<String> logout(HttpServletRequest servletRequest) {
        authTokenService.logout(tokenResolver.resolve(servletRequest));
        return ApiResponse.success("OK");
    }

    @GetMapping("/me")
    public ApiResponse<AccountProfileResponse> me() {
        return ApiResponse.success(authTokenService.profile(SecurityUtil.getCurrentAccountId()));
    }
}
