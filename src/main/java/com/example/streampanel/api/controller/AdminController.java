package com.example.streampanel.api.controller;

import com.example.streampanel.api.response.ApiResponse;
import com.example.streampanel.api.response.StreamSessionResponse;
import com.example.streampanel.application.service.AuthTokenService;
import com.example.streampanel.application.service.StreamSessionService;
import com.example.streampanel.common.security.SecurityUtil;
import java.util.Collections;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator actions. Access is limited to ADMIN accounts by the security filter chain.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final AuthTokenService authTokenService;
    private final StreamSessionService streamSessionService;

    public AdminController(AuthTokenService authTokenService, StreamSessionService streamSessionService) {
        this.authTokenService = authTokenService;
        this.streamSessionService = streamSessionService;
    }

    @PostMapping("/accounts/{id}/sessions/revoke")
    public ApiResponse<Map<String, Integer>> revokeSessions(@PathVariable("id") Long accountId) {
        int removed = authTokenService.revokeAllSessions(accountId);
        log.info("ADMIN_REVOKE_SESSIONS actor={} accountId={} removed={}",
                SecurityUtil.getCurrentAccountId(), accountId, removed);
        return ApiResponse.success(Collections.singletonMap("revoked", removed));
    }

    @PostMapping("/streams/{logId}/stop")
    public ApiResponse<StreamSessionResponse> forceStop(@PathVariable("logId") Long logId) {
        log.info("ADMIN_FORCE_STOP actor={} logId={}", SecurityUtil.getCurrentAccountId(), logId);
        return ApiResponse.success(streamSessionService.forceStop(logId));
    }
}
