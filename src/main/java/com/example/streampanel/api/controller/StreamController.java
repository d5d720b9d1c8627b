package com.example.streampanel.api.controller;

import com.example.streampanel.api.request.StreamStopRequest;
import com.example.streampanel.api.response.ApiResponse;
import com.example.streampanel.api.response.PageResponse;
import com.example.streampanel.api.response.StreamSessionResponse;
import com.example.streampanel.api.response.StreamStartResponse;
import com.example.streampanel.api.response.UsageStatsResponse;
import com.example.streampanel.application.service.StreamSessionService;
import com.example.streampanel.common.config.AppLicenseProperties;
import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.common.exception.ErrorCode;
import com.example.streampanel.common.logging.AccessLogFilter;
import com.example.streampanel.common.security.AccountPrincipal;
import com.example.streampanel.common.security.SecurityUtil;
import com.example.streampanel.domain.model.ClientMeta;
import java.util.List;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/streams")
public class StreamController {

    private final StreamSessionService streamSessionService;
    private final AppLicenseProperties licenseProperties;

    public StreamController(StreamSessionService streamSessionService, AppLicenseProperties licenseProperties) {
        this.streamSessionService = streamSessionService;
        this.licenseProperties = licenseProperties;
    }

    @GetMapping("/{id}/play")
    public ApiResponse<StreamStartResponse> play(@PathVariable("id") Long channelId, HttpServletRequest request) {
        ClientMeta origin = new ClientMeta(AccessLogFilter.resolveClientIp(request),
                request.getHeader(HttpHeaders.USER_AGENT));
        String licenseKey = request.getHeader(licenseProperties.getHeaderName());
        if (!StringUtils.hasText(licenseKey)) {
            licenseKey = request.getParameter(licenseProperties.getQueryParam());
        }
        return ApiResponse.success(
                streamSessionService.start(SecurityUtil.currentPrincipal(), channelId, origin, licenseKey));
    }

    @GetMapping("/{id}/proxy")
    public void proxy(@PathVariable("id") Long channelId,
                      @RequestParam("log_id") Long logId,
                      @RequestHeader(value = HttpHeaders.RANGE, required = false) String range,
                      @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
                      HttpServletResponse response) {
        streamSessionService.relay(SecurityUtil.currentPrincipal(), channelId, logId, range, userAgent, response);
    }

    @PostMapping("/{id}/stop")
    public ApiResponse<StreamSessionResponse> stop(@PathVariable("id") Long channelId,
                                                   @RequestParam(value = "log_id", required = false) Long logIdParam,
                                                   @RequestBody(required = false) StreamStopRequest body) {
        Long logId = body != null && body.getLogId() != null ? body.getLogId() : logIdParam;
        if (logId == null) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "logId is required");
        }
        AccountPrincipal principal = SecurityUtil.currentPrincipal();
        return ApiResponse.success(streamSessionService.stop(principal, logId));
    }

    @GetMapping("/active")
    public ApiResponse<List<StreamSessionResponse>> active() {
        return ApiResponse.success(streamSessionService.listActive(SecurityUtil.getCurrentAccountId()));
    }

    @GetMapping("/history")
    public ApiResponse<PageResponse<StreamSessionResponse>> history(
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return ApiResponse.success(streamSessionService.history(SecurityUtil.getCurrentAccountId(), page, limit));
    }

    @GetMapping("/stats")
    public ApiResponse<UsageStatsResponse> stats(@RequestParam(value = "period", required = false) String period) {
        return ApiResponse.success(streamSessionService.stats(SecurityUtil.getCurrentAccountId(), period));
    }
}
