package com.example.streampanel.api.controller;

import com.example.streampanel.api.request.LicenseValidateRequest;
import com.example.streampanel.api.response.ApiResponse;
import com.example.streampanel.api.response.LicenseStatusResponse;
import com.example.streampanel.application.service.LicenseQuotaService;
import com.example.streampanel.common.config.AppLicenseProperties;
import javax.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/licenses")
public class LicenseController {

    private final LicenseQuotaService licenseQuotaService;
    private final AppLicenseProperties licenseProperties;

    public LicenseController(LicenseQuotaService licenseQuotaService, AppLicenseProperties licenseProperties) {
        this.licenseQuotaService = licenseQuotaService;
        this.licenseProperties = licenseProperties;
    }

    @PostMapping("/validate")
    public ApiResponse<LicenseStatusResponse> validate(@RequestBody(required = false) LicenseValidateRequest body,
                                                       HttpServletRequest request) {
        String key = body == null ? null : body.getLicenseKey();
        if (!StringUtils.hasText(key)) {
            key = request.getHeader(licenseProperties.getHeaderName());
        }
        return ApiResponse.success(licenseQuotaService.validate(key));
    }

    @PostMapping("/{key}/disconnect")
    public ApiResponse<LicenseStatusResponse> disconnect(@PathVariable("key") String key) {
        return ApiResponse.success(licenseQuotaService.disconnect(key));
    }

    @GetMapping("/{key}")
    public ApiResponse<LicenseStatusResponse> info(@PathVariable("key") String key) {
        return ApiResponse.success(licenseQuotaService.info(key));
    }

    @PostMapping("/{key}/reset")
    public ApiResponse<LicenseStatusResponse> reset(@PathVariable("key") String key) {
        return ApiResponse.success(licenseQuotaService.reset(key));
    }

    @PostMapping("/{key}/revoke")
    public ApiResponse<LicenseStatusResponse> revoke(@PathVariable("key") String key) {
        return ApiResponse.success(licenseQuotaService.revoke(key));
    }
}
