package com.example.streampanel.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.license")
public class AppLicenseProperties {

    /**
     * When true, starting a stream without a license key is rejected.
     */
    private boolean requiredForStreams = false;

    private String headerName = "X-License-Key";

    private String queryParam = "license";
}
