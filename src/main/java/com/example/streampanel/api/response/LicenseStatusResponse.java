package com.example.streampanel.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LicenseStatusResponse {

    private String licenseKey;
    private String customerName;
    private String planType;
    private String status;
    private Integer maxConnections;
    private Integer currentConnections;
    private LocalDateTime expiresAt;
    private LocalDateTime lastUsed;
}
