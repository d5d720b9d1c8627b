package com.example.streampanel.api.request;

import lombok.Data;

@Data
public class LicenseValidateRequest {

    /**
     * Optional when the key is sent in the license header instead.
     */
    private String licenseKey;
}
