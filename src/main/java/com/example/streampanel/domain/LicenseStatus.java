package com.example.streampanel.domain;

import java.util.Locale;

public enum LicenseStatus {

    ACTIVE,

    REVOKED;

    /**
     * Unknown values read as REVOKED so a bad row never admits a stream.
     */
    public static LicenseStatus fromStorage(String value) {
        if (value == null) {
            return REVOKED;
        }
        try {
            return LicenseStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return REVOKED;
        }
    }
}
