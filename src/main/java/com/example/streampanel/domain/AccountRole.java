package com.example.streampanel.domain;

import java.util.Locale;

public enum AccountRole {

    ADMIN,

    RESELLER,

    USER;

    /**
     * Stored values are lower-case ({@code admin}, {@code reseller}, {@code user});
     * unknown values fall back to the least privileged role.
     */
    public static AccountRole fromStorage(String value) {
        if (value == null) {
            return USER;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return USER;
        }
    }
}
