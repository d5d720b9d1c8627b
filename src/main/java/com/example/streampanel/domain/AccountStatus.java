package com.example.streampanel.domain;

import java.util.Locale;

public enum AccountStatus {

    ACTIVE,

    SUSPENDED,

    BANNED;

    public static AccountStatus fromStorage(String value) {
        if (value == null) {
            return SUSPENDED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return SUSPENDED;
        }
    }
}
