package com.example.streampanel.common.security;

import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.common.exception.ErrorCode;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtil {

    private SecurityUtil() {
    }

    public static AccountPrincipal currentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AccountPrincipal) {
            return (AccountPrincipal) authentication.getPrincipal();
        }
        throw new BusinessException(ErrorCode.AUTH_MISSING_TOKEN, "Authentication required", "Please log in");
    }

    public static Long getCurrentAccountId() {
        return currentPrincipal().getAccountId();
    }
}
