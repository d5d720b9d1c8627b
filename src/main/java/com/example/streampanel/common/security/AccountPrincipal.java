package com.example.streampanel.common.security;

import com.example.streampanel.domain.AccountRole;
import java.util.Collection;
import java.util.Collections;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * Authenticated caller of a request: the account behind a live session and the token
 * that session is keyed by.
 */
public class AccountPrincipal {

    private final Long accountId;
    private final String username;
    private final AccountRole role;
    private final String token;

    public AccountPrincipal(Long accountId, String username, AccountRole role, String token) {
        this.accountId = accountId;
        this.username = username;
        this.role = role;
        this.token = token;
    }

    public Long getAccountId() {
        return accountId;
    }

    public String getUsername() {
        return username;
    }

    public AccountRole getRole() {
        return role;
    }

    public String getToken() {
        return token;
    }

    public boolean isAdmin() {
        return role == AccountRole.ADMIN;
    }

    public Collection<? extends GrantedAuthority> getAuthorities() {
        return Collections.singletonList(new SimpleGrantedAuthority("ROLE_" + role.name()));
    }

    @Override
    public String toString() {
        return username;
    }
}
