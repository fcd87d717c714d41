package com.example.bugservice.security;

import lombok.Getter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.UUID;

/**
 * Authenticated principal built from a verified JWT.
 * Bugs, votes and comments reference users by id only; there is no local user table.
 */
@Getter
public class CurrentUser implements UserDetails {

    private static final String ADMIN_AUTHORITY = "ROLE_ADMIN";

    private final UUID userId;
    private final Collection<? extends GrantedAuthority> authorities;

    public CurrentUser(UUID userId, Collection<? extends GrantedAuthority> authorities) {
        this.userId = userId;
        this.authorities = authorities;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return authorities;
    }

    @Override
    public String getPassword() {
        return null;
    }

    @Override
    public String getUsername() {
        return userId.toString();
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return true;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    /**
     * Platform administrator; may act for any company.
     */
    public boolean isAdmin() {
        return authorities.stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(ADMIN_AUTHORITY::equals);
    }
}
