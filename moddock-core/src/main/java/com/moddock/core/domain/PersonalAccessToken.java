package com.moddock.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Personal access token (PAT).
 * A long-lived bearer credential a user issues for API access without the
 * identity provider's session cookie. The secret is a random 63-bit value,
 * handed to clients in base62 form.
 *
 * Expiry is a soft revoke: expired tokens stay stored and listable until
 * their owner deletes them, but never authenticate.
 */
@Entity
@Table(name = "pats", indexes = {
    @Index(name = "idx_pats_user", columnList = "user_id"),
    @Index(name = "idx_pats_token", columnList = "access_token", unique = true)
})
public class PersonalAccessToken {

    @Id
    private Long id;

    @NotNull
    @Column(name = "access_token", nullable = false, unique = true)
    private Long accessToken;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @NotNull
    @Column(nullable = false, columnDefinition = "TEXT")
    private String scope;

    @NotNull
    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected PersonalAccessToken() {}

    public static PersonalAccessToken issue(long id, long accessToken, long userId, String scope, Instant expiresAt) {
        if (scope == null) {
            throw new IllegalArgumentException("Scope is required");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiration is required");
        }
        PersonalAccessToken token = new PersonalAccessToken();
        token.id = id;
        token.accessToken = accessToken;
        token.userId = userId;
        token.scope = scope;
        token.expiresAt = expiresAt;
        return token;
    }

    public void changeScope(String scope) {
        if (scope == null) {
            throw new IllegalArgumentException("Scope is required");
        }
        this.scope = scope;
    }

    public void changeExpiry(Instant expiresAt) {
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiration is required");
        }
        this.expiresAt = expiresAt;
    }

    public boolean isExpired(Instant now) {
        return expiresAt.isBefore(now);
    }

    public boolean isOwnedBy(long userId) {
        return this.userId == userId;
    }

    // Getters
    public Long getId() { return id; }
    public Long getAccessToken() { return accessToken; }
    public Long getUserId() { return userId; }
    public String getScope() { return scope; }
    public Instant getExpiresAt() { return expiresAt; }
}
