package com.moddock.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Platform user as seen by the moderation subsystem.
 * Account management lives elsewhere; this side only reads users to resolve
 * credentials and to check roles.
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_external", columnList = "external_id", unique = true)
})
public class User {

    @Id
    private Long id;

    @NotNull
    @Column(name = "external_id", nullable = false, unique = true)
    private String externalId;

    @NotNull
    @Column(nullable = false, length = 64)
    private String username;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Role role;

    @Column(nullable = false, updatable = false)
    private Instant created;

    protected User() {}

    public static User create(long id, String externalId, String username, Role role, Instant created) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("External ID is required");
        }
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        User user = new User();
        user.id = id;
        user.externalId = externalId;
        user.username = username;
        user.role = role == null ? Role.DEVELOPER : role;
        user.created = created;
        return user;
    }

    public boolean isModerator() {
        return role.isModerator();
    }

    // Getters
    public Long getId() { return id; }
    public String getExternalId() { return externalId; }
    public String getUsername() { return username; }
    public Role getRole() { return role; }
    public Instant getCreated() { return created; }

    public enum Role {
        DEVELOPER,
        MODERATOR,
        ADMIN;

        public boolean isModerator() {
            return this == MODERATOR || this == ADMIN;
        }
    }
}
