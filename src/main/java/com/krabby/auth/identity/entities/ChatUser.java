package com.krabby.auth.identity.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.ToString;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code users} table in the database. Besides the account
 * details, each row holds the only access and refresh tokens that are currently valid for the
 * user.
 */
@Entity
@Table(name = "users")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @NonNull
    @Builder.Default
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @NonNull
    @Column(unique = true)
    private String email;

    @NonNull
    @ToString.Exclude
    @Column(name = "password")
    private String passwordHash;

    @NonNull
    private String fullName;

    @ToString.Exclude
    @Column(length = 1024)
    private String accessToken;

    @ToString.Exclude
    @Column(length = 1024)
    private String refreshToken;

    @NonNull
    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private UserStatus status = UserStatus.OFFLINE;

    @Column(name = "is_logged_out")
    private boolean loggedOut;

    @Builder.Default
    @Column(name = "is_active")
    private boolean active = true;

    private OffsetDateTime lastSeenAt;
}
