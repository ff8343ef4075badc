package com.kitchensync.backend.auth.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * 裝置登入後拿到的 Bearer token。
 * sync 端只需要 userId，所以不掛 User 關聯，避免 filter 觸發 lazy load。
 */
@Data
@Entity
@Table(name = "auth_tokens")
public class AuthToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String token;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TokenType type = TokenType.ACCESS;

    @Column(nullable = false)
    private Instant expiresAt;

    @Column(nullable = false)
    private Instant createdAt = Instant.now();

    @Column(nullable = false)
    private boolean revoked = false;

    /** 發 token 的裝置；同一帳號多台裝置各自一筆 */
    @Column(length = 128)
    private String deviceId;

    public enum TokenType { ACCESS, REFRESH }
}
