package tech.authcore.platform.authentication.mfa.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for mfa_challenge_tokens table.
 */
@Entity
@Table(name = "mfa_challenge_tokens", indexes = {
    @Index(name = "idx_mfa_challenge_tokens_expires_at", columnList = "expires_at")
})
public class MfaChallengeTokenEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "user_id", nullable = false, length = 64)
    public String userId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    public String tenantId;

    @Column(name = "encrypted_token", nullable = false, length = 1024)
    public String encryptedToken;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64)
    public String tokenHash;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "used", nullable = false)
    public boolean used;

    @Column(name = "used_at")
    public Instant usedAt;

    @Column(name = "issued_from_ip_address", length = 45)
    public String issuedFromIpAddress;

    @Column(name = "issued_from_user_agent", length = 500)
    public String issuedFromUserAgent;

    public MfaChallengeTokenEntity() {
    }
}
