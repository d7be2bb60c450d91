package tech.authcore.platform.authentication.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for authorization_codes table.
 */
@Entity
@Table(name = "authorization_codes", indexes = {
    @Index(name = "idx_authorization_codes_expires_at", columnList = "expires_at")
})
public class AuthorizationCodeEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "code_hash", nullable = false, unique = true, length = 64)
    public String codeHash;

    @Column(name = "encrypted_code", nullable = false, length = 512)
    public String encryptedCode;

    @Column(name = "user_id", nullable = false, length = 64)
    public String userId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    public String tenantId;

    @Column(name = "client_id", nullable = false, length = 200)
    public String clientId;

    @Column(name = "redirect_uri", nullable = false, length = 2000)
    public String redirectUri;

    @Column(name = "scope", length = 1000)
    public String scope;

    @Column(name = "state", length = 256)
    public String state;

    @Column(name = "code_challenge", length = 128)
    public String codeChallenge;

    @Column(name = "code_challenge_method", length = 10)
    public String codeChallengeMethod;

    @Column(name = "issued_from_ip_address", length = 45)
    public String issuedFromIpAddress;

    @Column(name = "issued_from_user_agent", length = 500)
    public String issuedFromUserAgent;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "used", nullable = false)
    public boolean used;

    @Column(name = "used_at")
    public Instant usedAt;

    public AuthorizationCodeEntity() {
    }
}
