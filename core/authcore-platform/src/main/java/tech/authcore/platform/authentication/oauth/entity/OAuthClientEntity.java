package tech.authcore.platform.authentication.oauth.entity;

import jakarta.persistence.*;
import tech.authcore.platform.authentication.oauth.OAuthClient.ClientType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA Entity for OAuth clients.
 */
@Entity
@Table(name = "oauth_clients")
public class OAuthClientEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "client_id", nullable = false, unique = true, length = 200)
    public String clientId;

    @Column(name = "name", nullable = false, length = 200)
    public String name;

    @Column(name = "description", length = 1000)
    public String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "client_type", nullable = false, length = 20)
    public ClientType clientType;

    @Column(name = "client_secret_hash", length = 500)
    public String clientSecretHash;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "oauth_client_redirect_uris", joinColumns = @JoinColumn(name = "oauth_client_id"))
    @Column(name = "redirect_uri", length = 2000)
    public List<String> redirectUris = new ArrayList<>();

    @Column(name = "active", nullable = false)
    public boolean active = true;

    @Column(name = "tenant_id", length = 64)
    public String tenantId;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at")
    public Instant updatedAt;

    public OAuthClientEntity() {
    }
}
