package tech.authcore.platform.shared;

/**
 * Entity types persisted by the token core, with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix:
 * - Format: "{prefix}_{tsid}" (e.g., "rtk_0HZXEQ5Y8JY5Z")
 * - Total length: 17 characters (3-char prefix + underscore + 13-char TSID)
 *
 * Usage:
 * <pre>
 * String id = TsidGenerator.generate(EntityType.REFRESH_TOKEN);  // "rtk_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    // Clients
    OAUTH_CLIENT("oac"),

    // Sealed tokens
    AUTH_CODE("acd"),
    REFRESH_TOKEN("rtk"),
    MFA_CHALLENGE("mfa"),

    // Access tokens (jti claim)
    ACCESS_TOKEN("atk", false);

    private final String prefix;
    private final boolean usePrefix;

    EntityType(String prefix) {
        this(prefix, true);
    }

    EntityType(String prefix, boolean usePrefix) {
        this.prefix = prefix;
        this.usePrefix = usePrefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Whether generated IDs carry the prefix. Access token ids are
     * emitted as bare TSIDs since they travel inside the token itself.
     */
    public boolean usePrefix() {
        return usePrefix;
    }
}
