package tech.authcore.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for persisted tokens and clients.
 *
 * IDs are time-sortable 64-bit values rendered as 13-character Crockford
 * strings, prefixed with the entity type: "{prefix}_{tsid}"
 * (e.g., "acd_0HZXEQ5Y8JY5Z").
 *
 * Row ids are not secrets. Token plaintexts are generated separately
 * from {@link java.security.SecureRandom}.
 */
public final class TsidGenerator {

    /**
     * Separator between prefix and TSID.
     */
    public static final String SEPARATOR = "_";

    /**
     * Generate a new ID for the given entity type.
     *
     * @param type the entity type
     * @return the ID (with or without prefix depending on entity type)
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        String tsid = TsidCreator.getTsid().toString();
        return type.usePrefix() ? type.prefix() + SEPARATOR + tsid : tsid;
    }

    private TsidGenerator() {
        // Utility class
    }
}
