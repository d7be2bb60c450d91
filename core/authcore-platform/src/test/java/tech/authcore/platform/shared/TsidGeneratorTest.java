package tech.authcore.platform.shared;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TsidGeneratorTest {

    @Test
    @DisplayName("generate should prefix ids of persisted entities")
    void generate_shouldPrefixId_whenEntityUsesPrefix() {
        String id = TsidGenerator.generate(EntityType.REFRESH_TOKEN);

        assertThat(id).startsWith("rtk_").hasSize(17);
        assertThat(id.substring(4)).hasSize(13).doesNotContain(TsidGenerator.SEPARATOR);
    }

    @Test
    @DisplayName("generate should emit bare TSIDs for access token ids")
    void generate_shouldOmitPrefix_whenAccessToken() {
        assertThat(TsidGenerator.generate(EntityType.ACCESS_TOKEN)).hasSize(13);
    }

    @Test
    @DisplayName("generate should produce unique ids")
    void generate_shouldBeUnique() {
        assertThat(TsidGenerator.generate(EntityType.AUTH_CODE))
            .isNotEqualTo(TsidGenerator.generate(EntityType.AUTH_CODE));
    }

    @Test
    @DisplayName("generate should use the prefix of each persisted entity type")
    void generate_shouldUseEntityPrefix() {
        assertThat(TsidGenerator.generate(EntityType.AUTH_CODE)).startsWith("acd_");
        assertThat(TsidGenerator.generate(EntityType.MFA_CHALLENGE)).startsWith("mfa_");
        assertThat(TsidGenerator.generate(EntityType.OAUTH_CLIENT)).startsWith("oac_");
    }
}
