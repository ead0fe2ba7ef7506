package com.holesforpoles.auth.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuthConfig")
class AuthConfigTest {

    @Test
    @DisplayName("a configured secret is used as-is")
    void usesConfiguredSecret() {
        assertThat(AuthConfig.resolveSecret("configured-secret"))
                .isEqualTo("configured-secret".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("a blank secret is replaced by a random url-safe string")
    void generatesSecretWhenBlank() {
        byte[] first = AuthConfig.resolveSecret("");
        byte[] second = AuthConfig.resolveSecret(null);

        assertThat(first).hasSize(43);
        assertThat(second).hasSize(43).isNotEqualTo(first);
        assertThat(new String(first, StandardCharsets.UTF_8)).matches("[A-Za-z0-9_-]+");
        assertThat(Base64.getUrlDecoder().decode(first)).hasSize(AuthConfig.GENERATED_SECRET_BYTES);
    }

    @Test
    @DisplayName("allowed origins are split on commas")
    void parsesOrigins() {
        assertThat(SecurityConfig.parseOrigins("https://a.example, https://b.example"))
                .containsExactly("https://a.example", "https://b.example");
        assertThat(SecurityConfig.parseOrigins("")).containsExactly("*");
    }
}
