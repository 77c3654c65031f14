package com.products.lookup.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialBundleTest {

    @Test
    @DisplayName("API token is preferred when login credentials are present too")
    void prefersToken() {
        CredentialBundle bundle = CredentialBundle.of("tok-123", "alice", "secret", 600);

        assertThat(bundle.getMethod()).isEqualTo(AuthMethod.API_TOKEN);
        assertThat(bundle.hasToken()).isTrue();
        assertThat(bundle.hasLogin()).isTrue();
        assertThat(bundle.getSessionTimeoutSeconds()).isEqualTo(600);
    }

    @Test
    @DisplayName("template placeholders count as absent")
    void placeholdersIgnored() {
        CredentialBundle bundle = CredentialBundle.of(
                "your_api_token_here", "your_openfoodfacts_username", "your_openfoodfacts_password", null);

        assertThat(bundle.getMethod()).isEqualTo(AuthMethod.NONE);
        assertThat(bundle.hasToken()).isFalse();
        assertThat(bundle.hasLogin()).isFalse();
    }

    @Test
    @DisplayName("a placeholder token falls back to real login credentials")
    void placeholderTokenFallsBackToLogin() {
        CredentialBundle bundle = CredentialBundle.of("your_api_token_here", "alice", "secret", null);

        assertThat(bundle.getMethod()).isEqualTo(AuthMethod.LOGIN_PASSWORD);
        assertThat(bundle.getSessionTimeoutSeconds()).isEqualTo(CredentialBundle.DEFAULT_SESSION_TIMEOUT_SECONDS);
    }

    @Test
    @DisplayName("username without password is not a usable login")
    void halfLoginIsNone() {
        assertThat(CredentialBundle.ofLogin("alice", "  ", null).getMethod()).isEqualTo(AuthMethod.NONE);
    }

    @Test
    @DisplayName("secrets never appear in toString")
    void secretsHidden() {
        String text = CredentialBundle.of("tok-123", "alice", "secret", null).toString();

        assertThat(text).contains("alice").doesNotContain("tok-123").doesNotContain("secret");
    }
}
