package com.products.lookup.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.lookup.config.PricingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileCredentialStoreTest {

    private static final String FILE = "open_prices_credentials.json";

    @TempDir
    Path root;

    private PricingProperties props;

    @BeforeEach
    void setUp() {
        props = new PricingProperties();
    }

    private JsonFileCredentialStore store(final Path workingDir) {
        return new JsonFileCredentialStore(props, new ObjectMapper(), workingDir);
    }

    @Test
    @DisplayName("missing file resolves to read-only credentials")
    void missingFile() {
        JsonFileCredentialStore store = store(root);

        assertThat(store.resolve().getMethod()).isEqualTo(AuthMethod.NONE);
        assertThat(store.isLoaded()).isFalse();
    }

    @Test
    @DisplayName("login credentials and timeout are read from the working directory")
    void readsLogin() throws IOException {
        Files.writeString(root.resolve(FILE),
                "{\"open_prices\":{\"username\":\"alice\",\"password\":\"secret\",\"session_timeout\":900}}");

        CredentialBundle bundle = store(root).resolve();

        assertThat(bundle.getMethod()).isEqualTo(AuthMethod.LOGIN_PASSWORD);
        assertThat(bundle.getUsername()).isEqualTo("alice");
        assertThat(bundle.getSessionTimeoutSeconds()).isEqualTo(900);
    }

    @Test
    @DisplayName("current never reads the file and forgets secrets once cleared")
    void currentDoesNotReload() throws IOException {
        Files.writeString(root.resolve(FILE),
                "{\"open_prices\":{\"username\":\"alice\",\"password\":\"secret\"}}");
        JsonFileCredentialStore store = store(root);

        assertThat(store.current().getMethod()).isEqualTo(AuthMethod.NONE);
        assertThat(store.resolve().getPassword()).isEqualTo("secret");
        assertThat(store.current().getPassword()).isEqualTo("secret");

        store.clear();

        assertThat(store.current().getMethod()).isEqualTo(AuthMethod.NONE);
        assertThat(store.current().getPassword()).isNull();
        assertThat(store.isLoaded()).isFalse();
    }

    @Test
    @DisplayName("test resources take precedence over the project root")
    void testResourcesFirst() throws IOException {
        Files.writeString(root.resolve("pom.xml"), "<project/>");
        Files.writeString(root.resolve(FILE), "{\"open_prices\":{\"auth_token\":\"root-token\"}}");
        Path resources = Files.createDirectories(root.resolve("src/test/resources"));
        Files.writeString(resources.resolve(FILE), "{\"open_prices\":{\"auth_token\":\"test-token\"}}");

        assertThat(store(root).resolve().getToken()).isEqualTo("test-token");
    }

    @Test
    @DisplayName("upward scan finds the file next to the marker")
    void upwardScan() throws IOException {
        Files.writeString(root.resolve("pom.xml"), "<project/>");
        Files.writeString(root.resolve(FILE), "{\"open_prices\":{\"auth_token\":\"root-token\"}}");
        Path nested = Files.createDirectories(root.resolve("module/sub"));

        JsonFileCredentialStore store = store(nested);

        assertThat(store.resolve().getMethod()).isEqualTo(AuthMethod.API_TOKEN);
        assertThat(store.isLoaded()).isTrue();
    }

    @Test
    @DisplayName("placeholder template values resolve to read-only credentials")
    void placeholders() throws IOException {
        Files.writeString(root.resolve(FILE), "{\"open_prices\":{\"auth_token\":\"your_api_token_here\","
                + "\"username\":\"your_openfoodfacts_username\",\"password\":\"your_openfoodfacts_password\"}}");

        assertThat(store(root).resolve().getMethod()).isEqualTo(AuthMethod.NONE);
    }

    @Test
    @DisplayName("malformed file resolves to read-only credentials")
    void malformedFile() throws IOException {
        Files.writeString(root.resolve(FILE), "{not json");

        assertThat(store(root).resolve().getMethod()).isEqualTo(AuthMethod.NONE);
    }

    @Test
    @DisplayName("clear forces the file to be read again")
    void clearRereads() throws IOException {
        Path file = root.resolve(FILE);
        Files.writeString(file, "{\"open_prices\":{\"auth_token\":\"one\"}}");
        JsonFileCredentialStore store = store(root);
        assertThat(store.resolve().getToken()).isEqualTo("one");

        Files.writeString(file, "{\"open_prices\":{\"auth_token\":\"two\"}}");
        assertThat(store.resolve().getToken()).isEqualTo("one");

        store.clear();
        assertThat(store.resolve().getToken()).isEqualTo("two");
    }
}
