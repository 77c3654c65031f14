package com.products.lookup.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.lookup.config.PricingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * <h2>JsonFileCredentialStore</h2>
 *
 * <p>Reads pricing credentials from a JSON document shaped as</p>
 * <pre>{@code
 * {
 *   "open_prices": {
 *     "auth_token": "...",
 *     "username": "...",
 *     "password": "...",
 *     "session_timeout": 3600
 *   }
 * }
 * }</pre>
 *
 * <p>The document is looked up in this order:</p>
 * <ol>
 *   <li>{@code src/test/resources/<file>} under the working directory;</li>
 *   <li>the nearest ancestor of the working directory that holds the marker file;</li>
 *   <li>the working directory itself.</li>
 * </ol>
 *
 * <p>A missing or unreadable document resolves to {@link CredentialBundle#none()}.</p>
 */
@Slf4j
@Component
public class JsonFileCredentialStore implements CredentialStore {

    static final String SECTION = "open_prices";

    private final PricingProperties.Credentials cfg;

    private final ObjectMapper mapper;

    private final Path workingDir;

    private volatile CredentialBundle cached;

    private volatile boolean loaded;

    @Autowired
    public JsonFileCredentialStore(final PricingProperties props,
                                   @Qualifier("lookupObjectMapper") final ObjectMapper mapper) {
        this(props, mapper, Paths.get("").toAbsolutePath());
    }

    JsonFileCredentialStore(final PricingProperties props, final ObjectMapper mapper, final Path workingDir) {
        this.cfg = props.getCredentials();
        this.mapper = mapper;
        this.workingDir = workingDir;
    }

    @Override
    public synchronized CredentialBundle resolve() {
        if (cached == null) {
            cached = load();
        }
        return cached;
    }

    @Override
    public CredentialBundle current() {
        CredentialBundle bundle = cached;
        return bundle == null ? CredentialBundle.none() : bundle;
    }

    @Override
    public boolean isLoaded() {
        return loaded;
    }

    @Override
    public synchronized void clear() {
        cached = null;
        loaded = false;
    }

    /**
     * @return location of the credential document, if one exists
     */
    Optional<Path> locate() {
        String file = cfg.getFile();

        if (cfg.isSearchTestResources()) {
            Path testResource = workingDir.resolve("src").resolve("test").resolve("resources").resolve(file);
            if (Files.isRegularFile(testResource)) {
                return Optional.of(testResource);
            }
        }

        for (Path dir = workingDir; dir != null; dir = dir.getParent()) {
            if (Files.exists(dir.resolve(cfg.getMarkerFile()))) {
                Path candidate = dir.resolve(file);
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(candidate);
                }
                break;
            }
        }

        Path local = workingDir.resolve(file);
        return Files.isRegularFile(local) ? Optional.of(local) : Optional.empty();
    }

    private CredentialBundle load() {
        Optional<Path> path = locate();
        if (path.isEmpty()) {
            log.info("No pricing credential file '{}' found, pricing runs read-only", cfg.getFile());
            return CredentialBundle.none();
        }

        try {
            JsonNode section = mapper.readTree(path.get().toFile()).path(SECTION);
            CredentialBundle bundle = CredentialBundle.of(
                    text(section, "auth_token"),
                    text(section, "username"),
                    text(section, "password"),
                    section.hasNonNull("session_timeout") ? section.get("session_timeout").asInt() : null);
            loaded = true;
            log.info("Loaded pricing credentials from {} (method {})", path.get(), bundle.getMethod());
            return bundle;
        } catch (IOException ex) {
            log.warn("Cannot read pricing credentials from {}: {}", path.get(), ex.getMessage());
            return CredentialBundle.none();
        }
    }

    private static String text(final JsonNode node, final String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
