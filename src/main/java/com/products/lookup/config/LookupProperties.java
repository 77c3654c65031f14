package com.products.lookup.config;

import com.products.lookup.model.Language;
import com.products.lookup.model.LanguageList;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Binds the {@code lookup} section of <code>application.yml</code>.
 * <p>
 * Example YAML:
 * <pre>{@code
 * lookup:
 *   languages: [fr, en]
 *   auto-initialize: true
 *   cache:
 *     enabled: true
 *     max-age: 7d
 * }</pre>
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "lookup")
public class LookupProperties {

    /** ISO 639-1 tags in resolution order. Unknown tags are skipped. */
    private List<String> languages = new ArrayList<>(List.of("en"));

    /** Configure the pricing session once the application is ready. */
    private boolean autoInitialize = true;

    private Cache cache = new Cache();

    /**
     * Resolves {@link #languages} into a {@link LanguageList}.
     *
     * @return the configured languages, or the default language if none is recognised
     */
    public LanguageList languageList() {
        List<Language> resolved = new ArrayList<>();
        for (String code : languages) {
            Optional<Language> language = Language.fromCode(code);
            if (language.isPresent()) {
                resolved.add(language.get());
            } else {
                log.warn("Ignoring unknown lookup language '{}'", code);
            }
        }
        return LanguageList.of(resolved);
    }

    @Data
    public static class Cache {

        /** Consult and feed the product cache. */
        private boolean enabled = true;

        /** Age after which a cached product is fetched again. */
        private Duration maxAge = Duration.ofDays(7);
    }
}
