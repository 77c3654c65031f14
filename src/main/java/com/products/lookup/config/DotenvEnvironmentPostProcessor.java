package com.products.lookup.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.StandardEnvironment;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a {@code .env} file so that {@code ${OPEN_PRICES_TOKEN}},
 * {@code ${OPEN_PRICES_USERNAME}} and the other pricing credentials can be
 * kept out of {@code application.yml}.
 * <p>
 * The file is looked up in {@code lookup.dotenv.directory} (a system property
 * or environment variable {@code LOOKUP_DOTENV_DIRECTORY}), defaulting to the
 * working directory. Entries rank just below real OS environment variables, so
 * an exported variable always beats the file.
 * </p>
 */
public class DotenvEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String PROPERTY_SOURCE_NAME = "lookupDotenv";

    static final String DIRECTORY_PROPERTY = "lookup.dotenv.directory";

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(final ConfigurableEnvironment env,
                                       final SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .directory(env.getProperty(DIRECTORY_PROPERTY, "."))
                .filename(".env")
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();

        Map<String, Object> entries = new LinkedHashMap<>();
        for (DotenvEntry e : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            entries.put(e.getKey(), e.getValue());
        }
        if (entries.isEmpty()) {
            return;
        }

        MutablePropertySources sources = env.getPropertySources();
        MapPropertySource dotenvSource = new MapPropertySource(PROPERTY_SOURCE_NAME, entries);
        if (sources.contains(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME)) {
            sources.addAfter(StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME, dotenvSource);
        } else {
            sources.addFirst(dotenvSource);
        }
    }
}
