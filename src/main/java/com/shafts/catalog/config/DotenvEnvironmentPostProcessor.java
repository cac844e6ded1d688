package com.shafts.catalog.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.SystemEnvironmentPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Loads a `.env` file and adds its entries as a high-priority property source.
 * <p>
 * Entries are exposed with environment-variable semantics, so `CATALOG_SNAPSHOT_FILE=...`
 * in `.env` binds to `catalog.snapshot-file`. The directory holding `.env` is taken from
 * `catalog.dotenv-directory` (default: working directory).
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    static final String SOURCE_NAME = "catalogDotenv";

    static final String DIRECTORY_PROPERTY = "catalog.dotenv-directory";

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment env,
                                       SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .directory(env.getProperty(DIRECTORY_PROPERTY, "."))
                .filename(".env")
                .ignoreIfMissing()
                .load();

        Map<String, Object> map = new HashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
                .forEach(e -> map.put(e.getKey(), e.getValue()));
        if (map.isEmpty()) {
            return;
        }

        env.getPropertySources()
                .addFirst(new SystemEnvironmentPropertySource(SOURCE_NAME, map));
    }
}
