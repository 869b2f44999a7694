package com.mymemo.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Reminder store connection settings. Each key is read from its environment variable or
 * system property, then from {@code database.properties} on the classpath, then defaulted.
 */
public class DatabaseConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    public static final String PERSISTENCE_UNIT = "mymemo_pu";

    // property key -> environment variable
    private static final Map<String, String> ENV_KEYS = new LinkedHashMap<>();
    static {
        ENV_KEYS.put("db.url", "DB_URL");
        ENV_KEYS.put("db.host", "DB_HOST");
        ENV_KEYS.put("db.port", "DB_PORT");
        ENV_KEYS.put("db.name", "DB_NAME");
        ENV_KEYS.put("db.username", "DB_USERNAME");
        ENV_KEYS.put("db.password", "DB_PASSWORD");
        ENV_KEYS.put("db.pool.size", "DB_POOL_SIZE");
        ENV_KEYS.put("db.pool.minIdle", "DB_POOL_MIN_IDLE");
        ENV_KEYS.put("db.pool.maxLifetime", "DB_POOL_MAX_LIFETIME");
        ENV_KEYS.put("db.connection.timeout", "DB_CONNECTION_TIMEOUT");
        ENV_KEYS.put("jpa.show_sql", "JPA_SHOW_SQL");
        ENV_KEYS.put("flyway.enabled", "FLYWAY_ENABLED");
        ENV_KEYS.put("flyway.baseline.version", "FLYWAY_BASELINE_VERSION");
        ENV_KEYS.put("flyway.locations", "FLYWAY_LOCATIONS");
    }

    private final Map<String, String> values = new HashMap<>();

    public DatabaseConfig() {
        this(readEnvironment(), readPropertiesFile());
        log.info("Reminder store: {} as {} (pool {}, migrations {})",
                getUrl(), getUsername(), getPoolSize(), isFlywayEnabled() ? "on" : "off");
    }

    DatabaseConfig(Map<String, String> overrides, Map<String, String> fileValues) {
        values.putAll(fileValues);
        values.putAll(overrides);
        values.putIfAbsent("db.host", "localhost");
        values.putIfAbsent("db.port", "5432");
        values.putIfAbsent("db.name", "mymemo");
        values.putIfAbsent("db.url", "jdbc:postgresql://" + values.get("db.host") + ":"
                + values.get("db.port") + "/" + values.get("db.name"));
        values.putIfAbsent("db.username", "postgres");
        values.putIfAbsent("db.password", "postgres");
        values.putIfAbsent("jpa.show_sql", "false");
        values.putIfAbsent("flyway.enabled", "true");
        values.putIfAbsent("flyway.baseline.version", "0");
        values.putIfAbsent("flyway.locations", "classpath:db/migration");
    }

    private static Map<String, String> readEnvironment() {
        Map<String, String> found = new HashMap<>();
        ENV_KEYS.forEach((key, env) -> Optional.ofNullable(System.getenv(env))
                .or(() -> Optional.ofNullable(System.getProperty(env)))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .ifPresent(value -> found.put(key, value)));
        return found;
    }

    private static Map<String, String> readPropertiesFile() {
        Map<String, String> found = new HashMap<>();
        try (InputStream input = DatabaseConfig.class.getClassLoader()
                .getResourceAsStream("database.properties")) {
            if (input == null) {
                return found;
            }
            Properties file = new Properties();
            file.load(input);
            file.stringPropertyNames().forEach(key -> found.put(key, file.getProperty(key).trim()));
            log.debug("Loaded {} key(s) from database.properties", found.size());
        } catch (IOException e) {
            log.warn("Could not read database.properties, using environment and defaults", e);
        }
        return found;
    }

    public String getUrl() { return values.get("db.url"); }
    public String getUsername() { return values.get("db.username"); }
    public String getPassword() { return values.get("db.password"); }
    public String getDatabaseName() { return values.get("db.name"); }

    public String getDriver() {
        return "org.postgresql.Driver";
    }

    public int getPoolSize() {
        return (int) number("db.pool.size", 10);
    }

    public int getPoolMinIdle() {
        return (int) number("db.pool.minIdle", 2);
    }

    public long getPoolMaxLifetime() {
        return number("db.pool.maxLifetime", 1_800_000L);
    }

    public long getConnectionTimeout() {
        return number("db.connection.timeout", 30_000L);
    }

    public boolean isShowSql() {
        return Boolean.parseBoolean(values.get("jpa.show_sql"));
    }

    public boolean isFlywayEnabled() {
        return Boolean.parseBoolean(values.get("flyway.enabled"));
    }

    public String getFlywayBaselineVersion() {
        return values.get("flyway.baseline.version");
    }

    public String[] getFlywayLocations() {
        return values.get("flyway.locations").split("\\s*,\\s*");
    }

    private long number(String key, long defaultValue) {
        String raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            log.warn("Unable to parse {}='{}', using {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    /**
     * EclipseLink settings. Connections come from the pool, so only the platform and
     * logging are set here.
     */
    public Map<String, Object> getJpaProperties() {
        Map<String, Object> jpa = new HashMap<>();
        jpa.put("eclipselink.target-database", "PostgreSQL");
        jpa.put("eclipselink.ddl-generation", "none");
        jpa.put("eclipselink.cache.shared.default", "false");
        jpa.put("eclipselink.logging.level", isShowSql() ? "FINE" : "WARNING");
        jpa.put("eclipselink.logging.level.sql", isShowSql() ? "FINE" : "OFF");
        jpa.put("eclipselink.logging.parameters", String.valueOf(isShowSql()));
        return jpa;
    }
}
