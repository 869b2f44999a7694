package com.mymemo.composition.root;

import com.mymemo.config.DatabaseConfig;
import com.mymemo.repository.JpaReminderRepository;
import com.mymemo.repository.ReminderRepository;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.HashMap;
import java.util.Map;

public class JpaModule extends AbstractModule {
    private static final Logger log = LoggerFactory.getLogger(JpaModule.class);

    @Override
    protected void configure() {
        bind(ReminderRepository.class).to(JpaReminderRepository.class);
    }

    @Provides
    @Singleton
    public DatabaseConfig provideDatabaseConfig() {
        DatabaseConfig config = new DatabaseConfig();
        log.info("Database config loaded for {} (migrations {})",
                config.getDatabaseName(), config.isFlywayEnabled() ? "enabled" : "disabled");
        return config;
    }

    @Provides
    @Singleton
    public HikariDataSource provideHikariDataSource(DatabaseConfig config) {
        log.info("Opening connection pool to {}", config.getUrl());

        HikariDataSource ds = new HikariDataSource();
        ds.setPoolName("mymemo-db");
        ds.setJdbcUrl(config.getUrl());
        ds.setUsername(config.getUsername());
        ds.setPassword(config.getPassword());
        ds.setDriverClassName(config.getDriver());
        ds.setMaximumPoolSize(config.getPoolSize());
        ds.setMinimumIdle(config.getPoolMinIdle());
        ds.setConnectionTimeout(config.getConnectionTimeout());
        ds.setMaxLifetime(config.getPoolMaxLifetime());
        return ds;
    }

    @Provides
    @Singleton
    public DataSource provideDataSource(HikariDataSource dataSource) {
        return dataSource;
    }

    @Provides
    @Singleton
    public Flyway provideFlyway(DataSource dataSource, DatabaseConfig config) {
        Flyway flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(config.getFlywayLocations())
                .baselineOnMigrate(true)
                .baselineVersion(config.getFlywayBaselineVersion())
                .load();

        if (!config.isFlywayEnabled()) {
            log.warn("Schema migrations are disabled, expecting an existing reminders table");
            return flyway;
        }

        MigrationInfo[] pending = flyway.info().pending();
        for (MigrationInfo migration : pending) {
            log.info("Pending migration {}: {}", migration.getVersion(), migration.getDescription());
        }

        try {
            MigrateResult result = flyway.migrate();
            log.info("Applied {} migration(s), schema at version {}",
                    result.migrationsExecuted, result.targetSchemaVersion);
        } catch (RuntimeException e) {
            log.error("Schema migration failed", e);
            throw new IllegalStateException("Schema migration failed", e);
        }
        return flyway;
    }

    @Provides
    @Singleton
    public EntityManagerFactory provideEntityManagerFactory(DatabaseConfig config,
                                                            DataSource dataSource,
                                                            Flyway flyway) {
        Map<String, Object> properties = new HashMap<>(config.getJpaProperties());
        properties.put("jakarta.persistence.nonJtaDataSource", dataSource);

        try {
            EntityManagerFactory emf = Persistence.createEntityManagerFactory(
                    DatabaseConfig.PERSISTENCE_UNIT, properties);
            log.info("Persistence unit {} ready", DatabaseConfig.PERSISTENCE_UNIT);
            return emf;
        } catch (RuntimeException e) {
            log.error("Failed to create EntityManagerFactory", e);
            throw new IllegalStateException("Failed to initialize JPA", e);
        }
    }
}
