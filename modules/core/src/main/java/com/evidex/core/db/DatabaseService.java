package com.evidex.core.db;

import com.evidex.core.dao.DatabaseDao;
import com.evidex.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Root infrastructure service owning the case database.
 *
 * <p>Starts eagerly at boot, applies {@value #SCHEMA_RESOURCE} (every
 * statement is {@code IF NOT EXISTS}, so reopening an existing case database
 * is a no-op) and probes the engine version. {@link #jdbi()} is only handed
 * out while the service is RUNNING.
 */
@ApplicationScoped
@Startup
public class DatabaseService extends AbstractManagedService {

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    @Inject
    Jdbi jdbi;

    private String databaseVersion;

    @Override
    public String serviceId() {
        return "database";
    }

    @Override
    protected void doStart() throws IOException {
        String schema = loadSchema();
        jdbi.useHandle(handle -> handle.createScript(schema).execute());
        databaseVersion = jdbi.withExtension(DatabaseDao.class, DatabaseDao::engineVersion);
        log.infof("Case database ready (H2 %s)", databaseVersion);
    }

    @Override
    protected void doStop() {
        log.info("DatabaseService stopping (Agroal manages pool shutdown)");
    }

    /** Returns the Jdbi instance. Throws if the service is not RUNNING. */
    public Jdbi jdbi() {
        requireRunning();
        return jdbi;
    }

    /** Runs {@code SELECT 1}; a failure moves the service to FAILED. */
    public boolean ping() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            return true;
        } catch (Exception e) {
            fail(e);
            return false;
        }
    }

    /** Engine version reported by the startup probe. */
    public String databaseVersion() {
        return databaseVersion;
    }

    private static String loadSchema() throws IOException {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = loader.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IOException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("DatabaseService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping DatabaseService", e);
        }
    }
}
