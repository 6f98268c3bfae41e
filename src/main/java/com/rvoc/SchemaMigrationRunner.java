package com.rvoc;

import com.rvoc.config.RVocProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned SQL scripts under {@code db/migration} in version order. Applied versions
 * are recorded with a checksum in {@code schema_migrations}; an applied script that changed or
 * disappeared stops startup. Concurrent starts are serialized by a PostgreSQL advisory lock.
 */
@Component
@ConditionalOnProperty(prefix = "rvoc.database", name = "skip-migrations", havingValue = "false", matchIfMissing = true)
public class SchemaMigrationRunner implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrationRunner.class);
    private static final Pattern VERSION_FILE_PATTERN = Pattern.compile("^V([0-9]+)__([A-Za-z0-9_\\-]+)\\.sql$");
    static final String MIGRATION_RESOURCE_PATTERN = "classpath*:db/migration/V*__*.sql";
    private static final String MIGRATION_TABLE = "schema_migrations";
    private static final long ADVISORY_LOCK_KEY = 7_315_062_247_918_402_113L;

    private final DataSource dataSource;
    private final PathMatchingResourcePatternResolver resourceResolver = new PathMatchingResourcePatternResolver();
    private final boolean failOnMigrationError;

    public SchemaMigrationRunner(DataSource dataSource, RVocProperties properties) {
        this.dataSource = dataSource;
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        log.info("Running database schema migrations");

        try (Connection connection = dataSource.getConnection()) {
            lock(connection);
            try {
                ensureMigrationTable(connection);
                List<MigrationScript> migrations = loadMigrationScripts();
                if (migrations.isEmpty()) {
                    throw new IllegalStateException("No migrations found on classpath pattern "
                            + MIGRATION_RESOURCE_PATTERN);
                }

                Map<Integer, String> appliedChecksums = loadAppliedChecksums(connection);
                validateChecksums(migrations, appliedChecksums);
                int appliedNow = 0;
                for (MigrationScript migration : migrations) {
                    if (!appliedChecksums.containsKey(migration.version())) {
                        applyMigration(connection, migration);
                        appliedNow++;
                    }
                }

                if (appliedNow == 0) {
                    log.info("Schema is up to date, {} migrations already applied", appliedChecksums.size());
                } else {
                    log.info("Applied {} migrations", appliedNow);
                }
            } finally {
                unlock(connection);
            }
        } catch (Exception e) {
            String message = "Failed to migrate the database schema";
            if (failOnMigrationError) {
                throw new IllegalStateException(message, e);
            }
            log.error("{} (continuing because rvoc.database.fail-on-migration-error=false)", message, e);
        }
    }

    private void ensureMigrationTable(Connection connection) throws SQLException {
        String sql = """
                CREATE TABLE IF NOT EXISTS %s (
                    version INT PRIMARY KEY,
                    description VARCHAR(255) NOT NULL,
                    checksum VARCHAR(64) NOT NULL,
                    installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    execution_time_ms BIGINT NOT NULL
                )
                """.formatted(MIGRATION_TABLE);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    List<MigrationScript> loadMigrationScripts() throws IOException {
        Resource[] resources = resourceResolver.getResources(MIGRATION_RESOURCE_PATTERN);
        Map<Integer, MigrationScript> scriptsByVersion = new HashMap<>();

        for (Resource resource : resources) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = VERSION_FILE_PATTERN.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException(
                        "Invalid migration filename '" + fileName + "', expected V{version}__{description}.sql");
            }

            int version = Integer.parseInt(matcher.group(1));
            String description = matcher.group(2).replace('_', ' ');
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            MigrationScript script = new MigrationScript(version, description, resource, sha256(sql));
            MigrationScript previous = scriptsByVersion.putIfAbsent(version, script);
            if (previous != null) {
                throw new IllegalStateException("Duplicate migration version V" + version + " in files "
                        + previous.resource().getFilename() + " and " + fileName);
            }
        }

        List<MigrationScript> scripts = new ArrayList<>(scriptsByVersion.values());
        scripts.sort((left, right) -> Integer.compare(left.version(), right.version()));
        return scripts;
    }

    private Map<Integer, String> loadAppliedChecksums(Connection connection) throws SQLException {
        Map<Integer, String> applied = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + MIGRATION_TABLE);
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                applied.put(rs.getInt("version"), rs.getString("checksum"));
            }
        }
        return applied;
    }

    private void validateChecksums(List<MigrationScript> migrations, Map<Integer, String> appliedChecksums) {
        Map<Integer, MigrationScript> scriptsByVersion = new HashMap<>();
        for (MigrationScript migration : migrations) {
            scriptsByVersion.put(migration.version(), migration);
        }
        for (Map.Entry<Integer, String> applied : appliedChecksums.entrySet()) {
            MigrationScript script = scriptsByVersion.get(applied.getKey());
            if (script == null) {
                throw new IllegalStateException("Migration V" + applied.getKey()
                        + " was applied in the database but is missing from the classpath");
            }
            if (!script.checksum().equals(applied.getValue())) {
                throw new IllegalStateException("Checksum mismatch for migration V" + applied.getKey()
                        + ", the file changed after being applied");
            }
        }
    }

    private void applyMigration(Connection connection, MigrationScript migration) {
        boolean originalAutoCommit = true;
        long started = System.nanoTime();
        try {
            originalAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);

            ScriptUtils.executeSqlScript(connection, new EncodedResource(migration.resource(), StandardCharsets.UTF_8));

            long executionMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            try (PreparedStatement statement = connection.prepareStatement("INSERT INTO " + MIGRATION_TABLE
                    + " (version, description, checksum, execution_time_ms) VALUES (?, ?, ?, ?)")) {
                statement.setInt(1, migration.version());
                statement.setString(2, migration.description());
                statement.setString(3, migration.checksum());
                statement.setLong(4, executionMs);
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied migration V{} ({}) in {} ms", migration.version(), migration.description(), executionMs);
        } catch (Exception e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackException) {
                log.error("Failed to roll back migration V{}", migration.version(), rollbackException);
            }
            throw new IllegalStateException(
                    "Failed to apply migration V" + migration.version() + " (" + migration.description() + ")", e);
        } finally {
            try {
                connection.setAutoCommit(originalAutoCommit);
            } catch (SQLException e) {
                log.warn("Could not restore auto-commit after migration", e);
            }
        }
    }

    private void lock(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
    }

    private void unlock(Connection connection) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release the schema migration lock", e);
        }
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Unable to compute migration checksum", e);
        }
    }

    record MigrationScript(int version, String description, Resource resource, String checksum) {
    }
}
