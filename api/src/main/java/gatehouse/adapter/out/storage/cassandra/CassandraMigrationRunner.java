package gatehouse.adapter.out.storage.cassandra;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.datastax.oss.driver.api.core.CqlSession;
import org.jboss.logging.Logger;

/**
 * Applies CQL migrations from the classpath.
 *
 * <p>Migration files live under {@code db/cassandra/} and are named
 * {@code V{version}__{description}.cql}. V1 creates the keyspace and runs on
 * a session without a keyspace; later versions are tracked in the
 * {@code schema_migrations} table and applied once each.
 */
public class CassandraMigrationRunner {

    private static final Logger LOG = Logger.getLogger(CassandraMigrationRunner.class);
    private static final String MIGRATIONS_PATH = "db/cassandra/";
    private static final Pattern MIGRATION_PATTERN = Pattern.compile("V(\\d+)__.*\\.cql");
    private static final List<String> MIGRATIONS = List.of("V1__create_keyspace.cql", "V2__create_profiles.cql");

    private final CqlSession session;
    private final String keyspace;

    public CassandraMigrationRunner(CqlSession session, String keyspace) {
        this.session = session;
        this.keyspace = keyspace;
    }

    /**
     * Create the keyspace. The session must not be bound to a keyspace.
     */
    public void runKeyspaceMigration() {
        final var migration = load(MIGRATIONS.get(0));
        LOG.infof("Ensuring keyspace %s exists", keyspace);
        for (String statement : statements(migration.content())) {
            session.execute(statement);
        }
    }

    /**
     * Apply every pending migration after V1.
     *
     * @return the number of migrations applied
     */
    public int runMigrations() {
        ensureMigrationTableExists();
        final var appliedVersions = getAppliedVersions();

        int applied = 0;
        for (var migration : discoverMigrations()) {
            if (migration.version() == 1 || appliedVersions.contains(migration.version())) {
                continue;
            }
            applyMigration(migration);
            applied++;
        }

        if (applied > 0) {
            LOG.infof("Applied %d migration(s)", applied);
        } else {
            LOG.debug("No pending migrations");
        }
        return applied;
    }

    private void ensureMigrationTableExists() {
        session.execute(
                """
                CREATE TABLE IF NOT EXISTS %s.schema_migrations (
                    version int PRIMARY KEY,
                    script_name text,
                    applied_at timestamp
                )
                """
                        .formatted(keyspace));
    }

    private Set<Integer> getAppliedVersions() {
        final var rs = session.execute("SELECT version FROM %s.schema_migrations".formatted(keyspace));
        return rs.all().stream().map(row -> row.getInt("version")).collect(Collectors.toSet());
    }

    private List<Migration> discoverMigrations() {
        final List<Migration> migrations = new ArrayList<>();
        for (String filename : MIGRATIONS) {
            migrations.add(load(filename));
        }
        migrations.sort(Comparator.comparingInt(Migration::version));
        return migrations;
    }

    private Migration load(String filename) {
        final Matcher matcher = MIGRATION_PATTERN.matcher(filename);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a migration file name: " + filename);
        }
        final var path = MIGRATIONS_PATH + filename;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new IllegalStateException("Migration file not found: " + path);
            }
            final var content = new String(is.readAllBytes(), StandardCharsets.UTF_8)
                    .replace("${keyspace}", keyspace);
            return new Migration(Integer.parseInt(matcher.group(1)), filename, content);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read migration " + path, e);
        }
    }

    private static List<String> statements(String content) {
        final List<String> result = new ArrayList<>();
        for (String statement : content.split(";")) {
            final var withoutComments = statement.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"))
                    .trim();
            if (!withoutComments.isEmpty()) {
                result.add(withoutComments);
            }
        }
        return result;
    }

    private void applyMigration(Migration migration) {
        LOG.infof("Applying migration V%d: %s", migration.version(), migration.filename());

        for (String statement : statements(migration.content())) {
            // already connected to the keyspace
            if (statement.toUpperCase(Locale.ROOT).startsWith("USE ")) {
                continue;
            }
            try {
                session.execute(statement);
            } catch (RuntimeException e) {
                LOG.errorf("Failed to execute statement in %s: %s", migration.filename(), e.getMessage());
                throw new IllegalStateException("Migration failed: " + migration.filename(), e);
            }
        }

        session.execute(
                """
                INSERT INTO %s.schema_migrations (version, script_name, applied_at)
                VALUES (?, ?, ?)
                """
                        .formatted(keyspace),
                migration.version(),
                migration.filename(),
                Instant.now());
    }

    private record Migration(int version, String filename, String content) {}
}
