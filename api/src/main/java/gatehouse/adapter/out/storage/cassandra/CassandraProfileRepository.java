package gatehouse.adapter.out.storage.cassandra;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executor;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.vertx.core.Context;
import io.vertx.core.Vertx;
import org.jboss.logging.Logger;

import gatehouse.core.model.profile.Profile;
import gatehouse.core.model.profile.ProfileWriteConflictException;
import gatehouse.core.port.out.ProfileRepository;

/**
 * Cassandra implementation of ProfileRepository.
 *
 * <p>Inserts and onboarding updates are lightweight transactions, so the
 * uniqueness of a subject's row and the one-way onboarded flag hold across
 * instances without an external lock.
 *
 * <p>A lightweight transaction commits through Paxos, so a plain read at the
 * driver's default consistency can miss a row another instance just won.
 * Reads that follow a conditional write go through {@link #findCommitted},
 * which reads at {@code LOCAL_SERIAL}.
 *
 * <h2>Schema</h2>
 * <pre>
 * CREATE TABLE IF NOT EXISTS profiles (
 *     subject_id text PRIMARY KEY,
 *     email text,
 *     onboarded boolean,
 *     display_name text,
 *     role text,
 *     created_at timestamp,
 *     updated_at timestamp
 * );
 * </pre>
 */
public class CassandraProfileRepository implements ProfileRepository {

    private static final Logger LOG = Logger.getLogger(CassandraProfileRepository.class);

    private final CqlSession session;
    private final PreparedStatement selectByIdStmt;
    private final PreparedStatement insertIfAbsentStmt;
    private final PreparedStatement completeOnboardingStmt;

    public CassandraProfileRepository(CqlSession session) {
        this.session = session;
        this.selectByIdStmt = session.prepare("SELECT * FROM profiles WHERE subject_id = ?");
        this.insertIfAbsentStmt = session.prepare(
                """
                INSERT INTO profiles (subject_id, email, onboarded, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?)
                IF NOT EXISTS
                """);
        this.completeOnboardingStmt = session.prepare(
                """
                UPDATE profiles SET display_name = ?, role = ?, onboarded = true, updated_at = ?
                WHERE subject_id = ?
                IF onboarded = false
                """);
    }

    @Override
    public Uni<Optional<Profile>> findById(String subjectId) {
        return select(selectByIdStmt.bind(subjectId));
    }

    @Override
    public Uni<Optional<Profile>> findCommitted(String subjectId) {
        return select(selectByIdStmt.bind(subjectId).setConsistencyLevel(DefaultConsistencyLevel.LOCAL_SERIAL));
    }

    private Uni<Optional<Profile>> select(BoundStatement statement) {
        final Executor executor = getContextExecutor();
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(statement).toCompletableFuture())
                .emitOn(executor)
                .map(rs -> {
                    final Row row = rs.one();
                    return row != null ? Optional.of(fromRow(row)) : Optional.<Profile>empty();
                });
    }

    @Override
    public Uni<Profile> insert(Profile profile) {
        final Executor executor = getContextExecutor();
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(insertIfAbsentStmt.bind(
                                profile.subjectId(),
                                profile.email(),
                                profile.onboarded(),
                                profile.createdAt(),
                                profile.updatedAt()))
                        .toCompletableFuture())
                .emitOn(executor)
                .map(rs -> {
                    if (!rs.wasApplied()) {
                        throw new ProfileWriteConflictException(profile.subjectId());
                    }
                    return profile;
                });
    }

    @Override
    public Uni<Optional<Profile>> completeOnboarding(String subjectId, String displayName, String role, Instant at) {
        final Executor executor = getContextExecutor();
        return Uni.createFrom()
                .completionStage(() -> session.executeAsync(
                                completeOnboardingStmt.bind(displayName, role, at, subjectId))
                        .toCompletableFuture())
                .emitOn(executor)
                .invoke(rs -> {
                    if (!rs.wasApplied()) {
                        LOG.debugf("Onboarding update not applied for subject %s", subjectId);
                    }
                })
                // not applied means the row is missing or already onboarded; either way the stored row is the answer
                .flatMap(rs -> findCommitted(subjectId));
    }

    private Profile fromRow(Row row) {
        return new Profile(
                row.getString("subject_id"),
                row.getString("email"),
                row.getBoolean("onboarded"),
                row.getString("display_name"),
                row.getString("role"),
                row.getInstant("created_at"),
                row.getInstant("updated_at"));
    }

    /**
     * Get an executor that will run on the Vert.x context if available,
     * otherwise falls back to the default worker pool.
     *
     * <p>The Cassandra driver completes its futures on Netty I/O threads,
     * which have no Vert.x context for RESTEasy Reactive to resume on.
     */
    private Executor getContextExecutor() {
        final Context context = Vertx.currentContext();
        if (context != null) {
            return command -> context.runOnContext(v -> command.run());
        }
        return Infrastructure.getDefaultWorkerPool();
    }
}
