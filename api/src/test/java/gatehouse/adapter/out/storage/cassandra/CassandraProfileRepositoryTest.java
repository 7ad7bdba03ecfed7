package gatehouse.adapter.out.storage.cassandra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import com.datastax.oss.driver.api.core.ConsistencyLevel;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import gatehouse.core.model.profile.Profile;
import gatehouse.core.model.profile.ProfileWriteConflictException;

@DisplayName("CassandraProfileRepository")
@ExtendWith(MockitoExtension.class)
class CassandraProfileRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);
    private static final Instant CREATED = Instant.parse("2026-01-05T10:00:00Z");

    @Mock
    private CqlSession session;

    @Mock
    private PreparedStatement selectStmt;

    @Mock
    private PreparedStatement insertStmt;

    @Mock
    private PreparedStatement onboardingStmt;

    @Mock
    private BoundStatement plainRead;

    @Mock
    private BoundStatement serialRead;

    private CassandraProfileRepository repository;

    @BeforeEach
    void setUp() {
        lenient().when(session.prepare(startsWith("SELECT"))).thenReturn(selectStmt);
        lenient().when(session.prepare(contains("INSERT INTO profiles"))).thenReturn(insertStmt);
        lenient().when(session.prepare(contains("UPDATE profiles"))).thenReturn(onboardingStmt);
        lenient().when(selectStmt.bind("sub-1")).thenReturn(plainRead);
        lenient()
                .when(plainRead.setConsistencyLevel(DefaultConsistencyLevel.LOCAL_SERIAL))
                .thenReturn(serialRead);
        repository = new CassandraProfileRepository(session);
    }

    private static AsyncResultSet resultWith(Row row) {
        final var rs = mock(AsyncResultSet.class);
        lenient().when(rs.one()).thenReturn(row);
        return rs;
    }

    private static Row storedRow() {
        final var row = mock(Row.class);
        when(row.getString("subject_id")).thenReturn("sub-1");
        when(row.getString("email")).thenReturn("a@b.com");
        when(row.getBoolean("onboarded")).thenReturn(false);
        when(row.getInstant("created_at")).thenReturn(CREATED);
        when(row.getInstant("updated_at")).thenReturn(CREATED);
        return row;
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("should read at the session's default consistency for a plain lookup")
        void plainLookupUsesDefaultConsistency() {
            final AsyncResultSet rs = resultWith(storedRow());
            when(session.executeAsync(plainRead)).thenReturn(CompletableFuture.completedFuture(rs));

            final var profile = repository.findById("sub-1").await().atMost(TIMEOUT).orElseThrow();

            assertEquals("a@b.com", profile.email());
            verify(plainRead, never()).setConsistencyLevel(any(ConsistencyLevel.class));
        }

        @Test
        @DisplayName("should read at LOCAL_SERIAL when the row may have just been won by another writer")
        void committedLookupUsesSerialConsistency() {
            final AsyncResultSet rs = resultWith(storedRow());
            when(session.executeAsync(serialRead)).thenReturn(CompletableFuture.completedFuture(rs));

            final var profile = repository.findCommitted("sub-1").await().atMost(TIMEOUT);

            assertTrue(profile.isPresent());
            verify(plainRead).setConsistencyLevel(DefaultConsistencyLevel.LOCAL_SERIAL);
            verify(session, never()).executeAsync(plainRead);
        }
    }

    @Nested
    @DisplayName("Conditional writes")
    class ConditionalWrites {

        @Test
        @DisplayName("should report a lost IF NOT EXISTS insert as a write conflict")
        void lostInsertIsConflict() {
            final var bound = mock(BoundStatement.class);
            when(insertStmt.bind(any(), any(), any(), any(), any())).thenReturn(bound);
            final var rs = mock(AsyncResultSet.class);
            when(rs.wasApplied()).thenReturn(false);
            when(session.executeAsync(bound)).thenReturn(CompletableFuture.completedFuture(rs));

            final var insert = repository.insert(Profile.newProfile("sub-1", "a@b.com", CREATED));

            assertThrows(ProfileWriteConflictException.class, () -> insert.await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should return the stored row at LOCAL_SERIAL after an onboarding update")
        void onboardingReReadsSerially() {
            final var bound = mock(BoundStatement.class);
            when(onboardingStmt.bind(any(), any(), any(), any())).thenReturn(bound);
            final var updated = mock(AsyncResultSet.class);
            when(updated.wasApplied()).thenReturn(true);
            when(session.executeAsync(bound)).thenReturn(CompletableFuture.completedFuture(updated));
            final AsyncResultSet reread = resultWith(storedRow());
            when(session.executeAsync(serialRead)).thenReturn(CompletableFuture.completedFuture(reread));

            final var profile = repository
                    .completeOnboarding("sub-1", "Ada", "buyer", CREATED.plusSeconds(60))
                    .await()
                    .atMost(TIMEOUT);

            assertTrue(profile.isPresent());
            verify(plainRead).setConsistencyLevel(DefaultConsistencyLevel.LOCAL_SERIAL);
        }
    }
}
