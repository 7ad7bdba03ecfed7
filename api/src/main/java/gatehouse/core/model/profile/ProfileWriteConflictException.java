package gatehouse.core.model.profile;

/**
 * Raised by a profile store when an insert loses to an existing row with the same subject.
 *
 * <p>Never surfaced to clients; the resolver recovers by re-reading.
 */
public class ProfileWriteConflictException extends RuntimeException {

    private final String subjectId;

    public ProfileWriteConflictException(String subjectId) {
        super("Profile already exists for subject " + subjectId);
        this.subjectId = subjectId;
    }

    public String subjectId() {
        return subjectId;
    }
}
