package gatehouse.core.model.auth;

/**
 * Reference to an authenticated subject without any credentials attached.
 *
 * @param subjectId provider-assigned identifier
 * @param email     email address, may be null for providers that do not share it
 * @param provider  upstream provider name, may be null
 */
public record SubjectRef(String subjectId, String email, String provider) {

    public SubjectRef {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
    }
}
