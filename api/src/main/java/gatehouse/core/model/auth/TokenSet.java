package gatehouse.core.model.auth;

import java.time.Instant;

/**
 * Credentials issued by the identity provider for one authenticated subject.
 *
 * <p>Owned by the request that produced it until handed to the cookie issuer.
 * Never persisted server-side.
 *
 * @param accessToken  short-lived bearer credential
 * @param refreshToken long-lived credential used to obtain a new access token
 * @param subjectId    provider-assigned stable user identifier
 * @param email        email address reported by the provider
 * @param provider     upstream identity provider (e.g. google, email)
 * @param issuedAt     when this set was received
 * @param expiresIn    access token lifetime in seconds as reported by the provider
 */
public record TokenSet(
        String accessToken,
        String refreshToken,
        String subjectId,
        String email,
        String provider,
        Instant issuedAt,
        long expiresIn) {

    public TokenSet {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or blank");
        }
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new IllegalArgumentException("Refresh token cannot be null or blank");
        }
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        if (issuedAt == null) {
            issuedAt = Instant.now();
        }
    }

    /**
     * The subject this token set was issued to.
     */
    public SubjectRef subject() {
        return new SubjectRef(subjectId, email, provider);
    }

    @Override
    public String toString() {
        return "TokenSet[subjectId=" + subjectId + ", provider=" + provider + ", expiresIn=" + expiresIn + "]";
    }
}
