package gatehouse.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

import gatehouse.core.model.auth.PkcePair;

/**
 * Generates PKCE verifier/challenge pairs and opaque session handles.
 *
 * <p>Implements the client side of RFC 7636. Only the S256 challenge method
 * is produced; plain is never used.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String CHALLENGE_METHOD = "s256";

    private static final int VERIFIER_BYTES = 64;
    private static final int HANDLE_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    /**
     * Generate a fresh verifier and its S256 challenge.
     *
     * <p>The verifier is 86 characters of URL-safe base64, inside the 43-128
     * range RFC 7636 allows.
     *
     * @return new pair; never reused
     */
    public PkcePair generatePair() {
        final var verifier = randomUrlSafe(VERIFIER_BYTES);
        return new PkcePair(verifier, challengeFor(verifier));
    }

    /**
     * Compute BASE64URL(SHA256(verifier)) without padding.
     *
     * @param verifier The code verifier
     * @return S256 challenge
     */
    public String challengeFor(String verifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is required by the Java spec
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Generate an unguessable handle for the PKCE session cookie.
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateHandle() {
        return randomUrlSafe(HANDLE_BYTES);
    }

    private static String randomUrlSafe(int length) {
        final var bytes = new byte[length];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
