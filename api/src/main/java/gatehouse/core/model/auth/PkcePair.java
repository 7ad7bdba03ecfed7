package gatehouse.core.model.auth;

/**
 * A PKCE verifier and its S256 challenge for exactly one login attempt.
 *
 * @param verifier  secret kept server-side until the code exchange
 * @param challenge BASE64URL(SHA-256(verifier)), sent to the provider
 */
public record PkcePair(String verifier, String challenge) {

    @Override
    public String toString() {
        return "PkcePair[challenge=" + challenge + "]";
    }
}
