package gatehouse.adapter.in.dto;

/**
 * Non-secret session details returned after a password login.
 *
 * <p>Tokens travel only in HttpOnly cookies, never in this body.
 */
public record SessionInfo(String userId, String email, long expiresIn) {}
