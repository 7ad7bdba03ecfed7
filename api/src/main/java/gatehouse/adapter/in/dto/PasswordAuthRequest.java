package gatehouse.adapter.in.dto;

/**
 * Request body for email/password login and signup.
 *
 * @param email    email address
 * @param password password
 * @param action   {@code login} or {@code signup}
 */
public record PasswordAuthRequest(String email, String password, String action) {

    @Override
    public String toString() {
        return "PasswordAuthRequest[action=" + action + "]";
    }
}
