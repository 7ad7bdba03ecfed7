package gatehouse.adapter.in.dto;

/**
 * Request body for completing onboarding.
 *
 * @param fullName display name entered by the user
 * @param role     chosen role
 */
public record OnboardingRequest(String fullName, String role) {}
