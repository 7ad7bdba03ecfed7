package gatehouse.core.model.routing;

/**
 * Navigation outcome for a successful login.
 *
 * @param state       which of the three profile states applied
 * @param destination where to send the user
 */
public record RoutingDecision(OnboardingState state, Destination destination) {}
