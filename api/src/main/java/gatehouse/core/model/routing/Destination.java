package gatehouse.core.model.routing;

/**
 * Where a signed-in user is sent next.
 */
public enum Destination {
    ONBOARDING,
    DASHBOARD
}
