package gatehouse.core.model.routing;

/**
 * Classification of a login by profile state.
 *
 * <ul>
 *   <li>{@link #NEW} - State A, no profile existed before this login</li>
 *   <li>{@link #INCOMPLETE} - State B, profile exists but onboarding is unfinished</li>
 *   <li>{@link #COMPLETE} - State C, onboarding finished</li>
 * </ul>
 */
public enum OnboardingState {
    NEW,
    INCOMPLETE,
    COMPLETE
}
