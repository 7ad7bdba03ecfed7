package gatehouse.core.service.routing;

import jakarta.enterprise.context.ApplicationScoped;

import gatehouse.core.model.routing.Destination;
import gatehouse.core.model.routing.OnboardingState;
import gatehouse.core.model.routing.RoutingDecision;

/**
 * Maps profile state to the post-login destination ("3-state logic").
 *
 * <table>
 *   <caption>Routing table</caption>
 *   <tr><th>profile exists</th><th>onboarded</th><th>destination</th></tr>
 *   <tr><td>no</td><td>any</td><td>onboarding (new)</td></tr>
 *   <tr><td>yes</td><td>false</td><td>onboarding (incomplete)</td></tr>
 *   <tr><td>yes</td><td>true</td><td>dashboard (complete)</td></tr>
 * </table>
 */
@ApplicationScoped
public class RoutingDecisionEngine {

    public RoutingDecision decide(boolean profileExists, boolean onboarded) {
        if (!profileExists) {
            return new RoutingDecision(OnboardingState.NEW, Destination.ONBOARDING);
        }
        if (!onboarded) {
            return new RoutingDecision(OnboardingState.INCOMPLETE, Destination.ONBOARDING);
        }
        return new RoutingDecision(OnboardingState.COMPLETE, Destination.DASHBOARD);
    }
}
