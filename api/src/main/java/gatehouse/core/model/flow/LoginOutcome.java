package gatehouse.core.model.flow;

import java.util.List;

import gatehouse.core.model.auth.AuthErrorKind;
import gatehouse.core.model.auth.TokenSet;
import gatehouse.core.model.routing.RoutingDecision;

/**
 * Terminal result of a login flow.
 */
public sealed interface LoginOutcome {

    /**
     * States the flow passed through.
     */
    List<LoginFlowState> trail();

    /**
     * The flow reached {@link LoginFlowState#ROUTED}.
     *
     * @param tokens   credentials to hand to the cookie issuer
     * @param decision where to send the user
     * @param trail    visited states
     */
    record Routed(TokenSet tokens, RoutingDecision decision, List<LoginFlowState> trail) implements LoginOutcome {}

    /**
     * The flow reached {@link LoginFlowState#FAILED}.
     *
     * @param kind  why it failed
     * @param trail visited states
     */
    record Failed(AuthErrorKind kind, List<LoginFlowState> trail) implements LoginOutcome {}

    static LoginOutcome routed(TokenSet tokens, RoutingDecision decision, LoginFlow flow) {
        return new Routed(tokens, decision, flow.trail());
    }

    static LoginOutcome failed(LoginFlow flow) {
        return new Failed(flow.failure().orElse(AuthErrorKind.SERVER_ERROR), flow.trail());
    }
}
