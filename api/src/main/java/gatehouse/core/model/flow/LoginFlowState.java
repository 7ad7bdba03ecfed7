package gatehouse.core.model.flow;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a single login flow instance.
 *
 * <p>OAuth: {@code INIT -> AWAITING_PROVIDER -> CODE_RECEIVED -> EXCHANGING -> PROFILE_RESOLVED -> ROUTED}.
 * Password: {@code INIT -> EXCHANGING -> PROFILE_RESOLVED -> ROUTED}. Any non-terminal
 * state may move to {@code FAILED}.
 */
public enum LoginFlowState {
    INIT,
    AWAITING_PROVIDER,
    CODE_RECEIVED,
    EXCHANGING,
    PROFILE_RESOLVED,
    ROUTED,
    FAILED;

    /**
     * Whether the flow has ended.
     */
    public boolean isTerminal() {
        return this == ROUTED || this == FAILED;
    }

    /**
     * States reachable in one step from this one.
     */
    public Set<LoginFlowState> successors() {
        return switch (this) {
            case INIT -> EnumSet.of(AWAITING_PROVIDER, EXCHANGING, FAILED);
            case AWAITING_PROVIDER -> EnumSet.of(CODE_RECEIVED, FAILED);
            case CODE_RECEIVED -> EnumSet.of(EXCHANGING, FAILED);
            case EXCHANGING -> EnumSet.of(PROFILE_RESOLVED, FAILED);
            case PROFILE_RESOLVED -> EnumSet.of(ROUTED, FAILED);
            case ROUTED, FAILED -> EnumSet.noneOf(LoginFlowState.class);
        };
    }

    public boolean canTransitionTo(LoginFlowState next) {
        return successors().contains(next);
    }
}
