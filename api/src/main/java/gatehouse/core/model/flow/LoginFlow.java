package gatehouse.core.model.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import gatehouse.core.model.auth.AuthErrorKind;

/**
 * Tracks one login attempt through {@link LoginFlowState}.
 *
 * <p>Not thread-safe; a flow belongs to the single request handling it.
 */
public final class LoginFlow {

    private final List<LoginFlowState> trail = new ArrayList<>();
    private LoginFlowState state;
    private AuthErrorKind failure;

    private LoginFlow(LoginFlowState initial) {
        this.state = initial;
        this.trail.add(initial);
    }

    /**
     * A flow starting at login-initiation or credential submission.
     */
    public static LoginFlow start() {
        return new LoginFlow(LoginFlowState.INIT);
    }

    /**
     * A flow resumed by the provider redirecting back to the callback.
     */
    public static LoginFlow resumeFromProvider() {
        return new LoginFlow(LoginFlowState.AWAITING_PROVIDER);
    }

    /**
     * Move to the next state.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public LoginFlow advance(LoginFlowState next) {
        if (next == LoginFlowState.FAILED) {
            throw new IllegalArgumentException("Use fail() to enter FAILED");
        }
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal login flow transition " + state + " -> " + next);
        }
        state = next;
        trail.add(next);
        return this;
    }

    /**
     * Enter {@link LoginFlowState#FAILED} with the given kind.
     *
     * @throws IllegalStateException if the flow already ended
     */
    public LoginFlow fail(AuthErrorKind kind) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Login flow already ended in " + state);
        }
        state = LoginFlowState.FAILED;
        failure = kind;
        trail.add(LoginFlowState.FAILED);
        return this;
    }

    public LoginFlowState state() {
        return state;
    }

    public Optional<AuthErrorKind> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Every state visited, in order.
     */
    public List<LoginFlowState> trail() {
        return List.copyOf(trail);
    }
}
