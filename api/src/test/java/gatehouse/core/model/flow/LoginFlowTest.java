package gatehouse.core.model.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import gatehouse.core.model.auth.AuthErrorKind;

@DisplayName("LoginFlow")
class LoginFlowTest {

    @Nested
    @DisplayName("transitions")
    class TransitionTests {

        @Test
        @DisplayName("should walk the full OAuth path")
        void shouldWalkOAuthPath() {
            final var flow = LoginFlow.start()
                    .advance(LoginFlowState.AWAITING_PROVIDER)
                    .advance(LoginFlowState.CODE_RECEIVED)
                    .advance(LoginFlowState.EXCHANGING)
                    .advance(LoginFlowState.PROFILE_RESOLVED)
                    .advance(LoginFlowState.ROUTED);

            assertEquals(LoginFlowState.ROUTED, flow.state());
            assertEquals(6, flow.trail().size());
            assertTrue(flow.failure().isEmpty());
        }

        @Test
        @DisplayName("should allow the password shortcut from INIT to EXCHANGING")
        void shouldAllowPasswordShortcut() {
            final var flow = LoginFlow.start().advance(LoginFlowState.EXCHANGING);

            assertEquals(List.of(LoginFlowState.INIT, LoginFlowState.EXCHANGING), flow.trail());
        }

        @Test
        @DisplayName("should reject skipping the exchange")
        void shouldRejectSkippingExchange() {
            final var flow = LoginFlow.resumeFromProvider().advance(LoginFlowState.CODE_RECEIVED);

            assertThrows(IllegalStateException.class, () -> flow.advance(LoginFlowState.PROFILE_RESOLVED));
        }

        @Test
        @DisplayName("should require fail() to enter FAILED")
        void shouldRequireFailForFailed() {
            assertThrows(IllegalArgumentException.class, () -> LoginFlow.start().advance(LoginFlowState.FAILED));
        }
    }

    @Nested
    @DisplayName("fail()")
    class FailTests {

        @Test
        @DisplayName("should record the failure kind")
        void shouldRecordKind() {
            final var flow = LoginFlow.resumeFromProvider().fail(AuthErrorKind.SESSION_EXPIRED);

            assertEquals(LoginFlowState.FAILED, flow.state());
            assertEquals(AuthErrorKind.SESSION_EXPIRED, flow.failure().orElseThrow());
            assertEquals(List.of(LoginFlowState.AWAITING_PROVIDER, LoginFlowState.FAILED), flow.trail());
        }

        @Test
        @DisplayName("should not leave a terminal state")
        void shouldStayTerminal() {
            final var routed = LoginFlow.start()
                    .advance(LoginFlowState.EXCHANGING)
                    .advance(LoginFlowState.PROFILE_RESOLVED)
                    .advance(LoginFlowState.ROUTED);
            final var failed = LoginFlow.start().fail(AuthErrorKind.VALIDATION_ERROR);

            assertThrows(IllegalStateException.class, () -> routed.fail(AuthErrorKind.SERVER_ERROR));
            assertThrows(IllegalStateException.class, () -> failed.advance(LoginFlowState.EXCHANGING));
        }
    }
}
