package gatehouse.core.model.flow;

import gatehouse.core.model.auth.AuthErrorKind;
import gatehouse.core.model.auth.SubjectRef;

/**
 * Result of an email/password registration.
 */
public sealed interface SignupOutcome {

    /**
     * The provider registered the account.
     *
     * @param subject the new subject
     */
    record Registered(SubjectRef subject) implements SignupOutcome {}

    /**
     * Registration was rejected.
     *
     * @param kind classified failure
     */
    record Rejected(AuthErrorKind kind) implements SignupOutcome {}
}
