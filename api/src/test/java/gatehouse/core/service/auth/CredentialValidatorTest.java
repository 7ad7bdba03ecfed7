package gatehouse.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import gatehouse.core.config.LoginConfig;

@DisplayName("CredentialValidator")
class CredentialValidatorTest {

    private CredentialValidator validator;

    @BeforeEach
    void setUp() {
        final var config = mock(LoginConfig.class);
        when(config.minPasswordLength()).thenReturn(6);
        validator = new CredentialValidator(config);
    }

    @Test
    @DisplayName("should trim and lower-case emails")
    void shouldNormalizeEmail() {
        assertEquals(Optional.of("a@b.com"), validator.normalizeEmail("  A@B.Com "));
        assertTrue(validator.normalizeEmail("   ").isEmpty());
        assertTrue(validator.normalizeEmail(null).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"a@b.com", "first.last@example.co.uk", "x+tag@domain.io"})
    @DisplayName("should accept well-formed emails")
    void shouldAcceptValidEmails(String email) {
        assertTrue(validator.isValidEmail(email));
    }

    @ParameterizedTest
    @ValueSource(strings = {"plainaddress", "a@b", "@b.com", "a b@c.com", "a@b@c.com"})
    @DisplayName("should reject malformed emails")
    void shouldRejectInvalidEmails(String email) {
        assertFalse(validator.isValidEmail(email));
    }

    @Test
    @DisplayName("should enforce the minimum password length")
    void shouldEnforcePasswordLength() {
        assertFalse(validator.isValidPassword(null));
        assertFalse(validator.isValidPassword("12345"));
        assertTrue(validator.isValidPassword("123456"));
    }
}
