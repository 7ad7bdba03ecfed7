package gatehouse;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import gatehouse.core.model.profile.Profile;
import gatehouse.core.port.out.ProfileRepository;
import gatehouse.mock.MockIdentityProviderClient;

/**
 * Integration tests for onboarding completion.
 */
@QuarkusTest
@DisplayName("Onboarding Resource Tests")
public class OnboardingResourceTest {

    @Inject
    MockIdentityProviderClient provider;

    @Inject
    ProfileRepository profiles;

    private String signedInWithProfile(String subject) {
        profiles.insert(Profile.newProfile(subject, "o@example.com", Instant.now())).await().indefinitely();
        return provider.givenAccount("o-" + subject + "@example.com", "secret1", subject).accessToken();
    }

    @Test
    @DisplayName("should mark the profile onboarded and point to the dashboard")
    void shouldCompleteOnboarding() {
        final var subject = "sub-" + UUID.randomUUID();
        final var accessToken = signedInWithProfile(subject);

        given().cookie("access-token", accessToken)
                .contentType(ContentType.JSON)
                .body(Map.of("fullName", "Ada Lovelace", "role", "seller"))
                .when()
                .post("/api/onboarding/complete")
                .then()
                .statusCode(200)
                .body("next", equalTo("/dashboard"));

        final var profile = profiles.findById(subject).await().indefinitely().orElseThrow();
        assertTrue(profile.onboarded());
        assertEquals("Ada Lovelace", profile.displayName());
        assertEquals("seller", profile.role());
    }

    @Test
    @DisplayName("should require an authenticated subject")
    void shouldRequireAuthentication() {
        given().contentType(ContentType.JSON)
                .body(Map.of("fullName", "Ada", "role", "buyer"))
                .when()
                .post("/api/onboarding/complete")
                .then()
                .statusCode(401);
    }

    @Test
    @DisplayName("should reject a role outside the allowed set")
    void shouldRejectUnknownRole() {
        final var accessToken = signedInWithProfile("sub-" + UUID.randomUUID());

        given().cookie("access-token", accessToken)
                .contentType(ContentType.JSON)
                .body(Map.of("fullName", "Ada", "role", "admin"))
                .when()
                .post("/api/onboarding/complete")
                .then()
                .statusCode(400);
    }

    @Test
    @DisplayName("should return 404 when the subject has no profile")
    void shouldReturnNotFoundWithoutProfile() {
        final var subject = "sub-" + UUID.randomUUID();
        final var accessToken = provider.givenAccount("n-" + subject + "@example.com", "secret1", subject).accessToken();

        given().cookie("access-token", accessToken)
                .contentType(ContentType.JSON)
                .body(Map.of("fullName", "Ada", "role", "buyer"))
                .when()
                .post("/api/onboarding/complete")
                .then()
                .statusCode(404);
    }
}
