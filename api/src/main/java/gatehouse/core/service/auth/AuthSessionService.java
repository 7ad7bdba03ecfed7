package gatehouse.core.service.auth;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gatehouse.core.config.PkceConfig;
import gatehouse.core.port.out.AuthSessionRepository;

/**
 * Holds PKCE verifiers between login-initiate and the provider callback.
 *
 * <p>Each verifier is stored under a fresh handle with the configured TTL and
 * can be taken exactly once.
 */
@ApplicationScoped
public class AuthSessionService {

    private static final Logger LOG = Logger.getLogger(AuthSessionService.class);

    private final AuthSessionRepository repository;
    private final PkceService pkceService;
    private final PkceConfig config;

    @Inject
    public AuthSessionService(AuthSessionRepository repository, PkceService pkceService, PkceConfig config) {
        this.repository = repository;
        this.pkceService = pkceService;
        this.config = config;
    }

    /**
     * Store a verifier under a newly generated handle.
     *
     * @param verifier PKCE code verifier (must not be null or blank)
     * @return Uni with the handle
     * @throws IllegalArgumentException if verifier is null or blank
     */
    public Uni<String> put(String verifier) {
        if (verifier == null || verifier.isBlank()) {
            throw new IllegalArgumentException("verifier must not be null or blank");
        }
        final var handle = pkceService.generateHandle();
        return repository
                .store(handle, verifier, config.ttl())
                .invoke(() -> LOG.debugf("Stored PKCE session with TTL %s", config.ttl()))
                .replaceWith(handle);
    }

    /**
     * Atomically retrieve and delete the verifier for a handle.
     *
     * @param handle handle from the PKCE session cookie, may be null
     * @return Uni with the verifier, or empty if missing, expired or already taken
     */
    public Uni<Optional<String>> take(String handle) {
        if (handle == null || handle.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return repository.consume(handle).invoke(verifier -> {
            if (verifier.isEmpty()) {
                LOG.debug("PKCE session not found or already consumed");
            }
        });
    }
}
