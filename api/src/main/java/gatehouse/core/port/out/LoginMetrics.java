package gatehouse.core.port.out;

/**
 * Port interface for recording login metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface LoginMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record the start of a login attempt.
     *
     * @param method oauth or password
     */
    void recordAttempt(String method);

    /**
     * Record how a login attempt ended.
     *
     * @param method  oauth or password
     * @param outcome onboarding state on success, error code on failure
     */
    void recordOutcome(String method, String outcome);

    /**
     * Record a profile row being created.
     */
    void recordProfileCreated();

    /**
     * Record a concurrent-insert conflict that was recovered by re-reading.
     */
    void recordProfileConflict();
}
