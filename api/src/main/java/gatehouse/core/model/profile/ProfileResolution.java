package gatehouse.core.model.profile;

/**
 * Result of a get-or-create against the profile store.
 *
 * @param profile the stored profile
 * @param created true if this call inserted it
 */
public record ProfileResolution(Profile profile, boolean created) {

    /**
     * Whether a profile existed before this login.
     */
    public boolean existedBefore() {
        return !created;
    }
}
