package work.lcod.session.state;

/**
 * Reasons a job cannot start.
 */
public enum InhibitorCause {
    /** The job was not selected to run. */
    UNDESIRED,
    /** A dependency did not run yet. */
    PENDING_DEP,
    /** A dependency ran and did not pass. */
    FAILED_DEP,
    /** The resource job a requirement needs did not produce data yet. */
    PENDING_RESOURCE,
    /** A requirement evaluated to false against the available resource data. */
    FAILED_RESOURCE;

    public boolean isResourceCause() {
        return this == PENDING_RESOURCE || this == FAILED_RESOURCE;
    }
}
