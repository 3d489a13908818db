package work.lcod.session.resume;

/**
 * Optional checks and repairs applied while resuming.
 */
public enum ResumeFlag {
    /** Check that disk IO logs referenced by results exist. */
    VALIDATE_REFERENCES,
    /** Retarget legacy absolute IO log paths at the current session location. Implies {@link #VALIDATE_REFERENCES}. */
    REWRITE_LEGACY_PATHNAMES,
    /** Only log job definitions that changed since the session was saved. */
    IGNORE_CHECKSUMS
}
