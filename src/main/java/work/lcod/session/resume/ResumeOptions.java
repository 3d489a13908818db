package work.lcod.session.resume;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;

/**
 * Flags and the current session location (the directory relative IO log paths resolve against).
 *
 * @param location session directory, may be {@code null}
 */
public record ResumeOptions(Set<ResumeFlag> flags, Path location) {
    public ResumeOptions {
        flags = flags == null || flags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(flags));
    }

    public static ResumeOptions defaults() {
        return new ResumeOptions(Set.of(), null);
    }

    public static ResumeOptions of(Path location, ResumeFlag... flags) {
        return new ResumeOptions(Set.of(flags), location);
    }

    public boolean validateReferences() {
        return flags.contains(ResumeFlag.VALIDATE_REFERENCES) || rewriteLegacyPathnames();
    }

    public boolean rewriteLegacyPathnames() {
        return flags.contains(ResumeFlag.REWRITE_LEGACY_PATHNAMES);
    }

    public boolean ignoreChecksums() {
        return flags.contains(ResumeFlag.IGNORE_CHECKSUMS);
    }
}
