package work.lcod.session.api;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import work.lcod.session.resume.ResumeFlag;
import work.lcod.session.state.SessionState;
import work.lcod.session.storage.SessionStorageRepository;

/**
 * Immutable configuration of the session engine.
 *
 * @param manualOverhead seconds added per manual job when estimating run time
 * @param resumeFlags checks and repairs applied when resuming sessions
 * @param storageLocation directory holding session storages
 */
public record SessionEngineConfiguration(double manualOverhead, Set<ResumeFlag> resumeFlags, Path storageLocation) {
    public SessionEngineConfiguration {
        if (manualOverhead < 0 || Double.isNaN(manualOverhead)) {
            throw new IllegalArgumentException("manualOverhead must be a non-negative number: " + manualOverhead);
        }
        Objects.requireNonNull(resumeFlags, "resumeFlags");
        Objects.requireNonNull(storageLocation, "storageLocation");
        resumeFlags = resumeFlags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(resumeFlags));
    }

    public static SessionEngineConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        var builder = new Builder().manualOverhead(manualOverhead).storageLocation(storageLocation);
        resumeFlags.forEach(flag -> builder.resumeFlag(flag, true));
        return builder;
    }

    public static final class Builder {
        private double manualOverhead = SessionState.DEFAULT_MANUAL_OVERHEAD;
        private final Set<ResumeFlag> resumeFlags = EnumSet.noneOf(ResumeFlag.class);
        private Path storageLocation;

        public Builder manualOverhead(double manualOverhead) {
            this.manualOverhead = manualOverhead;
            return this;
        }

        public Builder resumeFlag(ResumeFlag flag, boolean enabled) {
            if (enabled) {
                resumeFlags.add(flag);
            } else {
                resumeFlags.remove(flag);
            }
            return this;
        }

        public Builder storageLocation(Path storageLocation) {
            this.storageLocation = storageLocation;
            return this;
        }

        public SessionEngineConfiguration build() {
            return new SessionEngineConfiguration(
                manualOverhead,
                resumeFlags,
                storageLocation != null ? storageLocation : SessionStorageRepository.defaultLocation()
            );
        }
    }
}
