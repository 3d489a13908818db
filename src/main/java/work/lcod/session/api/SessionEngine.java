package work.lcod.session.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import work.lcod.session.job.Job;
import work.lcod.session.resume.ResumeOptions;
import work.lcod.session.resume.SessionPeek;
import work.lcod.session.resume.SessionResumeHelper;
import work.lcod.session.state.DurationEstimate;
import work.lcod.session.state.SessionState;
import work.lcod.session.storage.SessionManager;
import work.lcod.session.storage.SessionStorage;
import work.lcod.session.storage.SessionStorageRepository;

/**
 * Public entry point for embedding the session engine with a given configuration.
 */
public final class SessionEngine {
    private final SessionEngineConfiguration configuration;

    public SessionEngine(SessionEngineConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public SessionEngineConfiguration configuration() {
        return configuration;
    }

    public SessionStorageRepository repository() {
        return new SessionStorageRepository(configuration.storageLocation());
    }

    public SessionManager createSession(List<Job> jobs) {
        return SessionManager.create(repository(), jobs);
    }

    public SessionManager loadSession(List<Job> jobs, SessionStorage storage) {
        return SessionManager.load(jobs, storage, session -> session, configuration.resumeFlags());
    }

    /**
     * Resumes serialized session data whose relative IO log paths resolve against {@code location}.
     */
    public SessionState resume(List<Job> jobs, byte[] data, Path location) {
        var options = new ResumeOptions(configuration.resumeFlags(), location);
        return new SessionResumeHelper(jobs, options).resume(data);
    }

    public SessionPeek peek(byte[] data) {
        return new SessionResumeHelper(List.of()).peek(data);
    }

    public DurationEstimate estimate(SessionState session) {
        return session.estimatedDuration(configuration.manualOverhead());
    }
}
