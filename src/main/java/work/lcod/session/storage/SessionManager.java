package work.lcod.session.storage;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.session.job.Job;
import work.lcod.session.resume.ResumeFlag;
import work.lcod.session.resume.ResumeOptions;
import work.lcod.session.resume.SessionResumeHelper;
import work.lcod.session.resume.SessionSuspendHelper;
import work.lcod.session.state.SessionState;

/**
 * Couples a {@link SessionState} with the {@link SessionStorage} it is checkpointed to.
 */
public final class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SessionState state;
    private final SessionStorage storage;

    public SessionManager(SessionState state, SessionStorage storage) {
        this.state = Objects.requireNonNull(state, "state");
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    /**
     * Starts a new session over {@code jobs} in a fresh storage of {@code repository}.
     */
    public static SessionManager create(SessionStorageRepository repository, List<Job> jobs) {
        var storage = repository.createStorage();
        log.debug("Created session manager in {}", storage.location());
        return new SessionManager(new SessionState(jobs), storage);
    }

    public static SessionManager load(List<Job> jobs, SessionStorage storage) {
        return load(jobs, storage, UnaryOperator.identity(), Set.of());
    }

    /**
     * Resumes the session checkpointed in {@code storage}; a storage without checkpoint yields a fresh session.
     */
    public static SessionManager load(
        List<Job> jobs,
        SessionStorage storage,
        UnaryOperator<SessionState> earlyCallback,
        Set<ResumeFlag> flags
    ) {
        var data = storage.loadCheckpoint();
        if (data.length == 0) {
            log.debug("No checkpoint in {}, starting a new session", storage.location());
            return new SessionManager(new SessionState(jobs), storage);
        }
        var helper = new SessionResumeHelper(jobs, new ResumeOptions(flags, storage.location()));
        return new SessionManager(helper.resume(data, earlyCallback), storage);
    }

    public SessionState state() {
        return state;
    }

    public SessionStorage storage() {
        return storage;
    }

    /**
     * Saves the current state. A stale lock left by an interrupted checkpoint is broken once.
     */
    public void checkpoint() {
        var data = new SessionSuspendHelper(storage.location()).suspend(state);
        try {
            storage.saveCheckpoint(data);
        } catch (LockedStorageException ex) {
            log.warn("Breaking stale checkpoint lock {}", ex.lockFile());
            storage.breakLock();
            storage.saveCheckpoint(data);
        }
    }

    /**
     * Removes every file of the session.
     */
    public void destroy() {
        storage.remove();
    }
}
