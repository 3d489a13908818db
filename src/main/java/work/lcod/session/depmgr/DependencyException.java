package work.lcod.session.depmgr;

import work.lcod.session.job.Job;

/**
 * Base class of dependency errors. Each one names the job it affects.
 */
public abstract class DependencyException extends RuntimeException {
    protected DependencyException(String message) {
        super(message);
    }

    /**
     * Job that cannot be scheduled because of this error.
     */
    public abstract Job affectedJob();

    public abstract DependencyProblem problem();
}
