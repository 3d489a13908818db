package work.lcod.session.depmgr;

import work.lcod.session.job.Job;

/**
 * Dependency problem reported as data: the job that cannot be scheduled and the id of the job causing it.
 *
 * @param affectingJobId id of the offending job, {@code null} when unknown
 */
public record DependencyProblem(Kind kind, Job affectedJob, String affectingJobId, String message) {
    public enum Kind {
        CYCLE,
        MISSING,
        DUPLICATE
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " problem for " + affectedJob.id() + ": " + message;
    }
}
