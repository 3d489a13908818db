package work.lcod.session.depmgr;

import work.lcod.session.job.Job;

/**
 * Raised when two different definitions share the same id. Carries both of them.
 */
public final class DuplicateJobException extends DependencyException {
    private final Job job;
    private final Job duplicateJob;

    public DuplicateJobException(Job job, Job duplicateJob) {
        super("duplicate job id: '" + job.id() + "' (checksums " + job.checksum().substring(0, 12)
            + " and " + duplicateJob.checksum().substring(0, 12) + ")");
        if (!job.id().equals(duplicateJob.id())) {
            throw new IllegalArgumentException("Jobs " + job.id() + " and " + duplicateJob.id() + " do not clash");
        }
        this.job = job;
        this.duplicateJob = duplicateJob;
    }

    /**
     * The job already known.
     */
    public Job job() {
        return job;
    }

    /**
     * The job clashing with {@link #job()}.
     */
    public Job duplicateJob() {
        return duplicateJob;
    }

    @Override
    public Job affectedJob() {
        return job;
    }

    @Override
    public DependencyProblem problem() {
        return new DependencyProblem(DependencyProblem.Kind.DUPLICATE, job, duplicateJob.id(), getMessage());
    }
}
