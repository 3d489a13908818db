package work.lcod.session.depmgr;

import work.lcod.session.job.Job;

/**
 * Raised when a job refers to a job id that is not known.
 */
public final class DependencyMissingException extends DependencyException {
    public enum DependencyType {
        DIRECT,
        RESOURCE
    }

    private final Job job;
    private final String missingJobId;
    private final DependencyType type;

    public DependencyMissingException(Job job, String missingJobId, DependencyType type) {
        super("missing dependency: '" + missingJobId + "' (" + type.name().toLowerCase() + ")");
        this.job = job;
        this.missingJobId = missingJobId;
        this.type = type;
    }

    public String missingJobId() {
        return missingJobId;
    }

    public DependencyType type() {
        return type;
    }

    @Override
    public Job affectedJob() {
        return job;
    }

    @Override
    public DependencyProblem problem() {
        return new DependencyProblem(DependencyProblem.Kind.MISSING, job, missingJobId, getMessage());
    }
}
