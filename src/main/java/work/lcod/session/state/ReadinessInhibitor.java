package work.lcod.session.state;

import java.util.Objects;
import work.lcod.session.job.Job;
import work.lcod.session.resource.ResourceExpression;

/**
 * Why a job cannot start. Every cause except {@link InhibitorCause#UNDESIRED} names the related job;
 * resource causes also carry the requirement expression that is not met.
 */
public record ReadinessInhibitor(InhibitorCause cause, Job relatedJob, ResourceExpression relatedExpression) {
    public static final ReadinessInhibitor UNDESIRED = new ReadinessInhibitor(InhibitorCause.UNDESIRED, null, null);

    public ReadinessInhibitor {
        Objects.requireNonNull(cause, "cause");
        if (cause != InhibitorCause.UNDESIRED && relatedJob == null) {
            throw new IllegalArgumentException("relatedJob is required when cause is " + cause);
        }
        if (cause.isResourceCause() && relatedExpression == null) {
            throw new IllegalArgumentException("relatedExpression is required when cause is " + cause);
        }
    }

    public static ReadinessInhibitor pendingDependency(Job dependency) {
        return new ReadinessInhibitor(InhibitorCause.PENDING_DEP, dependency, null);
    }

    public static ReadinessInhibitor failedDependency(Job dependency) {
        return new ReadinessInhibitor(InhibitorCause.FAILED_DEP, dependency, null);
    }

    public static ReadinessInhibitor pendingResource(Job resourceJob, ResourceExpression expression) {
        return new ReadinessInhibitor(InhibitorCause.PENDING_RESOURCE, resourceJob, expression);
    }

    public static ReadinessInhibitor failedResource(Job resourceJob, ResourceExpression expression) {
        return new ReadinessInhibitor(InhibitorCause.FAILED_RESOURCE, resourceJob, expression);
    }

    /**
     * Human readable explanation, suitable for operators.
     */
    public String description() {
        return switch (cause) {
            case UNDESIRED -> "undesired";
            case PENDING_DEP -> "required dependency '" + relatedJob.id() + "' did not run yet";
            case FAILED_DEP -> "required dependency '" + relatedJob.id() + "' has failed";
            case PENDING_RESOURCE -> "resource job '" + relatedJob.id() + "' did not run yet, requirement '"
                + relatedExpression.text() + "' cannot be evaluated";
            case FAILED_RESOURCE -> "resource requirement '" + relatedExpression.text() + "' is not met by '"
                + relatedJob.id() + "'";
        };
    }

    @Override
    public String toString() {
        return cause + ": " + description();
    }
}
