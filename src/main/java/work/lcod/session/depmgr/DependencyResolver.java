package work.lcod.session.depmgr;

import java.util.List;
import work.lcod.session.job.Job;

/**
 * Computes the ordered run list for a selection of jobs.
 */
public interface DependencyResolver {
    /**
     * Returns {@code visitList} and everything it depends on, directly or through resource
     * requirements, ordered so that every job comes after its dependencies.
     *
     * @param jobList all known jobs
     * @param visitList jobs to schedule, a subset of {@code jobList}
     * @throws DependencyException naming the first job that cannot be scheduled
     */
    List<Job> resolve(List<Job> jobList, List<Job> visitList);
}
