package work.lcod.session.depmgr;

import java.util.List;
import java.util.stream.Collectors;
import work.lcod.session.job.Job;

/**
 * Raised when jobs depend on each other in a loop. The cycle starts and ends with the same job.
 */
public final class DependencyCycleException extends DependencyException {
    private final List<Job> cycle;

    public DependencyCycleException(List<Job> cycle) {
        super("dependency cycle detected: " + cycle.stream().map(Job::id).collect(Collectors.joining(" -> ")));
        if (cycle.size() < 2 || !cycle.get(0).equals(cycle.get(cycle.size() - 1))) {
            throw new IllegalArgumentException("Not a cycle: " + cycle);
        }
        this.cycle = List.copyOf(cycle);
    }

    public List<Job> cycle() {
        return cycle;
    }

    @Override
    public Job affectedJob() {
        return cycle.get(0);
    }

    @Override
    public DependencyProblem problem() {
        return new DependencyProblem(DependencyProblem.Kind.CYCLE, affectedJob(), affectedJob().id(), getMessage());
    }
}
