package work.lcod.session.depmgr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.session.job.Job;

/**
 * Depth-first dependency solver. Given the same input it always produces the same order.
 */
public final class DependencySolver implements DependencyResolver {
    private static final Logger log = LoggerFactory.getLogger(DependencySolver.class);

    private enum Color { WHITE, GRAY, BLACK }

    @Override
    public List<Job> resolve(List<Job> jobList, List<Job> visitList) {
        return new Run(jobList).solve(visitList == null ? jobList : visitList);
    }

    private static final class Run {
        private final Map<String, Job> jobMap = new LinkedHashMap<>();
        private final Map<String, Color> colors = new HashMap<>();
        private final List<Job> solution = new ArrayList<>();

        Run(List<Job> jobList) {
            for (var job : jobList) {
                var existing = jobMap.putIfAbsent(job.id(), job);
                if (existing != null) {
                    throw new DuplicateJobException(existing, job);
                }
                colors.put(job.id(), Color.WHITE);
            }
        }

        List<Job> solve(List<Job> visitList) {
            log.debug("Solving dependencies of {} job(s)", visitList.size());
            for (var job : visitList) {
                var trail = new ArrayList<Job>();
                trail.add(job);
                visit(job, trail);
            }
            return solution;
        }

        private void visit(Job job, List<Job> trail) {
            var color = colors.get(job.id());
            if (color == null) {
                throw new IllegalArgumentException("Job " + job.id() + " is not part of the job list");
            }
            switch (color) {
                case WHITE -> {
                    colors.put(job.id(), Color.GRAY);
                    for (var depId : job.dependencies()) {
                        visitDependency(job, depId, DependencyMissingException.DependencyType.DIRECT, trail);
                    }
                    for (var resourceId : job.resourceDependencies()) {
                        visitDependency(job, resourceId, DependencyMissingException.DependencyType.RESOURCE, trail);
                    }
                    colors.put(job.id(), Color.BLACK);
                    solution.add(job);
                }
                case GRAY -> {
                    int start = trail.indexOf(job);
                    throw new DependencyCycleException(new ArrayList<>(trail.subList(start, trail.size())));
                }
                case BLACK -> {
                    // already in the solution
                }
            }
        }

        private void visitDependency(Job job, String depId, DependencyMissingException.DependencyType type, List<Job> trail) {
            var next = jobMap.get(depId);
            if (next == null) {
                throw new DependencyMissingException(job, depId, type);
            }
            trail.add(next);
            visit(next, trail);
            trail.remove(trail.size() - 1);
        }
    }
}
