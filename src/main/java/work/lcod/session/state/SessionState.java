package work.lcod.session.state;

import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.session.depmgr.DependencyException;
import work.lcod.session.depmgr.DependencyProblem;
import work.lcod.session.depmgr.DependencyResolver;
import work.lcod.session.depmgr.DependencySolver;
import work.lcod.session.depmgr.DuplicateJobException;
import work.lcod.session.job.Job;
import work.lcod.session.job.PluginKind;
import work.lcod.session.result.JobResult;
import work.lcod.session.result.Outcome;
import work.lcod.session.resource.RecordParser;
import work.lcod.session.resource.ResourceProgram;
import work.lcod.session.resource.ResourceRecord;
import work.lcod.session.resource.Rfc822RecordParser;

/**
 * State of a testing session: the known jobs, which of them are desired, the ordered run list, the
 * results collected so far and the resource data they produced.
 *
 * <p>Not thread safe; callers serialize access.
 */
public final class SessionState {
    private static final Logger log = LoggerFactory.getLogger(SessionState.class);

    public static final double DEFAULT_MANUAL_OVERHEAD = 30.0;

    private final DependencyResolver resolver;
    private final RecordParser parser;
    private final List<Job> jobList = new ArrayList<>();
    private final Map<String, JobState> jobStateMap = new LinkedHashMap<>();
    private final Map<String, List<ResourceRecord>> resourceMap = new LinkedHashMap<>();
    private final SessionMetadata metadata = new SessionMetadata();
    private final SessionEvents events = new SessionEvents();
    private List<Job> desiredJobList = List.of();
    private List<Job> mandatoryJobList = List.of();
    private List<Job> runList = List.of();

    public SessionState(List<Job> jobs) {
        this(jobs, new DependencySolver(), new Rfc822RecordParser());
    }

    /**
     * @throws DuplicateJobException if two different definitions share an id
     */
    public SessionState(List<Job> jobs, DependencyResolver resolver, RecordParser parser) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.parser = Objects.requireNonNull(parser, "parser");
        for (var job : jobs) {
            var existing = jobStateMap.get(job.id());
            if (existing == null) {
                jobStateMap.put(job.id(), new JobState(job));
                jobList.add(job);
            } else if (!existing.job().equals(job)) {
                throw new DuplicateJobException(existing.job(), job);
            }
        }
        recomputeReadiness();
    }

    /**
     * Replaces the mandatory jobs. They join the desired jobs on the next {@link #updateDesiredJobList}.
     */
    public void updateMandatoryJobList(List<Job> mandatory) {
        requireKnown(mandatory);
        this.mandatoryJobList = List.copyOf(mandatory);
        publish("updateMandatoryJobList", List.of());
    }

    public List<DependencyProblem> updateDesiredJobList(List<Job> desired) {
        return updateDesiredJobList(desired, true);
    }

    /**
     * Selects the jobs to run and recomputes the run list.
     *
     * <p>Jobs that cannot be scheduled are dropped from the desired list one at a time until the rest
     * resolves. Each dropped job is reported as a problem; nothing is thrown for dependency errors.
     *
     * @param includeMandatory whether mandatory jobs are put in front of the desired ones
     */
    public List<DependencyProblem> updateDesiredJobList(List<Job> desired, boolean includeMandatory) {
        requireKnown(desired);
        var effective = new ArrayList<Job>();
        if (includeMandatory) {
            effective.addAll(mandatoryJobList);
        }
        for (var job : desired) {
            if (!effective.contains(job)) {
                effective.add(job);
            }
        }
        var problems = new ArrayList<DependencyProblem>();
        List<Job> solution = List.of();
        while (!effective.isEmpty()) {
            try {
                solution = resolver.resolve(Collections.unmodifiableList(jobList), List.copyOf(effective));
                break;
            } catch (DependencyException ex) {
                log.debug("Dropping job from the desired list: {}", ex.getMessage());
                problems.add(ex.problem());
                dropAffected(effective, ex.affectedJob());
            }
        }
        this.desiredJobList = List.copyOf(effective);
        this.runList = List.copyOf(solution);
        recomputeReadiness();
        publish("updateDesiredJobList", List.of());
        return problems;
    }

    /**
     * Stores the result of a job. Resource jobs refresh their resource records; local jobs may add
     * the jobs they generated to the session.
     */
    public void updateJobResult(Job job, JobResult result) {
        Objects.requireNonNull(result, "result");
        var state = requireState(job);
        var previous = state.result();
        state.setResult(result);
        var details = new ArrayList<SessionEvents.Event>();
        details.add(new SessionEvents.JobResultChanged(job, previous, result));
        List<Job> generated = switch (job.plugin()) {
            case RESOURCE -> {
                processResourceResult(job, result);
                yield List.of();
            }
            case LOCAL -> processLocalResult(job, result);
            case SHELL, ATTACHMENT, MANUAL, USER_INTERACT, USER_VERIFY, USER_INTERACT_VERIFY -> List.of();
        };
        for (var added : generated) {
            details.add(new SessionEvents.JobAdded(added));
        }
        recomputeReadiness();
        publish("updateJobResult", details);
    }

    /**
     * Adds a job to the session. It starts undesired. Adding an identical definition again does nothing.
     *
     * @throws DuplicateJobException if a different definition with the same id is known
     */
    public void addJob(Job job) {
        var existing = jobStateMap.get(job.id());
        if (existing != null) {
            if (!existing.job().equals(job)) {
                throw new DuplicateJobException(existing.job(), job);
            }
            return;
        }
        log.info("Storing new job {}", job);
        jobStateMap.put(job.id(), new JobState(job));
        jobList.add(job);
        recomputeReadiness();
        publish("addJob", List.of(new SessionEvents.JobAdded(job)));
    }

    /**
     * Same as {@link #addJob}, under the name the execution controllers use next to {@link #removeUnit}.
     */
    public void addUnit(Job job) {
        addJob(job);
    }

    /**
     * @throws IllegalStateException if the job is on the run list
     */
    public void removeUnit(Job job) {
        var state = requireState(job);
        if (isScheduled(job.id())) {
            throw new IllegalStateException("Job " + job.id() + " is on the run list and cannot be removed");
        }
        forget(state.job());
        recomputeReadiness();
        publish("removeUnit", List.of(new SessionEvents.JobRemoved(state.job())));
    }

    /**
     * Removes every job matching {@code predicate}. Nothing is removed if any match is on the run list.
     *
     * @throws IllegalStateException if a matching job is on the run list
     */
    public void trimJobList(Predicate<Job> predicate) {
        var doomed = jobList.stream().filter(predicate).toList();
        var scheduled = doomed.stream().filter(job -> isScheduled(job.id())).map(Job::id).toList();
        if (!scheduled.isEmpty()) {
            throw new IllegalStateException("Cannot remove jobs that are on the run list: " + scheduled);
        }
        if (doomed.isEmpty()) {
            return;
        }
        var details = new ArrayList<SessionEvents.Event>();
        for (var job : doomed) {
            forget(job);
            details.add(new SessionEvents.JobRemoved(job));
        }
        log.debug("Trimmed {} job(s) from the session", doomed.size());
        recomputeReadiness();
        publish("trimJobList", details);
    }

    /**
     * Replaces the resource records known for {@code resourceId}.
     */
    public void setResourceList(String resourceId, List<ResourceRecord> records) {
        resourceMap.put(resourceId, List.copyOf(records));
        recomputeReadiness();
        publish("setResourceList", List.of());
    }

    public DurationEstimate estimatedDuration() {
        return estimatedDuration(DEFAULT_MANUAL_OVERHEAD);
    }

    /**
     * Estimates how long the run list takes.
     *
     * @param manualOverhead seconds added for every manual job to read the instructions
     */
    public DurationEstimate estimatedDuration(double manualOverhead) {
        double automated = 0;
        double manual = 0;
        boolean automatedKnown = true;
        boolean manualKnown = true;
        for (var job : runList) {
            OptionalDouble estimate = job.estimatedDuration();
            if (job.plugin().isAutomated()) {
                if (estimate.isPresent()) {
                    automated += estimate.getAsDouble();
                } else if (job.plugin() != PluginKind.LOCAL) {
                    automatedKnown = false;
                }
            } else {
                manual += manualOverhead;
                if (estimate.isPresent()) {
                    manual += estimate.getAsDouble();
                } else if (job.command().isPresent()) {
                    manualKnown = false;
                }
            }
        }
        return new DurationEstimate(
            automatedKnown ? OptionalDouble.of(automated) : OptionalDouble.empty(),
            manualKnown ? OptionalDouble.of(manual) : OptionalDouble.empty()
        );
    }

    public List<Job> jobList() {
        return Collections.unmodifiableList(jobList);
    }

    public Map<String, JobState> jobStateMap() {
        return Collections.unmodifiableMap(jobStateMap);
    }

    public List<Job> desiredJobList() {
        return desiredJobList;
    }

    public List<Job> mandatoryJobList() {
        return mandatoryJobList;
    }

    /**
     * Jobs to run, each after all of its dependencies.
     */
    public List<Job> runList() {
        return runList;
    }

    public Map<String, List<ResourceRecord>> resourceMap() {
        return Collections.unmodifiableMap(resourceMap);
    }

    public SessionMetadata metadata() {
        return metadata;
    }

    public SessionEvents events() {
        return events;
    }

    private void processResourceResult(Job job, JobResult result) {
        var records = new ArrayList<ResourceRecord>();
        for (var data : parseRecords(job, result)) {
            records.add(new ResourceRecord(data));
        }
        log.debug("Storing {} resource record(s) for {}", records.size(), job.id());
        resourceMap.put(job.id(), List.copyOf(records));
    }

    private List<Job> processLocalResult(Job job, JobResult result) {
        var added = new ArrayList<Job>();
        for (var data : parseRecords(job, result)) {
            Job generated;
            try {
                generated = job.createChildJob(data);
            } catch (IllegalArgumentException ex) {
                log.warn("Local job {} produced an invalid job definition, ignoring it: {}", job.id(), ex.getMessage());
                continue;
            }
            var existing = jobStateMap.get(generated.id());
            if (existing == null) {
                log.info("Storing new job {} generated by {}", generated, job.id());
                jobStateMap.put(generated.id(), new JobState(generated));
                jobList.add(generated);
                added.add(generated);
            } else if (!existing.job().equals(generated)) {
                log.warn("Local job {} produced job {} that collides with an existing job, the new job was discarded",
                    job.id(), generated.id());
            }
        }
        return added;
    }

    private List<Map<String, String>> parseRecords(Job job, JobResult result) {
        String text;
        try {
            text = result.stdout();
        } catch (UncheckedIOException ex) {
            log.warn("Cannot read output of {}, treating it as empty: {}", job.id(), ex.getMessage());
            return List.of();
        }
        var parsed = parser.parse(text);
        for (var problem : parsed.problems()) {
            log.warn("Job {} returned invalid record data, record dropped: {}", job.id(), problem);
        }
        return parsed.records();
    }

    /**
     * Single pass over the run list; its order guarantees dependencies are evaluated first.
     */
    private void recomputeReadiness() {
        for (var state : jobStateMap.values()) {
            state.resetInhibitors();
        }
        for (var job : runList) {
            var state = jobStateMap.get(job.id());
            state.markDesired();
            var program = job.resourceProgram();
            if (program.isPresent()) {
                for (var failure : program.get().evaluate(resourceMap)) {
                    var expression = failure.expression();
                    var resourceJob = jobStateMap.get(expression.resourceId()).job();
                    state.addInhibitor(failure.verdict() == ResourceProgram.Verdict.PENDING
                        ? ReadinessInhibitor.pendingResource(resourceJob, expression)
                        : ReadinessInhibitor.failedResource(resourceJob, expression));
                }
            }
            for (var depId : job.dependencies()) {
                var dependency = jobStateMap.get(depId);
                var outcome = dependency.result().outcome();
                if (outcome == Outcome.NONE) {
                    state.addInhibitor(ReadinessInhibitor.pendingDependency(dependency.job()));
                } else if (outcome != Outcome.PASS) {
                    state.addInhibitor(ReadinessInhibitor.failedDependency(dependency.job()));
                }
            }
        }
    }

    /**
     * Removes {@code affected} from the selection, or the selected job that pulls it in.
     */
    private void dropAffected(List<Job> effective, Job affected) {
        if (effective.remove(affected)) {
            return;
        }
        for (var root : effective) {
            if (reaches(root, affected.id())) {
                effective.remove(root);
                return;
            }
        }
        throw new IllegalStateException("Dependency resolver reported job " + affected.id()
            + " which is not reachable from the desired jobs");
    }

    private boolean reaches(Job root, String targetId) {
        var seen = new HashSet<String>();
        var queue = new ArrayDeque<Job>();
        queue.add(root);
        while (!queue.isEmpty()) {
            var job = queue.poll();
            if (job.id().equals(targetId)) {
                return true;
            }
            if (!seen.add(job.id())) {
                continue;
            }
            for (var id : job.dependencies()) {
                enqueue(queue, id);
            }
            for (var id : job.resourceDependencies()) {
                enqueue(queue, id);
            }
        }
        return false;
    }

    private void enqueue(ArrayDeque<Job> queue, String id) {
        var state = jobStateMap.get(id);
        if (state != null) {
            queue.add(state.job());
        }
    }

    private boolean isScheduled(String id) {
        return runList.stream().anyMatch(job -> job.id().equals(id));
    }

    private void forget(Job job) {
        jobList.remove(job);
        jobStateMap.remove(job.id());
        resourceMap.remove(job.id());
        desiredJobList = desiredJobList.stream().filter(j -> !j.id().equals(job.id())).toList();
        mandatoryJobList = mandatoryJobList.stream().filter(j -> !j.id().equals(job.id())).toList();
    }

    private JobState requireState(Job job) {
        var state = jobStateMap.get(job.id());
        if (state == null || !state.job().equals(job)) {
            throw new IllegalArgumentException("Job " + job.id() + " is not part of this session");
        }
        return state;
    }

    private void requireKnown(List<Job> jobs) {
        var unknown = jobs.stream()
            .filter(job -> {
                var state = jobStateMap.get(job.id());
                return state == null || !state.job().equals(job);
            })
            .map(Job::id)
            .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Jobs not part of this session: " + unknown);
        }
    }

    private void publish(String operation, List<SessionEvents.Event> details) {
        events.publish(new SessionEvents.StateChanged(this, operation), details);
    }
}
