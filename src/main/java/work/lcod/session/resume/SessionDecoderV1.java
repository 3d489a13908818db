package work.lcod.session.resume;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.session.job.Job;
import work.lcod.session.result.DiskJobResult;
import work.lcod.session.result.IoLogRecord;
import work.lcod.session.result.JobResult;
import work.lcod.session.result.MemoryJobResult;
import work.lcod.session.result.Outcome;
import work.lcod.session.state.JobState;
import work.lcod.session.state.SessionMetadata;
import work.lcod.session.state.SessionState;

/**
 * First session format: job checksums, results, metadata (title, flags, running job) and the
 * desired job list. Disk IO logs are referenced by absolute path.
 */
public final class SessionDecoderV1 implements SessionDecoder {
    private static final Logger log = LoggerFactory.getLogger(SessionDecoderV1.class);
    private static final Pattern LEGACY_LOCATION = Pattern.compile("^.*/\\.cache/lcod/sessions/[^/]+");

    @Override
    public int version() {
        return 1;
    }

    @Override
    public void validate(Map<String, Object> sessionRepr, ResumeContext context) {
        var jobsRepr = Repr.map(sessionRepr, "jobs");
        var resultsRepr = Repr.map(sessionRepr, "results");
        var ids = new TreeSet<String>(jobsRepr.keySet());
        ids.addAll(resultsRepr.keySet());
        for (var jobId : ids) {
            Repr.string(jobsRepr, jobId);
            for (var resultRepr : context.decoder().resultList(resultsRepr, jobId)) {
                context.decoder().buildJobResult(Repr.asMap(resultRepr, "a result of '" + jobId + "'"), context);
            }
        }
        var metadataRepr = Repr.map(sessionRepr, "metadata");
        Repr.optionalString(metadataRepr, "title");
        Repr.stringList(metadataRepr, "flags", "flag");
        Repr.optionalString(metadataRepr, "running_job_name");
        Repr.stringList(sessionRepr, "desired_job_list", "job id");
    }

    /**
     * Ids are processed in sorted order. An id whose job is not known yet (it is generated by a local
     * job replayed later) is retried in further rounds until a round makes no progress.
     */
    @Override
    public void restoreJobsAndResults(SessionState session, Map<String, Object> sessionRepr, ResumeContext context) {
        var jobsRepr = Repr.map(sessionRepr, "jobs");
        var resultsRepr = Repr.map(sessionRepr, "results");
        var ids = new TreeSet<String>(jobsRepr.keySet());
        ids.addAll(resultsRepr.keySet());
        var leftover = new ArrayDeque<String>();
        for (var jobId : ids) {
            if (!processJob(session, jobsRepr, resultsRepr, jobId, context)) {
                leftover.add(jobId);
            }
        }
        while (!leftover.isEmpty()) {
            boolean progress = false;
            int round = leftover.size();
            for (int i = 0; i < round; i++) {
                var jobId = leftover.poll();
                if (processJob(session, jobsRepr, resultsRepr, jobId, context)) {
                    progress = true;
                } else {
                    leftover.add(jobId);
                }
            }
            if (!progress) {
                throw new CorruptedSessionException("Unknown jobs remaining: " + String.join(", ", leftover));
            }
        }
    }

    private boolean processJob(
        SessionState session,
        Map<String, Object> jobsRepr,
        Map<String, Object> resultsRepr,
        String jobId,
        ResumeContext context
    ) {
        JobState state = session.jobStateMap().get(jobId);
        if (state == null) {
            return false;
        }
        var checksum = Repr.string(jobsRepr, jobId);
        Job job = state.job();
        if (!job.checksum().equals(checksum)) {
            if (!context.options().ignoreChecksums()) {
                throw new IncompatibleJobException(jobId);
            }
            log.warn("Definition of job '{}' has changed, resuming anyway", jobId);
        }
        JobResult last = null;
        for (var resultRepr : context.decoder().resultList(resultsRepr, jobId)) {
            last = withCheckedReference(
                context.decoder().buildJobResult(Repr.asMap(resultRepr, "a result of '" + jobId + "'"), context),
                context.options());
        }
        if (last != null) {
            log.debug("Restoring result of {}", jobId);
            session.updateJobResult(job, last);
        }
        return true;
    }

    private static JobResult withCheckedReference(JobResult result, ResumeOptions options) {
        if (!(result instanceof DiskJobResult disk)) {
            return result;
        }
        var path = checkReference(disk.ioLogPath(), options);
        if (path.equals(disk.ioLogPath())) {
            return disk;
        }
        return new DiskJobResult(disk.outcome(), disk.comments(), disk.returnCode(), disk.executionDuration(), path);
    }

    @Override
    public List<?> resultList(Map<String, Object> resultsRepr, String jobId) {
        if (resultsRepr.containsKey(jobId) && resultsRepr.get(jobId) == null) {
            return List.of();
        }
        return Repr.list(resultsRepr, jobId);
    }

    @Override
    public JobResult buildJobResult(Map<String, Object> resultRepr, ResumeContext context) {
        var outcomeRepr = Repr.optionalString(resultRepr, "outcome");
        Outcome outcome;
        try {
            outcome = Outcome.fromWire(outcomeRepr);
        } catch (IllegalArgumentException ex) {
            throw new CorruptedSessionException("Value of key 'outcome' is not a known outcome: " + outcomeRepr, ex);
        }
        var comments = Repr.optionalString(resultRepr, "comments");
        var returnCode = Repr.optionalInteger(resultRepr, "return_code");
        var duration = Repr.optionalNumber(resultRepr, "execution_duration");
        boolean onDisk = resultRepr.containsKey("io_log_filename");
        boolean inMemory = resultRepr.containsKey("io_log");
        if (onDisk == inMemory) {
            throw new CorruptedSessionException("A result needs exactly one of 'io_log' and 'io_log_filename'");
        }
        if (inMemory) {
            var ioLog = new ArrayList<IoLogRecord>();
            for (var recordRepr : Repr.list(resultRepr, "io_log")) {
                ioLog.add(buildIoLogRecord(recordRepr));
            }
            return new MemoryJobResult(outcome, comments, returnCode, duration, ioLog);
        }
        var path = context.decoder().ioLogPath(resultRepr.get("io_log_filename"), context);
        if (path == null) {
            return new MemoryJobResult(outcome, comments, returnCode, duration, List.of());
        }
        return new DiskJobResult(outcome, comments, returnCode, duration, path);
    }

    @Override
    public Path ioLogPath(Object filenameRepr, ResumeContext context) {
        if (!(filenameRepr instanceof String filename)) {
            throw new CorruptedSessionException("Value of key 'io_log_filename' is of incorrect type "
                + Repr.typeName(filenameRepr));
        }
        var path = Path.of(filename);
        if (!path.isAbsolute()) {
            throw new CorruptedSessionException("Value of key 'io_log_filename' must be an absolute path: " + filename);
        }
        return path;
    }

    private static Path checkReference(Path path, ResumeOptions options) {
        if (!options.validateReferences() || Files.exists(path)) {
            return path;
        }
        if (options.rewriteLegacyPathnames() && options.location() != null) {
            var matcher = LEGACY_LOCATION.matcher(path.toString());
            if (matcher.find()) {
                var rewritten = Path.of(options.location().toString() + path.toString().substring(matcher.end()));
                log.debug("Rewrote legacy log path {} to {}", path, rewritten);
                if (Files.exists(rewritten)) {
                    return rewritten;
                }
            }
        }
        throw new BrokenReferenceException(path);
    }

    private static IoLogRecord buildIoLogRecord(Object recordRepr) {
        if (!(recordRepr instanceof List<?> triple) || triple.size() != 3) {
            throw new CorruptedSessionException("Each 'io_log' record must be a [delay, stream, data] list");
        }
        if (!(triple.get(0) instanceof Number delay)) {
            throw new CorruptedSessionException("IO log delay is of incorrect type " + Repr.typeName(triple.get(0)));
        }
        if (delay.doubleValue() < 0) {
            throw new CorruptedSessionException("IO log delay cannot be negative");
        }
        var stream = triple.get(1);
        if (!IoLogRecord.STDOUT.equals(stream) && !IoLogRecord.STDERR.equals(stream)) {
            throw new CorruptedSessionException("IO log stream must be stdout or stderr, got " + stream);
        }
        if (!(triple.get(2) instanceof String data)) {
            throw new CorruptedSessionException("IO log data is of incorrect type " + Repr.typeName(triple.get(2)));
        }
        try {
            return new IoLogRecord(delay.doubleValue(), (String) stream, Base64.getDecoder().decode(data));
        } catch (IllegalArgumentException ex) {
            throw new CorruptedSessionException("IO log data is not correct base64", ex);
        }
    }

    @Override
    public void restoreMetadata(SessionMetadata metadata, Map<String, Object> metadataRepr) {
        metadata.setTitle(Repr.optionalString(metadataRepr, "title"));
        metadata.setFlags(new LinkedHashSet<>(Repr.stringList(metadataRepr, "flags", "flag")));
        metadata.setRunningJobName(Repr.optionalString(metadataRepr, "running_job_name"));
    }

    @Override
    public void restoreJobLists(SessionState session, Map<String, Object> sessionRepr) {
        var desired = jobsById(session, Repr.stringList(sessionRepr, "desired_job_list", "job id"), "desired_job_list");
        for (var problem : session.updateDesiredJobList(desired)) {
            log.warn("Restored desired job list has a dependency problem: {}", problem);
        }
    }

    /**
     * Maps persisted ids to the session's jobs.
     *
     * @throws CorruptedSessionException naming {@code key} for an unknown id
     */
    static List<Job> jobsById(SessionState session, List<String> ids, String key) {
        var jobs = new ArrayList<Job>();
        for (var id : ids) {
            var state = session.jobStateMap().get(id);
            if (state == null) {
                throw new CorruptedSessionException("'" + key + "' refers to unknown job '" + id + "'");
            }
            jobs.add(state.job());
        }
        return jobs;
    }

    @Override
    public Set<String> referencedJobIds(Map<String, Object> sessionRepr) {
        var ids = new HashSet<String>(Repr.map(sessionRepr, "jobs").keySet());
        ids.addAll(Repr.map(sessionRepr, "results").keySet());
        ids.addAll(Repr.stringList(sessionRepr, "desired_job_list", "job id"));
        return ids;
    }
}
