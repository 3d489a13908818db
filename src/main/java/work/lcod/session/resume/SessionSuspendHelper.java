package work.lcod.session.resume;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import work.lcod.session.job.Job;
import work.lcod.session.result.DiskJobResult;
import work.lcod.session.result.JobResult;
import work.lcod.session.result.MemoryJobResult;
import work.lcod.session.state.SessionMetadata;
import work.lcod.session.state.SessionState;

/**
 * Serializes a {@link SessionState} into the newest session format.
 */
public final class SessionSuspendHelper {
    public static final int VERSION = 6;

    private final Path location;

    public SessionSuspendHelper() {
        this(null);
    }

    /**
     * @param location session directory; disk IO logs below it are stored as relative paths
     */
    public SessionSuspendHelper(Path location) {
        this.location = location == null ? null : location.toAbsolutePath().normalize();
    }

    public byte[] suspend(SessionState session) {
        return EnvelopeCodec.encode(toRepr(session));
    }

    /**
     * Document written by {@link #suspend}, before compression.
     */
    public Map<String, Object> toRepr(SessionState session) {
        var envelope = new LinkedHashMap<String, Object>();
        envelope.put("version", VERSION);
        envelope.put("session", sessionRepr(session));
        return envelope;
    }

    private Map<String, Object> sessionRepr(SessionState session) {
        var jobs = new LinkedHashMap<String, Object>();
        var results = new LinkedHashMap<String, Object>();
        for (var state : session.jobStateMap().values()) {
            var result = state.result();
            if (!result.isHollow()) {
                jobs.put(state.job().id(), state.job().checksum());
                results.put(state.job().id(), List.of(resultRepr(result)));
            }
        }
        for (var job : session.desiredJobList()) {
            jobs.put(job.id(), job.checksum());
        }
        for (var job : session.mandatoryJobList()) {
            jobs.put(job.id(), job.checksum());
        }
        var repr = new LinkedHashMap<String, Object>();
        repr.put("jobs", jobs);
        repr.put("results", results);
        repr.put("desired_job_list", ids(session.desiredJobList()));
        repr.put("mandatory_job_list", ids(session.mandatoryJobList()));
        repr.put("metadata", metadataRepr(session.metadata()));
        return repr;
    }

    private Map<String, Object> resultRepr(JobResult result) {
        var repr = new LinkedHashMap<String, Object>();
        repr.put("outcome", result.outcome().wireName());
        repr.put("comments", result.comments());
        repr.put("return_code", result.returnCode());
        repr.put("execution_duration", result.executionDuration());
        if (result instanceof DiskJobResult disk) {
            repr.put("io_log_filename", ioLogFilename(disk.ioLogPath()));
        } else if (result instanceof MemoryJobResult memory) {
            var ioLog = new ArrayList<Object>();
            for (var record : memory.ioLog()) {
                ioLog.add(List.of(record.delay(), record.stream(), Base64.getEncoder().encodeToString(record.data())));
            }
            repr.put("io_log", ioLog);
        } else {
            throw new IllegalArgumentException("Unsupported result type " + result.getClass().getName());
        }
        return repr;
    }

    private String ioLogFilename(Path path) {
        var absolute = path.toAbsolutePath().normalize();
        if (location != null && absolute.startsWith(location)) {
            return location.relativize(absolute).toString();
        }
        return absolute.toString();
    }

    private static Map<String, Object> metadataRepr(SessionMetadata metadata) {
        var repr = new LinkedHashMap<String, Object>();
        repr.put("title", metadata.title());
        repr.put("flags", new ArrayList<>(new TreeSet<>(metadata.flags())));
        repr.put("running_job_name", metadata.runningJobName());
        var blob = metadata.appBlob();
        repr.put("app_blob", blob == null ? null : Base64.getEncoder().encodeToString(blob));
        repr.put("app_id", metadata.appId());
        return repr;
    }

    private static List<String> ids(List<Job> jobs) {
        return jobs.stream().map(Job::id).toList();
    }
}
