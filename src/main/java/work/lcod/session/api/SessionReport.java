package work.lcod.session.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import work.lcod.session.depmgr.DependencyProblem;
import work.lcod.session.job.Job;
import work.lcod.session.resume.SessionPeek;
import work.lcod.session.state.DurationEstimate;
import work.lcod.session.state.ReadinessInhibitor;
import work.lcod.session.state.SessionMetadata;
import work.lcod.session.state.SessionState;

/**
 * Serializable summary of a session, printed by the CLI.
 */
public record SessionReport(Map<String, Object> data) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public SessionReport {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static SessionReport of(SessionPeek peek) {
        var data = new LinkedHashMap<String, Object>();
        data.put("version", peek.version());
        data.put("metadata", metadata(peek.metadata()));
        return new SessionReport(data);
    }

    /**
     * Run list, readiness of each scheduled job, dependency problems and the duration estimate.
     */
    public static SessionReport of(SessionState session, List<DependencyProblem> problems, DurationEstimate estimate) {
        var data = new LinkedHashMap<String, Object>();
        data.put("desired", session.desiredJobList().stream().map(Job::id).toList());
        var runList = new ArrayList<Map<String, Object>>();
        for (var job : session.runList()) {
            var state = session.jobStateMap().get(job.id());
            var entry = new LinkedHashMap<String, Object>();
            entry.put("id", job.id());
            entry.put("plugin", job.plugin().wireName());
            entry.put("outcome", state.result().outcome().toString());
            entry.put("ready", state.canStart());
            entry.put("inhibitors", state.readinessInhibitors().stream().map(ReadinessInhibitor::description).toList());
            runList.add(entry);
        }
        data.put("run_list", runList);
        data.put("problems", problems.stream().map(DependencyProblem::toString).toList());
        var duration = new LinkedHashMap<String, Object>();
        duration.put("automated", seconds(estimate.automated()));
        duration.put("manual", seconds(estimate.manual()));
        data.put("estimated_duration", duration);
        data.put("metadata", metadata(session.metadata()));
        return new SessionReport(data);
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(data);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize session report: " + ex.getOriginalMessage(), ex);
        }
    }

    private static Map<String, Object> metadata(SessionMetadata metadata) {
        var data = new LinkedHashMap<String, Object>();
        data.put("title", metadata.title());
        data.put("flags", new ArrayList<>(metadata.flags()));
        data.put("running_job_name", metadata.runningJobName());
        var blob = metadata.appBlob();
        data.put("app_blob", blob == null ? null : Base64.getEncoder().encodeToString(blob));
        data.put("app_id", metadata.appId());
        return data;
    }

    private static Double seconds(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
