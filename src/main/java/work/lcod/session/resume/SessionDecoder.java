package work.lcod.session.resume;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.session.result.JobResult;
import work.lcod.session.state.SessionMetadata;
import work.lcod.session.state.SessionState;

/**
 * Decoder for one version of the session format. Each version delegates to its predecessor for
 * everything it does not change.
 */
public interface SessionDecoder {
    int version();

    /**
     * Checks the shape of the {@code session} object, results included, before anything is rebuilt.
     * Only the existence of referenced IO log files is left to the replay.
     */
    void validate(Map<String, Object> sessionRepr, ResumeContext context);

    /**
     * Replays persisted results into {@code session}, checking job checksums along the way.
     */
    void restoreJobsAndResults(SessionState session, Map<String, Object> sessionRepr, ResumeContext context);

    /**
     * Persisted results of one job, oldest first.
     */
    List<?> resultList(Map<String, Object> resultsRepr, String jobId);

    /**
     * Builds a result from its representation without touching the filesystem.
     */
    JobResult buildJobResult(Map<String, Object> resultRepr, ResumeContext context);

    /**
     * Path of a disk IO log as stored in a result, {@code null} when the result has no log.
     */
    Path ioLogPath(Object filenameRepr, ResumeContext context);

    void restoreMetadata(SessionMetadata metadata, Map<String, Object> metadataRepr);

    /**
     * Restores the mandatory and desired job lists, which also recomputes the run list.
     */
    void restoreJobLists(SessionState session, Map<String, Object> sessionRepr);

    /**
     * Ids the persisted data mentions; jobs outside this set and off the run list are trimmed.
     */
    Set<String> referencedJobIds(Map<String, Object> sessionRepr);
}
