package work.lcod.session.resume;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.session.result.JobResult;
import work.lcod.session.state.SessionMetadata;
import work.lcod.session.state.SessionState;

/**
 * Decoder that forwards every step to the decoder of the previous format version.
 */
public abstract class DelegatingSessionDecoder implements SessionDecoder {
    protected final SessionDecoder previous;

    protected DelegatingSessionDecoder(SessionDecoder previous) {
        this.previous = previous;
        if (previous.version() != version() - 1) {
            throw new IllegalArgumentException("Decoder v" + version() + " cannot extend v" + previous.version());
        }
    }

    @Override
    public void validate(Map<String, Object> sessionRepr, ResumeContext context) {
        previous.validate(sessionRepr, context);
    }

    @Override
    public void restoreJobsAndResults(SessionState session, Map<String, Object> sessionRepr, ResumeContext context) {
        previous.restoreJobsAndResults(session, sessionRepr, context);
    }

    @Override
    public List<?> resultList(Map<String, Object> resultsRepr, String jobId) {
        return previous.resultList(resultsRepr, jobId);
    }

    @Override
    public JobResult buildJobResult(Map<String, Object> resultRepr, ResumeContext context) {
        return previous.buildJobResult(resultRepr, context);
    }

    @Override
    public Path ioLogPath(Object filenameRepr, ResumeContext context) {
        return previous.ioLogPath(filenameRepr, context);
    }

    @Override
    public void restoreMetadata(SessionMetadata metadata, Map<String, Object> metadataRepr) {
        previous.restoreMetadata(metadata, metadataRepr);
    }

    @Override
    public void restoreJobLists(SessionState session, Map<String, Object> sessionRepr) {
        previous.restoreJobLists(session, sessionRepr);
    }

    @Override
    public Set<String> referencedJobIds(Map<String, Object> sessionRepr) {
        return previous.referencedJobIds(sessionRepr);
    }
}
