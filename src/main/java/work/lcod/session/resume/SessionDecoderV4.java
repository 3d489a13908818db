package work.lcod.session.resume;

import java.util.List;
import java.util.Map;

/**
 * Hollow results are no longer stored, so a job may have no entry in {@code results}.
 */
public final class SessionDecoderV4 extends DelegatingSessionDecoder {
    public SessionDecoderV4(SessionDecoder previous) {
        super(previous);
    }

    @Override
    public int version() {
        return 4;
    }

    @Override
    public List<?> resultList(Map<String, Object> resultsRepr, String jobId) {
        if (!resultsRepr.containsKey(jobId)) {
            return List.of();
        }
        return super.resultList(resultsRepr, jobId);
    }
}
