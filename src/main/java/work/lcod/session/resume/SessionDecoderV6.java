package work.lcod.session.resume;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import work.lcod.session.state.SessionState;

/**
 * Adds the mandatory job list ({@code mandatory_job_list}), restored before the desired jobs.
 */
public final class SessionDecoderV6 extends DelegatingSessionDecoder {
    public SessionDecoderV6(SessionDecoder previous) {
        super(previous);
    }

    @Override
    public int version() {
        return 6;
    }

    @Override
    public void validate(Map<String, Object> sessionRepr, ResumeContext context) {
        super.validate(sessionRepr, context);
        Repr.stringList(sessionRepr, "mandatory_job_list", "job id");
    }

    @Override
    public void restoreJobLists(SessionState session, Map<String, Object> sessionRepr) {
        var mandatory = Repr.stringList(sessionRepr, "mandatory_job_list", "job id");
        session.updateMandatoryJobList(SessionDecoderV1.jobsById(session, mandatory, "mandatory_job_list"));
        super.restoreJobLists(session, sessionRepr);
    }

    @Override
    public Set<String> referencedJobIds(Map<String, Object> sessionRepr) {
        var ids = new HashSet<>(super.referencedJobIds(sessionRepr));
        ids.addAll(Repr.stringList(sessionRepr, "mandatory_job_list", "job id"));
        return ids;
    }
}
