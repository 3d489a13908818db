package work.lcod.session.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import work.lcod.session.job.Job;
import work.lcod.session.result.JobResult;
import work.lcod.session.result.MemoryJobResult;

/**
 * Per-job state tracked by a {@link SessionState}: the last result and the readiness inhibitors.
 */
public final class JobState {
    private final Job job;
    private JobResult result = MemoryJobResult.hollow();
    private final List<ReadinessInhibitor> inhibitors = new ArrayList<>(List.of(ReadinessInhibitor.UNDESIRED));
    private String certificationStatus;

    JobState(Job job) {
        this.job = Objects.requireNonNull(job, "job");
        this.certificationStatus = job.certificationStatus();
    }

    public Job job() {
        return job;
    }

    public JobResult result() {
        return result;
    }

    void setResult(JobResult result) {
        this.result = Objects.requireNonNull(result, "result");
    }

    public List<ReadinessInhibitor> readinessInhibitors() {
        return Collections.unmodifiableList(inhibitors);
    }

    void resetInhibitors() {
        inhibitors.clear();
        inhibitors.add(ReadinessInhibitor.UNDESIRED);
    }

    void markDesired() {
        inhibitors.remove(ReadinessInhibitor.UNDESIRED);
    }

    void addInhibitor(ReadinessInhibitor inhibitor) {
        inhibitors.add(inhibitor);
    }

    public boolean canStart() {
        return inhibitors.isEmpty();
    }

    /**
     * {@code unspecified}, {@code blocker} or {@code non-blocker}; defaults to the job definition's value.
     */
    public String certificationStatus() {
        return certificationStatus;
    }

    public void setCertificationStatus(String certificationStatus) {
        this.certificationStatus = Objects.requireNonNull(certificationStatus, "certificationStatus");
    }

    @Override
    public String toString() {
        return "<JobState job:" + job.id() + " outcome:" + result.outcome() + " inhibitors:" + inhibitors + ">";
    }
}
