package work.lcod.session.state;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Free-form session data persisted alongside the job results.
 */
public final class SessionMetadata {
    public static final String FLAG_INCOMPLETE = "incomplete";
    public static final String FLAG_SUBMITTED = "submitted";
    public static final String FLAG_BOOTSTRAPPING = "bootstrapping";

    private String title;
    private final Set<String> flags = new LinkedHashSet<>();
    private String runningJobName;
    private byte[] appBlob;
    private String appId;

    public String title() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Set<String> flags() {
        return Collections.unmodifiableSet(flags);
    }

    public void setFlags(Set<String> flags) {
        this.flags.clear();
        if (flags != null) {
            this.flags.addAll(flags);
        }
    }

    public void addFlag(String flag) {
        flags.add(flag);
    }

    public void removeFlag(String flag) {
        flags.remove(flag);
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    /**
     * Id of the job that was running when the session was last saved, used to detect crashes.
     */
    public String runningJobName() {
        return runningJobName;
    }

    public void setRunningJobName(String runningJobName) {
        this.runningJobName = runningJobName;
    }

    /**
     * Opaque data owned by the application driving the session.
     */
    public byte[] appBlob() {
        return appBlob == null ? null : appBlob.clone();
    }

    public void setAppBlob(byte[] appBlob) {
        this.appBlob = appBlob == null ? null : appBlob.clone();
    }

    public String appId() {
        return appId;
    }

    public void setAppId(String appId) {
        this.appId = appId;
    }

    @Override
    public String toString() {
        return "<SessionMetadata title:" + title + " flags:" + flags + " running_job_name:" + runningJobName
            + " app_id:" + appId + ">";
    }
}
