package work.lcod.session.resume;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.session.job.Job;
import work.lcod.session.state.SessionMetadata;
import work.lcod.session.state.SessionState;

/**
 * Rebuilds a {@link SessionState} from a dormant session produced by {@link SessionSuspendHelper}
 * (or by an older release writing one of the earlier format versions).
 *
 * <p>Job definitions are never persisted: the session is rebuilt from the current job list and the
 * persisted checksums are compared against it. The first problem found aborts the resume.
 */
public final class SessionResumeHelper {
    private static final Logger log = LoggerFactory.getLogger(SessionResumeHelper.class);
    private static final Map<Integer, SessionDecoder> DECODERS = decoders();

    private final List<Job> jobs;
    private final ResumeOptions options;

    public SessionResumeHelper(List<Job> jobs) {
        this(jobs, ResumeOptions.defaults());
    }

    public SessionResumeHelper(List<Job> jobs, ResumeOptions options) {
        this.jobs = List.copyOf(jobs);
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Format versions this helper can read, oldest first.
     */
    public static List<Integer> supportedVersions() {
        return List.copyOf(DECODERS.keySet());
    }

    public SessionState resume(byte[] data) {
        return resume(data, UnaryOperator.identity());
    }

    /**
     * @param earlyCallback sees the fresh session before any result is replayed and may replace it,
     *     e.g. to register listeners first
     * @throws CorruptedSessionException if the data is malformed
     * @throws IncompatibleSessionException if the format version is not supported
     * @throws IncompatibleJobException if a job definition changed and checksums are not ignored
     * @throws BrokenReferenceException if a referenced IO log is missing and references are validated
     */
    public SessionState resume(byte[] data, UnaryOperator<SessionState> earlyCallback) {
        var envelope = Repr.asMap(EnvelopeCodec.decode(data), "session envelope");
        var decoder = decoderFor(envelope);
        var sessionRepr = Repr.map(envelope, "session");
        log.debug("Resuming session in format version {}", decoder.version());
        var context = new ResumeContext(decoder, options);
        decoder.validate(sessionRepr, context);

        var session = new SessionState(jobs);
        if (earlyCallback != null) {
            session = Objects.requireNonNull(earlyCallback.apply(session), "early callback returned no session");
        }
        decoder.restoreJobsAndResults(session, sessionRepr, context);
        decoder.restoreMetadata(session.metadata(), Repr.map(sessionRepr, "metadata"));
        decoder.restoreJobLists(session, sessionRepr);

        var referenced = decoder.referencedJobIds(sessionRepr);
        var scheduled = session.runList();
        session.trimJobList(job -> !referenced.contains(job.id()) && !scheduled.contains(job));
        log.debug("Resumed session with {} job(s), {} on the run list", session.jobList().size(), scheduled.size());
        return session;
    }

    /**
     * Reads the format version and metadata only.
     */
    public SessionPeek peek(byte[] data) {
        var envelope = Repr.asMap(EnvelopeCodec.decode(data), "session envelope");
        var decoder = decoderFor(envelope);
        var sessionRepr = Repr.map(envelope, "session");
        var metadata = new SessionMetadata();
        decoder.restoreMetadata(metadata, Repr.map(sessionRepr, "metadata"));
        return new SessionPeek(decoder.version(), metadata);
    }

    private static SessionDecoder decoderFor(Map<String, Object> envelope) {
        var version = Repr.require(envelope, "version");
        if (!Repr.isIntegral(version)) {
            throw new CorruptedSessionException("Value of key 'version' is of incorrect type " + Repr.typeName(version));
        }
        var decoder = DECODERS.get(exactVersion((Number) version));
        if (decoder == null) {
            throw new IncompatibleSessionException("Unsupported version " + version);
        }
        return decoder;
    }

    /**
     * The version as an int, or {@code null} when it does not fit one.
     */
    private static Integer exactVersion(Number version) {
        var exact = version instanceof BigInteger big ? big : BigInteger.valueOf(version.longValue());
        if (exact.bitLength() >= Integer.SIZE) {
            return null;
        }
        return exact.intValueExact();
    }

    private static Map<Integer, SessionDecoder> decoders() {
        var table = new TreeMap<Integer, SessionDecoder>();
        SessionDecoder decoder = new SessionDecoderV1();
        table.put(decoder.version(), decoder);
        decoder = new SessionDecoderV2(decoder);
        table.put(decoder.version(), decoder);
        decoder = new SessionDecoderV3(decoder);
        table.put(decoder.version(), decoder);
        decoder = new SessionDecoderV4(decoder);
        table.put(decoder.version(), decoder);
        decoder = new SessionDecoderV5(decoder);
        table.put(decoder.version(), decoder);
        decoder = new SessionDecoderV6(decoder);
        table.put(decoder.version(), decoder);
        return Collections.unmodifiableMap(table);
    }
}
