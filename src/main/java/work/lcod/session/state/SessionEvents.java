package work.lcod.session.state;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import work.lcod.session.job.Job;
import work.lcod.session.result.JobResult;

/**
 * Synchronous event bus of a {@link SessionState}.
 *
 * <p>Listeners run on the caller thread in registration order. For every mutation {@link StateChanged}
 * is delivered first, followed by the job-level events of that mutation. A listener exception
 * propagates to whoever triggered the mutation.
 */
public final class SessionEvents {
    private final List<Consumer<? super StateChanged>> stateChanged = new ArrayList<>();
    private final List<Consumer<? super JobAdded>> jobAdded = new ArrayList<>();
    private final List<Consumer<? super JobRemoved>> jobRemoved = new ArrayList<>();
    private final List<Consumer<? super JobResultChanged>> jobResultChanged = new ArrayList<>();

    public void onStateChanged(Consumer<? super StateChanged> listener) {
        stateChanged.add(listener);
    }

    public void onJobAdded(Consumer<? super JobAdded> listener) {
        jobAdded.add(listener);
    }

    public void onJobRemoved(Consumer<? super JobRemoved> listener) {
        jobRemoved.add(listener);
    }

    public void onJobResultChanged(Consumer<? super JobResultChanged> listener) {
        jobResultChanged.add(listener);
    }

    void publish(StateChanged change, List<Event> details) {
        deliver(stateChanged, change);
        for (var event : details) {
            if (event instanceof JobAdded added) {
                deliver(jobAdded, added);
            } else if (event instanceof JobRemoved removed) {
                deliver(jobRemoved, removed);
            } else if (event instanceof JobResultChanged resultChanged) {
                deliver(jobResultChanged, resultChanged);
            } else {
                throw new IllegalArgumentException("Unsupported session event " + event);
            }
        }
    }

    private static <E> void deliver(List<Consumer<? super E>> listeners, E event) {
        for (var listener : List.copyOf(listeners)) {
            listener.accept(event);
        }
    }

    /** Marker of events published by a session. */
    public interface Event {}

    /**
     * @param operation name of the mutating operation, e.g. {@code updateJobResult}
     */
    public record StateChanged(SessionState session, String operation) implements Event {}

    public record JobAdded(Job job) implements Event {}

    public record JobRemoved(Job job) implements Event {}

    public record JobResultChanged(Job job, JobResult oldResult, JobResult newResult) implements Event {}
}
