package work.lcod.session.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.session.api.SessionReport;
import work.lcod.session.depmgr.DependencyProblem;
import work.lcod.session.job.Job;
import work.lcod.session.job.JobCatalogLoader;
import work.lcod.session.state.SessionState;

@CommandLine.Command(
    name = "check",
    description = "Compute the run list and readiness for a job catalog, or for a saved session.",
    mixinStandardHelpOptions = true
)
final class CheckCommand implements Callable<Integer> {
    static final int EXIT_PROBLEMS = 2;

    @CommandLine.ParentCommand
    private SessionCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--catalog"},
        required = true,
        arity = "1..*",
        description = "Job catalog file (YAML or JSON)."
    )
    private List<Path> catalogs = new ArrayList<>();

    @CommandLine.Option(
        names = {"-d", "--desired"},
        arity = "1..*",
        description = "Ids of the jobs to run (default: every job)."
    )
    private List<String> desired = new ArrayList<>();

    @CommandLine.Option(
        names = {"-m", "--mandatory"},
        arity = "1..*",
        description = "Ids of jobs that always run."
    )
    private List<String> mandatory = new ArrayList<>();

    @CommandLine.Option(
        names = {"-s", "--session"},
        description = "Saved session (file or storage directory) to resume instead of starting fresh.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path session;

    @Override
    public Integer call() {
        var engine = parent.engine();
        var jobs = JobCatalogLoader.load(catalogs);
        SessionState state;
        List<DependencyProblem> problems;
        if (session != null) {
            var data = SessionCommand.readSessionData(session);
            state = engine.resume(jobs, data, SessionCommand.sessionLocation(session));
            problems = List.of();
        } else {
            state = new SessionState(jobs);
            state.updateMandatoryJobList(select(state, mandatory));
            problems = state.updateDesiredJobList(desired.isEmpty() ? state.jobList() : select(state, desired));
        }
        var report = SessionReport.of(state, problems, engine.estimate(state));
        spec.commandLine().getOut().println(report.toPrettyJson());
        return problems.isEmpty() ? 0 : EXIT_PROBLEMS;
    }

    private static List<Job> select(SessionState state, List<String> ids) {
        var jobs = new ArrayList<Job>();
        for (var id : ids) {
            var jobState = state.jobStateMap().get(id);
            if (jobState == null) {
                throw new IllegalArgumentException("Unknown job id: " + id);
            }
            jobs.add(jobState.job());
        }
        return jobs;
    }
}
