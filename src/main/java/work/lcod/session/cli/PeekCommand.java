package work.lcod.session.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.session.api.SessionReport;

@CommandLine.Command(
    name = "peek",
    description = "Print the format version and metadata of a saved session.",
    mixinStandardHelpOptions = true
)
final class PeekCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private SessionCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "SESSION", description = "Session file or storage directory.")
    private Path session;

    @Override
    public Integer call() {
        var peek = parent.engine().peek(SessionCommand.readSessionData(session));
        spec.commandLine().getOut().println(SessionReport.of(peek).toPrettyJson());
        return 0;
    }
}
