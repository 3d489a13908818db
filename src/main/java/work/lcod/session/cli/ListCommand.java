package work.lcod.session.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "list",
    description = "List the session storages of the repository.",
    mixinStandardHelpOptions = true
)
final class ListCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private SessionCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        var repository = parent.engine().repository();
        var out = spec.commandLine().getOut();
        var last = repository.lastStorage().orElse(null);
        for (var storage : repository.storageList()) {
            out.println((storage.equals(last) ? "* " : "  ") + storage.location());
        }
        return 0;
    }
}
