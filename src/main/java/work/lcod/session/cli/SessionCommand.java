package work.lcod.session.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;
import work.lcod.session.api.SessionEngine;
import work.lcod.session.api.SessionEngineConfiguration;
import work.lcod.session.api.SessionEngineConfigurationLoader;

@CommandLine.Command(
    name = "lcod-session",
    description = "Inspect and plan lcod testing sessions.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {PeekCommand.class, CheckCommand.class, ListCommand.class}
)
final class SessionCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--config",
        description = "Engine configuration (TOML), given before the subcommand.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    SessionEngine engine() {
        var configuration = config == null
            ? SessionEngineConfiguration.defaults()
            : SessionEngineConfigurationLoader.load(config);
        return new SessionEngine(configuration);
    }

    /**
     * Reads a checkpoint given either as the session file itself or as its storage directory.
     */
    static byte[] readSessionData(Path path) {
        var file = Files.isDirectory(path) ? path.resolve("session") : path;
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("No session data at " + path);
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read session data " + file + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Directory relative IO log paths of a checkpoint resolve against.
     */
    static Path sessionLocation(Path path) {
        var absolute = path.toAbsolutePath().normalize();
        return Files.isDirectory(absolute) ? absolute : absolute.getParent();
    }
}
