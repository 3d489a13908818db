package work.lcod.session.cli;

import java.util.stream.Collectors;
import picocli.CommandLine;
import work.lcod.session.resume.SessionResumeHelper;
import work.lcod.session.resume.SessionSuspendHelper;

/**
 * Engine version plus the session formats it reads and writes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        String readable = SessionResumeHelper.supportedVersions().stream()
            .map(String::valueOf)
            .collect(Collectors.joining(", "));
        return new String[] {
            "lcod-session (java) " + version,
            "session formats: reads " + readable + ", writes " + SessionSuspendHelper.VERSION
        };
    }
}
