package work.lcod.session.cli;

import java.io.UncheckedIOException;
import picocli.CommandLine;
import work.lcod.session.resume.SessionResumeException;
import work.lcod.session.storage.LockedStorageException;

/**
 * Prints a failed command as one line naming the failure. Sessions that cannot be resumed and locked
 * storages get their own exit codes so that wrappers can offer to start afresh.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final int EXIT_RESUME_FAILED = 3;
    static final int EXIT_STORAGE_LOCKED = 4;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable failure = ex instanceof UncheckedIOException && ex.getCause() != null ? ex.getCause() : ex;
        String message = failure.getMessage();
        if (message == null || message.isBlank()) {
            message = failure.getClass().getSimpleName();
        }
        String line = failure instanceof SessionResumeException
            ? "Cannot resume session: " + message
            : failure.getClass().getSimpleName() + ": " + message;
        commandLine.getErr().println(commandLine.getColorScheme().errorText(line));
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return exitCode(failure, commandLine);
    }

    private static int exitCode(Throwable failure, CommandLine commandLine) {
        if (failure instanceof SessionResumeException) {
            return EXIT_RESUME_FAILED;
        }
        if (failure instanceof LockedStorageException) {
            return EXIT_STORAGE_LOCKED;
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
