package work.lcod.session.storage;

import java.nio.file.Path;

/**
 * A previous checkpoint was interrupted and left its {@code session.next} file behind.
 */
public final class LockedStorageException extends IllegalStateException {
    private final Path lockFile;

    public LockedStorageException(Path lockFile) {
        super("Session storage is locked by " + lockFile + ", call breakLock() to discard it");
        this.lockFile = lockFile;
    }

    public Path lockFile() {
        return lockFile;
    }
}
