package work.lcod.session.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directory holding the checkpoint of one session and the IO logs of its jobs.
 */
public final class SessionStorage {
    private static final Logger log = LoggerFactory.getLogger(SessionStorage.class);

    static final String SESSION_FILE = "session";
    static final String SESSION_FILE_NEXT = "session.next";
    static final String IO_LOG_DIR = "io-logs";
    static final String PREFIX = "lcod-";
    static final String SUFFIX = ".session";

    private final Path location;

    public SessionStorage(Path location) {
        this.location = Objects.requireNonNull(location, "location").toAbsolutePath().normalize();
    }

    /**
     * Allocates a new storage in a random sub-directory of {@code baseDir} and makes it the last session.
     */
    public static SessionStorage create(Path baseDir) {
        return create(baseDir, true);
    }

    /**
     * @param replaceLast when set, the storage the {@code last-session} link points to is removed and
     *     the link is moved to the new storage
     */
    public static SessionStorage create(Path baseDir, boolean replaceLast) {
        SessionStorage storage;
        try {
            Files.createDirectories(baseDir);
            var dir = Files.createTempDirectory(baseDir, PREFIX);
            var location = baseDir.resolve(dir.getFileName() + SUFFIX);
            Files.move(dir, location);
            Files.createDirectories(location.resolve(IO_LOG_DIR));
            storage = new SessionStorage(location);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to create session storage in " + baseDir + ": " + ex.getMessage(), ex);
        }
        log.debug("Created new storage in {}", storage.location());
        if (replaceLast) {
            storage.replaceLastSession(baseDir);
        }
        return storage;
    }

    public Path location() {
        return location;
    }

    /**
     * Directory where the execution engine writes job IO logs.
     */
    public Path ioLogDir() {
        return location.resolve(IO_LOG_DIR);
    }

    /**
     * Bytes of the latest checkpoint, or an empty array if none was saved yet.
     */
    public byte[] loadCheckpoint() {
        var file = location.resolve(SESSION_FILE);
        if (!Files.exists(file)) {
            return new byte[0];
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read checkpoint " + file + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Writes {@code data} to {@code session.next}, syncs it and renames it over {@code session}.
     *
     * @throws LockedStorageException if {@code session.next} already exists
     */
    public void saveCheckpoint(byte[] data) {
        var next = location.resolve(SESSION_FILE_NEXT);
        var target = location.resolve(SESSION_FILE);
        log.debug("Saving {} bytes of session data to {}", data.length, location);
        try (FileChannel channel = FileChannel.open(next, StandardOpenOption.WRITE, StandardOpenOption.CREATE_NEW)) {
            var buffer = ByteBuffer.wrap(data);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        } catch (FileAlreadyExistsException ex) {
            throw new LockedStorageException(next);
        } catch (IOException ex) {
            discard(next);
            throw new IllegalStateException("Failed to write checkpoint " + next + ": " + ex.getMessage(), ex);
        }
        try {
            moveAtomically(next, target);
        } catch (IOException ex) {
            discard(next);
            throw new IllegalStateException("Failed to replace checkpoint " + target + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Removes the leftover of an interrupted {@link #saveCheckpoint}.
     */
    public void breakLock() {
        try {
            Files.deleteIfExists(location.resolve(SESSION_FILE_NEXT));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to break lock of " + location + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Deletes the storage directory and everything in it.
     */
    public void remove() {
        log.debug("Removing session storage from {}", location);
        try {
            deleteRecursively(location);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to remove session storage " + location + ": " + ex.getMessage(), ex);
        }
    }

    private void replaceLastSession(Path baseDir) {
        var link = baseDir.resolve(SessionStorageRepository.LAST_SESSION_LINK);
        try {
            if (Files.isSymbolicLink(link)) {
                var previous = baseDir.resolve(Files.readSymbolicLink(link)).normalize();
                log.debug("Removing storage associated with last session {}", previous);
                deleteRecursively(previous);
                Files.delete(link);
            } else if (Files.exists(link)) {
                log.warn("{} is not a symbolic link, repository {} must be corrupted", link, baseDir);
                return;
            }
            Files.createSymbolicLink(link, location);
            log.debug("Linked storage {} as last session", location);
        } catch (IOException | UnsupportedOperationException ex) {
            log.error("Cannot link {} as {}: {}", location, link, ex.getMessage());
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.warn("Atomic rename is not supported in {}, replacing the checkpoint non-atomically", target.getParent());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Unable to remove {}: {}", file, ex.getMessage());
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SessionStorage storage && storage.location.equals(location);
    }

    @Override
    public int hashCode() {
        return location.hashCode();
    }

    @Override
    public String toString() {
        return "<SessionStorage location:" + location + ">";
    }
}
