package work.lcod.session.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directory containing the storages of current and past sessions.
 */
public final class SessionStorageRepository {
    private static final Logger log = LoggerFactory.getLogger(SessionStorageRepository.class);

    static final String LAST_SESSION_LINK = "last-session";

    private final Path location;

    public SessionStorageRepository() {
        this(defaultLocation());
    }

    public SessionStorageRepository(Path location) {
        this.location = location;
    }

    /**
     * {@code $XDG_CACHE_HOME/lcod/sessions}, falling back to {@code ~/.cache/lcod/sessions}.
     */
    public static Path defaultLocation() {
        String cacheHome = System.getenv("XDG_CACHE_HOME");
        if (cacheHome == null || cacheHome.isBlank()) {
            String home = System.getProperty("user.home");
            if (home == null || home.isBlank()) {
                throw new IllegalStateException("Unable to determine user home directory");
            }
            return Path.of(home, ".cache", "lcod", "sessions");
        }
        return Path.of(cacheHome, "lcod", "sessions");
    }

    public Path location() {
        return location;
    }

    /**
     * Storage the {@code last-session} link points to, if it still exists.
     */
    public Optional<SessionStorage> lastStorage() {
        var link = location.resolve(LAST_SESSION_LINK);
        if (!Files.isSymbolicLink(link)) {
            return Optional.empty();
        }
        try {
            var target = location.resolve(Files.readSymbolicLink(link));
            return Files.isDirectory(target) ? Optional.of(new SessionStorage(target)) : Optional.empty();
        } catch (IOException ex) {
            log.warn("Unable to read {}: {}", link, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Every session directory in the repository; empty when the repository does not exist.
     */
    public List<SessionStorage> storageList() {
        log.debug("Enumerating sessions in {}", location);
        var storages = new ArrayList<SessionStorage>();
        try (Stream<Path> entries = Files.list(location)) {
            entries
                .filter(path -> Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS))
                .sorted()
                .forEach(path -> storages.add(new SessionStorage(path)));
        } catch (NoSuchFileException ex) {
            return List.of();
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to list sessions in " + location + ": " + ex.getMessage(), ex);
        }
        return storages;
    }

    public SessionStorage createStorage() {
        return SessionStorage.create(location);
    }
}
