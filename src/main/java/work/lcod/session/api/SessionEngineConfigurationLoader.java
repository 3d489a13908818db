package work.lcod.session.api;

import java.io.IOException;
import java.nio.file.Path;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.lcod.session.resume.ResumeFlag;

/**
 * Reads {@link SessionEngineConfiguration} from a TOML file. Keys that are absent keep their defaults.
 *
 * <pre>
 * [estimate]
 * manual_overhead = 30.0
 *
 * [resume]
 * validate_references = true
 * rewrite_legacy_pathnames = false
 * ignore_checksums = false
 *
 * [storage]
 * location = "/var/tmp/lcod/sessions"
 * </pre>
 */
public final class SessionEngineConfigurationLoader {
    private SessionEngineConfigurationLoader() {}

    public static SessionEngineConfiguration load(Path path) {
        TomlParseResult result;
        try {
            result = Toml.parse(path);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read configuration " + path + ": " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration " + path + ": " + result.errors().get(0));
        }
        return fromToml(result, path);
    }

    public static SessionEngineConfiguration parse(String toml) {
        var result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration: " + result.errors().get(0));
        }
        return fromToml(result, null);
    }

    static SessionEngineConfiguration fromToml(TomlParseResult result, Path source) {
        var builder = SessionEngineConfiguration.builder();
        var overhead = result.get("estimate.manual_overhead");
        if (overhead != null) {
            if (!(overhead instanceof Number number)) {
                throw new IllegalArgumentException(describe(source) + ": estimate.manual_overhead must be a number");
            }
            builder.manualOverhead(number.doubleValue());
        }
        readFlag(result, source, "resume.validate_references", ResumeFlag.VALIDATE_REFERENCES, builder);
        readFlag(result, source, "resume.rewrite_legacy_pathnames", ResumeFlag.REWRITE_LEGACY_PATHNAMES, builder);
        readFlag(result, source, "resume.ignore_checksums", ResumeFlag.IGNORE_CHECKSUMS, builder);
        var location = result.get("storage.location");
        if (location != null) {
            if (!(location instanceof String text) || text.isBlank()) {
                throw new IllegalArgumentException(describe(source) + ": storage.location must be a non-empty string");
            }
            var locationPath = Path.of(text);
            if (!locationPath.isAbsolute() && source != null && source.toAbsolutePath().getParent() != null) {
                locationPath = source.toAbsolutePath().getParent().resolve(locationPath).normalize();
            }
            builder.storageLocation(locationPath);
        }
        return builder.build();
    }

    private static void readFlag(
        TomlParseResult result,
        Path source,
        String key,
        ResumeFlag flag,
        SessionEngineConfiguration.Builder builder
    ) {
        var value = result.get(key);
        if (value == null) {
            return;
        }
        if (!(value instanceof Boolean enabled)) {
            throw new IllegalArgumentException(describe(source) + ": " + key + " must be a boolean");
        }
        builder.resumeFlag(flag, enabled);
    }

    private static String describe(Path source) {
        return source == null ? "Invalid configuration" : "Invalid configuration " + source;
    }
}
