package work.lcod.session.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import work.lcod.session.resource.ResourceProgram;

/**
 * Immutable job definition.
 *
 * <p>A job is described by a flat map of fields ({@code id}, {@code plugin}, {@code depends},
 * {@code requires}, {@code command}, {@code flags}, {@code estimated_duration}, ...). The checksum is
 * the SHA-256 of the canonical JSON form of that map (keys sorted, no whitespace), so two definitions
 * with the same id are identical exactly when their checksums match.
 */
public final class Job {
    private static final ObjectWriter CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .writer();
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[\\s,]+");

    private final Map<String, Object> data;
    private final String id;
    private final PluginKind plugin;
    private final Set<String> dependencies;
    private final Set<String> flags;
    private final String checksum;
    private final String via;
    private ResourceProgram program;

    private Job(Map<String, Object> data, String via) {
        Objects.requireNonNull(data, "data");
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        String rawId = data.get("id") instanceof String str ? str.strip() : "";
        if (rawId.isEmpty()) {
            throw new IllegalArgumentException("Job definition requires a non-empty 'id': " + data);
        }
        this.id = rawId;
        this.plugin = PluginKind.from(Objects.toString(data.get("plugin"), null));
        this.dependencies = Collections.unmodifiableSet(new TreeSet<>(splitList(data.get("depends"))));
        this.flags = Collections.unmodifiableSet(new LinkedHashSet<>(splitList(data.get("flags"))));
        this.checksum = computeChecksum(this.data);
        this.via = via;
    }

    public static Job of(Map<String, Object> data) {
        return new Job(data, null);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Creates a job generated by this (local) job from one of its output records.
     */
    public Job createChildJob(Map<String, ?> record) {
        return new Job(new LinkedHashMap<>(record), id);
    }

    public String id() {
        return id;
    }

    public String checksum() {
        return checksum;
    }

    public PluginKind plugin() {
        return plugin;
    }

    /**
     * Ids listed in {@code depends}, sorted.
     */
    public Set<String> dependencies() {
        return dependencies;
    }

    public Optional<String> requires() {
        return optionalText("requires");
    }

    /**
     * Compiled requirement program, compiled on first use.
     *
     * @throws work.lcod.session.resource.ResourceProgramException if {@code requires} is malformed
     */
    public Optional<ResourceProgram> resourceProgram() {
        var requires = requires();
        if (requires.isEmpty()) {
            return Optional.empty();
        }
        if (program == null) {
            program = new ResourceProgram(requires.get());
        }
        return Optional.of(program);
    }

    public Set<String> resourceDependencies() {
        return resourceProgram().map(ResourceProgram::requiredResources).orElse(Set.of());
    }

    public Set<String> flags() {
        return flags;
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    public Optional<String> command() {
        return optionalText("command");
    }

    public OptionalDouble estimatedDuration() {
        Object raw = data.get("estimated_duration");
        if (raw instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        if (raw instanceof String str && !str.isBlank()) {
            try {
                return OptionalDouble.of(Double.parseDouble(str.strip()));
            } catch (NumberFormatException ex) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    public String certificationStatus() {
        return optionalText("certification_status").orElse("unspecified");
    }

    /**
     * Id of the local job that generated this one, if any.
     */
    public Optional<String> via() {
        return Optional.ofNullable(via);
    }

    public Map<String, Object> data() {
        return data;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Job job && job.id.equals(id) && job.checksum.equals(checksum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, checksum);
    }

    @Override
    public String toString() {
        return "<Job id:" + id + " plugin:" + plugin.wireName() + ">";
    }

    private Optional<String> optionalText(String key) {
        Object raw = data.get(key);
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    private static List<String> splitList(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).map(String::strip).filter(s -> !s.isEmpty()).toList();
        }
        String text = raw.toString().strip();
        if (text.isEmpty()) {
            return List.of();
        }
        return List.of(LIST_SEPARATOR.split(text));
    }

    private static String computeChecksum(Map<String, Object> data) {
        try {
            byte[] canonical = CANONICAL.writeValueAsString(data).getBytes(StandardCharsets.UTF_8);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Job definition is not serializable: " + ex.getOriginalMessage(), ex);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is unavailable", ex);
        }
    }

    /**
     * Convenience builder producing the definition map.
     */
    public static final class Builder {
        private final Map<String, Object> data = new LinkedHashMap<>();

        private Builder(String id) {
            data.put("id", id);
            data.put("plugin", PluginKind.SHELL.wireName());
        }

        public Builder plugin(PluginKind plugin) {
            data.put("plugin", plugin.wireName());
            return this;
        }

        public Builder depends(String... ids) {
            data.put("depends", String.join(" ", ids));
            return this;
        }

        public Builder requires(String program) {
            data.put("requires", program);
            return this;
        }

        public Builder command(String command) {
            data.put("command", command);
            return this;
        }

        public Builder flags(String... flags) {
            data.put("flags", String.join(" ", flags));
            return this;
        }

        public Builder estimatedDuration(double seconds) {
            data.put("estimated_duration", seconds);
            return this;
        }

        public Builder field(String key, Object value) {
            data.put(key, value);
            return this;
        }

        public Job build() {
            return Job.of(data);
        }
    }
}
