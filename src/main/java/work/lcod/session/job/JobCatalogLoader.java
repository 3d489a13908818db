package work.lcod.session.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads job definitions from a YAML (or JSON) document with a top-level {@code jobs} list.
 *
 * <pre>
 * jobs:
 *   - id: package
 *     plugin: resource
 *     command: dpkg-query -W -f='name: ${Package}\n\n'
 *   - id: bluetooth/detect
 *     requires: package.name == 'bluez'
 *     command: hciconfig
 * </pre>
 */
public final class JobCatalogLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private JobCatalogLoader() {}

    public static List<Job> load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read job catalog: " + path, ex);
        }
    }

    public static List<Job> load(List<Path> paths) {
        var jobs = new ArrayList<Job>();
        for (var path : paths) {
            jobs.addAll(load(path));
        }
        return jobs;
    }

    /**
     * @param origin used in error messages
     */
    public static List<Job> parse(InputStream in, String origin) throws IOException {
        JsonNode root = YAML_MAPPER.readTree(in);
        if (root == null || root.isMissingNode() || !root.hasNonNull("jobs")) {
            return List.of();
        }
        var jobsNode = root.get("jobs");
        if (!jobsNode.isArray()) {
            throw new IllegalArgumentException("'jobs' must be a list in " + origin);
        }
        var jobs = new ArrayList<Job>(jobsNode.size());
        int index = 0;
        for (var node : jobsNode) {
            index++;
            if (!node.isObject()) {
                throw new IllegalArgumentException("Job #" + index + " in " + origin + " is not a mapping");
            }
            try {
                jobs.add(Job.of(YAML_MAPPER.convertValue(node, MAP_REF)));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Job #" + index + " in " + origin + ": " + ex.getMessage(), ex);
            }
        }
        return jobs;
    }
}
