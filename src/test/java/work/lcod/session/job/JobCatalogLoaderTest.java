package work.lcod.session.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class JobCatalogLoaderTest {
    private static final Path CATALOGS = Path.of("src", "test", "resources", "catalogs");

    @Test
    void loadsYamlCatalog() {
        var jobs = JobCatalogLoader.load(CATALOGS.resolve("audio.yaml"));
        assertEquals(List.of("package", "audio/detect", "audio/playback", "audio/blocked"),
            jobs.stream().map(Job::id).toList());
        assertEquals(PluginKind.RESOURCE, jobs.get(0).plugin());
        assertEquals(Set.of("package"), jobs.get(1).resourceDependencies());
        assertEquals(PluginKind.USER_INTERACT_VERIFY, jobs.get(2).plugin());
        assertTrue(jobs.get(2).hasFlag("also-after-suspend"));
    }

    @Test
    void loadsJsonCatalogsTogether() {
        var jobs = JobCatalogLoader.load(List.of(CATALOGS.resolve("cycle.json"), CATALOGS.resolve("audio.yaml")));
        assertEquals(6, jobs.size());
        assertEquals(Set.of("A"), jobs.get(1).dependencies());
    }

    @Test
    void documentWithoutJobsIsEmpty() throws IOException {
        assertTrue(parse("title: nothing here\n").isEmpty());
    }

    @Test
    void reportsTheOffendingJob() {
        var ex = assertThrows(IllegalArgumentException.class,
            () -> parse("jobs:\n  - id: ok\n    plugin: shell\n  - id: broken\n"));
        assertEquals("Job #2 in inline: Job plugin is required", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> parse("jobs: 3\n"));
        assertThrows(IllegalArgumentException.class, () -> parse("jobs:\n  - just-text\n"));
    }

    @Test
    void missingFileIsReported() {
        var ex = assertThrows(IllegalStateException.class, () -> JobCatalogLoader.load(CATALOGS.resolve("absent.yaml")));
        assertTrue(ex.getMessage().startsWith("Failed to read job catalog"));
    }

    private static List<Job> parse(String yaml) throws IOException {
        return JobCatalogLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "inline");
    }
}
