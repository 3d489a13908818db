package work.lcod.session.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.session.resource.ResourceProgramException;

class JobTest {
    @Test
    void checksumIgnoresKeyOrder() {
        var first = new LinkedHashMap<String, Object>();
        first.put("id", "a");
        first.put("plugin", "shell");
        first.put("command", "true");
        var second = new LinkedHashMap<String, Object>();
        second.put("command", "true");
        second.put("plugin", "shell");
        second.put("id", "a");
        assertEquals(Job.of(first).checksum(), Job.of(second).checksum());
        assertEquals(Job.of(first), Job.of(second));
    }

    @Test
    void checksumChangesWithDefinition() {
        var before = Job.builder("a").command("true").build();
        var after = Job.builder("a").command("false").build();
        assertNotEquals(before.checksum(), after.checksum());
        assertNotEquals(before, after);
        assertEquals(64, before.checksum().length());
    }

    @Test
    void parsesDependencyListsFromTextAndLists() {
        var fromText = Job.of(Map.of("id", "x", "plugin", "shell", "depends", "c b,  a"));
        assertEquals(List.of("a", "b", "c"), List.copyOf(fromText.dependencies()));
        var fromList = Job.of(Map.of("id", "y", "plugin", "shell", "depends", List.of("b", " a ")));
        assertEquals(Set.of("a", "b"), fromList.dependencies());
        assertTrue(Job.of(Map.of("id", "z", "plugin", "shell")).dependencies().isEmpty());
    }

    @Test
    void exposesResourceDependenciesOfRequirements() {
        var job = Job.builder("bt").requires("package.name == 'bluez'\ndevice.category == 'BLUETOOTH'").build();
        assertEquals(Set.of("package", "device"), job.resourceDependencies());
        assertTrue(Job.builder("plain").build().resourceProgram().isEmpty());
    }

    @Test
    void compilesRequirementsOnceOnFirstUse() {
        var job = Job.builder("bt").requires("package.name == 'bluez'").build();
        assertSame(job.resourceProgram().orElseThrow(), job.resourceProgram().orElseThrow());

        var broken = Job.builder("broken").requires("package.name = 'bluez'").build();
        assertThrows(ResourceProgramException.class, broken::resourceProgram);
    }

    @Test
    void readsEstimatedDurationFromNumbersAndText() {
        assertEquals(2.5, Job.builder("a").estimatedDuration(2.5).build().estimatedDuration().getAsDouble());
        assertEquals(3.0, Job.builder("b").field("estimated_duration", " 3 ").build().estimatedDuration().getAsDouble());
        assertTrue(Job.builder("c").field("estimated_duration", "soon").build().estimatedDuration().isEmpty());
    }

    @Test
    void childJobsRememberTheirOrigin() {
        var local = Job.builder("gen").plugin(PluginKind.LOCAL).build();
        var child = local.createChildJob(Map.of("id", "gen/child", "plugin", "shell"));
        assertEquals("gen", child.via().orElseThrow());
        assertTrue(local.via().isEmpty());
    }

    @Test
    void rejectsInvalidDefinitions() {
        assertThrows(IllegalArgumentException.class, () -> Job.of(Map.of("plugin", "shell")));
        assertThrows(IllegalArgumentException.class, () -> Job.of(Map.of("id", "  ", "plugin", "shell")));
        assertThrows(IllegalArgumentException.class, () -> Job.of(Map.of("id", "a")));
        var unknown = assertThrows(IllegalArgumentException.class, () -> Job.of(Map.of("id", "a", "plugin", "qml")));
        assertEquals("Unsupported job plugin: qml", unknown.getMessage());
    }

    @Test
    void certificationStatusDefaultsToUnspecified() {
        assertEquals("unspecified", Job.builder("a").build().certificationStatus());
        assertEquals("blocker", Job.builder("b").field("certification_status", "blocker").build().certificationStatus());
    }
}
