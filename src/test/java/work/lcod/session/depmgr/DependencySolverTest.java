package work.lcod.session.depmgr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.session.support.SessionTestSupport.ids;
import static work.lcod.session.support.SessionTestSupport.requiring;
import static work.lcod.session.support.SessionTestSupport.resource;
import static work.lcod.session.support.SessionTestSupport.shell;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.session.job.Job;

class DependencySolverTest {
    private final DependencySolver solver = new DependencySolver();

    @Test
    void ordersDependenciesBeforeDependents() {
        var a = shell("A", "C", "B");
        var b = shell("B", "C");
        var c = shell("C");
        assertEquals(List.of("C", "B", "A"), ids(solver.resolve(List.of(a, b, c), List.of(a))));
    }

    @Test
    void visitsOnlyWhatIsReachable() {
        var a = shell("A");
        var b = shell("B", "A");
        var unrelated = shell("X");
        assertEquals(List.of("A", "B"), ids(solver.resolve(List.of(unrelated, b, a), List.of(b))));
        assertEquals(List.of("X", "A", "B"), ids(solver.resolve(List.of(unrelated, b, a), null)));
    }

    @Test
    void resourceJobsComeBeforeTheirConsumers() {
        var consumer = requiring("bt", "device.category == 'BLUETOOTH'");
        var device = resource("device");
        assertEquals(List.of("device", "bt"), ids(solver.resolve(List.of(consumer, device), List.of(consumer))));
    }

    @Test
    void reportsMissingDependency() {
        var a = shell("A", "ghost");
        var ex = assertThrows(DependencyMissingException.class, () -> solver.resolve(List.of(a), List.of(a)));
        assertSame(a, ex.affectedJob());
        assertEquals("ghost", ex.missingJobId());
        assertEquals(DependencyMissingException.DependencyType.DIRECT, ex.type());
        assertEquals("missing dependency: 'ghost' (direct)", ex.getMessage());
    }

    @Test
    void reportsMissingResource() {
        var a = requiring("A", "ghost.attr == 'x'");
        var ex = assertThrows(DependencyMissingException.class, () -> solver.resolve(List.of(a), List.of(a)));
        assertEquals(DependencyMissingException.DependencyType.RESOURCE, ex.type());
        assertEquals(DependencyProblem.Kind.MISSING, ex.problem().kind());
    }

    @Test
    void reportsCycles() {
        var a = shell("A", "B");
        var b = shell("B", "A");
        var ex = assertThrows(DependencyCycleException.class, () -> solver.resolve(List.of(a, b), List.of(a)));
        assertEquals(List.of(a, b, a), ex.cycle());
        assertEquals("dependency cycle detected: A -> B -> A", ex.getMessage());
        assertSame(a, ex.affectedJob());
    }

    @Test
    void reportsSelfDependency() {
        var a = shell("A", "A");
        var ex = assertThrows(DependencyCycleException.class, () -> solver.resolve(List.of(a), List.of(a)));
        assertEquals(List.of(a, a), ex.cycle());
    }

    @Test
    void reportsDuplicateIds() {
        var first = Job.builder("A").command("true").build();
        var second = Job.builder("A").command("false").build();
        var ex = assertThrows(DuplicateJobException.class, () -> solver.resolve(List.of(first, second), List.of(first)));
        assertSame(first, ex.job());
        assertSame(second, ex.duplicateJob());
        assertEquals(DependencyProblem.Kind.DUPLICATE, ex.problem().kind());
    }

    @Test
    void rejectsVisitOfUnknownJob() {
        assertThrows(IllegalArgumentException.class, () -> solver.resolve(List.of(shell("A")), List.of(shell("B"))));
    }
}
