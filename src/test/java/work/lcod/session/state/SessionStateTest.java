package work.lcod.session.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.session.support.SessionTestSupport.fail;
import static work.lcod.session.support.SessionTestSupport.ids;
import static work.lcod.session.support.SessionTestSupport.local;
import static work.lcod.session.support.SessionTestSupport.pass;
import static work.lcod.session.support.SessionTestSupport.requiring;
import static work.lcod.session.support.SessionTestSupport.resource;
import static work.lcod.session.support.SessionTestSupport.shell;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.session.depmgr.DependencyProblem;
import work.lcod.session.depmgr.DuplicateJobException;
import work.lcod.session.job.Job;
import work.lcod.session.job.PluginKind;
import work.lcod.session.resource.ResourceRecord;
import work.lcod.session.result.DiskJobResult;
import work.lcod.session.result.MemoryJobResult;
import work.lcod.session.result.Outcome;

class SessionStateTest {
    @TempDir
    Path tempDir;

    @Test
    void freshSessionHasNothingToRun() {
        var a = shell("A");
        var session = new SessionState(List.of(a));
        assertTrue(session.runList().isEmpty());
        assertTrue(session.desiredJobList().isEmpty());
        assertEquals(List.of(ReadinessInhibitor.UNDESIRED), inhibitors(session, a));
        assertTrue(session.jobStateMap().get("A").result().isHollow());
    }

    @Test
    void dependentWaitsForItsDependency() {
        var a = shell("A");
        var b = shell("B", "A");
        var session = new SessionState(List.of(a, b));

        assertTrue(session.updateDesiredJobList(List.of(b)).isEmpty());
        assertEquals(List.of("A", "B"), ids(session.runList()));
        assertTrue(session.jobStateMap().get("A").canStart());
        assertEquals(List.of(ReadinessInhibitor.pendingDependency(a)), inhibitors(session, b));

        session.updateJobResult(a, pass());
        assertTrue(session.jobStateMap().get("B").canStart());

        session.updateJobResult(a, fail());
        assertEquals(List.of(ReadinessInhibitor.failedDependency(a)), inhibitors(session, b));
        assertEquals("required dependency 'A' has failed", inhibitors(session, b).get(0).description());
    }

    @Test
    void readinessDoesNotDependOnCallOrder() {
        var a = shell("A");
        var b = shell("B", "A");
        var session = new SessionState(List.of(a, b));

        session.updateJobResult(a, fail());
        assertEquals(List.of(ReadinessInhibitor.UNDESIRED), inhibitors(session, b));

        session.updateDesiredJobList(List.of(b));
        assertEquals(List.of(ReadinessInhibitor.failedDependency(a)), inhibitors(session, b));

        session.updateDesiredJobList(List.of());
        assertTrue(session.runList().isEmpty());
        assertEquals(List.of(ReadinessInhibitor.UNDESIRED), inhibitors(session, b));
        assertEquals(List.of(ReadinessInhibitor.UNDESIRED), inhibitors(session, a));
    }

    @Test
    void skippedDependencyBlocksLikeAFailure() {
        var a = shell("A");
        var b = shell("B", "A");
        var session = new SessionState(List.of(a, b));
        session.updateDesiredJobList(List.of(b));
        session.updateJobResult(a, MemoryJobResult.of(Outcome.SKIP));
        assertEquals(InhibitorCause.FAILED_DEP, inhibitors(session, b).get(0).cause());
    }

    @Test
    void resourceRequirementFollowsResourceData() {
        var device = resource("device");
        var bt = requiring("bt", "device.category == 'BLUETOOTH'");
        var session = new SessionState(List.of(device, bt));
        session.updateDesiredJobList(List.of(bt));
        assertEquals(List.of("device", "bt"), ids(session.runList()));
        assertEquals(InhibitorCause.PENDING_RESOURCE, inhibitors(session, bt).get(0).cause());
        assertSame(device, inhibitors(session, bt).get(0).relatedJob());

        session.updateJobResult(device, MemoryJobResult.withStdout(Outcome.PASS,
            "category: AUDIO\n\ncategory: BLUETOOTH\n"));
        assertEquals(2, session.resourceMap().get("device").size());
        assertTrue(session.jobStateMap().get("bt").canStart());

        session.updateJobResult(device, MemoryJobResult.withStdout(Outcome.PASS, "category: WIRELESS\n"));
        assertEquals(List.of(ResourceRecord.of("category", "WIRELESS")), session.resourceMap().get("device"));
        var inhibitor = inhibitors(session, bt).get(0);
        assertEquals(InhibitorCause.FAILED_RESOURCE, inhibitor.cause());
        assertEquals("device.category == 'BLUETOOTH'", inhibitor.relatedExpression().text());
    }

    @Test
    void malformedResourceRecordsAreDropped() {
        var device = resource("device");
        var session = new SessionState(List.of(device));
        session.updateJobResult(device, MemoryJobResult.withStdout(Outcome.PASS,
            "category: AUDIO\n\nthis is not a record\n\ncategory: VIDEO\n"));
        assertEquals(List.of(ResourceRecord.of("category", "AUDIO"), ResourceRecord.of("category", "VIDEO")),
            session.resourceMap().get("device"));
    }

    @Test
    void unreadableResourceOutputCountsAsEmpty() {
        var device = resource("device");
        var bt = requiring("bt", "device.category == 'BLUETOOTH'");
        var session = new SessionState(List.of(device, bt));
        session.updateDesiredJobList(List.of(bt));
        session.updateJobResult(device, new DiskJobResult(Outcome.PASS, null, 0, null, tempDir.resolve("gone.gz")));
        assertEquals(List.of(), session.resourceMap().get("device"));
        assertEquals(InhibitorCause.FAILED_RESOURCE, inhibitors(session, bt).get(0).cause());
    }

    @Test
    void setResourceListReplacesRecords() {
        var device = resource("device");
        var bt = requiring("bt", "device.category == 'BLUETOOTH'");
        var session = new SessionState(List.of(device, bt));
        session.updateDesiredJobList(List.of(bt));
        session.setResourceList("device", List.of(ResourceRecord.of("category", "BLUETOOTH")));
        assertTrue(session.jobStateMap().get("bt").canStart());
        session.setResourceList("device", List.of());
        assertFalse(session.jobStateMap().get("bt").canStart());
    }

    @Test
    void localJobAddsGeneratedJobs() {
        var generator = local("gen");
        var existing = shell("gen/existing");
        var session = new SessionState(List.of(generator, existing));
        var added = new ArrayList<String>();
        session.events().onJobAdded(event -> added.add(event.job().id()));

        session.updateJobResult(generator, MemoryJobResult.withStdout(Outcome.PASS,
            "id: gen/a\nplugin: shell\ncommand: true\n\n"
                + "id: gen/b\nplugin: shell\ndepends: gen/a\n\n"
                + "id: gen/existing\nplugin: manual\n\n"
                + "id: gen/broken\nplugin: nonsense\n"));

        assertEquals(List.of("gen/a", "gen/b"), added);
        assertEquals(List.of("gen", "gen/existing", "gen/a", "gen/b"), ids(session.jobList()));
        var child = session.jobStateMap().get("gen/b").job();
        assertEquals("gen", child.via().orElseThrow());
        assertSame(existing, session.jobStateMap().get("gen/existing").job());

        session.updateDesiredJobList(List.of(child));
        assertEquals(List.of("gen/a", "gen/b"), ids(session.runList()));
    }

    @Test
    void mandatoryJobsLeadTheDesiredList() {
        var m = shell("M");
        var x = shell("X");
        var session = new SessionState(List.of(m, x));
        session.updateMandatoryJobList(List.of(m));
        session.updateDesiredJobList(List.of(x, m));
        assertEquals(List.of("M", "X"), ids(session.desiredJobList()));
        assertEquals(List.of("M", "X"), ids(session.runList()));

        session.updateDesiredJobList(List.of(x), false);
        assertEquals(List.of("X"), ids(session.runList()));
    }

    @Test
    void cycleDropsTheAffectedJobsAndReportsThem() {
        var a = shell("A", "B");
        var b = shell("B", "A");
        var c = shell("C");
        var session = new SessionState(List.of(a, b, c));

        var problems = session.updateDesiredJobList(List.of(a, b));
        assertEquals(2, problems.size());
        assertTrue(problems.stream().allMatch(p -> p.kind() == DependencyProblem.Kind.CYCLE));
        assertTrue(session.runList().isEmpty());
        assertTrue(session.desiredJobList().isEmpty());

        problems = session.updateDesiredJobList(List.of(a, c));
        assertEquals(1, problems.size());
        assertEquals(List.of("C"), ids(session.runList()));
        assertEquals(List.of("C"), ids(session.desiredJobList()));
    }

    @Test
    void missingIndirectDependencyDropsTheDesiredRoot() {
        var a = shell("A", "ghost");
        var c = shell("C", "A");
        var d = shell("D");
        var session = new SessionState(List.of(a, c, d));

        var problems = session.updateDesiredJobList(List.of(c, d));
        assertEquals(1, problems.size());
        var problem = problems.get(0);
        assertEquals(DependencyProblem.Kind.MISSING, problem.kind());
        assertSame(a, problem.affectedJob());
        assertEquals("ghost", problem.affectingJobId());
        assertEquals(List.of("D"), ids(session.runList()));
    }

    @Test
    void endToEndResourceAndDependency() {
        var pkg = resource("package");
        var detect = Job.builder("detect").requires("package.name == 'bluez'").build();
        var test = shell("test", "detect");
        var session = new SessionState(List.of(test, detect, pkg));
        session.updateDesiredJobList(List.of(test));
        assertEquals(List.of("package", "detect", "test"), ids(session.runList()));

        session.updateJobResult(pkg, MemoryJobResult.withStdout(Outcome.PASS, "name: bluez\n"));
        assertTrue(session.jobStateMap().get("detect").canStart());
        assertEquals(InhibitorCause.PENDING_DEP, inhibitors(session, test).get(0).cause());

        session.updateJobResult(detect, pass());
        assertTrue(session.jobStateMap().get("test").canStart());
    }

    @Test
    void trimRefusesScheduledJobsWithoutChangingAnything() {
        var a = shell("A");
        var b = shell("B");
        var c = shell("C");
        var session = new SessionState(List.of(a, b, c));
        session.updateDesiredJobList(List.of(a));

        var ex = assertThrows(IllegalStateException.class, () -> session.trimJobList(job -> true));
        assertEquals("Cannot remove jobs that are on the run list: [A]", ex.getMessage());
        assertEquals(3, session.jobList().size());

        var removed = new ArrayList<String>();
        session.events().onJobRemoved(event -> removed.add(event.job().id()));
        session.trimJobList(job -> !job.id().equals("A"));
        assertEquals(List.of("A"), ids(session.jobList()));
        assertEquals(List.of("B", "C"), removed);
        assertFalse(session.jobStateMap().containsKey("B"));
    }

    @Test
    void removeUnitRefusesScheduledJobs() {
        var a = shell("A");
        var b = shell("B");
        var session = new SessionState(List.of(a, b));
        session.updateMandatoryJobList(List.of(b));
        session.updateDesiredJobList(List.of(a), false);

        assertThrows(IllegalStateException.class, () -> session.removeUnit(a));
        session.removeUnit(b);
        assertEquals(List.of("A"), ids(session.jobList()));
        assertTrue(session.mandatoryJobList().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> session.removeUnit(b));
    }

    @Test
    void duplicateDefinitionsConflict() {
        var first = Job.builder("A").command("true").build();
        var second = Job.builder("A").command("false").build();
        assertThrows(DuplicateJobException.class, () -> new SessionState(List.of(first, second)));

        var session = new SessionState(List.of(first, first));
        assertEquals(1, session.jobList().size());
        session.addJob(first);
        assertEquals(1, session.jobList().size());
        assertThrows(DuplicateJobException.class, () -> session.addJob(second));
        assertThrows(IllegalArgumentException.class, () -> session.updateDesiredJobList(List.of(second)));
        assertThrows(IllegalArgumentException.class, () -> session.updateJobResult(second, pass()));
    }

    @Test
    void addedJobsStartUndesired() {
        var session = new SessionState(List.of());
        var a = shell("A");
        session.addUnit(a);
        assertEquals(List.of(ReadinessInhibitor.UNDESIRED), inhibitors(session, a));
        session.addJob(shell("A"));
        assertEquals(1, session.jobList().size());
        session.updateDesiredJobList(List.of(a));
        assertTrue(session.jobStateMap().get("A").canStart());
    }

    @Test
    void estimatesAutomatedAndManualDuration() {
        var automated = Job.builder("auto").estimatedDuration(10).build();
        var generator = local("gen");
        var manual = Job.builder("manual").plugin(PluginKind.MANUAL).estimatedDuration(5).build();
        var instructions = Job.builder("read").plugin(PluginKind.USER_VERIFY).build();
        var unknown = shell("unknown");
        var session = new SessionState(List.of(automated, generator, manual, instructions, unknown));

        session.updateDesiredJobList(List.of(automated, generator, manual, instructions));
        var estimate = session.estimatedDuration();
        assertEquals(10.0, estimate.automated().getAsDouble());
        assertEquals(65.0, estimate.manual().getAsDouble());
        assertEquals(75.0, estimate.total().getAsDouble());
        assertEquals(5.0, session.estimatedDuration(0).manual().getAsDouble());

        session.updateDesiredJobList(List.of(automated, unknown));
        assertTrue(session.estimatedDuration().automated().isEmpty());
        assertTrue(session.estimatedDuration().total().isEmpty());
    }

    @Test
    void stateChangeIsDeliveredBeforeJobEvents() {
        var a = shell("A");
        var session = new SessionState(List.of(a));
        var seen = new ArrayList<String>();
        session.events().onStateChanged(event -> seen.add("state:" + event.operation()));
        session.events().onJobResultChanged(event -> seen.add("result:" + event.job().id() + ":"
            + event.oldResult().outcome() + "->" + event.newResult().outcome()));
        session.events().onJobAdded(event -> seen.add("added:" + event.job().id()));

        session.updateJobResult(a, pass());
        session.addJob(shell("B"));
        assertEquals(List.of("state:updateJobResult", "result:A:none->pass", "state:addJob", "added:B"), seen);
    }

    @Test
    void certificationStatusCanBeOverridden() {
        var a = Job.builder("A").field("certification_status", "blocker").build();
        var session = new SessionState(List.of(a));
        var state = session.jobStateMap().get("A");
        assertEquals("blocker", state.certificationStatus());
        state.setCertificationStatus("non-blocker");
        assertEquals("non-blocker", state.certificationStatus());
    }

    private static List<ReadinessInhibitor> inhibitors(SessionState session, Job job) {
        return session.jobStateMap().get(job.id()).readinessInhibitors();
    }
}
