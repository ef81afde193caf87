package org.scout.core.exec;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scout.core.annotation.AnnotationIndex;
import org.scout.core.extract.TestExtractor;
import org.scout.core.extract.UnitParseException;
import org.scout.core.filter.TestFilter;
import org.scout.core.load.CompilerSettings;
import org.scout.core.load.CompilingUnitLoader;
import org.scout.core.model.DiscoveredUnit;
import org.scout.core.model.InvocationOutcome;
import org.scout.core.model.OutcomeError;
import org.scout.core.prep.PrepContext;
import org.scout.core.prep.PrepRegistry;
import org.scout.core.worker.WorkerSetup;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.scout.core.SampleProjects.passingClass;

class ExecutionSchedulerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void singleWorkerStreamsOutcomesInDiscoveryOrder() throws UnitParseException {
        List<DiscoveredUnit> units = List.of(
                unit("unit_a", passingClass("TestA", "testOne", "testTwo")),
                unit("unit_b", passingClass("TestB", "testThree")));
        List<InvocationOutcome> streamed = new ArrayList<>();

        List<InvocationOutcome> outcomes = scheduler(1, 64).execute(units, TestFilter.all(), null, streamed::add);

        assertThat(outcomes).extracting(InvocationOutcome::methodName).containsExactly("testOne", "testTwo", "testThree");
        assertThat(streamed).isEqualTo(outcomes);
    }

    @Test
    void filterNarrowsToOneClass() throws UnitParseException {
        List<DiscoveredUnit> units = List.of(
                unit("unit_a", "class TestB { void testX() {} void testY() {} }\nclass TestOther { void testZ() {} }"),
                unit("unit_c", passingClass("TestB", "testX")));

        List<InvocationOutcome> outcomes = scheduler(1, 64)
                .execute(units, TestFilter.parse("unit_a.TestB"), null, outcome -> { });

        assertThat(outcomes).extracting(InvocationOutcome::unitId, InvocationOutcome::className)
                .containsOnly(tuple("unit_a", "TestB"));
        assertThat(outcomes).extracting(InvocationOutcome::methodName).containsExactly("testX", "testY");
    }

    @Test
    void multipleWorkersProduceTheSameOutcomesAsOne() throws UnitParseException {
        List<DiscoveredUnit> units = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            units.add(unit("unit_" + i, String.join("\n",
                    "public class TestUnit" + i + " {",
                    "    public void testPass() {}",
                    "    public void testFail() { throw new IllegalStateException(\"unit " + i + "\"); }",
                    "}")));
        }

        List<InvocationOutcome> sequential = scheduler(1, 1).execute(units, TestFilter.all(), null, outcome -> { });
        List<InvocationOutcome> parallel = scheduler(2, 1).execute(units, TestFilter.all(), null, outcome -> { });

        assertThat(parallel).hasSize(6);
        assertThat(new HashSet<>(parallel)).isEqualTo(new HashSet<>(sequential));
    }

    @Test
    void workerThatDiesFailsOnlyItsBatch() throws UnitParseException {
        List<DiscoveredUnit> units = new ArrayList<>();
        units.add(unit("unit_exit", String.join("\n",
                "public class TestExit {",
                "    public void testLeave() { System.exit(3); }",
                "    public void testNeverReached() {}",
                "}")));
        for (int i = 0; i < 4; i++) {
            units.add(unit("unit_" + i, passingClass("TestUnit" + i, "testPass")));
        }

        List<InvocationOutcome> outcomes = scheduler(2, 1).execute(units, TestFilter.all(), null, outcome -> { });

        assertThat(outcomes).hasSize(6);
        assertThat(outcomes).filteredOn(outcome -> outcome.unitId().equals("unit_exit"))
                .extracting(InvocationOutcome::methodName, outcome -> outcome.error().kind())
                .containsExactlyInAnyOrder(
                        tuple("testLeave", OutcomeError.Kind.EXEC_ERROR),
                        tuple("testNeverReached", OutcomeError.Kind.EXEC_ERROR));
        assertThat(outcomes).filteredOn(outcome -> outcome.unitId().equals("unit_exit"))
                .allSatisfy(outcome -> assertThat(outcome.error().describe()).startsWith("ExecError: Worker failed: "));
        assertThat(outcomes).filteredOn(outcome -> !outcome.unitId().equals("unit_exit"))
                .hasSize(4)
                .allMatch(InvocationOutcome::passed);
    }

    private ExecutionScheduler scheduler(int workers, int batchSize) {
        SchedulerSettings settings = new SchedulerSettings();
        settings.setMaxWorkers(workers);
        settings.setBatchSize(batchSize);

        CompilerSettings compilerSettings = new CompilerSettings();
        compilerSettings.setSourcePath(List.of(tempDir));
        PrepRegistry registry = new PrepRegistry();
        BatchRunner runner = new BatchRunner(new CompilingUnitLoader(compilerSettings), new PrepContext(registry),
                AnnotationIndex.empty(), objectMapper);

        WorkerSetup setup = new WorkerSetup();
        setup.setProjectRoot(tempDir.toString());
        setup.setSourcePath(List.of(tempDir.toString()));
        return new ExecutionScheduler(settings, runner, setup, objectMapper);
    }

    private static DiscoveredUnit unit(String unitId, String content) throws UnitParseException {
        return new DiscoveredUnit(unitId, "", content, new TestExtractor().extract(content).testMethods());
    }
}
