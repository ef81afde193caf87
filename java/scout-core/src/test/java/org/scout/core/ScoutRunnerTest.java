package org.scout.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scout.core.filter.InvalidFilterFormatException;
import org.scout.core.model.InvocationOutcome;
import org.scout.core.model.RunSummary;
import org.scout.core.prep.PrepRegistry;
import org.scout.core.prep.PrepScope;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.scout.core.SampleProjects.passingClass;
import static org.scout.core.SampleProjects.write;

class ScoutRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void onePassingAndOneFailingTest() {
        write(tempDir, "test_math.java", SampleProjects.MATH_UNIT);
        List<InvocationOutcome> streamed = new ArrayList<>();

        RunReport report = new ScoutRunner(options()).run(streamed::add);

        RunSummary summary = report.summary();
        assertThat(summary.collected()).isEqualTo(2);
        assertThat(summary.executed()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.passed()).isEqualTo(1);
        InvocationOutcome failure = report.outcomes().stream().filter(o -> !o.passed()).findFirst().orElseThrow();
        assertThat(failure.error().describe()).contains("x");
        assertThat(streamed).isEqualTo(report.outcomes());
    }

    @Test
    void filteredRunsExecuteNoMoreThanCollected() {
        write(tempDir, "unit_a.java", passingClass("TestA", "testOne", "testTwo"));
        write(tempDir, "unit_b.java", passingClass("TestB", "testThree"));

        RunOptions unfiltered = options();
        RunOptions filtered = options();
        filtered.setFilter("unit_a.TestA.testTwo");

        RunSummary all = new ScoutRunner(unfiltered).run().summary();
        RunSummary some = new ScoutRunner(filtered).run().summary();

        assertThat(all.executed()).isEqualTo(all.collected()).isEqualTo(3);
        assertThat(some.collected()).isEqualTo(3);
        assertThat(some.executed()).isEqualTo(1);
    }

    @Test
    void unparseableUnitsAreFlaggedAndTheRunContinues() {
        write(tempDir, "test_broken.java", "class TestBroken { void testIt( }");
        write(tempDir, "test_fine.java", passingClass("TestFine", "testOk"));

        RunReport report = new ScoutRunner(options()).run();

        assertThat(report.discovery().parseFailures()).hasSize(1);
        assertThat(report.summary().executed()).isEqualTo(1);
        assertThat(report.summary().failed()).isZero();
    }

    @Test
    void missingProjectIsRejectedBeforeRunning() {
        RunOptions options = options();
        options.setProjectRoot(tempDir.resolve("missing"));

        assertThatThrownBy(() -> new ScoutRunner(options).run())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void badFilterIsRejectedBeforeRunning() {
        RunOptions options = options();
        options.setFilter("a.b.c.d");

        assertThatThrownBy(() -> new ScoutRunner(options).run()).isInstanceOf(InvalidFilterFormatException.class);
    }

    @Test
    void brokenPrepUnitIsAConfigurationError() {
        write(tempDir, "preps.java", "public class Preps { not java }");
        RunOptions options = options();
        options.setPrepUnits(List.of("preps.java"));

        assertThatThrownBy(() -> new ScoutRunner(options).run()).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void programmaticPrepsAreVisibleInProcess() {
        write(tempDir, "test_greeting.java", String.join("\n",
                "import org.scout.core.prep.Preps;",
                "public class TestGreeting {",
                "    public void testGreeting() {",
                "        if (!\"hello\".equals(Preps.session(\"greeting\"))) throw new AssertionError(\"wrong greeting\");",
                "    }",
                "}"));
        PrepRegistry registry = new PrepRegistry();
        registry.register(PrepScope.SESSION, "greeting", () -> "hello");
        RunOptions options = options();
        options.setPrepRegistry(registry);

        assertThat(new ScoutRunner(options).run().summary().failed()).isZero();
    }

    @Test
    void totalTimeIncludesPrepUnitLoading() {
        write(tempDir, "fixtures/slow_preps.java", String.join("\n",
                "public class SlowPreps {",
                "    static {",
                "        try { Thread.sleep(300); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }",
                "    }",
                "}"));
        write(tempDir, "unit_a.java", passingClass("TestA", "testOne"));
        RunOptions options = options();
        options.setPrepUnits(List.of("fixtures/slow_preps.java"));

        RunSummary summary = new ScoutRunner(options).run().summary();

        assertThat(summary.executed()).isEqualTo(1);
        assertThat(summary.elapsed()).isGreaterThanOrEqualTo(Duration.ofMillis(300));
    }

    @Test
    void sessionPrepIsSharedWithinOneProcess() {
        writeTokenProject(4);

        List<String> tokens = tokens(new ScoutRunner(tokenOptions(1)).run());

        assertThat(tokens).hasSize(4);
        assertThat(Set.copyOf(tokens)).hasSize(1);
        assertThat(pidOf(tokens.get(0))).isEqualTo(ProcessHandle.current().pid());
    }

    @Test
    void sessionPrepIsPerProcessWithWorkers() {
        writeTokenProject(4);

        List<String> tokens = tokens(new ScoutRunner(tokenOptions(2)).run());

        assertThat(tokens).hasSize(4);
        Set<Long> pids = tokens.stream().map(ScoutRunnerTest::pidOf).collect(Collectors.toSet());
        assertThat(Set.copyOf(tokens)).hasSameSizeAs(pids);
        assertThat(pids).doesNotContain(ProcessHandle.current().pid());
    }

    private void writeTokenProject(int units) {
        write(tempDir, "fixtures/session_preps.java", String.join("\n",
                "import org.scout.core.prep.Prep;",
                "public class SessionPreps {",
                "    @Prep(scope = \"session\", name = \"token\")",
                "    public static String token() { return ProcessHandle.current().pid() + \":\" + System.nanoTime(); }",
                "}"));
        for (int i = 0; i < units; i++) {
            write(tempDir, "test_token_" + i + ".java", String.join("\n",
                    "import org.scout.core.prep.Preps;",
                    "public class TestToken" + i + " {",
                    "    public void testToken() { throw new IllegalStateException(\"token=\" + Preps.session(\"token\")); }",
                    "}"));
        }
    }

    private RunOptions tokenOptions(int workers) {
        RunOptions options = options();
        options.setMaxWorkers(workers);
        options.setBatchSize(1);
        options.setPrepUnits(List.of("fixtures/session_preps.java"));
        return options;
    }

    private static List<String> tokens(RunReport report) {
        return report.outcomes().stream()
                .map(outcome -> outcome.error().message())
                .map(message -> message.substring(message.indexOf("token=") + "token=".length()))
                .collect(Collectors.toList());
    }

    private static long pidOf(String token) {
        return Long.parseLong(token.substring(0, token.indexOf(':')));
    }

    private RunOptions options() {
        RunOptions options = new RunOptions();
        options.setProjectRoot(tempDir);
        return options;
    }
}
