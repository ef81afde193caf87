package org.scout.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    private static final String MATH_UNIT = String.join("\n",
            "import org.scout.core.annotation.Parameters;",
            "public class TestMath {",
            "    public void testAdd() {}",
            "    @Parameters({\"[2]\"})",
            "    public void testBroken(int value) { throw new IllegalStateException(\"x\" + value); }",
            "}");

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void reportsResultsAndExitsOneOnFailures() throws IOException {
        Files.writeString(tempDir.resolve("test_math.java"), MATH_UNIT);

        int code = run("--project=" + tempDir);

        assertThat(code).isEqualTo(Main.EXIT_FAILURES);
        assertThat(stdout()).contains(
                "Project: " + tempDir,
                "Max Workers: 1",
                "Batch Size: 64",
                "Quiet: false",
                "Suite: \"null\"",
                "- - - Results - - -",
                "[PASS] test_math.TestMath.testAdd",
                "[FAIL] test_math.TestMath.testBroken[[2]] → java.lang.IllegalStateException - x2",
                "- - - Summary - - -",
                "Collected: 2",
                "Executed: 2 / 2",
                "Failed: 1",
                "Passed: 1");
        assertThat(stdout()).doesNotContain("\033[");
    }

    @Test
    void quietKeepsOnlyTheSummary() throws IOException {
        Files.writeString(tempDir.resolve("test_math.java"), MATH_UNIT);

        run("-p", tempDir.toString(), "--quiet", "--filter=test_math.TestMath.testAdd");

        assertThat(stdout()).doesNotContain("- - - Results - - -", "[PASS]").contains("Executed: 1 / 2");
    }

    @Test
    void cleanRunExitsZero() throws IOException {
        Files.writeString(tempDir.resolve("test_ok.java"), "public class TestOk { public void testOk() {} }");

        assertThat(run("--project=" + tempDir)).isEqualTo(Main.EXIT_OK);
    }

    @Test
    void missingProjectExitsTwoWithoutRunning() {
        int code = run("--project=" + tempDir.resolve("nowhere"));

        assertThat(code).isEqualTo(Main.EXIT_CONFIG);
        assertThat(stderr()).contains("does not exist");
        assertThat(stdout()).isEmpty();
    }

    @Test
    void projectIsRequired() {
        assertThat(run("--quiet")).isEqualTo(Main.EXIT_CONFIG);
        assertThat(stderr()).contains("--project is required");
    }

    @Test
    void badFilterExitsTwo() {
        assertThat(run("--project=" + tempDir, "--filter=a.b.c.d")).isEqualTo(Main.EXIT_CONFIG);
        assertThat(stderr()).contains("Invalid test filter format");
    }

    @Test
    void malformedConfigExitsTwo() throws IOException {
        Files.writeString(tempDir.resolve("scout.json"), "{oops");

        assertThat(run("--project=" + tempDir)).isEqualTo(Main.EXIT_CONFIG);
    }

    @Test
    void helpPrintsUsage() {
        assertThat(run("--help")).isEqualTo(Main.EXIT_OK);
        assertThat(stdout()).contains("Usage:")
                .contains("java -jar scout-cli.jar --project=./tests")
                .contains("Worker JVMs reuse this JVM's classpath");
    }

    private int run(String... args) {
        return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), false);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
