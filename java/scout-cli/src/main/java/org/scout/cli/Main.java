package org.scout.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.scout.core.RunOptions;
import org.scout.core.RunReport;
import org.scout.core.ScoutRunner;
import org.scout.core.report.OutcomeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;

/**
 * CLI entry point for Scout.
 * Usage: java -jar scout-cli.jar --project=DIR [--workers=N] [--batch-size=N] [--quiet] [--suite=NAME] [--filter=EXPR]
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_CONFIG = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, System.console() != null));
    }

    static int run(String[] args, PrintStream out, PrintStream err, boolean color) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_CONFIG;
        }
        if (options.isHelp()) {
            printUsage(out);
            return EXIT_OK;
        }
        if (options.getProject() == null) {
            err.println("Error: --project is required");
            printUsage(err);
            return EXIT_CONFIG;
        }
        if (!Files.isDirectory(options.getProject())) {
            err.println("Error: Project " + options.getProject() + " does not exist!");
            return EXIT_CONFIG;
        }

        ObjectMapper objectMapper = new ObjectMapper();
        ConsoleReporter reporter = new ConsoleReporter(out, new OutcomeFormatter(objectMapper), options.isQuiet(), color);
        try {
            ScoutConfig config = new ConfigLoader(objectMapper).load(options.getProject());
            RunOptions runOptions = toRunOptions(options, config);

            reporter.header(options);
            reporter.resultsStart(options.getWorkers());
            RunReport report = new ScoutRunner(runOptions, objectMapper).run(reporter);
            reporter.summary(report.summary());
            return report.summary().failed() == 0 ? EXIT_OK : EXIT_FAILURES;
        } catch (IllegalArgumentException e) {
            // bad filter, bad scope, broken config or prep unit
            logger.debug("Configuration error", e);
            err.println("Error: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (RuntimeException e) {
            logger.error("Error running tests", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURES;
        }
    }

    static RunOptions toRunOptions(CliOptions options, ScoutConfig config) {
        RunOptions runOptions = new RunOptions();
        runOptions.setProjectRoot(options.getProject());
        runOptions.setMaxWorkers(options.getWorkers());
        runOptions.setBatchSize(options.getBatchSize());
        runOptions.setSuite(options.getSuite());
        runOptions.setFilter(options.getFilter());
        runOptions.setPrepUnits(config.getPreps());
        runOptions.setExcludes(config.getExclude());
        runOptions.setClasspath(config.getClasspath());
        runOptions.setWorkerJvmArgs(config.getWorkerJvmArgs());
        return runOptions;
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Scout - test discovery and execution for Java sources");
        stream.println();
        stream.println("Usage: java -jar scout-cli.jar [options]");
        stream.println();
        stream.println("Options:");
        stream.println("  --project=DIR, -p DIR       Root directory of the test project (required)");
        stream.println("  --workers=N, -w N           Number of worker processes (default: 1)");
        stream.println("  --batch-size=N, -bs N       Units each worker takes at once (default: 64)");
        stream.println("  --quiet, -q                 Print only the summary");
        stream.println("  --suite=NAME, -s NAME       Run only tests tagged with this suite");
        stream.println("  --filter=EXPR, -f EXPR      file, file.class or file.class.method");
        stream.println("  --help, -h                  Show this help message");
        stream.println();
        stream.println("Examples:");
        stream.println("  java -jar scout-cli.jar --project=./tests");
        stream.println("  java -jar scout-cli.jar -p ./tests --workers=4 --filter=test_math.TestAdd");
        stream.println();
        stream.println("Worker JVMs reuse this JVM's classpath plus the classpath entries of scout.json.");
    }
}
