package org.scout.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.scout.core.exec.BatchRunner;
import org.scout.core.exec.ExecutionScheduler;
import org.scout.core.exec.SchedulerSettings;
import org.scout.core.extract.DiscoveryResult;
import org.scout.core.extract.TestDiscovery;
import org.scout.core.extract.TestExtractor;
import org.scout.core.filter.TestFilter;
import org.scout.core.model.InvocationOutcome;
import org.scout.core.model.RunSummary;
import org.scout.core.prep.PrepRegistry;
import org.scout.core.report.ResultAggregator;
import org.scout.core.scan.SourceScanner;
import org.scout.core.worker.WorkerMain;
import org.scout.core.worker.WorkerSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs the whole pipeline for one project: discovery, filtering, execution and aggregation.
 *
 * Configuration errors (missing root, bad filter, broken prep unit) are thrown before any
 * test runs. Everything that goes wrong inside a test is reported as an outcome.
 */
public class ScoutRunner {
    private static final Logger logger = LoggerFactory.getLogger(ScoutRunner.class);

    private final RunOptions options;
    private final ObjectMapper objectMapper;

    public ScoutRunner(RunOptions options) {
        this(options, new ObjectMapper());
    }

    public ScoutRunner(RunOptions options, ObjectMapper objectMapper) {
        this.options = options;
        this.objectMapper = objectMapper;
    }

    public RunReport run() {
        return run(outcome -> { });
    }

    /**
     * @param listener receives every outcome as soon as it is known
     */
    public RunReport run(Consumer<InvocationOutcome> listener) {
        Path root = requireProjectRoot(options.getProjectRoot());
        TestFilter filter = TestFilter.parse(options.getFilter());

        SchedulerSettings settings = new SchedulerSettings();
        settings.setMaxWorkers(options.getMaxWorkers());
        settings.setBatchSize(options.getBatchSize());
        settings.setWorkerJvmArgs(options.getWorkerJvmArgs());

        WorkerSetup setup = new WorkerSetup();
        setup.setProjectRoot(root.toString());
        setup.setPrepUnits(options.getPrepUnits());
        setup.setClasspath(options.getClasspath());
        setup.setSourcePath(List.of(root.toString()));
        setup.setAnnotations(options.getAnnotationIndex().entries());

        long started = System.nanoTime();
        // prep units load here even when workers run the tests, so broken ones fail fast
        PrepRegistry registry = options.getPrepRegistry() != null ? options.getPrepRegistry() : new PrepRegistry();
        BatchRunner localRunner = WorkerMain.createRunner(setup, registry, objectMapper);

        DiscoveryResult discovery = new TestDiscovery(new SourceScanner(options.getExcludes()), new TestExtractor())
                .discover(root);

        ResultAggregator aggregator = new ResultAggregator();
        ExecutionScheduler scheduler = new ExecutionScheduler(settings, localRunner, setup, objectMapper);
        List<InvocationOutcome> outcomes = scheduler.execute(discovery.units(), filter, options.getSuite(),
                aggregator.andThen(listener));

        RunSummary summary = aggregator.summary(discovery.collectedCount(), Duration.ofNanos(System.nanoTime() - started));
        logger.info("Run finished: {} executed, {} failed", summary.executed(), summary.failed());
        return new RunReport(discovery, outcomes, summary);
    }

    private static Path requireProjectRoot(Path projectRoot) {
        if (projectRoot == null) {
            throw new IllegalArgumentException("No project directory given");
        }
        if (!Files.isDirectory(projectRoot)) {
            throw new IllegalArgumentException("Project directory does not exist: " + projectRoot);
        }
        return projectRoot.toAbsolutePath().normalize();
    }
}
