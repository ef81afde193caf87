package org.scout.core.exec;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.scout.core.filter.TestFilter;
import org.scout.core.model.DiscoveredUnit;
import org.scout.core.model.InvocationOutcome;
import org.scout.core.worker.WorkerSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Runs discovered units either in-process or across a pool of worker processes.
 *
 * With one worker the units run on the calling thread in discovery order. With more,
 * units are cut into batches that run concurrently in child JVMs; outcomes keep their
 * order within a batch only.
 */
public class ExecutionScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionScheduler.class);

    private final SchedulerSettings settings;
    private final BatchRunner localRunner;
    private final WorkerSetup workerSetup;
    private final ObjectMapper objectMapper;

    /**
     * @param localRunner runner used when {@code maxWorkers} is 1
     * @param workerSetup what forked workers are initialized with when {@code maxWorkers} exceeds 1
     */
    public ExecutionScheduler(SchedulerSettings settings, BatchRunner localRunner, WorkerSetup workerSetup,
                              ObjectMapper objectMapper) {
        this.settings = settings;
        this.localRunner = localRunner;
        this.workerSetup = workerSetup;
        this.objectMapper = objectMapper;
    }

    public List<InvocationOutcome> execute(List<DiscoveredUnit> units, TestFilter filter, String suite,
                                           Consumer<InvocationOutcome> sink) {
        List<InvocationOutcome> outcomes = new ArrayList<>();
        Consumer<InvocationOutcome> collect = outcome -> {
            outcomes.add(outcome);
            sink.accept(outcome);
        };

        if (settings.getMaxWorkers() <= 1) {
            localRunner.run(units, filter, suite, collect);
        } else {
            executeInWorkers(units, filter, suite, collect);
        }
        return outcomes;
    }

    private void executeInWorkers(List<DiscoveredUnit> units, TestFilter filter, String suite,
                                  Consumer<InvocationOutcome> collect) {
        List<List<DiscoveredUnit>> batches = BatchPlanner.partition(units, settings.getBatchSize());
        int workers = settings.getMaxWorkers();
        logger.info("Running {} batches of up to {} units on {} workers", batches.size(), settings.getBatchSize(), workers);

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try (ProcessWorkerPool pool = new ProcessWorkerPool(workers, workerSetup, settings.getWorkerJvmArgs(), objectMapper)) {
            CompletionService<List<InvocationOutcome>> completion = new ExecutorCompletionService<>(executor);
            for (int i = 0; i < batches.size(); i++) {
                int batchId = i;
                List<DiscoveredUnit> batch = batches.get(i);
                completion.submit(() -> pool.run(batchId, batch, filter, suite));
            }

            for (int done = 1; done <= batches.size(); done++) {
                List<InvocationOutcome> result;
                try {
                    result = completion.take().get();
                } catch (ExecutionException e) {
                    // pool.run maps worker failures to outcomes, so this is a bug in the scheduler itself
                    throw new IllegalStateException("Batch execution failed", e.getCause());
                }
                result.forEach(collect);
                logger.debug("Completed {}/{} batches", done, batches.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workers", e);
        } finally {
            executor.shutdownNow();
        }
    }
}
