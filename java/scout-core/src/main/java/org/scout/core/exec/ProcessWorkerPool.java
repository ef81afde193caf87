package org.scout.core.exec;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.scout.core.filter.TestFilter;
import org.scout.core.model.DiscoveredUnit;
import org.scout.core.model.InvocationOutcome;
import org.scout.core.model.MethodKey;
import org.scout.core.model.OutcomeError;
import org.scout.core.worker.WorkerRequest;
import org.scout.core.worker.WorkerSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Fixed set of worker slots, each holding at most one live child JVM.
 *
 * A slot starts its process on first use and drops it after a failure, so the next batch
 * on that slot gets a fresh worker.
 */
class ProcessWorkerPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProcessWorkerPool.class);

    private final WorkerSetup setup;
    private final List<String> jvmArgs;
    private final ObjectMapper objectMapper;
    private final BlockingQueue<Slot> idle;
    private final List<Slot> slots = new ArrayList<>();

    ProcessWorkerPool(int size, WorkerSetup setup, List<String> jvmArgs, ObjectMapper objectMapper) {
        this.setup = setup;
        this.jvmArgs = jvmArgs;
        this.objectMapper = objectMapper;
        this.idle = new ArrayBlockingQueue<>(size);
        for (int i = 0; i < size; i++) {
            Slot slot = new Slot(i);
            slots.add(slot);
            idle.add(slot);
        }
    }

    List<InvocationOutcome> run(int batchId, List<DiscoveredUnit> batch, TestFilter filter, String suite)
            throws InterruptedException {
        Slot slot = idle.take();
        try {
            if (slot.process == null || !slot.process.isAlive()) {
                slot.process = WorkerProcess.start(setup, jvmArgs, objectMapper);
            }
            logger.debug("Batch {} ({} units) on worker {}", batchId, batch.size(), slot.process.pid());
            return slot.process.send(new WorkerRequest(batchId, suite, filter, batch)).getOutcomes();
        } catch (IOException e) {
            logger.warn("Worker slot {} failed on batch {}: {}", slot.index, batchId, e.getMessage());
            slot.discard();
            return crashOutcomes(batch, filter, "Worker failed: " + e.getMessage());
        } finally {
            idle.put(slot);
        }
    }

    static List<InvocationOutcome> crashOutcomes(List<DiscoveredUnit> batch, TestFilter filter, String message) {
        OutcomeError error = OutcomeError.execError(message);
        List<InvocationOutcome> outcomes = new ArrayList<>();
        for (DiscoveredUnit unit : batch) {
            if (!filter.matchesFile(unit.unitId())) {
                continue;
            }
            filter.narrow(unit).forEach((className, methods) -> {
                for (String method : methods) {
                    outcomes.add(InvocationOutcome.fail(new MethodKey(unit.unitId(), className, method), error, null));
                }
            });
        }
        return outcomes;
    }

    @Override
    public void close() {
        for (Slot slot : slots) {
            if (slot.process != null) {
                slot.process.close();
                slot.process = null;
            }
        }
    }

    private static final class Slot {
        private final int index;
        private WorkerProcess process;

        private Slot(int index) {
            this.index = index;
        }

        private void discard() {
            if (process != null) {
                process.close();
                process = null;
            }
        }
    }
}
