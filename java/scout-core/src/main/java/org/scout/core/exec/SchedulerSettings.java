package org.scout.core.exec;

import java.util.ArrayList;
import java.util.List;

/**
 * How a run spreads its units over workers.
 */
public class SchedulerSettings {

    public static final int DEFAULT_BATCH_SIZE = 64;

    // 1 runs everything in-process, in order
    private int maxWorkers = 1;

    private int batchSize = DEFAULT_BATCH_SIZE;

    // extra JVM options for forked workers
    private List<String> workerJvmArgs = new ArrayList<>();

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
        }
        this.batchSize = batchSize;
    }

    public List<String> getWorkerJvmArgs() {
        return workerJvmArgs;
    }

    public void setWorkerJvmArgs(List<String> workerJvmArgs) {
        this.workerJvmArgs = workerJvmArgs == null ? new ArrayList<>() : workerJvmArgs;
    }
}
