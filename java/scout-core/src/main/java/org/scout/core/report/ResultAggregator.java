package org.scout.core.report;

import org.scout.core.model.InvocationOutcome;
import org.scout.core.model.RunSummary;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Counts outcomes as they arrive.
 */
public class ResultAggregator implements Consumer<InvocationOutcome> {

    private int executed;
    private int failed;

    @Override
    public synchronized void accept(InvocationOutcome outcome) {
        executed++;
        if (!outcome.passed()) {
            failed++;
        }
    }

    public synchronized RunSummary summary(int collected, Duration elapsed) {
        return new RunSummary(collected, executed, failed, elapsed);
    }
}
