package org.scout.core.report;

import org.junit.jupiter.api.Test;
import org.scout.core.model.InvocationOutcome;
import org.scout.core.model.MethodKey;
import org.scout.core.model.OutcomeError;
import org.scout.core.model.RunSummary;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ResultAggregatorTest {

    @Test
    void countsExecutedAndFailed() {
        ResultAggregator aggregator = new ResultAggregator();
        MethodKey key = new MethodKey("unit", "TestA", "testB");
        aggregator.accept(InvocationOutcome.pass(key, null));
        aggregator.accept(InvocationOutcome.fail(key, OutcomeError.methodNotFound(), null));
        aggregator.accept(InvocationOutcome.pass(key, null));

        RunSummary summary = aggregator.summary(10, Duration.ofSeconds(2));

        assertThat(summary.collected()).isEqualTo(10);
        assertThat(summary.executed()).isEqualTo(3);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.passed()).isEqualTo(2);
        assertThat(summary.elapsed()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void emptyRunHasZeroCounts() {
        RunSummary summary = new ResultAggregator().summary(0, Duration.ZERO);

        assertThat(summary.executed()).isZero();
        assertThat(summary.passed()).isZero();
    }
}
