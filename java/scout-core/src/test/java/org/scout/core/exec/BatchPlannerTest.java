package org.scout.core.exec;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchPlannerTest {

    @Test
    void batchSizeOneGivesOneBatchPerUnit() {
        assertThat(BatchPlanner.partition(List.of("a", "b", "c"), 1))
                .containsExactly(List.of("a"), List.of("b"), List.of("c"));
    }

    @Test
    void lastBatchHoldsTheRemainder() {
        assertThat(BatchPlanner.partition(List.of(1, 2, 3, 4, 5), 2))
                .containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
    }

    @Test
    void emptyInputGivesNoBatches() {
        assertThat(BatchPlanner.partition(List.of(), 64)).isEmpty();
    }

    @Test
    void sizeMustBePositive() {
        assertThatThrownBy(() -> BatchPlanner.partition(List.of(1), 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
