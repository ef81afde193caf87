package org.scout.core.model;

import java.time.Duration;

/**
 * Totals of one run. {@code collected} comes from discovery and is independent of
 * what filtering later let through.
 */
public record RunSummary(int collected, int executed, int failed, Duration elapsed) {

    public int passed() {
        return executed - failed;
    }
}
