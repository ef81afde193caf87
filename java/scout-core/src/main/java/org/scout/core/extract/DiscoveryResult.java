package org.scout.core.extract;

import org.scout.core.model.DiscoveredUnit;

import java.util.List;

/**
 * Outcome of one discovery pass.
 *
 * @param units          units declaring at least one test class, in scan order
 * @param parseFailures  units that could not be analyzed and were left out
 * @param collectedCount test methods across {@code units}, counted before any filtering
 */
public record DiscoveryResult(List<DiscoveredUnit> units, List<ParseFailure> parseFailures, int collectedCount) {

    public record ParseFailure(String unitId, String message) {
    }
}
