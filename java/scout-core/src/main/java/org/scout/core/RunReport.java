package org.scout.core;

import org.scout.core.extract.DiscoveryResult;
import org.scout.core.model.InvocationOutcome;
import org.scout.core.model.RunSummary;

import java.util.List;

/**
 * What a run discovered, what it executed and how it went.
 */
public record RunReport(DiscoveryResult discovery, List<InvocationOutcome> outcomes, RunSummary summary) {
}
