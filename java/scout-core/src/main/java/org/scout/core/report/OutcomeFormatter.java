package org.scout.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scout.core.model.InvocationOutcome;
import org.scout.core.model.RunSummary;

import java.util.List;
import java.util.Locale;

/**
 * Plain-text rendering of outcomes and summaries.
 */
public class OutcomeFormatter {

    public static final String PASS = "PASS";
    public static final String FAIL = "FAIL";

    private final ObjectMapper objectMapper;

    public OutcomeFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String format(InvocationOutcome outcome) {
        return status(outcome) + " " + describe(outcome);
    }

    public String status(InvocationOutcome outcome) {
        return outcome.passed() ? PASS : FAIL;
    }

    /**
     * Everything after the status: {@code unit.Class.method[params]}, plus the error of a failure.
     */
    public String describe(InvocationOutcome outcome) {
        StringBuilder line = new StringBuilder(outcome.key().toString());
        if (outcome.params() != null) {
            line.append('[').append(renderParams(outcome)).append(']');
        }
        if (!outcome.passed() && outcome.error() != null) {
            line.append(" → ").append(outcome.error().describe());
        }
        return line.toString();
    }

    public List<String> summary(RunSummary summary) {
        return List.of(
                "Collected: " + summary.collected(),
                "Executed: " + summary.executed() + " / " + summary.collected(),
                "Failed: " + summary.failed(),
                "Passed: " + summary.passed(),
                String.format(Locale.ROOT, "Total Time: %.2f Seconds", summary.elapsed().toMillis() / 1000.0));
    }

    private String renderParams(InvocationOutcome outcome) {
        try {
            return objectMapper.writeValueAsString(outcome.params());
        } catch (JsonProcessingException e) {
            return String.valueOf(outcome.params().arguments());
        }
    }
}
