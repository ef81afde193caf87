package org.scout.cli;

import org.scout.core.model.InvocationOutcome;
import org.scout.core.model.RunSummary;
import org.scout.core.report.OutcomeFormatter;

import java.io.PrintStream;
import java.util.function.Consumer;

/**
 * Writes the run header, the per-outcome lines and the summary to a console stream.
 */
public class ConsoleReporter implements Consumer<InvocationOutcome> {

    private static final String GREEN = "\033[92m";
    private static final String RED = "\033[91m";
    private static final String YELLOW = "\033[93m";
    private static final String RESET = "\033[0m";

    private final PrintStream out;
    private final OutcomeFormatter formatter;
    private final boolean quiet;
    private final boolean color;

    public ConsoleReporter(PrintStream out, OutcomeFormatter formatter, boolean quiet, boolean color) {
        this.out = out;
        this.formatter = formatter;
        this.quiet = quiet;
        this.color = color;
    }

    public void header(CliOptions options) {
        out.println("Project: " + options.getProject());
        out.println("Max Workers: " + options.getWorkers());
        out.println("Batch Size: " + options.getBatchSize());
        out.println("Quiet: " + options.isQuiet());
        out.println("Suite: \"" + options.getSuite() + "\"");
        out.println("Filter: \"" + options.getFilter() + "\"");
    }

    public void resultsStart(int workers) {
        if (!quiet) {
            out.println();
            out.println("- - - Results - - -");
            out.println();
        }
        if (workers > 1) {
            out.println(paint(YELLOW, "[Warning]") + " Worker processes pay off for heavy or long-running tests. "
                    + "For simple tests, JVM startup may slow the run down.");
        }
    }

    @Override
    public synchronized void accept(InvocationOutcome outcome) {
        if (quiet) {
            return;
        }
        String status = "[" + formatter.status(outcome) + "]";
        out.println(paint(outcome.passed() ? GREEN : RED, status) + " " + formatter.describe(outcome));
    }

    public void summary(RunSummary summary) {
        out.println();
        out.println("- - - Summary - - -");
        out.println();
        formatter.summary(summary).forEach(out::println);
    }

    private String paint(String code, String text) {
        return color ? code + text + RESET : text;
    }
}
