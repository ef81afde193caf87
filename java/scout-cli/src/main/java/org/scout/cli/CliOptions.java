package org.scout.cli;

import org.scout.core.ConfigurationException;
import org.scout.core.exec.SchedulerSettings;

import java.nio.file.Path;

/**
 * Parsed command line.
 */
public class CliOptions {

    private Path project;
    private int workers = 1;
    private int batchSize = SchedulerSettings.DEFAULT_BATCH_SIZE;
    private boolean quiet;
    private String suite;
    private String filter;
    private boolean help;

    /**
     * Accepts {@code --name=value} and {@code -n value} forms.
     *
     * @throws ConfigurationException for unknown options, missing values or non-numeric counts
     */
    public static CliOptions parse(String[] args) {
        CliOptions options = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--help") || arg.equals("-h")) {
                options.help = true;
            } else if (arg.equals("--quiet") || arg.equals("-q")) {
                options.quiet = true;
            } else if (arg.startsWith("--project=")) {
                options.project = Path.of(valueOf(arg));
            } else if (arg.equals("-p")) {
                options.project = Path.of(next(args, ++i, arg));
            } else if (arg.startsWith("--workers=")) {
                options.workers = count(arg, valueOf(arg));
            } else if (arg.equals("-w")) {
                options.workers = count(arg, next(args, ++i, arg));
            } else if (arg.startsWith("--batch-size=")) {
                options.batchSize = count(arg, valueOf(arg));
            } else if (arg.equals("-bs")) {
                options.batchSize = count(arg, next(args, ++i, arg));
            } else if (arg.startsWith("--suite=")) {
                options.suite = valueOf(arg);
            } else if (arg.equals("-s")) {
                options.suite = next(args, ++i, arg);
            } else if (arg.startsWith("--filter=")) {
                options.filter = valueOf(arg);
            } else if (arg.equals("-f")) {
                options.filter = next(args, ++i, arg);
            } else {
                throw new ConfigurationException("Unknown option: " + arg);
            }
        }
        return options;
    }

    private static String valueOf(String arg) {
        return arg.substring(arg.indexOf('=') + 1);
    }

    private static String next(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new ConfigurationException("Option " + option + " needs a value");
        }
        return args[index];
    }

    private static int count(String option, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option " + option + " needs a number, got '" + value + "'", e);
        }
        if (parsed < 1) {
            throw new ConfigurationException("Option " + option + " must be at least 1, got " + parsed);
        }
        return parsed;
    }

    public Path getProject() {
        return project;
    }

    public int getWorkers() {
        return workers;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public String getSuite() {
        return suite;
    }

    public String getFilter() {
        return filter;
    }

    public boolean isHelp() {
        return help;
    }
}
