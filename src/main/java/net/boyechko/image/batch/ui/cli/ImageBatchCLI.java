/*
 * Image-Batch - Batch Image Processing
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.image.batch.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.image.batch.action.ActionDescriptor;
import net.boyechko.image.batch.action.ActionRegistry;
import net.boyechko.image.batch.action.ActionRegistryException;
import net.boyechko.image.batch.core.BatchListener;
import net.boyechko.image.batch.core.BatchRequest;
import net.boyechko.image.batch.core.BatchService;
import net.boyechko.image.batch.core.DefaultActions;
import net.boyechko.image.batch.core.VerbosityLevel;
import net.boyechko.image.batch.report.BatchReport;
import net.boyechko.image.batch.report.ReportWriters;
import net.boyechko.image.batch.ui.BatchReporter;
import net.boyechko.image.batch.ui.LoggingListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ImageBatchCLI {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURES = 2;

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            List<Path> directories,
            List<String> extensions,
            List<String> actionIds,
            boolean recursive,
            int threads,
            boolean stopOnFailure,
            Path reportPath,
            VerbosityLevel verbosity,
            boolean headless,
            boolean listActions) {
        public CLIConfig {
            if (!listActions && (directories == null || directories.isEmpty())) {
                throw new IllegalArgumentException("At least one directory is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
            directories = directories == null ? List.of() : List.copyOf(directories);
            extensions = extensions == null ? List.of() : List.copyOf(extensions);
            actionIds = actionIds == null ? List.of() : List.copyOf(actionIds);
        }

        BatchRequest toRequest() {
            return new BatchRequest(directories, recursive, extensions, actionIds);
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and merges the batch file. */
    static class CLIConfigBuilder {
        List<Path> directories = new ArrayList<>();
        List<String> extensions;
        List<String> actionIds;
        Boolean recursive;
        Integer threads;
        Boolean stopOnFailure;
        boolean generateReport;
        Path reportPath;
        Path configPath;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;
        boolean headless;
        boolean listActions;

        CLIConfig build() throws CLIException {
            if (configPath != null) {
                mergeConfigFile();
            }
            if (!listActions && directories.isEmpty()) {
                throw new CLIException("No directories specified");
            }
            int threadCount = threads != null ? threads : BatchService.resolveDefaultThreads();
            if (threadCount < 1) {
                throw new CLIException("Thread count must be at least 1: " + threadCount);
            }
            if (generateReport && reportPath == null) {
                reportPath = Paths.get(ReportWriters.DEFAULT_REPORT_NAME);
            }
            return new CLIConfig(
                    directories,
                    extensions,
                    actionIds,
                    Boolean.TRUE.equals(recursive),
                    threadCount,
                    Boolean.TRUE.equals(stopOnFailure),
                    reportPath,
                    verbosity,
                    headless,
                    listActions);
        }

        private void mergeConfigFile() throws CLIException {
            BatchConfigFile file;
            try {
                file = BatchConfigFile.load(configPath);
            } catch (IOException e) {
                throw new CLIException("Cannot read batch file: " + e.getMessage());
            }
            Path base = configPath.toAbsolutePath().getParent();
            if (directories.isEmpty()) {
                for (String dir : file.directories) {
                    Path p = Paths.get(dir);
                    directories.add(p.isAbsolute() || base == null ? p : base.resolve(p));
                }
            }
            if (extensions == null && !file.extensions.isEmpty()) {
                extensions = file.extensions;
            }
            if (actionIds == null && !file.actions.isEmpty()) {
                actionIds = file.actions;
            }
            if (recursive == null) recursive = file.recursive;
            if (threads == null) threads = file.threads;
            if (stopOnFailure == null) stopOnFailure = file.stopOnFailure;
            if (reportPath == null && file.report != null) {
                reportPath = Paths.get(file.report);
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /** Runs the CLI and returns its exit status instead of exiting. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (isHelpRequested(args)) {
            out.println(usageMessage());
            return EXIT_OK;
        }
        CLIConfig config;
        try {
            config = parseArguments(args);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
        configureLogging(config.verbosity());

        if (config.listActions()) {
            listActions(DefaultActions.registry(), out);
            return EXIT_OK;
        }

        try {
            return processBatch(config, out, err);
        } catch (ActionRegistryException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No directories specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--dirs=") || arg.startsWith("-dirs=")) {
                for (String dir : parseCommaSeparated(valueOf(arg))) {
                    b.directories.add(Paths.get(dir));
                }
            } else if (arg.startsWith("--exts=") || arg.startsWith("-exts=")) {
                b.extensions = parseCommaSeparated(valueOf(arg));
            } else if (arg.startsWith("--actions=") || arg.startsWith("-actions=")) {
                b.actionIds = parseCommaSeparated(valueOf(arg));
            } else if (arg.startsWith("--threads=")) {
                b.threads = parseThreads(valueOf(arg));
            } else if (arg.startsWith("--config=")) {
                b.configPath = Paths.get(valueOf(arg));
            } else if (arg.startsWith("--report=")
                    || arg.startsWith("-r=")
                    || arg.startsWith("-logfile=")) {
                b.reportPath = Paths.get(valueOf(arg));
                b.generateReport = true;
            } else {
                switch (arg) {
                    case "--threads" -> b.threads = parseThreads(requireValue(args, ++i, arg));
                    case "--config" -> b.configPath = Paths.get(requireValue(args, ++i, arg));
                    case "-R", "--recursive" -> b.recursive = true;
                    case "--stop-on-fail" -> b.stopOnFailure = true;
                    case "--list-actions" -> b.listActions = true;
                    case "-headless", "--headless" -> b.headless = true;
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-r", "--report" -> b.generateReport = true;
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new CLIException("Unknown option: " + arg);
                        }
                        b.directories.add(Paths.get(arg));
                    }
                }
            }
        }

        return b.build();
    }

    private static String valueOf(String arg) {
        return arg.substring(arg.indexOf('=') + 1);
    }

    private static String requireValue(String[] args, int index, String option)
            throws CLIException {
        if (index >= args.length) {
            throw new CLIException("Value not specified after " + option);
        }
        return args[index];
    }

    private static int parseThreads(String value) throws CLIException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new CLIException("Invalid thread count: " + value);
        }
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(verbosity.logLevel(), Level.WARN));
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(ImageBatchCLI.class);
        }
        return logger;
    }

    private static int processBatch(CLIConfig config, PrintStream out, PrintStream err) {
        BatchReporter reporter = null;
        BatchListener listener;
        if (config.headless()) {
            listener = LoggingListener.withConsoleOutput();
        } else {
            reporter = new BatchReporter(out, config.verbosity());
            listener = reporter;
        }

        BatchService service =
                new BatchService.BatchServiceBuilder()
                        .withRegistry(DefaultActions.registry())
                        .withListener(listener)
                        .withThreads(config.threads())
                        .withStopOnFailure(config.stopOnFailure())
                        .build();

        logger().info(
                        "Starting batch over {} with {} thread(s)",
                        config.directories(),
                        config.threads());
        BatchReport report = service.run(config.toRequest());

        if (config.reportPath() != null) {
            try {
                ReportWriters.forPath(config.reportPath()).write(report, config.reportPath());
                if (reporter != null) {
                    reporter.onSuccess("Report saved to " + config.reportPath());
                }
                logger().info("Report saved to {}", config.reportPath());
            } catch (IOException e) {
                err.println(
                        "✗ Failed to write report " + config.reportPath() + ": " + e.getMessage());
                logger().debug("Report write failure", e);
                return EXIT_USAGE;
            }
        }

        return report.hasFailures() ? EXIT_FAILURES : EXIT_OK;
    }

    static void listActions(ActionRegistry registry, PrintStream out) {
        for (ActionDescriptor descriptor : registry.listAvailable()) {
            out.printf(
                    "%-20s %s%s%n",
                    descriptor.id(),
                    descriptor.displayName(),
                    descriptor.defaultSelected() ? " (default)" : "");
        }
    }

    private static List<String> parseCommaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: java ImageBatchCLI [options] <directory>...\n"
                + "  -h, --help            Show this help message\n"
                + "  --dirs=<a,b>          Directories to process (also positional)\n"
                + "  --exts=<png,tga>      File extensions to include (default: bmp,png,tga)\n"
                + "  --actions=<id,id>     Actions to run, in order (default: default actions)\n"
                + "  -R, --recursive       Include subdirectories\n"
                + "  --threads=<n>         Number of worker threads (default: 1)\n"
                + "  --stop-on-fail        Skip a file's remaining actions after a failure\n"
                + "  --config=<file>       Read the batch from a YAML file\n"
                + "  -r, --report          Save a report ("
                + ReportWriters.DEFAULT_REPORT_NAME
                + ")\n"
                + "                        Use -r=<file> or --report=<file>; .json, .txt or .xml\n"
                + "  --list-actions        List the available actions and exit\n"
                + "  --headless            Log events instead of printing the transcript\n"
                + "  -q, --quiet           Only show failures and the summary\n"
                + "  -v, --verbose         Show every action outcome\n"
                + "  -vv, --debug          Show all debug information\n"
                + "Exit status: 0 no failures, 2 some action failed, 1 usage error\n"
                + "Examples:\n"
                + "  java ImageBatchCLI -R textures\n"
                + "  java ImageBatchCLI --actions=check_power_of_2,verify_pbr_values"
                + " -r=report.json textures\n"
                + "  java ImageBatchCLI --config=batch.yaml -v";
    }
}
