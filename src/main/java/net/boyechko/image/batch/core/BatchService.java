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
package net.boyechko.image.batch.core;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import net.boyechko.image.batch.action.ActionDescriptor;
import net.boyechko.image.batch.action.ActionOutcome;
import net.boyechko.image.batch.action.ActionRegistry;
import net.boyechko.image.batch.action.ActionResult;
import net.boyechko.image.batch.action.ActionStatus;
import net.boyechko.image.batch.discovery.DiscoveryResult;
import net.boyechko.image.batch.discovery.DiscoveryWarning;
import net.boyechko.image.batch.discovery.FileDiscoverer;
import net.boyechko.image.batch.image.ImageHandle;
import net.boyechko.image.batch.image.ImageOpenException;
import net.boyechko.image.batch.report.BatchConfiguration;
import net.boyechko.image.batch.report.BatchReport;
import net.boyechko.image.batch.report.FileReport;
import net.boyechko.image.batch.report.FileState;
import net.boyechko.image.batch.report.ResultAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the selected actions over every discovered file.
 *
 * <p>Each file gets its own pipeline: open, run every action in order against one {@link
 * ImageHandle}, seal the report. A failure is contained to the (file, action) pair it came from;
 * registry errors are the only thing {@link #run(BatchRequest)} throws, and they are raised before
 * any file is touched. With more than one worker thread, whole files are processed in parallel
 * while the actions of one file stay sequential. The report always lists files in discovery order.
 */
public class BatchService {
    private static final Logger logger = LoggerFactory.getLogger(BatchService.class);

    private final ActionRegistry registry;
    private final BatchListener listener;
    private final int threads;
    private final boolean stopOnFailure;
    private final CancellationToken cancellation;

    public static class BatchServiceBuilder {
        private ActionRegistry registry;
        private BatchListener listener;
        private int threads = resolveDefaultThreads();
        private boolean stopOnFailure;
        private CancellationToken cancellation;

        public BatchServiceBuilder withRegistry(ActionRegistry registry) {
            this.registry = registry;
            return this;
        }

        public BatchServiceBuilder withListener(BatchListener listener) {
            this.listener = listener;
            return this;
        }

        public BatchServiceBuilder withThreads(int threads) {
            this.threads = threads;
            return this;
        }

        public BatchServiceBuilder withStopOnFailure(boolean stopOnFailure) {
            this.stopOnFailure = stopOnFailure;
            return this;
        }

        public BatchServiceBuilder withCancellation(CancellationToken cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public BatchService build() {
            if (threads < 1) {
                throw new IllegalStateException("Thread count must be at least 1, was " + threads);
            }
            return new BatchService(this);
        }
    }

    private BatchService(BatchServiceBuilder builder) {
        this.registry = builder.registry != null ? builder.registry : DefaultActions.registry();
        this.listener =
                new SerializedListener(
                        builder.listener != null ? builder.listener : BatchListener.noOp());
        this.threads = builder.threads;
        this.stopOnFailure = builder.stopOnFailure;
        this.cancellation =
                builder.cancellation != null ? builder.cancellation : new CancellationToken();
    }

    public ActionRegistry registry() {
        return registry;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    /**
     * Resolves the requested actions, discovers files and processes them.
     *
     * @throws net.boyechko.image.batch.action.UnknownActionException if an action id is not
     *     registered; no file is discovered or opened in that case
     */
    public BatchReport run(BatchRequest request) {
        List<ActionDescriptor> actions = resolveActions(request);
        Instant startedAt = Instant.now();

        FileDiscoverer discoverer = new FileDiscoverer(request.extensions());
        DiscoveryResult discovered =
                discoverer.discover(request.directories(), request.recursive());
        for (DiscoveryWarning warning : discovered.warnings()) {
            listener.onDiscoveryWarning(warning);
        }

        BatchConfiguration configuration =
                new BatchConfiguration(
                        request.directories(),
                        request.recursive(),
                        request.extensions(),
                        actions.stream().map(ActionDescriptor::id).toList());
        return execute(
                configuration, discovered.files(), discovered.warnings(), actions, startedAt);
    }

    /** Processes an already-known list of files, in the given order. */
    public BatchReport run(List<Path> files, List<ActionDescriptor> actions) {
        BatchConfiguration configuration =
                BatchConfiguration.forActions(actions.stream().map(ActionDescriptor::id).toList());
        return execute(configuration, files, List.of(), actions, Instant.now());
    }

    private List<ActionDescriptor> resolveActions(BatchRequest request) {
        if (request.usesDefaultActions()) {
            List<ActionDescriptor> defaults = registry.defaultSelection();
            logger.info(
                    "No actions selected; using defaults {}",
                    defaults.stream().map(ActionDescriptor::id).toList());
            return defaults;
        }
        return registry.resolve(request.actionIds());
    }

    private BatchReport execute(
            BatchConfiguration configuration,
            List<Path> files,
            List<DiscoveryWarning> warnings,
            List<ActionDescriptor> actions,
            Instant startedAt) {
        logger.info(
                "Processing {} files with actions {} on {} thread(s)",
                files.size(),
                configuration.actionIds(),
                threads);
        listener.onBatchStart(configuration, files.size());

        AtomicReferenceArray<FileReport> results = new AtomicReferenceArray<>(files.size());
        if (threads == 1 || files.size() <= 1) {
            for (int i = 0; i < files.size(); i++) {
                results.set(i, processSafely(files.get(i), i, files.size(), actions));
            }
        } else {
            runParallel(files, actions, results);
        }

        List<FileReport> reports = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            FileReport report = results.get(i);
            reports.add(report != null ? report : FileReport.cancelled(files.get(i)));
        }

        boolean cancelled = cancellation.isCancelled();
        if (cancelled) {
            logger.warn("Batch cancelled");
            listener.onCancelled();
        }

        BatchReport report =
                ResultAggregator.aggregate(
                        configuration, reports, warnings, startedAt, Instant.now(), cancelled);
        listener.onBatchComplete(report);
        return report;
    }

    private void runParallel(
            List<Path> files,
            List<ActionDescriptor> actions,
            AtomicReferenceArray<FileReport> results) {
        ExecutorService pool =
                Executors.newFixedThreadPool(Math.min(threads, files.size()), new WorkerFactory());
        try {
            List<Future<?>> futures = new ArrayList<>(files.size());
            for (int i = 0; i < files.size(); i++) {
                final int index = i;
                futures.add(
                        pool.submit(
                                () ->
                                        results.set(
                                                index,
                                                processSafely(
                                                        files.get(index),
                                                        index,
                                                        files.size(),
                                                        actions))));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    logger.error("Worker failed on {}", files.get(i), cause);
                    results.compareAndSet(
                            i,
                            null,
                            FileReport.aborted(
                                    files.get(i), "Processing aborted: " + describe(cause)));
                }
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for workers; cancelling batch");
            cancellation.cancel();
            Thread.currentThread().interrupt();
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Runs {@link #processFile} and turns anything that escapes it into a {@code process_file}
     * FAIL for that file alone.
     */
    private FileReport processSafely(
            Path file, int index, int total, List<ActionDescriptor> actions) {
        try {
            return processFile(file, index, total, actions);
        } catch (RuntimeException | Error e) {
            logger.error("Processing of {} aborted", file, e);
            return FileReport.aborted(file, "Processing aborted: " + describe(e));
        }
    }

    /** Runs the whole pipeline for one file. Never throws for file or action problems. */
    FileReport processFile(Path file, int index, int total, List<ActionDescriptor> actions) {
        if (cancellation.isCancelled()) {
            return FileReport.cancelled(file);
        }
        listener.onFileStart(file, index, total);

        ImageHandle handle;
        try {
            handle = ImageHandle.open(file);
        } catch (ImageOpenException e) {
            logger.warn("Skipping {}: {}", file, e.getMessage());
            FileReport failed = FileReport.openFailed(file, e.getMessage());
            listener.onActionComplete(file, failed.outcomes().get(0));
            listener.onFileComplete(failed);
            return failed;
        }

        FileReport report = new FileReport(file);
        FileState state = FileState.COMPLETED;
        for (ActionDescriptor action : actions) {
            if (cancellation.isCancelled()) {
                state = FileState.CANCELLED;
                break;
            }
            listener.onActionStart(file, action);
            ActionOutcome outcome = runAction(action, handle);
            report.append(outcome);
            listener.onActionComplete(file, outcome);

            if (stopOnFailure && outcome.isFailure()) {
                logger.debug("Stopping {} after failed action {}", file, action.id());
                state = FileState.SHORT_CIRCUITED;
                break;
            }
        }
        report.seal(state);
        listener.onFileComplete(report);
        return report;
    }

    private ActionOutcome runAction(ActionDescriptor action, ImageHandle handle) {
        int revisionBefore = handle.revision();
        try {
            ActionResult result = action.action().execute(handle);
            boolean rewritten = handle.revision() > revisionBefore;
            if (result == null) {
                return new ActionOutcome(
                        action.id(),
                        ActionStatus.FAIL,
                        "Action returned no result",
                        rewritten);
            }
            if (result.mutated() != rewritten) {
                logger.debug(
                        "Action {} reported mutated={} but file rewritten={} for {}",
                        action.id(),
                        result.mutated(),
                        rewritten,
                        handle.path());
            }
            return new ActionOutcome(action.id(), result.status(), result.message(), rewritten);
        } catch (Exception | LinkageError | AssertionError | VirtualMachineError e) {
            logger.warn("Action {} failed on {}: {}", action.id(), handle.path(), describe(e));
            logger.debug("Stack trace for failed action {}", action.id(), e);
            return new ActionOutcome(
                    action.id(),
                    ActionStatus.FAIL,
                    describe(e),
                    handle.revision() > revisionBefore);
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }

    /**
     * Default worker count, resolved from the {@code imagebatch.threads} system property, then
     * the {@code IMAGEBATCH_THREADS} environment variable, then 1.
     */
    public static int resolveDefaultThreads() {
        String value = System.getProperty("imagebatch.threads");
        if (value == null) {
            value = System.getenv("IMAGEBATCH_THREADS");
        }
        if (value == null || value.isBlank()) {
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid thread count '{}'", value);
            return 1;
        }
    }

    private static final class WorkerFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "image-batch-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    /** Forwards events to a delegate one at a time. */
    private static final class SerializedListener implements BatchListener {
        private final BatchListener delegate;

        SerializedListener(BatchListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public synchronized void onBatchStart(BatchConfiguration configuration, int fileCount) {
            delegate.onBatchStart(configuration, fileCount);
        }

        @Override
        public synchronized void onFileComplete(FileReport report) {
            delegate.onFileComplete(report);
        }

        @Override
        public synchronized void onBatchComplete(BatchReport report) {
            delegate.onBatchComplete(report);
        }

        @Override
        public synchronized void onDiscoveryWarning(DiscoveryWarning warning) {
            delegate.onDiscoveryWarning(warning);
        }

        @Override
        public synchronized void onFileStart(Path file, int index, int total) {
            delegate.onFileStart(file, index, total);
        }

        @Override
        public synchronized void onActionStart(Path file, ActionDescriptor action) {
            delegate.onActionStart(file, action);
        }

        @Override
        public synchronized void onActionComplete(Path file, ActionOutcome outcome) {
            delegate.onActionComplete(file, outcome);
        }

        @Override
        public synchronized void onCancelled() {
            delegate.onCancelled();
        }
    }
}
