package dev.multiverse.engine;

import dev.multiverse.model.Dataset;
import dev.multiverse.model.EngineSettings;
import dev.multiverse.model.ExecutionResult;
import dev.multiverse.model.ExecutionSummary;
import dev.multiverse.model.Option;
import dev.multiverse.model.Parameter;
import dev.multiverse.model.ResultRecord;
import dev.multiverse.model.Universe;
import dev.multiverse.pipeline.Pipeline;
import dev.multiverse.pipeline.Step;
import dev.multiverse.pipeline.StepAction;
import dev.multiverse.pipeline.StepContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the shared pipeline once per universe.
 *
 * <p>A failure inside one universe is caught at the universe boundary and recorded as an
 * {@link ExecutionResult.Failure}; it never aborts other universes. {@link #runAll} spreads
 * universes over a bounded worker pool and returns results ordered by universe id, whatever
 * order they finished in.
 */
public final class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String SUMMARIZE_STAGE = "(summarize outcomes)";
    private static final long SCHEDULE_POLL_MILLIS = 50;

    private final BranchRegistry registry;
    private final EngineSettings settings;
    private final ResultAggregator aggregator;

    public ExecutionEngine(BranchRegistry registry, EngineSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.aggregator = new ResultAggregator(new DistributionSummarizer(settings.grid()));
    }

    public EngineSettings settings() {
        return settings;
    }

    /**
     * Run {@code pipeline} for a single universe on the calling thread.
     */
    public ExecutionResult execute(Pipeline pipeline, Universe universe, Dataset dataset) {
        long start = System.nanoTime();
        StepContext context = null;
        try {
            context = new StepContext(universe, resolveOptions(universe), dataset);
            for (Step step : pipeline.steps()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("interrupted before step '" + step.label() + "'");
                }
                context.enterStep(step.label());
                resolve(step, universe).apply(context);
            }
            context.enterStep(SUMMARIZE_STAGE);
            List<ResultRecord> records = aggregator.aggregate(context.outcomes());
            log.debug("Universe {} ({}) produced {} records", universe.id(), universe.label(), records.size());
            return new ExecutionResult.Success(universe, records, since(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(universe, stepOf(context), "interrupted", e.getMessage(), e, start);
        } catch (Throwable e) {
            if (isFatal(e)) {
                throw (VirtualMachineError) e;
            }
            return failure(universe, stepOf(context), e.getClass().getSimpleName(), e.getMessage(), e, start);
        }
    }

    /**
     * Run every universe of {@code multiverse} over a worker pool bounded by the configured concurrency.
     * Universes not started before {@code control} is cancelled are reported as skipped.
     */
    public ExecutionSummary runAll(Multiverse multiverse, Dataset dataset, RunControl control) {
        List<Universe> universes = multiverse.universes();
        log.info("Running {} universes with concurrency {}{}", universes.size(), settings.concurrency(),
            settings.universeTimeout() == null ? "" : " and timeout " + settings.universeTimeout());

        Map<Integer, ExecutionResult> results = new ConcurrentHashMap<>();
        ExecutorService workers = Executors.newFixedThreadPool(settings.concurrency(), threads("universe-worker"));
        ScheduledExecutorService watchdog = settings.universeTimeout() == null
            ? null : Executors.newSingleThreadScheduledExecutor(threads("universe-watchdog"));
        Semaphore slots = new Semaphore(settings.concurrency());

        try {
            for (Universe universe : universes) {
                if (!acquire(slots, control)) {
                    break;
                }
                workers.execute(() -> {
                    long start = System.nanoTime();
                    try {
                        results.put(universe.id(), runGuarded(multiverse.pipeline(), universe, dataset, watchdog));
                    } catch (VirtualMachineError e) {
                        results.put(universe.id(),
                            failure(universe, null, e.getClass().getSimpleName(), e.getMessage(), e, start));
                    } finally {
                        control.markCompleted();
                        slots.release();
                    }
                });
            }
            workers.shutdown();
            while (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("Waiting for {} in-flight universes", settings.concurrency() - slots.availablePermits());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            control.cancel();
            workers.shutdownNow();
        } finally {
            if (watchdog != null) {
                watchdog.shutdownNow();
            }
        }

        var ordered = new ArrayList<ExecutionResult>(universes.size());
        for (Universe universe : universes) {
            ExecutionResult result = results.get(universe.id());
            ordered.add(result != null ? result : new ExecutionResult.Skipped(universe, "run cancelled before start"));
        }
        ExecutionSummary summary = new ExecutionSummary(ordered);
        log.info("Multiverse run finished: {}", summary.describe());
        return summary;
    }

    public ExecutionSummary runAll(Multiverse multiverse, Dataset dataset) {
        return runAll(multiverse, dataset, RunControl.create());
    }

    private ExecutionResult runGuarded(Pipeline pipeline, Universe universe, Dataset dataset,
                                       ScheduledExecutorService watchdog) {
        if (watchdog == null) {
            return execute(pipeline, universe, dataset);
        }
        Thread worker = Thread.currentThread();
        AtomicBoolean settled = new AtomicBoolean(false);
        Duration timeout = settings.universeTimeout();
        ScheduledFuture<?> guard = watchdog.schedule(() -> {
            if (settled.compareAndSet(false, true)) {
                worker.interrupt();
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        long start = System.nanoTime();
        ExecutionResult result = null;
        boolean timedOut = false;
        try {
            result = execute(pipeline, universe, dataset);
        } finally {
            if (settled.compareAndSet(false, true)) {
                guard.cancel(false);
            } else {
                timedOut = true;
                while (!guard.isDone()) {
                    Thread.onSpinWait();
                }
                // clear the watchdog's interrupt so the pooled thread can take the next universe
                Thread.interrupted();
            }
        }
        if (timedOut) {
            ExecutionResult.Failure failure = new ExecutionResult.Failure(universe, stepOf(result),
                ExecutionResult.Failure.TIMEOUT, "exceeded " + timeout, null, since(start));
            log.warn("Universe {} ({}) failed: {}", universe.id(), universe.label(), failure.describe());
            return failure;
        }
        return result;
    }

    private boolean acquire(Semaphore slots, RunControl control) throws InterruptedException {
        while (!control.isCancelled()) {
            if (slots.tryAcquire(SCHEDULE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (control.isCancelled()) {
                    slots.release();
                    return false;
                }
                return true;
            }
        }
        log.info("Run cancelled; no further universes will be scheduled");
        return false;
    }

    private Map<String, Option> resolveOptions(Universe universe) {
        var chosen = new LinkedHashMap<String, Option>();
        for (Parameter parameter : registry.parameters()) {
            String name = universe.choice(parameter.name());
            chosen.put(parameter.name(), parameter.option(name).orElseThrow(() -> new IllegalArgumentException(
                "Universe %d chose unknown option '%s' for '%s'".formatted(universe.id(), name, parameter.name()))));
        }
        return chosen;
    }

    private static StepAction resolve(Step step, Universe universe) {
        if (step instanceof Step.Fixed fixed) {
            return fixed.action();
        } else if (step instanceof Step.Branched branched) {
            String option = universe.choice(branched.parameter());
            StepAction variant = branched.variants().get(option);
            if (variant == null) {
                throw new IllegalStateException("Step '%s' has no variant for %s=%s"
                    .formatted(step.label(), branched.parameter(), option));
            }
            return variant;
        }
        throw new IllegalStateException("Unknown step: " + step);
    }

    /** Errors the JVM cannot recover from; a step's own stack overflow stays a universe failure. */
    private static boolean isFatal(Throwable e) {
        return e instanceof VirtualMachineError && !(e instanceof StackOverflowError);
    }

    private static String stepOf(StepContext context) {
        return context == null ? null : context.currentStep();
    }

    private ExecutionResult.Failure failure(Universe universe, String step, String type,
                                            String message, Throwable cause, long start) {
        var failure = new ExecutionResult.Failure(universe, step, type,
            message == null ? type : message, cause, since(start));
        log.warn("Universe {} ({}) failed: {}", universe.id(), universe.label(), failure.describe());
        return failure;
    }

    private static String stepOf(ExecutionResult result) {
        return result instanceof ExecutionResult.Failure f ? f.failedStep() : null;
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
