package space.ketterling.gridload.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import space.ketterling.gridload.model.Dataset;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the poll cycle on wall-clock multiples of the interval (e.g. :00,
 * :05, :10 for five minutes) and, optionally, the warehouse rebuild.
 *
 * <p>
 * Both jobs share one thread, so a rebuild never overlaps an append.
 * </p>
 */
public final class IngestScheduler {
    private static final Logger log = LoggerFactory.getLogger(IngestScheduler.class);

    private final ScheduledExecutorService exec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "ingest-poll"));

    private final IngestService ingest;
    private final Set<Dataset> datasets;
    private final Duration pollInterval;
    private final Runnable warehouseRebuild; // nullable
    private final Duration rebuildInterval;
    private final Clock clock;

    private volatile boolean stopped;
    private volatile ScheduledFuture<?> pollTask;
    private ScheduledFuture<?> rebuildTask;

    public IngestScheduler(IngestService ingest, Set<Dataset> datasets, Duration pollInterval,
            Runnable warehouseRebuild, Duration rebuildInterval, Clock clock) {
        if (pollInterval.isZero() || pollInterval.isNegative())
            throw new IllegalArgumentException("poll interval must be positive");
        this.ingest = ingest;
        this.datasets = Set.copyOf(datasets);
        this.pollInterval = pollInterval;
        this.warehouseRebuild = warehouseRebuild;
        this.rebuildInterval = rebuildInterval;
        this.clock = clock;
    }

    /**
     * Runs the first cycle immediately, then on each interval boundary.
     */
    public void start() {
        pollTask = exec.schedule(this::pollAndReschedule, 0, TimeUnit.MILLISECONDS);

        if (warehouseRebuild != null && rebuildInterval != null && !rebuildInterval.isZero()
                && !rebuildInterval.isNegative()) {
            rebuildTask = exec.scheduleWithFixedDelay(safe("warehouse", warehouseRebuild::run),
                    rebuildInterval.toMillis(), rebuildInterval.toMillis(), TimeUnit.MILLISECONDS);
        }

        log.info("Ingest scheduler started (interval={}, datasets={}, rebuild={})", pollInterval, datasets,
                warehouseRebuild == null ? "off" : rebuildInterval);
    }

    private void pollAndReschedule() {
        safe("poll", () -> ingest.runOnce(datasets)).run();
        if (stopped)
            return;
        Duration delay = delayUntilNextTick(clock.instant(), pollInterval);
        log.debug("Next poll in {}", delay);
        try {
            pollTask = exec.schedule(this::pollAndReschedule, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler shut down, not rescheduling poll");
        }
    }

    /**
     * Time from {@code now} to the next multiple of {@code interval} since the
     * epoch; a full interval when {@code now} is exactly on a boundary.
     */
    static Duration delayUntilNextTick(Instant now, Duration interval) {
        long step = interval.toMillis();
        long nowMs = now.toEpochMilli();
        long next = Math.floorDiv(nowMs, step) * step + step;
        return Duration.ofMillis(next - nowMs);
    }

    public void stop() {
        stopped = true;
        ScheduledFuture<?> p = pollTask;
        if (p != null)
            p.cancel(false);
        if (rebuildTask != null)
            rebuildTask.cancel(false);
        shutdown(exec, "ingest-poll");
    }

    private void shutdown(ScheduledExecutorService es, String name) {
        es.shutdown();
        try {
            if (!es.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate cleanly", name);
                es.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            es.shutdownNow();
        }
    }

    private Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
