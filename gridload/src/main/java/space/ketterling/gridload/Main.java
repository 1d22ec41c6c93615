/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for gridload, an ISO-NE load ingestion and warehouse application.
*
* Parses the command line, loads configuration, and wires the fetch client, normalizers,
* history store, warehouse compactor, query views, scheduler and API server.
* Runs a backfill and a single ingest cycle, or keeps polling and/or serving until shutdown.
*/

package space.ketterling.gridload;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import space.ketterling.gridload.api.ApiServer;
import space.ketterling.gridload.config.AppConfig;
import space.ketterling.gridload.ingest.CycleSummary;
import space.ketterling.gridload.ingest.DebugArtifacts;
import space.ketterling.gridload.ingest.IngestRunLog;
import space.ketterling.gridload.ingest.IngestScheduler;
import space.ketterling.gridload.ingest.IngestService;
import space.ketterling.gridload.isone.IsoNeClient;
import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.normalize.SchemaMapping;
import space.ketterling.gridload.normalize.SystemLoadNormalizer;
import space.ketterling.gridload.normalize.ZonalLoadNormalizer;
import space.ketterling.gridload.normalize.ZoneDirectory;
import space.ketterling.gridload.store.HistoryStore;
import space.ketterling.gridload.store.StorageLayout;
import space.ketterling.gridload.warehouse.Database;
import space.ketterling.gridload.warehouse.QueryFacade;
import space.ketterling.gridload.warehouse.WarehouseBuilder;
import space.ketterling.gridload.warehouse.WarehouseCompactor;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "gridload",
        description = "Ingest ISO-NE five-minute system and zonal load into a daily history and a Parquet warehouse.",
        mixinStandardHelpOptions = true,
        version = "gridload 1.0")
public final class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG = 2;

    @Option(names = "--backfill", defaultValue = "0", paramLabel = "N",
            description = "Backfill the N previous UTC days before polling (0 = skip).")
    int backfillDays;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    Mode mode;

    static final class Mode {
        @Option(names = "--once", required = true, description = "Run a single ingest cycle (after backfill, if any).")
        boolean once;

        @Option(names = "--loop", required = true, description = "Poll until stopped (after backfill, if any).")
        boolean loop;
    }

    @Option(names = "--interval-sec", paramLabel = "SECONDS",
            description = "Polling interval in seconds (default from schedule.poll, PT5M).")
    Integer intervalSec;

    @Option(names = "--only", paramLabel = "system|zonal", description = "Limit ingestion to one dataset.")
    String only;

    @Option(names = "--build-warehouse",
            description = "Rebuild Parquet segments and views after ingesting (or alone); in --loop also on schedule.warehouseRebuild.")
    boolean buildWarehouse;

    @Option(names = "--serve", description = "Start the HTTP query API and keep running.")
    boolean serve;

    public static void main(String[] args) {
        int code = new CommandLine(new Main()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        boolean once = mode != null && mode.once;
        boolean loop = mode != null && mode.loop;
        boolean ingest = backfillDays > 0 || once || loop;
        if (!ingest && !buildWarehouse && !serve) {
            log.error("Nothing to do: pass --once, --loop, --backfill N, --build-warehouse or --serve");
            return EXIT_CONFIG;
        }

        AppConfig cfg;
        Set<Dataset> datasets;
        try {
            if (backfillDays < 0)
                throw new IllegalArgumentException("--backfill must be >= 0");
            cfg = AppConfig.load();
            if (intervalSec != null) {
                if (intervalSec <= 0)
                    throw new IllegalArgumentException("--interval-sec must be positive");
                cfg = cfg.withPollInterval(Duration.ofSeconds(intervalSec));
            }
            datasets = only == null ? EnumSet.allOf(Dataset.class) : EnumSet.of(Dataset.fromName(only));
            if (ingest)
                cfg.requireCredentials();
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG;
        }
        log.info("Starting gridload with {}", cfg);

        try {
            return run(cfg, datasets, once, loop);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EXIT_OK;
        } catch (Exception e) {
            log.error("gridload failed", e);
            return EXIT_FAILURE;
        }
    }

    private int run(AppConfig cfg, Set<Dataset> datasets, boolean once, boolean loop)
            throws IOException, InterruptedException {
        ObjectMapper om = new ObjectMapper();
        Clock clock = Clock.systemUTC();
        StorageLayout layout = cfg.layout();
        layout.ensureDirectories();

        HistoryStore history = new HistoryStore(layout, cfg.isoCode());
        IngestRunLog runLog = new IngestRunLog(layout.logsDir().resolve("ingest_runs.jsonl"), om);

        IngestService ingestService = null;
        if (backfillDays > 0 || once || loop) {
            SystemLoadNormalizer system = new SystemLoadNormalizer(SchemaMapping.load(om, Dataset.SYSTEM),
                    cfg.isoCode());
            ZonalLoadNormalizer zonal = new ZonalLoadNormalizer(SchemaMapping.load(om, Dataset.ZONAL),
                    ZoneDirectory.isoNewEngland(), cfg.isoCode());
            ingestService = new IngestService(new IsoNeClient(cfg, om), history, List.of(system, zonal),
                    new DebugArtifacts(layout, om, clock), runLog, clock);
        }

        HikariDataSource ds = null;
        WarehouseBuilder warehouse = null;
        QueryFacade facade = null;
        if (buildWarehouse || serve) {
            ds = Database.createWarehouseDataSource(cfg);
            facade = new QueryFacade(ds, layout);
            warehouse = new WarehouseBuilder(new WarehouseCompactor(history, cfg.isoCode()), facade);
            facade.defineViews();
        }

        try {
            if (backfillDays > 0) {
                CycleSummary s = ingestService.backfill(backfillDays, datasets);
                log.info("Backfill of {} days done: {} rows added", backfillDays, s.totalAdded());
            }
            if (once) {
                CycleSummary s = ingestService.runOnce(datasets);
                log.info("Cycle done: {} rows added", s.totalAdded());
            }
            if (buildWarehouse && !loop)
                warehouse.build();

            if (!loop && !serve)
                return EXIT_OK;

            awaitShutdown(cfg, datasets, ingestService, loop, warehouse, facade, runLog, om, clock);
            return EXIT_OK;
        } finally {
            if (ds != null)
                ds.close();
        }
    }

    /**
     * Runs the scheduler and/or the API server until the JVM is asked to
     * stop.
     */
    private void awaitShutdown(AppConfig cfg, Set<Dataset> datasets, IngestService ingestService, boolean loop,
            WarehouseBuilder warehouse, QueryFacade facade, IngestRunLog runLog, ObjectMapper om, Clock clock)
            throws InterruptedException {
        CountDownLatch stopped = new CountDownLatch(1);

        IngestScheduler scheduler = null;
        if (loop) {
            Runnable rebuild = (buildWarehouse && warehouse != null) ? warehouse::build : null;
            scheduler = new IngestScheduler(ingestService, datasets, cfg.pollInterval(), rebuild,
                    cfg.warehouseRebuild(), clock);
            scheduler.start();
        }

        ApiServer api = null;
        if (serve) {
            api = new ApiServer(om, facade, runLog, warehouse);
            api.start(cfg.apiPort());
            log.info("API server started on port {}", api.port());
        }

        final IngestScheduler sched = scheduler;
        final ApiServer server = api;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                if (server != null)
                    server.stop();
                if (sched != null)
                    sched.stop();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            } finally {
                stopped.countDown();
            }
        }, "gridload-shutdown"));

        stopped.await();
    }
}
