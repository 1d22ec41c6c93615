/*
* Copyright 2025 Taylor Ketterling
* API Server for gridload, an ISO-NE load ingestion and warehouse application.
* utalizes Javalin for HTTP server and exposes read-only endpoints over the DuckDB warehouse.
* uses Jackson for JSON processing.
*/

package space.ketterling.gridload.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.gridload.ingest.IngestRunLog;
import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.warehouse.QueryFacade;
import space.ketterling.gridload.warehouse.WarehouseBuilder;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final ObjectMapper om;
    private final QueryFacade facade;
    private final IngestRunLog runLog;
    private final WarehouseBuilder warehouse; // nullable
    private Javalin app;

    public ApiServer(ObjectMapper om, QueryFacade facade, IngestRunLog runLog, WarehouseBuilder warehouse) {
        this.om = om;
        this.facade = facade;
        this.runLog = runLog;
        this.warehouse = warehouse;
    }

    /**
     * Starts the server; port 0 picks a free port (see {@link #port()}).
     */
    public void start(int port) {
        log.info("Starting API server on port {}", port);
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> ctx.attribute("startTime", System.currentTimeMillis()));

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> ctx.status(400).json(error("bad_request",
                e.getMessage())));

        // Helpful JSON error instead of default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(error("internal_error", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "gridload",
                "status", "ok",
                "endpoints", new String[] {
                        "GET /health",
                        "GET /api/load/system/latest",
                        "GET /api/load/zonal/latest",
                        "GET /api/load/parity?ts=2024-01-01T00:05:00Z",
                        "GET /api/load/zonal/window?hours=24",
                        "GET /api/load/zonal/profile?days=28",
                        "GET /api/ingest/runs?limit=50",
                        "POST /api/warehouse/rebuild"
                })));

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now().toString());
            if (facade.ping()) {
                out.put("warehouse", "ok");
                Map<String, Long> counts = new LinkedHashMap<>();
                for (Map.Entry<Dataset, Long> e : facade.rowCounts().entrySet())
                    counts.put(e.getKey().tableName(), e.getValue());
                out.put("rows", counts);
            } else {
                out.put("warehouse", "fail");
                ctx.status(503);
            }
            ctx.json(out);
        });

        ApiRoutesLoad.register(this);
        ApiRoutesIngest.register(this);

        app.start(port);
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    /** Actual bound port, after {@link #start(int)}. */
    public int port() {
        return app.port();
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    QueryFacade facade() {
        return facade;
    }

    IngestRunLog runLog() {
        return runLog;
    }

    WarehouseBuilder warehouse() {
        return warehouse;
    }

    ObjectNode error(String code, String message) {
        return om.createObjectNode().put("error", code).put("message", message);
    }

    void putNullable(ObjectNode obj, String key, Object value) {
        if (value == null)
            obj.putNull(key);
        else if (value instanceof Number n)
            obj.put(key, n.doubleValue());
        else
            obj.put(key, value.toString());
    }

    static int parseInt(String s, int def, int min, int max) {
        if (s == null || s.isBlank())
            return def;
        try {
            int v = Integer.parseInt(s.trim());
            if (v < min)
                v = min;
            if (v > max)
                v = max;
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an integer: " + s);
        }
    }
}
