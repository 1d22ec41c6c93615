package space.ketterling.gridload.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;

import space.ketterling.gridload.model.Dataset;

import java.util.Map;

/**
 * Routes that show ingestion runs and trigger a warehouse rebuild.
 */
final class ApiRoutesIngest {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesIngest() {
    }

    /**
     * Registers ingest log and warehouse endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/ingest/runs", ctx -> {
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), 50, 1, 200);
            ArrayNode arr = om.createArrayNode();
            for (JsonNode run : api.runLog().recent(limit))
                arr.add(run);
            ctx.json(arr);
        });

        app.post("/api/warehouse/rebuild", ctx -> {
            if (api.warehouse() == null) {
                ctx.status(503).json(api.error("rebuild_not_available", "warehouse rebuild is not configured"));
                return;
            }
            Map<Dataset, Integer> rows = api.warehouse().build();
            ObjectNode out = om.createObjectNode();
            out.put("status", "ok");
            ObjectNode counts = out.putObject("rows_written");
            for (Map.Entry<Dataset, Integer> e : rows.entrySet())
                counts.put(e.getKey().tableName(), e.getValue());
            ctx.json(out);
        });
    }
}
