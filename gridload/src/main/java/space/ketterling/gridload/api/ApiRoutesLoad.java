package space.ketterling.gridload.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.SystemLoadRecord;
import space.ketterling.gridload.model.TimestampParser;
import space.ketterling.gridload.model.ZonalLoadRecord;
import space.ketterling.gridload.warehouse.HourlyProfilePoint;
import space.ketterling.gridload.warehouse.ParityReport;
import space.ketterling.gridload.warehouse.QueryFacade;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Read-only load endpoints backed by the warehouse views.
 */
final class ApiRoutesLoad {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesLoad() {
    }

    /**
     * Registers load endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        QueryFacade q = api.facade();

        app.get("/api/load/system/latest", ctx -> {
            List<SystemLoadRecord> rows = q.latestSystem();
            ObjectNode out = om.createObjectNode();
            api.putNullable(out, "ts_utc", rows.isEmpty() ? null : rows.get(0).tsUtc());
            ArrayNode arr = out.putArray("rows");
            for (SystemLoadRecord r : rows)
                arr.add(systemRow(api, r));
            ctx.json(out);
        });

        app.get("/api/load/zonal/latest", ctx -> {
            List<ZonalLoadRecord> rows = q.latestZonal();
            ObjectNode out = om.createObjectNode();
            api.putNullable(out, "ts_utc", rows.isEmpty() ? null : rows.get(0).tsUtc());
            ArrayNode arr = out.putArray("rows");
            for (ZonalLoadRecord r : rows)
                arr.add(zonalRow(api, r));
            ctx.json(out);
        });

        app.get("/api/load/parity", ctx -> {
            String tsParam = ctx.queryParam("ts");
            Optional<Instant> ts;
            if (tsParam == null || tsParam.isBlank()) {
                ts = q.latestTimestamp(Dataset.SYSTEM);
            } else {
                try {
                    ts = Optional.of(Instant.parse(tsParam.trim()));
                } catch (DateTimeParseException e) {
                    ctx.status(400).json(api.error("bad_request", "ts must be an ISO-8601 instant"));
                    return;
                }
            }
            Optional<ParityReport> report = ts.flatMap(q::parity);
            if (report.isEmpty()) {
                ctx.status(404).json(api.error("no_data", "no system and zonal rows at " + ts.orElse(null)));
                return;
            }
            ParityReport p = report.get();
            ObjectNode out = om.createObjectNode();
            out.put("ts_utc", p.tsUtc().toString());
            out.put("system_mw", p.systemMw());
            out.put("zones_sum_mw", p.zonesSumMw());
            out.put("zone_count", p.zoneCount());
            out.put("delta_mw", p.deltaMw());
            out.put("delta_pct", p.deltaPct());
            out.put("text", p.format());
            ctx.json(out);
        });

        app.get("/api/load/zonal/window", ctx -> {
            int hours = ApiServer.parseInt(ctx.queryParam("hours"), 24, 1, 24 * 14);
            ArrayNode arr = om.createArrayNode();
            for (ZonalLoadRecord r : q.zonalWindow(hours))
                arr.add(zonalRow(api, r));
            ctx.json(arr);
        });

        app.get("/api/load/zonal/profile", ctx -> {
            int days = ApiServer.parseInt(ctx.queryParam("days"), 28, 1, 365);
            ArrayNode arr = om.createArrayNode();
            for (HourlyProfilePoint p : q.hourlyProfile(days)) {
                ObjectNode row = om.createObjectNode();
                row.put("zone_name", p.zoneName());
                row.put("iso_dow", p.isoDayOfWeek());
                row.put("hour", p.hour());
                row.put("avg_load_mw", p.avgLoadMw());
                row.put("samples", p.samples());
                arr.add(row);
            }
            ctx.json(arr);
        });
    }

    private static ObjectNode systemRow(ApiServer api, SystemLoadRecord r) {
        ObjectNode row = api.om().createObjectNode();
        row.put("iso", r.iso());
        row.put("ts_utc", r.tsUtc().toString());
        row.put("ts_local", TimestampParser.formatLocal(r.tsLocal()));
        row.put("location", r.location());
        api.putNullable(row, "load_mw", r.loadMw());
        row.put("is_system", r.isSystem());
        return row;
    }

    private static ObjectNode zonalRow(ApiServer api, ZonalLoadRecord r) {
        ObjectNode row = api.om().createObjectNode();
        row.put("iso", r.iso());
        row.put("ts_utc", r.tsUtc().toString());
        row.put("ts_local", TimestampParser.formatLocal(r.tsLocal()));
        row.put("zone_id", r.zoneId());
        row.put("zone_name", r.zoneName());
        api.putNullable(row, "load_mw", r.loadMw());
        return row;
    }
}
