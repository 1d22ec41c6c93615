package space.ketterling.gridload.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.zaxxer.hikari.HikariDataSource;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import space.ketterling.gridload.TestPayloads;
import space.ketterling.gridload.config.AppConfig;
import space.ketterling.gridload.ingest.CycleSummary;
import space.ketterling.gridload.ingest.IngestRunLog;
import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.store.HistoryStore;
import space.ketterling.gridload.store.StorageLayout;
import space.ketterling.gridload.warehouse.Database;
import space.ketterling.gridload.warehouse.QueryFacade;
import space.ketterling.gridload.warehouse.WarehouseBuilder;
import space.ketterling.gridload.warehouse.WarehouseCompactor;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiServerTest {
    private final HttpClient http = HttpClient.newHttpClient();

    @TempDir
    Path dataDir;

    private HikariDataSource ds;
    private QueryFacade facade;
    private WarehouseBuilder builder;
    private IngestRunLog runLog;
    private ApiServer api;

    @BeforeEach
    void setUp() {
        AppConfig cfg = AppConfig.from(Map.of("DATA_DIR", dataDir.toString()), new Properties(), new Properties());
        StorageLayout layout = cfg.layout();
        HistoryStore history = new HistoryStore(layout, cfg.isoCode());
        history.appendBatch(TestPayloads.systemNormalizer()
                .normalize(TestPayloads.json("system_current.json")).records(), Dataset.SYSTEM);
        history.appendBatch(TestPayloads.zonalNormalizer()
                .normalize(TestPayloads.json("zonal_current.json")).records(), Dataset.ZONAL);

        ds = Database.createWarehouseDataSource(cfg);
        facade = new QueryFacade(ds, layout);
        builder = new WarehouseBuilder(new WarehouseCompactor(history, cfg.isoCode()), facade);
        builder.build();
        runLog = new IngestRunLog(layout.logsDir().resolve("ingest_runs.jsonl"), TestPayloads.OM);
    }

    @AfterEach
    void tearDown() {
        if (api != null)
            api.stop();
        ds.close();
    }

    private void start(WarehouseBuilder warehouse) {
        api = new ApiServer(TestPayloads.OM, facade, runLog, warehouse);
        api.start(0);
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + api.port() + path)).GET().build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + api.port() + path))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode body(HttpResponse<String> resp) throws Exception {
        return TestPayloads.OM.readTree(resp.body());
    }

    @Test
    void healthReportsRowCounts() throws Exception {
        start(builder);

        HttpResponse<String> resp = get("/health");

        assertThat(resp.statusCode()).isEqualTo(200);
        JsonNode json = body(resp);
        assertThat(json.get("warehouse").asText()).isEqualTo("ok");
        assertThat(json.get("rows").get("system_load").asLong()).isEqualTo(2L);
        assertThat(json.get("rows").get("zonal_load").asLong()).isEqualTo(8L);
    }

    @Test
    void parityAtATimestamp() throws Exception {
        start(builder);

        HttpResponse<String> resp = get("/api/load/parity?ts=2024-01-01T05:05:00Z");

        assertThat(resp.statusCode()).isEqualTo(200);
        JsonNode json = body(resp);
        assertThat(json.get("text").asText()).isEqualTo("+50.0 MW (+0.33%)");
        assertThat(json.get("zone_count").asInt()).isEqualTo(8);
        assertThat(json.get("delta_mw").asDouble()).isEqualTo(50.0);
    }

    @Test
    void parityWithoutZonesIsNotFound() throws Exception {
        start(builder);

        HttpResponse<String> resp = get("/api/load/parity");

        assertThat(resp.statusCode()).isEqualTo(404);
        assertThat(body(resp).get("error").asText()).isEqualTo("no_data");
    }

    @Test
    void badParametersAreBadRequests() throws Exception {
        start(builder);

        HttpResponse<String> badTs = get("/api/load/parity?ts=yesterday");
        HttpResponse<String> badHours = get("/api/load/zonal/window?hours=lots");

        assertThat(badTs.statusCode()).isEqualTo(400);
        assertThat(badHours.statusCode()).isEqualTo(400);
        assertThat(body(badHours).get("error").asText()).isEqualTo("bad_request");
    }

    @Test
    void latestRows() throws Exception {
        start(builder);

        JsonNode system = body(get("/api/load/system/latest"));
        JsonNode zonal = body(get("/api/load/zonal/latest"));

        assertThat(system.get("ts_utc").asText()).isEqualTo("2024-01-01T05:10:00Z");
        assertThat(system.get("rows").get(0).get("load_mw").asDouble()).isEqualTo(15120.5);
        assertThat(system.get("rows").get(0).get("ts_local").asText()).isEqualTo("2024-01-01T00:10:00");
        assertThat(zonal.get("rows").size()).isEqualTo(8);
        assertThat(zonal.get("rows").get(0).get("zone_id").asText()).isEqualTo("4001");
    }

    @Test
    void windowAndProfile() throws Exception {
        start(builder);

        assertThat(body(get("/api/load/zonal/window?hours=2")).size()).isEqualTo(8);
        JsonNode profile = body(get("/api/load/zonal/profile?days=7"));
        assertThat(profile.size()).isEqualTo(8);
        assertThat(profile.get(0).get("iso_dow").asInt()).isEqualTo(1);
    }

    @Test
    void ingestRunsNewestFirst() throws Exception {
        Instant t = Instant.parse("2024-01-01T05:07:00Z");
        runLog.append(new CycleSummary("first", "poll", t, t, List.of()));
        runLog.append(new CycleSummary("second", "poll", t, t, List.of()));
        start(builder);

        JsonNode runs = body(get("/api/ingest/runs?limit=1"));

        assertThat(runs.size()).isEqualTo(1);
        assertThat(runs.get(0).get("run_id").asText()).isEqualTo("second");
    }

    @Test
    void rebuildThroughTheApi() throws Exception {
        start(builder);

        HttpResponse<String> resp = post("/api/warehouse/rebuild");

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(body(resp).get("rows_written").get("zonal_load").asInt()).isEqualTo(8);
    }

    @Test
    void rebuildWithoutBuilderIsUnavailable() throws Exception {
        start(null);

        assertThat(post("/api/warehouse/rebuild").statusCode()).isEqualTo(503);
    }

    @Test
    void integerParameterIsClamped() {
        assertThat(ApiServer.parseInt(null, 24, 1, 336)).isEqualTo(24);
        assertThat(ApiServer.parseInt("0", 24, 1, 336)).isEqualTo(1);
        assertThat(ApiServer.parseInt("9999", 24, 1, 336)).isEqualTo(336);
        assertThatThrownBy(() -> ApiServer.parseInt("x", 24, 1, 336))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
