package space.ketterling.gridload.isone;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.javalin.Javalin;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import space.ketterling.gridload.config.AppConfig;
import space.ketterling.gridload.model.Dataset;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsoNeClientTest {
    private static final ObjectMapper OM = new ObjectMapper();
    private static final String URL = "https://example.test/api/v1.1/fiveminutesystemload/current.json";

    private Javalin server;

    @AfterEach
    void tearDown() {
        if (server != null)
            server.stop();
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void urlsForceJsonOutput() {
        String base = "https://webservices.iso-ne.com/api/v1.1";

        assertThat(IsoNeClient.currentUrl(base, Dataset.SYSTEM))
                .isEqualTo(base + "/fiveminutesystemload/current.json");
        assertThat(IsoNeClient.dayUrl(base, Dataset.ZONAL, LocalDate.of(2024, 1, 9)))
                .isEqualTo(base + "/fiveminuteestimatedzonalload/day/20240109.json");
    }

    @Test
    void basicAuthHeader() {
        assertThat(IsoNeClient.basicAuth("user", "pass")).isEqualTo("Basic dXNlcjpwYXNz");
    }

    @Test
    void acceptsJsonBodies() {
        FetchedPayload p = IsoNeClient.interpret(OM, URL, 200, "application/json; charset=utf-8",
                utf8("{\"FiveMinSystemLoad\": []}"));

        assertThat(p.json().has("FiveMinSystemLoad")).isTrue();
        assertThat(p.url()).isEqualTo(URL);
    }

    @Test
    void httpErrorKeepsStatusAndBody() {
        assertThatThrownBy(() -> IsoNeClient.interpret(OM, URL, 401, "text/html", utf8("<html>login</html>")))
                .isInstanceOfSatisfying(TransportException.class, e -> {
                    assertThat(e.status()).isEqualTo(401);
                    assertThat(e.isRetryable()).isFalse();
                    assertThat(new String(e.body(), StandardCharsets.UTF_8)).contains("login");
                });
    }

    @Test
    void nonJsonContentTypeIsRefused() {
        assertThatThrownBy(() -> IsoNeClient.interpret(OM, URL, 200, "text/html", utf8("<html/>")))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("text/html");
    }

    @Test
    void malformedJsonIsRefused() {
        assertThatThrownBy(() -> IsoNeClient.interpret(OM, URL, 200, "application/json", utf8("{\"a\": ")))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    void errorShapedBodyIsRefused() {
        assertThatThrownBy(() -> IsoNeClient.interpret(OM, URL, 200, "application/json",
                utf8("{\"Message\": \"Authorization has been denied\"}")))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("Authorization has been denied");
    }

    @Test
    void retryableStatuses() {
        assertThat(new TransportException(URL, 429, "x", null).isRetryable()).isTrue();
        assertThat(new TransportException(URL, 503, "x", null).isRetryable()).isTrue();
        assertThat(new TransportException(URL, 404, "x", null).isRetryable()).isFalse();
        assertThat(new TransportException(URL, "io", new java.io.IOException("reset")).isRetryable()).isTrue();
    }

    @Test
    void retryAfterIsReadAsSeconds() {
        assertThat(IsoNeClient.retryAfterMillis("3")).isEqualTo(3000L);
        assertThat(IsoNeClient.retryAfterMillis("-1")).isZero();
        assertThat(IsoNeClient.retryAfterMillis("Wed, 21 Oct 2015 07:28:00 GMT")).isNull();
        assertThat(IsoNeClient.retryAfterMillis(null)).isNull();
    }

    @Test
    void clientRequiresCredentials() {
        AppConfig cfg = AppConfig.from(Map.of(), new Properties(), new Properties());

        assertThatThrownBy(() -> new IsoNeClient(cfg, OM))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void transientFailureIsRetriedThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<String> auth = new AtomicReference<>();
        server = Javalin.create()
                .get("/api/v1.1/fiveminutesystemload/current.json", ctx -> {
                    auth.set(ctx.header("Authorization"));
                    if (calls.incrementAndGet() == 1) {
                        ctx.header("Retry-After", "0");
                        ctx.status(503).result("busy");
                        return;
                    }
                    ctx.contentType("application/json")
                            .result("{\"FiveMinSystemLoad\": [{\"BeginDate\": \"2024-01-01T00:05:00.000-05:00\", "
                                    + "\"LoadMw\": 15000.0}]}");
                })
                .start(0);

        IsoNeClient client = new IsoNeClient(config(server.port()), OM, 3, 1L);
        FetchedPayload p = client.fetchCurrent(Dataset.SYSTEM);

        assertThat(calls.get()).isEqualTo(2);
        assertThat(auth.get()).isEqualTo(IsoNeClient.basicAuth("user", "pass"));
        assertThat(p.json().get("FiveMinSystemLoad").size()).isEqualTo(1);
    }

    @Test
    void permanentFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        server = Javalin.create()
                .get("/api/v1.1/fiveminuteestimatedzonalload/day/20240101.json", ctx -> {
                    calls.incrementAndGet();
                    ctx.status(403).result("forbidden");
                })
                .start(0);

        IsoNeClient client = new IsoNeClient(config(server.port()), OM, 3, 1L);

        assertThatThrownBy(() -> client.fetchDay(Dataset.ZONAL, LocalDate.of(2024, 1, 1)))
                .isInstanceOfSatisfying(TransportException.class, e -> assertThat(e.status()).isEqualTo(403));
        assertThat(calls.get()).isEqualTo(1);
    }

    private static AppConfig config(int port) {
        return AppConfig.from(Map.of(
                "ISONE_USERNAME", "user",
                "ISONE_PASSWORD", "pass",
                "ISONE_BASE_URL", "http://localhost:" + port + "/api/v1.1"),
                new Properties(), new Properties());
    }
}
