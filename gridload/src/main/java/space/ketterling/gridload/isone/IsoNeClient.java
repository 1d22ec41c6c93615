/*
* Copyright 2025 Taylor Ketterling
* ISO-NE Client for gridload, an ISO-NE load ingestion and warehouse application.
* Utilizes Java HttpClient for requests to the ISO New England Web Services API v1.1
* and Jackson for JSON processing.
*/

package space.ketterling.gridload.isone;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.gridload.config.AppConfig;
import space.ketterling.gridload.model.Dataset;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * HTTP client for the ISO-NE five-minute load endpoints.
 *
 * <p>
 * URLs always end in {@code .json} to force JSON output. Transient failures
 * (429, 5xx, I/O) are retried with exponential backoff, honoring a numeric
 * {@code Retry-After}.
 * </p>
 */
public final class IsoNeClient implements FeedSource {
    private static final Logger log = LoggerFactory.getLogger(IsoNeClient.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd", Locale.ROOT);
    private static final List<String> ERROR_KEYS = List.of("Error", "error", "Message", "message");

    private final HttpClient http;
    private final ObjectMapper om;
    private final String baseUrl;
    private final String authHeader;
    private final Duration timeout;
    private final int maxAttempts;
    private final long initialBackoffMs;

    /**
     * Creates a client using app config and a shared {@link ObjectMapper}.
     */
    public IsoNeClient(AppConfig cfg, ObjectMapper om) {
        this(cfg, om, 3, 1000L);
    }

    IsoNeClient(AppConfig cfg, ObjectMapper om, int maxAttempts, long initialBackoffMs) {
        cfg.requireCredentials();
        this.om = om;
        this.baseUrl = cfg.isoneBaseUrl();
        this.timeout = cfg.httpTimeout();
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = initialBackoffMs;
        this.authHeader = basicAuth(cfg.isoneUsername(), cfg.isonePassword());
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public FetchedPayload fetchCurrent(Dataset dataset) {
        return get(currentUrl(baseUrl, dataset));
    }

    @Override
    public FetchedPayload fetchDay(Dataset dataset, LocalDate day) {
        return get(dayUrl(baseUrl, dataset, day));
    }

    static String endpoint(Dataset dataset) {
        return switch (dataset) {
            case SYSTEM -> "fiveminutesystemload";
            case ZONAL -> "fiveminuteestimatedzonalload";
        };
    }

    static String currentUrl(String baseUrl, Dataset dataset) {
        return baseUrl + "/" + endpoint(dataset) + "/current.json";
    }

    static String dayUrl(String baseUrl, Dataset dataset, LocalDate day) {
        return baseUrl + "/" + endpoint(dataset) + "/day/" + DAY.format(day) + ".json";
    }

    static String basicAuth(String user, String pass) {
        String token = Base64.getEncoder().encodeToString((user + ":" + pass).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }

    /**
     * Executes a GET request with retries and interprets the response.
     */
    private FetchedPayload get(String url) {
        long backoffMs = initialBackoffMs;
        for (int attempt = 1; ; attempt++) {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Authorization", authHeader)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            long waitMs = backoffMs;
            try {
                log.debug("ISO-NE request -> {} attempt={}", url, attempt);
                HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
                String ctype = resp.headers().firstValue("Content-Type").orElse("");
                try {
                    FetchedPayload out = interpret(om, url, resp.statusCode(), ctype, resp.body());
                    log.debug("ISO-NE response {} for {} ({} bytes)", resp.statusCode(), url, resp.body().length);
                    return out;
                } catch (TransportException e) {
                    if (!e.isRetryable() || attempt >= maxAttempts)
                        throw e;
                    Long ra = retryAfterMillis(resp.headers().firstValue("Retry-After").orElse(null));
                    if (ra != null)
                        waitMs = ra;
                    log.warn("ISO-NE transient failure code={} url={} attempt={}", e.status(), url, attempt);
                }
            } catch (IOException e) {
                if (attempt >= maxAttempts)
                    throw new TransportException(url, "ISO-NE request failed: " + e.getMessage(), e);
                log.warn("ISO-NE request exception for url={} attempt={} err={}", url, attempt, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException(url, "Interrupted while fetching", e);
            }

            try {
                Thread.sleep(waitMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException(url, "Interrupted during backoff", e);
            }
            backoffMs *= 2;
        }
    }

    /**
     * Checks status, content type, JSON syntax and error-shaped bodies.
     */
    static FetchedPayload interpret(ObjectMapper om, String url, int status, String contentType, byte[] body) {
        if (status < 200 || status >= 300) {
            throw new TransportException(url, status,
                    "HTTP " + status + " from ISO-NE url=" + url + " body=" + snippet(body), body);
        }
        String ctype = contentType == null ? "" : contentType;
        if (!ctype.toLowerCase(Locale.ROOT).contains("json")) {
            throw new TransportException(url, status,
                    "Unexpected Content-Type '" + ctype + "' (likely HTML or a login page) url=" + url, body);
        }
        JsonNode json;
        try {
            json = om.readTree(body);
        } catch (IOException e) {
            throw new TransportException(url, status, "Invalid JSON in response url=" + url, body);
        }
        if (json == null || json.isMissingNode())
            throw new TransportException(url, status, "Empty response body url=" + url, body);
        if (json.isObject()) {
            for (String k : ERROR_KEYS) {
                if (json.has(k)) {
                    throw new TransportException(url, status,
                            "ISO-NE returned an error payload: " + json.get(k).toString(), body);
                }
            }
        }
        return new FetchedPayload(url, body, ctype, json);
    }

    static Long retryAfterMillis(String header) {
        if (header == null || header.isBlank())
            return null;
        try {
            return Math.max(0L, Long.parseLong(header.trim())) * 1000L;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String snippet(byte[] body) {
        if (body == null)
            return "";
        String s = new String(body, StandardCharsets.UTF_8);
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }
}
