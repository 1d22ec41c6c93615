package space.ketterling.gridload.isone;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A fetched body with its parsed JSON. The raw bytes are kept so they can be
 * stored exactly as received.
 */
public record FetchedPayload(String url, byte[] body, String contentType, JsonNode json) {
}
