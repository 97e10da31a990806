package org.example.bookmarksync.karakeep;

import org.example.bookmarksync.model.SyncSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

@Service
public class KarakeepClient {

    private static final Logger log = LoggerFactory.getLogger(KarakeepClient.class);

    public static final int PAGE_SIZE = 50;

    private final RestClient restClient;

    public KarakeepClient(RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.build();
    }

    /**
     * Fetches one page of bookmarks, oldest first.
     *
     * @param settings current sync settings (endpoint and API key)
     * @param cursor   continuation token from the previous page, or null for the first page
     * @throws SourceUnavailableException on a non-2xx response or transport failure
     */
    public KarakeepPage fetchPage(SyncSettings settings, String cursor) {
        URI uri = buildPageUri(settings.apiEndpoint(), cursor);
        log.info("Fetching Karakeep bookmarks: {}", uri);

        try {
            KarakeepPage page = restClient.get()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(KarakeepPage.class);
            return page != null ? page : new KarakeepPage(null, 0, null);
        } catch (RestClientResponseException e) {
            log.error("Karakeep API error: {} - {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new SourceUnavailableException(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (RestClientException e) {
            log.error("Error fetching bookmarks from Karakeep", e);
            throw new SourceUnavailableException("Error fetching bookmarks from Karakeep: " + e.getMessage(), e);
        }
    }

    URI buildPageUri(String apiEndpoint, String cursor) {
        String endpoint = apiEndpoint == null ? "" : apiEndpoint.trim();
        if (endpoint.endsWith("/")) {
            endpoint = endpoint.substring(0, endpoint.length() - 1);
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(endpoint + "/bookmarks")
            .queryParam("limit", PAGE_SIZE)
            .queryParam("sort", "createdAt")
            .queryParam("order", "asc");
        if (cursor == null || cursor.isEmpty()) {
            return builder.build().toUri();
        }
        // Cursors are opaque; expanding as a variable encodes reserved characters such as '+'.
        return builder.queryParam("cursor", "{cursor}")
            .encode()
            .buildAndExpand(Map.of("cursor", cursor))
            .toUri();
    }
}
