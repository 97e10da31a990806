package org.example.bookmarksync.karakeep;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * URL helpers derived from the configured Karakeep API endpoint.
 */
public final class KarakeepUrls {

    private KarakeepUrls() {
    }

    public static Optional<String> origin(String apiEndpoint) {
        URI uri = parseAbsolute(apiEndpoint);
        if (uri == null) {
            return Optional.empty();
        }
        return Optional.of(origin(uri));
    }

    public static Optional<String> assetUrl(String apiEndpoint, String assetId) {
        return origin(apiEndpoint).map(origin -> origin + "/assets/" + assetId);
    }

    public static Optional<String> previewUrl(String apiEndpoint, String bookmarkId) {
        return origin(apiEndpoint).map(origin -> origin + "/dashboard/preview/" + bookmarkId);
    }

    /**
     * True when both URLs share scheme, host and port. Unparseable input is never same-origin.
     */
    public static boolean isSameOrigin(String url, String apiEndpoint) {
        URI target = parseAbsolute(url);
        URI api = parseAbsolute(apiEndpoint);
        if (target == null || api == null) {
            return false;
        }
        return origin(target).equalsIgnoreCase(origin(api));
    }

    private static String origin(URI uri) {
        String scheme = uri.getScheme().toLowerCase();
        int port = uri.getPort();
        boolean defaultPort = port == -1
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
        return scheme + "://" + uri.getHost() + (defaultPort ? "" : ":" + port);
    }

    private static URI parseAbsolute(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(value.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
