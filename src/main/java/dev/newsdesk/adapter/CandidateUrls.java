package dev.newsdesk.adapter;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;

/**
 * URL helpers shared by the adapters, so that the same article always yields the same
 * identifier (and therefore the same content hash).
 */
public final class CandidateUrls {

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "fbclid", "gclid", "ref", "source", "cmpid"
    );

    private CandidateUrls() {
        // utility class
    }

    /**
     * Canonical form of an article URL: lowercase scheme and host, default port dropped,
     * fragment and tracking parameters removed, remaining parameters sorted.
     *
     * @return the canonical URL, or {@code null} if the input is not an absolute http(s) URL
     */
    public static @Nullable String canonicalize(@Nullable String url) {
        URI uri = parseAbsolute(url);
        if (uri == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }

        StringBuilder sb = new StringBuilder(base(uri, scheme)).append(path);
        String query = filterQueryParams(uri.getRawQuery());
        if (query != null) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /**
     * Resolve a possibly relative link against the page or feed it was found in.
     *
     * @return the absolute URL, or {@code null} if it cannot be resolved
     */
    public static @Nullable String resolve(String baseUrl, @Nullable String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        try {
            return new URI(baseUrl.strip()).resolve(href.strip()).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * @return {@code scheme://host[:port]} of the URL, or the input unchanged if malformed
     */
    public static String baseOf(String url) {
        URI uri = parseAbsolute(url);
        if (uri == null) {
            return url;
        }
        return base(uri, uri.getScheme().toLowerCase(Locale.ROOT));
    }

    /**
     * Same scheme, host and port. A leading {@code www.} is ignored on both sides.
     */
    public static boolean isSameSite(String siteUrl, String candidateUrl) {
        URI site = parseAbsolute(siteUrl);
        URI candidate = parseAbsolute(candidateUrl);
        if (site == null || candidate == null) {
            return false;
        }
        return stripWww(baseOf(siteUrl)).equals(stripWww(baseOf(candidateUrl)));
    }

    private static @Nullable URI parseAbsolute(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.strip());
            if (uri.getScheme() == null || uri.getHost() == null) {
                return null;
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            if (!"http".equals(scheme) && !"https".equals(scheme)) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String base(URI uri, String scheme) {
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port == -1 || isDefaultPort(scheme, port)) {
            return scheme + "://" + host;
        }
        return scheme + "://" + host + ":" + port;
    }

    private static String stripWww(String base) {
        return base.replaceFirst("://www\\.", "://");
    }

    private static @Nullable String filterQueryParams(@Nullable String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
                .filter(param -> !param.isEmpty())
                .filter(param -> {
                    String key = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
                    String lower = key.toLowerCase(Locale.ROOT);
                    return !lower.startsWith("utm_") && !TRACKING_PARAMS.contains(lower);
                })
                .sorted()
                .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
