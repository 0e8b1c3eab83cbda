package com.sitecheck.common.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {

    private UrlUtils() {}

    /**
     * Trim, default the scheme to https and lower-case the host. Path, query and fragment
     * keep their case.
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL must be a non-empty string");
        }
        String normalized = url.trim();
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            normalized = "https://" + normalized;
        }
        try {
            URI uri = new URI(normalized);
            if (uri.getHost() == null) {
                return normalized.toLowerCase(Locale.ROOT);
            }
            return new URI(
                uri.getScheme(),
                uri.getUserInfo(),
                uri.getHost().toLowerCase(Locale.ROOT),
                uri.getPort(),
                uri.getPath(),
                uri.getQuery(),
                uri.getFragment()
            ).toString();
        } catch (URISyntaxException e) {
            return normalized.toLowerCase(Locale.ROOT);
        }
    }

    public static boolean isHttps(String url) {
        return url != null && url.toLowerCase(Locale.ROOT).startsWith("https://");
    }

    /**
     * Host part of a URL, empty when it cannot be parsed.
     */
    public static String host(String url) {
        try {
            String host = new URI(url).getHost();
            return host != null ? host : "";
        } catch (URISyntaxException e) {
            return "";
        }
    }
}
