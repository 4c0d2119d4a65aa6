package io.scrapehive.scraper.target;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Rebuilds URIs from their raw components so that escaping in path and query survives.
 */
public final class UriUtils {

    private UriUtils() {}

    /**
     * Replaces the host of {@code uri} with {@code address}, keeping scheme, credentials, port,
     * path, query and fragment.
     */
    public static URI withHost(URI uri, String address) {
        String host = address.indexOf(':') >= 0 && !address.startsWith("[") ? "[" + address + "]" : address;
        return build(uri, uri.getRawUserInfo(), host, uri.getRawPath());
    }

    public static URI withoutUserInfo(URI uri) {
        String authority = uri.getRawAuthority();
        if (uri.isOpaque() || authority == null || authority.indexOf('@') < 0) {
            return uri;
        }
        return build(uri, null, hostOf(uri), uri.getRawPath());
    }

    public static URI withPath(URI uri, String path) {
        return build(uri, uri.getRawUserInfo(), hostOf(uri), path);
    }

    /**
     * First value of query parameter {@code name}, or {@code null}.
     */
    public static String queryParameter(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (URLDecoder.decode(key, StandardCharsets.UTF_8).equals(name)) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    // Registry-based authorities (e.g. host names with underscores) have no parsed host
    private static String hostOf(URI uri) {
        if (uri.getHost() != null || uri.getRawAuthority() == null) {
            return uri.getHost();
        }
        String authority = uri.getRawAuthority();
        return authority.substring(authority.indexOf('@') + 1);
    }

    private static URI build(URI uri, String rawUserInfo, String host, String rawPath) {
        StringBuilder sb = new StringBuilder();
        if (uri.getScheme() != null) {
            sb.append(uri.getScheme()).append(':');
        }
        if (host != null || rawUserInfo != null || uri.getRawAuthority() != null) {
            sb.append("//");
            if (rawUserInfo != null) {
                sb.append(rawUserInfo).append('@');
            }
            if (host != null) {
                sb.append(host);
            }
            if (uri.getPort() != -1) {
                sb.append(':').append(uri.getPort());
            }
        }
        if (rawPath != null) {
            sb.append(rawPath);
        }
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        if (uri.getRawFragment() != null) {
            sb.append('#').append(uri.getRawFragment());
        }
        return URI.create(sb.toString());
    }
}
