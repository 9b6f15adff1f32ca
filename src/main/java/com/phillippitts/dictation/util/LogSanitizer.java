package com.phillippitts.dictation.util;

import java.net.URI;

/** Utility for privacy-safe logging of transcript previews and URLs. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Strips the query string (which may carry signed tokens) from a URL before logging.
     */
    public static String redactQuery(String url) {
        if (url == null) {
            return "";
        }
        try {
            URI uri = URI.create(url);
            if (uri.getRawQuery() == null) {
                return url;
            }
            return new URI(uri.getScheme(), uri.getAuthority(), uri.getPath(), null, null).toString();
        } catch (Exception e) {
            int q = url.indexOf('?');
            return q < 0 ? url : url.substring(0, q);
        }
    }
}
