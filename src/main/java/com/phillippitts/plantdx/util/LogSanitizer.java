package com.phillippitts.plantdx.util;

import java.util.regex.Pattern;

/** Utility for privacy-safe logging of provider payloads and URLs. */
public final class LogSanitizer {

    private static final Pattern API_KEY_PARAM =
            Pattern.compile("(?i)([?&](?:key|api-key|api_key|apikey)=)[^&]*");

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
     * Masks API keys passed as query parameters, e.g. {@code ?api-key=abc} becomes {@code ?api-key=***}.
     */
    public static String redactUrl(String url) {
        if (url == null) {
            return "";
        }
        return API_KEY_PARAM.matcher(url).replaceAll("$1***");
    }
}
