package com.coin.porter.common.util;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

public final class LogSanitizer {
    private static final String MASK = "***";
    private static final Pattern QUERY_SECRET = Pattern.compile("(?i)\\b(apiKey|apiSecret|passphrase|signature|sign|secret)=[^\\s&]+");
    private static final Set<String> SECRET_HEADERS = Set.of(
            "x-mbx-apikey",
            "x-bapi-api-key",
            "x-bapi-sign"
    );

    private LogSanitizer() {
    }

    public static String sanitize(String value) {
        if (value == null) {
            return null;
        }
        return QUERY_SECRET.matcher(value).replaceAll("$1=" + MASK);
    }

    public static Map<String, String> sanitizeHeaders(Map<String, String> headers) {
        Map<String, String> out = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers == null) {
            return out;
        }
        headers.forEach((name, value) -> out.put(name,
                SECRET_HEADERS.contains(name.toLowerCase(Locale.ROOT)) ? MASK : value));
        return out;
    }
}
