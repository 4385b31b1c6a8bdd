package org.postevent.cdp.util;

/**
 * Helpers for keeping protocol trace logging readable.
 */
public class LogUtils {
    private LogUtils() {
    }

    public static String ellipses(String json) {
        return ellipses(json, 40);
    }

    /**
     * Shortens every string literal in a JSON text longer than {@code maxLength} characters by
     * replacing its middle with "...". Escaped quotes inside literals are honoured.
     */
    public static String ellipses(String json, int maxLength) {
        boolean inQuotes = false;
        var output = new StringBuilder(Math.min(json.length(), 1024));
        var quote = new StringBuilder();
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (inQuotes && c == '\\' && i + 1 < json.length()) {
                quote.append(c).append(json.charAt(++i));
            } else if (c == '"') {
                if (inQuotes) {
                    output.append('"');
                    if (quote.length() <= maxLength) {
                        output.append(quote);
                    } else {
                        output.append(quote, 0, maxLength / 2);
                        output.append("...");
                        output.append(quote, quote.length() - maxLength / 2, quote.length());
                    }
                    output.append('"');
                    quote.setLength(0);
                }
                inQuotes = !inQuotes;
            } else if (inQuotes) {
                quote.append(c);
            } else {
                output.append(c);
            }
        }
        if (inQuotes) output.append('"').append(quote);
        return output.toString();
    }
}
