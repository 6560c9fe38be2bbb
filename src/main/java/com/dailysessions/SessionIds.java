package com.dailysessions;

import org.joda.time.Instant;

/**
 * Builds session identifiers of the form {@code user_id#product_code#session_start}, where the
 * start is the ISO-8601 UTC instant. Backslash and '#' inside the ids are escaped with a
 * backslash, which keeps the encoding injective.
 */
public final class SessionIds {

    private static final char SEPARATOR = '#';
    private static final char ESCAPE = '\\';

    private SessionIds() {
    }

    public static String sessionId(String userId, String productCode, Instant sessionStart) {
        StringBuilder sb = new StringBuilder(userId.length() + productCode.length() + 32);
        appendEscaped(sb, userId);
        sb.append(SEPARATOR);
        appendEscaped(sb, productCode);
        sb.append(SEPARATOR);
        sb.append(sessionStart.toString());
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == SEPARATOR || c == ESCAPE) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
    }
}
