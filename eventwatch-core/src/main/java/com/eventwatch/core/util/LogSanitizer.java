package com.eventwatch.core.util;

/**
 * Neutralises attacker-controlled text before it is written to a log line
 * (CWE-117): CR/LF become a visible marker, other control characters are
 * rendered as {@code [CTRL-XX]}, and the result is length-capped.
 */
public final class LogSanitizer {

    public static final int DEFAULT_MAX_LENGTH = 512;

    private static final String NEWLINE_MARKER = " [NEWLINE] ";
    private static final String TRUNCATED_MARKER = "...[truncated]";

    private LogSanitizer() {
    }

    public static String sanitize(String input) {
        return sanitize(input, DEFAULT_MAX_LENGTH);
    }

    public static String sanitize(String input, int maxLength) {
        if (input == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(Math.min(input.length(), maxLength) + 16);
        int i = 0;
        while (i < input.length() && sb.length() < maxLength) {
            char ch = input.charAt(i);
            if (ch == '\r' || ch == '\n') {
                // collapse a run of line breaks into one marker
                while (i < input.length() && (input.charAt(i) == '\r' || input.charAt(i) == '\n')) {
                    i++;
                }
                sb.append(NEWLINE_MARKER);
                continue;
            }
            if (isControl(ch)) {
                sb.append(String.format("[CTRL-%02X]", (int) ch));
            } else {
                sb.append(ch);
            }
            i++;
        }
        if (i < input.length()) {
            sb.setLength(Math.min(sb.length(), maxLength));
            sb.append(TRUNCATED_MARKER);
        }
        return sb.toString();
    }

    private static boolean isControl(char ch) {
        return ch <= 0x1F || (ch >= 0x7F && ch <= 0x9F);
    }
}
