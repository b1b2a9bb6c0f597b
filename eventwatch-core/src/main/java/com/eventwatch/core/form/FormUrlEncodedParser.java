package com.eventwatch.core.form;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code application/x-www-form-urlencoded} text (form bodies and query
 * strings) into an ordered multi-map. Total over arbitrary input: broken
 * percent escapes are kept verbatim instead of failing the parse.
 */
public final class FormUrlEncodedParser {

    private FormUrlEncodedParser() {
    }

    public static Map<String, List<String>> parse(String encoded, Charset charset) {
        if (encoded == null || encoded.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> fields = new LinkedHashMap<>();
        for (String pair : encoded.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = decode(eq >= 0 ? pair.substring(0, eq) : pair, charset);
            String value = eq >= 0 ? decode(pair.substring(eq + 1), charset) : "";
            if (name.isEmpty()) {
                continue;
            }
            fields.computeIfAbsent(name, k -> new ArrayList<>(1)).add(value);
        }
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Like {@link java.net.URLDecoder}, except that each broken escape is kept
     * as literal text and the rest of the value is still decoded.
     */
    static String decode(String value, Charset charset) {
        if (value.indexOf('%') < 0 && value.indexOf('+') < 0) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '%' && isEscape(value, i)) {
                int high = Character.digit(value.charAt(i + 1), 16);
                int low = Character.digit(value.charAt(i + 2), 16);
                pending.write((high << 4) | low);
                i += 3;
                continue;
            }
            flush(pending, out, charset);
            out.append(c == '+' ? ' ' : c);
            i++;
        }
        flush(pending, out, charset);
        return out.toString();
    }

    private static boolean isEscape(String value, int at) {
        return at + 2 < value.length()
                && Character.digit(value.charAt(at + 1), 16) >= 0
                && Character.digit(value.charAt(at + 2), 16) >= 0;
    }

    private static void flush(ByteArrayOutputStream pending, StringBuilder out, Charset charset) {
        if (pending.size() > 0) {
            out.append(new String(pending.toByteArray(), charset));
            pending.reset();
        }
    }
}
