package com.configkit.ini.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.configkit.ini.model.exception.ValueConversionException;

import lombok.experimental.UtilityClass;

/**
 * Encodes lists as <code>{a, b, "c,d"}</code> and back.
 * Empty elements and elements containing ',', '{', '}', '"' or a space are quoted; inside quotes
 * a quote is written as \" and a backslash as \\.
 */
@UtilityClass
public class ArrayValueCodec {

    public static final int DEFAULT_MAX_ELEMENTS = 10_000;

    private static final String SPECIAL_CHARS = ",{}\" ";

    public static String encode(Collection<?> values) {
        if (values == null || values.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder(2 + values.size() * 10);
        sb.append('{');
        boolean first = true;
        for (Object value : values) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            String text = ValueConverter.toText(value);
            if (text.isEmpty() || needsQuotes(text)) {
                sb.append('"');
                for (int i = 0; i < text.length(); i++) {
                    char c = text.charAt(i);
                    if (c == '"' || c == '\\') {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
                sb.append('"');
            } else {
                sb.append(text);
            }
        }
        return sb.append('}').toString();
    }

    /**
     * Splits an encoded array into its raw element strings.
     *
     * @param maxElements limit on the element count, 0 for unlimited
     * @throws ValueConversionException on malformed input or too many elements
     */
    public static List<String> decode(String encoded, int maxElements) {
        String text = encoded == null ? "" : encoded.trim();
        if (text.length() < 2 || text.charAt(0) != '{' || text.charAt(text.length() - 1) != '}') {
            throw new ValueConversionException("Invalid array format", encoded, List.class);
        }

        String body = text.substring(1, text.length() - 1);
        List<String> items = new ArrayList<>();
        int start = 0;
        boolean inQuotes = false;
        for (int i = 0; i <= body.length(); i++) {
            if (i == body.length()) {
                if (inQuotes) {
                    throw new ValueConversionException("Unterminated quote in array", encoded, List.class);
                }
                addItem(items, body.substring(start, i), maxElements, encoded);
                break;
            }
            char c = body.charAt(i);
            if (inQuotes && c == '\\' && i + 1 < body.length()) {
                // the escaped character never ends the quote
                i++;
            } else if (c == '"') {
                if (!inQuotes && i > 0 && body.charAt(i - 1) == '\\') {
                    continue;
                }
                inQuotes = !inQuotes;
            } else if (c == ',' && !inQuotes) {
                addItem(items, body.substring(start, i), maxElements, encoded);
                start = i + 1;
            }
        }
        return items;
    }

    public static <T> List<T> decode(String encoded, Class<T> elementType, int maxElements) {
        List<String> raw = decode(encoded, maxElements);
        List<T> values = new ArrayList<>(raw.size());
        for (String item : raw) {
            values.add(ValueConverter.convert(item, elementType));
        }
        return values;
    }

    private static void addItem(List<String> items, String item, int maxElements, String encoded) {
        String trimmed = item.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        boolean quoted = trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"");
        if (maxElements > 0 && items.size() >= maxElements) {
            throw new ValueConversionException(
                    "Array exceeds maximum allowed size (" + maxElements + " elements)", encoded, List.class);
        }
        items.add(quoted ? unescape(trimmed.substring(1, trimmed.length() - 1)) : trimmed);
    }

    /**
     * Reverses the quoting of {@link #encode(Collection)}; a backslash before any other character is kept.
     */
    private static String unescape(String text) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == '\\' || next == '"') {
                    sb.append(next);
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static boolean needsQuotes(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (SPECIAL_CHARS.indexOf(text.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }
}
