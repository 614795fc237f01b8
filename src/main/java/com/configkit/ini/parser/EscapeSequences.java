package com.configkit.ini.parser;

import lombok.experimental.UtilityClass;

/**
 * Backslash escapes used inside quoted values ({@code \0 \a \b \t \r \n \; \# \" \\}) and the
 * single escape allowed in unquoted values: a backslash in front of a comment prefix.
 */
@UtilityClass
public class EscapeSequences {

    /**
     * Character produced by {@code \c}. Unknown escapes yield {@code c} itself.
     */
    public char decode(char c) {
        switch (c) {
            case '0':
                return '\0';
            case 'a':
                return '\u0007';
            case 'b':
                return '\b';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            case 'n':
                return '\n';
            default:
                return c;
        }
    }

    public String escapeQuoted(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\0' -> sb.append("\\0");
                case '\u0007' -> sb.append("\\a");
                case '\b' -> sb.append("\\b");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\n' -> sb.append("\\n");
                case ';' -> sb.append("\\;");
                case '#' -> sb.append("\\#");
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Puts a backslash in front of every comment prefix so an unquoted value reads back unchanged.
     */
    public String escapeUnquoted(String value, String commentPrefixChars) {
        StringBuilder sb = new StringBuilder(value.length() + 4);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (commentPrefixChars.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Whether {@code value} cannot be written unquoted without changing on the next read.
     */
    public boolean requiresQuotes(String value) {
        if (value.isEmpty()) {
            return false;
        }
        return Character.isWhitespace(value.charAt(0))
                || Character.isWhitespace(value.charAt(value.length() - 1))
                || value.charAt(0) == '"'
                || value.indexOf('\r') >= 0
                || value.indexOf('\n') >= 0;
    }
}
