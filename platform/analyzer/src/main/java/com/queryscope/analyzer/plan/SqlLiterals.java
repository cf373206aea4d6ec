package com.queryscope.analyzer.plan;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Map;
import java.util.UUID;

/**
 * Inlines parameter values into command text so the statement can be planned
 * without bind variables.
 *
 * A single left-to-right pass; substituted values are never rescanned, and
 * placeholders inside quoted strings, quoted identifiers and comments are left
 * alone. Named placeholders ({@code @id}, {@code :id}, {@code $id}) are looked
 * up by their full token first, then by the bare name. JDBC {@code ?} markers
 * are looked up as "1", "2", ... in order of appearance.
 */
public final class SqlLiterals {

    static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");
    static final DateTimeFormatter OFFSET_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS xxx");
    static final DateTimeFormatter OFFSET_TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS xxx");

    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private SqlLiterals() {}

    /**
     * Replace every placeholder that has a matching parameter. Placeholders
     * with no matching parameter are kept as written.
     */
    public static String substitute(String sql, Map<String, ?> parameters) {
        if (sql == null || sql.isEmpty() || parameters == null || parameters.isEmpty()) {
            return sql;
        }
        StringBuilder out = new StringBuilder(sql.length() + 32);
        int n = sql.length();
        int position = 0;
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            char next = i + 1 < n ? sql.charAt(i + 1) : '\0';

            if (c == '\'' || c == '"') {
                int end = skipQuoted(sql, i, c);
                out.append(sql, i, end);
                i = end;
            } else if (c == '-' && next == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? n : end;
                out.append(sql, i, end);
                i = end;
            } else if (c == '/' && next == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                out.append(sql, i, end);
                i = end;
            } else if ((c == ':' && next == ':') || (c == '@' && next == '@')) {
                // cast operator or system variable
                int end = identifierEnd(sql, i + 2);
                out.append(sql, i, end);
                i = end;
            } else if (c == '?') {
                position++;
                String key = Integer.toString(position);
                if (parameters.containsKey(key)) {
                    out.append(toLiteral(parameters.get(key)));
                } else {
                    out.append(c);
                }
                i++;
            } else if (isMarker(c) && isIdentifierChar(next) && !precededByIdentifier(sql, i)) {
                int end = identifierEnd(sql, i + 1);
                String token = sql.substring(i, end);
                String bare = token.substring(1);
                if (parameters.containsKey(token)) {
                    out.append(toLiteral(parameters.get(token)));
                } else if (parameters.containsKey(bare)) {
                    out.append(toLiteral(parameters.get(bare)));
                } else {
                    out.append(token);
                }
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * SQL literal for a single value.
     */
    public static String toLiteral(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String || value instanceof Character || value instanceof Enum<?>) {
            return quote(value instanceof Enum<?> e ? e.name() : value.toString());
        }
        if (value instanceof Boolean b) {
            return b ? "1" : "0";
        }
        if (value instanceof Double d) {
            return d.isNaN() || d.isInfinite() ? quote(d.toString()) : BigDecimal.valueOf(d).toPlainString();
        }
        if (value instanceof Float f) {
            return f.isNaN() || f.isInfinite() ? quote(f.toString()) : new BigDecimal(f.toString()).toPlainString();
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof BigInteger || value instanceof Number) {
            return new BigDecimal(value.toString()).toPlainString();
        }
        // java.sql subclasses first: they extend java.util.Date
        if (value instanceof java.sql.Timestamp ts) {
            return quote(DATE_TIME.format(ts.toLocalDateTime()));
        }
        if (value instanceof java.sql.Date d) {
            return quote(DATE.format(d.toLocalDate()));
        }
        if (value instanceof java.sql.Time t) {
            return quote(TIME.format(t.toLocalTime()));
        }
        if (value instanceof java.util.Date d) {
            return quote(DATE_TIME.format(LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC)));
        }
        if (value instanceof Instant instant) {
            return quote(DATE_TIME.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC)));
        }
        if (value instanceof LocalDateTime ldt) {
            return quote(DATE_TIME.format(ldt));
        }
        if (value instanceof LocalDate ld) {
            return quote(DATE.format(ld));
        }
        if (value instanceof LocalTime lt) {
            return quote(TIME.format(lt));
        }
        if (value instanceof OffsetDateTime odt) {
            return quote(OFFSET_DATE_TIME.format(odt));
        }
        if (value instanceof ZonedDateTime zdt) {
            return quote(OFFSET_DATE_TIME.format(zdt.toOffsetDateTime()));
        }
        if (value instanceof OffsetTime ot) {
            return quote(OFFSET_TIME.format(ot));
        }
        if (value instanceof UUID uuid) {
            return quote(uuid.toString());
        }
        if (value instanceof byte[] bytes) {
            return "0x" + HEX.formatHex(bytes);
        }
        return quote(value.toString());
    }

    static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private static int identifierEnd(String sql, int from) {
        int i = from;
        while (i < sql.length() && isIdentifierChar(sql.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isMarker(char c) {
        return c == '@' || c == ':' || c == '$';
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean precededByIdentifier(String sql, int i) {
        return i > 0 && isIdentifierChar(sql.charAt(i - 1));
    }
}
