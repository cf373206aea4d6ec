package com.queryscope.analyzer.plan;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class SqlLiteralsTest {

    @Test
    void scalarLiterals() {
        assertEquals("NULL", SqlLiterals.toLiteral(null));
        assertEquals("'O''Brien'", SqlLiterals.toLiteral("O'Brien"));
        assertEquals("'x'", SqlLiterals.toLiteral('x'));
        assertEquals("'SECONDS'", SqlLiterals.toLiteral(TimeUnit.SECONDS));
        assertEquals("1", SqlLiterals.toLiteral(true));
        assertEquals("0", SqlLiterals.toLiteral(false));
        assertEquals("'3fa85f64-5717-4562-b3fc-2c963f66afa6'",
            SqlLiterals.toLiteral(UUID.fromString("3fa85f64-5717-4562-b3fc-2c963f66afa6")));
        assertEquals("0x00FF10", SqlLiterals.toLiteral(new byte[] {0, (byte) 0xFF, 0x10}));
        assertEquals("'PT1.5S'", SqlLiterals.toLiteral(Duration.ofMillis(1500)));
    }

    @Test
    void numbersArePlainDecimals() {
        assertEquals("42", SqlLiterals.toLiteral(42));
        assertEquals("-7", SqlLiterals.toLiteral(-7L));
        assertEquals("3", SqlLiterals.toLiteral((short) 3));
        assertEquals("12345678901234567890", SqlLiterals.toLiteral(new BigInteger("12345678901234567890")));
        assertEquals("0.1", SqlLiterals.toLiteral(0.1d));
        assertEquals("2.5", SqlLiterals.toLiteral(2.5f));
        assertEquals("10000000000", SqlLiterals.toLiteral(1e10));
        assertEquals("1000", SqlLiterals.toLiteral(new BigDecimal("1E+3")));
        assertEquals("'NaN'", SqlLiterals.toLiteral(Double.NaN));
        assertEquals("'Infinity'", SqlLiterals.toLiteral(Float.POSITIVE_INFINITY));
    }

    @Test
    void temporalValues() {
        assertEquals("'2025-03-04 05:06:07.089'",
            SqlLiterals.toLiteral(LocalDateTime.of(2025, 3, 4, 5, 6, 7, 89_000_000)));
        assertEquals("'2025-03-04'", SqlLiterals.toLiteral(LocalDate.of(2025, 3, 4)));
        assertEquals("'05:06:07.000'", SqlLiterals.toLiteral(LocalTime.of(5, 6, 7)));
        assertEquals("'2025-03-04 05:06:07.000 +02:00'",
            SqlLiterals.toLiteral(OffsetDateTime.of(2025, 3, 4, 5, 6, 7, 0, ZoneOffset.ofHours(2))));
        assertEquals("'2025-03-04 05:06:07.000'", SqlLiterals.toLiteral(Instant.parse("2025-03-04T05:06:07Z")));
        assertEquals("'2025-03-04 05:06:07.000'",
            SqlLiterals.toLiteral(java.util.Date.from(Instant.parse("2025-03-04T05:06:07Z"))));
    }

    @Test
    void jdbcTemporalTypesKeepTheirShape() {
        assertEquals("'2025-03-04'", SqlLiterals.toLiteral(java.sql.Date.valueOf(LocalDate.of(2025, 3, 4))));
        assertEquals("'05:06:07.000'", SqlLiterals.toLiteral(java.sql.Time.valueOf(LocalTime.of(5, 6, 7))));
        assertEquals("'2025-03-04 05:06:07.500'",
            SqlLiterals.toLiteral(java.sql.Timestamp.valueOf(LocalDateTime.of(2025, 3, 4, 5, 6, 7, 500_000_000))));
    }

    @Test
    void namedPlaceholdersWithMarkerInKey() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("@id", 42);
        params.put("@name", "Ann");

        assertEquals("SELECT * FROM users WHERE id = 42 AND name = 'Ann'",
            SqlLiterals.substitute("SELECT * FROM users WHERE id = @id AND name = @name", params));
    }

    @Test
    void namedPlaceholdersWithBareKey() {
        assertEquals("UPDATE t SET a = 1 WHERE b = 'z'",
            SqlLiterals.substitute("UPDATE t SET a = :a WHERE b = $b", Map.of("a", 1, "b", "z")));
    }

    @Test
    void prefixOfAnotherNameIsNotReplaced() {
        Map<String, Object> params = Map.of("@p1", 1, "@p10", 10);

        assertEquals("SELECT 10, 1", SqlLiterals.substitute("SELECT @p10, @p1", params));
    }

    @Test
    void substitutedValuesAreNotRescanned() {
        Map<String, Object> params = Map.of("@a", "@b", "@b", "boom");

        assertEquals("SELECT '@b', 'boom'", SqlLiterals.substitute("SELECT @a, @b", params));
    }

    @Test
    void quotedTextAndCommentsAreLeftAlone() {
        String sql = "SELECT '@id', \"@id\" -- @id\n, @id /* @id */ FROM t WHERE x = 'it''s @id'";

        assertEquals("SELECT '@id', \"@id\" -- @id\n, 5 /* @id */ FROM t WHERE x = 'it''s @id'",
            SqlLiterals.substitute(sql, Map.of("@id", 5)));
    }

    @Test
    void castsAndSystemVariablesAreNotPlaceholders() {
        assertEquals("SELECT 3::int, @@ROWCOUNT",
            SqlLiterals.substitute("SELECT :v::int, @@ROWCOUNT", Map.of("v", 3, "int", 9, "ROWCOUNT", 1)));
    }

    @Test
    void positionalMarkersInOrder() {
        Map<String, Object> params = new HashMap<>();
        params.put("1", "a");
        params.put("2", null);
        params.put("3", 7);

        assertEquals("INSERT INTO t VALUES ('a', NULL, 7, '?')",
            SqlLiterals.substitute("INSERT INTO t VALUES (?, ?, ?, '?')", params));
    }

    @Test
    void unknownPlaceholdersStay() {
        assertEquals("SELECT @missing, ?", SqlLiterals.substitute("SELECT @missing, ?", Map.of("x", 1)));
        assertEquals("SELECT @a", SqlLiterals.substitute("SELECT @a", Map.of()));
    }

    @Test
    void emailLikeTextIsNotAPlaceholder() {
        assertEquals("SELECT user@host", SqlLiterals.substitute("SELECT user@host", Map.of("host", 1)));
    }
}
