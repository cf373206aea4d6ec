package com.queryscope.analyzer.plan;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DatabaseProviderTest {

    @Test
    void mapsJdbcProductNames() {
        assertEquals(DatabaseProvider.SQL_SERVER, DatabaseProvider.fromProductName("Microsoft SQL Server"));
        assertEquals(DatabaseProvider.POSTGRESQL, DatabaseProvider.fromProductName("PostgreSQL"));
        assertEquals(DatabaseProvider.MYSQL, DatabaseProvider.fromProductName("MySQL"));
        assertEquals(DatabaseProvider.MYSQL, DatabaseProvider.fromProductName("MariaDB"));
        assertEquals(DatabaseProvider.ORACLE, DatabaseProvider.fromProductName("Oracle"));
        assertEquals(DatabaseProvider.SQLITE, DatabaseProvider.fromProductName("SQLite"));
        assertEquals(DatabaseProvider.OTHER, DatabaseProvider.fromProductName("H2"));
        assertEquals(DatabaseProvider.UNKNOWN, DatabaseProvider.fromProductName(null));
    }

    @Test
    void wireNamesAndDialects() {
        assertEquals("SqlServer", DatabaseProvider.SQL_SERVER.providerName());
        assertEquals(StandardPlanDialect.SQL_SERVER, StandardPlanDialect.forProvider(DatabaseProvider.SQL_SERVER).orElseThrow());
        assertTrue(StandardPlanDialect.forProvider(DatabaseProvider.ORACLE).isEmpty());
        assertEquals("EXPLAIN (FORMAT JSON) SELECT 1", StandardPlanDialect.POSTGRESQL.planStatement("SELECT 1"));
        assertEquals("EXPLAIN FORMAT=JSON SELECT 1", StandardPlanDialect.MYSQL.planStatement("SELECT 1"));
        assertFalse(StandardPlanDialect.MYSQL.togglesSession());
        assertTrue(StandardPlanDialect.SQL_SERVER.togglesSession());
        assertEquals("text/plain", PlanFormat.UNKNOWN.contentType());
        assertEquals("Plain Text", PlanFormat.TEXT.description());
    }
}
