package ua.beengoo.rolink.bot.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseManagerTest {
    @Test
    void dialectFromUrl() {
        assertEquals(DatabaseManager.Dialect.SQLITE, DatabaseManager.Dialect.of("jdbc:sqlite:rolink.db", ""));
        assertEquals(DatabaseManager.Dialect.POSTGRES, DatabaseManager.Dialect.of("jdbc:postgresql://db/rolink", null));
        assertEquals(DatabaseManager.Dialect.MYSQL, DatabaseManager.Dialect.of("JDBC:MariaDB://db/rolink", ""));
    }

    @Test
    void driverHintCoversUnknownUrls() {
        assertEquals(DatabaseManager.Dialect.POSTGRES,
                DatabaseManager.Dialect.of("jdbc:pgsql://db/rolink", "org.postgresql.Driver"));
        assertThrows(IllegalStateException.class, () -> DatabaseManager.Dialect.of("jdbc:h2:mem:x", ""));
    }

    @Test
    void bundledScriptsSplitIntoStatements() {
        for (DatabaseManager.Dialect d : DatabaseManager.Dialect.values()) {
            List<String> statements = DatabaseManager.statements(d.migrationResource());
            assertFalse(statements.isEmpty(), d.name());
            assertTrue(statements.get(0).startsWith("CREATE TABLE IF NOT EXISTS linkages"), d.name());
            statements.forEach(s -> assertFalse(s.endsWith(";"), s));
        }
        assertEquals(2, DatabaseManager.statements(DatabaseManager.Dialect.SQLITE.migrationResource()).size());
    }
}
