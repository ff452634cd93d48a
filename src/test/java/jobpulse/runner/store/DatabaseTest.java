package jobpulse.runner.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseTest {

    private static final String URL =
            "jdbc:h2:mem:test-database;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";

    @Test
    void schemaInitIsRepeatable() {
        try (Database first = new Database(URL, 1)) {
            assertTrue(first.isHealthy());
        }
        try (Database second = new Database(URL, 1)) {
            assertTrue(second.isHealthy());
        }
    }

    @Test
    void closedPoolIsUnhealthy() {
        Database db = new Database(URL, 1);
        db.close();

        assertFalse(db.isHealthy());
    }

    @Test
    void badUrlIsStoreException() {
        assertThrows(StoreException.class, () -> new Database("jdbc:nosuchdb://nowhere", 1));
    }
}
