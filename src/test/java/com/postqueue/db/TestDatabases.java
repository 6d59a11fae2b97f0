package com.postqueue.db;

import java.sql.SQLException;
import java.util.UUID;

/**
 * Fresh in-memory H2 databases with the schema applied.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    public static Database inMemory() throws SQLException {
        Database database = new Database(
            "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "", 4);
        database.initialize();
        return database;
    }
}
