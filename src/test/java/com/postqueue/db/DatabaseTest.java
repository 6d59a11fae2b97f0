package com.postqueue.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DatabaseTest {

    private Database database;

    @BeforeEach
    public void setUp() throws Exception {
        database = TestDatabases.inMemory();
    }

    @AfterEach
    public void tearDown() {
        database.close();
    }

    @Test
    public void closingAConnectionReturnsItToThePool() throws Exception {
        assertEquals(4, database.availableConnections());

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM scheduled_jobs");
             ResultSet rs = stmt.executeQuery()) {
            assertTrue(rs.next());
            assertEquals(0, rs.getInt(1));
            assertEquals(3, database.availableConnections());
        }

        assertEquals(4, database.availableConnections());
    }

    @Test
    public void secondCloseDoesNotReturnTheConnectionAgain() throws Exception {
        Connection conn = database.getConnection();
        conn.close();
        conn.close();

        List<Connection> all = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                Connection borrowed = database.getConnection();
                all.add(borrowed);
                assertTrue(borrowed.isValid(2));
            }
            assertEquals(0, database.availableConnections());
        } finally {
            for (Connection borrowed : all) {
                borrowed.close();
            }
        }
    }

    @Test
    public void returnedConnectionRejectsFurtherUse() throws Exception {
        Connection conn = database.getConnection();
        conn.close();

        assertTrue(conn.isClosed());
        assertFalse(conn.isValid(1));
        assertThrows(SQLException.class, () -> conn.prepareStatement("SELECT 1"));
    }

    @Test
    public void uncommittedWorkIsRolledBackOnReturn() throws Exception {
        try (Connection conn = database.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO scheduled_jobs (id, target, payload, schedule_kind, active, created_at, updated_at) "
                        + "VALUES ('abandoned', 'news', 'x', 'RECURRING', TRUE, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)")) {
                stmt.executeUpdate();
            }
        }

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM scheduled_jobs");
             ResultSet rs = stmt.executeQuery()) {
            assertTrue(rs.next());
            assertEquals(0, rs.getInt(1));
            assertTrue(conn.getAutoCommit());
        }
    }

    @Test
    public void closedDatabaseRefusesConnections() {
        database.close();

        assertTrue(database.isClosed());
        assertThrows(SQLException.class, () -> database.getConnection());
    }
}
