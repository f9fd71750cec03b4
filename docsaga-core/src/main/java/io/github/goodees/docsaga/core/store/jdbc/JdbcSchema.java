package io.github.goodees.docsaga.core.store.jdbc;

/*-
 * #%L
 * ese
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.docsaga.core.Event;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Statements the JDBC journal needs from the database. Implementations decide about table layout and SQL dialect,
 * the store and the log only bind parameters and read result sets through this class.
 */
public abstract class JdbcSchema {

    /**
     * DDL statements creating the journal tables, in order of execution.
     * @return list of statements
     */
    protected abstract List<String> createTableStatements();

    /**
     * Create the journal tables when they do not exist yet, and initialize the global sequence.
     * @param connection connection to use
     * @throws SQLException when DDL fails
     */
    public void createTables(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String ddl : createTableStatements()) {
                st.execute(ddl);
            }
        }
        try (PreparedStatement select = selectLastOffset(connection); ResultSet rs = select.executeQuery()) {
            if (!rs.next()) {
                try (PreparedStatement insert = createSequence(connection)) {
                    insert.executeUpdate();
                }
            }
        }
    }

    protected abstract PreparedStatement selectEntityVersion(Connection connection, String entityId)
            throws SQLException;

    protected abstract PreparedStatement createEntityVersion(Connection connection, String entityId, long startVersion)
            throws SQLException;

    protected abstract long readEntityVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement updateEntityVersion(Connection connection, String entityId,
            long startVersion, long endVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, Event event, int payloadVersion,
            String payload, long offset) throws SQLException;

    protected abstract PreparedStatement selectEvents(Connection connection, String entityId, long afterVersion)
            throws SQLException;

    protected abstract PreparedStatement selectAllEvents(Connection connection, long afterOffset, int limit)
            throws SQLException;

    protected abstract long readEventVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;

    protected abstract long readEventOffset(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement createSequence(Connection connection) throws SQLException;

    /**
     * Advance the global sequence by given amount. The update locks the sequence row until the transaction ends.
     * @param connection connection of the append transaction
     * @param count number of offsets to reserve
     * @return the update statement
     * @throws SQLException on database error
     */
    protected abstract PreparedStatement advanceSequence(Connection connection, int count) throws SQLException;

    protected abstract PreparedStatement selectLastOffset(Connection connection) throws SQLException;

    protected abstract long readLastOffset(ResultSet rs) throws SQLException;
}
