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
import java.sql.Timestamp;
import java.util.Arrays;
import java.util.List;

/**
 * JDBC schema for separate tables per journal, named after common prefix. Following tables are used:
 * <ul>
 * <li><em>prefix_event</em>(ID, VERSION, CREATED_AT, TYPE, PAYLOAD_VERSION, PAYLOAD, CORRELATION_ID, SEQ) primary
 * key (ID, VERSION), unique SEQ</li>
 * <li><em>prefix_version</em>(ID, VERSION)</li>
 * <li><em>prefix_sequence</em>(NAME, SEQ) with single row holding last assigned offset</li>
 * </ul>
 */
public class DefaultJdbcSchema extends JdbcSchema {

    private static final String SEQUENCE_NAME = "GLOBAL";

    private final String eventTable;
    private final String versionTable;
    private final String sequenceTable;

    public DefaultJdbcSchema(String prefix) {
        this(prefix + "_event", prefix + "_version", prefix + "_sequence");
    }

    public DefaultJdbcSchema(String eventTable, String versionTable, String sequenceTable) {
        this.eventTable = eventTable;
        this.versionTable = versionTable;
        this.sequenceTable = sequenceTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getVersionTable() {
        return versionTable;
    }

    protected String getSequenceTable() {
        return sequenceTable;
    }

    @Override
    protected List<String> createTableStatements() {
        return Arrays.asList(
            "CREATE TABLE IF NOT EXISTS " + getEventTable() + " (ID VARCHAR(128) NOT NULL, VERSION BIGINT NOT NULL, "
                    + "CREATED_AT TIMESTAMP NOT NULL, TYPE VARCHAR(128) NOT NULL, PAYLOAD_VERSION INT NOT NULL, "
                    + "PAYLOAD CLOB NOT NULL, CORRELATION_ID VARCHAR(128), SEQ BIGINT NOT NULL, "
                    + "PRIMARY KEY (ID, VERSION))",
            "CREATE UNIQUE INDEX IF NOT EXISTS " + getEventTable() + "_seq ON " + getEventTable() + " (SEQ)",
            "CREATE TABLE IF NOT EXISTS " + getVersionTable() + " (ID VARCHAR(128) PRIMARY KEY, "
                    + "VERSION BIGINT NOT NULL)",
            "CREATE TABLE IF NOT EXISTS " + getSequenceTable() + " (NAME VARCHAR(64) PRIMARY KEY, "
                    + "SEQ BIGINT NOT NULL)");
    }

    @Override
    protected PreparedStatement selectEntityVersion(Connection connection, String entityId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION FROM " + getVersionTable() + " WHERE ID=?");
        st.setString(1, entityId);
        return st;
    }

    @Override
    protected PreparedStatement createEntityVersion(Connection connection, String entityId, long startVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getVersionTable()
                + " (ID, VERSION) VALUES (?, ?)");
        st.setString(1, entityId);
        st.setLong(2, startVersion);
        return st;
    }

    @Override
    protected long readEntityVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement updateEntityVersion(Connection connection, String entityId, long startVersion,
            long endVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getVersionTable()
                + " SET VERSION=? WHERE ID=? AND VERSION=?");
        st.setLong(1, endVersion);
        st.setString(2, entityId);
        st.setLong(3, startVersion);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (ID, VERSION, CREATED_AT, TYPE, PAYLOAD_VERSION, PAYLOAD, CORRELATION_ID, SEQ) "
                + "VALUES (?,?,?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, Event event, int payloadVersion, String payload,
            long offset) throws SQLException {
        insertEvent.setString(1, event.entityId());
        insertEvent.setLong(2, event.entityStateVersion());
        insertEvent.setTimestamp(3, Timestamp.from(event.getTimestamp()));
        insertEvent.setString(4, event.getType());
        insertEvent.setInt(5, payloadVersion);
        insertEvent.setString(6, payload);
        insertEvent.setString(7, event.correlationId());
        insertEvent.setLong(8, offset);
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String entityId, long afterVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT ID, VERSION, TYPE, PAYLOAD_VERSION, PAYLOAD, SEQ "
                + "FROM " + getEventTable() + " WHERE ID=? AND VERSION > ? ORDER BY VERSION");
        st.setString(1, entityId);
        st.setLong(2, afterVersion);
        return st;
    }

    @Override
    protected PreparedStatement selectAllEvents(Connection connection, long afterOffset, int limit)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT ID, VERSION, TYPE, PAYLOAD_VERSION, PAYLOAD, SEQ "
                + "FROM " + getEventTable() + " WHERE SEQ > ? ORDER BY SEQ");
        st.setLong(1, afterOffset);
        st.setMaxRows(limit);
        return st;
    }

    @Override
    protected long readEventVersion(ResultSet rs) throws SQLException {
        return rs.getLong(2);
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(3);
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(4);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(5);
    }

    @Override
    protected long readEventOffset(ResultSet rs) throws SQLException {
        return rs.getLong(6);
    }

    @Override
    protected PreparedStatement createSequence(Connection connection) throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getSequenceTable()
                + " (NAME, SEQ) VALUES (?, 0)");
        st.setString(1, SEQUENCE_NAME);
        return st;
    }

    @Override
    protected PreparedStatement advanceSequence(Connection connection, int count) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getSequenceTable()
                + " SET SEQ=SEQ+? WHERE NAME=?");
        st.setInt(1, count);
        st.setString(2, SEQUENCE_NAME);
        return st;
    }

    @Override
    protected PreparedStatement selectLastOffset(Connection connection) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT SEQ FROM " + getSequenceTable()
                + " WHERE NAME=?");
        st.setString(1, SEQUENCE_NAME);
        return st;
    }

    @Override
    protected long readLastOffset(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }
}
