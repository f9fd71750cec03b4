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
import io.github.goodees.docsaga.core.store.EventStore;
import io.github.goodees.docsaga.core.store.EventStoreException;
import io.github.goodees.docsaga.core.store.Serialization;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Event store appending to tables described by {@link JdbcSchema}. Every append runs in single transaction that
 * checks and advances the entity version, reserves global offsets and inserts the events.
 * @param <E> type of events serialization supports
 */
public class JdbcEventStore<E> implements EventStore {
    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
    }

    protected boolean isSupportedEvent(Event event) {
        return serialization.toSerializable(event) != null;
    }

    protected E checkCast(Event event) throws EventStoreException {
        E cast = serialization.toSerializable(event);
        if (cast == null) {
            throw EventStoreException.unsupported(event);
        } else {
            return cast;
        }
    }

    @Override
    public void persist(Event event) throws EventStoreException {
        PersistTemplate template = createTemplate();
        template.addEvent(event);
        template.persist();
    }

    @Override
    public void persist(Event... events) throws EventStoreException {
        PersistTemplate template = createTemplate();
        for (Event event : events) {
            template.addEvent(event);
        }
        template.persist();
    }

    @Override
    public void persist(Iterable<? extends Event> events) throws EventStoreException {
        PersistTemplate template = createTemplate();
        for (Event event : events) {
            template.addEvent(event);
        }
        template.persist();
    }

    protected PersistTemplate createTemplate() {
        return new PersistTemplate();
    }

    protected void prepareInsert(PreparedStatement insertEvent, Event event, long offset)
            throws SQLException, EventStoreException {
        E payload = checkCast(event);
        schema.prepareInsert(insertEvent, event, serialization.payloadVersion(payload),
            serialization.serialize(payload), offset);
    }

    protected class PersistTemplate {
        private final List<Event> events = new ArrayList<>();
        private String entityId;
        private long startVersion;
        private long endVersion;

        void addEvent(Event event) throws EventStoreException {
            if (entityId == null) {
                entityId = event.entityId();
                startVersion = event.entityStateVersion() - 1;
            } else if (!entityId.equals(event.entityId())) {
                throw EventStoreException.mixedEntities(entityId, event);
            } else if (event.entityStateVersion() != endVersion + 1) {
                throw EventStoreException.versionGap(entityId, endVersion + 1, event);
            }

            if (!isSupportedEvent(event)) {
                throw EventStoreException.unsupported(event);
            }
            endVersion = event.entityStateVersion();
            events.add(event);
        }

        public void persist() throws EventStoreException {
            if (events.isEmpty()) {
                return;
            }
            try (Connection connection = dataSource.getConnection()) {
                connection.setAutoCommit(false);
                try {
                    checkSourceVersion(connection);
                    updateVersion(connection);
                    long firstOffset = reserveOffsets(connection);
                    storeEvents(connection, firstOffset);
                    connection.commit();
                } catch (SQLException | EventStoreException | RuntimeException e) {
                    connection.rollback();
                    throw e;
                }
            } catch (SQLException ex) {
                throw EventStoreException.storeFailed(entityId, ex);
            }
        }

        private void checkSourceVersion(Connection connection) throws SQLException, EventStoreException {
            try (PreparedStatement selectVersion = schema.selectEntityVersion(connection, entityId);
                    ResultSet rs = selectVersion.executeQuery()) {
                if (!rs.next()) {
                    if (startVersion != 0) {
                        throw EventStoreException.versionConflict(entityId, 0, startVersion);
                    }
                    // no entity version - create a new one.
                    try (PreparedStatement createVersion = schema.createEntityVersion(connection, entityId,
                        startVersion)) {
                        createVersion.executeUpdate();
                    }
                } else {
                    long version = schema.readEntityVersion(rs);
                    if (version != startVersion) {
                        throw EventStoreException.versionConflict(entityId, version, startVersion);
                    }
                }
            }
        }

        private void updateVersion(Connection connection) throws SQLException, EventStoreException {
            try (PreparedStatement updateVersion = schema.updateEntityVersion(connection, entityId, startVersion,
                endVersion)) {
                if (updateVersion.executeUpdate() != 1) {
                    throw EventStoreException.versionConflict(entityId, startVersion);
                }
            }
        }

        private long reserveOffsets(Connection connection) throws SQLException {
            try (PreparedStatement advance = schema.advanceSequence(connection, events.size())) {
                if (advance.executeUpdate() != 1) {
                    throw new SQLException("Global sequence is not initialized");
                }
            }
            try (PreparedStatement select = schema.selectLastOffset(connection); ResultSet rs = select.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Global sequence is not initialized");
                }
                return schema.readLastOffset(rs) - events.size() + 1;
            }
        }

        private void storeEvents(Connection connection, long firstOffset) throws SQLException, EventStoreException {
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                long offset = firstOffset;
                for (Event event : events) {
                    prepareInsert(insertEvent, event, offset++);
                    insertEvent.addBatch();
                }
                insertEvent.executeBatch();
            }
        }
    }
}
