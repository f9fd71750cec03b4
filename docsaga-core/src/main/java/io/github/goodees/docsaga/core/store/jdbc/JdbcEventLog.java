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
import io.github.goodees.docsaga.core.store.EventLog;
import io.github.goodees.docsaga.core.store.EventStoreException;
import io.github.goodees.docsaga.core.store.GlobalEventLog;
import io.github.goodees.docsaga.core.store.Serialization;
import io.github.goodees.docsaga.core.store.StreamedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Event log backed by schema and serialization.
 */
public class JdbcEventLog<E extends Event> implements EventLog, GlobalEventLog {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventLog.class);

    private final DataSource ds;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;
    private final boolean strict;

    /**
     * Create instance that will read from provided datasource, delegating queries to JdbcSchema, deserializing events
     * by serialization, while being or not being strict.
     *
     * <p>When event log is in strict mode, it will throw an exception when an event being read cannot be deserialized.
     * This can happen when payload serialization was broken, or when the event was written by a newer version of the
     * system that the running code does not know yet. When {@code strict} is false, such event is skipped.
     *
     * @param ds the datasource
     * @param schema statements for the journal tables
     * @param serialization deserialization of payloads
     * @param strict whether unreadable events fail the read
     */
    public JdbcEventLog(DataSource ds, JdbcSchema schema, Serialization<E> serialization, boolean strict) {
        this.ds = ds;
        this.schema = schema;
        this.serialization = serialization;
        this.strict = strict;
    }

    @Override
    public Replay<E> readEvents(String entityId, long afterVersion) {
        try {
            return new JdbcReplay(entityId, afterVersion);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public long lastVersion(String entityId) throws EventStoreException {
        try (Connection connection = ds.getConnection();
                PreparedStatement entityVersion = schema.selectEntityVersion(connection, entityId);
                ResultSet rs = entityVersion.executeQuery()) {
            return rs.next() ? schema.readEntityVersion(rs) : 0;
        } catch (SQLException e) {
            throw EventStoreException.readFailed("version of entity " + entityId, e);
        }
    }

    @Override
    public List<StreamedEvent> readAll(long afterOffset, int limit) throws EventStoreException {
        List<StreamedEvent> result = new ArrayList<>();
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectAllEvents(connection, afterOffset, limit);
                ResultSet rs = st.executeQuery()) {
            while (rs.next() && result.size() < limit) {
                long offset = schema.readEventOffset(rs);
                E event = deserialize(rs);
                if (event != null) {
                    result.add(new StreamedEvent(offset, event));
                } else if (isStrict()) {
                    throw EventStoreException.readFailed("event at offset " + offset,
                        new IllegalArgumentException("Could not deserialize event"));
                } else {
                    logger.error("Could not deserialize event at offset {}", offset);
                }
            }
        } catch (SQLException e) {
            throw EventStoreException.readFailed("events after offset " + afterOffset, e);
        }
        return result;
    }

    @Override
    public long lastOffset() throws EventStoreException {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectLastOffset(connection);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? schema.readLastOffset(rs) : 0;
        } catch (SQLException e) {
            throw EventStoreException.readFailed("last offset", e);
        }
    }

    private E deserialize(ResultSet rs) throws SQLException {
        return serialization.deserialize(schema.readEventPayloadVersion(rs), schema.readEventPayload(rs),
            schema.readEventType(rs));
    }

    /**
     * Indicate whether failure to deserialize event causes exception to be thrown.
     * @return true when unreadable events fail the read
     */
    public boolean isStrict() {
        return strict;
    }

    class JdbcReplay implements EventLog.Replay<E> {
        private final String entityId;
        private Connection connection;
        private PreparedStatement statement;
        private ResultSet resultSet;
        private boolean iterating;
        private boolean stop;

        JdbcReplay(String entityId, long afterVersion) throws SQLException {
            this.entityId = entityId;
            try {
                connection = ds.getConnection();
                statement = schema.selectEvents(connection, entityId, afterVersion);
                resultSet = statement.executeQuery();
            } catch (SQLException e) {
                close();
                throw e;
            }
        }

        private E next() throws SQLException {
            while (!stop && resultSet.next()) {
                E event = deserialize(resultSet);
                if (event != null) {
                    return event;
                }
                long version = schema.readEventVersion(resultSet);
                if (isStrict()) {
                    throw new IllegalArgumentException(entityId + " Could not deserialize event " + version);
                } else {
                    logger.error("{} Could not deserialize event {}", entityId, version);
                }
            }
            return null;
        }

        private void startIteration() {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
        }

        @Override
        public void foreach(Consumer<? super E> consumer) {
            startIteration();
            try {
                for (E event = next(); event != null; event = next()) {
                    consumer.accept(event);
                }
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot access datastore", e);
            }
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer) {
            startIteration();
            try {
                R result = initial;
                for (E event = next(); event != null; event = next()) {
                    result = reducer.apply(result, event);
                }
                return result;
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot access datastore", e);
            }
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
            cleanup(resultSet);
            cleanup(statement);
            cleanup(connection);
        }

        protected void cleanup(AutoCloseable resource) {
            if (resource != null) {
                try {
                    resource.close();
                } catch (Exception e) {
                    logger.warn("Suppressing cleanup exception", e);
                }
            }
        }
    }

}
