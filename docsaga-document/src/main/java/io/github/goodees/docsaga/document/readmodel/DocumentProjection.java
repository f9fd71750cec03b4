package io.github.goodees.docsaga.document.readmodel;

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
import io.github.goodees.docsaga.core.store.StreamedEvent;
import io.github.goodees.docsaga.core.stream.EventConsumer;
import io.github.goodees.docsaga.document.event.ApprovedEvent;
import io.github.goodees.docsaga.document.event.CreatedOrUpdatedEvent;
import io.github.goodees.docsaga.document.event.RejectedEvent;
import io.github.goodees.docsaga.document.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Projects document events of the global stream into the read model.
 *
 * <p>Every event is handled in one transaction, which also stores the offset of the event. Events at or below the
 * stored offset were projected already and are skipped, so redelivery after a failure is harmless. Projected events
 * are passed to the listener after the transaction commits, so that whoever waits for them can read their
 * effect.</p>
 */
public class DocumentProjection implements EventConsumer {
    private static final Logger logger = LoggerFactory.getLogger(DocumentProjection.class);

    private final DataSource dataSource;
    private final Consumer<Event> projectedListener;

    public DocumentProjection(DataSource dataSource, Consumer<Event> projectedListener) {
        this.dataSource = Objects.requireNonNull(dataSource);
        this.projectedListener = Objects.requireNonNull(projectedListener);
    }

    @Override
    public void accept(StreamedEvent streamed) throws Exception {
        long offset = streamed.getOffset();
        Event event = streamed.getEvent();
        logger.debug("Event: {} Offset: {}", event, offset);
        boolean projected;
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try {
                long storedOffset = lockOffset(connection);
                if (offset <= storedOffset) {
                    logger.debug("Offset {} already projected, stored offset is {}", offset, storedOffset);
                    connection.rollback();
                    return;
                }
                projected = project(connection, event);
                updateOffset(connection, offset);
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            logger.error("Projection failed for event at offset {}: {}", offset, event.getType(), e);
            throw e;
        }
        if (projected) {
            projectedListener.accept(event);
        }
    }

    private boolean project(Connection connection, Event event) throws SQLException {
        Timestamp eventTime = Timestamp.from(event.getTimestamp());
        if (event instanceof CreatedOrUpdatedEvent) {
            storeDocument(connection, ((CreatedOrUpdatedEvent) event).getDocument(), eventTime);
            return true;
        } else if (event instanceof ApprovedEvent) {
            updateStatus(connection, event.entityId(), ApprovalStatus.APPROVED, eventTime);
            return true;
        } else if (event instanceof RejectedEvent) {
            updateStatus(connection, event.entityId(), ApprovalStatus.REJECTED, eventTime);
            return true;
        }
        return false;
    }

    private void storeDocument(Connection connection, Document document, Timestamp eventTime) throws SQLException {
        String id = document.getId().toString();
        long version = maxVersion(connection, id) + 1;
        if (documentExists(connection, id)) {
            try (PreparedStatement st = connection.prepareStatement("UPDATE Documents SET Title = ?, Body = ?, "
                    + "Version = ?, UpdatedAt = ?, ApprovalStatus = ? WHERE Id = ?")) {
                st.setString(1, document.getTitle());
                st.setString(2, document.getContent());
                st.setLong(3, version);
                st.setTimestamp(4, eventTime);
                st.setString(5, ApprovalStatus.PENDING.getColumnValue());
                st.setString(6, id);
                st.executeUpdate();
            }
        } else {
            try (PreparedStatement st = connection.prepareStatement("INSERT INTO Documents (Id, Title, Body, Version, "
                    + "CreatedAt, UpdatedAt, ApprovalStatus) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                st.setString(1, id);
                st.setString(2, document.getTitle());
                st.setString(3, document.getContent());
                st.setLong(4, version);
                st.setTimestamp(5, eventTime);
                st.setTimestamp(6, eventTime);
                st.setString(7, ApprovalStatus.PENDING.getColumnValue());
                st.executeUpdate();
            }
        }
        try (PreparedStatement st = connection.prepareStatement(
            "INSERT INTO DocumentVersions (Id, Version, Title, Body, CreatedAt) VALUES (?, ?, ?, ?, ?)")) {
            st.setString(1, id);
            st.setLong(2, version);
            st.setString(3, document.getTitle());
            st.setString(4, document.getContent());
            st.setTimestamp(5, eventTime);
            st.executeUpdate();
        }
        logger.info("Projected version {} of document {}", version, id);
    }

    private long maxVersion(Connection connection, String id) throws SQLException {
        try (PreparedStatement st = connection
                .prepareStatement("SELECT MAX(Version) FROM DocumentVersions WHERE Id = ?")) {
            st.setString(1, id);
            try (ResultSet rs = st.executeQuery()) {
                // MAX of no rows is null, read as 0
                return rs.next() ? rs.getLong(1) : 0;
            }
        }
    }

    private boolean documentExists(Connection connection, String id) throws SQLException {
        try (PreparedStatement st = connection.prepareStatement("SELECT Id FROM Documents WHERE Id = ?")) {
            st.setString(1, id);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void updateStatus(Connection connection, String id, ApprovalStatus status, Timestamp eventTime)
            throws SQLException {
        try (PreparedStatement st = connection
                .prepareStatement("UPDATE Documents SET ApprovalStatus = ?, UpdatedAt = ? WHERE Id = ?")) {
            st.setString(1, status.getColumnValue());
            st.setTimestamp(2, eventTime);
            st.setString(3, id);
            if (st.executeUpdate() == 0) {
                logger.warn("Document {} is not in read model, status {} not stored", id, status);
            }
        }
    }

    private long lockOffset(Connection connection) throws SQLException {
        try (PreparedStatement st = connection
                .prepareStatement("SELECT OffsetCount FROM Offsets WHERE OffsetName = ? FOR UPDATE")) {
            st.setString(1, ReadModelSchema.PROJECTION_NAME);
            try (ResultSet rs = st.executeQuery()) {
                if (rs.next()) {
                    return rs.getLong(1);
                }
                throw new IllegalStateException("Offset " + ReadModelSchema.PROJECTION_NAME + " is not initialized");
            }
        }
    }

    private void updateOffset(Connection connection, long offset) throws SQLException {
        try (PreparedStatement st = connection
                .prepareStatement("UPDATE Offsets SET OffsetCount = ? WHERE OffsetName = ?")) {
            st.setLong(1, offset);
            st.setString(2, ReadModelSchema.PROJECTION_NAME);
            st.executeUpdate();
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
