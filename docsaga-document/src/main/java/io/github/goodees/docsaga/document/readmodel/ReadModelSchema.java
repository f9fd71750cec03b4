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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Tables of the document read model. Creation is idempotent, existing tables and the stored projection offset are
 * kept.
 */
public final class ReadModelSchema {
    private static final Logger logger = LoggerFactory.getLogger(ReadModelSchema.class);

    public static final String PROJECTION_NAME = "DocumentProjection";

    private static final String[] TABLES = {
            "CREATE TABLE IF NOT EXISTS Documents (Id VARCHAR(36) PRIMARY KEY, Title VARCHAR(255) NOT NULL, "
                    + "Body VARCHAR(4000) NOT NULL, Version BIGINT NOT NULL, CreatedAt TIMESTAMP NOT NULL, "
                    + "UpdatedAt TIMESTAMP NOT NULL, ApprovalStatus VARCHAR(16) DEFAULT 'Pending' NOT NULL)",
            "CREATE TABLE IF NOT EXISTS DocumentVersions (Id VARCHAR(36) NOT NULL, Version BIGINT NOT NULL, "
                    + "Title VARCHAR(255) NOT NULL, Body VARCHAR(4000) NOT NULL, CreatedAt TIMESTAMP NOT NULL, "
                    + "PRIMARY KEY (Id, Version))",
            "CREATE TABLE IF NOT EXISTS Offsets (OffsetName VARCHAR(64) PRIMARY KEY, OffsetCount BIGINT NOT NULL)" };

    private ReadModelSchema() {
    }

    public static void createTables(DataSource dataSource) throws ReadModelException {
        try (Connection connection = dataSource.getConnection()) {
            try (Statement st = connection.createStatement()) {
                for (String ddl : TABLES) {
                    st.execute(ddl);
                }
            }
            if (!offsetExists(connection)) {
                try (PreparedStatement insert = connection
                        .prepareStatement("INSERT INTO Offsets (OffsetName, OffsetCount) VALUES (?, 0)")) {
                    insert.setString(1, PROJECTION_NAME);
                    insert.executeUpdate();
                }
                logger.info("Created read model offset {}", PROJECTION_NAME);
            }
        } catch (SQLException e) {
            throw new ReadModelException("Cannot create read model tables", e);
        }
    }

    /**
     * Delete all documents and versions and rewind the projection offset to the start of the log. Tables must exist.
     * @param dataSource the read model database
     * @throws ReadModelException when the statements fail
     */
    public static void clear(DataSource dataSource) throws ReadModelException {
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try (Statement st = connection.createStatement();
                    PreparedStatement rewind = connection
                            .prepareStatement("UPDATE Offsets SET OffsetCount = 0 WHERE OffsetName = ?")) {
                st.executeUpdate("DELETE FROM DocumentVersions");
                st.executeUpdate("DELETE FROM Documents");
                rewind.setString(1, PROJECTION_NAME);
                rewind.executeUpdate();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
            logger.info("Cleared read model {}", PROJECTION_NAME);
        } catch (SQLException e) {
            throw new ReadModelException("Cannot clear read model tables", e);
        }
    }

    private static boolean offsetExists(Connection connection) throws SQLException {
        try (PreparedStatement st = connection.prepareStatement("SELECT 1 FROM Offsets WHERE OffsetName = ?")) {
            st.setString(1, PROJECTION_NAME);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next();
            }
        }
    }
}
