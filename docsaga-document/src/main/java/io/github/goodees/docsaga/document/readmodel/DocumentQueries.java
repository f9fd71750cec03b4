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

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read only queries of the document read model.
 */
public class DocumentQueries {
    private static final String DOCUMENT_COLUMNS = "Id, Title, Body, Version, CreatedAt, UpdatedAt, ApprovalStatus";
    private static final String VERSION_COLUMNS = "Id, Version, Title, Body, CreatedAt";

    private final DataSource dataSource;

    public DocumentQueries(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource);
    }

    /**
     * All documents, most recently updated first.
     * @return list of documents
     * @throws ReadModelException when the read model is not accessible
     */
    public List<DocumentView> getDocuments() throws ReadModelException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = connection
                        .prepareStatement("SELECT " + DOCUMENT_COLUMNS + " FROM Documents ORDER BY UpdatedAt DESC");
                ResultSet rs = st.executeQuery()) {
            List<DocumentView> result = new ArrayList<>();
            while (rs.next()) {
                result.add(readDocument(rs));
            }
            return result;
        } catch (SQLException e) {
            throw new ReadModelException("Cannot read documents", e);
        }
    }

    public Optional<DocumentView> findDocument(String id) throws ReadModelException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = connection
                        .prepareStatement("SELECT " + DOCUMENT_COLUMNS + " FROM Documents WHERE Id = ?")) {
            st.setString(1, id);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? Optional.of(readDocument(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new ReadModelException("Cannot read document " + id, e);
        }
    }

    /**
     * Versions of a document, newest first.
     * @param id identity of the document
     * @return the versions, empty for unknown document
     * @throws ReadModelException when the read model is not accessible
     */
    public List<DocumentVersionView> getHistory(String id) throws ReadModelException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = connection.prepareStatement(
                    "SELECT " + VERSION_COLUMNS + " FROM DocumentVersions WHERE Id = ? ORDER BY Version DESC")) {
            st.setString(1, id);
            List<DocumentVersionView> result = new ArrayList<>();
            try (ResultSet rs = st.executeQuery()) {
                while (rs.next()) {
                    result.add(readVersion(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new ReadModelException("Cannot read history of document " + id, e);
        }
    }

    public Optional<DocumentVersionView> findVersion(String id, long version) throws ReadModelException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = connection.prepareStatement(
                    "SELECT " + VERSION_COLUMNS + " FROM DocumentVersions WHERE Id = ? AND Version = ?")) {
            st.setString(1, id);
            st.setLong(2, version);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? Optional.of(readVersion(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new ReadModelException("Cannot read version " + version + " of document " + id, e);
        }
    }

    /**
     * Offset of the last event the projection handled, the projection resumes after it.
     * @return the offset, 0 when nothing was projected yet
     * @throws ReadModelException when the read model is not accessible
     */
    public long lastOffset() throws ReadModelException {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement st = connection
                        .prepareStatement("SELECT OffsetCount FROM Offsets WHERE OffsetName = ?")) {
            st.setString(1, ReadModelSchema.PROJECTION_NAME);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new ReadModelException("Cannot read projection offset", e);
        }
    }

    private static DocumentView readDocument(ResultSet rs) throws SQLException {
        return new DocumentView(rs.getString(1), rs.getString(2), rs.getString(3), rs.getLong(4),
                rs.getTimestamp(5).toInstant(), rs.getTimestamp(6).toInstant(),
                ApprovalStatus.fromColumn(rs.getString(7)));
    }

    private static DocumentVersionView readVersion(ResultSet rs) throws SQLException {
        return new DocumentVersionView(rs.getString(1), rs.getLong(2), rs.getString(3), rs.getString(4),
                rs.getTimestamp(5).toInstant());
    }
}
