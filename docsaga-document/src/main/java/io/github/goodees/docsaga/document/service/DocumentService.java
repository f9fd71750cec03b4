package io.github.goodees.docsaga.document.service;

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

import io.github.goodees.docsaga.core.aggregate.AggregateRuntime;
import io.github.goodees.docsaga.core.aggregate.CommandResult;
import io.github.goodees.docsaga.core.correlation.CorrelationRegistry;
import io.github.goodees.docsaga.document.event.DocumentEvent;
import io.github.goodees.docsaga.document.model.Document;
import io.github.goodees.docsaga.document.model.DocumentCommand;
import io.github.goodees.docsaga.document.model.DocumentState;
import io.github.goodees.docsaga.document.model.InvalidDocumentException;
import io.github.goodees.docsaga.document.readmodel.DocumentQueries;
import io.github.goodees.docsaga.document.readmodel.DocumentVersionView;
import io.github.goodees.docsaga.document.readmodel.DocumentView;
import io.github.goodees.docsaga.document.readmodel.ReadModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Entry point for clients of the document system, such as an HTTP layer.
 *
 * <p>Commands are acknowledged only after their event was projected into the read model. The service subscribes for
 * the correlation id of a command before submitting it, and waits until the projection reports the event.</p>
 */
public class DocumentService {
    private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

    private final AggregateRuntime<DocumentState, DocumentCommand, DocumentEvent> documents;
    private final CorrelationRegistry correlations;
    private final DocumentQueries queries;
    private final Supplier<String> correlationIds;

    public DocumentService(AggregateRuntime<DocumentState, DocumentCommand, DocumentEvent> documents,
            CorrelationRegistry correlations, DocumentQueries queries) {
        this(documents, correlations, queries, () -> UUID.randomUUID().toString());
    }

    public DocumentService(AggregateRuntime<DocumentState, DocumentCommand, DocumentEvent> documents,
            CorrelationRegistry correlations, DocumentQueries queries, Supplier<String> correlationIds) {
        this.documents = Objects.requireNonNull(documents);
        this.correlations = Objects.requireNonNull(correlations);
        this.queries = Objects.requireNonNull(queries);
        this.correlationIds = Objects.requireNonNull(correlationIds);
    }

    /**
     * Create new document, or update existing one.
     * @param id identity of existing document, null or empty for new document
     * @param title the title
     * @param content the content
     * @return outcome of the command
     */
    public DocumentResponse createOrUpdate(String id, String title, String content) {
        UUID documentId;
        if (id == null || id.trim().isEmpty()) {
            documentId = UUID.randomUUID();
        } else {
            Optional<UUID> parsed = parseId(id);
            if (!parsed.isPresent()) {
                return DocumentResponse.invalid("Invalid document id");
            }
            documentId = parsed.get();
        }
        try {
            return submit(Document.create(documentId, title, content), DocumentResponse.DOCUMENT_RECEIVED);
        } catch (InvalidDocumentException e) {
            logger.debug("Document {} is not valid: {}", documentId, e.getMessage());
            return DocumentResponse.invalid(e.getMessage());
        }
    }

    /**
     * Make historical version of a document its current version. History is not rewritten, the restored content
     * becomes the newest version.
     * @param id identity of the document
     * @param version version to restore
     * @return outcome of the command
     */
    public DocumentResponse restoreVersion(String id, long version) {
        Optional<UUID> documentId = parseId(id);
        if (!documentId.isPresent()) {
            return DocumentResponse.invalid("Invalid document id");
        }
        try {
            Optional<DocumentVersionView> historical = queries.findVersion(documentId.get().toString(), version);
            if (!historical.isPresent()) {
                return DocumentResponse.invalid("Version not found");
            }
            DocumentVersionView restored = historical.get();
            Document document = Document.create(documentId.get(), restored.getTitle(), restored.getBody());
            return submit(document, DocumentResponse.VERSION_RESTORED);
        } catch (ReadModelException e) {
            logger.error("Cannot read version {} of document {}", version, id, e);
            return DocumentResponse.unavailable(id);
        } catch (InvalidDocumentException e) {
            return DocumentResponse.invalid(e.getMessage());
        }
    }

    public List<DocumentView> getDocuments() throws ReadModelException {
        return queries.getDocuments();
    }

    public List<DocumentVersionView> getHistory(String id) throws ReadModelException {
        return queries.getHistory(id);
    }

    private DocumentResponse submit(Document document, String acceptedMessage) {
        String aggregateId = document.getId().toString();
        String correlationId = correlationIds.get();
        try (CorrelationRegistry.Awaiter awaiter = correlations.subscribe(
            CorrelationRegistry.correlatedWith(correlationId), 1)) {
            CommandResult<DocumentEvent> result = documents
                    .submit(aggregateId, correlationId, new DocumentCommand.CreateOrUpdate(document)).get();
            if (!result.isPersisted()) {
                logger.info("Command {} for document {} was not accepted: {}", correlationId, aggregateId, result);
                return DocumentResponse.rejected(aggregateId);
            }
            awaiter.await();
            return DocumentResponse.accepted(acceptedMessage, aggregateId);
        } catch (ExecutionException e) {
            logger.warn("Command {} for document {} failed", correlationId, aggregateId, e.getCause());
            return DocumentResponse.unavailable(aggregateId);
        } catch (TimeoutException e) {
            logger.warn("Event of command {} for document {} was not projected in time", correlationId, aggregateId);
            return DocumentResponse.unavailable(aggregateId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DocumentResponse.unavailable(aggregateId);
        }
    }

    private static Optional<UUID> parseId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(id.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
