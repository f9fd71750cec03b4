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

import java.util.Objects;

/**
 * Outcome of a document command as presented to users. Messages never carry internal details.
 */
public final class DocumentResponse {
    public static final String DOCUMENT_RECEIVED = "Document received!";
    public static final String VERSION_RESTORED = "Version restored!";
    public static final String DOCUMENT_NOT_FOUND = "Error: Document not found";
    public static final String VERSION_NOT_FOUND = "Error: Version not found";
    public static final String UNAVAILABLE_MESSAGE = "Error: Service temporarily unavailable, please retry";

    public enum Status {
        /**
         * Command was processed and its result is visible in the read model.
         */
        ACCEPTED,
        /**
         * Input does not meet the constraints, retrying with same input will not help.
         */
        INVALID,
        /**
         * Command was rejected by the document.
         */
        REJECTED,
        /**
         * Infrastructure failure or timeout, command may be retried.
         */
        UNAVAILABLE
    }

    private final Status status;
    private final String message;
    private final String documentId;

    private DocumentResponse(Status status, String message, String documentId) {
        this.status = status;
        this.message = message;
        this.documentId = documentId;
    }

    static DocumentResponse accepted(String message, String documentId) {
        return new DocumentResponse(Status.ACCEPTED, message, documentId);
    }

    static DocumentResponse invalid(String reason) {
        return new DocumentResponse(Status.INVALID, "Error: " + reason, null);
    }

    static DocumentResponse rejected(String documentId) {
        return new DocumentResponse(Status.REJECTED, DOCUMENT_NOT_FOUND, documentId);
    }

    static DocumentResponse unavailable(String documentId) {
        return new DocumentResponse(Status.UNAVAILABLE, UNAVAILABLE_MESSAGE, documentId);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Identity of the document the command addressed.
     * @return the identity, null when input was invalid
     */
    public String getDocumentId() {
        return documentId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DocumentResponse that = (DocumentResponse) o;
        return status == that.status && message.equals(that.message) && Objects.equals(documentId, that.documentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, message, documentId);
    }

    @Override
    public String toString() {
        return status + ": " + message;
    }
}
