package io.github.goodees.docsaga.document.model;

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
import java.util.Optional;

/**
 * State of one document aggregate, folded from its events.
 */
public final class DocumentState {
    public static final DocumentState INITIAL = new DocumentState(null, 0, null, null);

    private final Document document;
    private final long version;
    private final String approvalCode;
    private final Boolean approved;

    private DocumentState(Document document, long version, String approvalCode, Boolean approved) {
        this.document = document;
        this.version = version;
        this.approvalCode = approvalCode;
        this.approved = approved;
    }

    public Optional<Document> getDocument() {
        return Optional.ofNullable(document);
    }

    /**
     * Number of events folded into this state.
     * @return the version
     */
    public long getVersion() {
        return version;
    }

    public Optional<String> getApprovalCode() {
        return Optional.ofNullable(approvalCode);
    }

    /**
     * Outcome of approval.
     * @return empty while undecided, true when approved, false when rejected
     */
    public Optional<Boolean> getApproved() {
        return Optional.ofNullable(approved);
    }

    public DocumentState withDocument(Document newDocument) {
        return new DocumentState(Objects.requireNonNull(newDocument), version + 1, approvalCode, approved);
    }

    public DocumentState withApprovalCode(String code) {
        return new DocumentState(document, version + 1, Objects.requireNonNull(code), approved);
    }

    public DocumentState withApproval(boolean outcome) {
        return new DocumentState(document, version + 1, approvalCode, outcome);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DocumentState that = (DocumentState) o;
        return version == that.version && Objects.equals(document, that.document)
                && Objects.equals(approvalCode, that.approvalCode) && Objects.equals(approved, that.approved);
    }

    @Override
    public int hashCode() {
        return Objects.hash(document, version, approvalCode, approved);
    }

    @Override
    public String toString() {
        return "DocumentState{" + "document=" + document + ", version=" + version + ", approvalCode=" + approvalCode
                + ", approved=" + approved + '}';
    }
}
