package io.github.goodees.docsaga.document.approval;

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
 * Data the approval saga carries across its phases.
 */
public final class ApprovalSagaData {
    private final String documentId;
    private final String approvalCode;

    public ApprovalSagaData(String documentId, String approvalCode) {
        this.documentId = Objects.requireNonNull(documentId);
        this.approvalCode = approvalCode;
    }

    public String getDocumentId() {
        return documentId;
    }

    public Optional<String> getApprovalCode() {
        return Optional.ofNullable(approvalCode);
    }

    public ApprovalSagaData withApprovalCode(String code) {
        return new ApprovalSagaData(documentId, code);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ApprovalSagaData that = (ApprovalSagaData) o;
        return documentId.equals(that.documentId) && Objects.equals(approvalCode, that.approvalCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, approvalCode);
    }

    @Override
    public String toString() {
        return "ApprovalSagaData{" + "documentId=" + documentId + ", approvalCode=" + approvalCode + '}';
    }
}
