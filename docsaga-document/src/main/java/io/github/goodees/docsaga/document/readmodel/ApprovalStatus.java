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

/**
 * Approval status of the current version of a document, as stored in column {@code ApprovalStatus}.
 */
public enum ApprovalStatus {
    PENDING("Pending"), APPROVED("Approved"), REJECTED("Rejected");

    private final String columnValue;

    ApprovalStatus(String columnValue) {
        this.columnValue = columnValue;
    }

    public String getColumnValue() {
        return columnValue;
    }

    public static ApprovalStatus fromColumn(String value) {
        for (ApprovalStatus status : values()) {
            if (status.columnValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown approval status " + value);
    }
}
