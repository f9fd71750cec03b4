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

import java.time.Instant;

/**
 * Current state of a document as shown to users.
 */
public final class DocumentView {
    private final String id;
    private final String title;
    private final String body;
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final ApprovalStatus approvalStatus;

    public DocumentView(String id, String title, String body, long version, Instant createdAt, Instant updatedAt,
            ApprovalStatus approvalStatus) {
        this.id = id;
        this.title = title;
        this.body = body;
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.approvalStatus = approvalStatus;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    /**
     * Number of the content version, counting only creations and updates.
     * @return version of the content
     */
    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public ApprovalStatus getApprovalStatus() {
        return approvalStatus;
    }

    @Override
    public String toString() {
        return "DocumentView{" + "id=" + id + ", title=" + title + ", version=" + version + ", approvalStatus="
                + approvalStatus + '}';
    }
}
