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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * A titled text document. Instances are only created through {@link #create(UUID, String, String)}, which validates
 * the title and the content; the JSON constructor trusts already persisted values.
 */
public final class Document {
    public static final int MAX_TITLE_LENGTH = 255;
    public static final int MAX_CONTENT_LENGTH = 4000;

    private final UUID id;
    private final String title;
    private final String content;

    @JsonCreator
    Document(@JsonProperty("id") UUID id, @JsonProperty("title") String title,
            @JsonProperty("content") String content) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = Objects.requireNonNull(title, "title");
        this.content = Objects.requireNonNull(content, "content");
    }

    /**
     * Create validated document.
     * @param id identity of the document
     * @param title non-blank title of at most {@value #MAX_TITLE_LENGTH} characters
     * @param content non-blank content of at most {@value #MAX_CONTENT_LENGTH} characters
     * @return the document
     * @throws InvalidDocumentException when title or content do not meet the constraints
     */
    public static Document create(UUID id, String title, String content) throws InvalidDocumentException {
        if (id == null) {
            throw new InvalidDocumentException("Invalid document id");
        }
        if (!isValid(title, MAX_TITLE_LENGTH)) {
            throw new InvalidDocumentException("Invalid title");
        }
        if (!isValid(content, MAX_CONTENT_LENGTH)) {
            throw new InvalidDocumentException("Invalid content");
        }
        return new Document(id, title, content);
    }

    private static boolean isValid(String value, int maxLength) {
        return value != null && !value.trim().isEmpty() && value.length() <= maxLength;
    }

    public UUID getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Document document = (Document) o;
        return id.equals(document.id) && title.equals(document.title) && content.equals(document.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, content);
    }

    @Override
    public String toString() {
        return "Document{" + "id=" + id + ", title=" + title + '}';
    }
}
