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

import org.junit.Test;

import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class DocumentTest {
    private static final UUID ID = UUID.fromString("0b1c4f42-3a57-4f6e-9a43-6b3b0f4c2f10");

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    private static void assertInvalid(String expectedMessage, UUID id, String title, String content) {
        try {
            Document.create(id, title, content);
            fail("Document should be refused: " + expectedMessage);
        } catch (InvalidDocumentException e) {
            assertEquals(expectedMessage, e.getMessage());
        }
    }

    @Test
    public void valid_document_keeps_its_values() throws InvalidDocumentException {
        Document document = Document.create(ID, "Title", "Content");
        assertEquals(ID, document.getId());
        assertEquals("Title", document.getTitle());
        assertEquals("Content", document.getContent());
        assertEquals(document, Document.create(ID, "Title", "Content"));
    }

    @Test
    public void limits_are_inclusive() throws InvalidDocumentException {
        Document document = Document.create(ID, repeat('t', Document.MAX_TITLE_LENGTH),
            repeat('c', Document.MAX_CONTENT_LENGTH));
        assertEquals(Document.MAX_TITLE_LENGTH, document.getTitle().length());
    }

    @Test
    public void blank_or_long_title_is_refused() {
        assertInvalid("Invalid title", ID, null, "Content");
        assertInvalid("Invalid title", ID, "  ", "Content");
        assertInvalid("Invalid title", ID, repeat('t', Document.MAX_TITLE_LENGTH + 1), "Content");
    }

    @Test
    public void blank_or_long_content_is_refused() {
        assertInvalid("Invalid content", ID, "Title", "");
        assertInvalid("Invalid content", ID, "Title", repeat('c', Document.MAX_CONTENT_LENGTH + 1));
    }

    @Test
    public void missing_id_is_refused() {
        assertInvalid("Invalid document id", null, "Title", "Content");
    }
}
