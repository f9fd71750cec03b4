package io.github.goodees.docsaga.document;

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

import io.github.goodees.docsaga.core.Event;
import io.github.goodees.docsaga.core.EventHeader;
import io.github.goodees.docsaga.core.aggregate.Decision;
import io.github.goodees.docsaga.document.event.ApprovalCodeSetEvent;
import io.github.goodees.docsaga.document.event.ApprovedEvent;
import io.github.goodees.docsaga.document.event.CreatedOrUpdatedEvent;
import io.github.goodees.docsaga.document.event.DocumentEvent;
import io.github.goodees.docsaga.document.event.ErrorEvent;
import io.github.goodees.docsaga.document.event.RejectedEvent;
import io.github.goodees.docsaga.document.model.Document;
import io.github.goodees.docsaga.document.model.DocumentCommand;
import io.github.goodees.docsaga.document.model.DocumentError;
import io.github.goodees.docsaga.document.model.DocumentState;
import io.github.goodees.docsaga.document.model.InvalidDocumentException;
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class DocumentAggregateTest {
    private static final UUID ID = UUID.fromString("5d7f1f3e-8d2a-4c1b-b1a7-9f0f4f7d9a11");
    private static final UUID OTHER_ID = UUID.fromString("a9b3c2d1-0e4f-4a5b-8c6d-7e8f9a0b1c2d");

    private final DocumentAggregate aggregate = new DocumentAggregate();

    private static Event header(long version) {
        return new EventHeader(ID.toString(), version, Instant.now(), "cid");
    }

    private static Document document(UUID id, String title) throws InvalidDocumentException {
        return Document.create(id, title, "Content of " + title);
    }

    private DocumentEvent single(Decision<DocumentEvent> decision, long version) {
        assertEquals(Decision.Kind.PERSIST, decision.getKind());
        assertEquals(1, decision.getEvents().size());
        return decision.getEvents().get(0).from(header(version));
    }

    @Test
    public void first_document_is_accepted() throws InvalidDocumentException {
        Document document = document(ID, "First");
        DocumentEvent event = single(aggregate.decide(new DocumentCommand.CreateOrUpdate(document),
            aggregate.initialState()), 1);

        assertThat(event, instanceOf(CreatedOrUpdatedEvent.class));
        assertEquals(document, ((CreatedOrUpdatedEvent) event).getDocument());
        assertEquals(1, event.entityStateVersion());
        assertEquals("cid", event.correlationId());
    }

    @Test
    public void update_of_same_document_is_accepted() throws InvalidDocumentException {
        DocumentState state = DocumentState.INITIAL.withDocument(document(ID, "First"));
        Decision<DocumentEvent> decision = aggregate.decide(
            new DocumentCommand.CreateOrUpdate(document(ID, "Second")), state);
        assertEquals(Decision.Kind.PERSIST, decision.getKind());
    }

    @Test
    public void different_document_is_rejected_as_not_found() throws InvalidDocumentException {
        DocumentState state = DocumentState.INITIAL.withDocument(document(ID, "First"));
        Decision<DocumentEvent> decision = aggregate.decide(
            new DocumentCommand.CreateOrUpdate(document(OTHER_ID, "Intruder")), state);

        assertEquals(Decision.Kind.REJECT, decision.getKind());
        DocumentEvent rejection = decision.getRejection().from(header(1));
        assertThat(rejection, instanceOf(ErrorEvent.class));
        assertEquals(DocumentError.DOCUMENT_NOT_FOUND, ((ErrorEvent) rejection).getError());
        assertEquals("Error event does not change state", state, aggregate.apply(rejection, state));
    }

    @Test
    public void workflow_commands_are_always_persisted() {
        DocumentState state = aggregate.initialState();
        DocumentEvent code = single(aggregate.decide(new DocumentCommand.SetApprovalCode("123456"), state), 1);
        assertEquals("123456", ((ApprovalCodeSetEvent) code).getCode());
        assertThat(single(aggregate.decide(new DocumentCommand.Approve(), state), 1),
            instanceOf(ApprovedEvent.class));
        assertThat(single(aggregate.decide(new DocumentCommand.Reject(), state), 1),
            instanceOf(RejectedEvent.class));
    }

    @Test
    public void events_fold_into_state() throws InvalidDocumentException {
        Document first = document(ID, "First");
        Document second = document(ID, "Second");
        List<DocumentEvent> history = Arrays.asList(
            CreatedOrUpdatedEvent.builder(header(1)).document(first).build(),
            ApprovalCodeSetEvent.builder(header(2)).code("111111").build(),
            ApprovedEvent.builder(header(3)).build(),
            CreatedOrUpdatedEvent.builder(header(4)).document(second).build());

        DocumentState state = aggregate.initialState();
        for (DocumentEvent event : history) {
            state = aggregate.apply(event, state);
        }
        assertEquals(Optional.of(second), state.getDocument());
        assertEquals(Optional.of("111111"), state.getApprovalCode());
        assertEquals(Optional.of(true), state.getApproved());
        assertEquals(4, state.getVersion());

        DocumentState replayed = aggregate.initialState();
        for (DocumentEvent event : history) {
            replayed = aggregate.apply(event, replayed);
        }
        assertEquals("Folding is deterministic", state, replayed);
    }

    @Test
    public void rejection_is_folded_as_not_approved() {
        DocumentState state = aggregate.apply(RejectedEvent.builder(header(1)).build(), aggregate.initialState());
        assertEquals(Optional.of(false), state.getApproved());
        assertFalse(state.getDocument().isPresent());
        assertTrue(aggregate.initialState().getApproved().equals(Optional.empty()));
    }
}
