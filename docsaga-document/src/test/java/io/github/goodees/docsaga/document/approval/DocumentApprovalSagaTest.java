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

import io.github.goodees.docsaga.core.Event;
import io.github.goodees.docsaga.core.EventHeader;
import io.github.goodees.docsaga.core.AsyncResult;
import io.github.goodees.docsaga.core.saga.SagaCommand;
import io.github.goodees.docsaga.core.saga.SideEffects;
import io.github.goodees.docsaga.document.DocumentAggregate;
import io.github.goodees.docsaga.document.event.ApprovalCodeSetEvent;
import io.github.goodees.docsaga.document.event.ApprovedEvent;
import io.github.goodees.docsaga.document.event.CreatedOrUpdatedEvent;
import io.github.goodees.docsaga.document.event.RejectedEvent;
import io.github.goodees.docsaga.document.model.Document;
import io.github.goodees.docsaga.document.model.DocumentCommand;
import io.github.goodees.docsaga.document.model.InvalidDocumentException;
import org.junit.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class DocumentApprovalSagaTest {
    private static final UUID ID = UUID.fromString("1f2e3d4c-5b6a-4978-8a9b-0c1d2e3f4a5b");
    private static final String DOC = ID.toString();

    private final List<String> notifications = new CopyOnWriteArrayList<>();
    private final DocumentApprovalSaga saga = new DocumentApprovalSaga(() -> "424242",
        (documentId, code) -> notifications.add(documentId + ":" + code));
    private final ApprovalSagaData data = saga.initialData(DOC);

    private static Event header(long version) {
        return new EventHeader(DOC, version, Instant.now(), "cid");
    }

    private static CreatedOrUpdatedEvent created(long version) throws InvalidDocumentException {
        return CreatedOrUpdatedEvent.builder(header(version)).document(Document.create(ID, "T", "C")).build();
    }

    private static void perform(SideEffects<ApprovalState> effects) throws Exception {
        for (AsyncResult.VoidSideEffect action : effects.getActions()) {
            action.doSideEffect();
        }
    }

    @Test
    public void created_document_starts_generating_code() throws InvalidDocumentException {
        assertTrue(saga.isStartingEvent(created(1)));
        assertFalse(saga.isStartingEvent(ApprovedEvent.builder(header(1)).build()));
        assertEquals(Optional.of(ApprovalState.generatingCode()), saga.react(created(1), data, null));
    }

    @Test
    public void reactions_follow_the_workflow() throws InvalidDocumentException {
        ApprovalCodeSetEvent codeSet = ApprovalCodeSetEvent.builder(header(2)).code("424242").build();
        assertEquals(Optional.of(ApprovalState.sendingNotification("424242")),
            saga.react(codeSet, data, ApprovalState.generatingCode()));
        assertEquals(Optional.of(ApprovalState.approved()),
            saga.react(ApprovedEvent.builder(header(3)).build(), data, ApprovalState.waitingForApproval("424242")));
        assertEquals(Optional.of(ApprovalState.rejected()),
            saga.react(RejectedEvent.builder(header(3)).build(), data, ApprovalState.waitingForApproval("424242")));
    }

    @Test
    public void unexpected_events_are_not_handled() throws InvalidDocumentException {
        assertEquals(Optional.empty(), saga.react(created(4), data, ApprovalState.waitingForApproval("1")));
        ApprovalCodeSetEvent codeSet = ApprovalCodeSetEvent.builder(header(2)).code("1").build();
        assertEquals(Optional.empty(), saga.react(codeSet, data, ApprovalState.waitingForApproval("1")));
    }

    @Test
    public void generating_code_stores_generated_code_on_document() {
        SideEffects<ApprovalState> effects = saga.effects(data, ApprovalState.generatingCode(), false);

        assertEquals(SideEffects.Transition.STAY, effects.getTransition());
        assertEquals(1, effects.getCommands().size());
        SagaCommand command = effects.getCommands().get(0);
        assertEquals(DocumentAggregate.ENTITY_NAME, command.getTargetType());
        assertEquals("Command goes to the document that started the saga", null, command.getTargetId());
        assertEquals("424242", ((DocumentCommand.SetApprovalCode) command.getPayload()).getCode());
    }

    @Test
    public void sending_notification_notifies_and_waits() throws Exception {
        ApprovalSagaData withCode = saga.fold(data, ApprovalState.sendingNotification("424242"));
        SideEffects<ApprovalState> effects = saga.effects(withCode, ApprovalState.sendingNotification("424242"),
            false);

        assertEquals(SideEffects.Transition.NEXT, effects.getTransition());
        assertEquals(ApprovalState.waitingForApproval("424242"), effects.getNextState());
        assertThat(effects.getCommands(), empty());
        perform(effects);
        assertThat(notifications, contains(DOC + ":424242"));
    }

    @Test
    public void recovering_notification_is_not_sent_again() throws Exception {
        SideEffects<ApprovalState> effects = saga.effects(data, ApprovalState.sendingNotification("424242"), true);

        assertEquals(SideEffects.Transition.NEXT, effects.getTransition());
        assertEquals(ApprovalState.waitingForApproval("424242"), effects.getNextState());
        perform(effects);
        assertThat(notifications, empty());
    }

    @Test
    public void waiting_for_approval_approves_document() {
        SideEffects<ApprovalState> effects = saga.effects(data, ApprovalState.waitingForApproval("424242"), false);
        assertEquals(SideEffects.Transition.STAY, effects.getTransition());
        assertThat(effects.getCommands().get(0).getPayload(), instanceOf(DocumentCommand.Approve.class));
    }

    @Test
    public void terminal_states_stop_the_saga() {
        assertEquals(SideEffects.Transition.STOP, saga.effects(data, ApprovalState.approved(), false)
                .getTransition());
        assertEquals(SideEffects.Transition.STOP, saga.effects(data, ApprovalState.rejected(), true)
                .getTransition());
    }

    @Test
    public void fold_remembers_approval_code() {
        ApprovalSagaData folded = saga.fold(data, ApprovalState.sendingNotification("424242"));
        assertEquals(Optional.of("424242"), folded.getApprovalCode());
        assertEquals(DOC, folded.getDocumentId());
        assertEquals(folded, saga.fold(folded, ApprovalState.waitingForApproval("424242")));
    }

    @Test
    public void random_codes_have_six_digits() {
        ApprovalCodeGenerator generator = ApprovalCodeGenerator.random();
        for (int i = 0; i < 100; i++) {
            String code = generator.generate();
            assertTrue(code, code.matches("[1-9][0-9]{5}"));
        }
    }
}
