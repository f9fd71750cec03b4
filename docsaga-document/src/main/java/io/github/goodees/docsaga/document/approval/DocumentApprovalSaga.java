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

import io.github.goodees.docsaga.core.saga.SagaCommand;
import io.github.goodees.docsaga.core.saga.SagaDefinition;
import io.github.goodees.docsaga.core.saga.SideEffects;
import io.github.goodees.docsaga.document.DocumentAggregate;
import io.github.goodees.docsaga.document.event.ApprovalCodeSetEvent;
import io.github.goodees.docsaga.document.event.ApprovedEvent;
import io.github.goodees.docsaga.document.event.CreatedOrUpdatedEvent;
import io.github.goodees.docsaga.document.event.DocumentEvent;
import io.github.goodees.docsaga.document.event.RejectedEvent;
import io.github.goodees.docsaga.document.model.DocumentCommand;

import java.util.Objects;
import java.util.Optional;

/**
 * Approval workflow started by every created or updated document.
 *
 * <p>The saga generates an approval code and stores it on the document, notifies approvers, and approves the
 * document automatically once it waits for approval. Approval or rejection of the document stops the saga.</p>
 */
public class DocumentApprovalSaga implements SagaDefinition<DocumentEvent, ApprovalSagaData, ApprovalState> {

    public static final String SAGA_NAME = "DocumentApprovalSaga";

    private final ApprovalCodeGenerator codeGenerator;
    private final ApprovalNotifier notifier;

    public DocumentApprovalSaga() {
        this(ApprovalCodeGenerator.random(), ApprovalNotifier.logging());
    }

    public DocumentApprovalSaga(ApprovalCodeGenerator codeGenerator, ApprovalNotifier notifier) {
        this.codeGenerator = Objects.requireNonNull(codeGenerator);
        this.notifier = Objects.requireNonNull(notifier);
    }

    @Override
    public ApprovalSagaData initialData(String sagaId) {
        return new ApprovalSagaData(sagaId, null);
    }

    @Override
    public boolean isStartingEvent(DocumentEvent event) {
        return event instanceof CreatedOrUpdatedEvent;
    }

    @Override
    public Optional<ApprovalState> react(DocumentEvent event, ApprovalSagaData data, ApprovalState currentState) {
        if (event instanceof CreatedOrUpdatedEvent && currentState == null) {
            return Optional.of(ApprovalState.generatingCode());
        } else if (event instanceof ApprovalCodeSetEvent && currentState instanceof ApprovalState.GeneratingCode) {
            return Optional.of(ApprovalState.sendingNotification(((ApprovalCodeSetEvent) event).getCode()));
        } else if (event instanceof ApprovedEvent) {
            return Optional.of(ApprovalState.approved());
        } else if (event instanceof RejectedEvent) {
            return Optional.of(ApprovalState.rejected());
        }
        return Optional.empty();
    }

    @Override
    public SideEffects<ApprovalState> effects(ApprovalSagaData data, ApprovalState state, boolean recovering) {
        if (state instanceof ApprovalState.GeneratingCode) {
            return SideEffects.<ApprovalState>stay().dispatch(SagaCommand.toOrigin(DocumentAggregate.ENTITY_NAME,
                new DocumentCommand.SetApprovalCode(codeGenerator.generate())));
        } else if (state instanceof ApprovalState.SendingNotification) {
            String code = ((ApprovalState.SendingNotification) state).getCode();
            SideEffects<ApprovalState> next = SideEffects.next(ApprovalState.waitingForApproval(code));
            // a notification might have been sent before restart
            return recovering ? next : next.perform(() -> notifier.notifyApprovers(data.getDocumentId(), code));
        } else if (state instanceof ApprovalState.WaitingForApproval) {
            return SideEffects.<ApprovalState>stay()
                    .dispatch(SagaCommand.toOrigin(DocumentAggregate.ENTITY_NAME, new DocumentCommand.Approve()));
        } else if (state.isTerminal()) {
            return SideEffects.stop();
        }
        return SideEffects.stay();
    }

    @Override
    public ApprovalSagaData fold(ApprovalSagaData data, ApprovalState state) {
        if (state instanceof ApprovalState.SendingNotification) {
            return data.withApprovalCode(((ApprovalState.SendingNotification) state).getCode());
        }
        return data;
    }
}
