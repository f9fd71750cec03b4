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

import io.github.goodees.docsaga.core.aggregate.Aggregate;
import io.github.goodees.docsaga.core.aggregate.Decision;
import io.github.goodees.docsaga.core.matching.TypeSwitchExpression;
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

import java.util.function.Function;

/**
 * Decisions and state folding of a document.
 *
 * <p>Creating or updating is accepted when the entity holds no document yet, or holds the same document. A document
 * with different identity is rejected with {@link DocumentError#DOCUMENT_NOT_FOUND}. Workflow commands are issued
 * by the approval saga only, and are always persisted.</p>
 */
public class DocumentAggregate implements Aggregate<DocumentState, DocumentCommand, DocumentEvent> {

    public static final String ENTITY_NAME = "Document";

    private static final TypeSwitchExpression<Function<DocumentState, Decision<DocumentEvent>>> DECISIONS =
            TypeSwitchExpression.<Function<DocumentState, Decision<DocumentEvent>>>builder()
                .on(DocumentCommand.CreateOrUpdate.class, c -> state -> createOrUpdate(c.getDocument(), state))
                .on(DocumentCommand.SetApprovalCode.class,
                    c -> state -> Decision.persist(h -> ApprovalCodeSetEvent.builder(h).code(c.getCode()).build()))
                .on(DocumentCommand.Approve.class,
                    c -> state -> Decision.persist(h -> ApprovedEvent.builder(h).build()))
                .on(DocumentCommand.Reject.class,
                    c -> state -> Decision.persist(h -> RejectedEvent.builder(h).build()))
                .build();

    private static final TypeSwitchExpression<Function<DocumentState, DocumentState>> UPDATES =
            TypeSwitchExpression.<Function<DocumentState, DocumentState>>builder()
                .on(CreatedOrUpdatedEvent.class, e -> state -> state.withDocument(e.getDocument()))
                .on(ApprovalCodeSetEvent.class, e -> state -> state.withApprovalCode(e.getCode()))
                .on(ApprovedEvent.class, e -> state -> state.withApproval(true))
                .on(RejectedEvent.class, e -> state -> state.withApproval(false))
                .on(ErrorEvent.class, e -> Function.identity())
                .build();

    @Override
    public DocumentState initialState() {
        return DocumentState.INITIAL;
    }

    @Override
    public Decision<DocumentEvent> decide(DocumentCommand command, DocumentState state) {
        Function<DocumentState, Decision<DocumentEvent>> decision = DECISIONS.match(command);
        return decision != null ? decision.apply(state) : Decision.ignore();
    }

    private static Decision<DocumentEvent> createOrUpdate(Document document, DocumentState state) {
        boolean sameDocument = state.getDocument().map(d -> d.getId().equals(document.getId())).orElse(true);
        if (sameDocument) {
            return Decision.persist(h -> CreatedOrUpdatedEvent.builder(h).document(document).build());
        } else {
            return Decision.reject(h -> ErrorEvent.builder(h).error(DocumentError.DOCUMENT_NOT_FOUND).build());
        }
    }

    @Override
    public DocumentState apply(DocumentEvent event, DocumentState state) {
        Function<DocumentState, DocumentState> update = UPDATES.match(event);
        return update != null ? update.apply(state) : state;
    }
}
