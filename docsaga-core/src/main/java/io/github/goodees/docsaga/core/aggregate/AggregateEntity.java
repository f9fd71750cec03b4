package io.github.goodees.docsaga.core.aggregate;

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
import io.github.goodees.docsaga.core.Request;
import io.github.goodees.docsaga.core.SyncEntity;
import io.github.goodees.docsaga.core.store.EventStore;
import io.github.goodees.docsaga.core.stream.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entity executing commands of an {@link Aggregate}. Decided events are persisted before they are applied to the
 * state, rejections are published to transient listeners of the stream and never persisted.
 */
public class AggregateEntity<S, C, E extends Event> extends SyncEntity {
    private static final Logger logger = LoggerFactory.getLogger(AggregateEntity.class);

    private final Aggregate<S, C, E> aggregate;
    private final Class<C> commandType;
    private final Class<E> eventType;
    private final EventStream stream;
    private S state;

    public AggregateEntity(String id, EventStore store, Aggregate<S, C, E> aggregate, Class<C> commandType,
            Class<E> eventType, EventStream stream) {
        super(id, store);
        this.aggregate = aggregate;
        this.commandType = commandType;
        this.eventType = eventType;
        this.stream = stream;
        this.state = aggregate.initialState();
    }

    public S getState() {
        return state;
    }

    @Override
    protected <R extends Request<RS>, RS> RS execute(R request) throws Exception {
        if (request instanceof Command) {
            return (RS) handle((Command<?, ?>) request);
        }
        throw new UnsupportedOperationException("Request of type " + request.getClass().getSimpleName()
                + " is not supported");
    }

    private CommandResult<E> handle(Command<?, ?> command) throws Exception {
        if (!commandType.isInstance(command.getPayload())) {
            throw new IllegalArgumentException("Aggregate " + getIdentity() + " does not accept "
                    + command.getPayload());
        }
        String correlationId = command.getCorrelationId();
        Decision<E> decision = aggregate.decide(commandType.cast(command.getPayload()), state);
        switch (decision.getKind()) {
            case PERSIST:
                List<E> events = new ArrayList<>();
                for (Event.FromHeader<? extends E> factory : decision.getEvents()) {
                    events.add(factory.from(new EventHeader(this, correlationId)));
                }
                persistAllAndUpdate(events);
                return CommandResult.persisted(events);
            case REJECT:
                // rejections carry the current version and leave it unchanged
                E rejection = decision.getRejection().from(EventHeader.currentState(this, correlationId));
                logger.info("Entity {} rejected command {}: {}", getIdentity(), command.getPayload(), rejection);
                stream.publishTransient(rejection);
                return CommandResult.rejected(rejection);
            default:
                logger.warn("Entity {} ignored command {} in state {}", getIdentity(), command.getPayload(), state);
                return CommandResult.ignored();
        }
    }

    @Override
    protected void updateState(Event event) {
        if (eventType.isInstance(event)) {
            state = aggregate.apply(eventType.cast(event), state);
        } else {
            logger.error("Entity {} received unsupported event {}", getIdentity(), event);
        }
    }

    @Override
    protected void performPostInvocationActions(List<Event> events, Throwable thrownException) {
        if (!events.isEmpty()) {
            stream.appended();
        }
    }

    @Override
    public String toString() {
        return "AggregateEntity{" + "id=" + getIdentity() + ", version=" + getStateVersion() + ", state=" + state
                + '}';
    }
}
