package io.github.goodees.docsaga.core;

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

import io.github.goodees.docsaga.core.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.Math.max;

/**
 * A single event sourced entity. The entity is bound to a {@linkplain EventSourcingRuntimeBase runtime}, that will
 * instantiate it, and a contract exists between the runtime and entity class to execute a {@link Request}.
 *
 * <p>An entity preserves its internal state. This state can <strong>only</strong> change as result of reception of an
 * event in method {@link #updateState(Event)}. The state of the entity, and the system in general <strong>may
 * not</strong> change in other methods, especially not in methods that execute the request.
 *
 * <p>Any events that happen as consequence of executing a request must be stored into provided {@link EventStore}.
 * This class does not define any specific method for that, it is left to subclasses to define API that is consistent
 * with execution style of the entities.</p>
 * @see AsyncEntity
 * @see SyncEntity
 */
public abstract class EventSourcedEntity {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final String identity;
    private long stateVersion;
    private long nextEventVersion;
    private final InvocationState invocationState = new InvocationState();

    /**
     * Constructor for subclasses.
     * @param identity the identity of the entity
     */
    protected EventSourcedEntity(String identity) {
        Objects.requireNonNull(identity);
        this.identity = identity;
    }

    /**
     * Return entity's identity.
     * @return entity's identity
     */
    public final String getIdentity() {
        return identity;
    }

    /**
     * Version of an entity. Each entity has monotonic growing version number that corresponds to number of events it
     * produced.
     * @return current entity version
     */
    public final long getStateVersion() {
        return stateVersion;
    }

    /**
     * Update state after event is persisted. Entity implementations call this method to have their state updated via
     * {@link #updateState(Event)} after the event was persisted. When storing events fail, this method should also be
     * called to invalidate the entity.
     * @param event event that was stored
     * @param eventStoreError error that happened during persistence of event
     */
    protected final void handlePersistence(Event event, Throwable eventStoreError) {
        if (eventStoreError == null) {
            applyEvent(event);
            getInvocationState().eventPersisted(event);
        } else {
            handlePersistenceFailure(eventStoreError);
        }
    }

    /**
     * Update state after events are persisted.
     * @param events events that were stored
     * @param eventStoreError error that happened during persistence of event
     * @see #handlePersistence(Event, Throwable)
     */
    protected final void handlePersistence(Collection<? extends Event> events, Throwable eventStoreError) {
        if (eventStoreError == null) {
            events.forEach(this::applyEvent);
            getInvocationState().eventsPersisted(events);
        } else {
            handlePersistenceFailure(eventStoreError);
        }
    }

    protected final void handlePersistenceFailure(Throwable eventStoreError) {
        getInvocationState().eventStoreFailed(eventStoreError);
        // versions handed out for the failed events are not valid anymore
        nextEventVersion = stateVersion;
    }

    /**
     * Called during state recovery for any event read from the event log.
     * @param event past event from the event log
     */
    void applyEvent(Event event) {
        updateState(event);
        stateVersion = max(event.entityStateVersion(), stateVersion + 1);
        nextEventVersion = stateVersion;
    }

    /**
     * Update the state as result of application of persisted event. This method must be very robust - it may not throw
     * an exception or break state invariants under any input. Failing to do so will make the entity irrecoverable.
     *
     * <p>When the state needs to be handled differently during replay, the method can query
     * {@link #getInvocationState()}</p>
     *
     * @param event event to apply
     */
    protected abstract void updateState(Event event);

    /**
     * Entity's state within invocation lifecycle. Runtime uses this information to assert consistency of processing,
     * entity may use it to determine details about events resulting from an invocation, or whether the recovery is
     * underway
     * @return entity's invocation state.
     */
    protected final InvocationState getInvocationState() {
        return this.invocationState;
    }

    /**
     * A callback called after execution of request finishes. May be used to plug request-independent side effects that
     * act on events generated during single execution run.
     * <p>This method must not change state or try to persist events.</p>
     * @param events Events persisted during currently finished invocation
     * @param thrownException Thrown exception in case the processing did not complete successfully
     */
    protected void performPostInvocationActions(List<Event> events, Throwable thrownException) {

    }

    /**
     * Callback called after entity is recovered from store, before first request is executed.
     */
    protected void initialize() {
    }

    /**
     * Offer next version for an event.
     * @return the version next produced event should have
     */
    protected final long nextEventVersion() {
        return ++nextEventVersion;
    }

    /**
     * The state entity is in. Serves for auditing purposes, on rare occasion could be used to determine whether
     * the entity is currently replaying past events, or executing a request.
     */
    public enum EntityInvocationState {
        INITIALIZING, IDLE, EXECUTING, SUCCESSFUL, EVENT_STORE_FAILED, FAILED
    }

    public final class InvocationState {
        private EntityInvocationState state = EntityInvocationState.INITIALIZING;
        private final List<Event> committedEvents = new ArrayList<>();
        private final List<Event> readOnlyEventsView = Collections.unmodifiableList(committedEvents);
        private Throwable throwable;

        private InvocationState() {

        }

        public EntityInvocationState getState() {
            return state;
        }

        public Throwable getThrowable() {
            return throwable;
        }

        public List<Event> getEvents() {
            return readOnlyEventsView;
        }

        void recovering() {
            state = EntityInvocationState.INITIALIZING;
        }

        void initialized() {
            state = EntityInvocationState.IDLE;
        }

        void preInvocation() {
            if (state != EntityInvocationState.IDLE) {
                logger.error("Broken runtime concurrency! Entity {} starts executing and while in state {}", identity,
                    state);
            }
            state = EntityInvocationState.EXECUTING;
        }

        void eventPersisted(Event event) {
            this.committedEvents.add(event);
        }

        void eventsPersisted(Collection<? extends Event> e) {
            this.committedEvents.addAll(e);
        }

        void eventStoreFailed(Throwable t) {
            this.throwable = t;
            this.state = EntityInvocationState.EVENT_STORE_FAILED;
        }

        void completed() {
            this.state = EntityInvocationState.SUCCESSFUL;
        }

        void failed(Throwable t) {
            this.throwable = t;
            this.state = EntityInvocationState.FAILED;
        }

        void postInvocation() {
            try {
                performPostInvocationActions(readOnlyEventsView, throwable);
            } catch (Exception e) {
                logger.error("Error in postInvocation phase of entity {}. Events: {}", identity, committedEvents, e);
            }
            state = EntityInvocationState.IDLE;
            throwable = null;
            committedEvents.clear();
        }

        @Override
        public String toString() {
            return "InvocationState{" + "state=" + state + ", committedEvents=" + committedEvents + ", throwable="
                    + throwable + '}';
        }
    }

}
