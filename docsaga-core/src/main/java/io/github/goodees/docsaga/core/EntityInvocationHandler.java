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

import io.github.goodees.docsaga.core.store.EventLog;
import io.github.goodees.docsaga.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Common logic for speaking with entities. It instantiates the entities, recovers their state and manages their
 * invocation lifecycle. In order for recovery to work, the runtime needs {@link EventLog} to see the past events.
 *
 * <h2 id="request-lifecycle">Request lifecycle</h2>
 * <ol>
 * <li>Obtain an up-to-date instance, as described by {@linkplain Lifecycle}</li>
 * <li>Pass the request to the instance. Subclasses of runtime define the contract between runtime and entity</li>
 * <li>When call completes, the invocation state of entity reflects successful or unsuccessful completion and
 * {@link EventSourcedEntity#performPostInvocationActions(List, Throwable)} is called</li>
 * <li>When the call failed due to storage error, the entity is removed from memory, so it is recovered into fresh
 * state on next request. The call results in {@link EventStoreException}, regardless of exception handling within the
 * entity.</li>
 * </ol>
 *
 * @param <E> the type of entity this runtime handles
 */
public class EntityInvocationHandler<E extends EventSourcedEntity> {

    private final Configuration<E> conf;

    /**
     * SLF4J logger for handler and its subclasses.
     */
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    /**
     * Configuration aspect describing in-memory storage of entities.
     *
     * @param <E> the type of entity
     */
    public interface WorkingMemory<E extends EventSourcedEntity> {

        /**
         * Return stored entity, or create and store a new instance.
         *
         * @param id id of the entity
         * @param instantiator code to invoke for obtaining a fresh entity.
         * @return an instance of entity
         */
        E lookup(String id, Function<String, E> instantiator);

        /**
         * Remove entity from working memory.
         *
         * @param id id of the entity
         * @return the removed instance, null when there was none
         */
        E remove(String id);

        /**
         * Identities of entities that were not looked up for given time.
         * @param idleTime minimal duration since last lookup
         * @return identities of idle entities
         */
        Collection<String> idleEntities(Duration idleTime);
    }

    /**
     * Configuration aspect describing reading of persistent storage.
     *
     * @param <E> the type of entity
     */
    public interface Persistence<E extends EventSourcedEntity> {

        /**
         * Event log of this runtime. EventLog must be consistent with EventStore used for this runtime, so it can
         * always return consistent set of events for an entity past specific version.
         *
         * @return event log of this runtime
         */
        EventLog getEventLog();

        /**
         * Whether no other writer appended events the instance has not seen.
         *
         * @param entity the instance of an entity
         * @return false if the log holds newer events than the instance
         */
        boolean isInLatestKnownState(E entity);
    }

    /**
     * Configuration aspect describing lifecycle of entity instances.
     * <ol>
     * <li>If the {@linkplain WorkingMemory} contains an instance, it will be used</li>
     * <li>Otherwise it will call {@link Lifecycle#instantiate(String)} to create uninitialized instance</li>
     * <li>All events of the entity are passed, in order they were created, into
     * {@link EventSourcedEntity#updateState(Event)}.</li>
     * <li>{@link EventSourcedEntity#initialize()} is called to let entity initialize its internal processes.</li>
     * </ol>
     *
     * @param <E> the type of entity
     */
    public interface Lifecycle<E extends EventSourcedEntity> {

        /**
         * Create a new uninitialized instance for given id.
         *
         * @param id id of the entity
         * @return instantiated entity
         */
        E instantiate(String id);

        /**
         * Perform clean up before removing an entity instance. This instance will no longer be used by the runtime.
         *
         * @param entity entity to dispose
         */
        void dispose(E entity);
    }

    public interface Configuration<E extends EventSourcedEntity> {

        WorkingMemory<E> memory();

        Persistence<E> persistence();

        Lifecycle<E> lifecycle();
    }

    /**
     * Receives outcome of an invocation started by {@link #invokeWithCallback(String, BiConsumer)}.
     */
    @FunctionalInterface
    public interface CompletionHandler {
        void completed(Object result, Throwable exceptionResult) throws EventStoreException;
    }

    public EntityInvocationHandler(Configuration<E> configuration) {
        conf = configuration;
    }

    /**
     * Let client invoke the action, and transfer the result to invocation handler.
     * @param entityId id of entity
     * @param action an action that will call back to provided completion handler.
     */
    public void invokeWithCallback(String entityId, BiConsumer<E, CompletionHandler> action) {
        E entity = prepareInvocation(entityId);
        action.accept(entity, (r, t) -> handleCompletion(entityId, entity, t));
    }

    /**
     * Remove an entity from memory. Must not be called while the entity executes a request, the dispatching runtimes
     * route passivation through the entity's mailbox.
     * @param entityId id of entity
     * @return true if an instance was active
     */
    public boolean passivate(String entityId) {
        E entity = conf.memory().remove(entityId);
        if (entity != null) {
            conf.lifecycle().dispose(entity);
            logger.debug("Entity {} passivated", entityId);
            return true;
        }
        return false;
    }

    /**
     * Identities of active entities that were not used for given time.
     * @param idleTime minimal idle time
     * @return identities eligible for passivation
     */
    public Collection<String> idleEntities(Duration idleTime) {
        return conf.memory().idleEntities(idleTime);
    }

    private E prepareInvocation(String entityId) {
        E entity = lookup(entityId);
        Objects.requireNonNull(entity, () -> "Lookup returned null for entityId " + entityId);
        entity.getInvocationState().preInvocation();
        return entity;
    }

    /**
     * Common logic to execute after the invocation of request completes. Removes the entity if event storing failed
     * (e. g. entity was stale).
     *
     * @param entityId identity of the entity
     * @param entity instance of the entity
     * @param t non-null, when invocation completed with an exception
     * @throws EventStoreException if storing failed, but the entity completed the invocation with different outcome
     */
    private void handleCompletion(String entityId, E entity, Throwable t) throws EventStoreException {
        if (entity.getInvocationState().getState() == EventSourcedEntity.EntityInvocationState.EVENT_STORE_FAILED) {
            EventStoreException ese;
            if ((entity.getInvocationState().getThrowable() instanceof EventStoreException)) {
                ese = (EventStoreException) entity.getInvocationState().getThrowable();
            } else {
                ese = EventStoreException.suppressed(entityId, entity.getInvocationState().getThrowable());
                entity.getInvocationState().eventStoreFailed(ese);
            }
            // post invocation actions can cleanup after EventStoreException.
            entity.getInvocationState().postInvocation();
            clearEntity(entityId, entity);
            if (ese != t) {
                throw ese;
            }
        } else {
            if (t != null) {
                entity.getInvocationState().failed(t);
            } else {
                entity.getInvocationState().completed();
            }
            entity.getInvocationState().postInvocation();
        }
    }

    private void clearEntity(String entityId, E entity) {
        conf.memory().remove(entityId);
        conf.lifecycle().dispose(entity);
    }

    private E lookup(String entityId) {
        // If instantiate and recover fails, then there is nothing you can do. So ex will just propagate to client.
        E entity = conf.memory().lookup(entityId, this::recoverEntity);
        if (!conf.persistence().isInLatestKnownState(entity)) {
            logger.info("Entity {} is stale at version {}, recovering again", entityId, entity.getStateVersion());
            conf.memory().remove(entityId);
            conf.lifecycle().dispose(entity);
            return conf.memory().lookup(entityId, this::recoverEntity);
        }
        return entity;
    }

    private E recoverEntity(String entityId) {
        E instance = conf.lifecycle().instantiate(entityId);
        long recoveryStart = System.currentTimeMillis();
        instance.getInvocationState().recovering();
        try (EventLog.Replay<? extends Event> events =
                conf.persistence().getEventLog().readEvents(entityId, instance.getStateVersion())) {
            AtomicInteger recoveredEventsCount = new AtomicInteger();
            events.foreach(event -> {
                try {
                    instance.applyEvent(event);
                } catch (RuntimeException e) {
                    logger.error("Entity {} failed to replay event {}", entityId, event.entityStateVersion(), e);
                    throw e;
                }
                recoveredEventsCount.incrementAndGet();
            });
            instance.initialize();
            instance.getInvocationState().initialized();
            logger.info("Entity {} recovered in {} ms replaying {} events", entityId,
                    System.currentTimeMillis() - recoveryStart, recoveredEventsCount.get());
        }
        return instance;
    }
}
