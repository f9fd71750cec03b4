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

import io.github.goodees.docsaga.core.dispatch.DispatchingEventSourcingRuntime;
import io.github.goodees.docsaga.core.store.EventLog;
import io.github.goodees.docsaga.core.store.EventStore;
import io.github.goodees.docsaga.core.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Common logic for facade to speaking with entities. It instantiates the entities, recovers their state and manages
 * their invocation lifecycle. In order for recovery to work, the runtime needs {@link EventLog} to see the past events.
 * Entities will then need to be created with an {@link EventStore} that is consistent with the EventLog.
 * <p>This class does not prescribe any specific execution and dispatching methods, this is left to subclasses.</p>
 * @see DispatchingEventSourcingRuntime
 * @param <E> the type of entity this runtime handles
 */
public abstract class EventSourcingRuntimeBase<E extends EventSourcedEntity> {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final EntityInvocationHandler.Lifecycle<E> lifecycleAdapter;
    private final EntityInvocationHandler.Persistence<E> persistenceAdapter;
    private final EntityInvocationHandler.WorkingMemory<E> workingMemory = new MapBasedWorkingMemory<>();
    protected final EntityInvocationHandler<E> invocationHandler;

    protected EventSourcingRuntimeBase() {
        lifecycleAdapter = new EntityInvocationHandler.Lifecycle<E>() {
            @Override
            public E instantiate(String id) {
                return EventSourcingRuntimeBase.this.instantiate(id);
            }

            @Override
            public void dispose(E entity) {
                EventSourcingRuntimeBase.this.dispose(entity);
            }
        };
        persistenceAdapter = new EntityInvocationHandler.Persistence<E>() {
            @Override
            public EventLog getEventLog() {
                return EventSourcingRuntimeBase.this.getEventLog();
            }

            @Override
            public boolean isInLatestKnownState(E entity) {
                return EventSourcingRuntimeBase.this.isInLatestKnownState(entity);
            }
        };
        invocationHandler = new EntityInvocationHandler<>(new EntityInvocationHandler.Configuration<E>() {
            @Override
            public EntityInvocationHandler.WorkingMemory<E> memory() {
                return workingMemory;
            }

            @Override
            public EntityInvocationHandler.Persistence<E> persistence() {
                return persistenceAdapter;
            }

            @Override
            public EntityInvocationHandler.Lifecycle<E> lifecycle() {
                return lifecycleAdapter;
            }
        });
    }

    /**
     * Create a new uninitialized instance for given id. Serves for creating the entity with reference to the
     * EventStore, correct identity and any other dependencies the entity needs to execute request. Runtime will
     * restore the state from the journal afterwards.
     * @param entityId the identity of the entity
     * @return freshly instantiated entity object
     */
    protected abstract E instantiate(String entityId);

    /**
     * Perform clean up before removing an entity instance. This instance will no longer be used by the runtime.
     * @param entity entity to dispose
     */
    protected abstract void dispose(E entity);

    /**
     * Event log of this runtime. EventLog must be consistent with EventStore used for this runtime.
     * @return event log of this runtime
     */
    protected abstract EventLog getEventLog();

    /**
     * Execute a request and return future result. This is the entry point for passing request to the entity and
     * getting results from it.
     * <p>The runtime guarantees, that for given {@code entityId}, there is only one entity instance in the memory and
     * it will only execute single request at time.</p>
     *
     * <p>Clients should not call any mutation methods of the returned CompletableFuture, such as
     * {@linkplain CompletableFuture#complete(Object)}. They will throw an UnsupportedOperationException.</p>
     * @param entityId the identity of the entity to be called
     * @param request the request to perform
     * @param <R> Type of request
     * @param <RS> Response type matching to the request
     * @return CompletableFuture of the result.
     */
    public abstract <R extends Request<RS>, RS> CompletableFuture<RS> execute(String entityId, R request);

    /**
     * Compare an instance with the last version in the log. When the log cannot be read, the instance is kept, the
     * store rejects its next write if it is stale.
     *
     * @param entity the instance of an entity
     * @return false if the log holds newer events than the instance
     */
    protected boolean isInLatestKnownState(E entity) {
        try {
            return getEventLog().lastVersion(entity.getIdentity()) <= entity.getStateVersion();
        } catch (EventStoreException e) {
            logger.warn("Cannot read version of entity {}, keeping instance at version {}", entity.getIdentity(),
                entity.getStateVersion(), e);
            return true;
        }
    }

}
