package io.github.goodees.docsaga.core.saga;

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
import io.github.goodees.docsaga.core.Request;
import io.github.goodees.docsaga.core.aggregate.EntityLocator;
import io.github.goodees.docsaga.core.config.EngineConfiguration;
import io.github.goodees.docsaga.core.config.EngineExecutors;
import io.github.goodees.docsaga.core.dispatch.DispatchingEventSourcingRuntime;
import io.github.goodees.docsaga.core.store.EventLog;
import io.github.goodees.docsaga.core.store.EventStore;
import io.github.goodees.docsaga.core.store.EventStoreException;
import io.github.goodees.docsaga.core.store.GlobalEventLog;
import io.github.goodees.docsaga.core.store.StreamedEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BiConsumer;

/**
 * Runtime of one saga type. Commands the sagas dispatch are routed through the {@link EntityLocator} given at
 * construction.
 *
 * @param <E> base type of origin events
 * @param <D> type of saga data
 * @param <S> type of saga state
 */
public class SagaRuntime<E extends Event, D, S> extends DispatchingEventSourcingRuntime<SagaEntity<E, D, S>> {

    private final String sagaName;
    private final SagaDefinition<E, D, S> definition;
    private final Class<E> eventType;
    private final EventStore store;
    private final EventLog eventLog;
    private final GlobalEventLog journal;
    private final EntityLocator locator;
    private final EngineExecutors executors;
    private final EngineConfiguration configuration;

    public SagaRuntime(String sagaName, SagaDefinition<E, D, S> definition, Class<E> eventType, EventStore store,
            EventLog eventLog, GlobalEventLog journal, EntityLocator locator, EngineExecutors executors,
            EngineConfiguration configuration) {
        this.sagaName = sagaName;
        this.definition = definition;
        this.eventType = eventType;
        this.store = store;
        this.eventLog = eventLog;
        this.journal = journal;
        this.locator = locator;
        this.executors = executors;
        this.configuration = configuration;
    }

    /**
     * Whether the event is of the origin type of this saga.
     * @param event any event
     * @return true if sagas of this runtime accept the event
     */
    public boolean handles(Event event) {
        return eventType.isInstance(event);
    }

    public boolean isStartingEvent(Event event) {
        return handles(event) && definition.isStartingEvent(eventType.cast(event));
    }

    public String sagaId(Event event) {
        return definition.sagaId(eventType.cast(event));
    }

    /**
     * Deliver origin event to its saga.
     * @param event the event
     * @return status of the saga after it processed the event and the effects of entered states
     */
    public CompletableFuture<SagaStatus> deliver(Event event) {
        return execute(sagaId(event), new SagaEntity.DeliverEvent(event));
    }

    /**
     * Perform effects of current state of a saga again.
     * @param sagaId identity of the saga
     * @return status after the effects
     */
    public CompletableFuture<SagaStatus> resume(String sagaId) {
        return execute(sagaId, SagaEntity.Resume.afterRestart());
    }

    public CompletableFuture<SagaStatus> status(String sagaId) {
        return execute(sagaId, SagaEntity.GetStatus.INSTANCE);
    }

    /**
     * Find sagas that started and did not stop, and resume them.
     * @return identities of resumed sagas
     * @throws EventStoreException when the journal cannot be read
     */
    public List<String> recover() throws EventStoreException {
        Map<String, Boolean> running = new LinkedHashMap<>();
        long offset = 0;
        List<StreamedEvent> batch;
        do {
            batch = journal.readAll(offset, configuration.getBatchSize());
            for (StreamedEvent streamed : batch) {
                Event event = streamed.getEvent();
                if (event instanceof SagaStartedEvent) {
                    running.put(event.entityId(), Boolean.TRUE);
                } else if (event instanceof SagaStoppedEvent) {
                    running.put(event.entityId(), Boolean.FALSE);
                }
                offset = streamed.getOffset();
            }
        } while (batch.size() == configuration.getBatchSize());

        List<String> unfinished = new ArrayList<>();
        running.forEach((id, isRunning) -> {
            if (isRunning) {
                unfinished.add(id);
            }
        });
        logger.info("Resuming {} unfinished {} sagas", unfinished.size(), sagaName);
        for (String id : unfinished) {
            resume(id).whenComplete((status, t) -> {
                if (t != null) {
                    logger.error("Saga {} could not be resumed", id, t);
                }
            });
        }
        return unfinished;
    }

    @Override
    protected SagaEntity<E, D, S> instantiate(String entityId) {
        return new SagaEntity<>(entityId, store, definition, eventType, this, locator, configuration);
    }

    @Override
    protected <RS, R extends Request<RS>> void invokeEntity(SagaEntity<E, D, S> entity, R request,
            BiConsumer<RS, Throwable> callback) throws Exception {
        CompletionStage<RS> step = entity.execute(request);
        if (step == null) {
            logger.error("Saga {} returned no result for {}", entity.getIdentity(), request);
            callback.accept(null, new IllegalStateException("Saga " + entity.getIdentity()
                    + " did not handle " + request));
        } else {
            step.whenComplete(callback);
        }
    }

    @Override
    protected void dispose(SagaEntity<E, D, S> entity) {
        logger.debug("Disposing saga {}", entity.getIdentity());
    }

    @Override
    protected EventLog getEventLog() {
        return eventLog;
    }

    @Override
    protected ExecutorService getExecutorService() {
        return executors.getWorkers();
    }

    @Override
    protected ScheduledExecutorService getScheduler() {
        return executors.getScheduler();
    }

    @Override
    public String getEntityName() {
        return sagaName;
    }

    // sagas schedule their own retries
    @Override
    protected long retryDelay(String id, Request<?> request, Throwable error, int attempts) {
        logger.warn("Saga {} failed processing request {}", id, request, error);
        return RETRY_NEVER;
    }
}
