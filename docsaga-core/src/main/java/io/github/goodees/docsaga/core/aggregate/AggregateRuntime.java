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
import io.github.goodees.docsaga.core.Request;
import io.github.goodees.docsaga.core.config.EngineConfiguration;
import io.github.goodees.docsaga.core.config.EngineExecutors;
import io.github.goodees.docsaga.core.dispatch.DispatchingEventSourcingRuntime;
import io.github.goodees.docsaga.core.store.EventLog;
import io.github.goodees.docsaga.core.store.EventStore;
import io.github.goodees.docsaga.core.store.EventStoreException;
import io.github.goodees.docsaga.core.stream.EventStream;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Runtime of one aggregate type. Commands for one identity are processed one at a time, commands failing on
 * concurrent modification are retried against replayed state.
 *
 * @param <S> type of state
 * @param <C> type of command payloads
 * @param <E> base type of events
 */
public class AggregateRuntime<S, C, E extends Event> extends DispatchingEventSourcingRuntime<AggregateEntity<S, C, E>> {

    private final String entityName;
    private final Aggregate<S, C, E> aggregate;
    private final Class<C> commandType;
    private final Class<E> eventType;
    private final EventStore store;
    private final EventLog eventLog;
    private final EngineExecutors executors;
    private final EngineConfiguration configuration;
    private final EventStream stream;

    public AggregateRuntime(String entityName, Aggregate<S, C, E> aggregate, Class<C> commandType,
            Class<E> eventType, EventStore store, EventLog eventLog, EngineExecutors executors,
            EngineConfiguration configuration, EventStream stream) {
        this.entityName = entityName;
        this.aggregate = aggregate;
        this.commandType = commandType;
        this.eventType = eventType;
        this.store = store;
        this.eventLog = eventLog;
        this.executors = executors;
        this.configuration = configuration;
        this.stream = stream;
    }

    /**
     * Submit a command with configured command timeout.
     * @param aggregateId identity of the aggregate
     * @param correlationId correlation id the resulting events will carry
     * @param payload the command
     * @return future of the result, failing with TimeoutException when not processed in time
     */
    public CompletableFuture<CommandResult<E>> submit(String aggregateId, String correlationId, C payload) {
        return submit(aggregateId, correlationId, payload, configuration.getCommandTimeout());
    }

    public CompletableFuture<CommandResult<E>> submit(String aggregateId, String correlationId, C payload,
            Duration timeout) {
        return executeWithTimeout(aggregateId, new Command<C, E>(aggregateId, correlationId, payload),
            timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Handle of single aggregate instance.
     * @param identity identity of the aggregate
     * @return the handle
     */
    public EntityRef ref(String identity) {
        return new Ref(identity);
    }

    @Override
    protected AggregateEntity<S, C, E> instantiate(String entityId) {
        return new AggregateEntity<>(entityId, store, aggregate, commandType, eventType, stream);
    }

    @Override
    protected <RS, R extends Request<RS>> void invokeEntity(AggregateEntity<S, C, E> entity, R request,
            BiConsumer<RS, Throwable> callback) throws Exception {
        // decide and persist complete within the call
        callback.accept(entity.execute(request), null);
    }

    @Override
    protected void dispose(AggregateEntity<S, C, E> entity) {
        logger.debug("Disposing {}", entity);
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
        return entityName;
    }

    @Override
    protected long retryDelay(String id, Request<?> request, Throwable error, int attempts) {
        if (error instanceof EventStoreException && ((EventStoreException) error).isVersionConflict()) {
            if (attempts < configuration.getOptimisticLockAttempts()) {
                logger.debug("Entity {} retries {} after concurrent modification", id, request);
                return RETRY_NOW;
            }
            logger.warn("Entity {} failed processing request {} after {} attempts", id, request, attempts, error);
        }
        return RETRY_NEVER;
    }

    private class Ref implements EntityRef {
        private final String identity;

        Ref(String identity) {
            this.identity = identity;
        }

        @Override
        public String getIdentity() {
            return identity;
        }

        @Override
        public CompletableFuture<CommandResult<? extends Event>> submit(String correlationId, Object payload) {
            return submit(correlationId, payload, configuration.getCommandTimeout());
        }

        @Override
        public CompletableFuture<CommandResult<? extends Event>> submit(String correlationId, Object payload,
                Duration timeout) {
            if (!commandType.isInstance(payload)) {
                CompletableFuture<CommandResult<? extends Event>> failed = new CompletableFuture<>();
                failed.completeExceptionally(new IllegalArgumentException(entityName + " does not accept "
                        + payload));
                return failed;
            }
            return AggregateRuntime.this.submit(identity, correlationId, commandType.cast(payload), timeout)
                    .thenApply(r -> r);
        }
    }
}
