package io.github.goodees.docsaga.core.dispatch;

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

import io.github.goodees.docsaga.core.EntityInvocationHandler;
import io.github.goodees.docsaga.core.EventSourcedEntity;
import io.github.goodees.docsaga.core.EventSourcingRuntimeBase;
import io.github.goodees.docsaga.core.Request;

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Common base for runtimes that dispatch requests using {@link Dispatcher}. In addition to basic execute method,
 * dispatching runtimes support retries of requests, timeouts, scheduled request dispatching and passivation of
 * entities.
 */
public abstract class DispatchingEventSourcingRuntime<E extends EventSourcedEntity> extends EventSourcingRuntimeBase<E> {
    public static final long RETRY_NEVER = -1;
    public static final long RETRY_NOW = 0;

    /**
     * ExecutorService, that will handle entity invocations. Should usually be backed by multiple threads.
     * @return instance of executor service
     */
    protected abstract ExecutorService getExecutorService();

    /**
     * ScheduledExecutorService, that will handle delayed delivery and timeouts of the requests. Must not use same
     * thread pool like {@link #getExecutorService()}, because in case that pool is overflowing, the timeouts would
     * not get executed
     * @return instance of ScheduledExecutorService
     */
    protected abstract ScheduledExecutorService getScheduler();

    /**
     * The abstract name for the entities the runtime is servicing. Used for better log messages, log destinations
     * and for locating the runtime.
     * @return short name describing the entities
     */
    public abstract String getEntityName();

    /**
     * Pass the request to the entity. When the call completes, {@code callback} should be invoked with either the
     * result value, or the thrown exception.
     *
     * @param entity entity instance
     * @param request the request to pass
     * @param callback callback to return the control back to the runtime for the post invocation tasks
     * @param <RS> type of response
     * @param <R> type of request
     * @throws Exception when anything goes wrong in invocation at level of runtime.
     */
    protected abstract <RS, R extends Request<RS>> void invokeEntity(E entity, R request,
                                                                     BiConsumer<RS, Throwable> callback) throws Exception;

    /**
     * Specify whether and when the request should be retried in case of failure.
     * @param id identity of the entity
     * @param request request that failed
     * @param error the throwable the request failed with
     * @param attempts number of attempts for execution of that request.
     * @return negative for failing the request, zero for immediate retry, positive for delay in ms until next attempt
     * @see DispatcherConfiguration#retryDelay(String, Request, Throwable, int)
     */
    protected long retryDelay(String id, Request<?> request, Throwable error, int attempts) {
        if (attempts < 5) {
            return RETRY_NOW;
        } else {
            logger.warn("Entity {} failed processing request {} after {} attempts", id, request, attempts, error);
            return RETRY_NEVER;
        }
    }

    @Override
    public <R extends Request<RS>, RS> CompletableFuture<RS> execute(String id, R request) {
        return getDispatcher().execute(id, request);
    }

    /**
     * Execute the request with given timeout. If the request has not completed until timeout expires, it will finish
     * with {@link java.util.concurrent.TimeoutException}.
     * <p>The runtime cannot interrupt a request that is already executing, it may still complete.</p>
     * @param id identity of an entity
     * @param request request to execute
     * @param timeout timeout for completion
     * @param unit unit of timeout
     * @param <R> type of request
     * @param <RS> type of response
     * @return CompletableFuture of the response.
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> executeWithTimeout(String id, R request, long timeout,
            TimeUnit unit) {
        return getDispatcher().executeWithTimeout(id, request, timeout, unit);
    }

    /**
     * Execute the request after specified delay. When the delay timer expires, the request would be put in the queue.
     * Used by entities themselves to trigger timed task as a reaction to other request.
     * @param id identity of an entity
     * @param request request to execute
     * @param delay amount of wait before request delivery
     * @param unit unit of delay
     * @param <R> type of request
     * @param <RS> type of response
     * @return CompletableFuture of the response
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> executeLater(String id, R request, long delay,
            TimeUnit unit) {
        return getDispatcher().executeLater(id, request, delay, unit);
    }

    /**
     * Remove entity from memory once all requests queued before this call complete. Next request will replay the
     * entity from the event log.
     * @param id identity of entity
     * @return future completing with true if an instance was removed
     */
    public CompletableFuture<Boolean> passivate(String id) {
        return getDispatcher().execute(id, Passivation.INSTANCE);
    }

    /**
     * Passivate entities that were not used for given time.
     * @param idleTime minimal idle time
     * @return number of entities scheduled for passivation
     */
    public int passivateIdle(Duration idleTime) {
        Collection<String> idle = invocationHandler.idleEntities(idleTime);
        idle.forEach(this::passivate);
        if (!idle.isEmpty()) {
            logger.debug("Passivating {} idle {} entities", idle.size(), getEntityName());
        }
        return idle.size();
    }

    /**
     * Whether no request for any entity of this runtime is queued or running.
     * @return true if the runtime has no work in progress
     */
    public boolean isIdle() {
        return dispatcher == null || dispatcher.isIdle();
    }

    private volatile Dispatcher dispatcher;

    /**
     * Lazily initialized {@link Dispatcher} to use for the callbacks.
     * @return the dispatcher of the runtime
     */
    protected Dispatcher getDispatcher() {
        if (dispatcher == null) {
            initialize();
        }
        return dispatcher;
    }

    // The only lock in entire implementation prevents double initialization of Dispatcher;
    private synchronized void initialize() {
        if (dispatcher == null) {
            this.dispatcher = new Dispatcher(new RuntimeDispatcherConfiguration());
        }
    }

    private static final class Passivation implements Request<Boolean> {
        static final Passivation INSTANCE = new Passivation();

        @Override
        public String toString() {
            return "Passivation";
        }
    }

    /**
     * Configuration of the dispatcher delegating to methods of this class. Actual execution flow is following:
     * <ol>
     *     <li>Entity instance is obtained via {@link EntityInvocationHandler}</li>
     *     <li>Request is invoked by passing control to {@link #invokeEntity(EventSourcedEntity, Request, BiConsumer)}</li>
     *     <li>The passed callback completes the invocation in the handler and then passes control back to
     *     dispatcher</li>
     * </ol>
     * If any exception happens during these steps, the response completes exceptionally with that exception.
     */
    protected class RuntimeDispatcherConfiguration implements DispatcherConfiguration {

        @Override
        public ExecutorService executorService() {
            return getExecutorService();
        }

        @Override
        public ScheduledExecutorService schedulerService() {
            return getScheduler();
        }

        @Override
        public String dispatcherName() {
            return getEntityName();
        }

        @Override
        public <R extends Request<RS>, RS> void execute(String entityId, R request, BiConsumer<RS, Throwable> callback) {
            if (request instanceof Passivation) {
                callback.accept((RS) Boolean.valueOf(invocationHandler.passivate(entityId)), null);
                return;
            }
            try {
                invokeWithCallback(entityId, request, callback);
            } catch (RuntimeException e) {
                logger.error("Entity with ID {} could not be recovered for request {}", entityId, request, e);
                callback.accept(null, e);
            }
        }

        private <R extends Request<RS>, RS> void invokeWithCallback(String entityId, R request,
                BiConsumer<RS, Throwable> callback) {
            invocationHandler.invokeWithCallback(entityId, (entity, handleCompletion) -> {
                try {
                    DispatchingEventSourcingRuntime.this.<RS, R>invokeEntity(entity, request, (rs, t) -> {
                        try {
                            Throwable unwrapped = Dispatcher.unwrapCompletionException(t);
                            handleCompletion.completed(rs, unwrapped);
                            callback.accept(rs, unwrapped);
                        } catch (Exception e) {
                            logger.error("Entity with ID {} failed on completion of request {} ", entityId, request,
                                e);
                            callback.accept(null, e);
                        }
                    });
                } catch (Exception e) {
                    logger.error("Entity with ID {} failed on invocation of request {}. Entity: {}", entityId,
                        request, entity, e);
                    try {
                        handleCompletion.completed(null, e);
                        callback.accept(null, e);
                    } catch (Exception ese) {
                        callback.accept(null, ese);
                    }
                }
            });
        }

        @Override
        public long retryDelay(String id, Request<?> request, Throwable t, int completedAttempts) {
            return DispatchingEventSourcingRuntime.this.retryDelay(id, request, t, completedAttempts);
        }
    }

}
