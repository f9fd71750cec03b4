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

import io.github.goodees.docsaga.core.AsyncEntity;
import io.github.goodees.docsaga.core.AsyncResult;
import io.github.goodees.docsaga.core.Event;
import io.github.goodees.docsaga.core.EventHeader;
import io.github.goodees.docsaga.core.Request;
import io.github.goodees.docsaga.core.aggregate.EntityLocator;
import io.github.goodees.docsaga.core.aggregate.EntityRef;
import io.github.goodees.docsaga.core.config.EngineConfiguration;
import io.github.goodees.docsaga.core.dispatch.Dispatcher;
import io.github.goodees.docsaga.core.matching.RequestHandler;
import io.github.goodees.docsaga.core.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Entity running one saga instance. Every transition is persisted to the saga journal before the effects of the
 * entered state are performed, so that effects interrupted by failure or restart can be performed again from the
 * persisted state.
 *
 * @param <E> base type of origin events
 * @param <D> type of saga data
 * @param <S> type of saga state
 */
public class SagaEntity<E extends Event, D, S> extends AsyncEntity {
    private static final Logger logger = LoggerFactory.getLogger(SagaEntity.class);

    private final SagaDefinition<E, D, S> definition;
    private final Class<E> eventType;
    private final SagaRuntime<E, D, S> runtime;
    private final EntityLocator locator;
    private final EngineConfiguration configuration;
    private final RequestHandler requestHandler;

    private boolean running;
    private String originId;
    private long lastOriginVersion;
    private String lastCorrelationId;
    private D data;
    private S state;

    public SagaEntity(String id, EventStore store, SagaDefinition<E, D, S> definition, Class<E> eventType,
            SagaRuntime<E, D, S> runtime, EntityLocator locator, EngineConfiguration configuration) {
        super(id, store);
        this.definition = definition;
        this.eventType = eventType;
        this.runtime = runtime;
        this.locator = locator;
        this.configuration = configuration;
        this.data = definition.initialData(id);
        this.requestHandler = RequestHandler.withDefaultFallback()
                .on(DeliverEvent.class, this::deliver)
                .on(Resume.class, this::resume)
                .on(GetStatus.class, r -> returning(status()))
                .build();
    }

    @Override
    protected <R extends Request<RS>, RS> CompletionStage<RS> execute(R request) {
        return requestHandler.handle(request);
    }

    private CompletionStage<SagaStatus> deliver(DeliverEvent request) {
        if (!eventType.isInstance(request.getEvent())) {
            return throwing(new IllegalArgumentException("Saga " + getIdentity() + " does not accept "
                    + request.getEvent()));
        }
        E event = eventType.cast(request.getEvent());
        if (isRedelivery(event)) {
            logger.debug("Saga {} already processed {} version {}", getIdentity(), event.getType(),
                event.entityStateVersion());
            return returning(status());
        }
        String correlationId = event.correlationId();
        long originVersion = event.entityStateVersion();
        if (running) {
            Optional<S> next = definition.react(event, data, state);
            if (!next.isPresent()) {
                logger.debug("Saga {} does not handle {} in state {}", getIdentity(), event.getType(), state);
                return returning(status());
            }
            return persistAndUpdate(transition(next.get(), originVersion, correlationId))
                    .thenCompose(e -> runEffects(false, correlationId, 0));
        }
        if (!definition.isStartingEvent(event)) {
            logger.debug("Saga {} is not running, ignoring {}", getIdentity(), event.getType());
            return returning(status());
        }
        Optional<S> first = definition.react(event, definition.initialData(getIdentity()), null);
        if (!first.isPresent()) {
            return returning(status());
        }
        logger.info("Saga {} started by {} version {}", getIdentity(), event.getType(), originVersion);
        return persistAllAndUpdate(
            new SagaStartedEvent(new EventHeader(this, correlationId), event.entityId(), originVersion),
            transition(first.get(), originVersion, correlationId))
                .thenCompose(e -> runEffects(false, correlationId, 0));
    }

    private boolean isRedelivery(E event) {
        return originId != null && originId.equals(event.entityId())
                && event.entityStateVersion() <= lastOriginVersion;
    }

    private CompletionStage<SagaStatus> resume(Resume request) {
        if (!running) {
            return returning(status());
        }
        if (request.getExpectedVersion() >= 0 && request.getExpectedVersion() != getStateVersion()) {
            logger.debug("Saga {} moved on since retry was scheduled, skipping", getIdentity());
            return returning(status());
        }
        logger.info("Saga {} resuming in state {}, attempt {}", getIdentity(), state, request.getAttempt());
        return runEffects(true, lastCorrelationId, request.getAttempt());
    }

    private SagaTransitionedEvent<S> transition(S next, long originVersion, String correlationId) {
        return new SagaTransitionedEvent<>(new EventHeader(this, correlationId), next, originVersion);
    }

    private CompletionStage<SagaStatus> runEffects(boolean recovering, String correlationId, int attempt) {
        SideEffects<S> effects = definition.effects(data, state, recovering);
        logger.debug("Saga {} entered {}: {}", getIdentity(), state, effects);
        AsyncResult<Void> performed = returning(null);
        for (AsyncResult.VoidSideEffect action : effects.getActions()) {
            performed = performed.thenTry(action);
        }
        for (SagaCommand command : effects.getCommands()) {
            performed = performed.thenCompose(v -> dispatch(command, correlationId));
        }
        return performed.handle((v, t) -> Dispatcher.unwrapCompletionException(t))
                .thenCompose(failure -> failure == null
                        ? completeTransition(effects, correlationId)
                        : scheduleRetry(failure, attempt));
    }

    private CompletionStage<Void> dispatch(SagaCommand command, String correlationId) {
        String target = command.getTargetId() != null ? command.getTargetId() : originId;
        EntityRef ref;
        try {
            ref = locator.resolve(command.getTargetType(), target);
        } catch (IllegalArgumentException e) {
            return throwing(e);
        }
        logger.debug("Saga {} dispatching {}", getIdentity(), command);
        return ref.submit(correlationId, command.getPayload(), configuration.getSagaDispatchTimeout())
                .thenApply(result -> {
                    if (result.isRejected()) {
                        logger.warn("Saga {} command {} was rejected with {}", getIdentity(), command,
                            result.getRejection());
                    }
                    return null;
                });
    }

    private CompletionStage<SagaStatus> completeTransition(SideEffects<S> effects, String correlationId) {
        switch (effects.getTransition()) {
            case NEXT:
                return persistAndUpdate(transition(effects.getNextState(), lastOriginVersion, correlationId))
                        .thenCompose(e -> runEffects(false, correlationId, 0));
            case STOP:
                return persistAndUpdate(new SagaStoppedEvent(new EventHeader(this, correlationId),
                    lastOriginVersion)).thenApply(e -> {
                        logger.info("Saga {} stopped in state {}", getIdentity(), state);
                        runtime.passivate(getIdentity());
                        return status();
                    });
            default:
                return returning(status());
        }
    }

    private CompletionStage<SagaStatus> scheduleRetry(Throwable failure, int attempt) {
        if (attempt < configuration.getSagaMaxRetries()) {
            long delay = configuration.getSagaRetryDelay().toMillis();
            logger.warn("Saga {} failed effects of state {}, retry {} in {} ms", getIdentity(), state, attempt + 1,
                delay, failure);
            runtime.executeLater(getIdentity(), new Resume(attempt + 1, getStateVersion()), delay,
                TimeUnit.MILLISECONDS).whenComplete((s, t) -> {
                    if (t != null) {
                        logger.error("Saga {} retry failed", getIdentity(), t);
                    }
                });
        } else {
            logger.error("Saga {} gave up effects of state {} after {} retries", getIdentity(), state, attempt,
                failure);
        }
        return returning(status());
    }

    @Override
    protected void updateState(Event event) {
        if (event instanceof SagaStartedEvent) {
            running = true;
            originId = ((SagaStartedEvent) event).getOriginId();
            data = definition.initialData(getIdentity());
            state = null;
        } else if (event instanceof SagaTransitionedEvent) {
            S entered = ((SagaTransitionedEvent<S>) event).getState();
            state = entered;
            data = definition.fold(data, entered);
        } else if (event instanceof SagaStoppedEvent) {
            running = false;
        } else {
            logger.error("Saga {} received unsupported event {}", getIdentity(), event);
            return;
        }
        lastOriginVersion = Math.max(lastOriginVersion, ((SagaEvent) event).getOriginVersion());
        lastCorrelationId = event.correlationId();
    }

    SagaStatus status() {
        return new SagaStatus(getIdentity(), state, running, getStateVersion());
    }

    D getData() {
        return data;
    }

    /**
     * Event of origin aggregate delivered to the saga.
     */
    public static final class DeliverEvent implements Request<SagaStatus> {
        private final Event event;

        public DeliverEvent(Event event) {
            this.event = event;
        }

        public Event getEvent() {
            return event;
        }

        @Override
        public String toString() {
            return "DeliverEvent{" + event + '}';
        }
    }

    /**
     * Perform effects of current state again, as when recovering.
     */
    public static final class Resume implements Request<SagaStatus> {
        private final int attempt;
        private final long expectedVersion;

        public Resume(int attempt, long expectedVersion) {
            this.attempt = attempt;
            this.expectedVersion = expectedVersion;
        }

        /**
         * Resume regardless of saga version, as after restart.
         * @return the request
         */
        public static Resume afterRestart() {
            return new Resume(0, -1);
        }

        public int getAttempt() {
            return attempt;
        }

        public long getExpectedVersion() {
            return expectedVersion;
        }

        @Override
        public String toString() {
            return "Resume{" + "attempt=" + attempt + ", expectedVersion=" + expectedVersion + '}';
        }
    }

    public static final class GetStatus implements Request<SagaStatus> {
        static final GetStatus INSTANCE = new GetStatus();

        @Override
        public String toString() {
            return "GetStatus";
        }
    }
}
