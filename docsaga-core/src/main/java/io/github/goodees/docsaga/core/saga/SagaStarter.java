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
import io.github.goodees.docsaga.core.store.StreamedEvent;
import io.github.goodees.docsaga.core.stream.EventConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Stream consumer that starts sagas on starting events and forwards later events to running sagas. The offset of
 * the stream advances only after the saga accepted the event, redelivered events are recognized by the saga.
 */
public class SagaStarter implements EventConsumer {
    private static final Logger logger = LoggerFactory.getLogger(SagaStarter.class);

    private final SagaRuntime<?, ?, ?> runtime;
    private final Duration deliveryTimeout;
    private final Set<String> active = ConcurrentHashMap.newKeySet();

    public SagaStarter(SagaRuntime<?, ?, ?> runtime, Duration deliveryTimeout) {
        this.runtime = runtime;
        this.deliveryTimeout = deliveryTimeout;
    }

    /**
     * Mark sagas as running, e. g. after they were recovered.
     * @param sagaIds identities of running sagas
     */
    public void activate(Collection<String> sagaIds) {
        active.addAll(sagaIds);
    }

    public boolean isActive(String sagaId) {
        return active.contains(sagaId);
    }

    @Override
    public void accept(StreamedEvent streamed) throws Exception {
        Event event = streamed.getEvent();
        if (!runtime.handles(event)) {
            return;
        }
        String sagaId = runtime.sagaId(event);
        if (!runtime.isStartingEvent(event) && !active.contains(sagaId)) {
            return;
        }
        logger.debug("Delivering offset {} to saga {}", streamed.getOffset(), sagaId);
        SagaStatus status = runtime.deliver(event).get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (status.isRunning()) {
            active.add(sagaId);
        } else {
            active.remove(sagaId);
        }
    }
}
