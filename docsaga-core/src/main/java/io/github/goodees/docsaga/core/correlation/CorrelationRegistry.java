package io.github.goodees.docsaga.core.correlation;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Lets callers wait for events observed after their registration. Callers subscribe before submitting a command
 * and wait for the events it causes, typically matched by correlation id.
 */
public class CorrelationRegistry implements Consumer<Event> {
    private static final Logger logger = LoggerFactory.getLogger(CorrelationRegistry.class);

    private final Set<Awaiter> awaiters = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService scheduler;
    private final Duration defaultTimeout;

    public CorrelationRegistry(ScheduledExecutorService scheduler, Duration defaultTimeout) {
        this.scheduler = scheduler;
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Subscribe for events with default timeout.
     * @param predicate events to match
     * @param count number of events to wait for
     * @return awaiter of the events
     */
    public Awaiter subscribe(Predicate<Event> predicate, int count) {
        return subscribe(predicate, count, defaultTimeout);
    }

    /**
     * Subscribe for events.
     * @param predicate events to match
     * @param count number of events to wait for
     * @param timeout time after which the awaiter fails with {@link TimeoutException}
     * @return awaiter of the events
     */
    public Awaiter subscribe(Predicate<Event> predicate, int count, Duration timeout) {
        if (count < 1) {
            throw new IllegalArgumentException("Count must be positive, was " + count);
        }
        Awaiter awaiter = new Awaiter(predicate, count);
        awaiters.add(awaiter);
        ScheduledFuture<?> timer = scheduler.schedule(awaiter::timeout, timeout.toMillis(), TimeUnit.MILLISECONDS);
        awaiter.future.whenComplete((r, t) -> {
            timer.cancel(false);
            awaiters.remove(awaiter);
        });
        return awaiter;
    }

    /**
     * Predicate matching events carrying given correlation id.
     * @param correlationId the correlation id
     * @return the predicate
     */
    public static Predicate<Event> correlatedWith(String correlationId) {
        return e -> correlationId.equals(e.correlationId());
    }

    @Override
    public void accept(Event event) {
        for (Awaiter awaiter : awaiters) {
            awaiter.offer(event);
        }
    }

    int pendingCount() {
        return awaiters.size();
    }

    /**
     * Pending subscription. Resolves exactly once: with matched events, by timeout or by cancellation.
     */
    public final class Awaiter implements AutoCloseable {
        private final Predicate<Event> predicate;
        private final int count;
        private final List<Event> matched = new ArrayList<>();
        private final CompletableFuture<List<Event>> future = new CompletableFuture<>();

        Awaiter(Predicate<Event> predicate, int count) {
            this.predicate = predicate;
            this.count = count;
        }

        synchronized void offer(Event event) {
            if (future.isDone() || !predicate.test(event)) {
                return;
            }
            matched.add(event);
            if (matched.size() == count) {
                future.complete(Collections.unmodifiableList(new ArrayList<>(matched)));
            }
        }

        void timeout() {
            if (future.completeExceptionally(new TimeoutException("No matching event observed in time"))) {
                logger.debug("Awaiter timed out after matching {} of {} events", matched.size(), count);
            }
        }

        public CompletableFuture<List<Event>> future() {
            return future;
        }

        /**
         * Block until the events are observed.
         * @return matched events, in order of observation
         * @throws TimeoutException when the subscription timed out
         * @throws CancellationException when the subscription was cancelled
         * @throws InterruptedException when waiting thread is interrupted
         */
        public List<Event> await() throws TimeoutException, InterruptedException {
            try {
                return future.get();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof TimeoutException) {
                    throw (TimeoutException) e.getCause();
                }
                throw new IllegalStateException("Awaiter failed", e.getCause());
            }
        }

        public void cancel() {
            future.completeExceptionally(new CancellationException("Awaiter cancelled"));
        }

        @Override
        public void close() {
            cancel();
        }
    }
}
