package io.github.goodees.docsaga.core.stream;

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
import io.github.goodees.docsaga.core.config.EngineConfiguration;
import io.github.goodees.docsaga.core.store.GlobalEventLog;
import io.github.goodees.docsaga.core.store.StreamedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Pull-based delivery of the global event log to named subscriptions. Each subscription reads the log from its own
 * offset and is served by at most one thread at a time. Rounds are triggered by {@link #appended()} and by periodic
 * polling.
 */
public class EventStream implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventStream.class);

    private final GlobalEventLog log;
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final EngineConfiguration configuration;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final List<Consumer<Event>> transientListeners = new CopyOnWriteArrayList<>();
    private volatile ScheduledFuture<?> polling;
    private volatile boolean closed;
    private final AtomicInteger activeRounds = new AtomicInteger();

    public EventStream(GlobalEventLog log, ExecutorService executor, ScheduledExecutorService scheduler,
            EngineConfiguration configuration) {
        this.log = log;
        this.executor = executor;
        this.scheduler = scheduler;
        this.configuration = configuration;
    }

    /**
     * Start periodic polling of the log.
     */
    public synchronized void start() {
        if (polling == null && !closed) {
            long interval = configuration.getPollInterval().toMillis();
            polling = scheduler.scheduleWithFixedDelay(this::appended, interval, interval, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Register a consumer that will receive all events after given offset.
     * @param name unique name of the subscription
     * @param afterOffset last offset the consumer already processed
     * @param consumer the consumer
     * @return the subscription
     */
    public Subscription subscribe(String name, long afterOffset, EventConsumer consumer) {
        Subscription subscription = new Subscription(name, afterOffset, consumer);
        if (subscriptions.putIfAbsent(name, subscription) != null) {
            throw new IllegalArgumentException("Subscription " + name + " already exists");
        }
        logger.info("Subscription {} starts after offset {}", name, afterOffset);
        subscription.signal();
        return subscription;
    }

    /**
     * Signal that new events were appended to the log.
     */
    public void appended() {
        subscriptions.values().forEach(Subscription::signal);
    }

    /**
     * Register a listener of events that are delivered but never persisted.
     * @param listener the listener
     */
    public void addTransientListener(Consumer<Event> listener) {
        transientListeners.add(listener);
    }

    /**
     * Deliver an event that is not part of the log, such as a rejection.
     * @param event the event
     */
    public void publishTransient(Event event) {
        for (Consumer<Event> listener : transientListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.error("Transient listener failed on {}", event, e);
            }
        }
    }

    /**
     * Stop delivery. Waits until consumers return from events they are processing, at most for the command timeout.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (polling != null) {
            polling.cancel(false);
        }
        subscriptions.clear();
        long deadline = System.nanoTime() + configuration.getCommandTimeout().toNanos();
        try {
            while (activeRounds.get() > 0) {
                if (System.nanoTime() > deadline) {
                    logger.warn("{} subscriptions still delivering after close", activeRounds.get());
                    return;
                }
                TimeUnit.MILLISECONDS.sleep(10);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Delivery state of one consumer.
     */
    public final class Subscription {
        private final String name;
        private final EventConsumer consumer;
        private final AtomicInteger signals = new AtomicInteger();
        private volatile long offset;

        Subscription(String name, long offset, EventConsumer consumer) {
            this.name = name;
            this.offset = offset;
            this.consumer = consumer;
        }

        public String getName() {
            return name;
        }

        /**
         * Offset of last event the consumer accepted.
         * @return last delivered offset
         */
        public long getOffset() {
            return offset;
        }

        public void cancel() {
            subscriptions.remove(name, this);
        }

        void signal() {
            if (signals.getAndIncrement() == 0 && !closed) {
                executor.submit(this::drain);
            }
        }

        private void drain() {
            activeRounds.incrementAndGet();
            try {
                while (true) {
                    int observed = signals.get();
                    round();
                    // signals that arrived during the round need another one
                    if (signals.compareAndSet(observed, 0)) {
                        return;
                    }
                }
            } finally {
                activeRounds.decrementAndGet();
            }
        }

        private void round() {
            if (closed || subscriptions.get(name) != this) {
                return;
            }
            try {
                List<StreamedEvent> batch;
                do {
                    batch = log.readAll(offset, configuration.getBatchSize());
                    for (StreamedEvent event : batch) {
                        if (closed) {
                            return;
                        }
                        logger.debug("Subscription {} delivering offset {}", name, event.getOffset());
                        consumer.accept(event);
                        offset = event.getOffset();
                    }
                } while (batch.size() == configuration.getBatchSize() && !closed);
            } catch (Exception e) {
                logger.error("Subscription {} failed after offset {}, will retry", name, offset, e);
            }
        }

        @Override
        public String toString() {
            return "Subscription{" + "name=" + name + ", offset=" + offset + '}';
        }
    }
}
