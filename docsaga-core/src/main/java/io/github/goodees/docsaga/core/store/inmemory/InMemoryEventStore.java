package io.github.goodees.docsaga.core.store.inmemory;

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
import io.github.goodees.docsaga.core.store.EventLog;
import io.github.goodees.docsaga.core.store.EventStore;
import io.github.goodees.docsaga.core.store.EventStoreException;
import io.github.goodees.docsaga.core.store.GlobalEventLog;
import io.github.goodees.docsaga.core.store.StreamedEvent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;


/**
 * Event store keeping the journal in memory. Appends are serialized on the store, so that the global offsets are
 * assigned in the order in which the appends become visible.
 */
public class InMemoryEventStore implements EventStore, EventLog, GlobalEventLog {
    private final ConcurrentMap<String, List<Event>> storage = new ConcurrentHashMap<>();
    private final List<StreamedEvent> globalLog = new ArrayList<>();

    @Override
    public long lastVersion(String entityId) {
        List<Event> entityLog = entityLog(entityId);
        synchronized (entityLog) {
            return entityLog.isEmpty() ? 0 : entityLog.get(entityLog.size() - 1).entityStateVersion();
        }
    }

    @Override
    public void persist(Event event) throws EventStoreException {
        persist(Collections.singletonList(event));
    }

    @Override
    public void persist(Event... events) throws EventStoreException {
        persist(Arrays.asList(events));
    }

    @Override
    public synchronized void persist(Iterable<? extends Event> events) throws EventStoreException {
        List<Event> batch = new ArrayList<>();
        String entityId = null;
        long expected = 0;
        for (Event event : events) {
            if (entityId == null) {
                entityId = event.entityId();
                long lastVersion = lastVersion(entityId);
                if (event.entityStateVersion() <= lastVersion) {
                    throw EventStoreException.versionConflict(entityId, lastVersion, event.entityStateVersion() - 1);
                }
                expected = lastVersion + 1;
            } else if (!entityId.equals(event.entityId())) {
                throw EventStoreException.mixedEntities(entityId, event);
            }
            if (event.entityStateVersion() != expected) {
                throw EventStoreException.versionGap(entityId, expected, event);
            }
            expected++;
            batch.add(event);
        }
        if (batch.isEmpty()) {
            return;
        }
        entityLog(entityId).addAll(batch);
        for (Event event : batch) {
            globalLog.add(new StreamedEvent(globalLog.size() + 1, event));
        }
    }

    private List<Event> entityLog(String entityId) {
        return storage.computeIfAbsent(entityId, (i) -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public synchronized List<StreamedEvent> readAll(long afterOffset, int limit) {
        int from = (int) Math.min(Math.max(afterOffset, 0), globalLog.size());
        int to = (int) Math.min((long) from + limit, globalLog.size());
        return new ArrayList<>(globalLog.subList(from, to));
    }

    @Override
    public synchronized long lastOffset() {
        return globalLog.size();
    }

    @Override
    public Replay<Event> readEvents(String entityId, long afterVersion) {
        return new Replay<Event>() {
            final List<Event> filteredEvents;
            boolean stop = false;

            {
                List<Event> events = entityLog(entityId);
                // synchronized list must be locked manually while iterating
                synchronized (events) {
                    filteredEvents = events.stream().filter(e -> e.entityStateVersion() > afterVersion)
                            .collect(java.util.stream.Collectors.toList());
                }
            }

            @Override
            public void foreach(Consumer<? super Event> consumer) {
                for (Event event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    consumer.accept(event);
                }
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super Event, R> reducer) {
                R result = initial;
                for (Event event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    result = reducer.apply(result, event);
                }
                return result;
            }

            @Override
            public void stop() {
                stop = true;
            }

            @Override
            public void close() {
            }
        };
    }
}
