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

import java.time.Instant;
import java.util.Objects;

/**
 * Plain carrier of event metadata. Serves as base class for hand written events, and as the source of metadata for
 * generated event builders.
 */
public class EventHeader implements Event {
    private final String entityId;
    private final long entityStateVersion;
    private final Instant timestamp;
    private final String correlationId;

    public EventHeader(String entityId, long entityStateVersion, Instant timestamp, String correlationId) {
        this.entityId = Objects.requireNonNull(entityId, "entityId");
        this.entityStateVersion = entityStateVersion;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
    }

    /**
     * Header for next event of the entity.
     * @param source entity producing the event
     * @param correlationId correlation id of request being executed
     */
    public EventHeader(EventSourcedEntity source, String correlationId) {
        this(source.getIdentity(), source.nextEventVersion(), Instant.now(), correlationId);
    }

    protected EventHeader(Event copy) {
        this(copy.entityId(), copy.entityStateVersion(), copy.getTimestamp(), copy.correlationId());
    }

    /**
     * Header that describes the current state of entity without advancing its version. Used for events that are
     * delivered but never persisted.
     * @param source the entity
     * @param correlationId correlation id of request being executed
     * @return header carrying current version of the entity
     */
    public static EventHeader currentState(EventSourcedEntity source, String correlationId) {
        return new EventHeader(source.getIdentity(), source.getStateVersion(), Instant.now(), correlationId);
    }

    @Override
    public String entityId() {
        return entityId;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public long entityStateVersion() {
        return entityStateVersion;
    }

    @Override
    public String correlationId() {
        return correlationId;
    }

    @Override
    public String toString() {
        return getType() + "{" + "entityId=" + entityId + ", version=" + entityStateVersion + ", timestamp="
                + timestamp + ", correlationId=" + correlationId + '}';
    }
}
