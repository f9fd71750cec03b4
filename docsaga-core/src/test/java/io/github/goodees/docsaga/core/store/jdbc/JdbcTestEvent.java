package io.github.goodees.docsaga.core.store.jdbc;

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

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

public class JdbcTestEvent implements Event {
    private final String entityId;
    private final long version;
    private final Instant timestamp;
    private final String correlationId;
    private final int payload;

    public JdbcTestEvent(String entityId, long version, Instant timestamp, String correlationId, int payload) {
        this.entityId = entityId;
        this.version = version;
        this.timestamp = timestamp;
        this.correlationId = correlationId;
        this.payload = payload;
    }

    public JdbcTestEvent(String entityId, long version, int payload) {
        // database timestamps keep millis at most
        this(entityId, version, Instant.now().truncatedTo(ChronoUnit.MILLIS), "cid-" + version, payload);
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
        return version;
    }

    @Override
    public String correlationId() {
        return correlationId;
    }

    public int getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        JdbcTestEvent that = (JdbcTestEvent) o;
        return version == that.version && payload == that.payload && entityId.equals(that.entityId)
                && timestamp.equals(that.timestamp) && correlationId.equals(that.correlationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, version);
    }

    @Override
    public String toString() {
        return "JdbcTestEvent{" + entityId + "@" + version + ", payload=" + payload + '}';
    }
}
