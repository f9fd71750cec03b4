package io.github.goodees.docsaga.core.store;

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

/**
 * Failure of appending events to or reading them from a store. The {@link Fault} tells whether repeating the
 * command against freshly replayed state can succeed.
 */
public class EventStoreException extends Exception {

    public enum Fault {
        /**
         * Another writer appended to the entity after its state was read.
         */
        VERSION_CONFLICT,
        /**
         * The store did not complete the read or the transaction.
         */
        STORAGE,
        /**
         * Events handed to the store break its contract, or the entity hid a store failure.
         */
        MISUSE
    }

    private final Fault fault;
    private final String entityId;

    private EventStoreException(Fault fault, String entityId, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
        this.entityId = entityId;
    }

    public Fault getFault() {
        return fault;
    }

    /**
     * @return identity of the entity whose events failed, null for reads spanning entities
     */
    public String getEntityId() {
        return entityId;
    }

    public boolean isVersionConflict() {
        return fault == Fault.VERSION_CONFLICT;
    }

    public static EventStoreException versionConflict(String entityId, long storedVersion, long expectedVersion) {
        return new EventStoreException(Fault.VERSION_CONFLICT, entityId, "Entity " + entityId + " is at version "
                + storedVersion + ", append expected version " + expectedVersion, null);
    }

    public static EventStoreException versionConflict(String entityId, long expectedVersion) {
        return new EventStoreException(Fault.VERSION_CONFLICT, entityId, "Entity " + entityId
                + " moved past version " + expectedVersion + " during append", null);
    }

    public static EventStoreException storeFailed(String entityId, Throwable cause) {
        return new EventStoreException(Fault.STORAGE, entityId, "Cannot append events of entity " + entityId + ": "
                + cause.getMessage(), cause);
    }

    public static EventStoreException readFailed(String what, Throwable cause) {
        return new EventStoreException(Fault.STORAGE, null, "Cannot read " + what + ": " + cause.getMessage(), cause);
    }

    public static EventStoreException mixedEntities(String entityId, Event other) {
        return new EventStoreException(Fault.MISUSE, entityId, "Single append cannot mix entity " + entityId
                + " with " + other.entityId(), null);
    }

    public static EventStoreException versionGap(String entityId, long expectedVersion, Event event) {
        return new EventStoreException(Fault.MISUSE, entityId, "Entity " + entityId + " expected event version "
                + expectedVersion + ", got " + event.entityStateVersion(), null);
    }

    public static EventStoreException unsupported(Event event) {
        return new EventStoreException(Fault.MISUSE, event.entityId(), "Store cannot serialize " + event, null);
    }

    public static EventStoreException suppressed(String entityId, Throwable cause) {
        return new EventStoreException(Fault.MISUSE, entityId, "Entity " + entityId
                + " swallowed a failure of the event store", cause);
    }
}
