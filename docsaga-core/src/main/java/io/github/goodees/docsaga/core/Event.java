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

/**
 * Immutable fact about the business domain that became true.
 *
 * <p>Every event sourced entity class defines its own set of events. The methods of this interface define metadata
 * that is stored next to the journaled payload to enable querying, ordering and deserialization.</p>
 *
 * <p>Support for events based on <a href="http://immutables.github.io">Immutables</a> is in package
 * {@link io.github.goodees.docsaga.core.immutables}.</p>
 */
public interface Event {
    /**
     * The type of event. For every entity class this must uniquely identify the event to be created.
     * @return textual description of the type of event, uses class name by default, stripped from suffix Event, or
     *         prefix Immutable
     */
    default String getType() {
        return EventType.defaultTypeName(getClass());
    }

    /**
     * The id of the entity this event relates to.
     * @return the entity id
     * @see EventSourcedEntity#getIdentity()
     */
    String entityId();

    /**
     * The time when an event occurred.
     * @return the instant of event creation
     */
    Instant getTimestamp();

    /**
     * The version of the entity expected after this event is applied. Versions of one entity form gapless ascending
     * sequence starting at 1.
     * @return the version on an entity
     */
    long entityStateVersion();

    /**
     * Token linking the event to the command that caused it.
     * @return correlation id of the originating command
     */
    String correlationId();

    /**
     * Creates an event out of metadata supplied by the runtime. Domain logic returns these factories, so that
     * versions and timestamps are only assigned when the events are about to be persisted.
     * @param <T> type of event created
     */
    @FunctionalInterface
    interface FromHeader<T extends Event> {
        T from(Event header);
    }

}
