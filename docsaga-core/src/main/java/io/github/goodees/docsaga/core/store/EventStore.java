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
 * Append-only storage of events. Events of one entity are appended with optimistic concurrency: the version of the
 * first event must directly follow the last stored version of the entity, and versions within a batch must be
 * consecutive.
 */
public interface EventStore {

    /**
     * Persist event synchronously. Callers may invoke side effects when this method completes without exception.
     * @param event event to store
     * @throws EventStoreException when storing fails, or if the entity was out of date
     */
    void persist(Event event) throws EventStoreException;

    /**
     * Persist events of single entity atomically.
     * @param events event to store
     * @throws EventStoreException when storing fails, or if the entity was out of date
     */
    void persist(Event... events) throws EventStoreException;

    /**
     * Persist events of single entity atomically.
     * @param events event to store
     * @throws EventStoreException when storing fails, or if the entity was out of date
     */
    void persist(Iterable<? extends Event> events) throws EventStoreException;
}
