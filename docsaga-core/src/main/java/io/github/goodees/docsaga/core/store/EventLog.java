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

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Per-entity view of a journal. Runtimes replay entities from it, and ask it for the last stored version to find out
 * whether an entity held in memory missed a write of another node.
 */
public interface EventLog {
    /**
     * Open a replay of the events of one entity.
     * @param entityId the id of an entity
     * @param afterVersion only events with greater version are replayed, 0 replays whole history
     * @return replay of the events in version order
     */
    Replay<? extends Event> readEvents(String entityId, long afterVersion);

    /**
     * Version of the newest stored event of an entity.
     * @param entityId the id of an entity
     * @return the version, 0 when the entity has no events
     * @throws EventStoreException when the journal cannot be read
     */
    long lastVersion(String entityId) throws EventStoreException;

    /**
     * Single pass over the events of an entity. Implementations may stream from an open cursor, so only one of
     * {@code foreach}, {@code reduce} and {@code toList} may be called, once.
     * @param <E> type of events
     */
    interface Replay<E extends Event> extends AutoCloseable {
        /**
         * Pass every event to the consumer, until the consumer calls {@link #stop()}.
         * @param consumer receiver of events
         */
        void foreach(Consumer<? super E> consumer);

        /**
         * Fold the events into a result, until the reducer calls {@link #stop()}.
         * @param initial initial value
         * @param reducer the reducer function
         * @param <R> type of result
         * @return the folded value
         */
        <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer);

        default List<E> toList() {
            List<E> result = new ArrayList<>();
            foreach(result::add);
            return result;
        }

        void stop();

        // releases the cursor, never throws
        @Override
        void close();
    }
}
