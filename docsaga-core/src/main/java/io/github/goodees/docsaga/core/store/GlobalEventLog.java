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

import java.util.List;

/**
 * Totally ordered view of all events appended to a store, across entities. Every appended event gets an offset, the
 * first one being 1. An offset is never visible before all smaller offsets are.
 */
public interface GlobalEventLog {

    /**
     * Read events appended after given offset.
     * @param afterOffset last offset the reader has seen, 0 to read from the beginning
     * @param limit maximal number of events to return
     * @return events in order of their offsets
     * @throws EventStoreException when the log cannot be read
     */
    List<StreamedEvent> readAll(long afterOffset, int limit) throws EventStoreException;

    /**
     * The offset of last appended event.
     * @return last offset, 0 when the log is empty
     * @throws EventStoreException when the log cannot be read
     */
    long lastOffset() throws EventStoreException;
}
