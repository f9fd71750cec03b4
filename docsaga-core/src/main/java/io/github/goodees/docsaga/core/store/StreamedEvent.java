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

import java.util.Objects;

/**
 * An event along with its position in the {@link GlobalEventLog}.
 */
public final class StreamedEvent {
    private final long offset;
    private final Event event;

    public StreamedEvent(long offset, Event event) {
        this.offset = offset;
        this.event = Objects.requireNonNull(event);
    }

    public long getOffset() {
        return offset;
    }

    public Event getEvent() {
        return event;
    }

    @Override
    public String toString() {
        return "StreamedEvent{" + "offset=" + offset + ", event=" + event + '}';
    }
}
