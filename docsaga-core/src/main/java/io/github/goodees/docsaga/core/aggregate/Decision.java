package io.github.goodees.docsaga.core.aggregate;

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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link Aggregate#decide(Object, Object)}. Events are described by factories, the runtime assigns
 * their headers when persisting.
 * @param <E> base type of events
 */
public final class Decision<E extends Event> {

    public enum Kind {
        PERSIST, REJECT, IGNORE
    }

    private static final Decision<?> IGNORE = new Decision<>(Kind.IGNORE, Collections.emptyList(), null);

    private final Kind kind;
    private final List<Event.FromHeader<? extends E>> events;
    private final Event.FromHeader<? extends E> rejection;

    private Decision(Kind kind, List<Event.FromHeader<? extends E>> events, Event.FromHeader<? extends E> rejection) {
        this.kind = kind;
        this.events = events;
        this.rejection = rejection;
    }

    @SafeVarargs
    public static <E extends Event> Decision<E> persist(Event.FromHeader<? extends E>... events) {
        if (events.length == 0) {
            throw new IllegalArgumentException("At least one event must be persisted");
        }
        return new Decision<>(Kind.PERSIST, Collections.unmodifiableList(Arrays.asList(events)), null);
    }

    public static <E extends Event> Decision<E> reject(Event.FromHeader<? extends E> errorEvent) {
        return new Decision<>(Kind.REJECT, Collections.emptyList(), Objects.requireNonNull(errorEvent));
    }

    public static <E extends Event> Decision<E> ignore() {
        return (Decision<E>) IGNORE;
    }

    public Kind getKind() {
        return kind;
    }

    public List<Event.FromHeader<? extends E>> getEvents() {
        return events;
    }

    public Event.FromHeader<? extends E> getRejection() {
        return rejection;
    }

    @Override
    public String toString() {
        return "Decision{" + kind + (kind == Kind.PERSIST ? ", events=" + events.size() : "") + '}';
    }
}
