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

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Response of an aggregate to a command.
 * @param <E> base type of events
 */
public final class CommandResult<E extends Event> {

    public enum Outcome {
        PERSISTED, REJECTED, IGNORED
    }

    private final Outcome outcome;
    private final List<E> events;
    private final E rejection;

    private CommandResult(Outcome outcome, List<E> events, E rejection) {
        this.outcome = outcome;
        this.events = events;
        this.rejection = rejection;
    }

    public static <E extends Event> CommandResult<E> persisted(List<E> events) {
        return new CommandResult<>(Outcome.PERSISTED, Collections.unmodifiableList(events), null);
    }

    public static <E extends Event> CommandResult<E> rejected(E errorEvent) {
        return new CommandResult<>(Outcome.REJECTED, Collections.emptyList(), errorEvent);
    }

    public static <E extends Event> CommandResult<E> ignored() {
        return new CommandResult<>(Outcome.IGNORED, Collections.emptyList(), null);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isPersisted() {
        return outcome == Outcome.PERSISTED;
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECTED;
    }

    /**
     * Events appended by the command, empty unless persisted.
     * @return persisted events
     */
    public List<E> getEvents() {
        return events;
    }

    public E getRejection() {
        return rejection;
    }

    /**
     * The event the command resulted in: last persisted event, or the rejection.
     * @return resulting event, empty when the command was ignored
     */
    public Optional<E> getResultingEvent() {
        if (isRejected()) {
            return Optional.of(rejection);
        }
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }

    @Override
    public String toString() {
        return "CommandResult{" + outcome + ", events=" + events + (rejection != null ? ", rejection=" + rejection
                : "") + '}';
    }
}
