package io.github.goodees.docsaga.core.saga;

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

import java.util.Optional;

/**
 * Pure definition of a saga reacting to events of an origin aggregate. For every event the saga receives, the
 * runtime calls {@link #react(Event, Object, Object)}; a new state is persisted, folded into saga data by
 * {@link #fold(Object, Object)}, and then {@link #effects(Object, Object, boolean)} decides about commands to
 * dispatch and the next transition.
 *
 * @param <E> base type of origin events
 * @param <D> type of saga data
 * @param <S> type of saga state
 */
public interface SagaDefinition<E extends Event, D, S> {

    /**
     * Data of a saga before its first transition.
     * @param sagaId identity of the saga
     * @return initial data
     */
    D initialData(String sagaId);

    /**
     * Whether the event starts a saga that is not running.
     * @param event origin event
     * @return true for starting events
     */
    boolean isStartingEvent(E event);

    /**
     * Identity of the saga an event belongs to. Identity of origin entity by default.
     * @param event origin event
     * @return saga identity
     */
    default String sagaId(E event) {
        return event.entityId();
    }

    /**
     * Compute next state on an event.
     * @param event the event
     * @param data current saga data
     * @param currentState current state, {@code null} when the saga did not start yet
     * @return the new state, or empty when the event is not handled in current state
     */
    Optional<S> react(E event, D data, S currentState);

    /**
     * Side effects of entering a state. Called every time the state is entered, and again when the saga recovers in
     * that state. Implementations use {@code recovering} to avoid repeating effects that must not be repeated.
     * @param data saga data
     * @param state entered state
     * @param recovering true when the effects are run again after restart or failure
     * @return commands, actions and transition
     */
    SideEffects<S> effects(D data, S state, boolean recovering);

    /**
     * Update saga data on entering a state.
     * @param data current data
     * @param state entered state
     * @return new data
     */
    D fold(D data, S state);
}
