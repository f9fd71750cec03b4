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

/**
 * Pure definition of an aggregate: how commands are decided against state, and how events fold into state.
 * Both functions must be free of side effects, the runtime may call them repeatedly, e. g. when replaying the
 * history or retrying a command after concurrent modification.
 *
 * @param <S> type of state
 * @param <C> type of command payloads
 * @param <E> base type of events
 */
public interface Aggregate<S, C, E extends Event> {

    /**
     * State of an entity without any events.
     * @return initial state
     */
    S initialState();

    /**
     * Decide outcome of a command.
     * @param command command payload
     * @param state current state
     * @return events to persist, rejection, or ignore
     */
    Decision<E> decide(C command, S state);

    /**
     * Fold an event into state. Must accept any event the aggregate ever persisted.
     * @param event the event
     * @param state state before the event
     * @return state after the event
     */
    S apply(E event, S state);
}
