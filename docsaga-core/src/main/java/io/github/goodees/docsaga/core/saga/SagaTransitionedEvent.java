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

import java.util.Objects;

/**
 * Saga entered a state.
 * @param <S> type of saga state
 */
public class SagaTransitionedEvent<S> extends SagaEvent {
    private final S state;

    public SagaTransitionedEvent(Event header, S state, long originVersion) {
        super(header, originVersion);
        this.state = Objects.requireNonNull(state);
    }

    public S getState() {
        return state;
    }

    @Override
    public String toString() {
        return "SagaTransitioned{" + "entityId=" + entityId() + ", version=" + entityStateVersion() + ", state="
                + state + ", originVersion=" + getOriginVersion() + '}';
    }
}
