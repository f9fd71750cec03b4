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
import io.github.goodees.docsaga.core.Request;

import java.util.Objects;

/**
 * Request to change state of one aggregate.
 * @param <C> type of payload
 * @param <E> base type of events of the aggregate
 */
public final class Command<C, E extends Event> implements Request<CommandResult<E>> {
    private final String aggregateId;
    private final String correlationId;
    private final C payload;

    public Command(String aggregateId, String correlationId, C payload) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public C getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "Command{" + "aggregateId=" + aggregateId + ", correlationId=" + correlationId + ", payload="
                + payload + '}';
    }
}
