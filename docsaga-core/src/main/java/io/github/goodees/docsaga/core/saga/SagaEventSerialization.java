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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.goodees.docsaga.core.Event;
import io.github.goodees.docsaga.core.EventHeader;
import io.github.goodees.docsaga.core.immutables.JacksonEventSerialization;
import io.github.goodees.docsaga.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;

/**
 * JSON serialization of saga journal. The state is written through the state class, so that its polymorphic type
 * information is kept.
 * @param <S> type of saga state
 */
public class SagaEventSerialization<S> implements Serialization<Event> {
    private static final Logger logger = LoggerFactory.getLogger(SagaEventSerialization.class);

    private final Class<S> stateType;
    private final ObjectMapper mapper;

    public SagaEventSerialization(Class<S> stateType) {
        this(stateType, JacksonEventSerialization.createMapper());
    }

    public SagaEventSerialization(Class<S> stateType, ObjectMapper mapper) {
        this.stateType = stateType;
        this.mapper = mapper;
    }

    @Override
    public int payloadVersion(Event object) {
        return 1;
    }

    @Override
    public String serialize(Event event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", event.getType());
        node.put("entityId", event.entityId());
        node.put("entityStateVersion", event.entityStateVersion());
        node.put("timestamp", event.getTimestamp().toString());
        node.put("correlationId", event.correlationId());
        SagaEvent sagaEvent = (SagaEvent) event;
        node.put("originVersion", sagaEvent.getOriginVersion());
        try {
            if (event instanceof SagaStartedEvent) {
                node.put("originId", ((SagaStartedEvent) event).getOriginId());
            } else if (event instanceof SagaTransitionedEvent) {
                Object state = ((SagaTransitionedEvent<?>) event).getState();
                node.set("state", mapper.readTree(mapper.writerFor(stateType).writeValueAsString(state)));
            }
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + event, e);
        }
    }

    @Override
    public Event deserialize(int payloadVersion, String payload, String type) {
        try {
            JsonNode node = mapper.readTree(payload);
            EventHeader header = new EventHeader(node.get("entityId").asText(),
                node.get("entityStateVersion").asLong(), Instant.parse(node.get("timestamp").asText()),
                node.get("correlationId").asText());
            long originVersion = node.get("originVersion").asLong();
            String eventType = type != null ? type : node.get("type").asText();
            switch (eventType) {
                case "SagaStarted":
                    return new SagaStartedEvent(header, node.get("originId").asText(), originVersion);
                case "SagaTransitioned":
                    S state = mapper.readerFor(stateType).readValue(node.get("state"));
                    return new SagaTransitionedEvent<>(header, state, originVersion);
                case "SagaStopped":
                    return new SagaStoppedEvent(header, originVersion);
                default:
                    logger.error("Unknown saga event type {}", eventType);
                    return null;
            }
        } catch (IOException | RuntimeException e) {
            logger.error("Cannot deserialize saga event of type {}", type, e);
            return null;
        }
    }

    @Override
    public Event toSerializable(Object o) {
        return o instanceof SagaEvent ? (Event) o : null;
    }
}
