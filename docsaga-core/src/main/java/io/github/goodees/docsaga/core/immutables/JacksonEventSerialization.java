package io.github.goodees.docsaga.core.immutables;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.goodees.docsaga.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON serialization of all events sharing a common base type. The base type carries Jackson type information, as
 * {@link ImmutableEvent} does.
 * @param <E> base type of events
 */
public class JacksonEventSerialization<E> implements Serialization<E> {
    private static final Logger logger = LoggerFactory.getLogger(JacksonEventSerialization.class);

    private final Class<E> baseType;
    private final ObjectMapper mapper;

    public JacksonEventSerialization(Class<E> baseType) {
        this(baseType, createMapper());
    }

    public JacksonEventSerialization(Class<E> baseType, ObjectMapper mapper) {
        this.baseType = baseType;
        this.mapper = mapper;
    }

    /**
     * Object mapper with java.time and Optional support, writing dates as ISO strings.
     * @return new mapper
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    protected ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public int payloadVersion(E object) {
        return 1;
    }

    @Override
    public String serialize(E object) {
        try {
            return mapper.writerFor(baseType).writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object, e);
        }
    }

    @Override
    public E deserialize(int payloadVersion, String payload, String type) {
        try {
            return mapper.readValue(payload, baseType);
        } catch (JsonProcessingException | RuntimeException e) {
            logger.error("Cannot deserialize event of type {} and payload version {}", type, payloadVersion, e);
            return null;
        }
    }

    @Override
    public E toSerializable(Object o) {
        return baseType.isInstance(o) ? baseType.cast(o) : null;
    }
}
