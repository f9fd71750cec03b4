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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import io.github.goodees.docsaga.core.Event;
import io.github.goodees.docsaga.core.EventType;
import org.immutables.value.Value;

/**
 * Base interface for entity events using <a href="http://immutables.github.io">Immutables library</a>.
 * An entity using this approach for event serialization defines its base interface of events extending this one.
 * <p><strong>All events for an entity need to be defined in same package!</strong>
 * <p>The package must be annotated with {@link ImmutableEvent.Style} in its {@code package-info.java}. Events are
 * created from a header through generated builder's {@code from(Event)} method.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonTypeIdResolver(ImmutableEventTypeResolver.class)
// allow for future changes in an event
@JsonIgnoreProperties(ignoreUnknown = true)
// Put key values at the front
@JsonPropertyOrder({ "entityId", "entityStateVersion", "timestamp", "correlationId" })
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface ImmutableEvent extends Event {

    @Override
    @Value.Auxiliary
    @JsonIgnore
    // type property is written by resolver, and requires default naming scheme
    default String getType() {
        return EventType.fromClassStripping(getClass(), "Immutable", "Event");
    }

    /**
     * Generation style of an event package. Implementations stay package private behind their interface,
     * optional attributes accept null and collection attributes get singular adders.
     */
    @Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE,
            overshadowImplementation = true,
            get = { "get*", "is*" },
            optionalAcceptNullable = true,
            depluralize = true,
            jdkOnly = true)
    @JsonSerialize
    @interface Style {
    }
}
