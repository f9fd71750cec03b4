package io.github.goodees.docsaga.document.event;

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
import io.github.goodees.docsaga.document.model.DocumentError;
import org.immutables.value.Value;

/**
 * Rejection of a command. Delivered to the caller and to correlation listeners, never persisted.
 */
@Value.Immutable
public interface ErrorEvent extends DocumentEvent {
    DocumentError getError();

    static Builder builder(Event header) {
        return new Builder().from(header);
    }

    class Builder extends ImmutableErrorEvent.Builder {

    }
}
