package io.github.goodees.docsaga.core.stream;

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

import io.github.goodees.docsaga.core.store.StreamedEvent;

/**
 * Consumer of the global event stream. An exception stops delivery to the consumer, the event is delivered again
 * in next round.
 */
@FunctionalInterface
public interface EventConsumer {
    void accept(StreamedEvent event) throws Exception;
}
