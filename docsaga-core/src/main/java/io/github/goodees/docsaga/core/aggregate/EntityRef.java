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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Addressable handle of one aggregate instance.
 */
public interface EntityRef {

    String getIdentity();

    /**
     * Submit a command payload with default timeout.
     * @param correlationId correlation id of the command
     * @param payload command payload
     * @return future of the result
     */
    CompletableFuture<CommandResult<? extends Event>> submit(String correlationId, Object payload);

    CompletableFuture<CommandResult<? extends Event>> submit(String correlationId, Object payload,
            Duration timeout);
}
