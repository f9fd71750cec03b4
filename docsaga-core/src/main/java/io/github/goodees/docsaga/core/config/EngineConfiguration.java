package io.github.goodees.docsaga.core.config;

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

import java.time.Duration;

/**
 * Timing and sizing settings of the engine.
 */
public interface EngineConfiguration {

    EngineConfiguration DEFAULT_CONFIG = new DefaultEngineConfiguration();

    /**
     * Maximal time a caller waits for a command to be processed by an aggregate.
     */
    Duration getCommandTimeout();

    /**
     * Maximal time a saga waits for a command it dispatched.
     */
    Duration getSagaDispatchTimeout();

    /**
     * Delay before a saga retries effects that failed.
     */
    Duration getSagaRetryDelay();

    int getSagaMaxRetries();

    /**
     * Number of attempts of a command that fails on concurrent modification of the entity.
     */
    int getOptimisticLockAttempts();

    Duration getCorrelationTimeout();

    Duration getPollInterval();

    int getBatchSize();

    /**
     * Time after which an entity that received no request is removed from memory.
     */
    Duration getIdleTimeout();

    int getPoolSize();
}
