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

/**
 * Routes commands to aggregates by entity type and identity.
 */
@FunctionalInterface
public interface EntityLocator {
    /**
     * Resolve handle of an aggregate.
     * @param entityType name of the entity type
     * @param identity identity of the aggregate
     * @return handle of the aggregate
     * @throws IllegalArgumentException when the entity type is not known
     */
    EntityRef resolve(String entityType, String identity);
}
