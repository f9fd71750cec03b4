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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class EntityRegistry implements EntityLocator {
    private final Map<String, AggregateRuntime<?, ?, ?>> runtimes = new ConcurrentHashMap<>();

    public EntityRegistry register(AggregateRuntime<?, ?, ?> runtime) {
        if (runtimes.putIfAbsent(runtime.getEntityName(), runtime) != null) {
            throw new IllegalArgumentException("Entity type " + runtime.getEntityName() + " already registered");
        }
        return this;
    }

    @Override
    public EntityRef resolve(String entityType, String identity) {
        AggregateRuntime<?, ?, ?> runtime = runtimes.get(entityType);
        if (runtime == null) {
            throw new IllegalArgumentException("Unknown entity type " + entityType);
        }
        return runtime.ref(identity);
    }
}
