package io.github.goodees.docsaga.core;

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
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Working memory keeping every active entity in a map, along with the time it was last looked up.
 * @param <E> type of entity
 */
public class MapBasedWorkingMemory<E extends EventSourcedEntity> implements EntityInvocationHandler.WorkingMemory<E> {
    private final ConcurrentMap<String, E> map = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> lastAccess = new ConcurrentHashMap<>();

    @Override
    public E lookup(String id, Function<String, E> instantiator) {
        E entity = map.computeIfAbsent(id, instantiator);
        lastAccess.put(id, System.nanoTime());
        return entity;
    }

    @Override
    public E remove(String id) {
        lastAccess.remove(id);
        return map.remove(id);
    }

    @Override
    public Collection<String> idleEntities(Duration idleTime) {
        long threshold = System.nanoTime() - idleTime.toNanos();
        return lastAccess.entrySet().stream()
                .filter(e -> e.getValue() - threshold <= 0)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
