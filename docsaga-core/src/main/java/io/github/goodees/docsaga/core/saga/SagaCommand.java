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

import java.util.Objects;

/**
 * Command a saga dispatches to an aggregate.
 */
public final class SagaCommand {
    private final String targetType;
    private final String targetId;
    private final Object payload;

    private SagaCommand(String targetType, String targetId, Object payload) {
        this.targetType = Objects.requireNonNull(targetType);
        this.targetId = targetId;
        this.payload = Objects.requireNonNull(payload);
    }

    /**
     * Command for the aggregate whose events started the saga.
     * @param targetType entity type of origin
     * @param payload command payload
     * @return the command
     */
    public static SagaCommand toOrigin(String targetType, Object payload) {
        return new SagaCommand(targetType, null, payload);
    }

    public static SagaCommand to(String targetType, String targetId, Object payload) {
        return new SagaCommand(targetType, Objects.requireNonNull(targetId), payload);
    }

    public String getTargetType() {
        return targetType;
    }

    /**
     * Identity of target aggregate.
     * @return target identity, null for origin
     */
    public String getTargetId() {
        return targetId;
    }

    public Object getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "SagaCommand{" + targetType + (targetId != null ? "/" + targetId : "") + ", " + payload + '}';
    }
}
