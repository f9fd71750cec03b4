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

/**
 * Snapshot of saga state returned to callers of the saga runtime.
 */
public final class SagaStatus {
    private final String sagaId;
    private final Object state;
    private final boolean running;
    private final long version;

    public SagaStatus(String sagaId, Object state, boolean running, long version) {
        this.sagaId = sagaId;
        this.state = state;
        this.running = running;
        this.version = version;
    }

    public String getSagaId() {
        return sagaId;
    }

    /**
     * Current state of the saga.
     * @param <S> type of state
     * @return current state, null when the saga never started
     */
    public <S> S getState() {
        return (S) state;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Whether the saga started and stopped since.
     * @return true for stopped saga
     */
    public boolean isStopped() {
        return !running && version > 0;
    }

    /**
     * Version of the saga journal.
     * @return number of saga events
     */
    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "SagaStatus{" + "sagaId=" + sagaId + ", state=" + state + ", running=" + running + ", version="
                + version + '}';
    }
}
