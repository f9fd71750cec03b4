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

import io.github.goodees.docsaga.core.AsyncResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Effects of entering a saga state. Actions run first, then commands are dispatched one after another, and when
 * all of them succeed, the transition is performed.
 * @param <S> type of saga state
 */
public final class SideEffects<S> {

    public enum Transition {
        STAY, NEXT, STOP
    }

    private final Transition transition;
    private final S nextState;
    private final List<AsyncResult.VoidSideEffect> actions = new ArrayList<>();
    private final List<SagaCommand> commands = new ArrayList<>();

    private SideEffects(Transition transition, S nextState) {
        this.transition = transition;
        this.nextState = nextState;
    }

    public static <S> SideEffects<S> stay() {
        return new SideEffects<>(Transition.STAY, null);
    }

    public static <S> SideEffects<S> next(S state) {
        return new SideEffects<>(Transition.NEXT, Objects.requireNonNull(state));
    }

    public static <S> SideEffects<S> stop() {
        return new SideEffects<>(Transition.STOP, null);
    }

    public SideEffects<S> dispatch(SagaCommand command) {
        commands.add(Objects.requireNonNull(command));
        return this;
    }

    public SideEffects<S> perform(AsyncResult.VoidSideEffect action) {
        actions.add(Objects.requireNonNull(action));
        return this;
    }

    public Transition getTransition() {
        return transition;
    }

    public S getNextState() {
        return nextState;
    }

    public List<AsyncResult.VoidSideEffect> getActions() {
        return Collections.unmodifiableList(actions);
    }

    public List<SagaCommand> getCommands() {
        return Collections.unmodifiableList(commands);
    }

    @Override
    public String toString() {
        return "SideEffects{" + transition + (nextState != null ? " " + nextState : "") + ", commands=" + commands
                + ", actions=" + actions.size() + '}';
    }
}
