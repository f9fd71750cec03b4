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

import io.github.goodees.docsaga.core.dispatch.Dispatcher;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Helper class for constructing asynchronous responses. It offers convenience methods for the constructs, that
 * are common in AsyncEntity.
 *
 * @param <T> the type of result
 */
public class AsyncResult<T> extends CompletableFuture<T> {
    private AsyncResult() {
        super();
    }

    private AsyncResult(CompletionStage<T> parent) {
        super();
        parent.whenComplete(asCallback());
    }

    private BiConsumer<T, Throwable> asCallback() {
        return (r, t) -> {
            if (t == null) {
                complete(r);
            } else {
                completeExceptionally(Dispatcher.unwrapCompletionException(t));
            }
        };
    }

    @Override
    public AsyncResult<T> whenComplete(BiConsumer<? super T, ? super Throwable> action) {
        return new AsyncResult<>(super.whenComplete(action));
    }

    @Override
    public <U> AsyncResult<U> thenApply(Function<? super T, ? extends U> transformation) {
        return new AsyncResult<>(super.thenApply(transformation));
    }

    @Override
    public <U> AsyncResult<U> thenCompose(Function<? super T, ? extends CompletionStage<U>> fn) {
        return new AsyncResult<>(super.thenCompose(fn));
    }

    /**
     * Execute a side effect once this stage completes successfully. Failure of the side effect fails the returned
     * stage.
     * @param sideEffect side effect to perform
     * @return stage repeating the result of this stage when side effect doesn't fail
     */
    public AsyncResult<T> thenTry(VoidSideEffect sideEffect) {
        return thenCompose(r -> invoke(() -> {
            sideEffect.doSideEffect();
            return r;
        }));
    }

    /**
     * A side effect that returns void
     */
    @FunctionalInterface
    public interface VoidSideEffect {
        void doSideEffect() throws Exception;
    }

    /**
     * Wrap a result of callable. The callable is invoked immediately.
     * @param action The action to perform
     * @param <V> type of result
     * @return Async result wrapping the return value or exception thrown from a callable
     */
    public static <V> AsyncResult<V> invoke(Callable<V> action) {
        AsyncResult<V> result = new AsyncResult<>();
        try {
            result.complete(action.call());
        } catch (Exception e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Wrap a value.
     * @param result value to wrap
     * @param <V> type of result
     * @return an AsyncResult that completed successfully with the result.
     */
    public static <V> AsyncResult<V> returning(V result) {
        AsyncResult<V> r = new AsyncResult<>();
        r.complete(result);
        return r;
    }

    /**
     * Wrap an exception
     * @param t Throwable to wrap.
     * @param <V> The original return type of the throwable.
     * @return an AsyncResult that completed exceptionally with given throwable.
     */
    public static <V> AsyncResult<V> throwing(Throwable t) {
        AsyncResult<V> r = new AsyncResult<>();
        r.completeExceptionally(t);
        return r;
    }
}
