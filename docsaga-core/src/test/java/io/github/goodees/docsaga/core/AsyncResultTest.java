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

import org.junit.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AsyncResultTest {
    @Test
    public void failing_side_effect_fails_the_result() throws InterruptedException {
        AsyncResult<Boolean> result = AsyncResult.returning(true);

        // type inference needs the cast
        AsyncResult<Boolean> r = result.thenTry((AsyncResult.VoidSideEffect) () -> {
            throw new UnsupportedOperationException("bam!");
        });
        try {
            r.get();
            fail("Side effect failure should propagate");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(UnsupportedOperationException.class));
        }
    }

    @Test
    public void side_effect_is_not_executed_on_failure_in_previous_stage() {
        AtomicBoolean executed = new AtomicBoolean();
        AsyncResult<Boolean> result = AsyncResult
                .<Boolean>throwing(new UnsupportedOperationException("Failed before attempting side effect"))
                .thenTry(() -> executed.set(true));
        assertTrue(result.isCompletedExceptionally());
        assertFalse(executed.get());
    }

    @Test
    public void successful_side_effect_keeps_the_value() throws ExecutionException, InterruptedException {
        AtomicBoolean executed = new AtomicBoolean();
        int value = AsyncResult.returning(42).thenTry(() -> executed.set(true)).get();
        assertEquals(42, value);
        assertTrue(executed.get());
    }

    @Test
    public void invoke_captures_thrown_exception() throws InterruptedException {
        AsyncResult<String> result = AsyncResult.invoke(() -> {
            throw new java.io.IOException("unreachable");
        });
        try {
            result.get();
            fail("Exception of callable should be captured");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(java.io.IOException.class));
        }
    }

    @Test
    public void failed_transformation_is_unwrapped() throws InterruptedException {
        CompletableFuture<Integer> source = new CompletableFuture<>();
        AsyncResult<Integer> result = AsyncResult.returning(0).thenCompose(zero -> source).thenApply(i -> i / (i - 1));
        assertFalse(result.isDone());
        source.complete(1);
        try {
            result.get();
            fail("Division by zero should fail the result");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(ArithmeticException.class));
        }
    }

    @Test
    public void transformations_return_async_results() throws ExecutionException, InterruptedException {
        AsyncResult<String> result = AsyncResult.returning(20)
                .thenApply(i -> i + 1)
                .thenCompose(i -> AsyncResult.returning(i * 2))
                .thenApply(String::valueOf);
        assertEquals("42", result.get());
    }
}
