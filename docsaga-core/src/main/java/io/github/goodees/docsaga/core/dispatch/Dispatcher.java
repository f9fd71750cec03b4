package io.github.goodees.docsaga.core.dispatch;

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

import io.github.goodees.docsaga.core.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Deque;
import java.util.function.BooleanSupplier;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Asynchronous message dispatcher. Guarantees to handle at most one message at time per entity. Internally, the
 * dispatcher maintains a queue of invocations for every entity id. Whenever a new request should be invoked, the
 * dispatcher checks if it is not invoking a request already.
 */
public class Dispatcher {

    private final DispatcherConfiguration conf;
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Logger logger;

    public Dispatcher(DispatcherConfiguration conf) {
        this.conf = conf;
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.dispatcherName());
    }

    /**
     * Schedule a request.
     * The request is added to entity's mailbox, and that mailbox is scheduled for dequeue. The response is returned
     * immediately, as it is just a holder for future result that completes when the request invocation completes.
     *
     * @param id      entity id
     * @param request request to pass
     * @param <R>     type of request
     * @param <RS>    type of response
     * @return the promise for the response
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> execute(String id, R request) {
        return mailbox(id).enqueue(request);
    }

    /**
     * Schedule a request with timeout. If invocation doesn't finish until timeout, the result completes exceptionally
     * with {@code TimeoutException}. When the invocation already started it is not interrupted, and its outcome is
     * not reported to the caller anymore.
     * @param id entity id
     * @param request the request
     * @param timeout timeout for completion
     * @param unit timeout unit
     * @param <R> request type
     * @param <RS> response type
     * @return the promise for the result
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> executeWithTimeout(String id, R request, long timeout,
            TimeUnit unit) {
        return mailbox(id).enqueueWithTimeout(request, timeout, unit);
    }

    /**
     * Schedule a request for future execution.
     * @param id entity id
     * @param request request
     * @param delay delay for invocation
     * @param unit delay unit
     * @param <R> request type
     * @param <RS> response type
     * @return the promise for the result
     */
    public <R extends Request<RS>, RS> CompletableFuture<RS> executeLater(String id, R request, long delay,
            TimeUnit unit) {
        return mailbox(id).enqueueLater(request, delay, unit);
    }

    /**
     * Whether no mailbox holds a queued or running request. Requests waiting for delayed enqueue are not counted.
     * @return true when the dispatcher has nothing to process
     */
    public boolean isIdle() {
        return mailboxes.values().stream().allMatch(Mailbox::isIdle);
    }

    private Mailbox mailbox(String id) {
        return mailboxes.computeIfAbsent(id, Mailbox::new);
    }

    public static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null
                && (ex instanceof CompletionException || ex instanceof ExecutionException)) {
            ex = ex.getCause();
        }
        return ex;
    }

    /**
     * Queue of messages for single entity. At this level we're handling the concurrency between adding new request,
     * and executing only single request.
     */
    class Mailbox implements Runnable {
        private final String id;
        private final Deque<Invocation<?, ?>> queue = new ConcurrentLinkedDeque<>();
        private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();
        private final AtomicReference<Invocation<?, ?>> currentInvocation = new AtomicReference<>();

        Mailbox(String id) {
            this.id = id;
        }

        <R extends Request<RS>, RS> CompletableFuture<RS> enqueue(R request) {
            Invocation<R, RS> inv = new Invocation<>(request);
            return enqueueInvocation(inv);
        }

        <R extends Request<RS>, RS> CompletableFuture<RS> enqueueWithTimeout(R request, long timeout, TimeUnit unit) {
            Invocation<R, RS> inv = new Invocation<>(request, timeout, unit);
            return enqueueInvocation(inv);
        }

        <R extends Request<RS>, RS> CompletableFuture<RS> enqueueLater(R request, long delay, TimeUnit unit) {
            Invocation<R, RS> inv = new Invocation<>(request);
            conf.schedulerService().schedule(() -> this.enqueueInvocation(inv), delay, unit);
            return inv.result;
        }

        /**
         * Add an invocation to queue, and process it if it is the first one.
         */
        <R extends Request<RS>, RS> CompletableFuture<RS> enqueueInvocation(Invocation<R, RS> inv) {
            queue.add(inv);
            if (canStartProcessing()) {
                conf.executorService().submit(this);
            }
            return inv.result;
        }

        boolean isIdle() {
            // reset to zero only after the queue was drained
            return enqueuesWhileBusy.get() == 0;
        }

        private boolean canStartProcessing() {
            int queueSize = enqueuesWhileBusy.getAndIncrement();
            if (queueSize == 0) {
                logger.debug("Will start processing queue for {}", id);
                return true;
            } else {
                logger.debug("Will not start processing the queue for {}, {} requests enqueued during current "
                        + "execution", id, queueSize);
                return false;
            }
        }

        private boolean canStopProcessing(int observedEnqueues) {
            return enqueuesWhileBusy.compareAndSet(observedEnqueues, 0);
        }

        /**
         * Process single message.
         * Called when Mailbox is submitted for execution and not processing, but also at end
         * of processing. This way even messages that arrive during processing (or are retried) will be processed.
         */
        @Override
        public void run() {
            Invocation<?, ?> inv = nextInvocation();
            if (inv != null) {
                if (currentInvocation.compareAndSet(null, inv)) {
                    inv.run();
                } else {
                    logger.error("Submit has run while invocation is in progress. Current invocation: {}, "
                            + "dequeued invocation: {}", currentInvocation, inv);
                    queue.addFirst(inv);
                }
            }
        }

        private Invocation<?, ?> nextInvocation() {
            while (true) {
                int enqueues = enqueuesWhileBusy.get();
                Invocation<?, ?> inv = queue.poll();
                if (inv == null) {
                    // An invocation might have been queued between previous line, and this decision point.
                    // Therefore we check, if canStartProcessing was called in between, and try polling the
                    // queue again, or we guarantee, that canStartProcessing will return true past the next statement.
                    if (canStopProcessing(enqueues)) {
                        logger.debug("Stopping processing of message queue for {}", id);
                        return null;
                    }
                } else {
                    return inv;
                }
            }
        }

        /**
         * Encapsulation of request processing. Represents the request as well as actual response given to client.
         * On this level we are handling the concurrency between invocation of the request, and cancellation of it.
         * Also retries of the invocations are handled here.
         */
        class Invocation<R extends Request<RS>, RS> implements Runnable {

            private final R request;
            private final AtomicBoolean idle = new AtomicBoolean(true);
            private final ClientFuture<RS> result = new ClientFuture<>(this::withdraw);
            private int completedAttempts = 0;
            private final ScheduledFuture<?> timeout;
            private final Instant submission = Instant.now();
            private Instant executionStart;

            Invocation(R request) {
                this.request = request;
                this.timeout = null;
            }

            Invocation(R request, long timeout, TimeUnit unit) {
                this.request = request;
                this.timeout = conf.schedulerService().schedule(this::timeout, timeout, unit);
            }

            @Override
            public void run() {
                if (claim()) {
                    completedAttempts++;
                    executionStart = Instant.now();
                    conf.execute(id, request, this::handleCompletion);
                } else {
                    logger.info("Invocation attempted to run after it was cancelled: {}", this);
                    finish();
                }
            }

            void finish() {
                if (currentInvocation.compareAndSet(this, null)) {
                    executionStart = null;
                    idle.set(true);
                    try {
                        conf.executorService().submit(Mailbox.this);
                    } catch (RejectedExecutionException e) {
                        logger.warn("Executor is shut down, {} queued requests for {} will not run", queue.size(),
                            id);
                    }
                } else {
                    logger.error("Invocation finished, but wasn't current invocation: {}", this);
                }
            }

            /**
             * Take the right to run the request or to drop it. Run, cancel and queue timeout race for it.
             */
            boolean claim() {
                return idle.compareAndSet(true, false);
            }

            boolean withdraw() {
                if (claim()) {
                    queue.remove(this);
                    return true;
                }
                return false;
            }

            void timeout() {
                if (claim()) {
                    queue.remove(this);
                    logger.info("Invocation timed out in queue: {}. Current invocation is {}", this,
                        currentInvocation.get());
                    result.fail(new TimeoutException("Request " + request + " for " + id
                            + " was not processed in time"));
                } else if (!result.isDone()) {
                    // the entity cannot be stopped, it may still complete the request.
                    logger.warn("ACTIVE invocation timed out: {}", this);
                    result.fail(new TimeoutException("Request " + request + " for " + id
                            + " did not complete in time"));
                }
            }

            private void handleCompletion(RS response, Throwable throwable) {
                if (throwable == null) {
                    cancelTimeout();
                    result.resolve(response);
                } else {
                    long delay = result.isDone() ? -1 : conf.retryDelay(id, request, throwable, completedAttempts);
                    if (delay == 0) {
                        queue.add(this);
                    } else if (delay > 0 && scheduleRetry(delay)) {
                        logger.debug("Retrying {} in {} ms", this, delay);
                    } else {
                        cancelTimeout();
                        result.fail(unwrapCompletionException(throwable));
                    }
                }
                finish();
            }

            private boolean scheduleRetry(long delay) {
                try {
                    conf.schedulerService().schedule(() -> enqueueInvocation(this), delay, TimeUnit.MILLISECONDS);
                    return true;
                } catch (RejectedExecutionException e) {
                    logger.warn("Scheduler is shut down, {} will not be retried", this);
                    return false;
                }
            }

            private void cancelTimeout() {
                if (timeout != null && !timeout.isDone()) {
                    timeout.cancel(false);
                }
            }

            @Override
            public String toString() {
                return "Invocation[entity=" + id + ", request=" + request + ", submissionTime=" + submission
                        + ", attempts=" + completedAttempts + ", executionStart=" + executionStart + "]";
            }
        }
    }


    /**
     * Future handed to the client. Only the dispatcher completes it, cancelling withdraws a request still queued.
     */
    private static final class ClientFuture<T> extends CompletableFuture<T> {
        private final BooleanSupplier withdraw;

        ClientFuture(BooleanSupplier withdraw) {
            this.withdraw = withdraw;
        }

        void resolve(T value) {
            super.complete(value);
        }

        void fail(Throwable t) {
            super.completeExceptionally(t);
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            return withdraw.getAsBoolean() && super.cancel(mayInterruptIfRunning);
        }

        @Override
        public boolean complete(T value) {
            throw readOnly();
        }

        @Override
        public boolean completeExceptionally(Throwable ex) {
            throw readOnly();
        }

        @Override
        public void obtrudeValue(T value) {
            throw readOnly();
        }

        @Override
        public void obtrudeException(Throwable ex) {
            throw readOnly();
        }

        private static UnsupportedOperationException readOnly() {
            return new UnsupportedOperationException("Response of a dispatched request cannot be completed by client");
        }
    }
}
