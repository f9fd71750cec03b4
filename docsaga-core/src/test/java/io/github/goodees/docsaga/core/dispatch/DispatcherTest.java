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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import io.github.goodees.docsaga.core.AsyncEntity;
import io.github.goodees.docsaga.core.Event;
import io.github.goodees.docsaga.core.EventHeader;
import io.github.goodees.docsaga.core.Request;
import io.github.goodees.docsaga.core.store.EventStore;
import io.github.goodees.docsaga.core.store.inmemory.InMemoryEventStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.LockSupport;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static io.github.goodees.docsaga.core.dispatch.DispatchingEventSourcingRuntime.RETRY_NEVER;
import static io.github.goodees.docsaga.core.dispatch.DispatchingEventSourcingRuntime.RETRY_NOW;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DispatcherTest {
    private static final Logger logger = LoggerFactory.getLogger(DispatcherTest.class);
    static final EventStore store = new InMemoryEventStore();
    static ExecutorService dispatchExecutor = Executors.newFixedThreadPool(4);
    static ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);
    static volatile boolean requestsMayFail = true;
    static volatile boolean immediateRetries = true;

    @Rule
    public ErrorCollector collector = new ErrorCollector();
    private AppenderBase<ILoggingEvent> errorAppender;

    @Before
    public void setUp() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        // any errors logged by dispatcher are actually assertion errors
        errorAppender = new AppenderBase<ILoggingEvent>() {
            @Override
            protected void append(ILoggingEvent event) {
                if (event.getLevel() == Level.ERROR) {
                    collector.addError(new AssertionError(event.getFormattedMessage()));
                }
            }
        };
        errorAppender.setContext(ctx);
        errorAppender.start();
        ctx.getLogger(Dispatcher.class.getName() + ".Counter").addAppender(errorAppender);
        requestsMayFail = true;
        immediateRetries = true;
    }

    @After
    public void tearDown() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(Dispatcher.class.getName() + ".Counter").detachAppender(errorAppender);
        errorAppender.stop();
    }

    enum Command implements Request<Integer> {
        INCREMENT, DECREMENT, WAIT, FAIL
    }

    static class Incremented extends EventHeader {

        Incremented(Counter source) {
            super(source, "test");
        }
    }

    static class Decremented extends EventHeader {

        Decremented(Counter source) {
            super(source, "test");
        }
    }

    static class Counter extends AsyncEntity {
        private int state;
        private int waitCorrelation;
        private final Random r = new Random();

        Counter(String id) {
            super(id, DispatcherTest.store);
        }

        @Override
        public <R extends Request<RS>, RS> CompletionStage<RS> execute(R request) {
            if (requestsMayFail && r.nextDouble() > 0.5) {
                return throwing(new IllegalStateException("I randomly chose to fail"));
            }
            Command c = (Command) request;
            switch (c) {
                case INCREMENT:
                    return (CompletionStage<RS>) increment();
                case DECREMENT:
                    return (CompletionStage<RS>) decrement();
                case WAIT:
                    int rel = waitCorrelation++;
                    logger.info("Received slow request {}", rel);
                    return (CompletionStage<RS>) CompletableFuture.supplyAsync(() -> {
                        LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(10));
                        logger.info("Slow request {} completing", rel);
                        return state;
                    }, dispatchExecutor);
                case FAIL:
                default:
                    return throwing(new IllegalArgumentException("I always fail"));
            }
        }

        private CompletionStage<Integer> increment() {
            return persistAndUpdate(new Incremented(this)).thenApply(e -> state);
        }

        private CompletionStage<Integer> decrement() {
            return persistAndUpdate(new Decremented(this)).thenApply(e -> state);
        }

        @Override
        protected void updateState(Event event) {
            if (event instanceof Incremented) {
                state++;
            } else if (event instanceof Decremented) {
                state--;
            }
        }
    }

    static class SimpleConfig implements DispatcherConfiguration {
        private final ConcurrentMap<String, Counter> instances = new ConcurrentHashMap<>();

        Counter lookup(String id) {
            return instances.computeIfAbsent(id, Counter::new);
        }

        @Override
        public String dispatcherName() {
            return "Counter";
        }

        @Override
        public ExecutorService executorService() {
            return dispatchExecutor;
        }

        @Override
        public ScheduledExecutorService schedulerService() {
            return scheduler;
        }

        @Override
        public <R extends Request<RS>, RS> void execute(String id, R request, BiConsumer<RS, Throwable> callback) {
            lookup(id).execute(request).whenComplete(callback);
        }

        @Override
        public long retryDelay(String id, Request<?> request, Throwable t, int completedAttempts) {
            return completedAttempts < 5 ? immediateRetries ? RETRY_NOW : 40 : RETRY_NEVER;
        }
    }

    private final SimpleConfig conf = new SimpleConfig();
    private final Dispatcher cut = new Dispatcher(conf);

    private final String[] instances = { "A", "B", "C", "D", "E" };

    class Client implements Runnable {
        private final Random r = new Random();
        private final Map<String, Integer> localChanges = new HashMap<>();

        private int passedRuns;

        @Override
        public void run() {
            try {
                for (passedRuns = 0; passedRuns < 500; passedRuns++) {
                    runSingle();
                }
            } catch (Exception e) {
                logger.error("Execution failed unexpectedly", e);
                collector.addError(e);
            }
        }

        private void runSingle() throws ExecutionException, InterruptedException, TimeoutException {
            String instance = instances[r.nextInt(instances.length)];
            Command c = r.nextBoolean() ? Command.INCREMENT : Command.DECREMENT;
            boolean willCancel = r.nextDouble() > 0.8;
            CompletableFuture<?> f = cut.execute(instance, c);
            CompletableFuture<Void> g = f.thenAccept((r) -> {
                localChanges.merge(instance, c == Command.INCREMENT ? 1 : -1, Integer::sum);
            }).exceptionally(t -> {
                if (!(willCancel && isCancellationException(t))) {
                    logger.info("{} on {} failed", c, instance, t);
                }
                return null;
            });

            // cancelling f withdraws the execution, cancelling g would not reach the dispatcher
            if (!(willCancel && f.cancel(true))) {
                g.get(5, TimeUnit.SECONDS);
            }
        }

        private boolean isCancellationException(Throwable t) {
            return t instanceof CancellationException
                    || (t instanceof CompletionException && t.getCause() instanceof CancellationException);
        }
    }

    @Test
    public void concurrent_clients_observe_consistent_entity_state() throws InterruptedException {
        // more clients than entities, dispatched to even smaller thread pool
        Client[] clients = new Client[8];
        for (int i = 0; i < clients.length; i++) {
            clients[i] = new Client();
        }
        Thread[] threads = Stream.of(clients).map(Thread::new).toArray(Thread[]::new);
        Stream.of(threads).forEach(Thread::start);
        for (Thread thread : threads) {
            thread.join();
        }

        for (Client client : clients) {
            assertEquals(500, client.passedRuns);
        }
        Map<String, Integer> localStats = Stream.of(clients).flatMap(c -> c.localChanges.entrySet().stream())
                .collect(Collectors.groupingBy(Map.Entry::getKey, Collectors.summingInt(Map.Entry::getValue)));

        for (Map.Entry<String, Integer> local : localStats.entrySet()) {
            assertEquals((int) local.getValue(), conf.instances.get(local.getKey()).state);
        }
    }

    @Test
    public void requests_that_timeout_before_execution_are_withdrawn() throws InterruptedException {
        requestsMayFail = false;
        List<CompletableFuture<Integer>> result = Stream
                .generate(() -> cut.executeWithTimeout("timeout", Command.WAIT, 100, TimeUnit.MILLISECONDS))
                .limit(100)
                .collect(toList());
        int completed = 0;
        int timedOut = 0;
        for (CompletableFuture<Integer> r : result) {
            try {
                r.get(2, TimeUnit.SECONDS);
                completed++;
            } catch (ExecutionException e) {
                assertThat(e.getCause(), instanceOf(TimeoutException.class));
                timedOut++;
            } catch (TimeoutException e) {
                fail("Timed out request should be reported by the dispatcher");
            }
        }
        assertThat(completed, greaterThanOrEqualTo(1));
        assertThat(timedOut, greaterThanOrEqualTo(50));
        assertThat(completed + timedOut, equalTo(100));
    }

    @Test
    public void scheduled_calls_are_executed_after_immediate_requests() throws InterruptedException,
            ExecutionException, TimeoutException {
        requestsMayFail = false;
        CompletableFuture<Integer> result = cut.executeLater("scheduled", Command.WAIT, 30, TimeUnit.MILLISECONDS);
        for (int i = 0; i < 10; i++) {
            cut.execute("scheduled", Command.INCREMENT);
        }
        Integer endState = result.get(1, TimeUnit.SECONDS);
        assertEquals(10, endState.intValue());
    }

    @Test
    public void retried_requests_time_out_relative_to_submission_time() throws InterruptedException {
        immediateRetries = false;
        requestsMayFail = false;
        CompletableFuture<Integer> result = cut.executeWithTimeout("failing_timeout", Command.FAIL, 100,
            TimeUnit.MILLISECONDS);
        try {
            result.get(1, TimeUnit.SECONDS);
            fail("Failing request should not complete");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(TimeoutException.class));
        } catch (TimeoutException e) {
            fail("Request should have timed out within dispatcher");
        }
    }

    @Test
    public void failures_are_reported_after_retries_are_exhausted() throws InterruptedException, TimeoutException {
        requestsMayFail = false;
        CompletableFuture<Integer> result = cut.execute("failing", Command.FAIL);
        try {
            result.get(1, TimeUnit.SECONDS);
            fail("Failing request should not complete");
        } catch (ExecutionException e) {
            assertThat(e.getCause(), instanceOf(IllegalArgumentException.class));
        }
    }

    @Test
    public void unwrapping_reaches_the_root_cause() {
        IllegalStateException root = new IllegalStateException("root");
        Throwable wrapped = new CompletionException(new ExecutionException(root));
        assertEquals(root, Dispatcher.unwrapCompletionException(wrapped));
        assertEquals(root, Dispatcher.unwrapCompletionException(root));
    }

    @Test
    public void dispatcher_is_idle_once_queued_requests_complete() throws Exception {
        requestsMayFail = false;
        CompletableFuture<Integer> slow = cut.execute("idle", Command.WAIT);
        CompletableFuture<Integer> next = cut.execute("idle", Command.INCREMENT);
        assertFalse(cut.isIdle());

        slow.get(1, TimeUnit.SECONDS);
        next.get(1, TimeUnit.SECONDS);
        long deadline = System.currentTimeMillis() + 1000;
        while (!cut.isIdle() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(cut.isIdle());
    }

    @Test
    public void clients_cannot_complete_responses() throws Exception {
        requestsMayFail = false;
        CompletableFuture<Integer> response = cut.execute("readonly", Command.WAIT);
        try {
            response.complete(42);
            fail("Response is completed by dispatcher only");
        } catch (UnsupportedOperationException e) {
            assertEquals(Integer.valueOf(0), response.get(1, TimeUnit.SECONDS));
        }
    }

    @Test
    public void running_invocation_completes_after_executor_shutdown() throws Exception {
        requestsMayFail = false;
        ExecutorService stopping = Executors.newSingleThreadExecutor();
        Dispatcher dispatcher = new Dispatcher(new SimpleConfig() {
            @Override
            public ExecutorService executorService() {
                return stopping;
            }
        });
        CompletableFuture<Integer> slow = dispatcher.execute("stopping", Command.WAIT);
        stopping.shutdown();

        // completion cannot hand the mailbox back to the executor, which must not be reported as error
        assertEquals(Integer.valueOf(0), slow.get(1, TimeUnit.SECONDS));
    }
}
