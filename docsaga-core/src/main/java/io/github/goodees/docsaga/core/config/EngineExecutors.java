package io.github.goodees.docsaga.core.config;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools shared by the runtimes of one engine. Invocations run on the worker pool, timeouts and delayed
 * requests on a separate scheduler. Stream subscriptions block while consumers wait for entities, and therefore
 * get threads of their own.
 */
public class EngineExecutors implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EngineExecutors.class);

    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService streams;

    public EngineExecutors(EngineConfiguration configuration) {
        this.workers = Executors.newFixedThreadPool(configuration.getPoolSize(), threadFactory("docsaga-worker"));
        this.scheduler = Executors.newScheduledThreadPool(1, threadFactory("docsaga-scheduler"));
        this.streams = Executors.newCachedThreadPool(threadFactory("docsaga-stream"));
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public ExecutorService getWorkers() {
        return workers;
    }

    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public ExecutorService getStreams() {
        return streams;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        streams.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Worker pool did not terminate in time, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
