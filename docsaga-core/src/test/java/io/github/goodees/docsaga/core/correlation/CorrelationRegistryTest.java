package io.github.goodees.docsaga.core.correlation;

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

import io.github.goodees.docsaga.core.Event;
import io.github.goodees.docsaga.core.EventHeader;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;

import static io.github.goodees.docsaga.core.correlation.CorrelationRegistry.correlatedWith;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CorrelationRegistryTest {
    private ScheduledExecutorService scheduler;
    private CorrelationRegistry registry;

    @Before
    public void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        registry = new CorrelationRegistry(scheduler, Duration.ofSeconds(5));
    }

    @After
    public void tearDown() {
        scheduler.shutdownNow();
    }

    private static Event event(String cid, long version) {
        return new EventHeader("doc", version, Instant.now(), cid);
    }

    @Test
    public void awaiter_completes_with_matching_events() throws Exception {
        CorrelationRegistry.Awaiter awaiter = registry.subscribe(correlatedWith("c1"), 2);
        Event first = event("c1", 1);
        Event second = event("c1", 2);
        registry.accept(first);
        registry.accept(event("c2", 3));
        registry.accept(second);
        registry.accept(event("c1", 4));

        List<Event> events = awaiter.await();
        assertThat(events, contains(first, second));
        assertEquals(0, registry.pendingCount());
    }

    @Test
    public void events_before_subscription_are_not_seen() throws Exception {
        registry.accept(event("c1", 1));
        CorrelationRegistry.Awaiter awaiter = registry.subscribe(correlatedWith("c1"), 1);
        assertTrue(!awaiter.future().isDone());
        Event later = event("c1", 2);
        registry.accept(later);
        assertThat(awaiter.await(), contains(later));
    }

    @Test(expected = TimeoutException.class)
    public void awaiter_times_out() throws Exception {
        CorrelationRegistry.Awaiter awaiter = registry.subscribe(correlatedWith("c1"), 1, Duration.ofMillis(50));
        try {
            awaiter.await();
        } finally {
            assertEquals(0, registry.pendingCount());
        }
    }

    @Test
    public void closed_awaiter_is_removed() throws InterruptedException, TimeoutException {
        CorrelationRegistry.Awaiter awaiter;
        try (CorrelationRegistry.Awaiter a = registry.subscribe(correlatedWith("c1"), 1)) {
            awaiter = a;
            assertEquals(1, registry.pendingCount());
        }
        assertEquals(0, registry.pendingCount());
        try {
            awaiter.await();
            fail("Closed awaiter should be cancelled");
        } catch (CancellationException expected) {
            assertTrue(awaiter.future().isCompletedExceptionally());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void count_must_be_positive() {
        registry.subscribe(correlatedWith("c1"), 0);
    }
}
