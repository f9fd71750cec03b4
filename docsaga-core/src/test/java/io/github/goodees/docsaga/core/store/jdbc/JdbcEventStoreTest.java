package io.github.goodees.docsaga.core.store.jdbc;

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

import io.github.goodees.docsaga.core.EventHeader;
import io.github.goodees.docsaga.core.store.EventStoreException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ErrorCollector;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;

import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class JdbcEventStoreTest extends JdbcTestBase {

    @Rule
    public ErrorCollector collector = new ErrorCollector();

    @Test
    public void events_for_new_entity_are_persisted() throws EventStoreException {
        eventStore.persist(new JdbcTestEvent(name(), 1, 100), new JdbcTestEvent(name(), 2, 200));
        assertDb(2, "select count(*) from test_event where id = ?", name());
        assertDb(2, "select version from test_version where id = ?", name());
    }

    @Test
    public void events_for_existing_entity_are_persisted() throws EventStoreException {
        eventStore.persist(new JdbcTestEvent(name(), 1, 100), new JdbcTestEvent(name(), 2, 200));
        eventStore.persist(new JdbcTestEvent(name(), 3, 100), new JdbcTestEvent(name(), 4, 200));
        assertDb(4, "select count(*) from test_event where id = ?", name());
        assertDb(4, "select version from test_version where id = ?", name());
    }

    @Test
    public void correlation_id_is_stored() throws EventStoreException {
        eventStore.persist(new JdbcTestEvent(name(), 1, Instant.now(), "abc", 1));
        assertDb(1, "select count(*) from test_event where id = ? and correlation_id = 'abc'", name());
    }

    @Test
    public void mixing_entities_fails() {
        try {
            eventStore.persist(new JdbcTestEvent(name(), 1, 100), new JdbcTestEvent(name() + "!", 2, 200));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.MISUSE, e.getFault());
            assertDb(0, "select count(*) from test_event where id like 'mixing%'");
        }
    }

    @Test
    public void skipping_versions_fails() {
        try {
            eventStore.persist(new JdbcTestEvent(name(), 1, 100), new JdbcTestEvent(name(), 3, 200));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.MISUSE, e.getFault());
            assertDb(0, "select count(*) from test_event where id = ?", name());
        }
    }

    @Test
    public void persisting_unsupported_events_fails() {
        try {
            eventStore.persist(new EventHeader(name(), 1, Instant.now(), "cid"));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.MISUSE, e.getFault());
        }
    }

    @Test
    public void first_event_of_new_entity_must_have_version_one() {
        try {
            eventStore.persist(new JdbcTestEvent(name(), 3, 100));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.VERSION_CONFLICT, e.getFault());
            assertDb(0, "select count(*) from test_version where id = ?", name());
        }
    }

    @Test
    public void persisting_stale_events_fails_with_optimistic_lock() throws EventStoreException {
        eventStore.persist(new JdbcTestEvent(name(), 1, 100), new JdbcTestEvent(name(), 2, 200));
        try {
            eventStore.persist(new JdbcTestEvent(name(), 2, 300));
            fail("should have failed");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.VERSION_CONFLICT, e.getFault());
            assertDb(2, "select count(*) from test_event where id = ?", name());
            assertDb(2, "select version from test_version where id = ?", name());
        }
    }

    @Test
    public void global_offsets_are_assigned_in_order_of_append() throws EventStoreException {
        long before = eventLog.lastOffset();
        eventStore.persist(new JdbcTestEvent(name(), 1, 100), new JdbcTestEvent(name(), 2, 200));
        eventStore.persist(new JdbcTestEvent(name() + "_other", 1, 300));
        List<Long> offsets = template.queryForList(
            "select seq from test_event where id like 'global_offsets%' order by seq", Long.class);
        assertThat(offsets, contains(before + 1, before + 2, before + 3));
        assertEquals(before + 3, eventLog.lastOffset());
    }

    @Test
    public void concurrent_appends_keep_versions_gapless() throws Exception {
        eventStore.persist(new JdbcTestEvent(name(), 1, 0));
        int writers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            int payload = i;
            results.add(pool.submit(() -> {
                start.await();
                try {
                    eventStore.persist(new JdbcTestEvent(name(), 2, payload));
                    return true;
                } catch (EventStoreException e) {
                    return false;
                }
            }));
        }
        start.countDown();
        int succeeded = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) {
                succeeded++;
            }
        }
        pool.shutdown();
        assertEquals("Exactly one writer may append version 2", 1, succeeded);
        assertDb(2, "select count(*) from test_event where id = ?", name());
        assertDb(2, "select version from test_version where id = ?", name());
    }
}
