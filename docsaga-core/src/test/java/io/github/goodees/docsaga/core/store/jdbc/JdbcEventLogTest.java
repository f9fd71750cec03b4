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

import io.github.goodees.docsaga.core.store.EventLog;
import io.github.goodees.docsaga.core.store.EventStoreException;
import io.github.goodees.docsaga.core.store.StreamedEvent;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class JdbcEventLogTest extends JdbcTestBase {

    List<JdbcTestEvent> generate(int size) throws EventStoreException {
        return generate(size, 1);
    }

    List<JdbcTestEvent> generate(int size, int firstVersion) throws EventStoreException {
        List<JdbcTestEvent> result = new ArrayList<>();
        for (int i = firstVersion; i < size + firstVersion; i++) {
            result.add(new JdbcTestEvent(name(), i, i * 10));
        }
        eventStore.persist(result);
        return result;
    }

    @Test
    public void foreach_delivers_results() throws EventStoreException {
        List<JdbcTestEvent> events = generate(3);
        List<JdbcTestEvent> delivered = new ArrayList<>();
        try (EventLog.Replay<JdbcTestEvent> ev = eventLog.readEvents(name(), 0)) {
            ev.foreach(delivered::add);
        }
        assertEquals(events, delivered);
    }

    @Test
    public void last_version_follows_appends() throws EventStoreException {
        assertEquals(0, eventLog.lastVersion(name()));
        generate(3);
        assertEquals(3, eventLog.lastVersion(name()));
    }

    @Test
    public void stop_stops_foreach() throws EventStoreException {
        List<JdbcTestEvent> events = generate(3);
        AtomicInteger counter = new AtomicInteger();
        List<JdbcTestEvent> delivered = new ArrayList<>();
        try (EventLog.Replay<JdbcTestEvent> ev = eventLog.readEvents(name(), 0)) {
            ev.foreach((e) -> {
                if (counter.incrementAndGet() == 2) {
                    ev.stop();
                }
                delivered.add(e);
            });
        }
        assertEquals(events.subList(0, 2), delivered);
    }

    @Test
    public void reduce_delivers_results() throws EventStoreException {
        int size = 30;
        generate(size);
        try (EventLog.Replay<JdbcTestEvent> ev = eventLog.readEvents(name(), 0)) {
            int result = ev.reduce(0, (a, e) -> a + e.getPayload());
            // 10+20+...+size*10
            assertEquals(size * (1 + size) * 10 / 2, result);
        }
    }

    @Test
    public void read_events_delivers_events_after_specified_version() throws EventStoreException {
        List<JdbcTestEvent> events = generate(30);
        List<JdbcTestEvent> delivered = new ArrayList<>();
        try (EventLog.Replay<JdbcTestEvent> ev = eventLog.readEvents(name(), 10)) {
            ev.foreach(delivered::add);
        }
        assertEquals(events.subList(10, events.size()), delivered);
        assertTrue("Returned entity version should be strictly greater than afterVersion argument",
            delivered.stream().allMatch(e -> e.entityStateVersion() > 10));
    }

    @Test
    public void no_events_returned_for_nonexisting_entity() {
        List<JdbcTestEvent> delivered = new ArrayList<>();
        try (EventLog.Replay<JdbcTestEvent> ev = eventLog.readEvents(name(), 0)) {
            ev.foreach(delivered::add);
        }
        assertThat(delivered, empty());
    }

    @Test
    public void different_payload_versions_properly_deserialized() throws EventStoreException {
        generate(10);
        serialization.setStoreHex(true);
        generate(10, 11);
        serialization.setStoreHex(false);
        // event 12 with payload 120 is encoded in hex
        assertDb(1, "select count(*) from test_event where id = ? and payload like '%|78'", name());
        List<JdbcTestEvent> delivered = new ArrayList<>();
        try (EventLog.Replay<JdbcTestEvent> ev = eventLog.readEvents(name(), 0)) {
            ev.foreach(delivered::add);
        }
        assertEquals(20, delivered.size());
        int i = 1;
        for (JdbcTestEvent event : delivered) {
            assertEquals(i, event.entityStateVersion());
            assertEquals(i * 10, event.getPayload());
            i++;
        }
    }

    @Test
    public void read_all_returns_events_of_all_entities_after_offset() throws EventStoreException {
        long start = eventLog.lastOffset();
        List<JdbcTestEvent> first = generate(3);
        JdbcTestEvent other = new JdbcTestEvent(name() + "_other", 1, 5);
        eventStore.persist(other);

        List<StreamedEvent> all = eventLog.readAll(start, 10);
        assertEquals(4, all.size());
        assertEquals(first, all.subList(0, 3).stream().map(StreamedEvent::getEvent).collect(toList()));
        assertEquals(other, all.get(3).getEvent());
        for (int i = 0; i < all.size(); i++) {
            assertEquals(start + i + 1, all.get(i).getOffset());
        }
        assertEquals(2, eventLog.readAll(start, 2).size());
        assertThat(eventLog.readAll(start + 4, 10), empty());
    }

    @Test
    public void unreadable_events_are_skipped_unless_strict() throws EventStoreException {
        long start = eventLog.lastOffset();
        generate(1);
        template.update("update test_event set payload = 'garbage' where id = ?", name());

        assertThat(eventLog.readAll(start, 10), empty());
        JdbcEventLog<JdbcTestEvent> strict = new JdbcEventLog<>(ds, schema, serialization, true);
        assertTrue(strict.isStrict());
        assertFalse(eventLog.isStrict());
        try {
            strict.readAll(start, 10);
            fail("Strict log should fail on unreadable event");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.STORAGE, e.getFault());
        }
    }
}
