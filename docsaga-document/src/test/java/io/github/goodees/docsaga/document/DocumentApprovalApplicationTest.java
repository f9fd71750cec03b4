package io.github.goodees.docsaga.document;

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
import io.github.goodees.docsaga.core.aggregate.CommandResult;
import io.github.goodees.docsaga.document.approval.ApprovalNotifier;
import io.github.goodees.docsaga.document.event.DocumentEvent;
import io.github.goodees.docsaga.document.event.ErrorEvent;
import io.github.goodees.docsaga.document.model.Document;
import io.github.goodees.docsaga.document.model.DocumentCommand;
import io.github.goodees.docsaga.document.model.DocumentError;
import io.github.goodees.docsaga.document.readmodel.ApprovalStatus;
import io.github.goodees.docsaga.document.readmodel.DocumentVersionView;
import io.github.goodees.docsaga.document.readmodel.DocumentView;
import io.github.goodees.docsaga.document.readmodel.ReadModelException;
import io.github.goodees.docsaga.document.readmodel.ReadModelSchema;
import io.github.goodees.docsaga.document.service.DocumentResponse;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DocumentApprovalApplicationTest {
    private static final String CODE = "424242";

    @Rule
    public TestName testName = new TestName();

    private final List<String> notifications = Collections.synchronizedList(new ArrayList<>());
    private final List<DocumentApprovalApplication> started = new ArrayList<>();

    private final List<ILoggingEvent> errors = Collections.synchronizedList(new ArrayList<>());
    private final AppenderBase<ILoggingEvent> errorAppender = new AppenderBase<ILoggingEvent>() {
        @Override
        protected void append(ILoggingEvent event) {
            if (event.getLevel().isGreaterOrEqual(Level.ERROR)) {
                errors.add(event);
            }
        }
    };

    @After
    public void stop() {
        started.forEach(DocumentApprovalApplication::close);
        if (errorAppender.isStarted()) {
            engineLogger().detachAppender(errorAppender);
            errorAppender.stop();
        }
    }

    private static ch.qos.logback.classic.Logger engineLogger() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        return ctx.getLogger("io.github.goodees.docsaga");
    }

    private void captureErrors() {
        errorAppender.setContext((LoggerContext) LoggerFactory.getILoggerFactory());
        errorAppender.start();
        engineLogger().addAppender(errorAppender);
    }

    private String jdbcUrl() {
        return "jdbc:h2:mem:app_" + testName.getMethodName() + ";DB_CLOSE_DELAY=-1";
    }

    private Properties properties(String store) {
        Properties properties = new Properties();
        properties.setProperty(DocumentApprovalApplication.STORE_PROPERTY, store);
        properties.setProperty(DocumentApprovalApplication.JDBC_URL_PROPERTY, jdbcUrl());
        properties.setProperty("docsaga.commandTimeout", "2000");
        properties.setProperty("docsaga.sagaDispatchTimeout", "2000");
        properties.setProperty("docsaga.sagaRetryDelay", "20");
        properties.setProperty("docsaga.correlationTimeout", "5000");
        properties.setProperty("docsaga.pollInterval", "20");
        return properties;
    }

    private DocumentApprovalApplication start(String store, ApprovalNotifier notifier) throws Exception {
        DocumentApprovalApplication app = DocumentApprovalApplication.start(properties(store), () -> CODE, notifier);
        started.add(app);
        return app;
    }

    private DocumentApprovalApplication start() throws Exception {
        return start("memory", (documentId, code) -> notifications.add(documentId + ":" + code));
    }

    private static DocumentView awaitStatus(DocumentApprovalApplication app, String id, ApprovalStatus status)
            throws ReadModelException, InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        DocumentView view = app.getQueries().findDocument(id).get();
        while (view.getApprovalStatus() != status && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            view = app.getQueries().findDocument(id).get();
        }
        assertEquals("Approval status of " + id, status, view.getApprovalStatus());
        return view;
    }

    @Test
    public void submitted_document_gets_approved() throws Exception {
        DocumentApprovalApplication app = start();
        DocumentResponse response = app.getService().createOrUpdate(null, "Hello", "World");

        assertEquals(DocumentResponse.Status.ACCEPTED, response.getStatus());
        assertEquals(DocumentResponse.DOCUMENT_RECEIVED, response.getMessage());
        String id = response.getDocumentId();
        assertNotNull(id);

        DocumentView view = awaitStatus(app, id, ApprovalStatus.APPROVED);
        assertEquals("Hello", view.getTitle());
        assertEquals("World", view.getBody());
        assertEquals(1, view.getVersion());
        assertThat(notifications, contains(id + ":" + CODE));
        assertTrue(app.getApprovals().status(id).get().isStopped());
    }

    @Test
    public void mismatching_identity_is_rejected() throws Exception {
        DocumentApprovalApplication app = start();
        String id = app.getService().createOrUpdate(null, "Hello", "World").getDocumentId();
        awaitStatus(app, id, ApprovalStatus.APPROVED);

        Document other = Document.create(UUID.randomUUID(), "Other", "Content");
        CommandResult<DocumentEvent> result = app.getDocuments()
                .submit(id, "mismatch", new DocumentCommand.CreateOrUpdate(other)).get();

        assertTrue(result.isRejected());
        assertEquals(DocumentError.DOCUMENT_NOT_FOUND, ((ErrorEvent) result.getRejection()).getError());
        assertEquals("mismatch", result.getRejection().correlationId());
        assertEquals(1, app.getQueries().findDocument(id).get().getVersion());
        assertEquals(1, app.getService().getHistory(id).size());
    }

    @Test
    public void restored_version_becomes_newest() throws Exception {
        DocumentApprovalApplication app = start();
        String id = app.getService().createOrUpdate(null, "First", "One").getDocumentId();
        assertTrue(app.getService().createOrUpdate(id, "Second", "Two").isAccepted());

        DocumentResponse restored = app.getService().restoreVersion(id, 1);
        assertEquals(DocumentResponse.Status.ACCEPTED, restored.getStatus());
        assertEquals(DocumentResponse.VERSION_RESTORED, restored.getMessage());

        DocumentView view = app.getQueries().findDocument(id).get();
        assertEquals(3, view.getVersion());
        assertEquals("First", view.getTitle());
        List<DocumentVersionView> history = app.getService().getHistory(id);
        assertEquals(3, history.size());
        assertEquals("Second", history.get(1).getTitle());
        assertEquals("First", history.get(2).getTitle());
        assertEquals("One", history.get(2).getBody());
    }

    @Test
    public void invalid_input_is_reported() throws Exception {
        DocumentApprovalApplication app = start();

        DocumentResponse blankTitle = app.getService().createOrUpdate(null, " ", "World");
        assertEquals(DocumentResponse.Status.INVALID, blankTitle.getStatus());
        assertEquals("Error: Invalid title", blankTitle.getMessage());

        assertEquals("Error: Invalid document id",
            app.getService().createOrUpdate("not-a-uuid", "Hello", "World").getMessage());
        assertEquals(DocumentResponse.VERSION_NOT_FOUND,
            app.getService().restoreVersion(UUID.randomUUID().toString(), 1).getMessage());

        String id = app.getService().createOrUpdate(null, "Hello", "World").getDocumentId();
        assertEquals(DocumentResponse.VERSION_NOT_FOUND, app.getService().restoreVersion(id, 7).getMessage());
        assertEquals(1, app.getService().getDocuments().size());
    }

    @Test
    public void failed_notification_is_not_repeated() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        DocumentApprovalApplication app = start("memory", (documentId, code) -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("Mail server down");
        });
        String id = app.getService().createOrUpdate(null, "Hello", "World").getDocumentId();

        awaitStatus(app, id, ApprovalStatus.APPROVED);
        assertEquals(1, attempts.get());
    }

    @Test
    public void jdbc_journals_survive_restart() throws Exception {
        ApprovalNotifier notifier = (documentId, code) -> notifications.add(documentId);
        DocumentApprovalApplication first = start("jdbc", notifier);
        String id = first.getService().createOrUpdate(null, "Hello", "World").getDocumentId();
        awaitStatus(first, id, ApprovalStatus.APPROVED);
        first.close();
        started.remove(first);

        DocumentApprovalApplication second = start("jdbc", notifier);
        assertTrue(second.getApprovals().status(id).get().isStopped());
        DocumentResponse update = second.getService().createOrUpdate(id, "Hello again", "World");
        assertTrue(update.isAccepted());

        DocumentView view = awaitStatus(second, id, ApprovalStatus.APPROVED);
        assertEquals(2, view.getVersion());
        assertEquals(2, second.getService().getHistory(id).size());
        assertThat("Update starts new approval, replayed events do not", notifications, contains(id, id));
    }

    @Test
    public void memory_store_restart_starts_with_empty_read_model() throws Exception {
        DocumentApprovalApplication first = start();
        String one = first.getService().createOrUpdate(null, "First", "One").getDocumentId();
        String two = first.getService().createOrUpdate(null, "Second", "Two").getDocumentId();
        awaitStatus(first, one, ApprovalStatus.APPROVED);
        awaitStatus(first, two, ApprovalStatus.APPROVED);
        first.close();
        started.remove(first);

        DocumentApprovalApplication second = start();
        assertTrue("Documents of previous run are gone with its events",
            second.getService().getDocuments().isEmpty());
        DocumentResponse three = second.getService().createOrUpdate(null, "Third", "Three");

        assertEquals(DocumentResponse.Status.ACCEPTED, three.getStatus());
        awaitStatus(second, three.getDocumentId(), ApprovalStatus.APPROVED);
        assertEquals(1, second.getService().getDocuments().size());
    }

    @Test
    public void read_model_ahead_of_journal_is_refused() throws Exception {
        ApprovalNotifier notifier = (documentId, code) -> { };
        DocumentApprovalApplication first = start("jdbc", notifier);
        String id = first.getService().createOrUpdate(null, "Hello", "World").getDocumentId();
        awaitStatus(first, id, ApprovalStatus.APPROVED);
        first.close();
        started.remove(first);

        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL(jdbcUrl());
        new JdbcTemplate(ds).update("UPDATE Offsets SET OffsetCount = OffsetCount + 10 WHERE OffsetName = ?",
            ReadModelSchema.PROJECTION_NAME);
        try {
            start("jdbc", notifier);
            fail("Read model past the end of the journal should not start");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("document journal ends at"));
        }
    }

    @Test
    public void close_lets_running_approval_finish() throws Exception {
        CountDownLatch notifying = new CountDownLatch(1);
        AtomicBoolean notified = new AtomicBoolean();
        DocumentApprovalApplication app = start("memory", (documentId, code) -> {
            notifying.countDown();
            Thread.sleep(300);
            notified.set(true);
        });
        captureErrors();
        app.getService().createOrUpdate(null, "Hello", "World");
        assertTrue(notifying.await(5, TimeUnit.SECONDS));

        app.close();
        started.remove(app);

        assertTrue("Notification was not interrupted", notified.get());
        assertThat(errors, empty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknown_store_is_refused() throws Exception {
        start("cassandra", (documentId, code) -> { });
    }
}
