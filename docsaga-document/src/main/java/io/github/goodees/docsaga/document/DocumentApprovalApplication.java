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

import io.github.goodees.docsaga.core.Event;
import io.github.goodees.docsaga.core.aggregate.AggregateRuntime;
import io.github.goodees.docsaga.core.aggregate.EntityRegistry;
import io.github.goodees.docsaga.core.config.DefaultEngineConfiguration;
import io.github.goodees.docsaga.core.config.EngineConfiguration;
import io.github.goodees.docsaga.core.config.EngineExecutors;
import io.github.goodees.docsaga.core.correlation.CorrelationRegistry;
import io.github.goodees.docsaga.core.immutables.JacksonEventSerialization;
import io.github.goodees.docsaga.core.saga.SagaEventSerialization;
import io.github.goodees.docsaga.core.saga.SagaRuntime;
import io.github.goodees.docsaga.core.saga.SagaStarter;
import io.github.goodees.docsaga.core.store.EventLog;
import io.github.goodees.docsaga.core.store.EventStore;
import io.github.goodees.docsaga.core.store.EventStoreException;
import io.github.goodees.docsaga.core.store.GlobalEventLog;
import io.github.goodees.docsaga.core.store.Serialization;
import io.github.goodees.docsaga.core.store.inmemory.InMemoryEventStore;
import io.github.goodees.docsaga.core.store.jdbc.DefaultJdbcSchema;
import io.github.goodees.docsaga.core.store.jdbc.JdbcEventLog;
import io.github.goodees.docsaga.core.store.jdbc.JdbcEventStore;
import io.github.goodees.docsaga.core.store.jdbc.JdbcSchema;
import io.github.goodees.docsaga.core.stream.EventStream;
import io.github.goodees.docsaga.document.approval.ApprovalCodeGenerator;
import io.github.goodees.docsaga.document.approval.ApprovalNotifier;
import io.github.goodees.docsaga.document.approval.ApprovalState;
import io.github.goodees.docsaga.document.approval.ApprovalSagaData;
import io.github.goodees.docsaga.document.approval.DocumentApprovalSaga;
import io.github.goodees.docsaga.document.event.DocumentEvent;
import io.github.goodees.docsaga.document.model.DocumentCommand;
import io.github.goodees.docsaga.document.model.DocumentState;
import io.github.goodees.docsaga.document.readmodel.DocumentProjection;
import io.github.goodees.docsaga.document.readmodel.DocumentQueries;
import io.github.goodees.docsaga.document.readmodel.ReadModelException;
import io.github.goodees.docsaga.document.readmodel.ReadModelSchema;
import io.github.goodees.docsaga.document.service.DocumentResponse;
import io.github.goodees.docsaga.document.service.DocumentService;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Document approval system assembled from its parts: journals of documents and of approval sagas, the global event
 * stream, the document runtime, the approval saga with its starter, the read model projection and the service.
 *
 * <p>Settings are read from {@code docsaga.properties}. Besides engine settings ({@code docsaga.*}, see
 * {@link DefaultEngineConfiguration#fromProperties(Properties)}) these are:</p>
 * <ul>
 * <li>{@code docsaga.store} &ndash; {@code memory} (default) or {@code jdbc} for the journals</li>
 * <li>{@code docsaga.jdbc.url} &ndash; H2 database of the read model, and of the journals in {@code jdbc} mode</li>
 * </ul>
 */
public class DocumentApprovalApplication implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DocumentApprovalApplication.class);

    public static final String STORE_PROPERTY = "docsaga.store";
    public static final String JDBC_URL_PROPERTY = "docsaga.jdbc.url";
    public static final String DEFAULT_JDBC_URL = "jdbc:h2:mem:docsaga;DB_CLOSE_DELAY=-1";
    static final String PROPERTIES_RESOURCE = "docsaga.properties";

    private final EngineConfiguration configuration;
    private final EngineExecutors executors;
    private final EventStream stream;
    private final AggregateRuntime<DocumentState, DocumentCommand, DocumentEvent> documents;
    private final SagaRuntime<DocumentEvent, ApprovalSagaData, ApprovalState> approvals;
    private final DocumentQueries queries;
    private final DocumentService service;
    private final ScheduledFuture<?> passivation;

    private DocumentApprovalApplication(Properties properties, ApprovalCodeGenerator codeGenerator,
            ApprovalNotifier notifier) throws SQLException, EventStoreException, ReadModelException {
        this.configuration = DefaultEngineConfiguration.fromProperties(properties);
        boolean jdbc = isJdbcStore(properties);
        logger.info("Starting with {}", configuration);
        DataSource dataSource = dataSource(properties.getProperty(JDBC_URL_PROPERTY, DEFAULT_JDBC_URL));

        Journal documentJournal = jdbc ? jdbcJournal(dataSource, "document",
            new JacksonEventSerialization<>(DocumentEvent.class)) : memoryJournal();
        Journal sagaJournal = jdbc ? jdbcJournal(dataSource, "approval_saga",
            new SagaEventSerialization<>(ApprovalState.class)) : memoryJournal();

        ReadModelSchema.createTables(dataSource);
        if (!jdbc) {
            // events of the previous run are gone, the read model must follow
            ReadModelSchema.clear(dataSource);
        }
        this.queries = new DocumentQueries(dataSource);
        long projected = queries.lastOffset();
        long journaled = documentJournal.global.lastOffset();
        if (projected > journaled) {
            throw new IllegalStateException("Read model is at offset " + projected
                    + " but the document journal ends at " + journaled);
        }

        this.executors = new EngineExecutors(configuration);

        this.stream = new EventStream(documentJournal.global, executors.getStreams(), executors.getScheduler(),
                configuration);
        this.documents = new AggregateRuntime<>(DocumentAggregate.ENTITY_NAME, new DocumentAggregate(),
                DocumentCommand.class, DocumentEvent.class, documentJournal.store, documentJournal.log, executors,
                configuration, stream);
        EntityRegistry registry = new EntityRegistry().register(documents);
        this.approvals = new SagaRuntime<>(DocumentApprovalSaga.SAGA_NAME,
                new DocumentApprovalSaga(codeGenerator, notifier), DocumentEvent.class, sagaJournal.store,
                sagaJournal.log, sagaJournal.global, registry, executors, configuration);

        CorrelationRegistry correlations = new CorrelationRegistry(executors.getScheduler(),
                configuration.getCorrelationTimeout());
        stream.addTransientListener(correlations);

        this.service = new DocumentService(documents, correlations, queries);

        SagaStarter starter = new SagaStarter(approvals,
                configuration.getCommandTimeout().plus(configuration.getSagaDispatchTimeout()));
        List<String> recovered = approvals.recover();
        starter.activate(recovered);
        logger.info("Recovered {} running approval sagas", recovered.size());

        stream.subscribe(ReadModelSchema.PROJECTION_NAME, projected,
            new DocumentProjection(dataSource, correlations));
        // sagas recognize redelivered events, so they may read the stream from the start
        stream.subscribe(DocumentApprovalSaga.SAGA_NAME, 0, starter);
        stream.start();

        Duration idle = configuration.getIdleTimeout();
        this.passivation = executors.getScheduler().scheduleWithFixedDelay(this::passivateIdle, idle.toMillis(),
            idle.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Start with settings from classpath resource {@code docsaga.properties}, generating random approval codes and
     * logging notifications.
     * @return running application
     * @throws Exception when the application cannot be started
     */
    public static DocumentApprovalApplication start() throws Exception {
        return start(loadProperties());
    }

    public static DocumentApprovalApplication start(Properties properties)
            throws SQLException, EventStoreException, ReadModelException {
        return start(properties, ApprovalCodeGenerator.random(), ApprovalNotifier.logging());
    }

    public static DocumentApprovalApplication start(Properties properties, ApprovalCodeGenerator codeGenerator,
            ApprovalNotifier notifier) throws SQLException, EventStoreException, ReadModelException {
        return new DocumentApprovalApplication(properties, codeGenerator, notifier);
    }

    static Properties loadProperties() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = DocumentApprovalApplication.class.getClassLoader()
                .getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.warn("{} not found on classpath, using defaults", PROPERTIES_RESOURCE);
            }
        }
        properties.putAll(System.getProperties());
        return properties;
    }

    private static boolean isJdbcStore(Properties properties) {
        String store = properties.getProperty(STORE_PROPERTY, "memory").trim();
        switch (store) {
            case "memory":
                return false;
            case "jdbc":
                return true;
            default:
                throw new IllegalArgumentException("Unknown " + STORE_PROPERTY + ": " + store);
        }
    }

    private static DataSource dataSource(String url) {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL(url);
        ds.setUser("sa");
        return ds;
    }

    private static Journal memoryJournal() {
        InMemoryEventStore store = new InMemoryEventStore();
        return new Journal(store, store, store);
    }

    private static <E extends Event> Journal jdbcJournal(DataSource dataSource,
            String prefix, Serialization<E> serialization) throws SQLException {
        JdbcSchema schema = new DefaultJdbcSchema(prefix);
        try (Connection connection = dataSource.getConnection()) {
            schema.createTables(connection);
        }
        JdbcEventLog<E> log = new JdbcEventLog<>(dataSource, schema, serialization, true);
        return new Journal(new JdbcEventStore<>(dataSource, schema, serialization), log, log);
    }

    private void passivateIdle() {
        Duration idle = configuration.getIdleTimeout();
        int passivated = documents.passivateIdle(idle) + approvals.passivateIdle(idle);
        if (passivated > 0) {
            logger.debug("Passivated {} idle entities", passivated);
        }
    }

    public DocumentService getService() {
        return service;
    }

    public DocumentQueries getQueries() {
        return queries;
    }

    public AggregateRuntime<DocumentState, DocumentCommand, DocumentEvent> getDocuments() {
        return documents;
    }

    public SagaRuntime<DocumentEvent, ApprovalSagaData, ApprovalState> getApprovals() {
        return approvals;
    }

    /**
     * Stop delivering events, let requests already dispatched complete, then stop the thread pools.
     */
    @Override
    public void close() {
        passivation.cancel(false);
        stream.close();
        awaitIdle(configuration.getCommandTimeout().plus(configuration.getSagaDispatchTimeout()));
        executors.close();
        logger.info("Stopped");
    }

    private void awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            // a saga stays busy while its commands run, so both runtimes must be idle at once
            while (!(documents.isIdle() && approvals.isIdle())) {
                if (System.nanoTime() > deadline) {
                    logger.warn("Requests still running after {}, stopping anyway", timeout);
                    return;
                }
                TimeUnit.MILLISECONDS.sleep(10);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Submit one document given by title and content, and print the read model once it is approved.
     * @param args title and content
     * @throws Exception when the application fails
     */
    public static void main(String[] args) throws Exception {
        if (args.length != 2) {
            System.err.println("Usage: DocumentApprovalApplication <title> <content>");
            System.exit(2);
        }
        try (DocumentApprovalApplication app = start()) {
            DocumentResponse response = app.getService().createOrUpdate(null, args[0], args[1]);
            System.out.println(response.getMessage());
            if (response.isAccepted()) {
                // wait for the saga to finish the approval
                long deadline = System.currentTimeMillis() + app.configuration.getCorrelationTimeout().toMillis();
                while (!app.getApprovals().status(response.getDocumentId()).get().isStopped()
                        && System.currentTimeMillis() < deadline) {
                    Thread.sleep(app.configuration.getPollInterval().toMillis());
                }
                app.getService().getDocuments().forEach(System.out::println);
            }
        }
    }

    private static final class Journal {
        private final EventStore store;
        private final EventLog log;
        private final GlobalEventLog global;

        Journal(EventStore store, EventLog log, GlobalEventLog global) {
            this.store = store;
            this.log = log;
            this.global = global;
        }
    }
}
