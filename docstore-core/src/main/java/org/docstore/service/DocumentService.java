/*
 * DocumentService.java
 *
 * This source file is part of the Docstore open source project
 *
 * Copyright 2024-2026 the Docstore project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.docstore.service;

import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Ints;
import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Durations;
import com.google.protobuf.util.Timestamps;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.docstore.DocumentStoreConfig;
import org.docstore.DocumentStoreException;
import org.docstore.DocumentStoreExceptions;
import org.docstore.cursors.ListCursor;
import org.docstore.cursors.ResultCursor;
import org.docstore.listen.ListenRequest;
import org.docstore.listen.ListenResponse;
import org.docstore.listen.ListenStreamHandler;
import org.docstore.logging.KeyValueLogMessage;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.DatabaseId;
import org.docstore.model.Document;
import org.docstore.model.DocumentMask;
import org.docstore.model.Precondition;
import org.docstore.model.ResourcePath;
import org.docstore.model.Value;
import org.docstore.model.Write;
import org.docstore.model.WriteResult;
import org.docstore.query.AggregationQuery;
import org.docstore.query.Order;
import org.docstore.query.QueryEvaluator;
import org.docstore.query.RunAggregationQueryResponse;
import org.docstore.query.RunQueryResponse;
import org.docstore.query.StructuredQuery;
import org.docstore.storage.DocumentSource;
import org.docstore.storage.DocumentStore;
import org.docstore.transaction.ReadOptions;
import org.docstore.transaction.TransactionBackend;
import org.docstore.transaction.TransactionCoordinator;
import org.docstore.transaction.TransactionOptions;
import org.docstore.transaction.TransactionRecord;
import org.docstore.write.BatchWriteResponse;
import org.docstore.write.CommitResponse;
import org.docstore.write.WritePipeline;
import org.docstore.write.WriteRequest;
import org.docstore.write.WriteResponse;
import org.docstore.write.WriteStreamHandler;
import org.docstore.write.WriteStreamRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Executor;

/**
 * The logical RPC surface of one database: document reads and writes, queries, transactions and the
 * Write and Listen streams.
 *
 * <p>
 * Unary calls run on the caller's thread and report failures by throwing a
 * {@link DocumentStoreException}. Streaming calls take the observer that receives responses and
 * return the observer that accepts requests, the shape a gRPC binding expects.
 * </p>
 *
 * <p>
 * Reads take a {@link ReadOptions}: the latest state, a past read time inside the staleness window,
 * an existing transaction, or (for {@link #batchGetDocuments}, {@link #runQuery} and
 * {@link #runAggregationQuery} only) a new transaction that is reported back in the first response.
 * </p>
 */
public class DocumentService implements TransactionBackend {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentService.class);
    @Nonnull
    private static final BaseEncoding PAGE_TOKEN_ENCODING = BaseEncoding.base64Url().omitPadding();
    private static final String AUTO_ID_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int AUTO_ID_LENGTH = 20;

    @Nonnull
    private final DatabaseId databaseId;
    @Nonnull
    private final DocumentStoreConfig config;
    @Nonnull
    private final DocumentStore store;
    @Nonnull
    private final QueryEvaluator evaluator;
    @Nonnull
    private final TransactionCoordinator coordinator;
    @Nonnull
    private final WriteStreamRegistry writeStreams;
    @Nonnull
    private final Executor streamExecutor;
    @Nonnull
    private final SecureRandom random = new SecureRandom();

    /**
     * Create a service over a new, empty store.
     *
     * @param databaseId the database served
     * @param config service configuration
     * @param streamExecutor runs the work of Listen streams
     */
    public DocumentService(@Nonnull DatabaseId databaseId, @Nonnull DocumentStoreConfig config,
                           @Nonnull Executor streamExecutor) {
        this.databaseId = databaseId;
        this.config = config;
        this.store = new DocumentStore(config.getClock());
        this.evaluator = new QueryEvaluator(config.getQueryProgressInterval());
        this.coordinator = new TransactionCoordinator(store, new WritePipeline(databaseId), evaluator, config);
        this.writeStreams = new WriteStreamRegistry(config.getClock());
        this.streamExecutor = streamExecutor;
    }

    @Nonnull
    public DatabaseId getDatabaseId() {
        return databaseId;
    }

    @Nonnull
    public DocumentStoreConfig getConfig() {
        return config;
    }

    @Nonnull
    public DocumentStore getStore() {
        return store;
    }

    @Nonnull
    public WriteStreamRegistry getWriteStreams() {
        return writeStreams;
    }

    @Nonnull
    public TransactionCoordinator getCoordinator() {
        return coordinator;
    }

    /**
     * Read one document.
     *
     * @param name full document name
     * @param mask fields to return, or {@code null} for all
     * @param consistency how to read
     * @return the document
     * @throws DocumentStoreExceptions.NotFoundException if the document does not exist
     */
    @Nonnull
    public Document getDocument(@Nonnull String name, @Nullable DocumentMask mask, @Nonnull ReadOptions consistency) {
        ResourcePath path = databaseId.parseDocumentName(name);
        ReadContext context = resolve(consistency, false);
        Document document = context.source.get(path);
        if (context.transaction != null) {
            coordinator.recordRead(context.transaction, path);
        }
        if (document == null) {
            throw new DocumentStoreExceptions.NotFoundException("document not found",
                    LogMessageKeys.DOCUMENT, name,
                    LogMessageKeys.READ_TIME, Timestamps.toString(context.source.getReadTime()));
        }
        return document.project(mask);
    }

    /**
     * List the documents of one collection, a page at a time. Every page of a listing reads at the
     * same time as the first one, unless the caller asks for another consistency.
     *
     * @param request what to list
     * @return one page
     */
    @Nonnull
    public ListDocumentsResponse listDocuments(@Nonnull ListDocumentsRequest request) {
        if (request.getPageSize() < 0) {
            throw new DocumentStoreExceptions.InvalidArgumentException("page size must not be negative",
                    LogMessageKeys.PAGE_SIZE, request.getPageSize());
        }
        if (request.isShowMissing() && !request.getOrderBy().isEmpty()) {
            throw new DocumentStoreExceptions.InvalidArgumentException("listing missing documents does not support an order");
        }
        ResourcePath parent = databaseId.parseParent(request.getParent());
        ResourcePath collection = collectionUnder(parent, request.getCollectionId());
        StructuredQuery query = StructuredQuery.newBuilder()
                .from(request.getCollectionId())
                .orderBy(request.getOrderBy().toArray(new Order[0]))
                .build();
        query.validate();

        int offset = 0;
        ReadContext context;
        if (request.getPageToken().isEmpty()) {
            context = resolve(request.getConsistency(), false);
        } else {
            PageToken token = PageToken.decode(request.getPageToken());
            offset = token.offset;
            context = request.getConsistency().getKind() == ReadOptions.Kind.LATEST
                      ? new ReadContext(store.snapshot(token.readTime), null, null)
                      : resolve(request.getConsistency(), false);
        }

        List<Document> documents = evaluator.candidates(parent, query, context.source);
        if (context.transaction != null) {
            coordinator.recordQuery(context.transaction, parent, query, documents);
        }
        if (request.isShowMissing()) {
            documents = withMissing(collection, documents, context.source);
        }
        int from = Math.min(offset, documents.size());
        int to = request.getPageSize() == 0 ? documents.size() : Math.min(documents.size(), from + request.getPageSize());
        List<Document> page = new ArrayList<>(to - from);
        for (Document document : documents.subList(from, to)) {
            page.add(document.project(request.getMask()));
        }
        String nextPageToken = to < documents.size()
                               ? new PageToken(to, context.source.getReadTime()).encode()
                               : "";
        return new ListDocumentsResponse(page, nextPageToken);
    }

    // Documents that do not exist themselves but have descendants, merged in name order.
    @Nonnull
    private static List<Document> withMissing(@Nonnull ResourcePath collection, @Nonnull List<Document> documents,
                                              @Nonnull DocumentSource source) {
        Map<ResourcePath, Document> byPath = new TreeMap<>();
        for (Document document : documents) {
            byPath.put(document.getPath(), document);
        }
        int childSize = collection.size() + 1;
        for (Document descendant : source.scan(collection)) {
            ResourcePath path = descendant.getPath();
            if (path.size() > childSize) {
                ResourcePath child = ResourcePath.fromSegments(path.getSegments().subList(0, childSize));
                if (!byPath.containsKey(child) && source.get(child) == null) {
                    byPath.put(child, Document.missing(child.canonicalString()));
                }
            }
        }
        return new ArrayList<>(byPath.values());
    }

    /**
     * Create a document that must not exist yet.
     *
     * @param parent parent resource name: the documents root or a document
     * @param collectionId collection to create the document in
     * @param documentId id of the new document, or {@code null} to generate one
     * @param fields the document contents
     * @param mask fields of the created document to return, or {@code null} for all
     * @return the created document
     * @throws DocumentStoreExceptions.AlreadyExistsException if the document exists
     */
    @Nonnull
    public Document createDocument(@Nonnull String parent, @Nonnull String collectionId, @Nullable String documentId,
                                   @Nonnull Map<String, Value> fields, @Nullable DocumentMask mask) {
        ResourcePath collection = collectionUnder(databaseId.parseParent(parent), collectionId);
        ResourcePath path = collection.append(documentId == null ? autoId() : documentId);
        String name = path.canonicalString();
        Write write = Write.update(Document.of(name, fields)).withPrecondition(Precondition.exists(false));
        CommitResponse response;
        try {
            response = coordinator.commit(null, ImmutableList.of(write));
        } catch (DocumentStoreExceptions.FailedPreconditionException e) {
            DocumentStoreExceptions.AlreadyExistsException exists =
                    new DocumentStoreExceptions.AlreadyExistsException("document already exists",
                            LogMessageKeys.DOCUMENT, name);
            exists.initCause(e);
            throw exists;
        }
        return readBack(path, response.getCommitTime(), mask);
    }

    /**
     * Create or update a document.
     *
     * @param document the new contents
     * @param updateMask fields to replace, or {@code null} to replace the whole document
     * @param mask fields of the result to return, or {@code null} for all
     * @param currentDocument condition on the stored document
     * @return the document after the update
     */
    @Nonnull
    public Document updateDocument(@Nonnull Document document, @Nullable DocumentMask updateMask,
                                   @Nullable DocumentMask mask, @Nonnull Precondition currentDocument) {
        ResourcePath path = databaseId.parseDocumentName(document.getName());
        Write write = updateMask == null ? Write.update(document) : Write.update(document, updateMask);
        CommitResponse response = coordinator.commit(null, ImmutableList.of(write.withPrecondition(currentDocument)));
        return readBack(path, response.getCommitTime(), mask);
    }

    public void deleteDocument(@Nonnull String name, @Nonnull Precondition currentDocument) {
        databaseId.parseDocumentName(name);
        coordinator.commit(null, ImmutableList.of(Write.delete(name).withPrecondition(currentDocument)));
    }

    @Nonnull
    private Document readBack(@Nonnull ResourcePath path, @Nonnull Timestamp commitTime, @Nullable DocumentMask mask) {
        Document stored = store.snapshot(commitTime).get(path);
        if (stored == null) {
            throw new DocumentStoreExceptions.InternalException("written document is not readable",
                    LogMessageKeys.DOCUMENT, path.canonicalString(),
                    LogMessageKeys.COMMIT_TIME, Timestamps.toString(commitTime));
        }
        return stored.project(mask);
    }

    /**
     * Read several documents at once, in request order.
     *
     * @param names full document names
     * @param mask fields to return, or {@code null} for all
     * @param consistency how to read; may begin a new transaction
     * @return one response per name
     */
    @Nonnull
    public ResultCursor<BatchGetDocumentsResponse> batchGetDocuments(@Nonnull List<String> names,
                                                                     @Nullable DocumentMask mask,
                                                                     @Nonnull ReadOptions consistency) {
        List<ResourcePath> paths = new ArrayList<>(names.size());
        for (String name : names) {
            paths.add(databaseId.parseDocumentName(name));
        }
        ReadContext context = resolve(consistency, true);
        Timestamp readTime = context.source.getReadTime();
        ByteString began = context.began;
        List<BatchGetDocumentsResponse> responses = new ArrayList<>(paths.size());
        for (ResourcePath path : paths) {
            Document document = context.source.get(path);
            if (context.transaction != null) {
                coordinator.recordRead(context.transaction, path);
            }
            responses.add(document == null
                          ? BatchGetDocumentsResponse.missing(path.canonicalString(), began, readTime)
                          : BatchGetDocumentsResponse.found(document.project(mask), began, readTime));
            began = null;
        }
        if (responses.isEmpty() && began != null) {
            throw new DocumentStoreExceptions.InvalidArgumentException("a new transaction needs at least one document");
        }
        return new ListCursor<>(responses);
    }

    @Nonnull
    @Override
    public ByteString beginTransaction(@Nonnull TransactionOptions options) {
        return coordinator.begin(options).getToken();
    }

    /**
     * Commit writes atomically, inside a transaction or on their own.
     *
     * @param transaction the transaction to commit, or {@code null}
     * @param writes the writes, applied in order
     * @return the commit time and per-write results
     */
    @Nonnull
    @Override
    public CommitResponse commit(@Nullable ByteString transaction, @Nonnull List<Write> writes) {
        return coordinator.commit(transaction, writes);
    }

    @Override
    public void rollback(@Nonnull ByteString transaction) {
        coordinator.rollback(transaction);
    }

    @Nullable
    @Override
    public Document getDocument(@Nonnull String name, @Nonnull ByteString transaction) {
        ResourcePath path = databaseId.parseDocumentName(name);
        TransactionRecord record = coordinator.lookupActive(transaction);
        Document document = coordinator.snapshot(record).get(path);
        coordinator.recordRead(record, path);
        return document;
    }

    @Nonnull
    @Override
    public List<Document> runQuery(@Nonnull String parent, @Nonnull StructuredQuery query,
                                   @Nonnull ByteString transaction) {
        ResourcePath parentPath = databaseId.parseParent(parent);
        TransactionRecord record = coordinator.lookupActive(transaction);
        List<Document> results = evaluator.evaluate(parentPath, query, coordinator.snapshot(record));
        coordinator.recordQuery(record, parentPath, query, results);
        return results;
    }

    /**
     * Run a query.
     *
     * @param parent parent resource name: the documents root or a document
     * @param query the query
     * @param consistency how to read; may begin a new transaction
     * @return the responses, at least one
     */
    @Nonnull
    public ResultCursor<RunQueryResponse> runQuery(@Nonnull String parent, @Nonnull StructuredQuery query,
                                                   @Nonnull ReadOptions consistency) {
        ResourcePath parentPath = databaseId.parseParent(parent);
        query.validate();
        ReadContext context = resolve(consistency, true);
        if (context.transaction != null && !context.transaction.isReadOnly()) {
            coordinator.recordQuery(context.transaction, parentPath, query,
                    evaluator.evaluate(parentPath, query, context.source));
        }
        return evaluator.execute(parentPath, query, context.source, context.began);
    }

    /**
     * Run an aggregation query. Inside a read-write transaction the documents it aggregates count as
     * read, so a concurrent change to any of them aborts the commit.
     *
     * @param parent parent resource name: the documents root or a document
     * @param aggregation the aggregation query
     * @param consistency how to read; may begin a new transaction
     * @return the aggregate values and their read time
     */
    @Nonnull
    public RunAggregationQueryResponse runAggregationQuery(@Nonnull String parent, @Nonnull AggregationQuery aggregation,
                                                           @Nonnull ReadOptions consistency) {
        ResourcePath parentPath = databaseId.parseParent(parent);
        aggregation.validate();
        ReadContext context = resolve(consistency, true);
        if (context.transaction != null && !context.transaction.isReadOnly()) {
            coordinator.recordQuery(context.transaction, parentPath, aggregation.getQuery(),
                    evaluator.evaluate(parentPath, aggregation.getQuery(), context.source));
        }
        Map<String, Value> result = evaluator.aggregate(parentPath, aggregation, context.source);
        return new RunAggregationQueryResponse(context.began, result, context.source.getReadTime());
    }

    /**
     * Open a Write stream.
     *
     * @param responseObserver receives the stream's responses
     * @return the observer to send requests to
     */
    @Nonnull
    public StreamObserver<WriteRequest> write(@Nonnull StreamObserver<WriteResponse> responseObserver) {
        return new WriteStreamHandler(writes -> coordinator.commit(null, writes), writeStreams,
                config.getMaxUnacknowledgedWrites(), responseObserver);
    }

    /**
     * Open a Listen stream.
     *
     * @param responseObserver receives the stream's responses
     * @return the observer to send requests to
     */
    @Nonnull
    public StreamObserver<ListenRequest> listen(@Nonnull StreamObserver<ListenResponse> responseObserver) {
        ListenStreamHandler handler = new ListenStreamHandler(databaseId, store, evaluator, streamExecutor,
                responseObserver);
        handler.start();
        return handler;
    }

    /**
     * List the ids of the collections directly under a parent, in order.
     *
     * @param parent the documents root or a document name
     * @param pageSize maximum ids per page; {@code 0} means no limit
     * @param pageToken token from the previous page, or empty
     * @param consistency how to read; transactions are not allowed
     * @return one page of ids
     */
    @Nonnull
    public ListCollectionIdsResponse listCollectionIds(@Nonnull String parent, int pageSize, @Nonnull String pageToken,
                                                       @Nonnull ReadOptions consistency) {
        if (pageSize < 0) {
            throw new DocumentStoreExceptions.InvalidArgumentException("page size must not be negative",
                    LogMessageKeys.PAGE_SIZE, pageSize);
        }
        if (consistency.getKind() != ReadOptions.Kind.LATEST && consistency.getKind() != ReadOptions.Kind.READ_TIME) {
            throw new DocumentStoreExceptions.InvalidArgumentException("collection ids cannot be read in a transaction");
        }
        ResourcePath parentPath = databaseId.parseParent(parent);
        DocumentSource source = resolve(consistency, false).source;
        NavigableSet<String> ids = new TreeSet<>();
        for (Document document : source.scan(parentPath)) {
            if (document.getPath().size() > parentPath.size()) {
                ids.add(document.getPath().get(parentPath.size()));
            }
        }
        if (!pageToken.isEmpty()) {
            ids = ids.tailSet(decodeCollectionToken(pageToken), false);
        }
        List<String> page = new ArrayList<>();
        for (String id : ids) {
            if (pageSize > 0 && page.size() == pageSize) {
                break;
            }
            page.add(id);
        }
        String nextPageToken = page.size() < ids.size()
                               ? PAGE_TOKEN_ENCODING.encode(page.get(page.size() - 1).getBytes(StandardCharsets.UTF_8))
                               : "";
        return new ListCollectionIdsResponse(page, nextPageToken);
    }

    @Nonnull
    private static String decodeCollectionToken(@Nonnull String pageToken) {
        try {
            return new String(PAGE_TOKEN_ENCODING.decode(pageToken), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new DocumentStoreExceptions.InvalidArgumentException("invalid page token", e);
        }
    }

    /**
     * Apply writes independently of each other. Each write commits on its own, so some may succeed
     * while others fail; no two writes may name the same document.
     *
     * @param writes the writes
     * @return one result and one status per write
     */
    @Nonnull
    public BatchWriteResponse batchWrite(@Nonnull List<Write> writes) {
        Set<String> names = new HashSet<>();
        for (Write write : writes) {
            if (!names.add(write.getName())) {
                throw new DocumentStoreExceptions.InvalidArgumentException("a batch write may not write a document twice",
                        LogMessageKeys.DOCUMENT, write.getName());
            }
        }
        List<WriteResult> results = new ArrayList<>(writes.size());
        List<Status> statuses = new ArrayList<>(writes.size());
        for (Write write : writes) {
            try {
                CommitResponse response = coordinator.commit(null, ImmutableList.of(write));
                results.add(response.getWriteResults().get(0));
                statuses.add(Status.OK);
            } catch (DocumentStoreException e) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("batch write failed",
                            LogMessageKeys.DOCUMENT, write.getName(),
                            LogMessageKeys.CODE, e.getCode()), e);
                }
                results.add(new WriteResult(null, ImmutableList.of()));
                statuses.add(e.toStatus());
            }
        }
        return new BatchWriteResponse(results, statuses);
    }

    /**
     * Expire stale transactions, forget write streams whose connection has been gone for longer
     * than the transaction timeout, and discard document versions that nothing can read any more:
     * those older than the version retention and older than every active transaction.
     *
     * @return the number of versions discarded
     */
    public int maintain() {
        int expired = coordinator.expireStale();
        int expiredStreams = writeStreams.expireIdle(config.getTransactionTimeout());
        Timestamp horizon = Timestamps.subtract(store.wallTime(),
                Durations.fromMillis(config.getVersionRetention().toMillis()));
        Timestamp oldestActive = coordinator.oldestActiveReadTime();
        if (oldestActive != null && Timestamps.compare(oldestActive, horizon) < 0) {
            horizon = oldestActive;
        }
        int pruned = store.prune(horizon);
        if ((expired > 0 || expiredStreams > 0 || pruned > 0) && LOGGER.isInfoEnabled()) {
            LOGGER.info(KeyValueLogMessage.of("maintenance",
                    LogMessageKeys.DATABASE, databaseId.getName(),
                    LogMessageKeys.COUNT, expired,
                    LogMessageKeys.EXPIRED_STREAMS, expiredStreams,
                    LogMessageKeys.PRUNED_VERSIONS, pruned,
                    LogMessageKeys.HORIZON, Timestamps.toString(horizon)));
        }
        return pruned;
    }

    @Nonnull
    private ResourcePath collectionUnder(@Nonnull ResourcePath parent, @Nonnull String collectionId) {
        if (collectionId.isEmpty() || collectionId.contains("/")) {
            throw new DocumentStoreExceptions.InvalidArgumentException("invalid collection id",
                    LogMessageKeys.COLLECTION_ID, collectionId);
        }
        return parent.append(collectionId);
    }

    @Nonnull
    private String autoId() {
        StringBuilder id = new StringBuilder(AUTO_ID_LENGTH);
        for (int i = 0; i < AUTO_ID_LENGTH; i++) {
            id.append(AUTO_ID_ALPHABET.charAt(random.nextInt(AUTO_ID_ALPHABET.length())));
        }
        return id.toString();
    }

    @Nonnull
    private ReadContext resolve(@Nonnull ReadOptions consistency, boolean allowNewTransaction) {
        switch (consistency.getKind()) {
            case TRANSACTION: {
                TransactionRecord record = coordinator.lookupActive(consistency.getTransaction());
                return new ReadContext(coordinator.snapshot(record), record, null);
            }
            case NEW_TRANSACTION: {
                if (!allowNewTransaction) {
                    throw new DocumentStoreExceptions.InvalidArgumentException(
                            "this operation cannot begin a transaction");
                }
                TransactionRecord record = coordinator.begin(consistency.getNewTransaction());
                return new ReadContext(coordinator.snapshot(record), record, record.getToken());
            }
            case READ_TIME: {
                Timestamp readTime = consistency.getReadTime();
                coordinator.validateReadTime(readTime);
                return new ReadContext(store.snapshot(readTime), null, null);
            }
            case LATEST:
            default:
                return new ReadContext(store.snapshot(store.currentReadTime()), null, null);
        }
    }

    private static final class ReadContext {
        @Nonnull
        private final DocumentSource source;
        @Nullable
        private final TransactionRecord transaction;
        @Nullable
        private final ByteString began;

        ReadContext(@Nonnull DocumentSource source, @Nullable TransactionRecord transaction, @Nullable ByteString began) {
            this.source = source;
            this.transaction = transaction;
            this.began = began;
        }
    }

    // offset (4 bytes, big-endian) followed by the serialized read time
    private static final class PageToken {
        private final int offset;
        @Nonnull
        private final Timestamp readTime;

        PageToken(int offset, @Nonnull Timestamp readTime) {
            this.offset = offset;
            this.readTime = readTime;
        }

        @Nonnull
        String encode() {
            byte[] time = readTime.toByteArray();
            byte[] bytes = Arrays.copyOf(Ints.toByteArray(offset), Integer.BYTES + time.length);
            System.arraycopy(time, 0, bytes, Integer.BYTES, time.length);
            return PAGE_TOKEN_ENCODING.encode(bytes);
        }

        @Nonnull
        static PageToken decode(@Nonnull String token) {
            try {
                byte[] bytes = PAGE_TOKEN_ENCODING.decode(token);
                if (bytes.length < Integer.BYTES) {
                    throw new DocumentStoreExceptions.InvalidArgumentException("invalid page token",
                            LogMessageKeys.PAGE_TOKEN, token);
                }
                int offset = Ints.fromByteArray(bytes);
                Timestamp readTime = Timestamp.parseFrom(Arrays.copyOfRange(bytes, Integer.BYTES, bytes.length));
                if (offset < 0 || !Timestamps.isValid(readTime)) {
                    throw new DocumentStoreExceptions.InvalidArgumentException("invalid page token",
                            LogMessageKeys.PAGE_TOKEN, token);
                }
                return new PageToken(offset, readTime);
            } catch (IllegalArgumentException | InvalidProtocolBufferException e) {
                throw new DocumentStoreExceptions.InvalidArgumentException("invalid page token", e);
            }
        }
    }
}
