/*
 * DocumentStore.java
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

package org.docstore.storage;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.KeyValueLogMessage;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.Document;
import org.docstore.model.ResourcePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory multi-version document storage. Each document path keeps a chain of versions
 * stamped with their commit times, which lets readers see any point in time inside the
 * retained window without blocking writers.
 *
 * <p>
 * Commits are serialised: {@link #commit(CommitFunction)} runs the staging function under the
 * store's write lock, publishes the result at a fresh commit time and notifies the registered
 * {@link CommitListener}s in commit order.
 * </p>
 */
public class DocumentStore {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentStore.class);

    @Nonnull
    private final ConcurrentSkipListMap<ResourcePath, VersionChain> documents = new ConcurrentSkipListMap<>();
    @Nonnull
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    @Nonnull
    private final CopyOnWriteArrayList<CommitListener> listeners = new CopyOnWriteArrayList<>();
    @Nonnull
    private final CommitClock clock;
    @Nonnull
    private volatile Timestamp earliestReadTime = Timestamps.EPOCH;

    public DocumentStore(@Nonnull Clock clock) {
        this.clock = new CommitClock(clock);
    }

    /**
     * Stage the changes of one commit. Called with the store locked against other commits.
     */
    @FunctionalInterface
    public interface CommitFunction {
        /**
         * Compute the changes to publish.
         *
         * @param latest the current state of the store
         * @param commitTime the time the changes will be published at
         * @return the changes to publish
         */
        @Nonnull
        MutationBatch stage(@Nonnull DocumentSource latest, @Nonnull Timestamp commitTime);
    }

    /**
     * Current time as a read time. Every commit published so far is visible at it, and no later
     * commit will be.
     *
     * @return a read time
     */
    @Nonnull
    public Timestamp currentReadTime() {
        lock.readLock().lock();
        try {
            return clock.readTime();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Wall-clock time of the store's clock, as a timestamp. Unlike {@link #currentReadTime()} this
     * does not reserve anything.
     *
     * @return the current time
     */
    @Nonnull
    public Timestamp wallTime() {
        return Timestamps.fromMicros(clock.nowMicros());
    }

    @Nonnull
    public Timestamp getEarliestReadTime() {
        return earliestReadTime;
    }

    /**
     * A view of the store as of {@code readTime}.
     *
     * @param readTime the point in time to read at
     * @return the view
     * @throws DocumentStoreExceptions.InvalidArgumentException if older versions have already been discarded
     */
    @Nonnull
    public DocumentSource snapshot(@Nonnull Timestamp readTime) {
        if (Timestamps.compare(readTime, earliestReadTime) < 0) {
            throw new DocumentStoreExceptions.InvalidArgumentException("read time is older than the retained versions",
                    LogMessageKeys.READ_TIME, Timestamps.toString(readTime),
                    LogMessageKeys.HORIZON, Timestamps.toString(earliestReadTime));
        }
        return new Snapshot(readTime);
    }

    /**
     * Time of the newest version of a document, including deletions.
     *
     * @param path document path
     * @return the last change time, or {@code null} if no retained version exists
     */
    @Nullable
    public Timestamp lastChangeTime(@Nonnull ResourcePath path) {
        VersionChain chain = documents.get(path);
        return chain == null ? null : chain.lastChangeTime();
    }

    /**
     * Run {@code function} and publish the changes it stages atomically.
     *
     * @param function computes the changes from the latest state
     * @return the published commit
     */
    @Nonnull
    public CommitEvent commit(@Nonnull CommitFunction function) {
        lock.writeLock().lock();
        try {
            Timestamp commitTime = clock.nextCommitTime();
            MutationBatch batch = function.stage(new Snapshot(commitTime), commitTime);
            List<DocumentMutation> mutations = new ArrayList<>(batch.getChanges().size());
            for (Map.Entry<ResourcePath, Document> change : batch.getChanges().entrySet()) {
                VersionChain chain = documents.computeIfAbsent(change.getKey(), ignore -> new VersionChain());
                Document before = chain.at(commitTime);
                chain.append(commitTime, change.getValue());
                mutations.add(new DocumentMutation(change.getKey(), before, change.getValue()));
            }
            CommitEvent event = new CommitEvent(commitTime, mutations);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("published commit",
                        LogMessageKeys.COMMIT_TIME, Timestamps.toString(commitTime),
                        LogMessageKeys.WRITE_COUNT, mutations.size()));
            }
            if (!mutations.isEmpty()) {
                for (CommitListener listener : listeners) {
                    listener.onCommit(event);
                }
            }
            return event;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void addListener(@Nonnull CommitListener listener) {
        listeners.add(listener);
    }

    public void removeListener(@Nonnull CommitListener listener) {
        listeners.remove(listener);
    }

    /**
     * Discard versions that no read at or after {@code horizon} can observe.
     *
     * @param horizon oldest read time that must stay readable
     * @return the number of versions discarded
     */
    public int prune(@Nonnull Timestamp horizon) {
        int pruned = 0;
        lock.writeLock().lock();
        try {
            if (Timestamps.compare(horizon, earliestReadTime) <= 0) {
                return 0;
            }
            for (Map.Entry<ResourcePath, VersionChain> entry : documents.entrySet()) {
                pruned += entry.getValue().prune(horizon);
                if (entry.getValue().isEmpty()) {
                    documents.remove(entry.getKey());
                }
            }
            earliestReadTime = horizon;
        } finally {
            lock.writeLock().unlock();
        }
        if (pruned > 0 && LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("pruned document versions",
                    LogMessageKeys.HORIZON, Timestamps.toString(horizon),
                    LogMessageKeys.PRUNED_VERSIONS, pruned));
        }
        return pruned;
    }

    private final class Snapshot implements DocumentSource {
        @Nonnull
        private final Timestamp readTime;

        Snapshot(@Nonnull Timestamp readTime) {
            this.readTime = readTime;
        }

        @Nonnull
        @Override
        public Timestamp getReadTime() {
            return readTime;
        }

        @Nullable
        @Override
        public Document get(@Nonnull ResourcePath path) {
            VersionChain chain = documents.get(path);
            return chain == null ? null : chain.at(readTime);
        }

        @Nonnull
        @Override
        public List<Document> scan(@Nonnull ResourcePath prefix) {
            List<Document> result = new ArrayList<>();
            ConcurrentNavigableMap<ResourcePath, VersionChain> tail = documents.tailMap(prefix, true);
            for (Map.Entry<ResourcePath, VersionChain> entry : tail.entrySet()) {
                if (!prefix.isPrefixOf(entry.getKey())) {
                    break;
                }
                Document document = entry.getValue().at(readTime);
                if (document != null) {
                    result.add(document);
                }
            }
            return result;
        }
    }

    /**
     * Versions of one document, oldest first. The list is replaced rather than mutated so
     * readers never need the lock.
     */
    private static final class VersionChain {
        @Nonnull
        private volatile ImmutableList<Version> versions = ImmutableList.of();

        @Nullable
        Document at(@Nonnull Timestamp readTime) {
            ImmutableList<Version> current = versions;
            for (int i = current.size() - 1; i >= 0; i--) {
                Version version = current.get(i);
                if (Timestamps.compare(version.time, readTime) <= 0) {
                    return version.document;
                }
            }
            return null;
        }

        @Nullable
        Timestamp lastChangeTime() {
            ImmutableList<Version> current = versions;
            return current.isEmpty() ? null : current.get(current.size() - 1).time;
        }

        void append(@Nonnull Timestamp time, @Nullable Document document) {
            versions = ImmutableList.<Version>builderWithExpectedSize(versions.size() + 1)
                    .addAll(versions)
                    .add(new Version(time, document))
                    .build();
        }

        int prune(@Nonnull Timestamp horizon) {
            ImmutableList<Version> current = versions;
            int firstKept = 0;
            for (int i = current.size() - 1; i >= 0; i--) {
                if (Timestamps.compare(current.get(i).time, horizon) <= 0) {
                    firstKept = i;
                    break;
                }
            }
            // a deletion visible at the horizon reads the same as no version at all
            if (firstKept < current.size() && current.get(firstKept).document == null
                    && Timestamps.compare(current.get(firstKept).time, horizon) <= 0) {
                firstKept++;
            }
            if (firstKept == 0) {
                return 0;
            }
            versions = current.subList(firstKept, current.size());
            return firstKept;
        }

        boolean isEmpty() {
            return versions.isEmpty();
        }
    }

    private static final class Version {
        @Nonnull
        private final Timestamp time;
        @Nullable
        private final Document document;

        Version(@Nonnull Timestamp time, @Nullable Document document) {
            this.time = time;
            this.document = document;
        }
    }
}
