/*
 * TransactionOptions.java
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

package org.docstore.transaction;

import com.google.protobuf.ByteString;
import com.google.protobuf.Timestamp;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Mode of a new transaction: read-only, optionally pinned to a past read time, or read-write,
 * optionally retrying an earlier transaction.
 */
public final class TransactionOptions {
    private final boolean readOnly;
    @Nullable
    private final Timestamp readTime;
    @Nullable
    private final ByteString retryTransaction;

    private TransactionOptions(boolean readOnly, @Nullable Timestamp readTime, @Nullable ByteString retryTransaction) {
        this.readOnly = readOnly;
        this.readTime = readTime;
        this.retryTransaction = retryTransaction;
    }

    @Nonnull
    public static TransactionOptions readWrite() {
        return new TransactionOptions(false, null, null);
    }

    /**
     * A read-write transaction that replaces an earlier attempt.
     *
     * @param retryTransaction token of the earlier attempt
     * @return the options
     */
    @Nonnull
    public static TransactionOptions readWrite(@Nonnull ByteString retryTransaction) {
        return new TransactionOptions(false, null, retryTransaction);
    }

    @Nonnull
    public static TransactionOptions readOnly() {
        return new TransactionOptions(true, null, null);
    }

    @Nonnull
    public static TransactionOptions readOnly(@Nonnull Timestamp readTime) {
        return new TransactionOptions(true, readTime, null);
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    @Nullable
    public Timestamp getReadTime() {
        return readTime;
    }

    @Nullable
    public ByteString getRetryTransaction() {
        return retryTransaction;
    }

    @Override
    public String toString() {
        return readOnly ? "readOnly" + (readTime == null ? "" : "@" + readTime.getSeconds())
                        : "readWrite" + (retryTransaction == null ? "" : "(retry)");
    }
}
