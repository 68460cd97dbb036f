/*
 * ReadOptions.java
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
 * Consistency selector of a read: the latest data, a past read time, an existing transaction,
 * or a transaction begun by the read itself. At most one is chosen.
 */
public final class ReadOptions {

    /**
     * Which consistency the read uses.
     */
    public enum Kind {
        LATEST,
        READ_TIME,
        TRANSACTION,
        NEW_TRANSACTION
    }

    private static final ReadOptions LATEST = new ReadOptions(Kind.LATEST, null, null, null);

    @Nonnull
    private final Kind kind;
    @Nullable
    private final Timestamp readTime;
    @Nullable
    private final ByteString transaction;
    @Nullable
    private final TransactionOptions newTransaction;

    private ReadOptions(@Nonnull Kind kind, @Nullable Timestamp readTime, @Nullable ByteString transaction,
                        @Nullable TransactionOptions newTransaction) {
        this.kind = kind;
        this.readTime = readTime;
        this.transaction = transaction;
        this.newTransaction = newTransaction;
    }

    @Nonnull
    public static ReadOptions latest() {
        return LATEST;
    }

    @Nonnull
    public static ReadOptions readTime(@Nonnull Timestamp readTime) {
        return new ReadOptions(Kind.READ_TIME, readTime, null, null);
    }

    @Nonnull
    public static ReadOptions transaction(@Nonnull ByteString transaction) {
        return new ReadOptions(Kind.TRANSACTION, null, transaction, null);
    }

    @Nonnull
    public static ReadOptions newTransaction(@Nonnull TransactionOptions options) {
        return new ReadOptions(Kind.NEW_TRANSACTION, null, null, options);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nullable
    public Timestamp getReadTime() {
        return readTime;
    }

    @Nullable
    public ByteString getTransaction() {
        return transaction;
    }

    @Nullable
    public TransactionOptions getNewTransaction() {
        return newTransaction;
    }

    @Override
    public String toString() {
        return "ReadOptions{" + kind + "}";
    }
}
