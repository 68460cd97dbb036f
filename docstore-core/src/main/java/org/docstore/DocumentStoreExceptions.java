/*
 * DocumentStoreExceptions.java
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

package org.docstore;

import com.google.common.collect.ImmutableSet;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import org.docstore.async.MoreAsyncUtil;
import org.docstore.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Set;

/**
 * Namespace for the concrete {@link DocumentStoreException} types, one per status code that
 * docstore reports, along with helpers to convert foreign failures.
 */
public class DocumentStoreExceptions {

    private static final Set<Status.Code> RETRIABLE_CODES = ImmutableSet.of(
            Status.Code.ABORTED,
            Status.Code.UNAVAILABLE,
            Status.Code.DEADLINE_EXCEEDED,
            Status.Code.INTERNAL,
            Status.Code.RESOURCE_EXHAUSTED);

    private DocumentStoreExceptions() {
    }

    /**
     * A request was malformed, referred to a terminal transaction, or asked for data outside
     * the readable window.
     */
    @SuppressWarnings("serial")
    public static class InvalidArgumentException extends DocumentStoreException {
        public InvalidArgumentException(@Nonnull String msg, @Nullable Object... keyValues) {
            super(Status.Code.INVALID_ARGUMENT, msg, keyValues);
        }

        public InvalidArgumentException(@Nonnull String msg, @Nullable Throwable cause) {
            super(Status.Code.INVALID_ARGUMENT, msg, cause);
        }
    }

    /**
     * A document or transaction does not exist.
     */
    @SuppressWarnings("serial")
    public static class NotFoundException extends DocumentStoreException {
        public NotFoundException(@Nonnull String msg, @Nullable Object... keyValues) {
            super(Status.Code.NOT_FOUND, msg, keyValues);
        }
    }

    /**
     * A document to be created is already present.
     */
    @SuppressWarnings("serial")
    public static class AlreadyExistsException extends DocumentStoreException {
        public AlreadyExistsException(@Nonnull String msg, @Nullable Object... keyValues) {
            super(Status.Code.ALREADY_EXISTS, msg, keyValues);
        }
    }

    /**
     * A write precondition did not hold. The batch had no effect.
     */
    @SuppressWarnings("serial")
    public static class FailedPreconditionException extends DocumentStoreException {
        private final int writeIndex;

        public FailedPreconditionException(@Nonnull String msg, int writeIndex, @Nullable Object... keyValues) {
            super(Status.Code.FAILED_PRECONDITION, msg, keyValues);
            this.writeIndex = writeIndex;
            addLogInfo(LogMessageKeys.WRITE_INDEX.toString(), writeIndex);
        }

        /**
         * Position of the offending write within its batch, or {@code -1} when the failure
         * is not tied to a single write.
         *
         * @return the index of the failed write
         */
        public int getWriteIndex() {
            return writeIndex;
        }
    }

    /**
     * Failures that a client may retry.
     */
    @SuppressWarnings("serial")
    public static class RetriableException extends DocumentStoreException {
        public RetriableException(@Nonnull Status.Code code, @Nonnull String msg, @Nullable Object... keyValues) {
            super(code, msg, keyValues);
        }

        public RetriableException(@Nonnull Status.Code code, @Nonnull String msg, @Nullable Throwable cause) {
            super(code, msg, cause);
        }
    }

    /**
     * A transaction conflicted with a concurrent commit, or outlived its lifetime.
     */
    @SuppressWarnings("serial")
    public static class AbortedException extends RetriableException {
        public AbortedException(@Nonnull String msg, @Nullable Object... keyValues) {
            super(Status.Code.ABORTED, msg, keyValues);
        }
    }

    /**
     * The caller fell too far behind, for example by not acknowledging write stream responses.
     */
    @SuppressWarnings("serial")
    public static class ResourceExhaustedException extends RetriableException {
        public ResourceExhaustedException(@Nonnull String msg, @Nullable Object... keyValues) {
            super(Status.Code.RESOURCE_EXHAUSTED, msg, keyValues);
        }
    }

    /**
     * The service is shutting down or a stream was closed under the caller.
     */
    @SuppressWarnings("serial")
    public static class UnavailableException extends RetriableException {
        public UnavailableException(@Nonnull String msg, @Nullable Object... keyValues) {
            super(Status.Code.UNAVAILABLE, msg, keyValues);
        }
    }

    /**
     * An unexpected failure inside docstore.
     */
    @SuppressWarnings("serial")
    public static class InternalException extends RetriableException {
        public InternalException(@Nonnull String msg, @Nullable Throwable cause) {
            super(Status.Code.INTERNAL, msg, cause);
        }

        public InternalException(@Nonnull String msg, @Nullable Object... keyValues) {
            super(Status.Code.INTERNAL, msg, keyValues);
        }
    }

    public static boolean isRetriable(@Nonnull Status.Code code) {
        return RETRIABLE_CODES.contains(code);
    }

    /**
     * Convert any failure into a {@link DocumentStoreException}. Future wrappers are removed first;
     * gRPC status failures keep their code; everything else becomes an {@link InternalException}.
     *
     * @param ex the failure
     * @return an equivalent docstore exception
     */
    @Nonnull
    public static DocumentStoreException wrap(@Nonnull Throwable ex) {
        Throwable cause = MoreAsyncUtil.unwrapCompletion(ex);
        if (cause instanceof DocumentStoreException) {
            return (DocumentStoreException)cause;
        }
        if (cause instanceof StatusRuntimeException || cause instanceof StatusException) {
            return fromStatus(Status.fromThrowable(cause));
        }
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new DocumentStoreException(Status.Code.CANCELLED, "interrupted", cause);
        }
        return new InternalException(String.valueOf(cause.getMessage()), cause);
    }

    /**
     * Rebuild a docstore exception from a status, for example one received on a stream.
     *
     * @param status the status to convert
     * @return an exception of the matching type
     */
    @Nonnull
    public static DocumentStoreException fromStatus(@Nonnull Status status) {
        String description = status.getDescription() == null ? status.getCode().name() : status.getDescription();
        DocumentStoreException result;
        switch (status.getCode()) {
            case INVALID_ARGUMENT:
                result = new InvalidArgumentException(description);
                break;
            case NOT_FOUND:
                result = new NotFoundException(description);
                break;
            case ALREADY_EXISTS:
                result = new AlreadyExistsException(description);
                break;
            case FAILED_PRECONDITION:
                result = new FailedPreconditionException(description, -1);
                break;
            case ABORTED:
                result = new AbortedException(description);
                break;
            case RESOURCE_EXHAUSTED:
                result = new ResourceExhaustedException(description);
                break;
            case UNAVAILABLE:
                result = new UnavailableException(description);
                break;
            case INTERNAL:
                result = new InternalException(description, status.getCause());
                break;
            default:
                if (isRetriable(status.getCode())) {
                    result = new RetriableException(status.getCode(), description, status.getCause());
                } else {
                    result = new DocumentStoreException(status.getCode(), description, status.getCause());
                }
                break;
        }
        return result;
    }
}
