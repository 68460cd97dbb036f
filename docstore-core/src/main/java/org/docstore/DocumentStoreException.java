/*
 * DocumentStoreException.java
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

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.docstore.logging.LogMessageKeys;
import org.docstore.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class for all errors reported by docstore operations. Every error carries the
 * canonical status code under which it would be reported to a remote caller.
 *
 * @see DocumentStoreExceptions
 */
@SuppressWarnings("serial")
public class DocumentStoreException extends LoggableException {
    @Nonnull
    private final Status.Code code;

    public DocumentStoreException(@Nonnull Status.Code code, @Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
        this.code = code;
    }

    public DocumentStoreException(@Nonnull Status.Code code, @Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
        this.code = code;
    }

    @Nonnull
    public Status.Code getCode() {
        return code;
    }

    /**
     * Whether a client may retry the operation that produced this error.
     *
     * @return {@code true} if the failure is transient
     */
    public boolean isRetriable() {
        return DocumentStoreExceptions.isRetriable(code);
    }

    /**
     * Convert into a gRPC status, suitable for closing a stream or for the cause of a removed target.
     *
     * @return a status with this error's code and message
     */
    @Nonnull
    public Status toStatus() {
        Status status = Status.fromCode(code).withDescription(getMessage());
        return getCause() == null ? status : status.withCause(getCause());
    }

    @Nonnull
    public StatusRuntimeException toStatusException() {
        return toStatus().asRuntimeException();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + LogMessageKeys.CODE + "=" + code + "]: " + getMessage();
    }
}
