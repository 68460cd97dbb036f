/*
 * ListenResponse.java
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

package org.docstore.listen;

import javax.annotation.Nonnull;

/**
 * A server message on a listen stream. Exactly one of its variants is present, chosen by
 * {@link #getKind()}; the getters of the other variants throw.
 */
public final class ListenResponse {

    /**
     * Which variant the response holds.
     */
    public enum Kind {
        TARGET_CHANGE,
        DOCUMENT_CHANGE,
        DOCUMENT_DELETE,
        DOCUMENT_REMOVE,
        FILTER
    }

    @Nonnull
    private final Kind kind;
    @Nonnull
    private final Object payload;

    private ListenResponse(@Nonnull Kind kind, @Nonnull Object payload) {
        this.kind = kind;
        this.payload = payload;
    }

    @Nonnull
    public static ListenResponse of(@Nonnull TargetChange targetChange) {
        return new ListenResponse(Kind.TARGET_CHANGE, targetChange);
    }

    @Nonnull
    public static ListenResponse of(@Nonnull DocumentChange documentChange) {
        return new ListenResponse(Kind.DOCUMENT_CHANGE, documentChange);
    }

    @Nonnull
    public static ListenResponse of(@Nonnull DocumentDelete documentDelete) {
        return new ListenResponse(Kind.DOCUMENT_DELETE, documentDelete);
    }

    @Nonnull
    public static ListenResponse of(@Nonnull DocumentRemove documentRemove) {
        return new ListenResponse(Kind.DOCUMENT_REMOVE, documentRemove);
    }

    @Nonnull
    public static ListenResponse of(@Nonnull ExistenceFilter filter) {
        return new ListenResponse(Kind.FILTER, filter);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nonnull
    public TargetChange getTargetChange() {
        return get(Kind.TARGET_CHANGE, TargetChange.class);
    }

    @Nonnull
    public DocumentChange getDocumentChange() {
        return get(Kind.DOCUMENT_CHANGE, DocumentChange.class);
    }

    @Nonnull
    public DocumentDelete getDocumentDelete() {
        return get(Kind.DOCUMENT_DELETE, DocumentDelete.class);
    }

    @Nonnull
    public DocumentRemove getDocumentRemove() {
        return get(Kind.DOCUMENT_REMOVE, DocumentRemove.class);
    }

    @Nonnull
    public ExistenceFilter getFilter() {
        return get(Kind.FILTER, ExistenceFilter.class);
    }

    @Nonnull
    private <T> T get(@Nonnull Kind expected, @Nonnull Class<T> type) {
        if (kind != expected) {
            throw new IllegalStateException("listen response is " + kind + ", not " + expected);
        }
        return type.cast(payload);
    }

    @Override
    public String toString() {
        return payload.toString();
    }
}
