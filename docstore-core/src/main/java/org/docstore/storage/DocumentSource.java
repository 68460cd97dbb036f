/*
 * DocumentSource.java
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

import com.google.protobuf.Timestamp;
import org.docstore.model.Document;
import org.docstore.model.ResourcePath;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * A consistent view of the documents of a database at a single point in time.
 */
public interface DocumentSource {

    /**
     * The time this view reflects.
     *
     * @return the read time
     */
    @Nonnull
    Timestamp getReadTime();

    /**
     * Look up a document.
     *
     * @param path document path
     * @return the document, or {@code null} if it does not exist at the read time
     */
    @Nullable
    Document get(@Nonnull ResourcePath path);

    /**
     * Every existing document whose path starts with {@code prefix}, in path order.
     *
     * @param prefix ancestor path
     * @return the documents below {@code prefix}
     */
    @Nonnull
    List<Document> scan(@Nonnull ResourcePath prefix);
}
