/*
 * SnapshotListener.java
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

package org.docstore.watch;

import org.docstore.DocumentStoreException;

import javax.annotation.Nonnull;

/**
 * Receives the snapshots of one watched target. Calls for one listener never overlap.
 */
public interface SnapshotListener {

    void onSnapshot(@Nonnull QuerySnapshot snapshot);

    /**
     * The target ended with an error; no further calls follow.
     *
     * @param error why the target ended
     */
    void onError(@Nonnull DocumentStoreException error);

    /**
     * A once target delivered its final snapshot; no further calls follow. Does nothing by default.
     */
    default void onCompleted() {
    }
}
