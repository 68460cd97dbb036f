/*
 * CommitListener.java
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

import javax.annotation.Nonnull;

/**
 * Observer of published commits. Called while the store still serialises commits, so
 * implementations must hand the event off rather than do work inline.
 */
@FunctionalInterface
public interface CommitListener {
    void onCommit(@Nonnull CommitEvent event);
}
