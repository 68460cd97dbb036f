/*
 * ExistenceFilterPolicy.java
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

/**
 * What a watch does when an existence filter shows that its view of a target has drifted from
 * the server's.
 */
public enum ExistenceFilterPolicy {
    /** Forget the target's documents and resume token, then reopen the whole stream. */
    RESET_STREAM,
    /** Forget the target's documents and resume token, then remove and re-add only that target. */
    RELISTEN_TARGET
}
