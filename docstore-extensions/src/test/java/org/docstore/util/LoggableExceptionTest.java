/*
 * LoggableExceptionTest.java
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

package org.docstore.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link LoggableException}.
 */
class LoggableExceptionTest {

    @Test
    void keysAndValuesFromConstructor() {
        LoggableException ex = new LoggableException("document missing", "document", "users/alice", "attempt", 2);
        Map<String, Object> logInfo = ex.getLogInfo();
        assertThat(logInfo, hasEntry("document", "users/alice"));
        assertThat(logInfo, hasEntry("attempt", 2));
        assertEquals("document missing", ex.getMessage());
    }

    @Test
    void exportPreservesInsertionOrder() {
        LoggableException ex = new LoggableException("failed")
                .addLogInfo("b", 1)
                .addLogInfo("a", 2);
        assertThat(ex.exportLogInfo(), arrayContaining("b", 1, "a", 2));
    }

    @Test
    void emptyWithoutInfo() {
        LoggableException ex = new LoggableException(new IllegalStateException("boom"));
        assertThat(ex.getLogInfo(), anEmptyMap());
        assertEquals(0, ex.exportLogInfo().length);
    }

    @Test
    void unbalancedKeysRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("bad", "lonely"));
    }
}
