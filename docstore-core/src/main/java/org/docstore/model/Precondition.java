/*
 * Precondition.java
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

package org.docstore.model;

import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A condition on the current state of a document that must hold for a write to apply.
 * At most one of {@code exists} and {@code updateTime} is set.
 */
public final class Precondition {
    public static final Precondition NONE = new Precondition(null, null);

    @Nullable
    private final Boolean exists;
    @Nullable
    private final Timestamp updateTime;

    private Precondition(@Nullable Boolean exists, @Nullable Timestamp updateTime) {
        this.exists = exists;
        this.updateTime = updateTime;
    }

    @Nonnull
    public static Precondition exists(boolean exists) {
        return new Precondition(exists, null);
    }

    @Nonnull
    public static Precondition updateTime(@Nonnull Timestamp updateTime) {
        return new Precondition(null, updateTime);
    }

    public boolean isNone() {
        return exists == null && updateTime == null;
    }

    @Nullable
    public Boolean getExists() {
        return exists;
    }

    @Nullable
    public Timestamp getUpdateTime() {
        return updateTime;
    }

    /**
     * Check the condition against the current version of a document.
     *
     * @param current the stored document, or {@code null} if there is none
     * @return {@code true} if the write may proceed
     */
    public boolean isSatisfiedBy(@Nullable Document current) {
        if (exists != null) {
            return exists == (current != null);
        }
        if (updateTime != null) {
            return current != null && updateTime.equals(current.getUpdateTime());
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Precondition)) {
            return false;
        }
        Precondition that = (Precondition)o;
        return Objects.equals(exists, that.exists) && Objects.equals(updateTime, that.updateTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exists, updateTime);
    }

    @Override
    public String toString() {
        if (exists != null) {
            return "exists=" + exists;
        }
        if (updateTime != null) {
            return "updateTime=" + Timestamps.toString(updateTime);
        }
        return "none";
    }
}
