/*
 * WriteResult.java
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

import com.google.common.collect.ImmutableList;
import com.google.protobuf.Timestamp;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one write within a committed batch.
 */
public final class WriteResult {
    @Nullable
    private final Timestamp updateTime;
    @Nonnull
    private final ImmutableList<Value> transformResults;

    public WriteResult(@Nullable Timestamp updateTime, @Nonnull List<Value> transformResults) {
        this.updateTime = updateTime;
        this.transformResults = ImmutableList.copyOf(transformResults);
    }

    /**
     * The document's update time after the write: the commit time if the document changed, its
     * previous update time if it did not, and {@code null} after a delete.
     *
     * @return the update time
     */
    @Nullable
    public Timestamp getUpdateTime() {
        return updateTime;
    }

    /**
     * One entry per field transform of the write, in order.
     *
     * @return the transform results
     */
    @Nonnull
    public List<Value> getTransformResults() {
        return transformResults;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WriteResult)) {
            return false;
        }
        WriteResult that = (WriteResult)o;
        return Objects.equals(updateTime, that.updateTime) && transformResults.equals(that.transformResults);
    }

    @Override
    public int hashCode() {
        return Objects.hash(updateTime, transformResults);
    }

    @Override
    public String toString() {
        return "WriteResult{updateTime=" + updateTime + ", transformResults=" + transformResults + "}";
    }
}
