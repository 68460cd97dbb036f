/*
 * Document.java
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

import com.google.common.collect.ImmutableMap;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable document: a full resource name, its fields and, once stored, its create and
 * update times. A <em>missing</em> document is a placeholder for a path that has descendants
 * but no data of its own; it has a name only.
 */
public final class Document {
    @Nonnull
    private final String name;
    @Nonnull
    private final ResourcePath path;
    @Nonnull
    private final ImmutableMap<String, Value> fields;
    @Nullable
    private final Timestamp createTime;
    @Nullable
    private final Timestamp updateTime;
    private final boolean missing;

    private Document(@Nonnull String name, @Nonnull ResourcePath path, @Nonnull ImmutableMap<String, Value> fields,
                     @Nullable Timestamp createTime, @Nullable Timestamp updateTime, boolean missing) {
        this.name = name;
        this.path = path;
        this.fields = fields;
        this.createTime = createTime;
        this.updateTime = updateTime;
        this.missing = missing;
    }

    /**
     * A document that has not been stored yet, as supplied with a write.
     *
     * @param name full document name
     * @param fields document contents
     * @return the document
     */
    @Nonnull
    public static Document of(@Nonnull String name, @Nonnull Map<String, Value> fields) {
        return new Document(name, ResourcePath.parse(name), ImmutableMap.copyOf(fields), null, null, false);
    }

    @Nonnull
    public static Document missing(@Nonnull String name) {
        return new Document(name, ResourcePath.parse(name), ImmutableMap.of(), null, null, true);
    }

    @Nonnull
    public Document withFields(@Nonnull Map<String, Value> newFields) {
        return new Document(name, path, ImmutableMap.copyOf(newFields), createTime, updateTime, false);
    }

    @Nonnull
    public Document withTimestamps(@Nonnull Timestamp newCreateTime, @Nonnull Timestamp newUpdateTime) {
        return new Document(name, path, fields, newCreateTime, newUpdateTime, false);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public ResourcePath getPath() {
        return path;
    }

    /**
     * Last segment of the name.
     *
     * @return the document id
     */
    @Nonnull
    public String getId() {
        return path.getLastSegment();
    }

    /**
     * Id of the collection directly containing this document.
     *
     * @return the collection id
     */
    @Nonnull
    public String getCollectionId() {
        return path.get(path.size() - 2);
    }

    @Nonnull
    public Map<String, Value> getFields() {
        return fields;
    }

    /**
     * Value at a field path. The path {@code __name__} yields a reference to this document.
     *
     * @param fieldPath field to read
     * @return the value, or empty if the field does not exist
     */
    @Nonnull
    public Optional<Value> getValue(@Nonnull FieldPath fieldPath) {
        if (fieldPath.isDocumentName()) {
            return Optional.of(Value.referenceValue(name));
        }
        return Values.getField(fields, fieldPath);
    }

    @Nullable
    public Timestamp getCreateTime() {
        return createTime;
    }

    @Nullable
    public Timestamp getUpdateTime() {
        return updateTime;
    }

    public boolean isMissing() {
        return missing;
    }

    /**
     * Copy with only the fields selected by {@code mask}.
     *
     * @param mask fields to keep; {@code null} keeps everything
     * @return the projected document
     */
    @Nonnull
    public Document project(@Nullable DocumentMask mask) {
        if (mask == null) {
            return this;
        }
        return new Document(name, path, ImmutableMap.copyOf(mask.apply(fields)), createTime, updateTime, missing);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Document that = (Document)o;
        return missing == that.missing
                && name.equals(that.name)
                && fields.equals(that.fields)
                && Objects.equals(createTime, that.createTime)
                && Objects.equals(updateTime, that.updateTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fields, createTime, updateTime, missing);
    }

    @Override
    public String toString() {
        if (missing) {
            return "Document{" + name + ", missing}";
        }
        return "Document{" + name
                + ", fields=" + fields
                + (updateTime == null ? "" : ", updateTime=" + Timestamps.toString(updateTime))
                + "}";
    }
}
