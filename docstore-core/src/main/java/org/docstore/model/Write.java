/*
 * Write.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One mutation of a batch: an update (with optional mask and transforms), a delete, or a
 * standalone transform, each guarded by an optional {@link Precondition}.
 */
public final class Write {

    /**
     * The kinds of write.
     */
    public enum Kind {
        UPDATE,
        DELETE,
        TRANSFORM
    }

    @Nonnull
    private final Kind kind;
    @Nonnull
    private final String name;
    @Nullable
    private final Document document;
    @Nullable
    private final DocumentMask updateMask;
    @Nonnull
    private final ImmutableList<FieldTransform> transforms;
    @Nonnull
    private final Precondition precondition;

    private Write(@Nonnull Kind kind, @Nonnull String name, @Nullable Document document, @Nullable DocumentMask updateMask,
                  @Nonnull ImmutableList<FieldTransform> transforms, @Nonnull Precondition precondition) {
        this.kind = kind;
        this.name = name;
        this.document = document;
        this.updateMask = updateMask;
        this.transforms = transforms;
        this.precondition = precondition;
    }

    /**
     * Replace the whole document, creating it if needed.
     *
     * @param document new contents
     * @return the write
     */
    @Nonnull
    public static Write update(@Nonnull Document document) {
        return new Write(Kind.UPDATE, document.getName(), document, null, ImmutableList.of(), Precondition.NONE);
    }

    /**
     * Replace only the masked fields. Masked fields absent from {@code document} are deleted.
     *
     * @param document source of new field values
     * @param updateMask fields to touch
     * @return the write
     */
    @Nonnull
    public static Write update(@Nonnull Document document, @Nonnull DocumentMask updateMask) {
        return new Write(Kind.UPDATE, document.getName(), document, updateMask, ImmutableList.of(), Precondition.NONE);
    }

    @Nonnull
    public static Write delete(@Nonnull String name) {
        return new Write(Kind.DELETE, name, null, null, ImmutableList.of(), Precondition.NONE);
    }

    @Nonnull
    public static Write transform(@Nonnull String name, @Nonnull List<FieldTransform> transforms) {
        return new Write(Kind.TRANSFORM, name, null, null, ImmutableList.copyOf(transforms), Precondition.NONE);
    }

    @Nonnull
    public static Write transform(@Nonnull String name, @Nonnull FieldTransform... transforms) {
        return transform(name, Arrays.asList(transforms));
    }

    @Nonnull
    public Write withPrecondition(@Nonnull Precondition newPrecondition) {
        return new Write(kind, name, document, updateMask, transforms, newPrecondition);
    }

    /**
     * Attach transforms to an update; they run after the update's fields are applied.
     *
     * @param updateTransforms transforms to run
     * @return the new write
     */
    @Nonnull
    public Write withUpdateTransforms(@Nonnull FieldTransform... updateTransforms) {
        if (kind != Kind.UPDATE) {
            throw new IllegalStateException("only updates carry update transforms");
        }
        return new Write(kind, name, document, updateMask,
                ImmutableList.<FieldTransform>builder().addAll(transforms).add(updateTransforms).build(), precondition);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nullable
    public Document getDocument() {
        return document;
    }

    @Nullable
    public DocumentMask getUpdateMask() {
        return updateMask;
    }

    /**
     * Update transforms of an update, or the transforms of a standalone transform.
     *
     * @return the transforms, possibly empty
     */
    @Nonnull
    public List<FieldTransform> getTransforms() {
        return transforms;
    }

    @Nonnull
    public Precondition getPrecondition() {
        return precondition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Write)) {
            return false;
        }
        Write that = (Write)o;
        return kind == that.kind && name.equals(that.name) && Objects.equals(document, that.document)
                && Objects.equals(updateMask, that.updateMask) && transforms.equals(that.transforms)
                && precondition.equals(that.precondition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, document, updateMask, transforms, precondition);
    }

    @Override
    public String toString() {
        return "Write{" + kind + " " + name
                + (updateMask == null ? "" : ", mask=" + updateMask)
                + (transforms.isEmpty() ? "" : ", transforms=" + transforms)
                + (precondition.isNone() ? "" : ", precondition=" + precondition)
                + "}";
    }
}
