/*
 * WritePipeline.java
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

package org.docstore.write;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.Timestamp;
import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;
import org.docstore.model.DatabaseId;
import org.docstore.model.Document;
import org.docstore.model.DocumentMask;
import org.docstore.model.FieldPath;
import org.docstore.model.FieldTransform;
import org.docstore.model.ResourcePath;
import org.docstore.model.Value;
import org.docstore.model.Values;
import org.docstore.model.Write;
import org.docstore.model.WriteResult;
import org.docstore.storage.DocumentSource;
import org.docstore.storage.MutationBatch;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies an ordered batch of {@link Write}s on top of a snapshot, all or nothing. Each write
 * sees the effects of the writes before it, its precondition is checked against that state,
 * and its transforms run after its update at the batch's commit time.
 */
public class WritePipeline {
    @Nonnull
    private final DatabaseId databaseId;

    public WritePipeline(@Nonnull DatabaseId databaseId) {
        this.databaseId = databaseId;
    }

    @Nonnull
    public DatabaseId getDatabaseId() {
        return databaseId;
    }

    /**
     * The changes and per-write results of an applied batch.
     */
    public static final class AppliedBatch {
        @Nonnull
        private final MutationBatch mutations;
        @Nonnull
        private final ImmutableList<WriteResult> writeResults;

        AppliedBatch(@Nonnull MutationBatch mutations, @Nonnull List<WriteResult> writeResults) {
            this.mutations = mutations;
            this.writeResults = ImmutableList.copyOf(writeResults);
        }

        @Nonnull
        public MutationBatch getMutations() {
            return mutations;
        }

        @Nonnull
        public List<WriteResult> getWriteResults() {
            return writeResults;
        }
    }

    /**
     * Check the shape of every write before anything is applied.
     *
     * @param writes the batch
     * @throws DocumentStoreExceptions.InvalidArgumentException if a write is malformed
     */
    public void validate(@Nonnull List<Write> writes) {
        for (int i = 0; i < writes.size(); i++) {
            Write write = writes.get(i);
            databaseId.parseDocumentName(write.getName());
            DocumentMask mask = write.getUpdateMask();
            if (mask != null) {
                mask.validate();
            }
            Document document = write.getDocument();
            if (document != null && document.getFields().containsKey(FieldPath.DOCUMENT_NAME_FIELD)) {
                throw new DocumentStoreExceptions.InvalidArgumentException("document may not set the name field",
                        LogMessageKeys.WRITE_INDEX, i, LogMessageKeys.DOCUMENT, write.getName());
            }
            Set<FieldPath> transformed = new HashSet<>();
            for (FieldTransform transform : write.getTransforms()) {
                FieldPath path = transform.getFieldPath();
                if (path.isDocumentName()) {
                    throw new DocumentStoreExceptions.InvalidArgumentException("cannot transform the document name",
                            LogMessageKeys.WRITE_INDEX, i, LogMessageKeys.DOCUMENT, write.getName());
                }
                if (!transformed.add(path)) {
                    throw new DocumentStoreExceptions.InvalidArgumentException("field is transformed more than once",
                            LogMessageKeys.WRITE_INDEX, i, LogMessageKeys.FIELD_PATH, path);
                }
                if (mask != null && mask.covers(path)) {
                    throw new DocumentStoreExceptions.InvalidArgumentException("field is both updated and transformed",
                            LogMessageKeys.WRITE_INDEX, i, LogMessageKeys.FIELD_PATH, path);
                }
            }
        }
    }

    /**
     * Apply the batch.
     *
     * @param writes the batch, already validated
     * @param latest the state to apply the batch to
     * @param commitTime the time the batch will commit at
     * @return the resulting changes and write results
     * @throws DocumentStoreExceptions.FailedPreconditionException if a precondition does not hold
     */
    @Nonnull
    public AppliedBatch apply(@Nonnull List<Write> writes, @Nonnull DocumentSource latest, @Nonnull Timestamp commitTime) {
        MutationBatch mutations = new MutationBatch();
        Map<ResourcePath, Optional<Document>> overlay = new HashMap<>();
        List<WriteResult> results = new ArrayList<>(writes.size());
        for (int i = 0; i < writes.size(); i++) {
            Write write = writes.get(i);
            ResourcePath path = databaseId.parseDocumentName(write.getName());
            Optional<Document> staged = overlay.get(path);
            @Nullable Document current = staged != null ? staged.orElse(null) : latest.get(path);
            if (!write.getPrecondition().isSatisfiedBy(current)) {
                throw new DocumentStoreExceptions.FailedPreconditionException("precondition failed", i,
                        LogMessageKeys.DOCUMENT, write.getName(),
                        LogMessageKeys.PRECONDITION, write.getPrecondition());
            }
            if (write.getKind() == Write.Kind.DELETE) {
                if (current != null) {
                    mutations.delete(path);
                }
                overlay.put(path, Optional.empty());
                results.add(new WriteResult(null, ImmutableList.of()));
                continue;
            }
            Map<String, Value> fields = newFields(write, current);
            List<Value> transformResults = new ArrayList<>(write.getTransforms().size());
            for (FieldTransform transform : write.getTransforms()) {
                Value previous = Values.getField(fields, transform.getFieldPath()).orElse(null);
                Value next = FieldTransforms.apply(transform, previous, commitTime);
                fields = Values.setField(fields, transform.getFieldPath(), next);
                transformResults.add(FieldTransforms.result(transform, next));
            }
            Document updated;
            if (current != null && current.getFields().equals(fields)) {
                updated = current;
            } else {
                Timestamp createTime = current == null ? commitTime : current.getCreateTime();
                updated = Document.of(write.getName(), fields).withTimestamps(createTime, commitTime);
                mutations.put(updated);
            }
            overlay.put(path, Optional.of(updated));
            results.add(new WriteResult(updated.getUpdateTime(), transformResults));
        }
        return new AppliedBatch(mutations, results);
    }

    @Nonnull
    private static Map<String, Value> newFields(@Nonnull Write write, @Nullable Document current) {
        if (write.getKind() == Write.Kind.TRANSFORM) {
            return current == null ? Map.of() : current.getFields();
        }
        Document document = write.getDocument();
        if (document == null) {
            throw new IllegalStateException("update without document");
        }
        DocumentMask mask = write.getUpdateMask();
        if (mask == null) {
            return document.getFields();
        }
        Map<String, Value> fields = current == null ? Map.of() : current.getFields();
        for (FieldPath path : mask.getFieldPaths()) {
            Optional<Value> value = Values.getField(document.getFields(), path);
            if (value.isPresent()) {
                fields = Values.setField(fields, path, value.get());
            } else {
                fields = Values.deleteField(fields, path);
            }
        }
        return fields;
    }
}
