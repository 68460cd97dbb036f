/*
 * DatabaseId.java
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

import org.docstore.DocumentStoreExceptions;
import org.docstore.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Identifies one database and knows how its document and collection names are laid out:
 * {@code projects/{project}/databases/{database}/documents/{collection}/{document}/...}.
 */
public final class DatabaseId {
    public static final String DEFAULT_DATABASE = "(default)";

    @Nonnull
    private final String projectId;
    @Nonnull
    private final String databaseId;
    @Nonnull
    private final ResourcePath documentsRoot;

    private DatabaseId(@Nonnull String projectId, @Nonnull String databaseId) {
        this.projectId = projectId;
        this.databaseId = databaseId;
        this.documentsRoot = ResourcePath.of("projects", projectId, "databases", databaseId, "documents");
    }

    @Nonnull
    public static DatabaseId of(@Nonnull String projectId, @Nonnull String databaseId) {
        return new DatabaseId(projectId, databaseId);
    }

    @Nonnull
    public static DatabaseId of(@Nonnull String projectId) {
        return new DatabaseId(projectId, DEFAULT_DATABASE);
    }

    @Nonnull
    public String getProjectId() {
        return projectId;
    }

    @Nonnull
    public String getDatabaseId() {
        return databaseId;
    }

    /**
     * The database resource name, {@code projects/{p}/databases/{d}}.
     *
     * @return the database name
     */
    @Nonnull
    public String getName() {
        return "projects/" + projectId + "/databases/" + databaseId;
    }

    /**
     * The path under which all documents of this database live. Queries over root collections use
     * it as their parent.
     *
     * @return the documents root path
     */
    @Nonnull
    public ResourcePath getDocumentsRoot() {
        return documentsRoot;
    }

    /**
     * Full document name for a path relative to the documents root.
     *
     * @param relativePath e.g. {@code users/alice}
     * @return e.g. {@code projects/p/databases/d/documents/users/alice}
     */
    @Nonnull
    public String documentName(@Nonnull String relativePath) {
        ResourcePath path = documentsRoot.append(ResourcePath.parse(relativePath));
        if (!isDocumentPath(path)) {
            throw new DocumentStoreExceptions.InvalidArgumentException("not a document path",
                    LogMessageKeys.DOCUMENT, relativePath);
        }
        return path.canonicalString();
    }

    @Nonnull
    public ResourcePath collectionPath(@Nonnull String relativePath) {
        ResourcePath path = documentsRoot.append(ResourcePath.parse(relativePath));
        if (!isCollectionPath(path)) {
            throw new DocumentStoreExceptions.InvalidArgumentException("not a collection path",
                    LogMessageKeys.PARENT, relativePath);
        }
        return path;
    }

    public boolean isDocumentPath(@Nonnull ResourcePath path) {
        int extra = path.size() - documentsRoot.size();
        return extra > 0 && extra % 2 == 0 && documentsRoot.isPrefixOf(path);
    }

    public boolean isCollectionPath(@Nonnull ResourcePath path) {
        int extra = path.size() - documentsRoot.size();
        return extra > 0 && extra % 2 == 1 && documentsRoot.isPrefixOf(path);
    }

    /**
     * Whether {@code path} may be the parent of a query: the documents root or a document.
     *
     * @param path candidate parent
     * @return {@code true} if collections can live directly under {@code path}
     */
    public boolean isParentPath(@Nonnull ResourcePath path) {
        return path.equals(documentsRoot) || isDocumentPath(path);
    }

    /**
     * Parse and validate a full document name belonging to this database.
     *
     * @param name full document name
     * @return the parsed path
     */
    @Nonnull
    public ResourcePath parseDocumentName(@Nonnull String name) {
        ResourcePath path = ResourcePath.parse(name);
        if (!isDocumentPath(path)) {
            throw new DocumentStoreExceptions.InvalidArgumentException("invalid document name",
                    LogMessageKeys.DOCUMENT, name, LogMessageKeys.DATABASE, getName());
        }
        return path;
    }

    /**
     * Parse and validate a query parent: the documents root or a document name.
     *
     * @param parent parent resource name
     * @return the parsed path
     */
    @Nonnull
    public ResourcePath parseParent(@Nonnull String parent) {
        ResourcePath path = ResourcePath.parse(parent);
        if (!isParentPath(path)) {
            throw new DocumentStoreExceptions.InvalidArgumentException("invalid parent",
                    LogMessageKeys.PARENT, parent, LogMessageKeys.DATABASE, getName());
        }
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DatabaseId that = (DatabaseId)o;
        return projectId.equals(that.projectId) && databaseId.equals(that.databaseId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, databaseId);
    }

    @Override
    public String toString() {
        return getName();
    }
}
