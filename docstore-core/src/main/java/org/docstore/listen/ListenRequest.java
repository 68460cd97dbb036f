/*
 * ListenRequest.java
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

package org.docstore.listen;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A client message on a listen stream: add one target or remove one.
 */
public final class ListenRequest {

    /**
     * Which change the request makes.
     */
    public enum Kind {
        ADD_TARGET,
        REMOVE_TARGET
    }

    @Nonnull
    private final Kind kind;
    @Nullable
    private final Target addTarget;
    private final int removeTarget;

    private ListenRequest(@Nonnull Kind kind, @Nullable Target addTarget, int removeTarget) {
        this.kind = kind;
        this.addTarget = addTarget;
        this.removeTarget = removeTarget;
    }

    @Nonnull
    public static ListenRequest addTarget(@Nonnull Target target) {
        return new ListenRequest(Kind.ADD_TARGET, target, 0);
    }

    @Nonnull
    public static ListenRequest removeTarget(int targetId) {
        return new ListenRequest(Kind.REMOVE_TARGET, null, targetId);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nonnull
    public Target getAddTarget() {
        if (addTarget == null) {
            throw new IllegalStateException("not an add target request");
        }
        return addTarget;
    }

    public int getRemoveTarget() {
        if (kind != Kind.REMOVE_TARGET) {
            throw new IllegalStateException("not a remove target request");
        }
        return removeTarget;
    }

    @Override
    public String toString() {
        return kind == Kind.ADD_TARGET ? "addTarget(" + addTarget + ")" : "removeTarget(" + removeTarget + ")";
    }
}
