/*
 * MoreAsyncUtil.java
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

package org.docstore.async;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Helpers for working with {@link CompletableFuture}s.
 */
public class MoreAsyncUtil {

    public static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private static final ScheduledThreadPoolExecutor scheduledThreadPoolExecutor
            = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("docstore-delay-%d")
                    .build());

    static {
        scheduledThreadPoolExecutor.setKeepAliveTime(30, TimeUnit.SECONDS);
        scheduledThreadPoolExecutor.allowCoreThreadTimeOut(true);
    }

    private MoreAsyncUtil() {
    }

    /**
     * Get a future that completes after the given delay.
     *
     * @param delay amount of time to wait
     * @param unit unit of <code>delay</code>
     * @return a future completed with <code>null</code> once the delay has passed
     */
    @Nonnull
    public static CompletableFuture<Void> delayedFuture(long delay, @Nonnull TimeUnit unit) {
        if (delay <= 0) {
            return DONE;
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        scheduledThreadPoolExecutor.schedule(() -> future.complete(null), delay, unit);
        return future;
    }

    /**
     * Strip the wrappers that the future machinery puts around the real failure.
     *
     * @param ex exception thrown by a future
     * @return the innermost meaningful cause
     */
    @Nonnull
    public static Throwable unwrapCompletion(@Nonnull Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
