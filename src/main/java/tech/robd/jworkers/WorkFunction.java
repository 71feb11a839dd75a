/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/WorkFunction.java
 description: Functional interface for a task body: runs on a background thread with a WorkContext and returns a (possibly null) result.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
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

package tech.robd.jworkers;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

/**
 * The body of a background task.
 *
 * <p>Example:</p>
 * <pre>{@code
 * WorkFunction<String> body = ctx -> {
 *     for (int step = 0; step < 10; step++) {
 *         ctx.checkCancelled();
 *         ctx.pause(250);
 *         ctx.progress((step + 1) * 10, "Step " + (step + 1) + " of 10");
 *     }
 *     return "Done.";
 * };
 * }</pre>
 *
 * @param <T> the (nullable) result type
 * @author Rob Deas
 * @since 0.1.0
 */
@FunctionalInterface
public interface WorkFunction<T extends @Nullable Object> {

    // 🧩 Section: api

    /**
     * Runs the task on a background thread.
     *
     * @param ctx the context used to poll for cancellation and report progress
     * @return the result, delivered to {@code onDone}
     * @throws Exception any failure; reported through {@code onError} unless it is a cancellation
     */
    @Nullable
    T apply(@NonNull WorkContext ctx) throws Exception;
    // [/🧩 Section: api]
}
