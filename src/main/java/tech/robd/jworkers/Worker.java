/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/Worker.java
 description: Public handle for one task execution: cooperative cancel, state inspection and the outcome future.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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

import java.util.concurrent.CompletableFuture;

/**
 * A handle to one submitted task.
 *
 * <p>Supports:
 * <ul>
 *   <li>Cooperative cancellation via {@link #cancel()}.</li>
 *   <li>State inspection with {@link #state()}, {@link #isRunning()} and {@link #isFinished()}.</li>
 *   <li>Outcome access via {@link #outcome()}, completed on the background thread once the
 *       terminal state is decided. Callbacks still arrive on the main thread.</li>
 * </ul>
 *
 * <p>Hold the handle for as long as the work may need cancelling and drop it once the
 * terminal callback has fired.</p>
 *
 * @param <T> the result type
 */
public interface Worker<T> {

    /**
     * @return a diagnostic name, unique within the owning pool
     */
    String name();

    /**
     * Request cancellation. Returns immediately; the body unwinds at its next checkpoint.
     *
     * @return {@code true} if this call made the request while the worker was running,
     * {@code false} if it was already requested or the worker has finished (no-op)
     */
    boolean cancel();

    /**
     * @return {@code true} once {@link #cancel()} has taken effect on the token
     */
    boolean isCancelRequested();

    WorkerState state();

    default boolean isRunning() {
        return state() == WorkerState.RUNNING;
    }

    default boolean isFinished() {
        return state().isTerminal();
    }

    /**
     * @return a future completing with the terminal outcome; never completes exceptionally
     */
    CompletableFuture<WorkOutcome<T>> outcome();
}
