/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/WorkOutcome.java
 description: Tagged terminal outcome of a task body: Done(value), Errored(message) or Cancelled.
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

import org.jspecify.annotations.Nullable;

/**
 * The terminal outcome of one worker, decided on the background thread and
 * dispatched on the main thread to the matching callback.
 *
 * @param <T> the result type
 */
public sealed interface WorkOutcome<T> permits WorkOutcome.Done, WorkOutcome.Errored, WorkOutcome.Cancelled {

    /**
     * @return the terminal {@link WorkerState} this outcome corresponds to
     */
    WorkerState state();

    // 🧩 Section: variants

    /**
     * The body returned normally.
     */
    record Done<T>(@Nullable T value) implements WorkOutcome<T> {
        @Override
        public WorkerState state() {
            return WorkerState.DONE;
        }
    }

    /**
     * The body failed with something other than a cancellation.
     *
     * @param message human-readable text, passed to {@code onError}
     * @param cause   the original failure, or {@code null} if the pool rejected the task
     */
    record Errored<T>(String message, @Nullable Throwable cause) implements WorkOutcome<T> {
        @Override
        public WorkerState state() {
            return WorkerState.ERRORED;
        }
    }

    /**
     * The body observed cancellation and unwound.
     */
    record Cancelled<T>() implements WorkOutcome<T> {
        @Override
        public WorkerState state() {
            return WorkerState.CANCELLED;
        }
    }
    // [/🧩 Section: variants]

    // 🧩 Section: factories
    static <T> WorkOutcome<T> done(@Nullable T value) {
        return new Done<>(value);
    }

    static <T> WorkOutcome<T> errored(String message, @Nullable Throwable cause) {
        return new Errored<>(message, cause);
    }

    static <T> WorkOutcome<T> cancelled() {
        return new Cancelled<>();
    }
    // [/🧩 Section: factories]
}
