/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/WorkRequest.java
 description: Immutable descriptor bundling a task body with its optional done/error/progress/cancel callbacks.
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

import java.util.function.Consumer;

/**
 * A task body plus the callbacks that receive its notifications on the main thread.
 * <p>
 * Any callback left {@code null} is simply not invoked.
 * </p>
 *
 * <pre>{@code
 * WorkRequest<List<String>> req = WorkRequest.builder(ctx -> listRemotes(ctx))
 *         .onDone(remotes -> combo.setItems(remotes))
 *         .onError(msg -> status.show(msg))
 *         .build();
 * }</pre>
 *
 * @param function   the task body (required)
 * @param onDone     receives the result after a normal return
 * @param onError    receives the rendered failure message
 * @param onProgress receives progress notifications
 * @param onCancel   runs after the body unwound from a cancellation
 * @param <T>        the result type
 */
public record WorkRequest<T>(
        WorkFunction<T> function,
        @Nullable Consumer<? super T> onDone,
        @Nullable Consumer<String> onError,
        @Nullable ProgressListener onProgress,
        @Nullable Runnable onCancel) {

    public WorkRequest {
        if (function == null) throw new IllegalArgumentException("function cannot be null");
    }

    // 🧩 Section: factories

    /**
     * A request with no callbacks; useful when only {@link Worker#outcome()} is observed.
     */
    public static <T> WorkRequest<T> of(WorkFunction<T> function) {
        return new WorkRequest<>(function, null, null, null, null);
    }

    public static <T> Builder<T> builder(WorkFunction<T> function) {
        return new Builder<>(function);
    }

    public Builder<T> toBuilder() {
        return new Builder<>(function)
                .onDone(onDone)
                .onError(onError)
                .onProgress(onProgress)
                .onCancel(onCancel);
    }
    // [/🧩 Section: factories]

    // 🧩 Section: builder
    public static final class Builder<T> {
        private final WorkFunction<T> function;
        private @Nullable Consumer<? super T> onDone;
        private @Nullable Consumer<String> onError;
        private @Nullable ProgressListener onProgress;
        private @Nullable Runnable onCancel;

        private Builder(WorkFunction<T> function) {
            if (function == null) throw new IllegalArgumentException("function cannot be null");
            this.function = function;
        }

        public Builder<T> onDone(@Nullable Consumer<? super T> onDone) {
            this.onDone = onDone;
            return this;
        }

        public Builder<T> onError(@Nullable Consumer<String> onError) {
            this.onError = onError;
            return this;
        }

        public Builder<T> onProgress(@Nullable ProgressListener onProgress) {
            this.onProgress = onProgress;
            return this;
        }

        public Builder<T> onCancel(@Nullable Runnable onCancel) {
            this.onCancel = onCancel;
            return this;
        }

        public WorkRequest<T> build() {
            return new WorkRequest<>(function, onDone, onError, onProgress, onCancel);
        }
    }
    // [/🧩 Section: builder]
}
