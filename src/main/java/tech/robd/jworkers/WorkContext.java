/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/WorkContext.java
 description: Handle passed into a running task body: cooperative cancellation checkpoints, progress emission and a checkpointing pause.
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
import tech.robd.jworkers.diagnostics.Diagnostics;

/**
 * Explicit context passed to a {@link WorkFunction}.
 * <p>
 * Cancellation is cooperative only. A body observes it by calling {@link #checkCancelled()}
 * (or {@link #pause(long)}, which checks between slices) at points where unwinding is safe.
 * A body that never checks runs to completion.
 * </p>
 *
 * <p>A context is created per task invocation and should not escape the body. Progress
 * reported through a leaked context after the worker has finished is dropped.</p>
 */
public final class WorkContext {

    private static final Diagnostics DIAG = Diagnostics.of(WorkContext.class);
    public static final String WORK_WAS_CANCELLED = "Work was cancelled";
    private static final long PAUSE_SLICE_MS = 10L;

    private final @NonNull CancellationToken token;
    private final @NonNull ProgressListener progressSink;

    private WorkContext(@NonNull CancellationToken token, @NonNull ProgressListener progressSink) {
        this.token = token;
        this.progressSink = progressSink;
    }

    /**
     * @param token        the owning worker's token
     * @param progressSink where {@link #progress(int, String)} calls are forwarded
     * @return a new context
     */
    public static @NonNull WorkContext create(CancellationToken token, ProgressListener progressSink) {
        if (token == null) throw new IllegalArgumentException("token cannot be null");
        if (progressSink == null) throw new IllegalArgumentException("progressSink cannot be null");
        return new WorkContext(token, progressSink);
    }

    // 🧩 Section: cancellation

    /**
     * Checkpoint. Returns normally unless cancellation has been requested.
     *
     * @throws WorkCancelledException if the owning worker was cancelled
     */
    public void checkCancelled() {
        if (token.isRequested()) {
            DIAG.debug("ctx#{} checkpoint hit after cancel on {}", hashCode(), Thread.currentThread().getName());
            throw new WorkCancelledException(WORK_WAS_CANCELLED);
        }
    }

    /**
     * Non-throwing query, for bodies that want to release resources before unwinding.
     * Unwinding should still go through {@link #checkCancelled()}.
     */
    public boolean isCancelled() {
        return token.isRequested();
    }
    // [/🧩 Section: cancellation]

    // 🧩 Section: progress

    /**
     * Queue a progress notification for delivery on the main thread.
     *
     * @param percent advisory percentage, normally 0..100; passed through unchanged
     * @param message text shown alongside; {@code null} is delivered as an empty string
     */
    public void progress(int percent, @Nullable String message) {
        progressSink.onProgress(percent, message == null ? "" : message);
    }
    // [/🧩 Section: progress]

    // 🧩 Section: pause

    /**
     * Sleep for {@code millis}, acting as a checkpoint before and during the wait.
     * Cancellation is noticed within one short slice; the thread is never interrupted for it.
     *
     * @throws WorkCancelledException if cancellation is requested before or during the pause
     * @throws InterruptedException   if the thread is interrupted by its host
     */
    public void pause(long millis) throws InterruptedException {
        checkCancelled();
        long remaining = Math.max(0L, millis);
        while (remaining > 0L) {
            long slice = Math.min(PAUSE_SLICE_MS, remaining);
            Thread.sleep(slice);
            remaining -= slice;
            checkCancelled();
        }
    }
    // [/🧩 Section: pause]

    @Override
    public String toString() {
        return "WorkContext{" +
                "thread=" + Thread.currentThread().getName() +
                ", cancelled=" + token.isRequested() +
                '}';
    }
}
