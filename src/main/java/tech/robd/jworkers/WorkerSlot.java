/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/WorkerSlot.java
 description: Holds at most one live Worker for a logical operation; replace() cancels the previous worker before submitting the next.
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

import org.jspecify.annotations.Nullable;

import java.util.concurrent.atomic.AtomicReference;

/**
 * At most one live {@link Worker} for one logical operation (loading a list, expanding a tree
 * node, ...). Re-entering the operation through {@link #replace(WorkRequest)} cancels whatever
 * was still running and starts the new request.
 *
 * <p>The slot empties itself on the main thread just before the held worker's terminal
 * callback runs, so that callback may call {@link #replace(WorkRequest)} again. A cancelled
 * predecessor still delivers its own {@code onCancel}.</p>
 *
 * @param <T> result type of the operation
 */
public final class WorkerSlot<T> {

    private final WorkerPool pool;
    private final AtomicReference<@Nullable Worker<T>> current = new AtomicReference<>();

    public WorkerSlot(WorkerPool pool) {
        if (pool == null) throw new IllegalArgumentException("pool cannot be null");
        this.pool = pool;
    }

    /**
     * Cancel the live worker, if any, then submit {@code request}.
     *
     * @return the new worker, now held by this slot
     */
    public Worker<T> replace(WorkRequest<T> request) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");
        cancel();

        AtomicReference<@Nullable Worker<T>> self = new AtomicReference<>();
        Runnable release = () -> {
            Worker<T> mine = self.get();
            if (mine != null) current.compareAndSet(mine, null);
        };

        var onDone = request.onDone();
        var onError = request.onError();
        var onCancel = request.onCancel();
        WorkRequest<T> tracked = request.toBuilder()
                .onDone(value -> {
                    release.run();
                    if (onDone != null) onDone.accept(value);
                })
                .onError(message -> {
                    release.run();
                    if (onError != null) onError.accept(message);
                })
                .onCancel(() -> {
                    release.run();
                    if (onCancel != null) onCancel.run();
                })
                .build();

        Worker<T> worker = pool.submit(tracked);
        self.set(worker);
        current.set(worker);
        return worker;
    }

    /**
     * Cancel and forget the live worker. Its terminal callback is still delivered.
     *
     * @return {@code true} if a running worker accepted the request
     */
    public boolean cancel() {
        Worker<T> previous = current.getAndSet(null);
        return previous != null && previous.cancel();
    }

    public @Nullable Worker<T> current() {
        return current.get();
    }

    /**
     * @return {@code true} while the held worker has not reached a terminal state
     */
    public boolean isBusy() {
        Worker<T> w = current.get();
        return w != null && w.isRunning();
    }
}
