/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/MainThreadQueue.java
 description: Explicit main-thread task queue: post from any thread, drain once per event-loop iteration on the bound thread.
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
import tech.robd.jworkers.diagnostics.Diagnostics;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * A {@link MainThread} that the host drives explicitly.
 *
 * <p>Worker threads {@link #post(Runnable)} closures; the owning thread runs them by calling
 * {@link #drain()} once per event-loop iteration, or {@link #pumpUntil(BooleanSupplier, Duration)}
 * when it wants to block until something specific has happened.</p>
 *
 * <p>The queue is bound to the thread that constructed it. A posted task that throws a
 * {@link RuntimeException} is logged and the drain carries on with the next task.</p>
 */
public final class MainThreadQueue implements MainThread {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(MainThreadQueue.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final BlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();
    private volatile Thread owner;
    // [/🧩 Section: state]

    public MainThreadQueue() {
        this.owner = Thread.currentThread();
        DIAG.debug("main-queue bound to {}", owner.getName());
    }

    // 🧩 Section: posting
    @Override
    public void post(Runnable task) {
        if (task == null) throw new IllegalArgumentException("task cannot be null");
        tasks.add(task);
    }

    @Override
    public boolean isMainThread() {
        return Thread.currentThread() == owner;
    }

    /**
     * Make the calling thread the main thread, e.g. when the event loop starts on a thread
     * other than the one that built the queue.
     */
    public void bindToCurrentThread() {
        owner = Thread.currentThread();
        DIAG.debug("main-queue rebound to {}", owner.getName());
    }
    // [/🧩 Section: posting]

    // 🧩 Section: draining

    /**
     * Run every task that was queued when the call started. Tasks posted while draining wait
     * for the next iteration.
     *
     * @return the number of tasks run
     * @throws IllegalStateException if called off the main thread
     */
    public int drain() {
        requireMainThread("drain");
        int budget = tasks.size();
        int ran = 0;
        while (ran < budget) {
            Runnable task = tasks.poll();
            if (task == null) break;
            runSafely(task);
            ran++;
        }
        return ran;
    }

    /**
     * Drain repeatedly, waiting for new tasks in between, until {@code condition} holds or
     * {@code timeout} elapses. The condition is evaluated on the main thread after each drain.
     *
     * @return {@code true} if the condition was met, {@code false} on timeout or interrupt
     * @throws IllegalStateException if called off the main thread
     */
    public boolean pumpUntil(BooleanSupplier condition, Duration timeout) {
        if (condition == null || timeout == null) {
            throw new IllegalArgumentException("condition and timeout cannot be null");
        }
        requireMainThread("pumpUntil");
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            drain();
            if (condition.getAsBoolean()) return true;
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0L) return false;
            @Nullable Runnable next;
            try {
                next = tasks.poll(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                DIAG.debug("main-queue pump interrupted");
                return condition.getAsBoolean();
            }
            if (next != null) runSafely(next);
        }
    }

    /**
     * @return tasks waiting to run
     */
    public int pending() {
        return tasks.size();
    }
    // [/🧩 Section: draining]

    // 🧩 Section: helpers
    private void requireMainThread(String op) {
        if (!isMainThread()) {
            throw new IllegalStateException(op + "() must be called on the main thread ("
                    + owner.getName() + "), not " + Thread.currentThread().getName());
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            DIAG.error("main-thread task failed: {}", e.toString(), e);
        }
    }
    // [/🧩 Section: helpers]

    @Override
    public String toString() {
        return "MainThreadQueue[owner=" + owner.getName() + ", pending=" + tasks.size() + "]";
    }
}
