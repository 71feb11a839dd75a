/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/WorkerPool.java
 description: Accepts WorkRequests, starts one background execution per request and routes callbacks to the main thread. Tracks live workers for cancelAll/close.
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

import tech.robd.jworkers.diagnostics.Diagnostics;
import tech.robd.jworkers.internal.WorkerImpl;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@code WorkerPool} runs task bodies off the main thread and delivers their callbacks on it.
 *
 * <p>It allows you to:
 * <ul>
 *   <li>Start work with {@link #submit(WorkRequest)}, which never waits for the body.</li>
 *   <li>Cancel everything still running with {@link #cancelAll()}.</li>
 *   <li>Wind down with {@link #close()} when the owning window goes away, and optionally
 *       {@link #awaitTermination(Duration)} from a thread that may block.</li>
 * </ul>
 *
 * <p>There is no queue, concurrency limit or back-pressure: with the default executor every
 * submission gets its own thread. Callers coordinate replacement of in-flight work themselves,
 * or through a {@link WorkerSlot}.</p>
 */
public final class WorkerPool implements AutoCloseable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(WorkerPool.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final MainThread mainThread;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final WorkerPoolConfig config;
    private final Set<Worker<?>> activeWorkers = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong sequence = new AtomicLong();
    // [/🧩 Section: state]

    private WorkerPool(MainThread mainThread, ExecutorService executor, boolean ownsExecutor, WorkerPoolConfig config) {
        this.mainThread = mainThread;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.config = config;
        DIAG.debug("pool#{} created (ownsExecutor={})", config.name(), ownsExecutor);
    }

    // 🧩 Section: factories

    /**
     * Pool with settings from {@link WorkerPoolConfig#fromSystemProperties()}.
     */
    public static WorkerPool create(MainThread mainThread) {
        return create(mainThread, WorkerPoolConfig.fromSystemProperties());
    }

    /**
     * Pool backed by an unbounded cached thread pool owned by the returned instance.
     */
    public static WorkerPool create(MainThread mainThread, WorkerPoolConfig config) {
        if (mainThread == null || config == null) {
            throw new IllegalArgumentException("mainThread and config cannot be null");
        }
        return new WorkerPool(mainThread, newDefaultExecutor(config), true, config);
    }

    /**
     * Pool running bodies on a caller-supplied executor. {@link #close()} does not shut it down.
     * A bounded executor makes later submissions wait behind earlier ones.
     */
    public static WorkerPool create(MainThread mainThread, ExecutorService executor, WorkerPoolConfig config) {
        if (mainThread == null || executor == null || config == null) {
            throw new IllegalArgumentException("mainThread, executor and config cannot be null");
        }
        return new WorkerPool(mainThread, executor, false, config);
    }

    private static ExecutorService newDefaultExecutor(WorkerPoolConfig config) {
        AtomicLong threads = new AtomicLong();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, config.name() + "-thread-" + threads.incrementAndGet());
            t.setDaemon(config.daemonThreads());
            return t;
        };
        return Executors.newCachedThreadPool(factory);
    }
    // [/🧩 Section: factories]

    // 🧩 Section: submission

    /**
     * Start {@code request}'s body on a background thread and return its handle immediately.
     * <p>If the pool is closed or the executor refuses the task, the returned worker resolves to
     * {@link WorkerState#ERRORED} and {@code onError} is delivered as usual.</p>
     *
     * @param request the work to run
     * @param <T>     the result type
     * @return a live handle
     * @throws IllegalArgumentException if {@code request} is null
     */
    public <T> Worker<T> submit(WorkRequest<T> request) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");

        String workerName = config.name() + "-" + sequence.incrementAndGet();
        WorkerImpl<T> worker = new WorkerImpl<>(workerName, request, mainThread);
        activeWorkers.add(worker);

        // 🧩 Point: submission/forget-finished
        worker.outcome().whenComplete((o, t) -> activeWorkers.remove(worker));

        if (closed.get()) {
            worker.reject("Worker pool '" + config.name() + "' is closed");
            return worker;
        }

        // 🧩 Point: submission/start-body
        try {
            executor.execute(worker);
        } catch (RejectedExecutionException rex) {
            worker.reject("Worker pool '" + config.name() + "' rejected task (probably shut down)");
        }
        return worker;
    }
    // [/🧩 Section: submission]

    // 🧩 Section: lifecycle

    /**
     * Request cancellation of every worker that has not finished.
     *
     * @return how many workers accepted the request
     */
    public int cancelAll() {
        int cancelled = 0;
        for (Worker<?> worker : activeWorkers) {
            if (worker.cancel()) cancelled++;
        }
        DIAG.debug("pool#{} cancelAll -> {} requested", config.name(), cancelled);
        return cancelled;
    }

    /**
     * Cancel live workers and stop accepting work. Returns without waiting: bodies unwind at
     * their next checkpoint and their terminal callbacks are still posted to the main thread.
     * Threads are never interrupted. An executor the pool created is shut down; a
     * caller-supplied one is left running. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            DIAG.debug("pool#{} close() ignored (already closed)", config.name());
            return;
        }
        DIAG.debug("pool#{} closing with {} live", config.name(), activeWorkers.size());
        cancelAll();
        if (ownsExecutor) executor.shutdown();
    }

    /**
     * {@link #awaitTermination(Duration)} with the configured shutdown timeout.
     */
    public boolean awaitTermination() throws InterruptedException {
        return awaitTermination(config.shutdownTimeout());
    }

    /**
     * Block until every worker submitted so far has decided its terminal state, or the
     * timeout passes. Waits on outcomes only, so callbacks need not have been delivered.
     * Do not call this on the main thread of an event loop that must keep running.
     *
     * @param timeout how long to wait
     * @return {@code true} if no worker is still running
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (timeout == null) throw new IllegalArgumentException("timeout cannot be null");
        CompletableFuture<?>[] pending = activeWorkers.stream()
                .map(Worker::outcome)
                .toArray(CompletableFuture<?>[]::new);
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException te) {
            DIAG.warn("pool#{} {} bodies still running after {}; they finish at their next checkpoint",
                    config.name(), activeWorkers.size(), timeout);
            return false;
        } catch (ExecutionException ee) {
            // outcome futures are only ever completed normally
            throw new IllegalStateException("Worker outcome failed", ee.getCause());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: info

    /**
     * @return workers submitted to this pool whose terminal state is not yet decided
     */
    public int activeCount() {
        return activeWorkers.size();
    }

    public MainThread mainThread() {
        return mainThread;
    }

    public WorkerPoolConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "WorkerPool(" + config.name() + (closed.get() ? ", closed" : "") + ")";
    }
    // [/🧩 Section: info]
}
