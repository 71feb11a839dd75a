/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/internal/WorkerImpl.java
 description: Default Worker implementation. Runs the task body, decides exactly one terminal
              outcome and marshals progress and terminal callbacks onto the main thread.
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

package tech.robd.jworkers.internal;

import tech.robd.jworkers.*;
import tech.robd.jworkers.diagnostics.Diagnostics;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Default implementation of {@link Worker}.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Run the body with a fresh {@link WorkContext} and map how it ended to a {@link WorkOutcome}.</li>
 *   <li>Move {@code RUNNING} to exactly one terminal state with a single compare-and-set.</li>
 *   <li>Post progress and terminal closures to the {@link MainThread}; the terminal closure is
 *       posted after every progress closure emitted by the body.</li>
 * </ul>
 *
 * <p>Progress emission and the terminal decision share one lock, so a progress call from a
 * leaked context either lands before the terminal closure or is dropped.</p>
 *
 * @param <T> result type
 */
public final class WorkerImpl<T> implements Worker<T>, Runnable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(WorkerImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final String name;
    private final WorkRequest<T> request;
    private final MainThread mainThread;
    private final CancellationToken token = CancellationToken.create();
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.RUNNING);
    private final CompletableFuture<WorkOutcome<T>> outcome = new CompletableFuture<>();
    private final Object emitLock = new Object();
    // [/🧩 Section: state]

    // 🧩 Section: construction
    public WorkerImpl(String name, WorkRequest<T> request, MainThread mainThread) {
        if (name == null) throw new IllegalArgumentException("name cannot be null");
        if (request == null) throw new IllegalArgumentException("request cannot be null");
        if (mainThread == null) throw new IllegalArgumentException("mainThread cannot be null");
        this.name = name;
        this.request = request;
        this.mainThread = mainThread;
        DIAG.debug("wrk#{} created", name);
    }
    // [/🧩 Section: construction]

    // 🧩 Section: execution

    /**
     * Runs the body on the calling (background) thread. Never throws.
     */
    @Override
    public void run() {
        DIAG.debug("wrk#{} start on {}", name, Thread.currentThread().getName());
        WorkContext ctx = WorkContext.create(token, this::emitProgress);
        WorkOutcome<T> result;
        try {
            T value = request.function().apply(ctx);
            result = WorkOutcome.done(value);
        } catch (WorkCancelledException wce) {
            result = WorkOutcome.cancelled();
        } catch (CancellationException ce) {
            // only ours if the token was actually raised
            result = token.isRequested()
                    ? WorkOutcome.cancelled()
                    : WorkOutcome.errored(FailureMessages.render(ce), ce);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            result = token.isRequested()
                    ? WorkOutcome.cancelled()
                    : WorkOutcome.errored(FailureMessages.render(ie), ie);
        } catch (Throwable t) {
            result = WorkOutcome.errored(FailureMessages.render(t), t);
        }
        finish(result);
    }

    /**
     * Resolve without running the body, used when the pool cannot accept the task.
     */
    public void reject(String reason) {
        DIAG.warn("wrk#{} rejected: {}", name, reason);
        finish(WorkOutcome.errored(reason, null));
    }
    // [/🧩 Section: execution]

    // 🧩 Section: dispatch
    private void emitProgress(int percent, String message) {
        ProgressListener listener = request.onProgress();
        synchronized (emitLock) {
            if (state.get() != WorkerState.RUNNING) {
                DIAG.debug("wrk#{} progress {}% dropped: already {}", name, percent, state.get());
                return;
            }
            if (listener == null) return;
            try {
                mainThread.post(() -> listener.onProgress(percent, message));
            } catch (RuntimeException rex) {
                DIAG.error("wrk#{} progress {}% could not be posted to the main thread", name, percent, rex);
            }
        }
    }

    private void finish(WorkOutcome<T> result) {
        synchronized (emitLock) {
            if (!state.compareAndSet(WorkerState.RUNNING, result.state())) {
                DIAG.error("wrk#{} second terminal outcome {} ignored (state={})", name, result.state(), state.get());
                return;
            }
            DIAG.debug("wrk#{} terminal -> {}", name, result.state());
            try {
                mainThread.post(() -> deliver(result));
            } catch (RuntimeException rex) {
                // the outcome still completes; only the callback is lost
                DIAG.error("wrk#{} {} callback could not be posted to the main thread", name, result.state(), rex);
            }
        }
        outcome.complete(result);
    }

    private void deliver(WorkOutcome<T> result) {
        DIAG.debug("wrk#{} delivering {}", name, result.state());
        if (result instanceof WorkOutcome.Done<T> done) {
            Consumer<? super T> onDone = request.onDone();
            if (onDone != null) onDone.accept(done.value());
        } else if (result instanceof WorkOutcome.Errored<T> errored) {
            Consumer<String> onError = request.onError();
            if (onError != null) onError.accept(errored.message());
        } else {
            Runnable onCancel = request.onCancel();
            if (onCancel != null) onCancel.run();
        }
    }
    // [/🧩 Section: dispatch]

    // 🧩 Section: API
    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean cancel() {
        if (state.get() != WorkerState.RUNNING) {
            DIAG.debug("wrk#{} cancel() ignored: already {}", name, state.get());
            return false;
        }
        boolean first = token.request();
        DIAG.debug("wrk#{} cancel() requested (first={})", name, first);
        return first;
    }

    @Override
    public boolean isCancelRequested() {
        return token.isRequested();
    }

    @Override
    public WorkerState state() {
        return state.get();
    }

    @Override
    public CompletableFuture<WorkOutcome<T>> outcome() {
        return outcome.copy();
    }
    // [/🧩 Section: API]

    // 🧩 Section: misc
    @Override
    public String toString() {
        WorkerState s = state.get();
        String status = s == WorkerState.RUNNING && token.isRequested() ? "CANCELLING" : s.name();
        return "Worker[" + name + " " + status + "]";
    }
    // [/🧩 Section: misc]
}
