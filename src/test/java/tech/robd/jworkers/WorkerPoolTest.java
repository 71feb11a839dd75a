/*
 [File Info]
 path: src/test/java/tech/robd/jworkers/WorkerPoolTest.java
 description: WorkerPool tests: single terminal callback on the main thread, cancellation precedence,
              cancel after completion, progress ordering, error messages, non-blocking submit,
              replace-in-flight, rejection after close and cancelAll.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 * Licensed under the Apache License, Version 2.0 (the "License");
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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jworkers.tools.CallbackRecorder;
import tech.robd.jworkers.tools.TestAwaitUtils;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    private MainThreadQueue main;
    private WorkerPool pool;

    @BeforeEach
    void setup() {
        main = new MainThreadQueue();
        pool = WorkerPool.create(main, WorkerPoolConfig.defaults().withName("test"));
    }

    @AfterEach
    void cleanup() {
        pool.close();
    }

    @Test
    @Timeout(5)
        // Exactly one terminal callback, delivered on the main thread; extra pumping delivers nothing more.
    void exactlyOneTerminalCallbackOnMainThread() {
        var rec = new CallbackRecorder<String>(main);
        Worker<String> w = pool.submit(rec.request(ctx -> {
            ctx.checkCancelled();
            return "ok";
        }));

        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");
        TestAwaitUtils.pumpFor(main, 100);

        assertEquals(List.of("done:ok"), rec.events());
        assertEquals(1, rec.terminalCount());
        assertEquals(0, rec.offMainThreadCalls());
        assertEquals(WorkerState.DONE, w.state());
        assertTrue(w.isFinished());
        assertFalse(w.isRunning());
    }

    @Test
    @Timeout(5)
        // Cancellation precedence: cancel() before the first checkpoint means onCancel, never onDone/onError.
        // Race-avoidance: the body blocks on 'go' until the cancel has been requested.
    void cancelBeforeFirstCheckpointDeliversOnCancel() {
        var go = new CountDownLatch(1);
        var rec = new CallbackRecorder<String>(main);
        Worker<String> w = pool.submit(rec.request(ctx -> {
            TestAwaitUtils.await(go, 2000);
            ctx.checkCancelled();
            return "should not happen";
        }));

        assertTrue(w.cancel(), "first cancel should take effect");
        assertFalse(w.cancel(), "second cancel is a no-op");
        assertTrue(w.isCancelRequested());
        go.countDown();

        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");
        TestAwaitUtils.pumpFor(main, 50);

        assertEquals(List.of("cancel"), rec.events());
        assertEquals(WorkerState.CANCELLED, w.state());
        assertInstanceOf(WorkOutcome.Cancelled.class, TestAwaitUtils.awaitOutcome(w, 100));
    }

    @Test
    @Timeout(5)
        // cancel() on a finished worker returns false and triggers no callback.
    void cancelAfterCompletionIsNoOp() {
        var rec = new CallbackRecorder<Integer>(main);
        Worker<Integer> w = pool.submit(rec.request(ctx -> 42));

        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");
        assertFalse(w.cancel());
        assertFalse(w.isCancelRequested());
        TestAwaitUtils.pumpFor(main, 50);

        assertEquals(List.of("done:42"), rec.events());
        assertEquals(WorkerState.DONE, w.state());
    }

    @Test
    @Timeout(5)
        // Progress notifications arrive in emission order and before the terminal callback.
    void progressIsDeliveredInOrderBeforeDone() {
        var rec = new CallbackRecorder<String>(main);
        pool.submit(rec.request(ctx -> {
            ctx.progress(10, "a");
            ctx.progress(90, "b");
            return "result";
        }));

        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");

        assertEquals(List.of("progress:10:a", "progress:90:b", "done:result"), rec.events());
    }

    @Test
    @Timeout(5)
        // Percent values are passed through untouched, even out of range or going backwards.
    void progressValuesAreNotClampedOrReordered() {
        var rec = new CallbackRecorder<String>(main);
        pool.submit(rec.request(ctx -> {
            ctx.progress(150, "over");
            ctx.progress(-5, null);
            return "x";
        }));

        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");

        assertEquals(List.of("progress:150:over", "progress:-5:", "done:x"), rec.events());
    }

    @Test
    @Timeout(5)
        // A failure's message is handed to onError verbatim; nothing else fires.
    void failureMessageReachesOnError() {
        var rec = new CallbackRecorder<String>(main);
        Worker<String> w = pool.submit(rec.request(ctx -> {
            throw new IllegalStateException("boom");
        }));

        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");
        TestAwaitUtils.pumpFor(main, 50);

        assertEquals(List.of("error:boom"), rec.events());
        assertEquals(WorkerState.ERRORED, w.state());
        var outcome = assertInstanceOf(WorkOutcome.Errored.class, TestAwaitUtils.awaitOutcome(w, 100));
        assertInstanceOf(IllegalStateException.class, outcome.cause());
    }

    @Test
    @Timeout(5)
        // Errors (not just exceptions) escaping a body still resolve to onError.
    void errorThrowableResolvesToOnError() {
        var rec = new CallbackRecorder<String>(main);
        pool.submit(rec.request(ctx -> {
            throw new AssertionError("internal fault");
        }));

        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");

        assertEquals(List.of("error:internal fault"), rec.events());
    }

    @Test
    @Timeout(5)
        // A CancellationException the body did not get from its own token is a failure, not a cancellation.
    void foreignCancellationExceptionIsAnError() {
        var rec = new CallbackRecorder<String>(main);
        pool.submit(rec.request(ctx -> {
            throw new CancellationException("upstream future cancelled");
        }));

        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");

        assertEquals(List.of("error:upstream future cancelled"), rec.events());
    }

    @Test
    @Timeout(5)
        // A body that swallows the cancellation signal and returns normally is Done.
    void bodyThatIgnoresCancellationCompletesNormally() {
        var go = new CountDownLatch(1);
        var rec = new CallbackRecorder<String>(main);
        Worker<String> w = pool.submit(rec.request(ctx -> {
            TestAwaitUtils.await(go, 2000);
            try {
                ctx.checkCancelled();
                return "not cancelled";
            } catch (WorkCancelledException e) {
                return "cleaned up";
            }
        }));

        w.cancel();
        go.countDown();
        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");

        assertEquals(List.of("done:cleaned up"), rec.events());
    }

    @Test
    @Timeout(5)
        // submit() returns a running handle while the body is still blocked before its first checkpoint.
    void submitDoesNotWaitForTheBody() {
        var release = new CountDownLatch(1);
        var rec = new CallbackRecorder<String>(main);

        long start = System.nanoTime();
        Worker<String> w = pool.submit(rec.request(ctx -> {
            TestAwaitUtils.await(release, 3000);
            ctx.checkCancelled();
            return "late";
        }));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertNotNull(w);
        assertTrue(elapsedMs < 500, "submit blocked for " + elapsedMs + "ms");
        assertTrue(w.isRunning());
        assertEquals(1, pool.activeCount());
        TestAwaitUtils.pumpFor(main, 50);
        assertTrue(rec.events().isEmpty());

        release.countDown();
        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");
        assertEquals(List.of("done:late"), rec.events());
    }

    @Test
    @Timeout(5)
        // Replace-in-flight: cancel the running worker, submit a new one; the old ends Cancelled, the new runs to Done.
    void replacingInFlightWorkerCancelsThePrevious() {
        var entered = new CountDownLatch(1);
        var first = new CallbackRecorder<String>(main);
        var second = new CallbackRecorder<String>(main);

        Worker<String> old = pool.submit(first.request(ctx -> {
            entered.countDown();
            while (true) {
                ctx.pause(10);
            }
        }));
        TestAwaitUtils.awaitLatch(entered, 1000, "first worker never started");

        old.cancel();
        Worker<String> replacement = pool.submit(second.request(ctx -> {
            ctx.checkCancelled();
            return "second";
        }));

        TestAwaitUtils.pumpUntil(main, () -> first.hasTerminal() && second.hasTerminal(), 2000,
                "both workers should finish");

        assertEquals(List.of("cancel"), first.events());
        assertEquals(List.of("done:second"), second.events());
        assertEquals(WorkerState.CANCELLED, old.state());
        assertEquals(WorkerState.DONE, replacement.state());
        assertNotEquals(old.name(), replacement.name());
    }

    @Test
    @Timeout(5)
        // Progress emitted after cancel() but before the next checkpoint is still delivered, ahead of onCancel.
    void progressRacingCancellationIsDeliveredBeforeOnCancel() {
        var go = new CountDownLatch(1);
        var rec = new CallbackRecorder<String>(main);
        Worker<String> w = pool.submit(rec.request(ctx -> {
            TestAwaitUtils.await(go, 2000);
            ctx.progress(50, "late");
            ctx.checkCancelled();
            return "unreachable";
        }));

        w.cancel();
        go.countDown();
        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");

        assertEquals(List.of("progress:50:late", "cancel"), rec.events());
    }

    @Test
    @Timeout(5)
        // Progress through a context that outlived its body is dropped.
    void progressFromLeakedContextIsDropped() {
        var leaked = new AtomicReference<WorkContext>();
        var rec = new CallbackRecorder<String>(main);
        Worker<String> w = pool.submit(rec.request(ctx -> {
            leaked.set(ctx);
            return "done";
        }));

        TestAwaitUtils.awaitOutcome(w, 2000);
        leaked.get().progress(99, "too late");
        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");
        TestAwaitUtils.pumpFor(main, 50);

        assertEquals(List.of("done:done"), rec.events());
    }

    @Test
    @Timeout(5)
        // A request without callbacks runs fine; the outcome future still reports the value.
    void requestWithoutCallbacksStillCompletes() {
        Worker<String> w = pool.submit(WorkRequest.of(ctx -> "quiet"));

        WorkOutcome<String> outcome = TestAwaitUtils.awaitOutcome(w, 2000);
        TestAwaitUtils.pumpFor(main, 50);

        assertEquals(new WorkOutcome.Done<>("quiet"), outcome);
        TestAwaitUtils.pumpUntil(main, () -> pool.activeCount() == 0, 1000, "worker still tracked");
    }

    @Test
    @Timeout(5)
        // cancelAll() reaches every live worker.
    void cancelAllCancelsEveryLiveWorker() {
        var started = new CountDownLatch(3);
        var a = new CallbackRecorder<Void>(main);
        var b = new CallbackRecorder<Void>(main);
        var c = new CallbackRecorder<Void>(main);
        for (var rec : List.of(a, b, c)) {
            pool.submit(rec.request(ctx -> {
                started.countDown();
                while (true) {
                    ctx.pause(10);
                }
            }));
        }
        TestAwaitUtils.awaitLatch(started, 1000, "workers never started");

        assertEquals(3, pool.cancelAll());
        TestAwaitUtils.pumpUntil(main, () -> a.hasTerminal() && b.hasTerminal() && c.hasTerminal(), 2000,
                "all workers should be cancelled");

        for (var rec : List.of(a, b, c)) {
            assertEquals(List.of("cancel"), rec.events());
        }
        assertEquals(0, pool.activeCount());
    }

    @Test
    @Timeout(5)
        // close() cancels running work; the body unwinds at its next checkpoint and onCancel still arrives.
    void closeCancelsRunningWorkers() throws InterruptedException {
        var entered = new CountDownLatch(1);
        var rec = new CallbackRecorder<String>(main);
        Worker<String> w = pool.submit(rec.request(ctx -> {
            entered.countDown();
            while (true) {
                ctx.pause(10);
            }
        }));
        TestAwaitUtils.awaitLatch(entered, 1000, "worker never started");

        pool.close();
        pool.close(); // idempotent

        assertTrue(pool.isClosed());
        assertTrue(w.isCancelRequested());
        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 1000, "no terminal callback");
        assertEquals(List.of("cancel"), rec.events());
        assertEquals(WorkerState.CANCELLED, w.state());
        assertTrue(pool.awaitTermination(Duration.ofSeconds(1)));
    }

    @Test
    @Timeout(5)
        // close() returns at once even when a body is stuck before its first checkpoint.
    void closeDoesNotWaitForBlockedBody() throws InterruptedException {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var rec = new CallbackRecorder<String>(main);
        Worker<String> w = pool.submit(rec.request(ctx -> {
            entered.countDown();
            TestAwaitUtils.await(release, 4000);
            ctx.checkCancelled();
            return "late";
        }));
        TestAwaitUtils.awaitLatch(entered, 1000, "worker never started");

        long start = System.nanoTime();
        pool.close();
        long tookMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(tookMs < 500, "close() blocked for " + tookMs + "ms");
        assertEquals(WorkerState.RUNNING, w.state());
        assertFalse(pool.awaitTermination(Duration.ofMillis(50)), "body is still blocked");

        release.countDown();
        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 2000, "no terminal callback");
        assertEquals(List.of("cancel"), rec.events());
        assertTrue(pool.awaitTermination(Duration.ofSeconds(1)));
    }

    @Test
    @Timeout(5)
        // A host loop that refuses posts loses the callback but the worker still completes and is forgotten.
    void refusingHostStillCompletesOutcome() {
        MainThread refusing = MainThread.of(r -> {
            throw new RejectedExecutionException("host loop gone");
        }, () -> false);
        try (WorkerPool hostPool = WorkerPool.create(refusing, WorkerPoolConfig.defaults().withName("host"))) {
            Worker<String> w = hostPool.submit(WorkRequest.<String>builder(ctx -> {
                        ctx.progress(50, "half");
                        return "v";
                    })
                    .onProgress((p, m) -> { })
                    .onDone(v -> { })
                    .build());

            WorkOutcome<String> outcome = TestAwaitUtils.awaitOutcome(w, 2000);
            assertEquals(WorkOutcome.done("v"), outcome);
            assertEquals(WorkerState.DONE, w.state());
            long deadline = System.nanoTime() + 1_000_000_000L;
            while (hostPool.activeCount() > 0 && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            assertEquals(0, hostPool.activeCount());
        }
    }

    @Test
    @Timeout(5)
        // Submitting to a closed pool still hands back a worker, which resolves to onError.
    void submitAfterCloseResolvesToError() {
        pool.close();
        var ran = new CountDownLatch(1);
        var rec = new CallbackRecorder<String>(main);

        Worker<String> w = pool.submit(rec.request(ctx -> {
            ran.countDown();
            return "never";
        }));

        TestAwaitUtils.pumpUntil(main, rec::hasTerminal, 1000, "no terminal callback");
        assertEquals(List.of("error:Worker pool 'test' is closed"), rec.events());
        assertEquals(WorkerState.ERRORED, w.state());
        assertEquals(1, ran.getCount(), "body must not run");
    }

    @Test
    void submitRejectsNullRequest() {
        assertThrows(IllegalArgumentException.class, () -> pool.submit(null));
    }
}
