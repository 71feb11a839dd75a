/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/MainThread.java
 description: Main-thread dispatch seam: post closures from any thread for execution on the single UI thread.
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

import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * The single thread on which every worker callback runs.
 *
 * <p>{@link MainThreadQueue} is the explicit, drained-per-iteration implementation. Hosts that
 * already own an event loop can adapt it with {@link #of(Executor, BooleanSupplier)}, e.g.
 * {@code MainThread.of(SwingUtilities::invokeLater, SwingUtilities::isEventDispatchThread)}.</p>
 */
public interface MainThread {

    /**
     * Queue {@code task} to run on the main thread. Callable from any thread; tasks posted
     * from one thread run in posting order.
     */
    void post(Runnable task);

    /**
     * @return {@code true} if the calling thread is the main thread
     */
    boolean isMainThread();

    /**
     * Adapt a host event loop.
     *
     * @param hostExecutor  runs posted tasks on the host's main thread, in order
     * @param isMainThread  answers whether the caller is on that thread
     * @return a {@link MainThread} delegating to the host
     */
    static MainThread of(Executor hostExecutor, BooleanSupplier isMainThread) {
        if (hostExecutor == null || isMainThread == null) {
            throw new IllegalArgumentException("hostExecutor and isMainThread cannot be null");
        }
        return new HostMainThread(hostExecutor, isMainThread);
    }

    /**
     * {@link MainThread} backed by a host-supplied executor.
     */
    record HostMainThread(Executor hostExecutor, BooleanSupplier mainThreadCheck) implements MainThread {
        @Override
        public void post(Runnable task) {
            if (task == null) throw new IllegalArgumentException("task cannot be null");
            hostExecutor.execute(task);
        }

        @Override
        public boolean isMainThread() {
            return mainThreadCheck.getAsBoolean();
        }
    }
}
