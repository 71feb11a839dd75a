/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/CancellationToken.java
 description: Public interface for a one-way cancellation flag shared between the submitting
              side and a running task body.
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

import tech.robd.jworkers.internal.CancellationTokenImpl;

/**
 * Represents a cancellation request that can be raised from any thread and observed
 * by a running task body.
 *
 * <p>Cancellation is one-way: once requested, a token never returns to the
 * not-requested state.</p>
 */
public interface CancellationToken {

    /**
     * @return {@code true} if cancellation has been requested
     * <p>Thread-safe and non-blocking.</p>
     */
    boolean isRequested();

    /**
     * Request cancellation.
     * <p>Safe to call multiple times and from any thread.</p>
     *
     * @return {@code true} if this call set the flag, {@code false} if it was already set
     */
    boolean request();

    /**
     * @return a fresh, not-yet-requested token
     */
    static CancellationToken create() {
        return new CancellationTokenImpl();
    }
}
