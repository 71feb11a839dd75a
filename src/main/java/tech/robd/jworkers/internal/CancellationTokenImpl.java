/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/internal/CancellationTokenImpl.java
 description: Default implementation of CancellationToken backed by an atomic flag.
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

import tech.robd.jworkers.CancellationToken;
import tech.robd.jworkers.diagnostics.Diagnostics;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default implementation of {@link CancellationToken}. Diagnostics are silent unless enabled.
 */
public final class CancellationTokenImpl implements CancellationToken {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(CancellationTokenImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final int tokId = System.identityHashCode(this);
    private final AtomicBoolean requested = new AtomicBoolean(false);
    // [/🧩 Section: state]

    // 🧩 Section: query
    @Override
    public boolean isRequested() {
        return requested.get();
    }
    // [/🧩 Section: query]

    // 🧩 Section: request
    @Override
    public boolean request() {
        if (!requested.compareAndSet(false, true)) {
            DIAG.debug("tok#{} request: already requested", tokId);
            return false;
        }
        DIAG.debug("tok#{} request: flag set", tokId);
        return true;
    }
    // [/🧩 Section: request]

    // 🧩 Section: misc
    @Override
    public String toString() {
        return requested.get() ? "CancellationToken[REQUESTED]" : "CancellationToken[ACTIVE]";
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }
    // [/🧩 Section: misc]
}
