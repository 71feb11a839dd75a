/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/WorkCancelledException.java
 description: Distinguished exception thrown at a checkpoint once cancellation has been requested.
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

import java.util.concurrent.CancellationException;

/**
 * Thrown by {@link WorkContext#checkCancelled()} when the owning worker has been asked to stop.
 * <p>
 * A task body lets this propagate to unwind; the worker then delivers {@code onCancel}
 * instead of {@code onError}.
 * </p>
 *
 * @author Rob Deas
 * @since 0.1.0
 */
public final class WorkCancelledException extends CancellationException {

    private static final long serialVersionUID = 1L;

    public WorkCancelledException(String message) {
        super(message);
    }
}
