/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/FailureMessages.java
 description: Renders a task-body failure into the human-readable string handed to onError.
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

import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turns a failure into the text passed to {@code onError}.
 *
 * <p>Wrapper exceptions ({@link CompletionException}, {@link ExecutionException},
 * {@link InvocationTargetException}) are peeled off first. The message is used as-is when
 * present and non-blank; otherwise the exception's simple class name stands in.</p>
 */
public final class FailureMessages {

    private FailureMessages() {
    }

    public static String render(Throwable failure) {
        if (failure == null) return "Unknown error";
        Throwable t = unwrap(failure);
        String msg = t.getMessage();
        if (msg != null && !msg.isBlank()) return msg;
        return t.getClass().getSimpleName();
    }

    static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while ((t instanceof CompletionException
                || t instanceof ExecutionException
                || t instanceof InvocationTargetException)
                && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
