/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/diagnostics/Diagnostics.java
 description: Lightweight diagnostics facade used by the worker engine. Trace-style output is
              switchable at runtime; failures are always reported.
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

package tech.robd.jworkers.diagnostics;

/**
 * Minimal logging facade bound to an owning {@link Class}.
 * <p>
 * {@code debug} and {@code info} only emit while diagnostics are switched on
 * (system property {@code jworkers.diag=true} or {@link #enable()}). {@code warn} and
 * {@code error} always emit.
 * </p>
 */
public interface Diagnostics {

    // 🧩 Section: identity

    /**
     * @return the owner class whose logger receives the output
     */
    Class<?> owner();
    // [/🧩 Section: identity]

    // 🧩 Section: forwarding

    default void debug(String msg, Object... args) {
        DiagnosticsBackend.debug(owner(), msg, args);
    }

    default void info(String msg, Object... args) {
        DiagnosticsBackend.info(owner(), msg, args);
    }

    /**
     * Report a condition the host should see (rejected work, slow shutdown). Not gated.
     */
    default void warn(String msg, Object... args) {
        DiagnosticsBackend.warn(owner(), msg, args);
    }

    /**
     * Report a failure. Not gated by the diagnostics switch.
     *
     * @param msg  SLF4J-style message pattern
     * @param args arguments; a trailing {@link Throwable} is logged with its stack trace
     */
    default void error(String msg, Object... args) {
        DiagnosticsBackend.error(owner(), msg, args);
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: factories-and-switch

    /**
     * @param owner the owning class (non-null)
     * @return diagnostics routed to {@code owner}'s logger
     */
    static Diagnostics of(Class<?> owner) {
        if (owner == null) throw new IllegalArgumentException("owner cannot be null");
        return new ActiveD(owner);
    }

    /**
     * Switch debug/info output on until {@link #disable()} or JVM exit.
     */
    static void enable() {
        DiagnosticsBackend.enable();
    }

    static void disable() {
        DiagnosticsBackend.disable();
    }

    static boolean isEnabled() {
        return DiagnosticsBackend.isEnabled();
    }
    // [/🧩 Section: factories-and-switch]
}
