/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/diagnostics/DiagnosticsBackend.java
 description: Internal diagnostics sink that forwards to SLF4J (LocationAwareLogger when available).
              Debug/info gated by system property `jworkers.diag`; warn and error always emitted.
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;

import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * SLF4J sink for {@link Diagnostics}.
 *
 * <p>Loggers are cached per owner class. When the bound logger is a
 * {@link LocationAwareLogger} the caller location is attributed past this class.</p>
 */
final class DiagnosticsBackend {

    // 🧩 Section: constants-and-state
    /**
     * Caller boundary for {@link LocationAwareLogger}: the frame above the last
     * {@code Diagnostics} default method is the real call site.
     */
    static final String FQCN = Diagnostics.class.getName();

    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    /**
     * System property to enable diagnostics: {@code -Djworkers.diag=true}.
     */
    static final String DIAGNOSTICS_PROPERTY_NAME = "jworkers.diag";

    private static volatile boolean enabled =
            Boolean.parseBoolean(System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim());
    // [/🧩 Section: constants-and-state]

    private DiagnosticsBackend() {
    }

    // 🧩 Section: enablement
    static void enable() {
        enabled = true;
    }

    static void disable() {
        enabled = false;
    }

    static boolean isEnabled() {
        return enabled;
    }

    /**
     * @return whether a call at {@code level} reaches SLF4J under the current switch
     */
    static boolean passes(int level) {
        return enabled || level >= LocationAwareLogger.WARN_INT;
    }
    // [/🧩 Section: enablement]

    // 🧩 Section: emitters
    static void debug(Class<?> owner, String msg, Object... args) {
        if (!passes(LocationAwareLogger.DEBUG_INT)) return; // fast path
        emit(owner, LocationAwareLogger.DEBUG_INT, msg, args);
    }

    static void info(Class<?> owner, String msg, Object... args) {
        if (!passes(LocationAwareLogger.INFO_INT)) return;
        emit(owner, LocationAwareLogger.INFO_INT, msg, args);
    }

    static void warn(Class<?> owner, String msg, Object... args) {
        emit(owner, LocationAwareLogger.WARN_INT, msg, args);
    }

    static void error(Class<?> owner, String msg, Object... args) {
        emit(owner, LocationAwareLogger.ERROR_INT, msg, args);
    }

    private static void emit(Class<?> owner, int level, String msg, Object[] args) {
        Logger log = LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);

        // 🧩 Point: emitters/split-throwable
        Throwable t = null;
        Object[] params = args;
        if (args != null && args.length > 0 && args[args.length - 1] instanceof Throwable last) {
            t = last;
            params = Arrays.copyOf(args, args.length - 1);
        }

        if (log instanceof LocationAwareLogger law) {
            law.log(null, FQCN, level, msg, params, t);
            return;
        }
        Object[] withThrowable = t == null ? params : args;
        switch (level) {
            case LocationAwareLogger.DEBUG_INT -> {
                if (log.isDebugEnabled()) log.debug(msg, withThrowable);
            }
            case LocationAwareLogger.INFO_INT -> {
                if (log.isInfoEnabled()) log.info(msg, withThrowable);
            }
            case LocationAwareLogger.WARN_INT -> {
                if (log.isWarnEnabled()) log.warn(msg, withThrowable);
            }
            default -> log.error(msg, withThrowable);
        }
    }
    // [/🧩 Section: emitters]
}
