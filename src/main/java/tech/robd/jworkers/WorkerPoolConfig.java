/*
 [File Info]
 path: src/main/java/tech/robd/jworkers/WorkerPoolConfig.java
 description: WorkerPool settings (thread naming, daemon threads, shutdown wait) with system-property overrides.
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

import java.time.Duration;

/**
 * Settings for a {@link WorkerPool}.
 *
 * <p>System properties read by {@link #fromSystemProperties()}:
 * <ul>
 *   <li>{@code jworkers.pool.name} – prefix for worker and thread names (default {@code workers})</li>
 *   <li>{@code jworkers.pool.daemon} – whether pool threads are daemons (default {@code true})</li>
 *   <li>{@code jworkers.pool.shutdownTimeoutMs} – how long {@link WorkerPool#awaitTermination()} waits for
 *       bodies to unwind (default {@code 5000})</li>
 * </ul>
 *
 * @param name            prefix for worker and thread names
 * @param daemonThreads   whether the default executor creates daemon threads
 * @param shutdownTimeout upper bound on the wait in {@link WorkerPool#awaitTermination()}
 */
public record WorkerPoolConfig(String name, boolean daemonThreads, Duration shutdownTimeout) {

    public static final String NAME_PROPERTY = "jworkers.pool.name";
    public static final String DAEMON_PROPERTY = "jworkers.pool.daemon";
    public static final String SHUTDOWN_TIMEOUT_PROPERTY = "jworkers.pool.shutdownTimeoutMs";

    static final String DEFAULT_NAME = "workers";
    static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 5_000L;

    public WorkerPoolConfig {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name cannot be blank");
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be zero or positive");
        }
    }

    public static WorkerPoolConfig defaults() {
        return new WorkerPoolConfig(DEFAULT_NAME, true, Duration.ofMillis(DEFAULT_SHUTDOWN_TIMEOUT_MS));
    }

    /**
     * Defaults overridden by any of the {@code jworkers.pool.*} system properties that are set.
     *
     * @throws IllegalArgumentException if the timeout property is not a non-negative number
     */
    public static WorkerPoolConfig fromSystemProperties() {
        String name = System.getProperty(NAME_PROPERTY, DEFAULT_NAME).trim();
        boolean daemon = Boolean.parseBoolean(System.getProperty(DAEMON_PROPERTY, "true").trim());
        String rawTimeout = System.getProperty(SHUTDOWN_TIMEOUT_PROPERTY, Long.toString(DEFAULT_SHUTDOWN_TIMEOUT_MS)).trim();
        long timeoutMs;
        try {
            timeoutMs = Long.parseLong(rawTimeout);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(SHUTDOWN_TIMEOUT_PROPERTY + " is not a number: " + rawTimeout, e);
        }
        return new WorkerPoolConfig(name, daemon, Duration.ofMillis(timeoutMs));
    }

    public WorkerPoolConfig withName(String name) {
        return new WorkerPoolConfig(name, daemonThreads, shutdownTimeout);
    }

    public WorkerPoolConfig withDaemonThreads(boolean daemonThreads) {
        return new WorkerPoolConfig(name, daemonThreads, shutdownTimeout);
    }

    public WorkerPoolConfig withShutdownTimeout(Duration shutdownTimeout) {
        return new WorkerPoolConfig(name, daemonThreads, shutdownTimeout);
    }
}
