/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.gateway.domain.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-call execution context: the caller's cancellation token and the deadline
 * derived from the call timeout. Long-running handlers consult
 * {@link #interruption()} at every poll so they never wait past either.
 */
public final class ToolExecutionContext {

    private final String toolName;
    private final CancellationToken cancellationToken;
    private final Instant deadline;
    private final Clock clock;

    public ToolExecutionContext(String toolName, CancellationToken cancellationToken, Duration timeout, Clock clock) {
        this.toolName = toolName;
        this.cancellationToken = cancellationToken != null ? cancellationToken : CancellationToken.none();
        this.clock = clock;
        this.deadline = clock.instant().plus(timeout);
    }

    /**
     * Context without a caller token, bounded by the given timeout.
     */
    public static ToolExecutionContext of(String toolName, Duration timeout) {
        return new ToolExecutionContext(toolName, CancellationToken.none(), timeout, Clock.systemUTC());
    }

    public String getToolName() {
        return toolName;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public boolean isCancelled() {
        return cancellationToken.isCancellationRequested();
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    /**
     * Why the call should stop now, if it should. Cancellation wins over expiry.
     */
    public Optional<ToolFailureKind> interruption() {
        if (isCancelled()) {
            return Optional.of(ToolFailureKind.CANCELLED);
        }
        if (isExpired()) {
            return Optional.of(ToolFailureKind.TIMED_OUT);
        }
        return Optional.empty();
    }

    /**
     * Result describing the current interruption.
     */
    public ToolResult interruptedResult() {
        ToolFailureKind kind = interruption().orElse(ToolFailureKind.CANCELLED);
        if (kind == ToolFailureKind.TIMED_OUT) {
            return ToolResult.failure(ToolFailureKind.TIMED_OUT, "Tool '" + toolName + "' exceeded its deadline");
        }
        return ToolResult.cancelled(toolName);
    }
}
