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

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;

/**
 * Uniform result envelope of a tool call. A successful result carries output
 * and never an error; a failed result carries an error and a
 * {@link ToolFailureKind} and never output. Instances are immutable.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    boolean success;
    String output;
    Object data;
    String error;
    ToolFailureKind failureKind;
    @With
    Duration duration;

    /**
     * Creates a successful tool result with output text.
     */
    public static ToolResult success(String output) {
        return success(output, null);
    }

    /**
     * Creates a successful tool result with output text and structured data.
     */
    public static ToolResult success(String output, Object data) {
        return ToolResult.builder()
                .success(true)
                .output(output != null ? output : "")
                .data(data)
                .build();
    }

    /**
     * Creates a failed tool result of the given kind.
     */
    public static ToolResult failure(ToolFailureKind kind, String error) {
        if (kind == null) {
            throw new IllegalArgumentException("Failure kind is required");
        }
        return ToolResult.builder()
                .success(false)
                .error(error != null && !error.isBlank() ? error : kind.name())
                .failureKind(kind)
                .build();
    }

    /**
     * Creates a runtime failure.
     */
    public static ToolResult failure(String error) {
        return failure(ToolFailureKind.EXECUTION_FAILED, error);
    }

    public static ToolResult validationFailed(String error) {
        return failure(ToolFailureKind.VALIDATION_FAILED, error);
    }

    public static ToolResult denied(String reason) {
        return failure(ToolFailureKind.POLICY_DENIED, reason);
    }

    public static ToolResult notFound(String error) {
        return failure(ToolFailureKind.NOT_FOUND, error);
    }

    public static ToolResult cancelled(String toolName) {
        return failure(ToolFailureKind.CANCELLED, "Tool execution cancelled: " + toolName);
    }

    public static ToolResult timedOut(String toolName, Duration timeout) {
        return failure(ToolFailureKind.TIMED_OUT,
                "Tool '" + toolName + "' timed out after " + timeout.toMillis() + " ms");
    }

    /**
     * True when the call was stopped by its caller rather than failing.
     */
    public boolean isCancelled() {
        return failureKind == ToolFailureKind.CANCELLED;
    }

    public boolean isTimedOut() {
        return failureKind == ToolFailureKind.TIMED_OUT;
    }
}
