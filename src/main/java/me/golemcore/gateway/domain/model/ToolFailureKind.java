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

/**
 * Classification of a failed tool call. Callers may branch on the kind instead
 * of parsing the error text.
 */
public enum ToolFailureKind {

    /**
     * Arguments were missing or did not match the tool's declared schema.
     */
    VALIDATION_FAILED,

    /**
     * Execution was blocked by the process security policy or the file access
     * policy.
     */
    POLICY_DENIED,

    /**
     * The tool, file, executable or process does not exist.
     */
    NOT_FOUND,

    /**
     * The target is a protected system process.
     */
    PROTECTED,

    /**
     * The call exceeded its timeout.
     */
    TIMED_OUT,

    /**
     * The call was stopped by its caller. Not an error of the tool itself.
     */
    CANCELLED,

    /**
     * Tool execution failed during runtime (exceptions, I/O errors, crashed
     * processes, etc.).
     */
    EXECUTION_FAILED,

    /**
     * The credential store could not persist a change.
     */
    PERSISTENCE_FAILED
}
