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

package me.golemcore.gateway.process;

import me.golemcore.gateway.domain.model.ToolFailureKind;

import java.nio.file.Path;

/**
 * Outcome of a launch request. On success the pid and resolved executable are
 * set; on failure the kind and message are.
 */
public record LaunchResult(boolean started, long pid, Path executable, ToolFailureKind failureKind,
        String message) {

    public static LaunchResult started(long pid, Path executable) {
        return new LaunchResult(true, pid, executable, null, null);
    }

    public static LaunchResult failed(ToolFailureKind kind, String message) {
        return new LaunchResult(false, -1, null, kind, message);
    }
}
