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

package me.golemcore.gateway.tools.process;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolFailureKind;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.process.ProcessLifecycleManager;
import me.golemcore.gateway.process.TerminationResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Closes an application by process ID, gracefully when possible and forcibly
 * otherwise. Protected system processes are never touched.
 */
@Component
@RequiredArgsConstructor
public class CloseApplicationTool implements ToolComponent {

    private static final String PARAM_PROCESS_ID = "process_id";

    private final ProcessLifecycleManager processManager;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("close_application")
                .description("Close an application by process ID. Tries a graceful close first, then kills it.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PROCESS_ID, Map.of(
                                        "type", "integer",
                                        "description", "Process ID to close")),
                        "required", List.of(PARAM_PROCESS_ID)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        long pid = ((Number) parameters.get(PARAM_PROCESS_ID)).longValue();
        return processManager.terminate(pid, context)
                .thenApply(CloseApplicationTool::toToolResult);
    }

    static ToolResult toToolResult(TerminationResult result) {
        return switch (result.status()) {
        case CLOSED_GRACEFULLY, KILLED -> ToolResult.success(result.message(), Map.of(
                "pid", result.pid(),
                "name", result.processName(),
                "forced", result.status() == TerminationResult.Status.KILLED));
        case INVALID_PID -> ToolResult.validationFailed(result.message());
        case NOT_FOUND -> ToolResult.notFound(result.message());
        case PROTECTED -> ToolResult.failure(ToolFailureKind.PROTECTED, result.message());
        case CANCELLED -> ToolResult.failure(ToolFailureKind.CANCELLED, result.message());
        case TIMED_OUT -> ToolResult.failure(ToolFailureKind.TIMED_OUT, result.message());
        case STILL_RUNNING -> ToolResult.failure(result.message());
        };
    }
}
