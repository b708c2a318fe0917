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
import me.golemcore.gateway.domain.model.RunningProcess;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.process.ProcessLifecycleManager;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lists running processes as a fixed-width table sorted by name. Only the
 * first {@value #MAX_ROWS} rows are shown.
 */
@Component
@RequiredArgsConstructor
public class GetRunningApplicationsTool implements ToolComponent {

    static final int MAX_ROWS = 100;
    private static final int MAX_TITLE_LENGTH = 37;

    private final ProcessLifecycleManager processManager;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.simple("get_running_applications",
                "List running processes with PID, name, window title and memory usage.");
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return processManager.listRunning().thenApply(processes -> {
            if (context.interruption().isPresent()) {
                return context.interruptedResult();
            }
            return ToolResult.success(format(processes), Map.of("count", processes.size()));
        });
    }

    static String format(List<RunningProcess> processes) {
        StringBuilder sb = new StringBuilder();
        sb.append("Running applications: ").append(processes.size()).append("\n\n");
        sb.append(String.format("%-8s %-25s %-40s %-12s%n", "PID", "Name", "Window title", "Memory (MB)"));
        sb.append("-".repeat(85)).append('\n');
        for (RunningProcess process : processes.stream().limit(MAX_ROWS).toList()) {
            sb.append(String.format("%-8d %-25s %-40s %-12d%n",
                    process.pid(),
                    process.name() != null ? process.name() : "(unknown)",
                    title(process.windowTitle()),
                    process.memoryMb()));
        }
        if (processes.size() > MAX_ROWS) {
            sb.append("\n... and ").append(processes.size() - MAX_ROWS).append(" more processes\n");
        }
        return sb.toString();
    }

    private static String title(String windowTitle) {
        if (windowTitle == null || windowTitle.isEmpty()) {
            return "(background)";
        }
        return windowTitle.length() > MAX_TITLE_LENGTH
                ? windowTitle.substring(0, MAX_TITLE_LENGTH) + "..."
                : windowTitle;
    }
}
