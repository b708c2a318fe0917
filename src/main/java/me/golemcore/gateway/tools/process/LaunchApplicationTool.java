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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.SecurityDecision;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.process.LaunchResult;
import me.golemcore.gateway.process.ProcessLifecycleManager;
import me.golemcore.gateway.security.ProcessSecurityPolicy;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Starts an application. The executable and argument string are checked by
 * {@link ProcessSecurityPolicy} before anything runs; the process is started
 * directly, never through a shell.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LaunchApplicationTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final String PARAM_ARGUMENTS = "arguments";
    private static final String PARAM_WORKING_DIRECTORY = "working_directory";
    private static final String TYPE = "type";
    private static final String TYPE_STRING = "string";
    private static final String DESCRIPTION = "description";

    private final ProcessSecurityPolicy securityPolicy;
    private final ProcessLifecycleManager processManager;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("launch_application")
                .description("""
                        Launch an application by path or by name found on PATH.
                        Dangerous executables and destructive command lines are refused.
                        Returns the process ID of the started application.
                        """)
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Executable path or name"),
                                PARAM_ARGUMENTS, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Command line arguments; use double quotes to group"),
                                PARAM_WORKING_DIRECTORY, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Working directory (optional)")),
                        "required", List.of(PARAM_PATH)))
                .build();
    }

    @Override
    public SecurityDecision checkAccess(Map<String, Object> parameters) {
        String path = stringParam(parameters, PARAM_PATH);
        if (path == null || path.isBlank()) {
            return SecurityDecision.deny("Parameter 'path' must not be empty");
        }
        String arguments = stringParam(parameters, PARAM_ARGUMENTS);
        SecurityDecision decision = securityPolicy.evaluate(path, arguments);
        if (decision.allowed()) {
            // PATH lookup may land on a different file than the name suggests
            decision = processManager.resolvePath(path)
                    .map(resolved -> securityPolicy.evaluate(resolved.toString(), arguments))
                    .orElse(decision);
        }
        if (decision.denied()) {
            log.warn("[Launch] BLOCKED {} {}: {}", path, stringParam(parameters, PARAM_ARGUMENTS),
                    decision.reason());
        }
        return decision;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        String path = stringParam(parameters, PARAM_PATH);
        return processManager.launch(path,
                stringParam(parameters, PARAM_ARGUMENTS),
                stringParam(parameters, PARAM_WORKING_DIRECTORY),
                context)
                .thenApply(LaunchApplicationTool::toToolResult);
    }

    private static ToolResult toToolResult(LaunchResult result) {
        if (!result.started()) {
            return ToolResult.failure(result.failureKind(), result.message());
        }
        return ToolResult.success(
                "Application launched (PID: " + result.pid() + ", Path: " + result.executable() + ")",
                Map.of("pid", result.pid(), PARAM_PATH, result.executable().toString()));
    }

    private static String stringParam(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        return value instanceof String s ? s : null;
    }
}
