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

package me.golemcore.gateway.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.CancellationToken;
import me.golemcore.gateway.domain.model.SecurityDecision;
import me.golemcore.gateway.domain.model.ToolCallRequest;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolFailureKind;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.plugin.context.ExtensionRegistryService;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Tool registry and dispatcher: resolves a tool call to a handler, validates
 * its arguments, runs the handler's access check and executes it under a
 * timeout and a cooperative cancellation token.
 *
 * <p>
 * Every outcome is a {@link ToolResult}; nothing is thrown to the caller.
 * Unknown tools, invalid arguments and policy denials are reported before the
 * handler runs, so they have no side effects. Timeout and cancellation are
 * reported as distinct failure kinds.
 *
 * <p>
 * Built-in tools are the {@link ToolComponent} beans; tools of enabled
 * extensions are resolved through {@link ExtensionRegistryService} under
 * their namespaced names.
 */
@Service
@Slf4j
public class ToolDispatchService {

    private final Map<String, ToolComponent> builtinTools;
    private final ExtensionRegistryService extensionRegistry;
    private final ToolArgumentValidator argumentValidator;
    private final GatewayProperties.ToolsProperties config;
    private final Clock clock;

    public ToolDispatchService(List<ToolComponent> tools, ExtensionRegistryService extensionRegistry,
            ToolArgumentValidator argumentValidator, GatewayProperties properties) {
        this(tools, extensionRegistry, argumentValidator, properties, Clock.systemUTC());
    }

    ToolDispatchService(List<ToolComponent> tools, ExtensionRegistryService extensionRegistry,
            ToolArgumentValidator argumentValidator, GatewayProperties properties, Clock clock) {
        this.builtinTools = indexBuiltinTools(tools);
        this.extensionRegistry = extensionRegistry;
        this.argumentValidator = argumentValidator;
        this.config = properties.getTools();
        this.clock = clock;
        log.info("[Dispatcher] Registered built-in tools: {}", builtinTools.keySet());
    }

    public CompletableFuture<ToolResult> execute(ToolCallRequest request, CancellationToken cancellationToken) {
        return execute(request.getToolName(), request.getArguments(), request.getTimeout(), cancellationToken);
    }

    /**
     * Dispatches one tool call.
     *
     * @param toolName
     *            requested tool name, sanitized before lookup
     * @param arguments
     *            call arguments, may be {@code null}
     * @param timeout
     *            call timeout; {@code null} or non-positive uses the configured
     *            default, larger values are capped at the configured maximum
     * @param cancellationToken
     *            caller's token, may be {@code null}
     * @return a future that always completes normally with the result
     */
    public CompletableFuture<ToolResult> execute(String toolName, Map<String, Object> arguments, Duration timeout,
            CancellationToken cancellationToken) {
        long startNanos = System.nanoTime();
        CancellationToken token = cancellationToken != null ? cancellationToken : CancellationToken.none();
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        String name = sanitizeToolName(toolName);

        if (token.isCancellationRequested()) {
            return completed(ToolResult.cancelled(name), startNanos);
        }

        Optional<ToolComponent> resolved = findTool(name);
        if (resolved.isEmpty()) {
            log.debug("[Dispatcher] Unknown tool: {}", toolName);
            return completed(ToolResult.notFound("Tool not found: " + toolName), startNanos);
        }
        ToolComponent tool = resolved.get();

        if (!tool.isEnabled()) {
            return completed(ToolResult.denied("Tool is disabled: " + name), startNanos);
        }

        Optional<String> violation = argumentValidator.validate(tool.getDefinition(), args);
        if (violation.isPresent()) {
            log.debug("[Dispatcher] Invalid arguments for {}: {}", name, violation.get());
            return completed(ToolResult.validationFailed(violation.get()), startNanos);
        }

        SecurityDecision decision;
        try {
            decision = tool.checkAccess(args);
        } catch (RuntimeException e) {
            log.error("[Dispatcher] Access check of {} failed", name, e);
            return completed(ToolResult.failure("Access check failed: " + safeCauseMessage(e)), startNanos);
        }
        if (decision.denied()) {
            log.warn("[Dispatcher] {} denied: {}", name, decision.reason());
            return completed(ToolResult.denied(decision.reason()), startNanos);
        }

        if (name.startsWith(ExtensionRegistryService.TOOL_PREFIX)) {
            extensionRegistry.markUsed(name);
        }

        Duration effectiveTimeout = effectiveTimeout(timeout);
        ToolExecutionContext context = new ToolExecutionContext(name, token, effectiveTimeout, clock);
        CompletableFuture<ToolResult> result = new CompletableFuture<>();

        CompletableFuture<ToolResult> execution;
        try {
            execution = tool.execute(args, context);
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        if (execution == null) {
            execution = CompletableFuture.completedFuture(ToolResult.failure("Tool returned no result"));
        }

        execution.whenComplete((toolResult, error) -> {
            if (error != null) {
                log.error("[Dispatcher] Tool execution failed: {}", name, error);
                result.complete(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Tool execution failed: " + safeCauseMessage(error)));
            } else if (toolResult == null) {
                result.complete(ToolResult.failure("Tool returned no result"));
            } else {
                result.complete(toolResult);
            }
        });
        CancellationToken.Registration cancelRegistration = token.onCancel(() -> {
            if (result.complete(ToolResult.cancelled(name))) {
                log.info("[Dispatcher] {} cancelled by caller", name);
            }
        });
        result.whenComplete((toolResult, error) -> cancelRegistration.unregister());
        result.completeOnTimeout(ToolResult.timedOut(name, effectiveTimeout),
                effectiveTimeout.toMillis(), TimeUnit.MILLISECONDS);

        return result.thenApply(toolResult -> {
            Duration elapsed = elapsed(startNanos);
            log.debug("[Dispatcher] {} finished in {} ms: success={}, kind={}", name, elapsed.toMillis(),
                    toolResult.isSuccess(), toolResult.getFailureKind());
            return toolResult.withDuration(elapsed);
        });
    }

    /**
     * Definitions of the enabled built-in tools followed by the tools of enabled
     * extensions, the latter under their namespaced names.
     */
    public List<ToolDefinition> getAvailableTools() {
        List<ToolDefinition> definitions = new ArrayList<>();
        builtinTools.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .forEach(definitions::add);
        extensionRegistry.getEnabledTools().forEach((name, tool) -> {
            ToolDefinition definition = tool.getDefinition();
            definitions.add(ToolDefinition.builder()
                    .name(name)
                    .description(definition.getDescription())
                    .inputSchema(definition.getInputSchema())
                    .build());
        });
        return List.copyOf(definitions);
    }

    public Optional<ToolComponent> findTool(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        ToolComponent builtin = builtinTools.get(name);
        if (builtin != null) {
            return Optional.of(builtin);
        }
        return extensionRegistry.findTool(name);
    }

    Duration effectiveTimeout(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return config.getDefaultTimeout();
        }
        return requested.compareTo(config.getMaxTimeout()) > 0 ? config.getMaxTimeout() : requested;
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.trim().replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Dispatcher] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private static Map<String, ToolComponent> indexBuiltinTools(List<ToolComponent> tools) {
        Map<String, ToolComponent> index = new LinkedHashMap<>();
        for (ToolComponent tool : tools) {
            String name = tool.getToolName();
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Tool without a name: " + tool.getClass().getName());
            }
            if (name.startsWith(ExtensionRegistryService.TOOL_PREFIX)) {
                throw new IllegalStateException("Built-in tool name uses the extension prefix: " + name);
            }
            if (index.putIfAbsent(name, tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + name);
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private CompletableFuture<ToolResult> completed(ToolResult result, long startNanos) {
        return CompletableFuture.completedFuture(result.withDuration(elapsed(startNanos)));
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
