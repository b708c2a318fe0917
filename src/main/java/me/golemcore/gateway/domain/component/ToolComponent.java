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

package me.golemcore.gateway.domain.component;

import me.golemcore.gateway.domain.model.SecurityDecision;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing an executable tool that can be invoked by the
 * planning loop. Tools expose their JSON Schema definition and implement the
 * execution logic. Built-in tools are Spring components; extension tools are
 * contributed by {@link me.golemcore.gateway.plugin.api.GatewayExtension}s.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling. Required
     * parameters declared here are validated by the dispatcher before the tool
     * sees the call.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Access check run by the dispatcher after argument validation and before
     * execution. Tools touching processes or file system paths override this to
     * consult the security policies. A denial is returned to the caller verbatim.
     *
     * @param parameters
     *            the validated execution parameters
     * @return the policy verdict
     */
    default SecurityDecision checkAccess(Map<String, Object> parameters) {
        return SecurityDecision.allow();
    }

    /**
     * Executes the tool with the specified parameters. Implementations must not
     * block the calling thread and should consult
     * {@link ToolExecutionContext#interruption()} at their wait points.
     *
     * @param parameters
     *            the execution parameters as a map
     * @param context
     *            cancellation token and deadline of the call
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
