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

package me.golemcore.gateway.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.dto.ToolExecutionRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.ToolExecutionResponse;
import me.golemcore.gateway.domain.model.CancellationToken;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.domain.service.ToolDispatchService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Tool listing and execution. A client that disconnects before the result is
 * ready cancels the call.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolsController {

    private final ToolDispatchService toolDispatchService;

    @GetMapping
    public Mono<ResponseEntity<List<ToolDefinition>>> getTools() {
        return Mono.just(ResponseEntity.ok(toolDispatchService.getAvailableTools()));
    }

    @PostMapping("/{name}/execute")
    public Mono<ResponseEntity<ToolExecutionResponse>> execute(@PathVariable String name,
            @RequestBody(required = false) ToolExecutionRequest request) {
        Map<String, Object> arguments = request != null && request.getArguments() != null
                ? request.getArguments()
                : Map.of();
        Duration timeout = request != null && request.getTimeoutSeconds() != null
                ? Duration.ofSeconds(request.getTimeoutSeconds())
                : null;
        CancellationToken token = CancellationToken.create();

        return Mono.fromFuture(() -> toolDispatchService.execute(name, arguments, timeout, token))
                .map(result -> ResponseEntity.ok(toResponse(name, result)))
                .doOnCancel(token::cancel);
    }

    private static ToolExecutionResponse toResponse(String name, ToolResult result) {
        return ToolExecutionResponse.builder()
                .tool(name)
                .success(result.isSuccess())
                .output(result.getOutput())
                .error(result.getError())
                .failureKind(result.getFailureKind() != null ? result.getFailureKind().name() : null)
                .data(result.getData())
                .durationMs(result.getDuration() != null ? result.getDuration().toMillis() : 0)
                .build();
    }
}
