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

package me.golemcore.gateway.tools.file;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.SecurityDecision;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.security.FileAccessPolicy;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static me.golemcore.gateway.tools.file.TextFileSupport.DESCRIPTION;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_PATH;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_OBJECT;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_STRING;

/**
 * Reads a whole file as UTF-8 text. Files over 10 MB are refused.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReadFileTool implements ToolComponent {

    private final FileAccessPolicy fileAccessPolicy;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("read_file")
                .description("Read the content of a file as UTF-8 text (max 10MB).")
                .inputSchema(Map.of(
                        TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Path of the file to read")),
                        "required", List.of(PARAM_PATH)))
                .build();
    }

    @Override
    public SecurityDecision checkAccess(Map<String, Object> parameters) {
        return fileAccessPolicy.evaluateRead(TextFileSupport.stringParam(parameters, PARAM_PATH));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            if (context.interruption().isPresent()) {
                return context.interruptedResult();
            }
            String pathStr = TextFileSupport.stringParam(parameters, PARAM_PATH);
            try {
                Path path = Paths.get(pathStr);
                Optional<ToolResult> invalid = TextFileSupport.checkReadableFile(path);
                if (invalid.isPresent()) {
                    return invalid.get();
                }
                String content = Files.readString(path, StandardCharsets.UTF_8);
                log.debug("[ReadFile] Read {} ({} chars)", path, content.length());
                return ToolResult.success(content, Map.of(
                        PARAM_PATH, path.toString(),
                        "size", Files.size(path)));
            } catch (IOException e) {
                log.warn("[ReadFile] Failed to read {}: {}", pathStr, e.getMessage());
                return ToolResult.failure("Failed to read file: " + e.getMessage());
            }
        });
    }
}
