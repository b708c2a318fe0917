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
import java.util.concurrent.CompletableFuture;

import static me.golemcore.gateway.tools.file.TextFileSupport.DESCRIPTION;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_CONTENT;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_PATH;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_OBJECT;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_STRING;

/**
 * Writes UTF-8 text to a file, creating parent directories and replacing any
 * existing content.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WriteFileTool implements ToolComponent {

    private final FileAccessPolicy fileAccessPolicy;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("write_file")
                .description("Write UTF-8 text to a file, replacing existing content. System paths are refused.")
                .inputSchema(Map.of(
                        TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Path of the file to write"),
                                PARAM_CONTENT, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Text to write")),
                        "required", List.of(PARAM_PATH, PARAM_CONTENT)))
                .build();
    }

    @Override
    public SecurityDecision checkAccess(Map<String, Object> parameters) {
        return fileAccessPolicy.evaluateWriteWithContent(
                TextFileSupport.stringParam(parameters, PARAM_PATH),
                TextFileSupport.stringParam(parameters, PARAM_CONTENT));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            if (context.interruption().isPresent()) {
                return context.interruptedResult();
            }
            String pathStr = TextFileSupport.stringParam(parameters, PARAM_PATH);
            String content = TextFileSupport.stringParam(parameters, PARAM_CONTENT);
            try {
                Path path = Paths.get(pathStr);
                TextFileSupport.createParentDirectories(path);
                Files.writeString(path, content, StandardCharsets.UTF_8);
                log.info("[WriteFile] Wrote {} chars to {}", content.length(), path);
                return ToolResult.success("File written successfully: " + path, Map.of(
                        PARAM_PATH, path.toString(),
                        "size", Files.size(path)));
            } catch (IOException e) {
                log.warn("[WriteFile] Failed to write {}: {}", pathStr, e.getMessage());
                return ToolResult.failure("Failed to write file: " + e.getMessage());
            }
        });
    }
}
