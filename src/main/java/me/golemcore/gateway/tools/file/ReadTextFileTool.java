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
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static me.golemcore.gateway.tools.file.TextFileSupport.DESCRIPTION;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_ENCODING;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_PATH;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_OBJECT;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_STRING;

/**
 * Reads a text file in a caller-chosen encoding (max 10 MB).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReadTextFileTool implements ToolComponent {

    private final FileAccessPolicy fileAccessPolicy;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("read_text_file")
                .description("Read a text file with the given encoding (default UTF-8, max 10MB).")
                .inputSchema(Map.of(
                        TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Path of the file to read"),
                                PARAM_ENCODING, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Encoding such as UTF-8, UTF-16, SHIFT-JIS (default UTF-8)")),
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
            Charset charset = TextFileSupport.charset(parameters);
            try {
                Path path = Paths.get(pathStr);
                Optional<ToolResult> invalid = TextFileSupport.checkReadableFile(path);
                if (invalid.isPresent()) {
                    return invalid.get();
                }
                String content = Files.readString(path, charset);
                return ToolResult.success(content, Map.of(
                        PARAM_PATH, path.toString(),
                        PARAM_ENCODING, charset.name()));
            } catch (IOException e) {
                log.warn("[ReadTextFile] Failed to read {} as {}: {}", pathStr, charset, e.getMessage());
                return ToolResult.failure("Failed to read file: " + e.getMessage());
            }
        });
    }
}
