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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static me.golemcore.gateway.tools.file.TextFileSupport.DESCRIPTION;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_CONTENT;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_CREATE_BACKUP;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_ENCODING;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_PATH;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_BOOLEAN;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_OBJECT;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_STRING;

/**
 * Writes text in a caller-chosen encoding, optionally keeping the previous
 * content in a {@code .backup} sidecar.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WriteTextFileTool implements ToolComponent {

    private final FileAccessPolicy fileAccessPolicy;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("write_text_file")
                .description("""
                        Write text to a file with the given encoding (default UTF-8, max 10MB).
                        Set create_backup to keep the previous content in <file>.backup.
                        System paths are refused.
                        """)
                .inputSchema(Map.of(
                        TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Path of the file to write"),
                                PARAM_CONTENT, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Text to write"),
                                PARAM_ENCODING, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Encoding (default UTF-8)"),
                                PARAM_CREATE_BACKUP, Map.of(
                                        TYPE, TYPE_BOOLEAN,
                                        DESCRIPTION, "Back up the existing file first (default false)")),
                        "required", List.of(PARAM_PATH, PARAM_CONTENT)))
                .build();
    }

    @Override
    public SecurityDecision checkAccess(Map<String, Object> parameters) {
        return fileAccessPolicy.evaluateWriteWithContent(
                TextFileSupport.stringParam(parameters, PARAM_PATH),
                TextFileSupport.stringParam(parameters, PARAM_CONTENT),
                TextFileSupport.charset(parameters));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            if (context.interruption().isPresent()) {
                return context.interruptedResult();
            }
            String pathStr = TextFileSupport.stringParam(parameters, PARAM_PATH);
            String content = TextFileSupport.stringParam(parameters, PARAM_CONTENT);
            Charset charset = TextFileSupport.charset(parameters);
            try {
                Path path = Paths.get(pathStr);
                TextFileSupport.createParentDirectories(path);
                Optional<Path> backup = TextFileSupport.flag(parameters, PARAM_CREATE_BACKUP)
                        ? TextFileSupport.backup(path)
                        : Optional.empty();
                Files.writeString(path, content, charset);
                log.info("[WriteTextFile] Wrote {} chars to {} ({})", content.length(), path, charset);

                Map<String, Object> data = new LinkedHashMap<>();
                data.put(PARAM_PATH, path.toString());
                data.put(PARAM_ENCODING, charset.name());
                backup.ifPresent(b -> data.put("backup", b.toString()));
                return ToolResult.success("File written successfully: " + path, data);
            } catch (IOException e) {
                log.warn("[WriteTextFile] Failed to write {}: {}", pathStr, e.getMessage());
                return ToolResult.failure("Failed to write file: " + e.getMessage());
            }
        });
    }
}
