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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

import static me.golemcore.gateway.tools.file.TextFileSupport.DESCRIPTION;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_PATH;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_OBJECT;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_STRING;

/**
 * Lists the entries of a directory, directories and files alike, sorted by
 * name. At most {@value #MAX_ENTRIES} entries are returned.
 */
@Component
@Slf4j
public class ListDirectoryTool implements ToolComponent {

    static final int MAX_ENTRIES = 1000;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("list_directory")
                .description("List files and subdirectories of a directory.")
                .inputSchema(Map.of(
                        TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Directory to list")),
                        "required", List.of(PARAM_PATH)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            if (context.interruption().isPresent()) {
                return context.interruptedResult();
            }
            String pathStr = TextFileSupport.stringParam(parameters, PARAM_PATH);
            Path dir = Paths.get(pathStr);
            if (!Files.exists(dir)) {
                return ToolResult.notFound("Directory not found: " + dir);
            }
            if (!Files.isDirectory(dir)) {
                return ToolResult.validationFailed("Not a directory: " + dir);
            }

            List<Path> children;
            try (Stream<Path> stream = Files.list(dir)) {
                children = stream.sorted().limit(MAX_ENTRIES).toList();
            } catch (IOException e) {
                log.warn("[ListDirectory] Failed to list {}: {}", dir, e.getMessage());
                return ToolResult.failure("Failed to list directory: " + e.getMessage());
            }

            List<Map<String, Object>> entries = new ArrayList<>();
            StringBuilder sb = new StringBuilder();
            for (Path child : children) {
                String name = child.getFileName().toString();
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", name);
                try {
                    BasicFileAttributes attrs = Files.readAttributes(child, BasicFileAttributes.class);
                    entry.put(TYPE, attrs.isDirectory() ? "directory" : "file");
                    entry.put("size", attrs.size());
                } catch (IOException e) {
                    entry.put(TYPE, "unknown");
                }
                entries.add(entry);
                String prefix = "directory".equals(entry.get(TYPE)) ? "[DIR]" : "[FILE]";
                sb.append(prefix).append(' ').append(name).append('\n');
            }

            return ToolResult.success(sb.toString().stripTrailing(), Map.of(
                    PARAM_PATH, dir.toString(),
                    "entries", entries));
        });
    }
}
