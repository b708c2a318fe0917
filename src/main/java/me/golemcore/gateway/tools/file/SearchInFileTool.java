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
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static me.golemcore.gateway.tools.file.TextFileSupport.DESCRIPTION;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_ENCODING;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_PATH;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_USE_REGEX;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_BOOLEAN;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_OBJECT;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_STRING;

/**
 * Finds the lines of a text file that contain a pattern. Plain patterns match
 * case-insensitively; with {@code use_regex} the pattern is a Java regular
 * expression searched within each line.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SearchInFileTool implements ToolComponent {

    private static final String PARAM_PATTERN = "pattern";
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private final FileAccessPolicy fileAccessPolicy;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("search_in_file")
                .description("Search a text file and return matching lines as 'Line N: text'.")
                .inputSchema(Map.of(
                        TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Path of the file to search"),
                                PARAM_PATTERN, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Text or regular expression to look for"),
                                PARAM_ENCODING, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Encoding (default UTF-8)"),
                                PARAM_USE_REGEX, Map.of(
                                        TYPE, TYPE_BOOLEAN,
                                        DESCRIPTION, "Treat pattern as a regular expression (default false)")),
                        "required", List.of(PARAM_PATH, PARAM_PATTERN)))
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
            String pattern = TextFileSupport.stringParam(parameters, PARAM_PATTERN);
            if (pattern == null || pattern.isBlank()) {
                return ToolResult.validationFailed("Parameter 'pattern' must not be empty");
            }

            Predicate<String> matcher;
            try {
                matcher = lineMatcher(pattern, TextFileSupport.flag(parameters, PARAM_USE_REGEX));
            } catch (PatternSyntaxException e) {
                return ToolResult.validationFailed("Invalid regular expression: " + e.getDescription());
            }

            try {
                Path path = Paths.get(pathStr);
                Optional<ToolResult> invalid = TextFileSupport.checkReadableFile(path);
                if (invalid.isPresent()) {
                    return invalid.get();
                }
                String content = Files.readString(path, TextFileSupport.charset(parameters));
                String[] lines = LINE_BREAK.split(content, -1);
                List<String> matches = new ArrayList<>();
                for (int i = 0; i < lines.length; i++) {
                    if (context.interruption().isPresent()) {
                        return context.interruptedResult();
                    }
                    if (matcher.test(lines[i])) {
                        matches.add("Line " + (i + 1) + ": " + lines[i]);
                    }
                }
                if (matches.isEmpty()) {
                    return ToolResult.success("No matching lines found", Map.of("matches", 0));
                }
                return ToolResult.success(String.join("\n", matches), Map.of("matches", matches.size()));
            } catch (IOException e) {
                log.warn("[SearchInFile] Failed to read {}: {}", pathStr, e.getMessage());
                return ToolResult.failure("Failed to search file: " + e.getMessage());
            }
        });
    }

    private static Predicate<String> lineMatcher(String pattern, boolean useRegex) {
        if (useRegex) {
            Pattern compiled = Pattern.compile(pattern);
            return line -> compiled.matcher(line).find();
        }
        String needle = pattern.toLowerCase(Locale.ROOT);
        return line -> line.toLowerCase(Locale.ROOT).contains(needle);
    }
}
