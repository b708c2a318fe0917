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
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static me.golemcore.gateway.tools.file.TextFileSupport.DESCRIPTION;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_CREATE_BACKUP;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_ENCODING;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_PATH;
import static me.golemcore.gateway.tools.file.TextFileSupport.PARAM_USE_REGEX;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_BOOLEAN;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_OBJECT;
import static me.golemcore.gateway.tools.file.TextFileSupport.TYPE_STRING;

/**
 * Replaces every occurrence of a text (or regular expression) in a file and
 * reports how many were replaced. The original can be kept in a
 * {@code .backup} sidecar.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReplaceInFileTool implements ToolComponent {

    private static final String PARAM_OLD_TEXT = "old_text";
    private static final String PARAM_NEW_TEXT = "new_text";

    private final FileAccessPolicy fileAccessPolicy;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("replace_in_file")
                .description("""
                        Replace all occurrences of old_text with new_text in a file.
                        With use_regex, old_text is a regular expression and new_text may use $1 group references.
                        Set create_backup to keep the original in <file>.backup.
                        """)
                .inputSchema(Map.of(
                        TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Path of the file to edit"),
                                PARAM_OLD_TEXT, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Text or regular expression to replace"),
                                PARAM_NEW_TEXT, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Replacement text"),
                                PARAM_ENCODING, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Encoding (default UTF-8)"),
                                PARAM_USE_REGEX, Map.of(
                                        TYPE, TYPE_BOOLEAN,
                                        DESCRIPTION, "Treat old_text as a regular expression (default false)"),
                                PARAM_CREATE_BACKUP, Map.of(
                                        TYPE, TYPE_BOOLEAN,
                                        DESCRIPTION, "Back up the file before editing (default false)")),
                        "required", List.of(PARAM_PATH, PARAM_OLD_TEXT, PARAM_NEW_TEXT)))
                .build();
    }

    @Override
    public SecurityDecision checkAccess(Map<String, Object> parameters) {
        String path = TextFileSupport.stringParam(parameters, PARAM_PATH);
        SecurityDecision write = fileAccessPolicy.evaluateWrite(path);
        return write.denied() ? write : fileAccessPolicy.evaluateRead(path);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            if (context.interruption().isPresent()) {
                return context.interruptedResult();
            }
            String pathStr = TextFileSupport.stringParam(parameters, PARAM_PATH);
            String oldText = TextFileSupport.stringParam(parameters, PARAM_OLD_TEXT);
            String newText = TextFileSupport.stringParam(parameters, PARAM_NEW_TEXT);
            if (oldText.isEmpty()) {
                return ToolResult.validationFailed("Parameter 'old_text' must not be empty");
            }
            boolean useRegex = TextFileSupport.flag(parameters, PARAM_USE_REGEX);
            Charset charset = TextFileSupport.charset(parameters);

            try {
                Path path = Paths.get(pathStr);
                Optional<ToolResult> invalid = TextFileSupport.checkReadableFile(path);
                if (invalid.isPresent()) {
                    return invalid.get();
                }
                String content = Files.readString(path, charset);

                Replacement replacement;
                try {
                    replacement = useRegex
                            ? replaceRegex(content, oldText, newText)
                            : replaceLiteral(content, oldText, newText);
                } catch (PatternSyntaxException e) {
                    return ToolResult.validationFailed("Invalid regular expression: " + e.getDescription());
                } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                    return ToolResult.validationFailed("Invalid replacement text: " + e.getMessage());
                }

                SecurityDecision size = fileAccessPolicy.evaluateContentSize(
                        FileAccessPolicy.encodedLength(replacement.content(), charset));
                if (size.denied()) {
                    return ToolResult.denied(size.reason());
                }
                if (context.interruption().isPresent()) {
                    return context.interruptedResult();
                }

                Optional<Path> backup = Optional.empty();
                if (replacement.count() > 0) {
                    if (TextFileSupport.flag(parameters, PARAM_CREATE_BACKUP)) {
                        backup = TextFileSupport.backup(path);
                    }
                    Files.writeString(path, replacement.content(), charset);
                }
                log.info("[ReplaceInFile] Replaced {} occurrence(s) in {}", replacement.count(), path);

                Map<String, Object> data = new LinkedHashMap<>();
                data.put(PARAM_PATH, path.toString());
                data.put("replacements", replacement.count());
                backup.ifPresent(b -> data.put("backup", b.toString()));
                return ToolResult.success("Replaced " + replacement.count() + " occurrence(s)", data);
            } catch (IOException e) {
                log.warn("[ReplaceInFile] Failed to edit {}: {}", pathStr, e.getMessage());
                return ToolResult.failure("Failed to replace in file: " + e.getMessage());
            }
        });
    }

    static Replacement replaceLiteral(String content, String oldText, String newText) {
        int count = 0;
        int index = content.indexOf(oldText);
        while (index >= 0) {
            count++;
            index = content.indexOf(oldText, index + oldText.length());
        }
        return new Replacement(content.replace(oldText, newText), count);
    }

    static Replacement replaceRegex(String content, String regex, String replacement) {
        Matcher matcher = Pattern.compile(regex).matcher(content);
        StringBuilder sb = new StringBuilder();
        int count = 0;
        while (matcher.find()) {
            count++;
            matcher.appendReplacement(sb, replacement);
        }
        matcher.appendTail(sb);
        return new Replacement(sb.toString(), count);
    }

    record Replacement(String content, int count) {
    }
}
