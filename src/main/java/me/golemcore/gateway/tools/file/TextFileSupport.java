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

import me.golemcore.gateway.domain.model.ToolResult;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers shared by the file tools: parameter access, encoding names, backup
 * sidecars and the common error texts.
 */
final class TextFileSupport {

    static final String PARAM_PATH = "path";
    static final String PARAM_CONTENT = "content";
    static final String PARAM_ENCODING = "encoding";
    static final String PARAM_CREATE_BACKUP = "create_backup";
    static final String PARAM_USE_REGEX = "use_regex";

    static final String TYPE = "type";
    static final String TYPE_STRING = "string";
    static final String TYPE_BOOLEAN = "boolean";
    static final String TYPE_OBJECT = "object";
    static final String DESCRIPTION = "description";

    static final String BACKUP_SUFFIX = ".backup";

    private static final Map<String, Charset> ENCODINGS = Map.ofEntries(
            Map.entry("UTF-8", StandardCharsets.UTF_8),
            Map.entry("UTF8", StandardCharsets.UTF_8),
            Map.entry("UTF-16", StandardCharsets.UTF_16LE),
            Map.entry("UTF16", StandardCharsets.UTF_16LE),
            Map.entry("UTF-16LE", StandardCharsets.UTF_16LE),
            Map.entry("UTF-16BE", StandardCharsets.UTF_16BE),
            Map.entry("ASCII", StandardCharsets.US_ASCII),
            Map.entry("US-ASCII", StandardCharsets.US_ASCII),
            Map.entry("LATIN1", StandardCharsets.ISO_8859_1),
            Map.entry("ISO-8859-1", StandardCharsets.ISO_8859_1));

    private static final Map<String, String> OPTIONAL_ENCODINGS = Map.of(
            "UTF-32", "UTF-32",
            "UTF32", "UTF-32",
            "SHIFT-JIS", "Shift_JIS",
            "SHIFT_JIS", "Shift_JIS",
            "SJIS", "Shift_JIS",
            "EUC-JP", "EUC-JP",
            "ISO-2022-JP", "ISO-2022-JP");

    private TextFileSupport() {
    }

    /**
     * Charset named by the {@code encoding} parameter. Unknown or missing names
     * fall back to UTF-8.
     */
    static Charset charset(Map<String, Object> parameters) {
        Object value = parameters.get(PARAM_ENCODING);
        if (!(value instanceof String name) || name.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        String key = name.trim().toUpperCase(Locale.ROOT);
        Charset known = ENCODINGS.get(key);
        if (known != null) {
            return known;
        }
        String optional = OPTIONAL_ENCODINGS.get(key);
        if (optional != null && Charset.isSupported(optional)) {
            return Charset.forName(optional);
        }
        return StandardCharsets.UTF_8;
    }

    static String stringParam(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        return value instanceof String s ? s : null;
    }

    static boolean flag(Map<String, Object> parameters, String name) {
        return Boolean.TRUE.equals(parameters.get(name));
    }

    /**
     * Copies the file byte for byte to its {@code .backup} sidecar, replacing
     * any previous backup.
     */
    static Optional<Path> backup(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        Path backup = file.resolveSibling(file.getFileName() + BACKUP_SUFFIX);
        Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        return Optional.of(backup);
    }

    static void createParentDirectories(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Common checks for tools that read an existing file.
     */
    static Optional<ToolResult> checkReadableFile(Path file) {
        if (!Files.exists(file)) {
            return Optional.of(ToolResult.notFound("File not found: " + file));
        }
        if (!Files.isRegularFile(file)) {
            return Optional.of(ToolResult.validationFailed("Not a file: " + file));
        }
        return Optional.empty();
    }
}
