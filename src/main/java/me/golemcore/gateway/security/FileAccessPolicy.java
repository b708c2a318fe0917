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

package me.golemcore.gateway.security;

import me.golemcore.gateway.domain.model.SecurityDecision;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Access policy for the file tools: a 10 MB ceiling on reads and written
 * content, and a deny-list of system locations for every write.
 *
 * <p>
 * A path is matched in its raw form (separators normalized) and in its
 * absolute normalized form, so a Windows system path is refused on any host.
 * Matching is case-insensitive and stops at path segment boundaries.
 */
@Component
public class FileAccessPolicy {

    public static final long MAX_FILE_SIZE = 10L * 1024 * 1024; // 10 MB

    private static final List<String> BLOCKED_PATHS = List.of(
            "C:\\Windows",
            "C:\\Program Files",
            "C:\\Program Files (x86)",
            "C:\\ProgramData",
            "C:\\Users\\All Users",
            "C:\\Users\\Default",
            "C:\\Users\\Public",
            "C:\\$Recycle.Bin",
            "C:\\System Volume Information",
            "C:\\Boot",
            "C:\\Config.Msi",
            "C:\\Recovery",
            "C:\\inetpub",
            "/etc",
            "/bin",
            "/sbin",
            "/usr/bin",
            "/usr/sbin",
            "/var/log",
            "/var/spool",
            "/proc",
            "/sys",
            "/dev",
            "/boot",
            "/root");

    /**
     * Denies writes into system locations.
     */
    public SecurityDecision evaluateWrite(String path) {
        if (path == null || path.isBlank()) {
            return SecurityDecision.deny("Path must not be empty");
        }
        for (String candidate : candidates(path)) {
            for (String blocked : BLOCKED_PATHS) {
                if (isUnder(candidate, normalize(blocked))) {
                    return SecurityDecision.deny("Access denied: '" + path + "' is inside the system path "
                            + blocked + " which is not allowed for writing");
                }
            }
        }
        return SecurityDecision.allow();
    }

    /**
     * Denies reads of existing files larger than {@link #MAX_FILE_SIZE}. Missing
     * files are left to the tool to report.
     */
    public SecurityDecision evaluateRead(String path) {
        if (path == null || path.isBlank()) {
            return SecurityDecision.deny("Path must not be empty");
        }
        try {
            Path file = Paths.get(path);
            if (Files.isRegularFile(file) && Files.size(file) > MAX_FILE_SIZE) {
                return SecurityDecision.deny("File exceeds the size limit (max " + maxSizeMb() + " MB)");
            }
        } catch (InvalidPathException e) {
            return SecurityDecision.deny("Invalid path: " + path);
        } catch (IOException e) {
            // Unreadable metadata is reported by the tool itself
            return SecurityDecision.allow();
        }
        return SecurityDecision.allow();
    }

    /**
     * Denies writes whose resulting size would exceed {@link #MAX_FILE_SIZE}.
     */
    public SecurityDecision evaluateContentSize(long length) {
        if (length > MAX_FILE_SIZE) {
            return SecurityDecision.deny("Content exceeds the size limit (max " + maxSizeMb() + " MB)");
        }
        return SecurityDecision.allow();
    }

    public SecurityDecision evaluateWriteWithContent(String path, String content) {
        return evaluateWriteWithContent(path, content, StandardCharsets.UTF_8);
    }

    /**
     * Write check for replacing a file: the path must be writable and the
     * content, encoded with {@code charset}, must fit {@link #MAX_FILE_SIZE}.
     */
    public SecurityDecision evaluateWriteWithContent(String path, String content, Charset charset) {
        SecurityDecision pathDecision = evaluateWrite(path);
        if (pathDecision.denied()) {
            return pathDecision;
        }
        return evaluateContentSize(encodedLength(content, charset));
    }

    public SecurityDecision evaluateAppend(String path, String content) {
        return evaluateAppend(path, content, StandardCharsets.UTF_8);
    }

    /**
     * Write check for appends: the existing file plus the new content, encoded
     * with {@code charset}, must stay within {@link #MAX_FILE_SIZE}.
     */
    public SecurityDecision evaluateAppend(String path, String content, Charset charset) {
        SecurityDecision decision = evaluateWriteWithContent(path, content, charset);
        if (decision.denied()) {
            return decision;
        }
        long existing = 0;
        try {
            Path file = Paths.get(path);
            if (Files.isRegularFile(file)) {
                existing = Files.size(file);
            }
        } catch (IOException | InvalidPathException e) {
            // The append itself reports unreadable files
            return SecurityDecision.allow();
        }
        if (existing + encodedLength(content, charset) > MAX_FILE_SIZE) {
            return SecurityDecision.deny("File would exceed the size limit (max " + maxSizeMb() + " MB)");
        }
        return SecurityDecision.allow();
    }

    /**
     * Size in bytes of {@code content} as it lands on disk.
     */
    public static long encodedLength(String content, Charset charset) {
        if (content == null || content.isEmpty()) {
            return 0;
        }
        return content.getBytes(charset != null ? charset : StandardCharsets.UTF_8).length;
    }

    private static List<String> candidates(String path) {
        List<String> candidates = new ArrayList<>();
        candidates.add(normalize(path));
        try {
            candidates.add(normalize(Paths.get(path).toAbsolutePath().normalize().toString()));
        } catch (InvalidPathException e) {
            // The raw form is still checked
        }
        return candidates;
    }

    private static boolean isUnder(String candidate, String blocked) {
        if (!candidate.startsWith(blocked)) {
            return false;
        }
        return candidate.length() == blocked.length() || candidate.charAt(blocked.length()) == '/';
    }

    private static String normalize(String path) {
        String normalized = path.trim().replace('\\', '/').toLowerCase(Locale.ROOT);
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static long maxSizeMb() {
        return MAX_FILE_SIZE / 1024 / 1024;
    }
}
