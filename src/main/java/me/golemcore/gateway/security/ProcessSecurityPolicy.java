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

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Security policy deciding whether a process launch request may run.
 *
 * <p>
 * The verdict is a pure function of the executable path and the argument
 * string. Checks run in order and the first match denies:
 * <ol>
 * <li>Executable file name against tools that cause irreversible system change
 * (registry editors, partitioning and format tools, backup deletion, boot
 * configuration, ACL and ownership tools, schedulers)</li>
 * <li>Full command line against destructive command signatures</li>
 * <li>For shells and script hosts, the argument string against dangerous
 * sub-commands</li>
 * </ol>
 *
 * <p>
 * This is a deny-list. Command strings that evade every signature are allowed.
 * The policy keeps no state and does not log; callers report denials.
 *
 * @see FileAccessPolicy
 */
@Component
public class ProcessSecurityPolicy {

    // Bare names; Windows launch extensions are stripped before lookup
    private static final Set<String> BLOCKED_EXECUTABLES = Set.of(
            // Windows
            "regedit", "reg", "format", "diskpart",
            "vssadmin", "wbadmin", "bcdedit", "bootrec",
            "fsutil", "cipher", "takeown", "icacls", "cacls",
            "net", "net1", "sc", "schtasks", "at", "attrib",
            "debug", "edlin", "debug64", "edlin64",
            // POSIX
            "mkfs", "fdisk", "sfdisk", "parted", "wipefs", "setfacl", "crontab",
            "visudo", "grub-install", "efibootmgr");

    private static final List<String> LAUNCH_EXTENSIONS = List.of(".exe", ".com", ".bat", ".cmd");

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile("del\\s+/[fq]\\s+.*[a-z]:\\\\", Pattern.CASE_INSENSITIVE),
            Pattern.compile("rmdir\\s+/[sq]\\s+.*[a-z]:\\\\", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(^|[\\s\\\\/\"])format(\\.com)?\\s+[a-z]:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("diskpart", Pattern.CASE_INSENSITIVE),
            Pattern.compile("reg(\\.exe)?\\s+delete", Pattern.CASE_INSENSITIVE),
            Pattern.compile("net\\s+user", Pattern.CASE_INSENSITIVE),
            Pattern.compile("net\\s+localgroup", Pattern.CASE_INSENSITIVE),
            Pattern.compile("takeown", Pattern.CASE_INSENSITIVE),
            Pattern.compile("icacls.*/grant.*(administrators|everyone)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("powershell.*-enc(odedcommand)?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(powershell|pwsh).*(\\biex\\b|invoke-expression)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("cmd.*/[ck].*\\bdel\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile(">.*nul.*2>&1.*del", Pattern.CASE_INSENSITIVE),
            Pattern.compile("fsutil\\s+file\\s+setzerodata", Pattern.CASE_INSENSITIVE),
            Pattern.compile("cipher\\s+/w", Pattern.CASE_INSENSITIVE),
            Pattern.compile("vssadmin\\s+delete", Pattern.CASE_INSENSITIVE),
            Pattern.compile("wbadmin\\s+delete", Pattern.CASE_INSENSITIVE),
            Pattern.compile("bcdedit", Pattern.CASE_INSENSITIVE),
            Pattern.compile("bootrec", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\brm\\s+(-[a-z]*\\s+)*-[a-z]*(r[a-z]*f|f[a-z]*r)[a-z]*\\s+/(\\*|\\s|$)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bmkfs(\\.[a-z0-9]+)?\\s", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdd\\s+.*of=/dev/", Pattern.CASE_INSENSITIVE),
            Pattern.compile("base64\\s+(-d|--decode).*\\|\\s*(sh|bash|zsh)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("chmod\\s+(-r\\s+)?[0-7]*777\\s+/(\\s|$)", Pattern.CASE_INSENSITIVE));

    private static final Set<String> SHELL_HOSTS = Set.of(
            "cmd", "powershell", "pwsh", "wscript", "cscript",
            "sh", "bash", "zsh", "dash", "ksh");

    private static final List<String> DANGEROUS_SHELL_COMMANDS = List.of(
            "del ", "erase ", "rmdir ", "rd ", "format ", "diskpart",
            "reg delete", "reg add", "net user", "net localgroup",
            "takeown", "icacls", "attrib -r -s -h",
            "fsutil", "cipher", "vssadmin", "wbadmin",
            "bcdedit", "bootrec", ">nul", "2>&1",
            "rm -rf", "rm -fr", "mkfs", "dd if=", "useradd", "userdel", "usermod", "passwd",
            "chown ", "chmod 777", "shutdown", "reboot");

    /**
     * Decides whether the executable may be launched with the given arguments.
     *
     * @param path
     *            executable path or bare name as requested
     * @param arguments
     *            the raw argument string, may be {@code null}
     * @return the verdict; denials carry a reason fit for the caller
     */
    public SecurityDecision evaluate(String path, String arguments) {
        String args = arguments != null ? arguments : "";
        String executableName = executableName(path);
        String bareName = bareName(executableName);

        if (BLOCKED_EXECUTABLES.contains(bareName)) {
            return SecurityDecision.deny("'" + executableName + "' is a dangerous executable and cannot be launched");
        }

        String fullCommand = path + " " + args;
        for (Pattern pattern : DANGEROUS_PATTERNS) {
            if (pattern.matcher(fullCommand).find()) {
                return SecurityDecision.deny("Dangerous command pattern detected");
            }
        }

        if (SHELL_HOSTS.contains(bareName) && containsDangerousShellCommand(args)) {
            return SecurityDecision.deny("The command contains a dangerous operation");
        }

        return SecurityDecision.allow();
    }

    static String executableName(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.trim().replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        String fileName = slash >= 0 ? normalized.substring(slash + 1) : normalized;
        return fileName.toLowerCase(Locale.ROOT);
    }

    /**
     * File name without a Windows launch extension, so {@code regedit} and
     * {@code regedit.exe} are the same executable.
     */
    static String bareName(String executableName) {
        for (String extension : LAUNCH_EXTENSIONS) {
            if (executableName.endsWith(extension) && executableName.length() > extension.length()) {
                return executableName.substring(0, executableName.length() - extension.length());
            }
        }
        return executableName;
    }

    private static boolean containsDangerousShellCommand(String arguments) {
        String lowerArgs = arguments.toLowerCase(Locale.ROOT);
        return DANGEROUS_SHELL_COMMANDS.stream().anyMatch(lowerArgs::contains);
    }
}
