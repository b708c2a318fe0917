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

package me.golemcore.gateway.process;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.RunningProcess;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolFailureKind;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.ProcessPort;
import me.golemcore.gateway.port.outbound.ProcessPort.HostProcess;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Launches, terminates and lists host processes.
 *
 * <p>
 * Launch resolves the executable (as given, then through {@code PATH}), starts
 * it without a shell and probes it once after a short delay to report an
 * immediate crash. Termination refuses protected system processes, asks the
 * process to exit normally where supported and falls back to a forced kill.
 * Every wait is sliced into poll intervals and stops early when the call is
 * cancelled or its deadline passes.
 *
 * <p>
 * Blocking work runs on the manager's own executor; the public operations
 * return futures.
 */
@Service
@Slf4j
public class ProcessLifecycleManager {

    private static final List<String> EXECUTABLE_EXTENSIONS = List.of(".exe", ".com", ".bat", ".cmd", "");

    private static final Set<String> PROTECTED_PROCESSES = Set.of(
            // Windows
            "system", "registry", "smss", "csrss", "wininit", "services", "lsass",
            "svchost", "explorer", "winlogon", "fontdrvhost", "dwm",
            "memory compression", "secure system",
            // Linux and macOS
            "init", "systemd", "systemd-logind", "dbus-daemon", "kthreadd",
            "launchd", "kernel_task", "loginwindow", "windowserver",
            "xorg", "xwayland", "gnome-shell", "kwin_x11", "kwin_wayland",
            "gdm", "gdm-session-worker", "sddm", "lightdm");

    private final ProcessPort processPort;
    private final GatewayProperties.ProcessProperties config;
    private final ExecutorService executor;

    public ProcessLifecycleManager(ProcessPort processPort, GatewayProperties properties) {
        this.processPort = processPort;
        this.config = properties.getProcess();
        this.executor = Executors.newCachedThreadPool();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Process] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Resolves an executable against the process {@code PATH}.
     */
    public Optional<Path> resolvePath(String candidate) {
        return resolvePath(candidate, System.getenv("PATH"));
    }

    Optional<Path> resolvePath(String candidate, String searchPath) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        Path path;
        try {
            path = Paths.get(candidate);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        if (Files.isRegularFile(path)) {
            return Optional.of(realPath(path));
        }
        if (path.isAbsolute() || searchPath == null) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String extension : EXECUTABLE_EXTENSIONS) {
                try {
                    Path found = Paths.get(dir).resolve(candidate + extension);
                    if (Files.isRegularFile(found)) {
                        return Optional.of(realPath(found));
                    }
                } catch (InvalidPathException e) {
                    log.debug("[Process] Skipping invalid PATH entry: {}", dir);
                    break;
                }
            }
        }
        return Optional.empty();
    }

    public CompletableFuture<LaunchResult> launch(String path, String arguments, String workingDirectory,
            ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> doLaunch(path, arguments, workingDirectory, context), executor);
    }

    public CompletableFuture<TerminationResult> terminate(long pid, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> doTerminate(pid, context), executor);
    }

    public CompletableFuture<List<RunningProcess>> listRunning() {
        return CompletableFuture.supplyAsync(this::doListRunning, executor);
    }

    LaunchResult doLaunch(String path, String arguments, String workingDirectory, ToolExecutionContext context) {
        Optional<Path> executable = resolvePath(path);
        if (executable.isEmpty()) {
            return LaunchResult.failed(ToolFailureKind.NOT_FOUND,
                    "Application '" + path + "' not found. Check the path.");
        }

        Path workDir = null;
        if (workingDirectory != null && !workingDirectory.isBlank()) {
            try {
                workDir = Paths.get(workingDirectory);
            } catch (InvalidPathException e) {
                return LaunchResult.failed(ToolFailureKind.NOT_FOUND,
                        "Working directory '" + workingDirectory + "' is not a valid path");
            }
            if (!Files.isDirectory(workDir)) {
                return LaunchResult.failed(ToolFailureKind.NOT_FOUND,
                        "Working directory '" + workingDirectory + "' does not exist");
            }
        }

        List<String> command = new ArrayList<>();
        command.add(executable.get().toString());
        command.addAll(tokenize(arguments));

        Process process;
        try {
            process = processPort.start(command, workDir);
        } catch (IOException e) {
            log.warn("[Process] Failed to start {}: {}", executable.get(), e.getMessage());
            return LaunchResult.failed(ToolFailureKind.EXECUTION_FAILED,
                    "Failed to launch application: " + e.getMessage());
        }
        long pid = process.pid();
        log.info("[Process] Started {} (pid {})", executable.get(), pid);

        Optional<ToolFailureKind> interruption = pause(config.getLaunchProbeDelay(), context);
        if (interruption.isPresent()) {
            return LaunchResult.failed(interruption.get(),
                    "Launch wait interrupted; the process was started with PID " + pid);
        }

        if (!process.isAlive() && process.exitValue() != 0) {
            log.warn("[Process] {} exited immediately with code {}", executable.get(), process.exitValue());
            return LaunchResult.failed(ToolFailureKind.EXECUTION_FAILED,
                    "Application exited abnormally (exit code " + process.exitValue() + ")");
        }
        return LaunchResult.started(pid, executable.get());
    }

    TerminationResult doTerminate(long pid, ToolExecutionContext context) {
        if (pid <= 0) {
            return new TerminationResult(TerminationResult.Status.INVALID_PID, pid, null,
                    "process_id must be a positive integer");
        }

        Optional<HostProcess> found = processPort.findProcess(pid);
        if (found.isEmpty() || !found.get().isAlive()) {
            return new TerminationResult(TerminationResult.Status.NOT_FOUND, pid, null,
                    "Process ID " + pid + " not found");
        }
        HostProcess process = found.get();
        String name = process.name().orElse("unknown");

        if (isProtected(process)) {
            log.warn("[Process] Refusing to terminate protected process {} (pid {})", name, pid);
            return new TerminationResult(TerminationResult.Status.PROTECTED, pid, name,
                    "System process '" + name + "' (PID: " + pid + ") cannot be terminated");
        }

        if (process.supportsGracefulClose()) {
            process.requestGracefulClose();
            WaitOutcome graceful = awaitExit(process, config.getGracefulTimeout(), context);
            if (graceful == WaitOutcome.EXITED) {
                log.info("[Process] {} (pid {}) closed gracefully", name, pid);
                return new TerminationResult(TerminationResult.Status.CLOSED_GRACEFULLY, pid, name,
                        "Application '" + name + "' (PID: " + pid + ") closed gracefully");
            }
            if (graceful != WaitOutcome.STILL_RUNNING) {
                return interrupted(graceful, pid, name);
            }
            log.debug("[Process] {} (pid {}) ignored the close request, killing", name, pid);
        }

        process.forceTerminate();
        WaitOutcome forced = awaitExit(process, config.getForcedTimeout(), context);
        return switch (forced) {
        case EXITED -> {
            log.info("[Process] {} (pid {}) killed", name, pid);
            yield new TerminationResult(TerminationResult.Status.KILLED, pid, name,
                    "Application '" + name + "' (PID: " + pid + ") was forcibly terminated");
        }
        case STILL_RUNNING -> {
            log.warn("[Process] {} (pid {}) survived a forced kill", name, pid);
            yield new TerminationResult(TerminationResult.Status.STILL_RUNNING, pid, name,
                    "Failed to terminate application '" + name + "' (PID: " + pid + ")");
        }
        default -> interrupted(forced, pid, name);
        };
    }

    List<RunningProcess> doListRunning() {
        return processPort.listProcesses().stream()
                .map(ProcessLifecycleManager::snapshot)
                .sorted(Comparator.comparing(RunningProcess::name,
                        Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
                .toList();
    }

    boolean isProtected(HostProcess process) {
        if (process.pid() == 1 || process.pid() == processPort.currentPid()) {
            return true;
        }
        return process.name()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .map(name -> name.endsWith(".exe") ? name.substring(0, name.length() - 4) : name)
                .filter(PROTECTED_PROCESSES::contains)
                .isPresent();
    }

    /**
     * Splits an argument string on whitespace, keeping double-quoted runs
     * together.
     */
    static List<String> tokenize(String arguments) {
        List<String> tokens = new ArrayList<>();
        if (arguments == null) {
            return tokens;
        }
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean hasToken = false;
        for (char c : arguments.toCharArray()) {
            if (c == '"') {
                inQuotes = !inQuotes;
                hasToken = true;
            } else if (Character.isWhitespace(c) && !inQuotes) {
                if (hasToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    hasToken = false;
                }
            } else {
                current.append(c);
                hasToken = true;
            }
        }
        if (hasToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static RunningProcess snapshot(HostProcess process) {
        return new RunningProcess(process.pid(), process.name().orElse(null),
                process.windowTitle().orElse(null), process.memoryMb());
    }

    private TerminationResult interrupted(WaitOutcome outcome, long pid, String name) {
        if (outcome == WaitOutcome.CANCELLED) {
            return new TerminationResult(TerminationResult.Status.CANCELLED, pid, name,
                    "Termination of PID " + pid + " was cancelled");
        }
        return new TerminationResult(TerminationResult.Status.TIMED_OUT, pid, name,
                "Termination of PID " + pid + " exceeded the call deadline");
    }

    private WaitOutcome awaitExit(HostProcess process, Duration window, ToolExecutionContext context) {
        long deadline = System.nanoTime() + window.toNanos();
        while (true) {
            Optional<ToolFailureKind> interruption = context.interruption();
            if (interruption.isPresent()) {
                return toOutcome(interruption.get());
            }
            if (!process.isAlive()) {
                return WaitOutcome.EXITED;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return process.isAlive() ? WaitOutcome.STILL_RUNNING : WaitOutcome.EXITED;
            }
            if (!sleep(Math.min(remaining, config.getPollInterval().toNanos()))) {
                return WaitOutcome.CANCELLED;
            }
        }
    }

    private Optional<ToolFailureKind> pause(Duration delay, ToolExecutionContext context) {
        long deadline = System.nanoTime() + delay.toNanos();
        while (true) {
            Optional<ToolFailureKind> interruption = context.interruption();
            if (interruption.isPresent()) {
                return interruption;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            if (!sleep(Math.min(remaining, config.getPollInterval().toNanos()))) {
                return Optional.of(ToolFailureKind.CANCELLED);
            }
        }
    }

    private static boolean sleep(long nanos) {
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static WaitOutcome toOutcome(ToolFailureKind kind) {
        return kind == ToolFailureKind.TIMED_OUT ? WaitOutcome.TIMED_OUT : WaitOutcome.CANCELLED;
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }

    private enum WaitOutcome {
        EXITED, STILL_RUNNING, CANCELLED, TIMED_OUT
    }
}
