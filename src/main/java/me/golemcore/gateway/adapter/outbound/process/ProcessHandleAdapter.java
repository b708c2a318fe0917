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

package me.golemcore.gateway.adapter.outbound.process;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.port.outbound.ProcessPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link ProcessPort} backed by {@link ProcessHandle} and {@link ProcessBuilder}.
 *
 * <p>
 * Memory is read from {@code /proc/<pid>/status} where that file exists.
 * Window titles are not available through the JDK and are always absent.
 */
@Component
@Slf4j
public class ProcessHandleAdapter implements ProcessPort {

    private static final Path PROC_ROOT = Paths.get("/proc");

    @Override
    public Optional<HostProcess> findProcess(long pid) {
        return ProcessHandle.of(pid).map(HandleProcess::new);
    }

    @Override
    public List<HostProcess> listProcesses() {
        try (Stream<ProcessHandle> handles = ProcessHandle.allProcesses()) {
            return handles.<HostProcess>map(HandleProcess::new).toList();
        }
    }

    @Override
    public long currentPid() {
        return ProcessHandle.current().pid();
    }

    @Override
    public Process start(List<String> command, Path workingDirectory) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        return builder.start();
    }

    static long readResidentMemoryMb(Path statusFile) {
        if (!Files.isReadable(statusFile)) {
            return 0;
        }
        try (Stream<String> lines = Files.lines(statusFile)) {
            return lines.filter(line -> line.startsWith("VmRSS:"))
                    .findFirst()
                    .map(ProcessHandleAdapter::parseKilobytes)
                    .map(kb -> kb / 1024)
                    .orElse(0L);
        } catch (IOException | RuntimeException e) {
            log.trace("[Process] Cannot read {}: {}", statusFile, e.getMessage());
            return 0;
        }
    }

    private static long parseKilobytes(String line) {
        String value = line.substring("VmRSS:".length()).trim();
        int space = value.indexOf(' ');
        return Long.parseLong(space > 0 ? value.substring(0, space) : value);
    }

    private static final class HandleProcess implements HostProcess {

        private final ProcessHandle handle;

        private HandleProcess(ProcessHandle handle) {
            this.handle = handle;
        }

        @Override
        public long pid() {
            return handle.pid();
        }

        @Override
        public Optional<String> name() {
            try {
                return handle.info().command()
                        .map(command -> command.replace('\\', '/'))
                        .map(command -> command.substring(command.lastIndexOf('/') + 1))
                        .filter(name -> !name.isBlank());
            } catch (RuntimeException e) {
                log.trace("[Process] Cannot read name of {}: {}", handle.pid(), e.getMessage());
                return Optional.empty();
            }
        }

        @Override
        public Optional<String> windowTitle() {
            return Optional.empty();
        }

        @Override
        public long memoryMb() {
            return readResidentMemoryMb(PROC_ROOT.resolve(Long.toString(handle.pid())).resolve("status"));
        }

        @Override
        public boolean supportsGracefulClose() {
            return handle.supportsNormalTermination();
        }

        @Override
        public boolean requestGracefulClose() {
            return handle.destroy();
        }

        @Override
        public boolean forceTerminate() {
            return handle.destroyForcibly();
        }

        @Override
        public boolean isAlive() {
            return handle.isAlive();
        }
    }
}
