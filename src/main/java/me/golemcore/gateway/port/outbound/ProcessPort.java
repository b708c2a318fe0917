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

package me.golemcore.gateway.port.outbound;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Port for host operating system processes: lookup, listing and start.
 * Attribute reads on {@link HostProcess} are best-effort and never throw.
 */
public interface ProcessPort {

    Optional<HostProcess> findProcess(long pid);

    List<HostProcess> listProcesses();

    /**
     * Pid of the gateway's own process.
     */
    long currentPid();

    /**
     * Starts the command directly, without a shell. Output streams are
     * discarded.
     *
     * @param command
     *            executable followed by its arguments
     * @param workingDirectory
     *            working directory, or {@code null} to inherit the gateway's
     * @return the started process
     * @throws IOException
     *             if the process could not be started
     */
    Process start(List<String> command, Path workingDirectory) throws IOException;

    /**
     * View of a running host process.
     */
    interface HostProcess {

        long pid();

        /**
         * Executable name without directory, if readable.
         */
        Optional<String> name();

        Optional<String> windowTitle();

        /**
         * Resident memory in megabytes, zero if unreadable.
         */
        long memoryMb();

        /**
         * Whether the process can be asked to exit normally.
         */
        boolean supportsGracefulClose();

        boolean requestGracefulClose();

        boolean forceTerminate();

        boolean isAlive();
    }
}
