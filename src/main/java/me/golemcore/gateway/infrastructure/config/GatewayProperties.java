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

package me.golemcore.gateway.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Centralized configuration properties for the gateway, bound from
 * application.properties.
 *
 * <p>
 * All gateway configuration is organized under the {@code gateway.*} prefix:
 * <ul>
 * <li>{@link ToolsProperties} - call timeouts</li>
 * <li>{@link ProcessProperties} - launch probe and termination windows</li>
 * <li>{@link ExtensionsProperties} - extension jar directory</li>
 * <li>{@link CredentialsProperties} - secret store and key file locations</li>
 * </ul>
 *
 * <p>
 * Paths may contain {@code ${user.home}}, which is expanded by
 * {@link #expandPath(String)}.
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private ToolsProperties tools = new ToolsProperties();
    private ProcessProperties process = new ProcessProperties();
    private ExtensionsProperties extensions = new ExtensionsProperties();
    private CredentialsProperties credentials = new CredentialsProperties();

    @Data
    public static class ToolsProperties {
        /** Timeout applied when a call does not specify one. */
        private Duration defaultTimeout = Duration.ofSeconds(30);

        /** Upper bound for caller-specified timeouts. */
        private Duration maxTimeout = Duration.ofSeconds(300);
    }

    @Data
    public static class ProcessProperties {
        /** Delay after start before checking for an immediate crash. */
        private Duration launchProbeDelay = Duration.ofMillis(100);

        /** How long to wait for a process to exit after a graceful close request. */
        private Duration gracefulTimeout = Duration.ofSeconds(3);

        /** How long to wait for a process to exit after a forced kill. */
        private Duration forcedTimeout = Duration.ofSeconds(5);

        private Duration pollInterval = Duration.ofMillis(100);
    }

    @Data
    public static class ExtensionsProperties {
        private String directory = "${user.home}/.golemcore/gateway/extensions";
    }

    @Data
    public static class CredentialsProperties {
        private String storePath = "${user.home}/.golemcore/gateway/credentials.json";
        private String keyPath = "${user.home}/.golemcore/gateway/credentials.key";
    }

    public static Path expandPath(String path) {
        return Paths.get(path.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }
}
