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

package me.golemcore.gateway.plugin.context;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.plugin.api.ExtensionContext;
import me.golemcore.gateway.port.outbound.CredentialStorePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Default host-side extension context. Secrets come from the environment
 * first, then from the credential store.
 */
@Component
@Slf4j
public class SpringExtensionContext implements ExtensionContext {

    private final CredentialStorePort credentialStore;
    private final Path dataRoot;

    public SpringExtensionContext(GatewayProperties properties, CredentialStorePort credentialStore) {
        this.credentialStore = credentialStore;
        this.dataRoot = GatewayProperties.expandPath(properties.getExtensions().getDirectory())
                .resolveSibling("extension-data");
    }

    @Override
    public Path dataDirectory(String extensionName) {
        Path dir = dataRoot.resolve(extensionName).normalize();
        if (!dir.startsWith(dataRoot)) {
            throw new IllegalArgumentException("Invalid extension name: " + extensionName);
        }
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create extension data directory: " + dir, e);
        }
        return dir;
    }

    @Override
    public Optional<String> secret(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }

        String environmentKey = key.toUpperCase(Locale.ROOT).replace('.', '_');
        String envValue = System.getenv(environmentKey);
        if (envValue != null && !envValue.isBlank()) {
            return Optional.of(envValue);
        }

        try {
            return credentialStore.retrieve(key).join();
        } catch (CompletionException e) {
            log.warn("[Extensions] Secret '{}' unavailable: {}", key, e.getCause().getMessage());
            return Optional.empty();
        }
    }
}
