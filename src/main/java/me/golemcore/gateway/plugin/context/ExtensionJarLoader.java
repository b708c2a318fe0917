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
import me.golemcore.gateway.plugin.api.GatewayExtension;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Opens an extension jar in its own class loader and instantiates the
 * {@link GatewayExtension} providers it declares through
 * {@link ServiceLoader}. A provider that fails to load is logged and skipped;
 * the remaining providers of the jar are still returned.
 */
@Component
@Slf4j
public class ExtensionJarLoader {

    private static final int MAX_PROVIDER_FAILURES = 32;

    public LoadedJar open(Path jar) throws IOException {
        URLClassLoader classLoader = newClassLoader(jar);
        List<GatewayExtension> extensions = new ArrayList<>();
        Iterator<GatewayExtension> providers = ServiceLoader.load(GatewayExtension.class, classLoader).iterator();
        int failures = 0;
        while (failures < MAX_PROVIDER_FAILURES) {
            try {
                if (!providers.hasNext()) {
                    break;
                }
                extensions.add(providers.next());
            } catch (ServiceConfigurationError | LinkageError e) {
                log.warn("[Extensions] Skipping provider in {}: {}", jar.getFileName(), e.getMessage());
                failures++;
                if (e instanceof LinkageError) {
                    break;
                }
            }
        }
        return new LoadedJar(jar, classLoader, extensions);
    }

    private static URLClassLoader newClassLoader(Path jar) throws MalformedURLException {
        return new URLClassLoader("extension:" + jar.getFileName(),
                new URL[] { jar.toUri().toURL() },
                GatewayExtension.class.getClassLoader());
    }

    /**
     * Extensions found in one jar, with the class loader that owns them.
     */
    public record LoadedJar(Path jar, URLClassLoader classLoader, List<GatewayExtension> extensions) {

        public LoadedJar {
            extensions = List.copyOf(extensions);
        }

        public void close() {
            try {
                classLoader.close();
            } catch (IOException e) {
                log.warn("[Extensions] Failed to close class loader of {}: {}", jar.getFileName(), e.getMessage());
            }
        }
    }
}
