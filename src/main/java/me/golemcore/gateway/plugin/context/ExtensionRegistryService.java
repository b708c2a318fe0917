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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.ExtensionDescriptor;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.plugin.api.ExtensionContext;
import me.golemcore.gateway.plugin.api.GatewayExtension;
import me.golemcore.gateway.plugin.context.ExtensionJarLoader.LoadedJar;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * Registry of dynamically loaded extensions and the tools they contribute.
 *
 * <p>
 * Extensions come from jars in {@code gateway.extensions.directory} (see
 * {@link ExtensionJarLoader}) or are registered programmatically. Each loaded
 * jar keeps its own class loader, closed when the last extension from it is
 * removed. Failures of one jar or provider are logged and do not affect the
 * others.
 *
 * <p>
 * Extension tools are exposed as {@code extension_<extension>_<tool>} so they
 * never shadow built-in tools. An extension whose namespaced tool name is already
 * taken by a loaded extension is rejected. A disabled extension contributes no
 * tools.
 *
 * <p>
 * A read/write lock guards the registry: lookups run concurrently, mutations
 * exclusively.
 */
@Service
@Slf4j
public class ExtensionRegistryService {

    public static final String TOOL_PREFIX = "extension_";
    static final String REGISTERED_ORIGIN = "registered";

    private final ExtensionJarLoader jarLoader;
    private final ExtensionContext extensionContext;
    private final Path extensionsDirectory;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, LoadedExtension> extensions = new LinkedHashMap<>();

    public ExtensionRegistryService(ExtensionJarLoader jarLoader, ExtensionContext extensionContext,
            GatewayProperties properties) {
        this(jarLoader, extensionContext,
                GatewayProperties.expandPath(properties.getExtensions().getDirectory()), Clock.systemUTC());
    }

    ExtensionRegistryService(ExtensionJarLoader jarLoader, ExtensionContext extensionContext,
            Path extensionsDirectory, Clock clock) {
        this.jarLoader = jarLoader;
        this.extensionContext = extensionContext;
        this.extensionsDirectory = extensionsDirectory;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        load();
    }

    @PreDestroy
    public void shutdown() {
        lock.writeLock().lock();
        try {
            unloadAll();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Scans the extensions directory and adds every extension not yet loaded.
     *
     * @return number of extensions added
     */
    public int load() {
        lock.writeLock().lock();
        try {
            return loadFromDirectory();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Unloads every extension, then loads the extensions directory again.
     *
     * @return number of extensions loaded
     */
    public int reload() {
        lock.writeLock().lock();
        try {
            unloadAll();
            int loaded = loadFromDirectory();
            log.info("[Extensions] Reloaded, {} extension(s) active", loaded);
            return loaded;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Adds an extension that is already instantiated.
     *
     * @return false if an extension with the same name is loaded, one of its
     *         namespaced tool names is already taken, or it failed to initialize
     */
    public boolean register(GatewayExtension extension) {
        lock.writeLock().lock();
        try {
            return add(extension, null, REGISTERED_ORIGIN, clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean unregister(String name) {
        lock.writeLock().lock();
        try {
            LoadedExtension removed = extensions.remove(name);
            if (removed == null) {
                return false;
            }
            shutdownQuietly(removed);
            closeIfUnused(removed.jar);
            log.info("[Extensions] Unregistered {}", name);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<ExtensionDescriptor> getLoaded() {
        lock.readLock().lock();
        try {
            return extensions.values().stream()
                    .map(LoadedExtension::toDescriptor)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ExtensionDescriptor> find(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(extensions.get(name)).map(LoadedExtension::toDescriptor);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return false if no extension has this name
     */
    public boolean setEnabled(String name, boolean enabled) {
        lock.writeLock().lock();
        try {
            LoadedExtension extension = extensions.get(name);
            if (extension == null) {
                return false;
            }
            extension.enabled = enabled;
            log.info("[Extensions] {} {}", name, enabled ? "enabled" : "disabled");
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Looks up an extension tool by its namespaced name. Tools of disabled
     * extensions are not found.
     */
    public Optional<ToolComponent> findTool(String toolName) {
        if (toolName == null || !toolName.startsWith(TOOL_PREFIX)) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return extensions.values().stream()
                    .filter(extension -> extension.enabled)
                    .map(extension -> extension.tools.get(toolName))
                    .filter(tool -> tool != null)
                    .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Tools of all enabled extensions, keyed by namespaced name.
     */
    public Map<String, ToolComponent> getEnabledTools() {
        lock.readLock().lock();
        try {
            Map<String, ToolComponent> tools = new LinkedHashMap<>();
            extensions.values().stream()
                    .filter(extension -> extension.enabled)
                    .forEach(extension -> tools.putAll(extension.tools));
            return Collections.unmodifiableMap(tools);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records that a tool of the owning extension was just used.
     */
    public void markUsed(String toolName) {
        lock.writeLock().lock();
        try {
            extensions.values().stream()
                    .filter(extension -> extension.tools.containsKey(toolName))
                    .findFirst()
                    .ifPresent(extension -> extension.lastUsedAt = clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Namespaced tool name of an extension tool. Characters outside
     * {@code [a-z0-9_-]} in the extension name become underscores.
     */
    public static String toolName(String extensionName, String localToolName) {
        String namespace = extensionName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
        return TOOL_PREFIX + namespace + "_" + localToolName;
    }

    private int loadFromDirectory() {
        try {
            Files.createDirectories(extensionsDirectory);
        } catch (IOException e) {
            log.error("[Extensions] Cannot create extensions directory {}", extensionsDirectory, e);
            return 0;
        }

        List<Path> jars;
        try (Stream<Path> files = Files.list(extensionsDirectory)) {
            jars = files.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".jar"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("[Extensions] Cannot scan extensions directory {}", extensionsDirectory, e);
            return 0;
        }

        int added = 0;
        for (Path jar : jars) {
            added += loadJar(jar);
        }
        log.info("[Extensions] Loaded {} extension(s) from {} jar(s) in {}", added, jars.size(),
                extensionsDirectory);
        return added;
    }

    private int loadJar(Path jar) {
        LoadedJar loadedJar;
        try {
            loadedJar = jarLoader.open(jar);
        } catch (IOException | RuntimeException e) {
            log.warn("[Extensions] Failed to open {}: {}", jar.getFileName(), e.getMessage());
            return 0;
        }

        Instant installedAt = installedAt(jar);
        int added = 0;
        for (GatewayExtension extension : loadedJar.extensions()) {
            if (add(extension, loadedJar, jar.toString(), installedAt)) {
                added++;
            }
        }
        if (added == 0) {
            log.debug("[Extensions] No extensions loaded from {}", jar.getFileName());
            loadedJar.close();
        }
        return added;
    }

    private boolean add(GatewayExtension extension, LoadedJar jar, String origin, Instant installedAt) {
        String name;
        try {
            name = extension.name();
        } catch (RuntimeException e) {
            log.warn("[Extensions] Extension {} has no readable name: {}", extension.getClass().getName(),
                    e.getMessage());
            return false;
        }
        if (name == null || name.isBlank()) {
            log.warn("[Extensions] Ignoring extension {} without a name", extension.getClass().getName());
            return false;
        }
        if (extensions.containsKey(name)) {
            log.warn("[Extensions] Duplicate extension name '{}' from {}, ignored", name, origin);
            return false;
        }

        Map<String, ToolComponent> tools = new LinkedHashMap<>();
        String version;
        try {
            version = extension.version();
            extension.initialize(extensionContext);
            for (ToolComponent tool : extension.tools()) {
                String toolName = toolName(name, tool.getToolName());
                if (tools.putIfAbsent(toolName, tool) != null) {
                    log.warn("[Extensions] Duplicate tool {} in extension {}, ignored", toolName, name);
                }
            }
        } catch (RuntimeException | LinkageError e) {
            log.warn("[Extensions] Extension '{}' from {} failed to initialize: {}", name, origin, e.toString());
            shutdownQuietly(extension, name);
            return false;
        }

        Optional<String> clash = tools.keySet().stream()
                .filter(toolName -> extensions.values().stream()
                        .anyMatch(loaded -> loaded.tools.containsKey(toolName)))
                .findFirst();
        if (clash.isPresent()) {
            log.warn("[Extensions] Extension '{}' from {} rejected: tool {} is already provided by another extension",
                    name, origin, clash.get());
            shutdownQuietly(extension, name);
            return false;
        }

        extensions.put(name, new LoadedExtension(extension, name, version, jar, origin, installedAt, tools));
        log.info("[Extensions] Loaded {} {} from {} with tools {}", name, version, origin, tools.keySet());
        return true;
    }

    private void unloadAll() {
        List<LoadedExtension> loaded = new ArrayList<>(extensions.values());
        extensions.clear();
        for (LoadedExtension extension : loaded) {
            shutdownQuietly(extension);
        }
        loaded.stream()
                .map(extension -> extension.jar)
                .filter(jar -> jar != null)
                .distinct()
                .forEach(LoadedJar::close);
    }

    private void closeIfUnused(LoadedJar jar) {
        if (jar == null) {
            return;
        }
        boolean inUse = extensions.values().stream().anyMatch(extension -> extension.jar == jar);
        if (!inUse) {
            jar.close();
        }
    }

    private static void shutdownQuietly(LoadedExtension extension) {
        shutdownQuietly(extension.extension, extension.name);
    }

    private static void shutdownQuietly(GatewayExtension extension, String name) {
        try {
            extension.shutdown();
        } catch (RuntimeException | LinkageError e) {
            log.warn("[Extensions] Extension '{}' failed to shut down: {}", name, e.toString());
        }
    }

    private static Instant installedAt(Path jar) {
        try {
            return Files.getLastModifiedTime(jar).toInstant();
        } catch (IOException e) {
            log.debug("[Extensions] Cannot read modification time of {}", jar);
            return Instant.now();
        }
    }

    private static final class LoadedExtension {

        private final GatewayExtension extension;
        private final String name;
        private final String version;
        private final LoadedJar jar;
        private final String origin;
        private final Instant installedAt;
        private final Map<String, ToolComponent> tools;
        private boolean enabled = true;
        private Instant lastUsedAt;

        private LoadedExtension(GatewayExtension extension, String name, String version, LoadedJar jar,
                String origin, Instant installedAt, Map<String, ToolComponent> tools) {
            this.extension = extension;
            this.name = name;
            this.version = version;
            this.jar = jar;
            this.origin = origin;
            this.installedAt = installedAt;
            this.tools = Collections.unmodifiableMap(tools);
        }

        private ExtensionDescriptor toDescriptor() {
            return ExtensionDescriptor.builder()
                    .name(name)
                    .version(version)
                    .originPath(origin)
                    .enabled(enabled)
                    .installedAt(installedAt)
                    .lastUsedAt(lastUsedAt)
                    .toolNames(List.copyOf(tools.keySet()))
                    .build();
        }
    }
}
