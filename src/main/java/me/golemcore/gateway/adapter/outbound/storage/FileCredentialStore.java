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

package me.golemcore.gateway.adapter.outbound.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.CredentialStoreException;
import me.golemcore.gateway.port.outbound.CredentialStorePort;
import me.golemcore.gateway.port.outbound.SecretProtector;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Credential store keeping every secret in one JSON object on disk.
 *
 * <p>
 * Values pass through a {@link SecretProtector} before they are written. Each
 * mutation rewrites the file through a crash-safe sequence:
 * <ol>
 * <li>Write to a temporary file (.tmp suffix) with fsync</li>
 * <li>Verify the temporary file size</li>
 * <li>Atomic rename of .tmp to the target (plain rename where the file system
 * has no atomic move)</li>
 * </ol>
 * A crash therefore leaves either the previous or the new mapping. A file that
 * cannot be parsed is logged and read as an empty store.
 *
 * <p>
 * Location configured via {@code gateway.credentials.store-path}.
 */
@Component
@Slf4j
public class FileCredentialStore implements CredentialStorePort {

    private static final TypeReference<TreeMap<String, String>> MAPPING_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final SecretProtector secretProtector;
    private final Path storePath;

    public FileCredentialStore(GatewayProperties properties, SecretProtector secretProtector) {
        this(GatewayProperties.expandPath(properties.getCredentials().getStorePath()), secretProtector);
    }

    FileCredentialStore(Path storePath, SecretProtector secretProtector) {
        this.storePath = storePath;
        this.secretProtector = secretProtector;
    }

    @Override
    public CompletableFuture<Void> store(String key, String value) {
        requireText(key, "key");
        requireText(value, "value");
        return CompletableFuture.runAsync(() -> withWriteLock(() -> {
            TreeMap<String, String> mapping = readMapping();
            mapping.put(key, secretProtector.protect(value));
            writeMapping(mapping);
            log.debug("[Credentials] Stored secret '{}'", key);
            return null;
        }));
    }

    @Override
    public CompletableFuture<Optional<String>> retrieve(String key) {
        requireText(key, "key");
        return CompletableFuture.supplyAsync(() -> withReadLock(() -> {
            String protectedValue = readMapping().get(key);
            if (protectedValue == null) {
                return Optional.<String>empty();
            }
            try {
                return Optional.of(secretProtector.unprotect(protectedValue));
            } catch (IllegalStateException e) {
                throw new CredentialStoreException("Secret '" + key + "' cannot be read", e);
            }
        }));
    }

    @Override
    public CompletableFuture<Boolean> delete(String key) {
        requireText(key, "key");
        return CompletableFuture.supplyAsync(() -> withWriteLock(() -> {
            TreeMap<String, String> mapping = readMapping();
            if (mapping.remove(key) == null) {
                return false;
            }
            writeMapping(mapping);
            log.debug("[Credentials] Deleted secret '{}'", key);
            return true;
        }));
    }

    @Override
    public CompletableFuture<List<String>> listKeys() {
        return CompletableFuture.supplyAsync(() -> withReadLock(() -> List.copyOf(readMapping().keySet())));
    }

    @Override
    public CompletableFuture<Void> clear() {
        return CompletableFuture.runAsync(() -> withWriteLock(() -> {
            try {
                Files.deleteIfExists(storePath);
            } catch (IOException e) {
                throw new CredentialStoreException("Failed to clear credential store: " + storePath, e);
            }
            log.info("[Credentials] Store cleared");
            return null;
        }));
    }

    private TreeMap<String, String> readMapping() {
        if (!Files.exists(storePath)) {
            return new TreeMap<>();
        }
        try {
            TreeMap<String, String> mapping = objectMapper.readValue(storePath.toFile(), MAPPING_TYPE);
            return mapping != null ? mapping : new TreeMap<>();
        } catch (IOException e) {
            log.warn("[Credentials] Unreadable store {}, treating as empty: {}", storePath, e.getMessage());
            return new TreeMap<>();
        }
    }

    private void writeMapping(Map<String, String> mapping) {
        Path tempPath = storePath.resolveSibling(storePath.getFileName() + ".tmp");
        try {
            Path parent = storePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            byte[] bytes = serialize(mapping);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            if (Files.size(tempPath) != bytes.length) {
                throw new IOException("Verification failed: size mismatch");
            }

            try {
                Files.move(tempPath, storePath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Credentials] Atomic move not supported, using regular move");
                Files.move(tempPath, storePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Credentials] Failed to cleanup temp file: {}", tempPath);
            }
            throw new CredentialStoreException("Failed to persist credential store: " + storePath, e);
        }
    }

    private byte[] serialize(Map<String, String> mapping) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(mapping);
    }

    private <T> T withReadLock(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T withWriteLock(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Credential " + name + " must not be blank");
        }
    }
}
