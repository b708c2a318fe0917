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

package me.golemcore.gateway.adapter.outbound.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.SecretProtector;
import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.encrypt.Encryptors;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * {@link SecretProtector} using AES-256-GCM through Spring Security Crypto's
 * {@link Encryptors#delux(CharSequence, CharSequence)}.
 *
 * <p>
 * The password and salt are generated once per user and kept in a JSON key
 * file readable only by its owner ({@code rw-------} where the file system
 * supports POSIX permissions). Losing the key file makes stored secrets
 * unreadable.
 */
@Component
@Slf4j
public class AesGcmSecretProtector implements SecretProtector {

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Path keyPath;
    private volatile TextEncryptor encryptor;

    public AesGcmSecretProtector(GatewayProperties properties) {
        this(GatewayProperties.expandPath(properties.getCredentials().getKeyPath()));
    }

    AesGcmSecretProtector(Path keyPath) {
        this.keyPath = keyPath;
    }

    @Override
    public String protect(String plainText) {
        return encryptor().encrypt(plainText);
    }

    @Override
    public String unprotect(String protectedText) {
        try {
            return encryptor().decrypt(protectedText);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IllegalStateException("Secret cannot be decrypted with the current key", e);
        }
    }

    private TextEncryptor encryptor() {
        TextEncryptor current = encryptor;
        if (current == null) {
            synchronized (this) {
                current = encryptor;
                if (current == null) {
                    KeyMaterial key = loadOrCreateKey();
                    current = Encryptors.delux(key.password(), key.salt());
                    encryptor = current;
                }
            }
        }
        return current;
    }

    private KeyMaterial loadOrCreateKey() {
        try {
            if (Files.exists(keyPath)) {
                return readKey();
            }
            KeyMaterial key = new KeyMaterial(
                    new String(Hex.encode(KeyGenerators.secureRandom(32).generateKey())),
                    KeyGenerators.string().generateKey());
            writeOwnerOnly(objectMapper.writeValueAsBytes(key));
            log.info("[Credentials] Generated new key file: {}", keyPath);
            return key;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load credential key: " + keyPath, e);
        }
    }

    private KeyMaterial readKey() throws IOException {
        return objectMapper.readValue(keyPath.toFile(), KeyMaterial.class);
    }

    /**
     * Writes the key to a temp file, verifies it, then moves it into place so
     * the key path never holds a partial key.
     */
    private void writeOwnerOnly(byte[] content) throws IOException {
        Path parent = keyPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempPath = keyPath.resolveSibling(keyPath.getFileName() + ".tmp");
        Files.deleteIfExists(tempPath);
        boolean posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
        try {
            if (posix) {
                Files.createFile(tempPath, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
            } else {
                Files.createFile(tempPath);
                log.debug("[Credentials] POSIX permissions unsupported; key file relies on directory ACLs");
            }
            try (FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                channel.write(ByteBuffer.wrap(content));
                channel.force(true);
            }
            if (Files.size(tempPath) != content.length) {
                throw new IOException("Verification failed: size mismatch");
            }

            try {
                Files.move(tempPath, keyPath, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Credentials] Atomic move not supported, using regular move");
                Files.move(tempPath, keyPath);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Credentials] Failed to cleanup temp key file: {}", tempPath);
            }
            throw e;
        }
    }

    record KeyMaterial(String password, String salt) {
        @Override
        public String toString() {
            return "KeyMaterial[redacted]";
        }
    }
}
