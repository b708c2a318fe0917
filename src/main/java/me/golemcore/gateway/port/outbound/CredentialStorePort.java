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

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent secret storage. Keys and values must be non-blank.
 * Mutations replace the backing file as a whole, so a crash leaves either the
 * old or the new mapping.
 */
public interface CredentialStorePort {

    /**
     * Store or overwrite a secret.
     */
    CompletableFuture<Void> store(String key, String value);

    /**
     * Read a secret; empty when the key is absent.
     */
    CompletableFuture<Optional<String>> retrieve(String key);

    /**
     * Delete a secret.
     *
     * @return whether the key was present
     */
    CompletableFuture<Boolean> delete(String key);

    CompletableFuture<List<String>> listKeys();

    /**
     * Remove every secret and the backing file.
     */
    CompletableFuture<Void> clear();
}
