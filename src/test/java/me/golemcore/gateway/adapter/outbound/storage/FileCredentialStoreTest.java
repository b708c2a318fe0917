package me.golemcore.gateway.adapter.outbound.storage;

import me.golemcore.gateway.port.outbound.CredentialStoreException;
import me.golemcore.gateway.port.outbound.SecretProtector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FileCredentialStoreTest {

    private static final String API_KEY = "weather.api_key";
    private static final String SECRET = "s3cr3t-value";

    @TempDir
    Path tempDir;

    private Path storePath;
    private FileCredentialStore store;

    @BeforeEach
    void setUp() {
        storePath = tempDir.resolve("credentials.json");
        store = new FileCredentialStore(storePath, new ReversingProtector());
    }

    @Test
    void shouldStoreAndRetrieveSecret() throws Exception {
        store.store(API_KEY, SECRET).get();

        assertEquals(Optional.of(SECRET), store.retrieve(API_KEY).get());
    }

    @Test
    void shouldNeverWritePlainText() throws Exception {
        store.store(API_KEY, SECRET).get();

        String onDisk = Files.readString(storePath);
        assertTrue(onDisk.contains(API_KEY));
        assertFalse(onDisk.contains(SECRET));
    }

    @Test
    void shouldOverwriteExistingSecret() throws Exception {
        store.store(API_KEY, "first").get();
        store.store(API_KEY, "second").get();

        assertEquals(Optional.of("second"), store.retrieve(API_KEY).get());
        assertEquals(List.of(API_KEY), store.listKeys().get());
    }

    @Test
    void shouldReturnEmptyForUnknownKey() throws Exception {
        assertEquals(Optional.empty(), store.retrieve("missing").get());
    }

    @Test
    void shouldDeleteSecret() throws Exception {
        store.store(API_KEY, SECRET).get();

        assertTrue(store.delete(API_KEY).get());
        assertFalse(store.delete(API_KEY).get());
        assertEquals(Optional.empty(), store.retrieve(API_KEY).get());
    }

    @Test
    void shouldListKeysSorted() throws Exception {
        store.store("zeta", "1").get();
        store.store("alpha", "2").get();

        assertEquals(List.of("alpha", "zeta"), store.listKeys().get());
    }

    @Test
    void shouldClearStore() throws Exception {
        store.store(API_KEY, SECRET).get();

        store.clear().get();

        assertFalse(Files.exists(storePath));
        assertTrue(store.listKeys().get().isEmpty());
    }

    @Test
    void shouldPersistAcrossInstances() throws Exception {
        store.store(API_KEY, SECRET).get();

        FileCredentialStore reopened = new FileCredentialStore(storePath, new ReversingProtector());

        assertEquals(Optional.of(SECRET), reopened.retrieve(API_KEY).get());
    }

    @Test
    void shouldLeaveNoTemporaryFileBehind() throws Exception {
        store.store(API_KEY, SECRET).get();

        assertFalse(Files.exists(tempDir.resolve("credentials.json.tmp")));
    }

    @Test
    void shouldIgnoreStaleTemporaryFile() throws Exception {
        store.store(API_KEY, SECRET).get();
        Files.writeString(tempDir.resolve("credentials.json.tmp"), "{\"half\":");

        assertEquals(Optional.of(SECRET), store.retrieve(API_KEY).get());
        store.store("other", "x").get();
        assertEquals(List.of("other", API_KEY), store.listKeys().get());
    }

    @Test
    void shouldTreatCorruptFileAsEmpty() throws Exception {
        Files.writeString(storePath, "this is not json");

        assertTrue(store.listKeys().get().isEmpty());
        store.store(API_KEY, SECRET).get();
        assertEquals(Optional.of(SECRET), store.retrieve(API_KEY).get());
    }

    @Test
    void shouldRejectBlankKeyOrValue() {
        assertThrows(IllegalArgumentException.class, () -> store.store(" ", SECRET));
        assertThrows(IllegalArgumentException.class, () -> store.store(API_KEY, ""));
        assertThrows(IllegalArgumentException.class, () -> store.retrieve(null));
    }

    @Test
    void shouldFailWhenSecretCannotBeDecrypted() throws Exception {
        store.store(API_KEY, SECRET).get();
        SecretProtector wrongKey = mock(SecretProtector.class);
        when(wrongKey.unprotect(anyString())).thenThrow(new IllegalStateException("bad tag"));
        FileCredentialStore reopened = new FileCredentialStore(storePath, wrongKey);

        CompletableFuture<Optional<String>> retrieval = reopened.retrieve(API_KEY);

        ExecutionException error = assertThrows(ExecutionException.class, retrieval::get);
        assertInstanceOf(CredentialStoreException.class, error.getCause());
    }

    @Test
    void shouldFailWhenStoreLocationIsUnwritable() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");
        FileCredentialStore broken = new FileCredentialStore(blocker.resolve("credentials.json"),
                new ReversingProtector());

        ExecutionException error = assertThrows(ExecutionException.class, () -> broken.store(API_KEY, SECRET).get());

        assertInstanceOf(CredentialStoreException.class, error.getCause());
    }

    private static final class ReversingProtector implements SecretProtector {

        @Override
        public String protect(String plainText) {
            return "enc:" + new StringBuilder(plainText).reverse();
        }

        @Override
        public String unprotect(String protectedText) {
            return new StringBuilder(protectedText.substring("enc:".length())).reverse().toString();
        }
    }
}
