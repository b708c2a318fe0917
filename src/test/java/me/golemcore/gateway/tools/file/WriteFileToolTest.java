package me.golemcore.gateway.tools.file;

import me.golemcore.gateway.domain.model.CancellationToken;
import me.golemcore.gateway.domain.model.SecurityDecision;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolFailureKind;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.security.FileAccessPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WriteFileToolTest {

    private static final String PATH = "path";
    private static final String CONTENT = "content";

    @TempDir
    Path tempDir;

    private WriteFileTool tool;
    private ToolExecutionContext context;

    @BeforeEach
    void setUp() {
        tool = new WriteFileTool(new FileAccessPolicy());
        context = ToolExecutionContext.of("write_file", Duration.ofSeconds(5));
    }

    @Test
    void shouldWriteFileAndCreateParents() throws Exception {
        Path file = tempDir.resolve("nested/dir/hello.txt");

        ToolResult result = tool.execute(Map.of(PATH, file.toString(), CONTENT, "Привет"), context).get();

        assertTrue(result.isSuccess());
        assertEquals("File written successfully: " + file, result.getOutput());
        assertEquals("Привет", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void shouldOverwriteExistingFile() throws Exception {
        Path file = tempDir.resolve("data.txt");
        Files.writeString(file, "old");

        tool.execute(Map.of(PATH, file.toString(), CONTENT, "new"), context).get();

        assertEquals("new", Files.readString(file));
    }

    @Test
    void shouldDenySystemPath() {
        SecurityDecision decision = tool.checkAccess(Map.of(PATH, "/etc/hosts", CONTENT, "x"));

        assertTrue(decision.denied());
    }

    @Test
    void shouldAllowOrdinaryPath() {
        assertTrue(tool.checkAccess(Map.of(PATH, tempDir.resolve("a.txt").toString(), CONTENT, "x")).allowed());
    }

    @Test
    void shouldReturnCancelledWhenCallAlreadyCancelled() throws Exception {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        ToolExecutionContext cancelled = new ToolExecutionContext("write_file", token, Duration.ofSeconds(5),
                Clock.systemUTC());
        Path file = tempDir.resolve("never.txt");

        ToolResult result = tool.execute(Map.of(PATH, file.toString(), CONTENT, "x"), cancelled).get();

        assertEquals(ToolFailureKind.CANCELLED, result.getFailureKind());
        assertFalse(Files.exists(file));
    }

    @Test
    void shouldReportWriteFailure() throws Exception {
        Path directory = Files.createDirectory(tempDir.resolve("occupied"));

        ToolResult result = tool.execute(Map.of(PATH, directory.toString(), CONTENT, "x"), context).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.getError().startsWith("Failed to write file"));
    }
}
