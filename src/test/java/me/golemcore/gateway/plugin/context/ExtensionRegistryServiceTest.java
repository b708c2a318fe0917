package me.golemcore.gateway.plugin.context;

import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.ExtensionDescriptor;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.plugin.api.AbstractExtension;
import me.golemcore.gateway.plugin.api.ExtensionContext;
import me.golemcore.gateway.plugin.api.GatewayExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ExtensionRegistryServiceTest {

    private static final String GREETING = "greeting";
    private static final String HELLO_TOOL = "extension_greeting_hello";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private Path extensionsDir;
    private ExtensionRegistryService registry;

    @BeforeEach
    void setUp() {
        extensionsDir = tempDir.resolve("extensions");
        registry = new ExtensionRegistryService(new ExtensionJarLoader(), mock(ExtensionContext.class),
                extensionsDir, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    void shouldCreateMissingDirectoryAndLoadNothing() {
        assertEquals(0, registry.load());
        assertTrue(Files.isDirectory(extensionsDir));
        assertTrue(registry.getLoaded().isEmpty());
    }

    @Test
    void shouldLoadExtensionFromJar() throws Exception {
        Path jar = jar("greeting.jar", GreetingExtension.class.getName());
        Instant modified = Instant.parse("2026-02-01T08:30:00Z");
        Files.setLastModifiedTime(jar, FileTime.from(modified));

        assertEquals(1, registry.load());

        ExtensionDescriptor descriptor = registry.find(GREETING).orElseThrow();
        assertEquals("1.0.0", descriptor.getVersion());
        assertEquals(jar.toString(), descriptor.getOriginPath());
        assertTrue(descriptor.isEnabled());
        assertEquals(modified, descriptor.getInstalledAt());
        assertNull(descriptor.getLastUsedAt());
        assertEquals(List.of(HELLO_TOOL), descriptor.getToolNames());
    }

    @Test
    void shouldExposeNamespacedTools() throws Exception {
        jar("greeting.jar", GreetingExtension.class.getName());
        registry.load();

        Optional<ToolComponent> tool = registry.findTool(HELLO_TOOL);

        assertTrue(tool.isPresent());
        ToolResult result = tool.get().execute(Map.of("name", "Ada"),
                ToolExecutionContext.of(HELLO_TOOL, Duration.ofSeconds(5))).get();
        assertEquals("Hello, Ada!", result.getOutput());
        assertTrue(registry.findTool("hello").isEmpty());
        assertEquals(List.of(HELLO_TOOL), List.copyOf(registry.getEnabledTools().keySet()));
    }

    @Test
    void shouldHideToolsOfDisabledExtensionOnly() throws Exception {
        jar("greeting.jar", GreetingExtension.class.getName());
        registry.load();
        assertTrue(registry.register(new EchoExtension()));

        assertTrue(registry.setEnabled(GREETING, false));

        assertTrue(registry.findTool(HELLO_TOOL).isEmpty());
        assertTrue(registry.findTool("extension_echo_echo").isPresent());
        assertEquals(List.of("extension_echo_echo"), List.copyOf(registry.getEnabledTools().keySet()));
        assertFalse(registry.find(GREETING).orElseThrow().isEnabled());

        assertTrue(registry.setEnabled(GREETING, true));
        assertTrue(registry.findTool(HELLO_TOOL).isPresent());
        assertFalse(registry.setEnabled("unknown", true));
    }

    @Test
    void shouldSkipGarbageJarAndLoadTheRest() throws Exception {
        Files.createDirectories(extensionsDir);
        Files.write(extensionsDir.resolve("a-corrupt.jar"), new byte[] { 1, 2, 3, 4, 5 });
        jar("b-greeting.jar", GreetingExtension.class.getName());

        assertEquals(1, registry.load());
        assertEquals(List.of(GREETING), names());
    }

    @Test
    void shouldSkipUnknownProviderClass() throws Exception {
        jar("mixed.jar", GreetingExtension.class.getName(), "com.example.DoesNotExist");

        assertEquals(1, registry.load());
        assertTrue(registry.find(GREETING).isPresent());
    }

    @Test
    void shouldRejectExtensionFailingToInitialize() throws Exception {
        jar("broken.jar", BrokenExtension.class.getName());
        jar("greeting.jar", GreetingExtension.class.getName());

        assertEquals(1, registry.load());
        assertTrue(registry.find("broken").isEmpty());
    }

    @Test
    void shouldRejectDuplicateExtensionNames() throws Exception {
        jar("first.jar", GreetingExtension.class.getName());
        jar("second.jar", GreetingExtension.class.getName());

        assertEquals(1, registry.load());
        assertEquals(extensionsDir.resolve("first.jar").toString(),
                registry.find(GREETING).orElseThrow().getOriginPath());
    }

    @Test
    void shouldIgnoreFilesThatAreNotJars() throws Exception {
        Files.createDirectories(extensionsDir);
        Files.writeString(extensionsDir.resolve("README.txt"), "not an extension");

        assertEquals(0, registry.load());
    }

    @Test
    void shouldNotLoadTwiceWithoutReload() throws Exception {
        jar("greeting.jar", GreetingExtension.class.getName());

        assertEquals(1, registry.load());
        assertEquals(0, registry.load());
        assertEquals(1, registry.getLoaded().size());
    }

    @Test
    void shouldReloadFromDirectory() throws Exception {
        registry.load();
        assertTrue(registry.register(new EchoExtension()));
        jar("greeting.jar", GreetingExtension.class.getName());

        assertEquals(1, registry.reload());

        assertEquals(List.of(GREETING), names());
    }

    @Test
    void shouldRegisterAndUnregisterProgrammatically() {
        EchoExtension echo = new EchoExtension();

        assertTrue(registry.register(echo));
        assertFalse(registry.register(new EchoExtension()));
        assertEquals(ExtensionRegistryService.REGISTERED_ORIGIN, registry.find("echo").orElseThrow().getOriginPath());
        assertEquals(NOW, registry.find("echo").orElseThrow().getInstalledAt());

        assertTrue(registry.unregister("echo"));
        assertTrue(echo.shutDown);
        assertFalse(registry.unregister("echo"));
        assertTrue(registry.findTool("extension_echo_echo").isEmpty());
    }

    @Test
    void shouldRecordLastUse() {
        registry.register(new EchoExtension());

        registry.markUsed("extension_echo_echo");

        assertEquals(NOW, registry.find("echo").orElseThrow().getLastUsedAt());
    }

    @Test
    void shouldRejectExtensionWhoseNamespacedToolIsTaken() {
        SingleToolExtension first = new SingleToolExtension("a", "b_c");
        SingleToolExtension second = new SingleToolExtension("a_b", "c");
        SingleToolExtension third = new SingleToolExtension("A B", "c");

        assertTrue(registry.register(first));
        assertFalse(registry.register(second));
        assertFalse(registry.register(third));

        assertEquals(List.of("a"), names());
        assertTrue(second.shutDown);
        assertTrue(third.shutDown);
        assertEquals("from-a", registry.getEnabledTools().get("extension_a_b_c").getDefinition().getDescription());
        assertEquals("from-a", registry.findTool("extension_a_b_c").orElseThrow().getDefinition().getDescription());
    }

    @Test
    void shouldAcceptExtensionOnceClashingOwnerIsUnregistered() {
        assertTrue(registry.register(new SingleToolExtension("a", "b_c")));
        assertTrue(registry.unregister("a"));

        assertTrue(registry.register(new SingleToolExtension("a_b", "c")));
        assertEquals("from-a_b", registry.findTool("extension_a_b_c").orElseThrow().getDefinition().getDescription());
    }

    @Test
    void shouldNamespaceToolNames() {
        assertEquals("extension_my_ext_v2_search", ExtensionRegistryService.toolName("My Ext.v2", "search"));
        assertEquals("extension_greeting_hello", ExtensionRegistryService.toolName("Greeting", "hello"));
    }

    private List<String> names() {
        return registry.getLoaded().stream().map(ExtensionDescriptor::getName).toList();
    }

    private Path jar(String fileName, String... providers) throws IOException {
        Files.createDirectories(extensionsDir);
        Path jar = extensionsDir.resolve(fileName);
        try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
            out.putNextEntry(new JarEntry("META-INF/services/" + GatewayExtension.class.getName()));
            out.write(String.join("\n", providers).getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
        }
        return jar;
    }

    private static final class EchoExtension extends AbstractExtension {

        private boolean shutDown;

        private EchoExtension() {
            super("echo", "2.1.0");
        }

        @Override
        protected void onInitialize(ExtensionContext context) {
            addTool(new ToolComponent() {
                @Override
                public ToolDefinition getDefinition() {
                    return ToolDefinition.simple("echo", "Echo");
                }

                @Override
                public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
                        ToolExecutionContext executionContext) {
                    return CompletableFuture.completedFuture(ToolResult.success(String.valueOf(parameters)));
                }
            });
        }

        @Override
        public void shutdown() {
            shutDown = true;
            super.shutdown();
        }
    }

    private static final class SingleToolExtension extends AbstractExtension {

        private final String toolName;
        private boolean shutDown;

        private SingleToolExtension(String name, String toolName) {
            super(name, "1.0.0");
            this.toolName = toolName;
        }

        @Override
        protected void onInitialize(ExtensionContext context) {
            String description = "from-" + name();
            addTool(new ToolComponent() {
                @Override
                public ToolDefinition getDefinition() {
                    return ToolDefinition.simple(toolName, description);
                }

                @Override
                public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
                        ToolExecutionContext executionContext) {
                    return CompletableFuture.completedFuture(ToolResult.success(description));
                }
            });
        }

        @Override
        public void shutdown() {
            shutDown = true;
            super.shutdown();
        }
    }
}
