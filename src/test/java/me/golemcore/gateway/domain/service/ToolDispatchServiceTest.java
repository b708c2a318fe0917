package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.CancellationToken;
import me.golemcore.gateway.domain.model.SecurityDecision;
import me.golemcore.gateway.domain.model.ToolCallRequest;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolFailureKind;
import me.golemcore.gateway.domain.model.ToolResult;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.plugin.context.ExtensionRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolDispatchServiceTest {

    private static final String ECHO = "echo";
    private static final String TEXT = "text";
    private static final long WAIT_SECONDS = 5;

    private ExtensionRegistryService extensionRegistry;
    private GatewayProperties properties;
    private AtomicInteger executions;

    @BeforeEach
    void setUp() {
        extensionRegistry = mock(ExtensionRegistryService.class);
        properties = new GatewayProperties();
        properties.getTools().setDefaultTimeout(Duration.ofSeconds(30));
        properties.getTools().setMaxTimeout(Duration.ofSeconds(300));
        executions = new AtomicInteger();
    }

    @Test
    void shouldExecuteKnownTool() throws Exception {
        ToolDispatchService dispatcher = dispatcher(echoTool());

        ToolResult result = dispatcher.execute(ECHO, Map.of(TEXT, "hi"), null, null)
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals("hi", result.getOutput());
        assertNotNull(result.getDuration());
    }

    @Test
    void shouldExecuteFromCallRequest() throws Exception {
        ToolDispatchService dispatcher = dispatcher(echoTool());
        ToolCallRequest request = ToolCallRequest.builder()
                .toolName(ECHO)
                .arguments(Map.of(TEXT, "request"))
                .build();

        ToolResult result = dispatcher.execute(request, CancellationToken.none()).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals("request", result.getOutput());
    }

    @Test
    void shouldReportUnknownTool() throws Exception {
        ToolDispatchService dispatcher = dispatcher(echoTool());

        ToolResult result = dispatcher.execute("missing_tool", Map.of(), null, null).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.NOT_FOUND, result.getFailureKind());
        assertEquals("Tool not found: missing_tool", result.getError());
    }

    @Test
    void shouldRejectMissingArgumentWithoutExecuting() throws Exception {
        ToolDispatchService dispatcher = dispatcher(echoTool());

        ToolResult result = dispatcher.execute(ECHO, Map.of(), null, null).get();

        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
        assertEquals("Missing required parameter: text", result.getError());
        assertEquals(0, executions.get());
    }

    @Test
    void shouldRejectWrongArgumentType() throws Exception {
        ToolDispatchService dispatcher = dispatcher(echoTool());

        ToolResult result = dispatcher.execute(ECHO, Map.of(TEXT, 12), null, null).get();

        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
        assertEquals(0, executions.get());
    }

    @Test
    void shouldReturnPolicyDenialVerbatimWithoutExecuting() throws Exception {
        ToolComponent guarded = new StubTool(ECHO, args -> SecurityDecision.deny("Not on my watch"),
                (args, context) -> CompletableFuture.completedFuture(ToolResult.success("ran")));
        ToolDispatchService dispatcher = dispatcher(guarded);

        ToolResult result = dispatcher.execute(ECHO, Map.of(TEXT, "x"), null, null).get();

        assertEquals(ToolFailureKind.POLICY_DENIED, result.getFailureKind());
        assertEquals("Not on my watch", result.getError());
        assertEquals(0, executions.get());
    }

    @Test
    void shouldReportFailingAccessCheck() throws Exception {
        ToolComponent broken = new StubTool(ECHO, args -> {
            throw new IllegalStateException("policy offline");
        }, (args, context) -> CompletableFuture.completedFuture(ToolResult.success("ran")));
        ToolDispatchService dispatcher = dispatcher(broken);

        ToolResult result = dispatcher.execute(ECHO, Map.of(TEXT, "x"), null, null).get();

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Access check failed: policy offline", result.getError());
    }

    @Test
    void shouldReportTimeoutWhenToolNeverCompletes() throws Exception {
        ToolDispatchService dispatcher = dispatcher(hangingTool(new AtomicReference<>()));

        ToolResult result = dispatcher.execute(ECHO, Map.of(TEXT, "x"), Duration.ofMillis(100), null)
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(result.isTimedOut());
        assertFalse(result.isCancelled());
        assertEquals(ToolFailureKind.TIMED_OUT, result.getFailureKind());
    }

    @Test
    void shouldReportCancellationDistinctFromTimeout() throws Exception {
        AtomicReference<ToolExecutionContext> seen = new AtomicReference<>();
        ToolDispatchService dispatcher = dispatcher(hangingTool(seen));
        CancellationToken token = CancellationToken.create();

        CompletableFuture<ToolResult> future = dispatcher.execute(ECHO, Map.of(TEXT, "x"), null, token);
        token.cancel();
        ToolResult result = future.get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(result.isCancelled());
        assertFalse(result.isTimedOut());
        assertTrue(seen.get().isCancelled());
    }

    @Test
    void shouldReleaseCancelListenerWhenCallFinishes() throws Exception {
        ToolDispatchService dispatcher = dispatcher(echoTool());
        CancellationToken sessionToken = mock(CancellationToken.class);
        CancellationToken.Registration registration = mock(CancellationToken.Registration.class);
        when(sessionToken.onCancel(any())).thenReturn(registration);

        for (int i = 0; i < 3; i++) {
            assertTrue(dispatcher.execute(ECHO, Map.of(TEXT, "x"), null, sessionToken)
                    .get(WAIT_SECONDS, TimeUnit.SECONDS).isSuccess());
        }

        verify(registration, times(3)).unregister();
    }

    @Test
    void shouldNotRunToolWhenAlreadyCancelled() throws Exception {
        ToolDispatchService dispatcher = dispatcher(echoTool());
        CancellationToken token = CancellationToken.create();
        token.cancel();

        ToolResult result = dispatcher.execute(ECHO, Map.of(TEXT, "x"), null, token).get();

        assertTrue(result.isCancelled());
        assertEquals(0, executions.get());
    }

    @Test
    void shouldConvertThrownExceptionToFailure() throws Exception {
        ToolComponent throwing = new StubTool(ECHO, args -> SecurityDecision.allow(), (args, context) -> {
            throw new IllegalArgumentException("boom");
        });
        ToolDispatchService dispatcher = dispatcher(throwing);

        ToolResult result = dispatcher.execute(ECHO, Map.of(TEXT, "x"), null, null).get();

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Tool execution failed: boom", result.getError());
    }

    @Test
    void shouldReportRootCauseOfFailedFuture() throws Exception {
        ToolComponent failing = new StubTool(ECHO, args -> SecurityDecision.allow(),
                (args, context) -> CompletableFuture.failedFuture(
                        new CompletionException(new IOException("disk unplugged"))));
        ToolDispatchService dispatcher = dispatcher(failing);

        ToolResult result = dispatcher.execute(ECHO, Map.of(TEXT, "x"), null, null).get();

        assertEquals("Tool execution failed: disk unplugged", result.getError());
    }

    @Test
    void shouldReportNullResult() throws Exception {
        ToolComponent empty = new StubTool(ECHO, args -> SecurityDecision.allow(), (args, context) -> null);
        ToolDispatchService dispatcher = dispatcher(empty);

        ToolResult result = dispatcher.execute(ECHO, Map.of(TEXT, "x"), null, null).get();

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Tool returned no result", result.getError());
    }

    @Test
    void shouldDenyDisabledBuiltinTool() throws Exception {
        StubTool disabled = echoTool();
        disabled.enabled = false;
        ToolDispatchService dispatcher = dispatcher(disabled);

        ToolResult result = dispatcher.execute(ECHO, Map.of(TEXT, "x"), null, null).get();

        assertEquals(ToolFailureKind.POLICY_DENIED, result.getFailureKind());
        assertEquals("Tool is disabled: echo", result.getError());
        assertFalse(dispatcher.getAvailableTools().stream().anyMatch(d -> ECHO.equals(d.getName())));
    }

    @Test
    void shouldSanitizeLeakedTokensInToolName() throws Exception {
        ToolDispatchService dispatcher = dispatcher(echoTool());

        ToolResult result = dispatcher.execute("echo<|channel|>commentary", Map.of(TEXT, "ok"), null, null).get();

        assertTrue(result.isSuccess());
        assertEquals("ok", result.getOutput());
    }

    @Test
    void shouldDispatchExtensionToolAndMarkItUsed() throws Exception {
        String name = "extension_demo_echo";
        when(extensionRegistry.findTool(name)).thenReturn(Optional.of(echoTool()));
        ToolDispatchService dispatcher = dispatcher();

        ToolResult result = dispatcher.execute(name, Map.of(TEXT, "from extension"), null, null).get();

        assertTrue(result.isSuccess());
        verify(extensionRegistry).markUsed(name);
    }

    @Test
    void shouldNotMarkRejectedExtensionCall() throws Exception {
        String name = "extension_demo_echo";
        when(extensionRegistry.findTool(name)).thenReturn(Optional.of(echoTool()));
        ToolDispatchService dispatcher = dispatcher();

        dispatcher.execute(name, Map.of(), null, null).get();

        verify(extensionRegistry, never()).markUsed(name);
    }

    @Test
    void shouldListBuiltinAndExtensionTools() {
        when(extensionRegistry.getEnabledTools()).thenReturn(Map.of("extension_demo_echo", echoTool()));
        ToolDispatchService dispatcher = dispatcher(new StubTool("other", args -> SecurityDecision.allow(),
                (args, context) -> CompletableFuture.completedFuture(ToolResult.success(""))));

        List<ToolDefinition> tools = dispatcher.getAvailableTools();

        assertEquals(List.of("other", "extension_demo_echo"), tools.stream().map(ToolDefinition::getName).toList());
        assertEquals("Echo text back", tools.get(1).getDescription());
    }

    @Test
    void shouldRejectDuplicateBuiltinNames() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> dispatcher(echoTool(), echoTool()));

        assertEquals("Duplicate tool name: echo", error.getMessage());
    }

    @Test
    void shouldRejectBuiltinUsingExtensionPrefix() {
        StubTool impostor = new StubTool("extension_fake", args -> SecurityDecision.allow(),
                (args, context) -> CompletableFuture.completedFuture(ToolResult.success("")));

        assertThrows(IllegalStateException.class, () -> dispatcher(impostor));
    }

    @Test
    void shouldClampTimeouts() {
        ToolDispatchService dispatcher = dispatcher();

        assertEquals(Duration.ofSeconds(30), dispatcher.effectiveTimeout(null));
        assertEquals(Duration.ofSeconds(30), dispatcher.effectiveTimeout(Duration.ZERO));
        assertEquals(Duration.ofSeconds(30), dispatcher.effectiveTimeout(Duration.ofSeconds(-5)));
        assertEquals(Duration.ofSeconds(10), dispatcher.effectiveTimeout(Duration.ofSeconds(10)));
        assertEquals(Duration.ofSeconds(300), dispatcher.effectiveTimeout(Duration.ofHours(1)));
    }

    @Test
    void shouldSanitizeToolNames() {
        assertEquals("read_file", ToolDispatchService.sanitizeToolName("  read_file  "));
        assertEquals("list_directory", ToolDispatchService.sanitizeToolName("list_directory<|channel|>"));
        assertEquals("", ToolDispatchService.sanitizeToolName("<|x|>"));
        assertNull(ToolDispatchService.sanitizeToolName(null));
    }

    private ToolDispatchService dispatcher(ToolComponent... tools) {
        return new ToolDispatchService(List.of(tools), extensionRegistry, new ToolArgumentValidator(), properties,
                Clock.systemUTC());
    }

    private StubTool echoTool() {
        return new StubTool(ECHO, args -> SecurityDecision.allow(),
                (args, context) -> CompletableFuture.completedFuture(ToolResult.success((String) args.get(TEXT))));
    }

    private StubTool hangingTool(AtomicReference<ToolExecutionContext> seen) {
        return new StubTool(ECHO, args -> SecurityDecision.allow(), (args, context) -> {
            seen.set(context);
            return new CompletableFuture<>();
        });
    }

    private final class StubTool implements ToolComponent {

        private final String name;
        private final Function<Map<String, Object>, SecurityDecision> access;
        private final BiFunction<Map<String, Object>, ToolExecutionContext, CompletableFuture<ToolResult>> body;
        private boolean enabled = true;

        private StubTool(String name, Function<Map<String, Object>, SecurityDecision> access,
                BiFunction<Map<String, Object>, ToolExecutionContext, CompletableFuture<ToolResult>> body) {
            this.name = name;
            this.access = access;
            this.body = body;
        }

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder()
                    .name(name)
                    .description("Echo text back")
                    .inputSchema(Map.of(
                            "type", "object",
                            "properties", Map.of(TEXT, Map.of("type", "string")),
                            "required", List.of(TEXT)))
                    .build();
        }

        @Override
        public SecurityDecision checkAccess(Map<String, Object> parameters) {
            return access.apply(parameters);
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
            executions.incrementAndGet();
            return body.apply(parameters, context);
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }
    }
}
