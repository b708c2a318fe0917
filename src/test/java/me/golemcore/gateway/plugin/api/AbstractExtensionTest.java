package me.golemcore.gateway.plugin.api;

import me.golemcore.gateway.domain.component.ToolComponent;
import me.golemcore.gateway.domain.model.ToolDefinition;
import me.golemcore.gateway.domain.model.ToolExecutionContext;
import me.golemcore.gateway.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AbstractExtensionTest {

    @Test
    void shouldCollectToolsOnEachInitialization() {
        CountingExtension extension = new CountingExtension();
        ExtensionContext context = mock(ExtensionContext.class);

        extension.initialize(context);
        extension.initialize(context);

        assertEquals(2, extension.initializations.get());
        assertEquals(1, extension.tools().size());
        assertSame(context, extension.context());
    }

    @Test
    void shouldDropToolsOnShutdown() {
        CountingExtension extension = new CountingExtension();
        extension.initialize(mock(ExtensionContext.class));

        extension.shutdown();

        assertTrue(extension.tools().isEmpty());
        assertEquals("counting", extension.name());
        assertEquals("3.0.0", extension.version());
    }

    @Test
    void shouldExposeImmutableToolList() {
        CountingExtension extension = new CountingExtension();
        extension.initialize(mock(ExtensionContext.class));

        assertThrows(UnsupportedOperationException.class, () -> extension.tools().clear());
    }

    private static final class CountingExtension extends AbstractExtension {

        private final AtomicInteger initializations = new AtomicInteger();

        private CountingExtension() {
            super("counting", "3.0.0");
        }

        @Override
        protected void onInitialize(ExtensionContext context) {
            initializations.incrementAndGet();
            addTool(new ToolComponent() {
                @Override
                public ToolDefinition getDefinition() {
                    return ToolDefinition.simple("count", "Count");
                }

                @Override
                public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
                        ToolExecutionContext executionContext) {
                    return CompletableFuture.completedFuture(ToolResult.success(
                            String.valueOf(initializations.get())));
                }
            });
        }
    }
}
