package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.adapter.inbound.web.dto.ExtensionDto;
import me.golemcore.gateway.adapter.inbound.web.dto.ExtensionEnableRequest;
import me.golemcore.gateway.domain.model.ExtensionDescriptor;
import me.golemcore.gateway.plugin.context.ExtensionRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExtensionsControllerTest {

    private static final String WEATHER = "weather";

    private ExtensionRegistryService extensionRegistry;
    private ExtensionsController controller;
    private ExtensionDescriptor descriptor;

    @BeforeEach
    void setUp() {
        extensionRegistry = mock(ExtensionRegistryService.class);
        controller = new ExtensionsController(extensionRegistry);
        descriptor = ExtensionDescriptor.builder()
                .name(WEATHER)
                .version("1.2.0")
                .originPath("/opt/extensions/weather.jar")
                .enabled(true)
                .installedAt(Instant.parse("2026-01-10T10:00:00Z"))
                .toolNames(List.of("extension_weather_forecast"))
                .build();
    }

    @Test
    void shouldListExtensions() {
        when(extensionRegistry.getLoaded()).thenReturn(List.of(descriptor));

        StepVerifier.create(controller.getExtensions())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    ExtensionDto dto = response.getBody().get(0);
                    assertEquals(WEATHER, dto.getName());
                    assertEquals("2026-01-10T10:00:00Z", dto.getInstalledAt());
                    assertNull(dto.getLastUsedAt());
                    assertEquals(List.of("extension_weather_forecast"), dto.getTools());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnSingleExtension() {
        when(extensionRegistry.find(WEATHER)).thenReturn(Optional.of(descriptor));

        StepVerifier.create(controller.getExtension(WEATHER))
                .assertNext(response -> assertEquals("1.2.0", response.getBody().getVersion()))
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownExtension() {
        when(extensionRegistry.find("ghost")).thenReturn(Optional.empty());

        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.getExtension("ghost"));

        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
    }

    @Test
    void shouldDisableExtension() {
        when(extensionRegistry.setEnabled(WEATHER, false)).thenReturn(true);
        when(extensionRegistry.find(WEATHER)).thenReturn(Optional.of(descriptor.toBuilder().enabled(false).build()));

        StepVerifier.create(controller.setEnabled(WEATHER, new ExtensionEnableRequest(false)))
                .assertNext(response -> assertFalse(response.getBody().isEnabled()))
                .verifyComplete();
    }

    @Test
    void shouldRejectEnablingUnknownExtension() {
        when(extensionRegistry.setEnabled("ghost", true)).thenReturn(false);

        assertThrows(ResponseStatusException.class,
                () -> controller.setEnabled("ghost", new ExtensionEnableRequest(true)));
    }

    @Test
    void shouldReloadExtensions() {
        when(extensionRegistry.getLoaded()).thenReturn(List.of(descriptor));

        StepVerifier.create(controller.reload())
                .assertNext(response -> assertEquals(1, response.getBody().size()))
                .verifyComplete();

        verify(extensionRegistry).reload();
    }
}
