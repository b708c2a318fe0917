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

package me.golemcore.gateway.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.dto.ExtensionDto;
import me.golemcore.gateway.adapter.inbound.web.dto.ExtensionEnableRequest;
import me.golemcore.gateway.domain.model.ExtensionDescriptor;
import me.golemcore.gateway.plugin.context.ExtensionRegistryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;

/**
 * Extension inspection and management.
 */
@RestController
@RequestMapping("/api/extensions")
@RequiredArgsConstructor
public class ExtensionsController {

    private final ExtensionRegistryService extensionRegistry;

    @GetMapping
    public Mono<ResponseEntity<List<ExtensionDto>>> getExtensions() {
        return Mono.just(ResponseEntity.ok(toDtos(extensionRegistry.getLoaded())));
    }

    @GetMapping("/{name}")
    public Mono<ResponseEntity<ExtensionDto>> getExtension(@PathVariable String name) {
        ExtensionDescriptor descriptor = extensionRegistry.find(name)
                .orElseThrow(() -> notFound(name));
        return Mono.just(ResponseEntity.ok(toDto(descriptor)));
    }

    @PostMapping("/reload")
    public Mono<ResponseEntity<List<ExtensionDto>>> reload() {
        return Mono.fromCallable(() -> {
            extensionRegistry.reload();
            return ResponseEntity.ok(toDtos(extensionRegistry.getLoaded()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{name}/enable")
    public Mono<ResponseEntity<ExtensionDto>> setEnabled(@PathVariable String name,
            @RequestBody ExtensionEnableRequest request) {
        if (!extensionRegistry.setEnabled(name, request.isEnabled())) {
            throw notFound(name);
        }
        ExtensionDescriptor descriptor = extensionRegistry.find(name)
                .orElseThrow(() -> notFound(name));
        return Mono.just(ResponseEntity.ok(toDto(descriptor)));
    }

    private static ResponseStatusException notFound(String name) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Extension not found: " + name);
    }

    private static List<ExtensionDto> toDtos(List<ExtensionDescriptor> descriptors) {
        return descriptors.stream()
                .map(ExtensionsController::toDto)
                .toList();
    }

    private static ExtensionDto toDto(ExtensionDescriptor descriptor) {
        return ExtensionDto.builder()
                .name(descriptor.getName())
                .version(descriptor.getVersion())
                .originPath(descriptor.getOriginPath())
                .enabled(descriptor.isEnabled())
                .installedAt(format(descriptor.getInstalledAt()))
                .lastUsedAt(format(descriptor.getLastUsedAt()))
                .tools(descriptor.getToolNames())
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
