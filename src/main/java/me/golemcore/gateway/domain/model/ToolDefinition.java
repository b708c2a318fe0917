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

package me.golemcore.gateway.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Declaration of a tool as exposed to the planning loop: name, description and
 * a JSON Schema object describing the arguments.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    /**
     * Creates a simple tool definition without input parameters.
     */
    public static ToolDefinition simple(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    /**
     * Names listed under {@code required} in the input schema.
     */
    public List<String> requiredParameters() {
        if (inputSchema == null || !(inputSchema.get("required") instanceof List<?> required)) {
            return List.of();
        }
        return required.stream()
                .map(String::valueOf)
                .toList();
    }

    /**
     * Declared JSON type of a parameter, or {@code null} when the schema does not
     * declare one.
     */
    public String parameterType(String parameter) {
        if (inputSchema == null || !(inputSchema.get("properties") instanceof Map<?, ?> properties)) {
            return null;
        }
        if (!(properties.get(parameter) instanceof Map<?, ?> property)) {
            return null;
        }
        Object type = property.get("type");
        return type != null ? type.toString() : null;
    }
}
