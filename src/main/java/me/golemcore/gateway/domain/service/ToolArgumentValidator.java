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

package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Checks call arguments against a tool's input schema: every required key must
 * be present, and every present key with a declared JSON type must match it.
 */
@Component
public class ToolArgumentValidator {

    /**
     * @return a message naming the offending parameter, or empty when the
     *         arguments are valid
     */
    public Optional<String> validate(ToolDefinition definition, Map<String, Object> arguments) {
        for (String required : definition.requiredParameters()) {
            if (arguments.get(required) == null) {
                return Optional.of("Missing required parameter: " + required);
            }
        }
        for (Map.Entry<String, Object> argument : arguments.entrySet()) {
            String expected = definition.parameterType(argument.getKey());
            if (expected == null || argument.getValue() == null) {
                continue;
            }
            if (!matchesType(expected, argument.getValue())) {
                return Optional.of("Parameter '" + argument.getKey() + "' must be of type " + expected);
            }
        }
        return Optional.empty();
    }

    static boolean matchesType(String type, Object value) {
        return switch (type) {
        case "string" -> value instanceof String;
        case "boolean" -> value instanceof Boolean;
        case "number" -> value instanceof Number;
        case "integer" -> isIntegral(value);
        case "object" -> value instanceof Map<?, ?>;
        case "array" -> value instanceof Collection<?> || value.getClass().isArray();
        default -> true;
        };
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }
}
