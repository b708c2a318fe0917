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

package me.golemcore.gateway.plugin.api;

import me.golemcore.gateway.domain.component.ToolComponent;

import java.util.List;

/**
 * Contract of a dynamically loaded extension contributing tools to the
 * gateway.
 *
 * <p>
 * Extensions are packaged as jars in the extensions directory and announce
 * their implementation class in
 * {@code META-INF/services/me.golemcore.gateway.plugin.api.GatewayExtension}.
 * Implementations need a public no-argument constructor.
 *
 * <p>
 * Lifecycle: instantiated, {@link #initialize(ExtensionContext)} once, then
 * {@link #tools()} is read; {@link #shutdown()} runs on unregister or reload.
 */
public interface GatewayExtension {

    /**
     * Unique extension name. Also the namespace of its tools.
     */
    String name();

    String version();

    void initialize(ExtensionContext context);

    /**
     * Tools contributed by this extension. Names are local to the extension; the
     * registry exposes them as {@code extension_<name>_<tool>}.
     */
    List<ToolComponent> tools();

    void shutdown();
}
