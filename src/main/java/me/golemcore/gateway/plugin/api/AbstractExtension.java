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

import java.util.ArrayList;
import java.util.List;

/**
 * Convenience base for extensions: fixed name and version, and a tool list
 * filled by {@link #addTool(ToolComponent)} during initialization.
 */
public abstract class AbstractExtension implements GatewayExtension {

    private final String name;
    private final String version;
    private final List<ToolComponent> extensionTools = new ArrayList<>();
    private ExtensionContext context;

    protected AbstractExtension(String name, String version) {
        this.name = name;
        this.version = version;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public final void initialize(ExtensionContext context) {
        this.context = context;
        extensionTools.clear();
        onInitialize(context);
    }

    @Override
    public List<ToolComponent> tools() {
        return List.copyOf(extensionTools);
    }

    @Override
    public void shutdown() {
        extensionTools.clear();
    }

    /**
     * Registers tools and acquires resources.
     */
    protected abstract void onInitialize(ExtensionContext context);

    protected void addTool(ToolComponent tool) {
        extensionTools.add(tool);
    }

    protected ExtensionContext context() {
        return context;
    }
}
