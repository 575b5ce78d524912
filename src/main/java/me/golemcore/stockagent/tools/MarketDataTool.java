package me.golemcore.stockagent.tools;

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

import me.golemcore.stockagent.domain.component.ToolComponent;
import me.golemcore.stockagent.domain.model.ToolDefinition;
import me.golemcore.stockagent.domain.model.ToolFailureKind;
import me.golemcore.stockagent.domain.model.ToolResult;
import me.golemcore.stockagent.port.outbound.MarketDataPort;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool backed by one lookup of the market data service. The lookup itself is
 * opaque here: arguments go out as-is and the JSON result comes back as the
 * tool's structured data.
 */
public class MarketDataTool implements ToolComponent {

    private final ToolDefinition definition;
    private final MarketDataPort marketDataPort;

    public MarketDataTool(ToolDefinition definition, MarketDataPort marketDataPort) {
        this.definition = definition;
        this.marketDataPort = marketDataPort;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        try {
            Map<String, Object> result = marketDataPort.invoke(definition.getName(), parameters);
            Object error = result.get("error");
            if (error != null) {
                return CompletableFuture.completedFuture(
                        ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, String.valueOf(error)));
            }
            return CompletableFuture.completedFuture(ToolResult.success(definition.getName(), result));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
