package me.golemcore.stockagent.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.component.ToolCatalog;
import me.golemcore.stockagent.domain.component.ToolComponent;
import me.golemcore.stockagent.domain.model.Message;
import me.golemcore.stockagent.domain.model.ToolDefinition;
import me.golemcore.stockagent.domain.model.ToolFailureKind;
import me.golemcore.stockagent.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Name-keyed registry of local tools and the invoker for a single tool call.
 *
 * <p>
 * Execution never throws: unknown names, missing required arguments and
 * exceptions raised by the tool are all reported as a failed
 * {@link ToolResult}.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<ToolCatalog> catalogs) {
        for (ToolCatalog catalog : catalogs) {
            for (ToolComponent tool : catalog.getTools()) {
                register(tool);
            }
        }
        log.info("[Tools] Registered {} tool(s)", tools.size());
    }

    public void register(ToolComponent tool) {
        ToolComponent previous = tools.put(tool.getToolName(), tool);
        if (previous != null) {
            log.warn("[Tools] Replaced tool registration: {}", tool.getToolName());
        }
    }

    public ToolComponent getTool(String name) {
        return tools.get(name);
    }

    public Set<String> getToolNames() {
        return new TreeSet<>(tools.keySet());
    }

    /**
     * Definitions for the given names, in the given order.
     *
     * @throws IllegalStateException
     *             if a name is not registered
     */
    public List<ToolDefinition> definitions(Collection<String> names) {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (String name : names) {
            ToolComponent tool = tools.get(name);
            if (tool == null) {
                throw new IllegalStateException("Tool not registered: " + name);
            }
            definitions.add(tool.getDefinition());
        }
        return definitions;
    }

    public ToolResult execute(Message.ToolCall toolCall) {
        String toolName = toolCall.getName();
        ToolComponent tool = toolName != null ? tools.get(toolName) : null;

        if (tool == null) {
            String available = String.join(", ", getToolNames());
            return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                    "Unknown tool: " + toolName + ". Available tools: " + available);
        }

        Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        List<String> missing = tool.getDefinition().requiredParameters().stream()
                .filter(parameter -> arguments.get(parameter) == null)
                .toList();
        if (!missing.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Missing required arguments: " + String.join(", ", missing));
        }

        try {
            log.debug("[Tools] Executing {} with {}", toolName, arguments);
            return tool.execute(arguments).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution interrupted");
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, safeCauseMessage(e));
        }
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
