package me.golemcore.stockagent.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Declaration of a callable tool as offered to the completion service: name,
 * description and a JSON Schema for its parameters.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    /**
     * Returns the names listed under {@code required} in the input schema.
     */
    @SuppressWarnings("unchecked")
    public List<String> requiredParameters() {
        if (inputSchema == null) {
            return List.of();
        }
        Object required = inputSchema.get("required");
        if (required instanceof List<?> list) {
            return (List<String>) list;
        }
        return List.of();
    }
}
