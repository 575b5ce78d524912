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

import java.util.Map;

/**
 * Outcome of one tool invocation inside a tool round.
 */
@Data
@Builder
public class ToolCallResult {

    private String toolCallId;
    private String toolName;
    private Map<String, Object> arguments;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName")
    private boolean success;
    private Object result;
    private String error;

    /**
     * Text placed in the synthetic tool turn and in aggregate error messages.
     */
    public String describe() {
        if (success) {
            return result != null ? String.valueOf(result) : "";
        }
        return error != null ? error : "unknown error";
    }
}
