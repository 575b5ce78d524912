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

/**
 * Classifies why a single tool invocation failed.
 */
public enum ToolFailureKind {

    /**
     * The model requested a tool that is not registered.
     */
    UNKNOWN_TOOL,

    /**
     * Arguments could not be parsed or are missing required fields.
     */
    INVALID_ARGUMENTS,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, remote errors).
     */
    EXECUTION_FAILED
}
