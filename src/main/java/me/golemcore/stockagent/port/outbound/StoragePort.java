package me.golemcore.stockagent.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for files in the local workspace, organized by directory.
 */
public interface StoragePort {

    /**
     * Read text content from file. Completes with {@code null} when the file
     * does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Append text to a file (for JSONL).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);
}
