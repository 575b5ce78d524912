package me.golemcore.stockagent.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.model.QuizHistoryRecord;
import me.golemcore.stockagent.port.outbound.QuizHistoryPort;
import me.golemcore.stockagent.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Quiz history as an append-only JSONL file in the local workspace, one
 * record per line. The file is read once on first access and mirrored in
 * memory afterwards; every save appends before it updates the mirror.
 */
@Component
@Slf4j
public class JsonlQuizHistoryAdapter implements QuizHistoryPort {

    static final String DIRECTORY = "quiz";
    static final String HISTORY_FILE = "history.jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Map<String, List<QuizHistoryRecord>> records = new HashMap<>();
    private boolean loaded;

    public JsonlQuizHistoryAdapter(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void save(QuizHistoryRecord record) {
        ensureLoaded();
        String line;
        try {
            line = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize quiz history record", e);
        }
        storagePort.appendText(DIRECTORY, HISTORY_FILE, line + "\n").join();
        cache(record);
        log.debug("[Quiz] Stored history record for quiz #{} ({})", record.getQuizId(), record.getRequestId());
    }

    @Override
    public synchronized Set<Integer> findPlayedQuizIds(String requestId) {
        Set<Integer> ids = new TreeSet<>();
        for (QuizHistoryRecord record : recordsOf(requestId)) {
            ids.add(record.getQuizId());
        }
        return ids;
    }

    @Override
    public synchronized List<QuizHistoryRecord> findByRequestId(String requestId) {
        List<QuizHistoryRecord> result = new ArrayList<>(recordsOf(requestId));
        result.sort(Comparator.comparing(QuizHistoryRecord::getCompletedAt,
                Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed());
        return result;
    }

    private List<QuizHistoryRecord> recordsOf(String requestId) {
        if (requestId == null) {
            return List.of();
        }
        ensureLoaded();
        return records.getOrDefault(requestId, List.of());
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        String text = storagePort.getText(DIRECTORY, HISTORY_FILE).join();
        int count = 0;
        if (text != null) {
            for (String line : text.split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    cache(objectMapper.readValue(line, QuizHistoryRecord.class));
                    count++;
                } catch (JsonProcessingException e) {
                    log.warn("[Quiz] Skipping unreadable history line: {}", e.getOriginalMessage());
                }
            }
        }
        loaded = true;
        log.info("[Quiz] Loaded {} quiz history records", count);
    }

    private void cache(QuizHistoryRecord record) {
        String key = record.getRequestId() != null ? record.getRequestId() : "";
        records.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
    }
}
