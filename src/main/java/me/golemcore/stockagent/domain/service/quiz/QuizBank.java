package me.golemcore.stockagent.domain.service.quiz;

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
import me.golemcore.stockagent.domain.model.QuizQuestion;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import me.golemcore.stockagent.port.outbound.QuizHistoryPort;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Question pool loaded from the quiz bank resource. Prefers questions the
 * conversation has not attempted yet.
 */
@Component
@Slf4j
public class QuizBank {

    private final ResourceLoader resourceLoader;
    private final QuizHistoryPort historyPort;
    private final String location;
    private final Random random = new Random();

    private volatile List<QuizQuestion> questions;

    public QuizBank(ResourceLoader resourceLoader, QuizHistoryPort historyPort, AgentProperties properties) {
        this.resourceLoader = resourceLoader;
        this.historyPort = historyPort;
        this.location = properties.getQuiz().getResource();
    }

    /**
     * Picks a question for the conversation: random among the unplayed ones,
     * or random among all once every question has been attempted.
     *
     * @throws QuizException
     *             if the bank is missing or holds no valid question
     */
    public QuizQuestion select(String requestId) {
        List<QuizQuestion> all = questions();
        Set<Integer> played = requestId == null || requestId.isBlank()
                ? Set.of()
                : historyPort.findPlayedQuizIds(requestId);

        List<QuizQuestion> unplayed = all.stream()
                .filter(quiz -> !played.contains(quiz.getId()))
                .toList();
        List<QuizQuestion> pool = unplayed.isEmpty() ? all : unplayed;
        if (unplayed.isEmpty()) {
            log.info("[Quiz] Every quiz was attempted by {}, picking from all {}", requestId, all.size());
        }
        QuizQuestion selected = pool.get(random.nextInt(pool.size()));
        log.info("[Quiz] Selected quiz #{}", selected.getId());
        return selected;
    }

    List<QuizQuestion> questions() {
        List<QuizQuestion> loaded = questions;
        if (loaded == null) {
            synchronized (this) {
                loaded = questions;
                if (loaded == null) {
                    loaded = load();
                    questions = loaded;
                }
            }
        }
        return loaded;
    }

    private List<QuizQuestion> load() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("[Quiz] Quiz bank not found: {}", location);
            throw new QuizException("퀴즈 파일을 찾을 수 없습니다.");
        }
        String content;
        try (InputStream in = resource.getInputStream()) {
            content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new QuizException("퀴즈 파일을 찾을 수 없습니다.", e);
        }
        List<QuizQuestion> parsed = QuizParser.parse(content);
        if (parsed.isEmpty()) {
            throw new QuizException("유효한 퀴즈를 로드할 수 없습니다.");
        }
        return parsed;
    }
}
