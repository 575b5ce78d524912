package me.golemcore.stockagent.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link SessionProperties} - conversation store lifetime and capacity</li>
 * <li>{@link CompletionProperties} - completion service endpoint and limits</li>
 * <li>{@link RouterProperties} - routing state machine limits</li>
 * <li>{@link QuizProperties} - quiz bank, timeout and rewards</li>
 * <li>{@link MarketDataProperties} - market data tool service</li>
 * <li>{@link NewsProperties} - news search used for quiz hints</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * <li>{@link StorageProperties} - local workspace for quiz history</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private SessionProperties session = new SessionProperties();
    private CompletionProperties completion = new CompletionProperties();
    private RouterProperties router = new RouterProperties();
    private QuizProperties quiz = new QuizProperties();
    private MarketDataProperties marketData = new MarketDataProperties();
    private NewsProperties news = new NewsProperties();
    private HttpProperties http = new HttpProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class SessionProperties {
        private Duration idleTimeout = Duration.ofMinutes(10);
        private int capacity = 5;
    }

    @Data
    public static class CompletionProperties {
        private String apiUrl;
        private String path = "/testapp/v3/chat-completions/HCX-005";
        private double temperature = 0.0;
        private int maxTokens = 4000;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class RouterProperties {
        private int maxClarifications = 2;
    }

    @Data
    public static class QuizProperties {
        private String resource = "classpath:quiz/quiz.txt";
        private Duration timeout = Duration.ofMinutes(10);
        private String triggerPhrase = "퀴즈도전";
        private double rewardValue = 100.0;
        private Duration rewardInterval = Duration.ofHours(24);
    }

    @Data
    public static class MarketDataProperties {
        private String baseUrl;
    }

    @Data
    public static class NewsProperties {
        private String baseUrl = "https://openapi.naver.com";
        private String clientId;
        private String clientSecret;
        private int maxResults = 5;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.stock-agent/workspace";
    }
}
