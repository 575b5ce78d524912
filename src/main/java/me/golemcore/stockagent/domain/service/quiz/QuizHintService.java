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
import me.golemcore.stockagent.domain.model.CompletionException;
import me.golemcore.stockagent.domain.model.ConversationState;
import me.golemcore.stockagent.domain.model.NewsItem;
import me.golemcore.stockagent.domain.model.QuizQuestion;
import me.golemcore.stockagent.domain.service.TextCompletionService;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import me.golemcore.stockagent.port.outbound.NewsSearchPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hints for the running quiz. Keyword hints come from the question background,
 * news hints from recent articles about the answer company's field. Neither
 * may name the answer company.
 */
@Component
@Slf4j
public class QuizHintService {

    static final Set<String> HINT_PHRASES = Set.of(
            "힌트", "hint", "도움", "help",
            "힌트 주세요", "힌트주세요", "힌트 좀", "힌트좀",
            "도움 주세요", "도움주세요", "도와주세요", "도와줘",
            "모르겠어", "모르겠어요", "모르겠다", "몰라", "몰라요",
            "어려워", "어려워요", "어렵다", "어려운데",
            "잘 모르겠어", "잘 모르겠어요", "잘 모르겠네",
            "헷갈려", "헷갈려요", "헷갈린다",
            "애매해", "애매해요",
            "뭐지", "뭐야", "뭔지", "뭔가요");

    static final String NO_BACKGROUND = "힌트를 제공할 수 있는 정보가 없습니다.";
    static final String LEAKED_KEYWORDS = "키워드: 관련 정보, 배경지식, 참고자료";
    static final String FAILED_KEYWORDS = "키워드: 관련, 정보, 배경";
    static final String NEWS_UNAVAILABLE = "최근 뉴스 검색이 불가능합니다. 기존 힌트를 참고해주세요.";
    static final String NO_NEWS_KEYWORDS = "최근 뉴스에서 관련 키워드를 찾을 수 없습니다.";
    static final String CONTINUE_LINE = "퀴즈는 계속 진행 중입니다. 답변을 입력해주세요!";

    private static final int MAX_KEYWORDS = 5;
    private static final int MAX_KEYWORD_LENGTH = 20;
    private static final int MAX_NEWS_TEXT = 1000;

    private final TextCompletionService textCompletionService;
    private final NewsSearchPort newsSearchPort;
    private final int maxNewsResults;

    public QuizHintService(TextCompletionService textCompletionService, NewsSearchPort newsSearchPort,
            AgentProperties properties) {
        this.textCompletionService = textCompletionService;
        this.newsSearchPort = newsSearchPort;
        this.maxNewsResults = properties.getNews().getMaxResults();
    }

    public static boolean isHintRequest(String input) {
        return input != null && HINT_PHRASES.contains(input.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Short keyword hint paraphrased from the question background, prefixed
     * with a light bulb.
     */
    public String keywordHint(ConversationState state, QuizQuestion question) {
        String background = question.getBackground();
        if (background == null || background.isBlank()) {
            return NO_BACKGROUND;
        }
        String company = question.getCorrectCompany();
        String prompt = """
                다음 배경지식을 바탕으로 키워드 형태의 힌트를 만들 것.

                배경지식: %s
                정답 기업명: %s

                - 정답 기업명과 그 일부도 절대 포함하지 말 것
                - 년도, 금액, 업종, 특징 등 핵심 키워드 3-5개만 뽑을 것
                - "키워드: " 형태로 답할 것
                """.formatted(background, company);
        String hint;
        try {
            hint = textCompletionService.complete(null, prompt, state.getSessionId(), state.getCredential());
            if (company != null && !company.isEmpty() && hint.contains(company)) {
                log.warn("[Quiz] Keyword hint for quiz #{} named the answer, replacing it", question.getId());
                hint = LEAKED_KEYWORDS;
            }
        } catch (CompletionException e) {
            log.warn("[Quiz] Keyword hint generation failed: {}", e.getMessage());
            hint = FAILED_KEYWORDS;
        }
        return "💡 " + hint;
    }

    /**
     * Full reply to a hint request: the news hint (or its fallback with the
     * keyword hint) followed by the continue line.
     */
    public String hintMessage(ConversationState state, QuizQuestion question) {
        NewsHint newsHint = newsHint(state, question);
        List<String> parts = new ArrayList<>();
        if (newsHint.success()) {
            parts.add(newsHint.message());
        } else {
            parts.add("📰 " + newsHint.message());
            parts.add("");
            parts.add(keywordHint(state, question));
        }
        parts.add("");
        parts.add("---");
        parts.add(CONTINUE_LINE);
        return String.join("\n", parts);
    }

    NewsHint newsHint(ConversationState state, QuizQuestion question) {
        if (!newsSearchPort.isAvailable()) {
            log.debug("[News] News search is not configured");
            return NewsHint.fallback();
        }
        List<String> searchKeywords = searchKeywords(state, question);
        if (searchKeywords.isEmpty()) {
            return NewsHint.fallback();
        }
        List<NewsItem> news = newsSearchPort.search(searchKeywords.get(0) + " 뉴스", maxNewsResults);
        if (news.isEmpty()) {
            return NewsHint.fallback();
        }
        List<String> keywords = newsKeywords(state, question, news);
        if (keywords.isEmpty()) {
            return new NewsHint(true, NO_NEWS_KEYWORDS);
        }
        return new NewsHint(true, "📰 **최근 뉴스 기반 힌트**\n"
                + "최근 뉴스에서 발견된 관련 키워드:\n"
                + "💡 " + String.join(", ", keywords) + "\n"
                + "이 키워드들과 관련된 기업을 생각해보세요!");
    }

    List<String> searchKeywords(ConversationState state, QuizQuestion question) {
        Set<String> keywords = new LinkedHashSet<>();
        String company = question.getCorrectCompany();
        if (company != null && !company.isEmpty()) {
            String prompt = """
                    다음 기업명에서 검색에 유용한 핵심 키워드 3-5개를 뽑을 것.
                    기업명: %s
                    - 기업명 자체는 제외하고 업종, 주요 사업, 기술 등을 포함할 것
                    - 쉼표로만 구분해서 답할 것
                    """.formatted(company);
            keywords.addAll(modelKeywords(state, prompt, company));
        }
        String background = question.getBackground() != null ? question.getBackground() : "";
        if (background.contains("상장")) {
            keywords.add("상장");
        }
        if (background.contains("IPO") || background.contains("공모")) {
            keywords.add("IPO");
        }
        if (background.contains("시총") || background.contains("시가총액")) {
            keywords.add("시가총액");
        }
        return keywords.stream()
                .filter(keyword -> keyword.length() >= 2)
                .limit(MAX_KEYWORDS)
                .toList();
    }

    private List<String> newsKeywords(ConversationState state, QuizQuestion question, List<NewsItem> news) {
        String combined = news.stream()
                .map(item -> item.getTitle() + " " + item.getDescription())
                .collect(Collectors.joining(" "));
        if (combined.length() > MAX_NEWS_TEXT) {
            combined = combined.substring(0, MAX_NEWS_TEXT);
        }
        String prompt = """
                다음 뉴스 내용에서 퀴즈와 관련된 핵심 키워드 3-5개를 뽑을 것.
                뉴스 내용: %s
                - 기업명 "%s"과 그 일부는 절대 포함하지 말 것
                - 업종, 기술, 트렌드, 특징 등을 포함할 것
                - 쉼표로만 구분해서 답할 것
                """.formatted(combined, question.getCorrectCompany());
        return modelKeywords(state, prompt, question.getCorrectCompany());
    }

    private List<String> modelKeywords(ConversationState state, String prompt, String company) {
        String answer;
        try {
            answer = textCompletionService.complete(null, prompt, state.getSessionId(), state.getCredential());
        } catch (CompletionException e) {
            log.warn("[News] Keyword extraction failed: {}", e.getMessage());
            return List.of();
        }
        return parseKeywords(answer, company);
    }

    static List<String> parseKeywords(String answer, String company) {
        List<String> keywords = new ArrayList<>();
        for (String raw : answer.split(",")) {
            String keyword = raw.strip();
            if (keyword.startsWith("키워드:")) {
                keyword = keyword.substring("키워드:".length()).strip();
            }
            if (keyword.isEmpty() || keyword.length() > MAX_KEYWORD_LENGTH
                    || keyword.startsWith("예시") || keyword.startsWith("답변")) {
                continue;
            }
            if (company != null && !company.isEmpty() && keyword.contains(company)) {
                continue;
            }
            keywords.add(keyword);
            if (keywords.size() == MAX_KEYWORDS) {
                break;
            }
        }
        return keywords;
    }

    record NewsHint(boolean success, String message) {

        static NewsHint fallback() {
            return new NewsHint(false, NEWS_UNAVAILABLE);
        }
    }
}
