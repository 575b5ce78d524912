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
import me.golemcore.stockagent.domain.model.QuizOption;
import me.golemcore.stockagent.domain.model.QuizQuestion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the quiz bank text format.
 *
 * <pre>
 * 1. Q. 질문
 * ① 선택지
 * ② 선택지
 * ③ 선택지
 * ④ 선택지
 * 정답: ② 회사명
 * 배경지식 ...
 * </pre>
 *
 * The question may also start on the line after a bare {@code N.} line.
 * Blocks that fail validation are skipped.
 */
@Slf4j
public final class QuizParser {

    static final int MIN_QUESTION_LENGTH = 10;
    static final int MIN_OPTION_LENGTH = 2;

    private static final Pattern BLOCK_SPLIT = Pattern.compile("\\n(?=\\d+\\.)");
    private static final Pattern BARE_NUMBER = Pattern.compile("(\\d+)\\.\\s*");
    private static final Pattern NUMBER_AND_QUESTION = Pattern.compile("(\\d+)\\.\\s*Q\\.\\s*(.*)");
    private static final Pattern ANSWER_LINE = Pattern.compile("정답:\\s*([①②③④])\\s*(.*)");
    private static final Map<String, String> SYMBOL_TO_NUMBER = symbolMap();
    private static final int MIN_BLOCK_LINES = 6;

    private QuizParser() {
    }

    public static List<QuizQuestion> parse(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String normalized = content.replace("\r\n", "\n").strip();
        List<QuizQuestion> quizzes = new ArrayList<>();
        for (String block : BLOCK_SPLIT.split(normalized)) {
            if (block.isBlank()) {
                continue;
            }
            Optional<QuizQuestion> quiz = parseBlock(block.strip());
            if (quiz.isPresent() && isValid(quiz.get())) {
                quizzes.add(quiz.get());
            } else {
                log.warn("[Quiz] Skipping invalid quiz block: {}", abbreviate(block));
            }
        }
        log.info("[Quiz] Parsed {} valid quizzes", quizzes.size());
        return quizzes;
    }

    static Optional<QuizQuestion> parseBlock(String block) {
        List<String> lines = Arrays.stream(block.split("\n"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
        if (lines.size() < MIN_BLOCK_LINES) {
            return Optional.empty();
        }

        int id;
        String question;
        int optionStart;
        Matcher bare = BARE_NUMBER.matcher(lines.get(0));
        if (bare.matches()) {
            if (!lines.get(1).startsWith("Q.")) {
                return Optional.empty();
            }
            id = Integer.parseInt(bare.group(1));
            question = lines.get(1).substring(2).strip();
            optionStart = 2;
        } else {
            Matcher inline = NUMBER_AND_QUESTION.matcher(lines.get(0));
            if (!inline.matches()) {
                return Optional.empty();
            }
            id = Integer.parseInt(inline.group(1));
            question = inline.group(2).strip();
            optionStart = 1;
        }

        Map<String, QuizOption> options = new TreeMap<>();
        for (String line : lines.subList(optionStart, lines.size())) {
            String symbol = line.substring(0, 1);
            String number = SYMBOL_TO_NUMBER.get(symbol);
            if (number != null && !options.containsKey(number)) {
                options.put(number, new QuizOption(number, symbol, line.substring(1).strip()));
            }
        }

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!line.startsWith("정답:")) {
                continue;
            }
            Matcher answer = ANSWER_LINE.matcher(line);
            if (!answer.matches()) {
                return Optional.empty();
            }
            String symbol = answer.group(1);
            String background = String.join(" ", lines.subList(i + 1, lines.size()));
            return Optional.of(QuizQuestion.builder()
                    .id(id)
                    .question(question)
                    .options(new ArrayList<>(options.values()))
                    .correctSymbol(symbol)
                    .correctNumber(SYMBOL_TO_NUMBER.get(symbol))
                    .correctCompany(answer.group(2).strip())
                    .background(background)
                    .build());
        }
        return Optional.empty();
    }

    static boolean isValid(QuizQuestion quiz) {
        if (quiz.getId() <= 0) {
            return false;
        }
        if (quiz.getQuestion() == null || quiz.getQuestion().strip().length() < MIN_QUESTION_LENGTH) {
            return false;
        }
        List<QuizOption> options = quiz.getOptions();
        if (options == null || options.size() != SYMBOL_TO_NUMBER.size()) {
            return false;
        }
        for (QuizOption option : options) {
            if (option.getText() == null || option.getText().strip().length() < MIN_OPTION_LENGTH) {
                return false;
            }
        }
        if (quiz.getCorrectCompany() == null || quiz.getCorrectCompany().isEmpty()) {
            return false;
        }
        options.stream()
                .filter(option -> option.getNumber().equals(quiz.getCorrectNumber()))
                .filter(option -> !option.getText().contains(quiz.getCorrectCompany()))
                .findFirst()
                .ifPresent(option -> log.warn("[Quiz] Quiz {}: answer '{}' does not match option '{}'",
                        quiz.getId(), quiz.getCorrectCompany(), option.getText()));
        return true;
    }

    private static Map<String, String> symbolMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("①", "1");
        map.put("②", "2");
        map.put("③", "3");
        map.put("④", "4");
        return map;
    }

    private static String abbreviate(String block) {
        String flat = block.strip().replace('\n', ' ');
        return flat.length() <= 50 ? flat : flat.substring(0, 50) + "...";
    }
}
