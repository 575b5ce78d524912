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
import me.golemcore.stockagent.domain.model.QuizHistoryRecord;
import me.golemcore.stockagent.domain.model.RewardQuote;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import me.golemcore.stockagent.port.outbound.MarketDataPort;
import me.golemcore.stockagent.port.outbound.QuizHistoryPort;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prices quiz rewards and summarises the shares a conversation has collected.
 */
@Component
@Slf4j
public class QuizRewardService {

    static final int SHARE_SCALE = 7;

    private final MarketDataPort marketDataPort;
    private final QuizHistoryPort historyPort;
    private final Clock clock;
    private final double targetValue;

    public QuizRewardService(MarketDataPort marketDataPort, QuizHistoryPort historyPort, Clock clock,
            AgentProperties properties) {
        this.marketDataPort = marketDataPort;
        this.historyPort = historyPort;
        this.clock = clock;
        this.targetValue = properties.getQuiz().getRewardValue();
    }

    public double getTargetValue() {
        return targetValue;
    }

    /**
     * Shares of {@code companyName} worth the target value at the closing price
     * of the last trading day before today. Empty when no price is available.
     */
    public Optional<RewardQuote> quote(String companyName) {
        Optional<MarketDataPort.ClosingPrice> close;
        try {
            close = marketDataPort.previousClose(companyName, LocalDate.now(clock));
        } catch (RuntimeException e) {
            log.warn("[Reward] Price lookup failed for {}: {}", companyName, e.getMessage());
            return Optional.empty();
        }
        if (close.isEmpty() || close.get().price() <= 0) {
            log.warn("[Reward] No previous closing price for {}", companyName);
            return Optional.empty();
        }
        double price = close.get().price();
        double shares = roundShares(targetValue / price);
        RewardQuote quote = RewardQuote.builder()
                .companyName(companyName)
                .priceDate(close.get().date())
                .closingPrice(price)
                .shares(shares)
                .totalValue(shares * price)
                .targetValue(targetValue)
                .build();
        log.info("[Reward] {} {} shares at {} ({})", companyName, formatShares(shares), price, quote.getPriceDate());
        return Optional.of(quote);
    }

    /**
     * Holdings per company across every rewarded answer of the conversation.
     */
    public String rewardsSummary(String requestId) {
        List<QuizHistoryRecord> rewarded = historyPort.findByRequestId(requestId).stream()
                .filter(QuizHistoryRecord::isRewarded)
                .toList();
        if (rewarded.isEmpty()) {
            return "📊 **현재 보유 주식**\n아직 받은 보상이 없습니다.";
        }
        Map<String, Double> holdings = new LinkedHashMap<>();
        for (QuizHistoryRecord record : rewarded) {
            holdings.merge(record.getRewardStock(), record.getRewardAmount(), Double::sum);
        }
        StringBuilder summary = new StringBuilder("📊 **현재 보유 주식**");
        holdings.forEach((stock, amount) -> summary.append("\n• ").append(stock).append(": ")
                .append(formatShares(roundShares(amount))).append("주"));
        summary.append("\n\n총 ").append(rewarded.size()).append("회 퀴즈 정답으로 ")
                .append(holdings.size()).append("종목 보유");
        return summary.toString();
    }

    static double roundShares(double shares) {
        return BigDecimal.valueOf(shares).setScale(SHARE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    static String formatShares(double shares) {
        return BigDecimal.valueOf(shares).stripTrailingZeros().toPlainString();
    }
}
