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

import java.util.List;

/**
 * Fixed tool sets offered to the completion service by each branch.
 */
public enum ToolGroup {

    PREPROCESS(List.of("check_trading_date", "names_to_ticker")),
    FETCH(List.of(
            "get_historical_data",
            "get_market_ohlcv",
            "get_stock_ranking",
            "get_stock_comparison",
            "get_market_average_comparison",
            "get_market_ratio")),
    CONDITIONAL(List.of(
            "get_stocks_by_price_range",
            "get_stocks_by_volume",
            "get_stocks_by_change_rate",
            "get_stocks_by_volume_change",
            "get_stocks_by_combined_conditions",
            "get_top_stocks_by_price")),
    SIGNAL(List.of(
            "get_bollinger_touch_stocks",
            "get_cross_signal_stocks",
            "get_cross_signal_count_by_stock",
            "get_volume_surge_stocks",
            "get_rsi_stocks",
            "get_ma_deviation_stocks",
            "get_volume_deviation_stocks"));

    private final List<String> toolNames;

    ToolGroup(List<String> toolNames) {
        this.toolNames = toolNames;
    }

    public List<String> getToolNames() {
        return toolNames;
    }
}
