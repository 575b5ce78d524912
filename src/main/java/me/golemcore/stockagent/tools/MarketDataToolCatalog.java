package me.golemcore.stockagent.tools;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.stockagent.domain.component.ToolCatalog;
import me.golemcore.stockagent.domain.component.ToolComponent;
import me.golemcore.stockagent.domain.model.ToolDefinition;
import me.golemcore.stockagent.port.outbound.MarketDataPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarations of every market data tool: preprocessing lookups, direct
 * fetches, conditional searches and technical signal searches.
 *
 * <p>
 * Descriptions are written for the completion model, which answers in Korean,
 * so they stay in Korean.
 */
@Component
@RequiredArgsConstructor
public class MarketDataToolCatalog implements ToolCatalog {

    private static final String DATE = "YYYY-MM-DD 형식의 날짜 (단일 날짜 조회 시 사용)";
    private static final String START_DATE = "YYYY-MM-DD 형식의 시작 날짜";
    private static final String END_DATE = "YYYY-MM-DD 형식의 종료 날짜";
    private static final String TICKER = "종목 티커 (예: 005930.KS, 419120.KQ)";
    private static final String MARKET = "시장 구분, 질문에 KOSPI, KOSDAQ 시장구분이 없으면 ALL로 설정";
    private static final String ORDER_BY = "정렬 방향 (ASC: 오름차순, DESC: 내림차순)";
    private static final List<String> MARKETS = List.of("KOSPI", "KOSDAQ", "ALL");
    private static final List<String> DIRECTIONS = List.of("ASC", "DESC");

    private final MarketDataPort marketDataPort;

    @Override
    public List<ToolComponent> getTools() {
        List<ToolComponent> tools = new ArrayList<>();
        for (ToolDefinition definition : definitions()) {
            tools.add(new MarketDataTool(definition, marketDataPort));
        }
        return tools;
    }

    static List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>();

        // preprocessing
        definitions.add(tool("check_trading_date", "주어진 날짜가 거래일인지 확인하고 가장 가까운 거래일을 반환")
                .string("date", "YYYY-MM-DD 형식의 날짜")
                .required("date").build());
        definitions.add(tool("names_to_ticker", "종목명 리스트를 티커로 변환")
                .array("names", "변환할 종목명 리스트")
                .required("names").build());

        // fetch
        definitions.add(tool("get_historical_data", "특정 종목의 과거 주가 데이터 조회")
                .string("ticker", TICKER)
                .string("start_date", START_DATE + " (inclusive)")
                .string("end_date", END_DATE + " (inclusive). 미지정시 start_date만 조회")
                .required("ticker", "start_date").build());
        definitions.add(tool("get_market_ohlcv", "KOSPI, KOSDAQ, ALL 시장의 특정 날짜 OHLCV 데이터 조회")
                .enumeration("market", "시장 구분 (ALL: 모든 시장)", List.of("ALL"))
                .string("date", DATE)
                .required("market", "date").build());
        definitions.add(tool("get_stock_ranking", "특정 종목의 시장 순위 조회 (거래량, 종가, 등락률 기준)")
                .string("ticker", TICKER)
                .string("date", DATE)
                .enumeration("market", "시장 구분 (기본값: ALL)", MARKETS)
                .enumeration("rank_by", "순위 기준", List.of("volume", "close", "change_rate"))
                .required("ticker", "date").build());
        definitions.add(tool("get_stock_comparison", "여러 종목을 지정된 지표로 비교 분석 (종가, 거래량, 등락률, 시가총액)")
                .array("tickers", "비교할 종목 티커 리스트")
                .string("date", DATE)
                .array("compare_by", "비교 기준 리스트 (close, volume, change_rate, market_cap)")
                .required("tickers", "date").build());
        definitions.add(tool("get_market_average_comparison", "특정 종목의 지표를 시장 평균과 비교 분석")
                .string("ticker", TICKER)
                .string("date", DATE)
                .enumeration("market", "시장 구분 (기본값: ALL)", MARKETS)
                .enumeration("compare_by", "비교 기준 (기본값: change_rate)", List.of("change_rate", "volume"))
                .required("ticker", "date").build());
        definitions.add(tool("get_market_ratio", "특정 종목의 지표가 전체 시장에서 차지하는 비율 계산")
                .string("ticker", TICKER)
                .string("date", DATE)
                .enumeration("market", "시장 구분 (기본값: ALL)", MARKETS)
                .enumeration("ratio_by", "비율 계산 기준 (기본값: volume)", List.of("volume"))
                .required("ticker", "date").build());

        // conditional
        definitions.add(period(tool("get_stocks_by_price_range", "가격 기준 종목 검색 (가장 비싼 종목, 특정 가격구간)")
                .enumeration("market", MARKET, MARKETS))
                .number("min_price", "최소 주가 (원)")
                .number("max_price", "최대 주가 (원)")
                .enumeration("order_by", ORDER_BY, DIRECTIONS)
                .required("market").build());
        definitions.add(period(tool("get_stocks_by_volume", "특정 거래량 이상의 종목 검색")
                .enumeration("market", MARKET, MARKETS))
                .integer("min_volume", "최소 거래량 (주), 0으로 설정하면 모든 종목 조회")
                .enumeration("order_by", ORDER_BY, DIRECTIONS)
                .required("market").build());
        definitions.add(period(tool("get_stocks_by_change_rate", "특정 등락률 범위의 종목 검색")
                .enumeration("market", MARKET, MARKETS))
                .number("min_change_rate", "최소 등락률 (퍼센트 단위: 3% = 3.0)")
                .number("max_change_rate", "최대 등락률 (퍼센트 단위: -2% = -2.0)")
                .enumeration("order_by", ORDER_BY, DIRECTIONS)
                .required("market").build());
        definitions.add(period(tool("get_stocks_by_volume_change", "전일 대비 거래량 증가 종목 검색")
                .enumeration("market", MARKET, MARKETS))
                .number("min_volume_ratio", "전일 대비 최소 거래량 비율 (1.3 = 30% 증가)")
                .enumeration("order_by", ORDER_BY, DIRECTIONS)
                .required("market", "min_volume_ratio").build());
        definitions.add(period(tool("get_stocks_by_combined_conditions", "종가, 등락률, 거래량 등 복합 조건 종목 검색")
                .enumeration("market", MARKET, MARKETS))
                .number("min_price", "최소 주가 (원)")
                .number("max_price", "최대 주가 (원)")
                .integer("min_volume", "최소 거래량 (주)")
                .integer("max_volume", "최대 거래량 (주)")
                .number("min_change_rate", "최소 등락률 (퍼센트 단위)")
                .number("max_change_rate", "최대 등락률 (퍼센트 단위)")
                .number("min_volume_ratio", "전일 대비 최소 거래량 비율")
                .enumeration("order_by", ORDER_BY, DIRECTIONS)
                .required("market").build());
        definitions.add(tool("get_top_stocks_by_price", "종가/거래량/등락률 기준 상위 N개 종목 조회")
                .enumeration("market", "시장 구분 (KOSPI, KOSDAQ, ALL)", MARKETS)
                .string("date", DATE)
                .integer("top_n", "상위 몇 개 종목 (기본값: 1)")
                .enumeration("order_by", "정렬 기준", List.of("close", "volume", "change_rate"))
                .enumeration("order_direction", ORDER_BY, DIRECTIONS)
                .required("market", "date").build());

        // signal
        definitions.add(period(tool("get_bollinger_touch_stocks", "볼린저 밴드 상단/하단 터치 종목 검색"))
                .enumeration("band_type", "밴드 타입 (UPPER: 상단, LOWER: 하단)", List.of("UPPER", "LOWER"))
                .number("tolerance", "터치 허용 오차 (1% = 1.0)")
                .build());
        definitions.add(tool("get_cross_signal_stocks", "골든/데드 크로스 신호 종목 검색")
                .string("start_date", START_DATE)
                .string("end_date", END_DATE)
                .enumeration("signal_type", "신호 타입", List.of("GOLDEN_CROSS", "DEAD_CROSS", "ALL"))
                .required("start_date", "end_date").build());
        definitions.add(tool("get_cross_signal_count_by_stock", "특정 종목의 골든/데드 크로스 발생 횟수 조회")
                .string("ticker", TICKER)
                .string("start_date", START_DATE)
                .string("end_date", END_DATE)
                .required("ticker", "start_date", "end_date").build());
        definitions.add(period(tool("get_volume_surge_stocks", "거래량 급증 종목 검색"))
                .number("surge_ratio", "급증 기준 비율 (100% = 1.0)")
                .integer("ma_period", "이동평균 기간")
                .build());
        definitions.add(period(tool("get_rsi_stocks", "RSI 기반 과매수/과매도 종목 검색"))
                .number("rsi_threshold", "RSI 임계값")
                .enumeration("condition", "RSI 조건", List.of("OVERBOUGHT", "OVERSOLD"))
                .build());
        definitions.add(period(tool("get_ma_deviation_stocks", "이동평균 대비 편차 종목 검색"))
                .integer("ma_period", "이동평균 기간")
                .number("deviation_percent", "편차 기준 퍼센트 (10% = 10.0)")
                .enumeration("condition", "조건 (ABOVE: 평균 이상, BELOW: 평균 이하)", List.of("ABOVE", "BELOW"))
                .build());
        definitions.add(period(tool("get_volume_deviation_stocks", "거래량 이동평균 대비 편차 종목 검색"))
                .integer("volume_ma_period", "거래량 이동평균 기간 (5, 20, 60)")
                .number("deviation_percent", "편차 기준 퍼센트 (500% = 500.0)")
                .enumeration("condition", "조건 (ABOVE: 평균 이상, BELOW: 평균 이하)", List.of("ABOVE", "BELOW"))
                .build());

        return definitions;
    }

    private static SchemaBuilder tool(String name, String description) {
        return new SchemaBuilder(name, description);
    }

    private static SchemaBuilder period(SchemaBuilder builder) {
        return builder
                .string("start_date", START_DATE + " (기간 조회 시 사용)")
                .string("end_date", END_DATE + " (기간 조회 시 사용)")
                .string("date", DATE);
    }

    private static final class SchemaBuilder {
        private final String name;
        private final String description;
        private final Map<String, Object> properties = new LinkedHashMap<>();
        private List<String> required = List.of();

        private SchemaBuilder(String name, String description) {
            this.name = name;
            this.description = description;
        }

        SchemaBuilder string(String property, String text) {
            properties.put(property, Map.of("type", "string", "description", text));
            return this;
        }

        SchemaBuilder number(String property, String text) {
            properties.put(property, Map.of("type", "number", "description", text));
            return this;
        }

        SchemaBuilder integer(String property, String text) {
            properties.put(property, Map.of("type", "integer", "description", text));
            return this;
        }

        SchemaBuilder array(String property, String text) {
            properties.put(property, Map.of("type", "array", "items", Map.of("type", "string"),
                    "description", text));
            return this;
        }

        SchemaBuilder enumeration(String property, String text, List<String> values) {
            properties.put(property, Map.of("type", "string", "enum", values, "description", text));
            return this;
        }

        SchemaBuilder required(String... names) {
            this.required = List.of(names);
            return this;
        }

        ToolDefinition build() {
            return ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(Map.of(
                            "type", "object",
                            "properties", properties,
                            "required", required))
                    .build();
        }
    }
}
