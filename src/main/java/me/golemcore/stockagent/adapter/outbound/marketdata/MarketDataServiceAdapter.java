package me.golemcore.stockagent.adapter.outbound.marketdata;

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

import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import me.golemcore.stockagent.infrastructure.http.FeignClientFactory;
import me.golemcore.stockagent.port.outbound.MarketDataPort;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the market data service that owns the stock database. Each
 * data tool maps to {@code POST /tools/{name}} with the tool arguments as the
 * JSON body.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarketDataServiceAdapter implements MarketDataPort {

    private final AgentProperties properties;
    private final FeignClientFactory feignClientFactory;

    private volatile MarketDataApi client;

    @Override
    public Map<String, Object> invoke(String toolName, Map<String, Object> arguments) {
        Map<String, Object> result = api().invokeTool(toolName, arguments);
        return result != null ? result : Map.of();
    }

    @Override
    public Optional<ClosingPrice> previousClose(String companyName, LocalDate referenceDate) {
        try {
            PreviousCloseResponse response = api().previousClose(companyName, referenceDate.toString());
            if (response == null || response.getClose() == null || response.getClose() <= 0) {
                return Optional.empty();
            }
            return Optional.of(new ClosingPrice(response.getTicker(), LocalDate.parse(response.getDate()),
                    response.getClose()));
        } catch (FeignException.NotFound e) {
            log.warn("[MarketData] No closing price for '{}' before {}", companyName, referenceDate);
            return Optional.empty();
        }
    }

    private MarketDataApi api() {
        MarketDataApi current = client;
        if (current == null) {
            String baseUrl = properties.getMarketData().getBaseUrl();
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalStateException("Market data service URL is not configured");
            }
            synchronized (this) {
                if (client == null) {
                    client = feignClientFactory.create(MarketDataApi.class, baseUrl);
                    log.info("[MarketData] Client initialized for {}", baseUrl);
                }
                current = client;
            }
        }
        return current;
    }

    // Feign API interface
    public interface MarketDataApi {
        @RequestLine("POST /tools/{name}")
        @Headers("Content-Type: application/json")
        Map<String, Object> invokeTool(@Param("name") String name, Map<String, Object> arguments);

        @RequestLine("GET /prices/previous-close?company={company}&before={before}")
        PreviousCloseResponse previousClose(@Param("company") String company, @Param("before") String before);
    }

    @Data
    public static class PreviousCloseResponse {
        private String ticker;
        private String date;
        private Double close;
    }
}
