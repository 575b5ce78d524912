package me.golemcore.stockagent.adapter.outbound.news;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.stockagent.domain.model.NewsItem;
import me.golemcore.stockagent.infrastructure.config.AgentProperties;
import me.golemcore.stockagent.infrastructure.http.FeignClientFactory;
import me.golemcore.stockagent.port.outbound.NewsSearchPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Naver news search ({@code GET /v1/search/news.json}), newest first. Any
 * failure yields an empty list so hints can fall back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NaverNewsAdapter implements NewsSearchPort {

    private final AgentProperties properties;
    private final FeignClientFactory feignClientFactory;

    private volatile NaverSearchApi client;

    @Override
    public boolean isAvailable() {
        AgentProperties.NewsProperties news = properties.getNews();
        return notBlank(news.getClientId()) && notBlank(news.getClientSecret()) && notBlank(news.getBaseUrl());
    }

    @Override
    public List<NewsItem> search(String query, int maxResults) {
        if (!isAvailable()) {
            return List.of();
        }
        AgentProperties.NewsProperties news = properties.getNews();
        try {
            log.info("[News] Searching news: {}", query);
            SearchResponse response = api().searchNews(news.getClientId(), news.getClientSecret(), query,
                    maxResults);
            if (response == null || response.getItems() == null) {
                return List.of();
            }
            List<NewsItem> items = new ArrayList<>();
            for (SearchItem item : response.getItems()) {
                items.add(NewsItem.builder()
                        .title(stripBold(item.getTitle()))
                        .description(stripBold(item.getDescription()))
                        .link(item.getLink() != null ? item.getLink() : "")
                        .build());
            }
            return items;
        } catch (RuntimeException e) {
            log.warn("[News] News search failed: {}", e.getMessage());
            return List.of();
        }
    }

    static String stripBold(String text) {
        return text == null ? "" : text.replace("<b>", "").replace("</b>", "");
    }

    private NaverSearchApi api() {
        NaverSearchApi current = client;
        if (current == null) {
            synchronized (this) {
                if (client == null) {
                    client = feignClientFactory.create(NaverSearchApi.class, properties.getNews().getBaseUrl());
                }
                current = client;
            }
        }
        return current;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    // Feign API interface
    public interface NaverSearchApi {
        @RequestLine("GET /v1/search/news.json?query={query}&display={display}&start=1&sort=date")
        @Headers({
                "X-Naver-Client-Id: {clientId}",
                "X-Naver-Client-Secret: {clientSecret}"
        })
        SearchResponse searchNews(@Param("clientId") String clientId,
                @Param("clientSecret") String clientSecret,
                @Param("query") String query,
                @Param("display") int display);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchResponse {
        private List<SearchItem> items;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchItem {
        private String title;
        private String description;
        private String link;
    }
}
