package com.furniture.queryparser.config;

import com.furniture.queryparser.model.NamedItem;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Configuration
public class SuggestionCacheConfig {

    @Value("${parser.suggestion.cache-ttl:PT1H}")
    private Duration cacheTtl;

    @Value("${parser.suggestion.cache-max-size:1000}")
    private long cacheMaxSize;

    @Bean("suggestionLookupCache")
    public Cache<String, List<NamedItem>> suggestionLookupCache() {
        return Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(cacheMaxSize)
                .build();
    }
}
