package com.furniture.queryparser.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class FeatureMatchingConfig {

    @Value("${parser.matching.fuzzy-min-length:6}")
    private int fuzzyMinLength;

    @Value("${parser.matching.default-threshold:0.93}")
    private double defaultThreshold;

    @Value("${parser.matching.strict-threshold:0.96}")
    private double strictThreshold;

    @Value("${parser.matching.strict-terms:detail,metal}")
    private List<String> strictTerms;

    @Bean
    public FeatureMatchingSettings featureMatchingSettings() {
        return new FeatureMatchingSettings(fuzzyMinLength, defaultThreshold, strictThreshold, strictTerms);
    }
}
