package com.furniture.queryparser.config;

import com.furniture.queryparser.service.FeatureLexicon;
import com.furniture.queryparser.service.LexiconLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LexiconConfig {

    @Value("${parser.lexicon.location:lexicon/furniture-lexicon.json}")
    private String lexiconLocation;

    /**
     * Built once at startup and shared read-only by every request.
     */
    @Bean
    public FeatureLexicon featureLexicon(LexiconLoader lexiconLoader) {
        return FeatureLexicon.from(lexiconLoader.load(lexiconLocation));
    }
}
