package com.furniture.queryparser.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.furniture.queryparser.model.LexiconDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the lexicon definition (features, rule tables, product types, styles) from the classpath.
 */
@Component
public class LexiconLoader {

    private static final Logger log = LoggerFactory.getLogger(LexiconLoader.class);

    private final ObjectMapper objectMapper;

    public LexiconLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public LexiconDefinition load(String location) {
        ClassPathResource resource = new ClassPathResource(location);
        try (InputStream in = resource.getInputStream()) {
            LexiconDefinition definition = objectMapper.readValue(in, LexiconDefinition.class);
            log.info("Loaded lexicon from {}: {} categories, {} product types, {} styles",
                    location, definition.features().size(), definition.productTypes().size(), definition.styles().size());
            return definition;
        } catch (IOException e) {
            throw new LexiconLoadException("Failed to load lexicon from classpath:" + location, e);
        }
    }
}
