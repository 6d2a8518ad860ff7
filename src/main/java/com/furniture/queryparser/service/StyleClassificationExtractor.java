package com.furniture.queryparser.service;

import java.util.Map;

public interface StyleClassificationExtractor {
    /**
     * Summarises the design style of a query. The map is passed through to clients untouched.
     */
    Map<String, Object> extractClassification(String query);
}
