package com.furniture.queryparser.service;

import com.furniture.queryparser.model.SuggestionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class QuerySuggestionService {

    private static final Logger log = LoggerFactory.getLogger(QuerySuggestionService.class);

    private final CatalogLookupService catalogLookupService;
    private final StyleSuggestionService styleSuggestionService;

    public QuerySuggestionService(CatalogLookupService catalogLookupService,
                                  StyleSuggestionService styleSuggestionService) {
        this.catalogLookupService = catalogLookupService;
        this.styleSuggestionService = styleSuggestionService;
    }

    /**
     * Suggests product names, brand names and styles that start with the query.
     */
    public SuggestionResult suggest(String query) {
        log.info("Suggestion for '{}'", query);
        return new SuggestionResult(
                catalogLookupService.fetchProductNames(query),
                catalogLookupService.fetchBrandNames(query),
                styleSuggestionService.suggestStyles(query));
    }
}
