package com.furniture.queryparser.service;

import com.furniture.queryparser.model.ParserResult;
import com.furniture.queryparser.model.PriceRange;
import com.furniture.queryparser.model.ProductTypeClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a free-text query into a {@link ParserResult}.
 *
 * <p>Stages always run in the same order: product type (which also spell-corrects the query),
 * features on the corrected query, style classification and price on the original query.
 * A stage that fails is logged and replaced by its empty default so the other stages still
 * contribute to the result.
 */
@Service
public class FurnitureParserService {

    private static final Logger log = LoggerFactory.getLogger(FurnitureParserService.class);

    private final ProductTypeClassifier productTypeClassifier;
    private final FeatureExtractionService featureExtractionService;
    private final StyleClassificationExtractor styleClassificationExtractor;
    private final PriceRangeExtractor priceRangeExtractor;

    public FurnitureParserService(ProductTypeClassifier productTypeClassifier,
                                  FeatureExtractionService featureExtractionService,
                                  StyleClassificationExtractor styleClassificationExtractor,
                                  PriceRangeExtractor priceRangeExtractor) {
        this.productTypeClassifier = productTypeClassifier;
        this.featureExtractionService = featureExtractionService;
        this.styleClassificationExtractor = styleClassificationExtractor;
        this.priceRangeExtractor = priceRangeExtractor;
    }

    public ParserResult parse(String query) {
        log.info("Parsing query: {}", query);

        ProductTypeClassification classification = classify(query);
        String correctedQuery = classification.correctedQuery() != null ? classification.correctedQuery() : query;

        List<String> features = extractFeatures(correctedQuery);
        Map<String, Object> styleSummary = extractStyle(query);
        PriceRange priceRange = extractPrice(query);

        List<String> productTypes = classification.isUnknown() ? List.of() : List.copyOf(classification.productTypes());
        List<Double> confidences = classification.confidences();
        double confidence = confidences != null && !confidences.isEmpty() && confidences.get(0) != null
                ? confidences.get(0)
                : 0.0;

        return new ParserResult(
                productTypes,
                features,
                priceRange,
                "",
                styleSummary,
                List.of(),
                confidence,
                query,
                Objects.equals(correctedQuery, query) ? null : correctedQuery
        );
    }

    private ProductTypeClassification classify(String query) {
        try {
            ProductTypeClassification result = productTypeClassifier.classifyProductType(query);
            return result != null ? result : ProductTypeClassification.unknown(query);
        } catch (RuntimeException e) {
            log.warn("Product type classification failed for '{}', continuing without it: {}", query, e.getMessage());
            return ProductTypeClassification.unknown(query);
        }
    }

    private List<String> extractFeatures(String text) {
        try {
            return List.copyOf(featureExtractionService.extractFeatures(text));
        } catch (RuntimeException e) {
            log.warn("Feature extraction failed for '{}', continuing without it: {}", text, e.getMessage());
            return List.of();
        }
    }

    private Map<String, Object> extractStyle(String query) {
        try {
            Map<String, Object> summary = styleClassificationExtractor.extractClassification(query);
            return summary != null ? summary : Map.of();
        } catch (RuntimeException e) {
            log.warn("Style classification failed for '{}', continuing without it: {}", query, e.getMessage());
            return Map.of();
        }
    }

    private PriceRange extractPrice(String query) {
        try {
            Optional<PriceRange> price = priceRangeExtractor.extractPriceRange(query);
            return price != null ? price.orElse(null) : null;
        } catch (RuntimeException e) {
            log.warn("Price extraction failed for '{}', continuing without it: {}", query, e.getMessage());
            return null;
        }
    }
}
