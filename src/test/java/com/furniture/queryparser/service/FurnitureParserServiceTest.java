package com.furniture.queryparser.service;

import com.furniture.queryparser.config.FeatureMatchingSettings;
import com.furniture.queryparser.model.ParserResult;
import com.furniture.queryparser.model.PriceRange;
import com.furniture.queryparser.model.ProductTypeClassification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FurnitureParserServiceTest {

    @Mock
    private ProductTypeClassifier productTypeClassifier;

    @Mock
    private FeatureExtractionService featureExtractionService;

    @Mock
    private StyleClassificationExtractor styleClassificationExtractor;

    @Mock
    private PriceRangeExtractor priceRangeExtractor;

    private FurnitureParserService mockedService() {
        return new FurnitureParserService(productTypeClassifier, featureExtractionService,
                styleClassificationExtractor, priceRangeExtractor);
    }

    @Test
    void featuresRunOnCorrectedQueryAndTheRestOnTheOriginal() {
        String query = "Leather couhc under 900";
        when(productTypeClassifier.classifyProductType(query))
                .thenReturn(new ProductTypeClassification(List.of("Sofa"), List.of(0.8), "leather couch under 900"));
        when(featureExtractionService.extractFeatures("leather couch under 900")).thenReturn(List.of("leather"));
        when(styleClassificationExtractor.extractClassification(query)).thenReturn(Map.of("styles", List.of()));
        when(priceRangeExtractor.extractPriceRange(query))
                .thenReturn(Optional.of(new PriceRange(null, 900.0, "EUR", 0.8)));

        ParserResult result = mockedService().parse(query);

        assertThat(result.productType()).containsExactly("Sofa");
        assertThat(result.features()).containsExactly("leather");
        assertThat(result.priceRange().max()).isEqualTo(900.0);
        assertThat(result.classificationSummary()).containsKey("styles");
        assertThat(result.confidenceScore()).isEqualTo(0.8);
        assertThat(result.location()).isEmpty();
        assertThat(result.extras()).isEmpty();
        assertThat(result.originalQuery()).isEqualTo(query);
        assertThat(result.suggestedQuery()).isEqualTo("leather couch under 900");
    }

    @Test
    void unknownTypeGivesNoTypesAndZeroConfidence() {
        when(productTypeClassifier.classifyProductType("velvet thing"))
                .thenReturn(ProductTypeClassification.unknown("velvet thing"));
        when(featureExtractionService.extractFeatures("velvet thing")).thenReturn(List.of("velvet"));
        when(styleClassificationExtractor.extractClassification("velvet thing")).thenReturn(Map.of());
        when(priceRangeExtractor.extractPriceRange("velvet thing")).thenReturn(Optional.empty());

        ParserResult result = mockedService().parse("velvet thing");

        assertThat(result.productType()).isEmpty();
        assertThat(result.confidenceScore()).isEqualTo(0.0);
        assertThat(result.priceRange()).isNull();
        assertThat(result.suggestedQuery()).isNull();
    }

    @Test
    void failingClassifierFallsBackToOriginalQuery() {
        when(productTypeClassifier.classifyProductType(anyString())).thenThrow(new IllegalStateException("boom"));
        when(featureExtractionService.extractFeatures("oak bench")).thenReturn(List.of());
        when(styleClassificationExtractor.extractClassification("oak bench")).thenReturn(Map.of());
        when(priceRangeExtractor.extractPriceRange("oak bench")).thenReturn(Optional.empty());

        ParserResult result = mockedService().parse("oak bench");

        assertThat(result.productType()).isEmpty();
        assertThat(result.suggestedQuery()).isNull();
        verify(featureExtractionService).extractFeatures("oak bench");
    }

    @Test
    void otherStageFailuresDegradeToDefaults() {
        when(productTypeClassifier.classifyProductType("sofa"))
                .thenReturn(new ProductTypeClassification(List.of("Sofa"), List.of(1.0), "sofa"));
        when(featureExtractionService.extractFeatures("sofa")).thenThrow(new IllegalStateException("features"));
        when(styleClassificationExtractor.extractClassification("sofa")).thenThrow(new IllegalStateException("style"));
        when(priceRangeExtractor.extractPriceRange("sofa")).thenThrow(new IllegalStateException("price"));

        ParserResult result = mockedService().parse("sofa");

        assertThat(result.productType()).containsExactly("Sofa");
        assertThat(result.confidenceScore()).isEqualTo(1.0);
        assertThat(result.features()).isEmpty();
        assertThat(result.classificationSummary()).isEmpty();
        assertThat(result.priceRange()).isNull();
    }

    @Test
    void parsesWithBundledLexicon() {
        FeatureLexicon lexicon = TestLexicons.bundled();
        SimilarityMatcher similarity = new SimilarityMatcher();
        FurnitureParserService service = new FurnitureParserService(
                new DictionaryProductTypeClassifier(lexicon, similarity, 0.8),
                new FeatureExtractionService(
                        new WindowedFeatureMatcher(lexicon, similarity, new ContextualAcceptance(lexicon),
                                FeatureMatchingSettings.defaults()),
                        new ContextualPatternMatcher(lexicon),
                        new FeatureDisambiguator(lexicon)),
                new KeywordStyleClassifier(lexicon),
                new RegexPriceRangeExtractor());

        ParserResult result = service.parse("grey l shape sofa with metal legs under 1000 eur");

        assertThat(result.productType()).containsExactly("Sofa");
        assertThat(result.features()).containsExactly("l shape", "metal legs");
        assertThat(result.priceRange()).isEqualTo(new PriceRange(null, 1000.0, "EUR", 0.8));
        assertThat(result.confidenceScore()).isEqualTo(1.0);
        assertThat(result.suggestedQuery()).isNull();
    }
}
