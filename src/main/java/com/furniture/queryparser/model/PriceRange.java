package com.furniture.queryparser.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Price bounds parsed from a query. Either bound may be open.
 */
@Schema(description = "Price range detected in the query")
public record PriceRange(
        @Schema(description = "Lower bound, null when open", example = "500") Double min,
        @Schema(description = "Upper bound, null when open", example = "1000") Double max,
        @Schema(description = "ISO currency code", example = "EUR") String currency,
        @Schema(description = "Extraction confidence", example = "0.9") double confidence
) {
    public static final String DEFAULT_CURRENCY = "EUR";

    public PriceRange {
        if (currency == null || currency.isBlank()) {
            currency = DEFAULT_CURRENCY;
        }
    }
}
