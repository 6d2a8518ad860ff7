package com.furniture.queryparser.model;

import java.util.List;

/**
 * Output of a product-type classifier. {@code productTypes} holds {@link #UNKNOWN_TYPE} alone
 * when nothing was recognised.
 */
public record ProductTypeClassification(
        List<String> productTypes,
        List<Double> confidences,
        String correctedQuery
) {
    public static final String UNKNOWN_TYPE = "Unknown";

    public static ProductTypeClassification unknown(String query) {
        return new ProductTypeClassification(List.of(UNKNOWN_TYPE), List.of(), query);
    }

    public boolean isUnknown() {
        return productTypes == null
                || productTypes.isEmpty()
                || (productTypes.size() == 1 && UNKNOWN_TYPE.equals(productTypes.get(0)));
    }
}
