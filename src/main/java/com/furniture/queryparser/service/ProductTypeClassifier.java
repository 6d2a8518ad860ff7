package com.furniture.queryparser.service;

import com.furniture.queryparser.model.ProductTypeClassification;

public interface ProductTypeClassifier {
    /**
     * Classifies the product types a query asks for and returns a spell-corrected variant of it.
     * Returns {@link ProductTypeClassification#unknown(String)} when nothing is recognised.
     */
    ProductTypeClassification classifyProductType(String query);
}
