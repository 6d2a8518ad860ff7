package com.furniture.queryparser.service;

import com.furniture.queryparser.model.PriceRange;

import java.util.Optional;

public interface PriceRangeExtractor {
    Optional<PriceRange> extractPriceRange(String query);
}
