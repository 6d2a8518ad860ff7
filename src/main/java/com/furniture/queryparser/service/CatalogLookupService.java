package com.furniture.queryparser.service;

import com.furniture.queryparser.model.NamedItem;
import com.furniture.queryparser.repository.BrandRepository;
import com.furniture.queryparser.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Prefix lookups of brand and product names. Database failures degrade to an empty list.
 */
@Service
public class CatalogLookupService {

    private static final Logger log = LoggerFactory.getLogger(CatalogLookupService.class);

    static final String BRAND_TABLE = "brand";
    static final String PRODUCT_TABLE = "product";

    private final BrandRepository brandRepository;
    private final ProductRepository productRepository;
    private final SuggestionCache suggestionCache;

    public CatalogLookupService(BrandRepository brandRepository,
                                ProductRepository productRepository,
                                SuggestionCache suggestionCache) {
        this.brandRepository = brandRepository;
        this.productRepository = productRepository;
        this.suggestionCache = suggestionCache;
    }

    public List<NamedItem> fetchBrandNames(String prefix) {
        return lookup(BRAND_TABLE, prefix, () -> toItems(
                brandRepository.findDistinctTop10ByNameStartingWithIgnoreCase(prefix),
                brand -> new NamedItem(brand.getId(), brand.getName())));
    }

    public List<NamedItem> fetchProductNames(String prefix) {
        return lookup(PRODUCT_TABLE, prefix, () -> toItems(
                productRepository.findDistinctTop10ByNameStartingWithIgnoreCaseAndPublishedTrue(prefix),
                product -> new NamedItem(product.getId(), product.getName())));
    }

    private List<NamedItem> lookup(String table, String prefix, Supplier<List<NamedItem>> loader) {
        if (prefix == null || prefix.isBlank()) {
            return List.of();
        }
        try {
            List<NamedItem> items = suggestionCache.get(table, prefix, loader);
            log.info("Fetched {} items from {} for prefix '{}'", items.size(), table, prefix);
            return items;
        } catch (DataAccessException | TransactionException e) {
            log.error("Database error while looking up {} for prefix '{}': {}", table, prefix, e.getMessage());
            return List.of();
        }
    }

    private static <T> List<NamedItem> toItems(List<T> rows, Function<T, NamedItem> mapper) {
        List<NamedItem> items = new ArrayList<>();
        for (T row : rows) {
            NamedItem item = mapper.apply(row);
            if (item.id() != null) {
                items.add(item);
            }
        }
        return items;
    }
}
