package com.furniture.queryparser.service;

import com.furniture.queryparser.model.NamedItem;
import com.github.benmanes.caffeine.cache.Cache;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Time-limited cache of catalog lookups, keyed by {@code table:prefix}.
 *
 * <p>Loads are atomic per key: concurrent requests for the same prefix wait for one database
 * round trip instead of issuing several.
 */
@Service
public class SuggestionCache {

    private final Cache<String, List<NamedItem>> cache;

    public SuggestionCache(@Qualifier("suggestionLookupCache") Cache<String, List<NamedItem>> cache) {
        this.cache = cache;
    }

    public List<NamedItem> get(String table, String prefix, Supplier<List<NamedItem>> loader) {
        return cache.get(key(table, prefix), ignored -> List.copyOf(loader.get()));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public Map<String, Object> stats() {
        cache.cleanUp();
        TreeSet<String> tables = new TreeSet<>();
        for (String key : cache.asMap().keySet()) {
            tables.add(key.substring(0, key.indexOf(':')));
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("cache_entries", cache.estimatedSize());
        stats.put("cache_tables", List.copyOf(tables));
        return stats;
    }

    private static String key(String table, String prefix) {
        return table + ":" + (prefix == null ? "" : prefix.toLowerCase(Locale.ROOT));
    }
}
