package com.furniture.queryparser.repository;

import com.furniture.queryparser.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProductRepository extends JpaRepository<Product, String> {
    /**
     * Finds up to ten distinct published products whose name starts with the given prefix, ignoring case.
     */
    List<Product> findDistinctTop10ByNameStartingWithIgnoreCaseAndPublishedTrue(String prefix);
}
