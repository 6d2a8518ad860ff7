package com.furniture.queryparser.repository;

import com.furniture.queryparser.model.Brand;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BrandRepository extends JpaRepository<Brand, String> {
    /**
     * Finds up to ten distinct brands whose name starts with the given prefix, ignoring case.
     */
    List<Brand> findDistinctTop10ByNameStartingWithIgnoreCase(String prefix);
}
