package com.furniture.queryparser.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
@Entity
@Table(name = "product")
public class Product {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "name")
    private String name;

    // The catalog schema uses a camel-cased, quoted column for the visibility flag
    @Column(name = "\"isPublished\"")
    private Boolean published;

    public Product() {
    }

    public Product(String id, String name, Boolean published) {
        this.id = id;
        this.name = name;
        this.published = published;
    }
}
