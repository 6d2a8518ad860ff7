package com.furniture.queryparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QueryParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryParserApplication.class, args);
    }
}
