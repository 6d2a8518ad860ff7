package com.furniture.queryparser.model;

public enum MatchKind {
    EXACT,
    FUZZY
}
